package me.golemcore.apollo.domain.model;

/**
 * Reasons a turn ends in {@link TurnState#FAILED}, each with the message shown
 * to the user.
 */
public enum TurnFailureKind {
    MODEL_ERROR("The assistant is temporarily unavailable. Please try again."),
    TIMEOUT("The request took too long to complete. Please try again."),
    STORE_ERROR("Your message could not be processed right now. Please try again.");

    private final String userMessage;

    TurnFailureKind(String userMessage) {
        this.userMessage = userMessage;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
