package me.golemcore.apollo.domain.model;

/**
 * States of a single conversation turn. {@link #FAILED} is reachable from any
 * non-terminal state.
 */
public enum TurnState {
    RECEIVED, CONTEXT_BUILT, MODEL_CALLED, TOOLS_REQUESTED, TOOLS_EXECUTED, MODEL_RESUMED, FINALIZED, PERSISTED, FAILED;

    public boolean isTerminal() {
        return this == PERSISTED || this == FAILED;
    }
}
