package me.golemcore.apollo.domain.system.turn;

import me.golemcore.apollo.domain.model.TurnContext;

/**
 * Runs one user message through to one persisted assistant response.
 */
public interface ConversationTurnSystem {

    /**
     * Processes the turn synchronously, reporting progress through the emitter.
     * Never throws: failures end in an {@code error} event and a failed outcome.
     */
    TurnOutcome processTurn(TurnContext context, String userMessage, TurnEventEmitter emitter);
}
