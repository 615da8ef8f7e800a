package me.golemcore.apollo.domain.system.turn;

import me.golemcore.apollo.domain.model.Message;
import me.golemcore.apollo.domain.model.TurnContext;

/**
 * Trusted execution boundary for model-proposed tool calls. Implementations
 * always return an outcome and never throw.
 */
public interface ToolExecutorPort {

    ToolExecutionOutcome execute(TurnContext context, Message.ToolCall toolCall);
}
