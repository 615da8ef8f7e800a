package me.golemcore.apollo.domain.model;

/**
 * Classification of tool execution failures.
 */
public enum ToolFailureKind {
    /**
     * Arguments failed type, presence or value checks before dispatch.
     */
    VALIDATION_ERROR,

    /**
     * The referenced entity does not exist or belongs to another user. The two
     * cases are deliberately indistinguishable.
     */
    NOT_FOUND,

    /**
     * The tool failed while running, e.g. because the store was unavailable.
     */
    EXECUTION_ERROR,

    /**
     * The model asked for a tool that is not registered.
     */
    UNKNOWN_TOOL
}
