package dev.repowarden.domain.enums;

/**
 * Dispatchable actions, declared in dispatch order.
 * The comment goes last so it can reflect what the other actions did.
 */
public enum ActionType {
    REMOVE_LABEL, ADD_LABEL, REQUEST_REVIEWER, ADD_ASSIGNEE, SET_STATUS, SET_ISSUE_STATE, POST_COMMENT
}
