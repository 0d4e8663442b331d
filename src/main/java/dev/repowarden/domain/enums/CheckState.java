package dev.repowarden.domain.enums;

/**
 * Commit status states, mapped to the lowercase values the statuses API expects.
 */
public enum CheckState {
    PENDING, SUCCESS, FAILURE, ERROR;

    public String apiValue() {
        return name().toLowerCase();
    }

    public static CheckState fromApiValue(String value) {
        return value == null ? null : CheckState.valueOf(value.toUpperCase());
    }
}
