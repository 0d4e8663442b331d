package dev.repowarden.domain.enums;

public enum IssueState {
    OPEN, CLOSED;

    public String apiValue() {
        return name().toLowerCase();
    }
}
