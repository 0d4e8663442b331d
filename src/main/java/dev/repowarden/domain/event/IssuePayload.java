package dev.repowarden.domain.event;

public record IssuePayload(int number, String title, String body) implements EventPayload {

    /** Title and body joined for keyword scanning. */
    public String text() {
        String t = title != null ? title : "";
        String b = body != null ? body : "";
        return b.isEmpty() ? t : t + "\n" + b;
    }
}
