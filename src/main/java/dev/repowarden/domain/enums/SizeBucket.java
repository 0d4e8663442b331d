package dev.repowarden.domain.enums;

/**
 * Change-size buckets over the total of added and removed lines.
 *
 * SMALL &lt; 50 | MEDIUM 50-299 | LARGE 300-1000 | XLARGE &gt; 1000
 */
public enum SizeBucket {
    SMALL("small"), MEDIUM("medium"), LARGE("large"), XLARGE("xlarge");

    private final String tag;

    SizeBucket(String tag) { this.tag = tag; }

    public String tag() { return tag; }

    public static SizeBucket of(int changedLines) {
        if (changedLines < 50) return SMALL;
        if (changedLines < 300) return MEDIUM;
        if (changedLines <= 1000) return LARGE;
        return XLARGE;
    }
}
