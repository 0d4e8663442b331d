package dev.repowarden.planner;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;

/**
 * Hidden HTML markers embedded in bot comments. They let later deliveries find
 * what was already posted by asking the platform, with no local state.
 */
public final class CommentMarkers {

    public static final String WELCOME = marker("welcome");
    public static final String MERGED_THANKS = marker("merged-thanks");

    /** Joins independent sections of one comment, such as a welcome and a scan report. */
    public static final String SECTION_SEPARATOR = "\n\n---\n\n";

    private static final String PREFIX = "<!-- repowarden:";
    private static final String SUFFIX = " -->";

    private CommentMarkers() {}

    public static String marker(String key) {
        return PREFIX + key + SUFFIX;
    }

    public static String replyTo(long commentId) {
        return marker("reply-to:" + commentId);
    }

    /** Content marker: equal bodies always produce the same marker. */
    public static String digestOf(String body) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(body.getBytes(StandardCharsets.UTF_8));
            return marker("digest:" + HexFormat.of().formatHex(hash, 0, 12));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /**
     * One digest marker per section, in section order. A section that was already
     * posted as part of an earlier comment keeps its marker.
     */
    public static List<String> sectionDigests(String body) {
        return Arrays.stream(body.split(SECTION_SEPARATOR, -1))
                .map(CommentMarkers::digestOf)
                .distinct()
                .toList();
    }
}
