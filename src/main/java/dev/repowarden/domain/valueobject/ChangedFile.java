package dev.repowarden.domain.valueobject;

import dev.repowarden.domain.enums.Language;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Immutable view of one file in a pull request diff.
 *
 * @param path       repository-relative path
 * @param additions  added line count as reported by the platform
 * @param deletions  removed line count as reported by the platform
 * @param language   detected language tag, or {@code null} when unsupported
 * @param addedLines added lines with their line number in the new file
 */
public record ChangedFile(
        String path,
        int additions,
        int deletions,
        String language,
        List<AddedLine> addedLines
) {
    private static final Pattern HUNK_HEADER = Pattern.compile("^@@ -\\d+(?:,\\d+)? \\+(\\d+)(?:,\\d+)? @@.*");

    public ChangedFile {
        if (path == null || path.isBlank()) throw new IllegalArgumentException("path required");
        addedLines = addedLines == null ? List.of() : List.copyOf(addedLines);
    }

    /**
     * Builds a file from a unified diff hunk set, keeping only the added lines.
     */
    public static ChangedFile fromPatch(String path, int additions, int deletions, String patch) {
        List<AddedLine> added = parseAddedLines(patch);
        String firstLine = added.isEmpty() ? null : added.get(0).text();
        String language = Language.detect(path, firstLine).map(Language::tag).orElse(null);
        return new ChangedFile(path, additions, deletions, language, added);
    }

    static List<AddedLine> parseAddedLines(String patch) {
        if (patch == null || patch.isEmpty()) return List.of();
        List<AddedLine> added = new ArrayList<>();
        int newLine = 0;
        for (String line : patch.split("\n", -1)) {
            Matcher hunk = HUNK_HEADER.matcher(line);
            if (hunk.matches()) {
                newLine = Integer.parseInt(hunk.group(1));
            } else if (line.startsWith("+")) {
                added.add(new AddedLine(newLine, line.substring(1)));
                newLine++;
            } else if (!line.startsWith("-") && !line.startsWith("\\")) {
                // context line
                newLine++;
            }
        }
        return added;
    }

    public int changedLines() {
        return additions + deletions;
    }

    public String addedContent() {
        return addedLines.stream().map(AddedLine::text).collect(Collectors.joining("\n"));
    }

    public record AddedLine(int lineNumber, String text) {}
}
