package dev.repowarden.domain.enums;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported languages, detected from file extension or, for extensionless
 * scripts, from a shebang interpreter.
 */
public enum Language {
    PYTHON("python", List.of(".py", ".pyx", ".pyi"), List.of("python")),
    JAVASCRIPT("javascript", List.of(".js", ".jsx", ".mjs", ".cjs"), List.of("node")),
    TYPESCRIPT("typescript", List.of(".ts", ".tsx"), List.of("ts-node", "deno")),
    JAVA("java", List.of(".java"), List.of()),
    GO("go", List.of(".go"), List.of()),
    RUST("rust", List.of(".rs"), List.of()),
    RUBY("ruby", List.of(".rb"), List.of("ruby")),
    PHP("php", List.of(".php"), List.of("php")),
    SWIFT("swift", List.of(".swift"), List.of("swift")),
    CPP("c++", List.of(".cpp", ".cc", ".cxx", ".hpp", ".hh", ".c", ".h"), List.of());

    private final String tag;
    private final List<String> extensions;
    private final List<String> interpreters;

    Language(String tag, List<String> extensions, List<String> interpreters) {
        this.tag = tag;
        this.extensions = extensions;
        this.interpreters = interpreters;
    }

    public String tag() { return tag; }

    public static Optional<Language> fromTag(String tag) {
        for (Language language : values()) {
            if (language.tag.equalsIgnoreCase(tag)) return Optional.of(language);
        }
        return Optional.empty();
    }

    public static Optional<Language> detect(String path, String firstLine) {
        Optional<Language> byExtension = fromPath(path);
        return byExtension.isPresent() ? byExtension : fromShebang(firstLine);
    }

    public static Optional<Language> fromPath(String path) {
        if (path == null) return Optional.empty();
        String lower = path.toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.extensions.stream().anyMatch(lower::endsWith)) return Optional.of(language);
        }
        return Optional.empty();
    }

    /**
     * Resolves "#!/usr/bin/env python3" or "#!/usr/bin/ruby" style lines.
     */
    public static Optional<Language> fromShebang(String line) {
        if (line == null || !line.startsWith("#!")) return Optional.empty();
        String[] parts = line.substring(2).trim().split("\\s+");
        String program = parts[0].substring(parts[0].lastIndexOf('/') + 1);
        if ("env".equals(program)) {
            program = "";
            for (int i = 1; i < parts.length; i++) {
                if (!parts[i].startsWith("-") && !parts[i].contains("=")) {
                    program = parts[i];
                    break;
                }
            }
        }
        String interpreter = program.toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.interpreters.stream().anyMatch(interpreter::startsWith)) return Optional.of(language);
        }
        return Optional.empty();
    }
}
