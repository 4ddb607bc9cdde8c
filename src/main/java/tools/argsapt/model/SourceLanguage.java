package tools.argsapt.model;

import java.util.Locale;

/**
 * Source languages whose units contribute class names to a binary.
 */
public enum SourceLanguage {
    JAVA(".java"),
    SCALA(".scala");

    private final String extension;

    SourceLanguage(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public boolean owns(String sourcePath) {
        return sourcePath != null && sourcePath.endsWith(extension);
    }

    public static SourceLanguage parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("empty language name");
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
