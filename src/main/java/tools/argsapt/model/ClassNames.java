package tools.argsapt.model;

import java.util.Objects;

public final class ClassNames {

    private ClassNames() {
    }

    /**
     * Maps a source path relative to its source root onto the class it declares,
     * e.g. {@code com/foo/Main.java} to {@code com.foo.Main}.
     */
    public static String fromSourcePath(String sourcePath, SourceLanguage language) {
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(language, "language");

        String raw = sourcePath.trim().replace('\\', '/');
        while (raw.startsWith("./")) {
            raw = raw.substring(2);
        }
        while (raw.startsWith("/")) {
            raw = raw.substring(1);
        }
        if (raw.endsWith(language.extension())) {
            raw = raw.substring(0, raw.length() - language.extension().length());
        }
        return raw.replace('/', '.');
    }
}
