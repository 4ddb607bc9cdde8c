package tools.argsapt.scan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the argument metadata the args annotation processor leaves in class output directories:
 * every file directly under {@code <classdir>/com/twitter/common/args/apt} whose name starts with
 * {@code cmdline.arg.info.txt}. Lines are unioned across files and directories.
 */
public final class MetadataScanner {

    private static final Logger log = LoggerFactory.getLogger(MetadataScanner.class);

    public static final String ARG_INFO_DIR = "com/twitter/common/args/apt";
    public static final String ARG_INFO_PREFIX = "cmdline.arg.info.txt";

    private final String relativeDir;
    private final String basenamePrefix;

    public MetadataScanner() {
        this(ARG_INFO_DIR, ARG_INFO_PREFIX);
    }

    public MetadataScanner(String relativeDir, String basenamePrefix) {
        this.relativeDir = Objects.requireNonNull(relativeDir, "relativeDir");
        this.basenamePrefix = Objects.requireNonNull(basenamePrefix, "basenamePrefix");
    }

    /**
     * Returns the distinct lines of all metadata files below {@code baseDirs}.
     * An empty result means nothing was generated and nothing should be merged.
     */
    public Set<String> scan(List<Path> baseDirs) throws IOException {
        Objects.requireNonNull(baseDirs, "baseDirs");

        final Set<String> lines = new HashSet<>();
        for (Path baseDir : baseDirs) {
            final Path dir = baseDir.resolve(relativeDir);
            if (!Files.isDirectory(dir)) {
                // no processor output for this root
                log.debug("No arg info under {}", dir);
                continue;
            }

            try (var entries = Files.list(dir)) {
                final var files = entries
                        .filter(Files::isRegularFile)
                        .filter(path -> {
                            final var name = path.getFileName() != null ? path.getFileName().toString() : "";
                            return name.startsWith(basenamePrefix);
                        })
                        .sorted()
                        .toList();

                for (var file : files) {
                    final List<String> fileLines = Files.readAllLines(file, StandardCharsets.UTF_8);
                    lines.addAll(fileLines);
                    log.debug("Read {} arg info lines from {}", fileLines.size(), file);
                }
            }
        }
        return lines;
    }
}
