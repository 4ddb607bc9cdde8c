package tools.argsapt.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.ProviderNotFoundException;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.zip.ZipException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes merged arg info into an existing archive as a single entry.
 * All other entries of the archive are carried over unchanged; an entry already at
 * {@link #ENTRY_NAME} is replaced.
 */
public final class ArchiveMerger {

    private static final Logger log = LoggerFactory.getLogger(ArchiveMerger.class);

    public static final String ENTRY_NAME = "com/twitter/common/args/apt/cmdline.arg.info.txt.0";
    public static final String HEADER = "# Created by pants goal binary:args-apt";

    private final String entryName;
    private final String header;

    public ArchiveMerger() {
        this(ENTRY_NAME, HEADER);
    }

    public ArchiveMerger(String entryName, String header) {
        this.entryName = Objects.requireNonNull(entryName, "entryName");
        this.header = Objects.requireNonNull(header, "header");
    }

    public void merge(Path archive, Collection<String> lines) throws IOException {
        Objects.requireNonNull(archive, "archive");
        Objects.requireNonNull(lines, "lines");

        if (!Files.isRegularFile(archive)) {
            throw new NoSuchFileException(archive.toString(), null, "archive to merge into does not exist");
        }

        final byte[] content = render(lines).getBytes(StandardCharsets.UTF_8);

        // the zip file system rewrites the archive on close; closing is what commits the entry
        try (FileSystem zip = openArchive(archive)) {
            final Path entry = zip.getPath(entryName);
            if (entry.getParent() != null) {
                Files.createDirectories(entry.getParent());
            }
            if (Files.exists(entry)) {
                log.warn("Replacing existing {} in {}", entryName, archive);
            }
            Files.write(entry, content,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        }
        log.info("Wrote {} arg info records to {}", lines.size(), archive);
    }

    private static FileSystem openArchive(Path archive) throws IOException {
        try {
            return FileSystems.newFileSystem(archive, Map.of());
        } catch (ProviderNotFoundException ex) {
            // no provider claims files that are neither zips nor named like one
            final ZipException zex = new ZipException(archive + " is not a zip archive");
            zex.initCause(ex);
            throw zex;
        }
    }

    /**
     * Header line followed by {@code lines} in ascending order, every line newline-terminated.
     * Equal inputs in any order render to identical text.
     */
    public String render(Collection<String> lines) {
        final List<String> sorted = new ArrayList<>(lines);
        Collections.sort(sorted);

        final StringBuilder sb = new StringBuilder(header).append('\n');
        for (String line : sorted) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }
}
