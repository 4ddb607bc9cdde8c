package tools.argsapt.graph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import tools.argsapt.model.SourceLanguage;

/**
 * Reads a build graph and its jar products from a JSON file:
 * <pre>
 * {
 *   "units": [{"id": "...", "binary": true, "internal": true, "languages": ["java"],
 *              "sources": ["com/foo/Main.java"], "dependencies": ["..."]}],
 *   "jars": {"unitId": {"/out/dist": ["main.jar"]}}
 * }
 * </pre>
 * Relative base directories resolve against {@code workDir}.
 */
public final class BuildGraphLoader {

    private final Path workDir;
    private final ObjectMapper jsonMapper;

    public BuildGraphLoader(Path workDir) {
        this.workDir = Objects.requireNonNull(workDir, "workDir").toAbsolutePath().normalize();
        this.jsonMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Loaded load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new IOException("Graph file not found: " + file);
        }

        final GraphFile raw = jsonMapper.readValue(file.toFile(), GraphFile.class);
        if (raw == null) {
            throw new IOException("Empty graph file: " + file);
        }
        try {
            final BuildGraph graph = BuildGraph.of(toUnits(raw.units()));
            return new Loaded(graph, toJarProducts(raw.jars(), graph));
        } catch (IllegalArgumentException ex) {
            throw new IOException("Invalid graph file " + file + ": " + ex.getMessage(), ex);
        }
    }

    private static List<DeclaredUnit> toUnits(List<UnitEntry> entries) {
        if (entries == null) {
            return List.of();
        }
        final List<DeclaredUnit> out = new ArrayList<>(entries.size());
        for (UnitEntry e : entries) {
            if (e.id() == null || e.id().isBlank()) {
                throw new IllegalArgumentException("unit without id");
            }
            final Set<SourceLanguage> languages = new LinkedHashSet<>();
            if (e.languages() != null) {
                for (String name : e.languages()) {
                    languages.add(SourceLanguage.parse(name));
                }
            }
            out.add(new DeclaredUnit(
                    e.id(),
                    Boolean.TRUE.equals(e.binary()),
                    !Boolean.FALSE.equals(e.internal()), // first-party unless stated otherwise
                    languages,
                    e.sources(),
                    e.dependencies()));
        }
        return out;
    }

    private JarProducts toJarProducts(Map<String, Map<String, List<String>>> jars, BuildGraph graph) {
        if (jars == null) {
            return JarProducts.empty();
        }
        final Map<String, Map<Path, List<String>>> out = new LinkedHashMap<>();
        for (var e : jars.entrySet()) {
            if (graph.find(e.getKey()).isEmpty()) {
                throw new IllegalArgumentException("jars mapped for unknown unit " + e.getKey());
            }
            final Map<Path, List<String>> bases = new LinkedHashMap<>();
            for (var b : e.getValue().entrySet()) {
                final Path base = workDir.resolve(b.getKey()).normalize();
                bases.put(base, b.getValue() == null ? List.of() : b.getValue());
            }
            out.put(e.getKey(), bases);
        }
        return new JarProducts(out);
    }

    public record Loaded(BuildGraph graph, JarProducts jars) {
    }

    // --- file records (read as JSON) ---

    public record GraphFile(
            List<UnitEntry> units,
            Map<String, Map<String, List<String>>> jars
    ) {
    }

    public record UnitEntry(
            String id,
            Boolean binary,
            Boolean internal,
            List<String> languages,
            List<String> sources,
            List<String> dependencies
    ) {
    }
}
