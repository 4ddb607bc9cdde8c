package tools.argsapt.graph;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Archives produced for each unit by the upstream jar step:
 * unitId -> { baseDir -> [archive names relative to baseDir] }.
 */
public record JarProducts(Map<String, Map<Path, List<String>>> byUnitId) {

    public JarProducts {
        Objects.requireNonNull(byUnitId, "byUnitId");
        final Map<String, Map<Path, List<String>>> copy = new LinkedHashMap<>();
        for (var e : byUnitId.entrySet()) {
            final Map<Path, List<String>> bases = new LinkedHashMap<>();
            for (var b : e.getValue().entrySet()) {
                bases.put(b.getKey(), List.copyOf(b.getValue()));
            }
            copy.put(e.getKey(), Collections.unmodifiableMap(bases));
        }
        byUnitId = Collections.unmodifiableMap(copy);
    }

    public static JarProducts empty() {
        return new JarProducts(Map.of());
    }

    public boolean has(String unitId) {
        final var bases = byUnitId.get(unitId);
        return bases != null && !bases.isEmpty();
    }

    public Map<Path, List<String>> get(String unitId) {
        return byUnitId.getOrDefault(unitId, Map.of());
    }

    /**
     * Resolved archive paths for {@code unitId}, in mapping order.
     */
    public List<Path> archivesOf(String unitId) {
        final List<Path> out = new ArrayList<>();
        for (var e : get(unitId).entrySet()) {
            for (String name : e.getValue()) {
                out.add(e.getKey().resolve(name));
            }
        }
        return out;
    }
}
