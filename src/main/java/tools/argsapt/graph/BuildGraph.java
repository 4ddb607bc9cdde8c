package tools.argsapt.graph;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

import tools.argsapt.model.BuildUnit;

/**
 * Immutable set of build units keyed by id, plus the transitive walk over their dependencies.
 * Every dependency id must name a unit of the same graph.
 */
public final class BuildGraph {

    private final Map<String, BuildUnit> unitsById;

    private BuildGraph(Map<String, BuildUnit> unitsById) {
        this.unitsById = unitsById;
    }

    public static BuildGraph of(Collection<? extends BuildUnit> units) {
        Objects.requireNonNull(units, "units");

        // LinkedHashMap keeps declaration order for units()
        final Map<String, BuildUnit> byId = new LinkedHashMap<>();
        for (BuildUnit unit : units) {
            if (byId.put(unit.id(), unit) != null) {
                throw new IllegalArgumentException("duplicate unit id: " + unit.id());
            }
        }
        for (BuildUnit unit : byId.values()) {
            for (String dep : unit.dependencyIds()) {
                if (!byId.containsKey(dep)) {
                    throw new IllegalArgumentException("unit " + unit.id() + " depends on unknown unit " + dep);
                }
            }
        }
        return new BuildGraph(Collections.unmodifiableMap(byId));
    }

    public Collection<BuildUnit> units() {
        return unitsById.values();
    }

    public Optional<BuildUnit> find(String id) {
        return Optional.ofNullable(unitsById.get(id));
    }

    public BuildUnit require(String id) {
        final BuildUnit unit = unitsById.get(id);
        if (unit == null) {
            throw new IllegalArgumentException("unknown unit: " + id);
        }
        return unit;
    }

    /**
     * Visits {@code root} and its transitive dependencies in pre-order, each unit at most once.
     * Units rejected by {@code predicate} are neither visited nor descended into.
     */
    public void walk(BuildUnit root, Predicate<? super BuildUnit> predicate, Consumer<? super BuildUnit> visitor) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(visitor, "visitor");

        final Set<String> seen = new HashSet<>();
        final Deque<BuildUnit> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            final BuildUnit unit = stack.pop();
            if (!seen.add(unit.id()) || !predicate.test(unit)) {
                continue;
            }
            visitor.accept(unit);

            final List<String> deps = unit.dependencyIds();
            for (int i = deps.size() - 1; i >= 0; i--) {
                final BuildUnit dep = unitsById.get(deps.get(i));
                if (dep != null && !seen.contains(dep.id())) {
                    stack.push(dep);
                }
            }
        }
    }
}
