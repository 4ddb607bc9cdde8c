package tools.argsapt.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tools.argsapt.model.BuildUnit;
import tools.argsapt.model.SourceLanguage;

import static org.junit.jupiter.api.Assertions.*;

class BuildGraphTest {

    static DeclaredUnit unit(String id, boolean internal, List<String> sources, String... deps) {
        return new DeclaredUnit(id, false, internal, Set.of(), sources, List.of(deps));
    }

    @Test
    @DisplayName("walks dependencies in pre-order, visiting shared units once")
    void walksPreOrderOnce() {
        final var graph = BuildGraph.of(List.of(
                unit("bin", true, List.of(), "a", "b"),
                unit("a", true, List.of(), "c"),
                unit("b", true, List.of(), "c"),
                unit("c", true, List.of())));

        final List<String> visited = new ArrayList<>();
        graph.walk(graph.require("bin"), u -> true, u -> visited.add(u.id()));

        assertEquals(List.of("bin", "a", "c", "b"), visited);
    }

    @Test
    @DisplayName("does not descend into units rejected by the predicate")
    void stopsAtRejectedUnits() {
        final var graph = BuildGraph.of(List.of(
                unit("bin", true, List.of(), "lib", "3rdparty"),
                unit("lib", true, List.of()),
                unit("3rdparty", false, List.of(), "hidden"),
                unit("hidden", true, List.of())));

        final List<String> visited = new ArrayList<>();
        graph.walk(graph.require("bin"), BuildUnit::isInternal, u -> visited.add(u.id()));

        assertEquals(List.of("bin", "lib"), visited);
    }

    @Test
    @DisplayName("terminates on dependency cycles")
    void handlesCycles() {
        final var graph = BuildGraph.of(List.of(
                unit("a", true, List.of(), "b"),
                unit("b", true, List.of(), "a")));

        final List<String> visited = new ArrayList<>();
        graph.walk(graph.require("a"), u -> true, u -> visited.add(u.id()));

        assertEquals(List.of("a", "b"), visited);
    }

    @Test
    @DisplayName("rejects dangling dependencies and duplicate ids")
    void validatesUnits() {
        assertThrows(IllegalArgumentException.class,
                () -> BuildGraph.of(List.of(unit("a", true, List.of(), "missing"))));
        assertThrows(IllegalArgumentException.class,
                () -> BuildGraph.of(List.of(unit("a", true, List.of()), unit("a", true, List.of()))));
    }

    @Test
    @DisplayName("a unit is a java unit if it declares java or owns a .java source")
    void sourceLanguageDetection() {
        final var declared = new DeclaredUnit("d", false, true, Set.of(SourceLanguage.JAVA), List.of(), List.of());
        final var bySource = unit("s", true, List.of("com/foo/A.java"));
        final var scalaOnly = unit("x", true, List.of("com/foo/B.scala"));

        assertTrue(declared.isSourceLanguage(SourceLanguage.JAVA));
        assertTrue(bySource.isSourceLanguage(SourceLanguage.JAVA));
        assertFalse(scalaOnly.isSourceLanguage(SourceLanguage.JAVA));
        assertTrue(scalaOnly.isSourceLanguage(SourceLanguage.SCALA));
    }
}
