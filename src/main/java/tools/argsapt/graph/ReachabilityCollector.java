package tools.argsapt.graph;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import tools.argsapt.model.BuildUnit;
import tools.argsapt.model.ClassNames;
import tools.argsapt.model.SourceLanguage;

/**
 * Collects the fully-qualified names of the classes a binary is built from.
 * Only units accepted by the internal predicate are walked, so third-party
 * dependencies and everything behind them contribute nothing.
 */
public final class ReachabilityCollector {

    private static final Logger log = LoggerFactory.getLogger(ReachabilityCollector.class);

    private final BuildGraph graph;
    private final Set<SourceLanguage> languages;
    private final boolean transitive;
    private final Predicate<BuildUnit> internal;

    public ReachabilityCollector(BuildGraph graph, Set<SourceLanguage> languages, boolean transitive) {
        this(graph, languages, transitive, BuildUnit::isInternal);
    }

    public ReachabilityCollector(BuildGraph graph,
                                 Set<SourceLanguage> languages,
                                 boolean transitive,
                                 Predicate<BuildUnit> internal) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.languages = Set.copyOf(Objects.requireNonNull(languages, "languages"));
        this.transitive = transitive;
        this.internal = Objects.requireNonNull(internal, "internal");
    }

    public Set<String> collect(BuildUnit binary) {
        Objects.requireNonNull(binary, "binary");

        final Set<String> classNames = new HashSet<>();
        if (transitive) {
            graph.walk(binary, internal, unit -> addClassNames(unit, classNames));
        } else if (internal.test(binary)) {
            addClassNames(binary, classNames);
        }
        log.debug("{} reaches {} classes", binary.id(), classNames.size());
        return Set.copyOf(classNames);
    }

    private void addClassNames(BuildUnit unit, Set<String> out) {
        for (SourceLanguage language : languages) {
            if (!unit.isSourceLanguage(language)) {
                continue;
            }
            for (String source : unit.sources()) {
                if (language.owns(source)) {
                    out.add(ClassNames.fromSourcePath(source, language));
                }
            }
        }
    }
}
