package tools.argsapt.task;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import tools.argsapt.filter.MalformedRecordException;
import tools.argsapt.filter.RecordFilter;
import tools.argsapt.graph.BuildGraph;
import tools.argsapt.graph.JarProducts;
import tools.argsapt.graph.ReachabilityCollector;
import tools.argsapt.io.ArchiveMerger;
import tools.argsapt.model.BuildUnit;
import tools.argsapt.scan.MetadataScanner;

/**
 * Injects the arg info of each binary's reachable classes into the archives built for it.
 * <p>
 * Metadata is scanned once per run. For every binary with jar products, the filtered records are
 * computed once and written into each of its archives.
 */
public final class ArgsAptTask {

    private static final Logger log = LoggerFactory.getLogger(ArgsAptTask.class);

    private final ArgsAptConfig config;
    private final JarProducts jars;
    private final ReachabilityCollector collector;
    private final MetadataScanner scanner;
    private final ArchiveMerger merger;

    public ArgsAptTask(ArgsAptConfig config, BuildGraph graph, JarProducts jars) {
        this(config,
                jars,
                new ReachabilityCollector(graph, config.languages(), config.transitive()),
                new MetadataScanner(),
                new ArchiveMerger());
    }

    public ArgsAptTask(ArgsAptConfig config,
                       JarProducts jars,
                       ReachabilityCollector collector,
                       MetadataScanner scanner,
                       ArchiveMerger merger) {
        this.config = Objects.requireNonNull(config, "config");
        this.jars = Objects.requireNonNull(jars, "jars");
        this.collector = Objects.requireNonNull(collector, "collector");
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.merger = Objects.requireNonNull(merger, "merger");
    }

    public List<Injection> execute(Collection<? extends BuildUnit> targets) throws TaskException {
        Objects.requireNonNull(targets, "targets");

        if (config.classDirs().isEmpty()) {
            log.info("No class directories configured, skipping args-apt");
            return List.of();
        }

        final Set<String> lines;
        try {
            lines = scanner.scan(config.classDirs());
        } catch (IOException ex) {
            throw new TaskException("Failed to read arg info from " + config.classDirs(), ex);
        }
        if (lines.isEmpty()) {
            log.info("No arg info found under {}", config.classDirs());
            return List.of();
        }

        final List<Injection> out = new ArrayList<>();
        for (BuildUnit unit : targets) {
            if (!unit.isBinary()) {
                continue;
            }
            final List<Path> archives = jars.archivesOf(unit.id());
            if (archives.isEmpty()) {
                log.debug("No jars produced for {}", unit.id());
                continue;
            }

            final List<String> kept = recordsFor(unit, lines);
            for (Path archive : archives) {
                try {
                    merger.merge(archive, kept);
                } catch (IOException ex) {
                    throw new TaskException("Failed to add arg info to " + archive + " for " + unit.id(), ex);
                }
                out.add(new Injection(unit.id(), archive, kept.size()));
            }
        }
        return out;
    }

    private List<String> recordsFor(BuildUnit binary, Set<String> lines) throws TaskException {
        if (config.includeAll()) {
            return RecordFilter.filter(lines, Set.of(), true);
        }
        final Set<String> classNames = collector.collect(binary);
        try {
            return RecordFilter.filter(lines, classNames, false);
        } catch (MalformedRecordException ex) {
            throw new TaskException("Malformed arg info while processing " + binary.id(), ex);
        }
    }

    /**
     * One archive that received arg info.
     */
    public record Injection(String unitId, Path archive, int records) {
    }
}
