package tools.argsapt;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import tools.argsapt.graph.BuildGraphLoader;
import tools.argsapt.model.BuildUnit;
import tools.argsapt.model.SourceLanguage;
import tools.argsapt.task.ArgsAptConfig;
import tools.argsapt.task.ArgsAptTask;
import tools.argsapt.task.TaskException;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Path graphFile = null;
        Path classdirFile = null;
        boolean includeAll = false;
        boolean transitive = true;
        final Set<String> classdirs = new LinkedHashSet<>();
        final Set<String> targetIds = new LinkedHashSet<>();
        final Set<SourceLanguage> languages = EnumSet.noneOf(SourceLanguage.class);

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if (arg.startsWith("--graph=")) {
                    graphFile = Paths.get(arg.substring("--graph=".length()));
                    continue;
                }
                if (arg.startsWith("--classdirs=")) {
                    splitList(arg.substring("--classdirs=".length()), classdirs);
                    continue;
                }
                if (arg.startsWith("--classdirFile=")) {
                    classdirFile = Paths.get(arg.substring("--classdirFile=".length()));
                    continue;
                }
                if (arg.startsWith("--targets=")) {
                    splitList(arg.substring("--targets=".length()), targetIds);
                    continue;
                }
                if (arg.startsWith("--includeAll=")) {
                    includeAll = Boolean.parseBoolean(arg.substring("--includeAll=".length()));
                    continue;
                }
                if (arg.startsWith("--transitive=")) {
                    transitive = Boolean.parseBoolean(arg.substring("--transitive=".length()));
                    continue;
                }
                if (arg.startsWith("--languages=")) {
                    final Set<String> names = new LinkedHashSet<>();
                    splitList(arg.substring("--languages=".length()), names);
                    for (String name : names) {
                        languages.add(SourceLanguage.parse(name));
                    }
                    continue;
                }
                System.err.println("ERROR: unknown argument: " + arg);
                printUsage();
                return 2;
            }

            if (graphFile == null) {
                System.err.println("ERROR: --graph is required");
                printUsage();
                return 2;
            }
            if (languages.isEmpty()) {
                languages.add(SourceLanguage.JAVA);
            }

            final Path workDir = Paths.get("").toAbsolutePath().normalize();
            if (classdirFile != null) {
                loadClassdirsFromFile(workDir.resolve(classdirFile).normalize(), classdirs);
            }
            final List<Path> classDirPaths = new ArrayList<>(classdirs.size());
            for (String dir : classdirs) {
                classDirPaths.add(workDir.resolve(dir).normalize());
            }

            final var loaded = new BuildGraphLoader(workDir).load(workDir.resolve(graphFile).normalize());
            final List<BuildUnit> targets = new ArrayList<>();
            if (targetIds.isEmpty()) {
                targets.addAll(loaded.graph().units());
            } else {
                for (String id : targetIds) {
                    targets.add(loaded.graph().require(id));
                }
            }

            final ArgsAptConfig config = new ArgsAptConfig(classDirPaths, includeAll, languages, transitive);
            final ArgsAptTask task = new ArgsAptTask(config, loaded.graph(), loaded.jars());
            final var injections = task.execute(targets);

            for (var injection : injections) {
                System.out.println("args-apt: " + injection.unitId() + " -> " + injection.archive()
                        + " (" + injection.records() + " records)");
            }
            System.out.println("Archives updated: " + injections.size());
            return 0;
        } catch (IllegalArgumentException ex) {
            System.err.println("ERROR: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (java.io.IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (TaskException ex) {
            final Throwable cause = ex.getCause();
            System.err.println("ERROR: " + safeMsg(ex.getMessage())
                    + (cause != null ? ": " + safeMsg(cause.getMessage()) : ""));
            return 1;
        } catch (Exception ex) {
            System.err.println("ERROR: failed to add arg info: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static void splitList(String list, Set<String> out) {
        final String trimmed = list.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        Arrays.stream(trimmed.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(out::add);
    }

    private static void loadClassdirsFromFile(Path file, Set<String> classdirs) throws java.io.IOException {
        if (!Files.isRegularFile(file)) {
            throw new java.io.IOException("Classdir file not found: " + file);
        }
        try (var br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = br.readLine()) != null) {
                String trimmed = line.trim();
                final int hash = trimmed.indexOf('#');
                if (hash >= 0) {
                    trimmed = trimmed.substring(0, hash).trim();
                }
                if (trimmed.isEmpty()) {
                    continue;
                }
                for (String token : trimmed.split("[,\\s]+")) {
                    if (!token.isEmpty()) {
                        classdirs.add(token);
                    }
                }
            }
        }
    }

    private static void printUsage() {
        System.out.println("Usage: argsapt --graph=<file> [options]");
        System.out.println("Options:");
        System.out.println("  --graph=<path>          Build graph and jar products (JSON), required");
        System.out.println("  --targets=<id1,id2>     Unit ids to process (default: all units)");
        System.out.println("  --classdirs=<d1,d2>     Class output directories holding arg info");
        System.out.println("  --classdirFile=<path>   File listing class output directories");
        System.out.println("  --includeAll=<bool>     Keep arg info of unreachable classes too (default: false)");
        System.out.println("  --languages=<l1,l2>     Source languages to track: java, scala (default: java)");
        System.out.println("  --transitive=<bool>     Follow internal dependencies (default: true)");
        System.out.println("  --help, -h              Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
