package tools.argsapt.task;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import tools.argsapt.model.SourceLanguage;

/**
 * Options of the args-apt step.
 *
 * @param classDirs  class output directories searched for arg info; empty disables the step
 * @param includeAll keep every record instead of only those of reachable classes
 * @param languages  source languages whose units contribute class names
 * @param transitive follow internal dependencies of a binary, not just its own sources
 */
public record ArgsAptConfig(
        List<Path> classDirs,
        boolean includeAll,
        Set<SourceLanguage> languages,
        boolean transitive
) {

    public ArgsAptConfig {
        classDirs = List.copyOf(Objects.requireNonNull(classDirs, "classDirs"));
        languages = Set.copyOf(Objects.requireNonNull(languages, "languages"));
        if (languages.isEmpty()) {
            throw new IllegalArgumentException("at least one source language is required");
        }
    }

    public static ArgsAptConfig of(List<Path> classDirs) {
        return new ArgsAptConfig(classDirs, false, Set.of(SourceLanguage.JAVA), true);
    }

    public ArgsAptConfig withIncludeAll(boolean includeAll) {
        return new ArgsAptConfig(classDirs, includeAll, languages, transitive);
    }

    public ArgsAptConfig withLanguages(Set<SourceLanguage> languages) {
        return new ArgsAptConfig(classDirs, includeAll, languages, transitive);
    }

    public ArgsAptConfig withTransitive(boolean transitive) {
        return new ArgsAptConfig(classDirs, includeAll, languages, transitive);
    }
}
