package tools.argsapt.graph;

import java.util.List;
import java.util.Objects;
import java.util.Set;

import tools.argsapt.model.BuildUnit;
import tools.argsapt.model.SourceLanguage;

/**
 * Build unit as declared in a graph file.
 */
public record DeclaredUnit(
        String id,
        boolean binary,
        boolean internal,
        Set<SourceLanguage> languages, // declared explicitly, may be empty
        List<String> sources,
        List<String> dependencyIds
) implements BuildUnit {

    public DeclaredUnit {
        Objects.requireNonNull(id, "id");
        languages = languages == null ? Set.of() : Set.copyOf(languages);
        sources = sources == null ? List.of() : List.copyOf(sources);
        dependencyIds = dependencyIds == null ? List.of() : List.copyOf(dependencyIds);
    }

    @Override
    public boolean isBinary() {
        return binary;
    }

    @Override
    public boolean isInternal() {
        return internal;
    }

    @Override
    public boolean isSourceLanguage(SourceLanguage language) {
        if (languages.contains(language)) {
            return true;
        }
        for (String source : sources) {
            if (language.owns(source)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return id;
    }
}
