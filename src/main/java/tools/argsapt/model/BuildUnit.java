package tools.argsapt.model;

import java.util.List;

/**
 * Read-only view of a node in the build graph.
 */
public interface BuildUnit {

    String id();

    /** True for units packaged into a runnable archive. */
    boolean isBinary();

    /** True for first-party units; third-party units are never walked. */
    boolean isInternal();

    /**
     * True if the unit declares {@code language} or owns at least one source of it.
     * A unit whose sources have not been written yet still counts when it declares the language.
     */
    boolean isSourceLanguage(SourceLanguage language);

    /** Source paths relative to the unit's source root, e.g. {@code com/foo/Main.java}. */
    List<String> sources();

    List<String> dependencyIds();
}
