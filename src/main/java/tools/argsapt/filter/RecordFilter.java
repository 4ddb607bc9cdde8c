package tools.argsapt.filter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Keeps the arg info records that belong to a binary.
 * <p>
 * A record is {@code <keyname> <arg1> [arg2 ...]}. {@code field} and {@code positional} records
 * name the class declaring the argument as {@code arg1} and are kept only for known classes;
 * all other records are kept as they are.
 */
public final class RecordFilter {

    public static final String FIELD = "field";
    public static final String POSITIONAL = "positional";

    private RecordFilter() {
    }

    public static List<String> filter(Collection<String> lines, Set<String> classNames, boolean includeAll) {
        Objects.requireNonNull(lines, "lines");
        Objects.requireNonNull(classNames, "classNames");

        final List<String> kept = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            if (includeAll || accepts(line, classNames)) {
                kept.add(line);
            }
        }
        return kept;
    }

    /**
     * @throws MalformedRecordException for a {@code field} or {@code positional} record without a class name
     */
    public static boolean accepts(String line, Set<String> classNames) {
        final String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return false;
        }

        final String[] tokens = trimmed.split(" ");
        final String keyname = tokens[0];
        if (!FIELD.equals(keyname) && !POSITIONAL.equals(keyname)) {
            return true;
        }
        if (tokens.length < 2) {
            throw new MalformedRecordException(trimmed, keyname + " record without a class name");
        }
        return classNames.contains(tokens[1]);
    }
}
