package tools.argsapt.filter;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RecordFilterTest {

    private static final Set<String> CLASSES = Set.of("com.foo.Main");
    private static final List<String> LINES = List.of(
            "field com.foo.Main x",
            "field com.bar.Other y",
            "cmdline something");

    @Test
    @DisplayName("keeps field records of known classes and all unscoped records")
    void keepsReachableRecords() {
        final List<String> kept = RecordFilter.filter(LINES, CLASSES, false);

        assertEquals(List.of("field com.foo.Main x", "cmdline something"), kept);
    }

    @Test
    @DisplayName("applies the class check to positional records")
    void filtersPositionalRecords() {
        final List<String> kept = RecordFilter.filter(
                List.of("positional com.foo.Main args", "positional com.bar.Other args"), CLASSES, false);

        assertEquals(List.of("positional com.foo.Main args"), kept);
    }

    @Test
    @DisplayName("includeAll keeps every record")
    void includeAllKeepsEverything() {
        assertEquals(LINES, RecordFilter.filter(LINES, CLASSES, true));
        assertEquals(LINES, RecordFilter.filter(LINES, Set.of(), true));
    }

    @Test
    @DisplayName("drops blank lines in both modes")
    void dropsBlankLines() {
        final List<String> lines = List.of("", "   ", "cmdline something");

        assertEquals(List.of("cmdline something"), RecordFilter.filter(lines, CLASSES, false));
        assertEquals(List.of("cmdline something"), RecordFilter.filter(lines, CLASSES, true));
    }

    @Test
    @DisplayName("matches on the trimmed record but keeps the line as read")
    void keepsOriginalLine() {
        final List<String> kept = RecordFilter.filter(List.of("  field com.foo.Main x  "), CLASSES, false);

        assertEquals(List.of("  field com.foo.Main x  "), kept);
    }

    @Test
    @DisplayName("keyname match is exact")
    void keynameIsExact() {
        assertTrue(RecordFilter.accepts("fields com.bar.Other y", CLASSES));
        assertTrue(RecordFilter.accepts("Field com.bar.Other y", CLASSES));
        assertFalse(RecordFilter.accepts("field com.foo.MainX y", CLASSES));
    }

    @Test
    @DisplayName("rejects class-scoped records without a class name")
    void rejectsMalformedRecords() {
        final var ex = assertThrows(MalformedRecordException.class,
                () -> RecordFilter.filter(List.of("field"), CLASSES, false));
        assertEquals("field", ex.line());
        assertTrue(ex.getMessage().contains("'field'"));

        assertThrows(MalformedRecordException.class, () -> RecordFilter.accepts("positional", CLASSES));
    }

    @Test
    @DisplayName("an empty class token matches no class and drops the record")
    void emptyClassTokenIsDropped() {
        final List<String> kept = RecordFilter.filter(
                List.of("field  com.foo.Main x", "positional  com.foo.Main", "cmdline y"), CLASSES, false);

        assertEquals(List.of("cmdline y"), kept);
    }

    @Test
    @DisplayName("malformed records pass when the filter is bypassed")
    void includeAllSkipsParsing() {
        assertEquals(List.of("field"), RecordFilter.filter(List.of("field"), CLASSES, true));
    }
}
