package tools.argsapt.filter;

/**
 * A class-scoped arg info record that does not name its class.
 */
public final class MalformedRecordException extends RuntimeException {

    private final String line;

    public MalformedRecordException(String line, String reason) {
        super(reason + ": '" + line + "'");
        this.line = line;
    }

    public String line() {
        return line;
    }
}
