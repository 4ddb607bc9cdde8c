package tools.argsapt.task;

/**
 * The args-apt step could not complete for a unit.
 */
public class TaskException extends Exception {

    public TaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
