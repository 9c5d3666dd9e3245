package taskgrid.engine.exception;

/**
 * Base class for structural errors raised by the orchestration engine.
 * Every operation that throws one leaves engine state untouched.
 */
public class TaskEngineException extends RuntimeException {

    public TaskEngineException(String message) {
        super(message);
    }

    public TaskEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
