package taskgrid.engine.exception;

/**
 * Task definition is missing a required field.
 */
public class InvalidTaskException extends TaskEngineException {

    public InvalidTaskException(String message) {
        super(message);
    }
}
