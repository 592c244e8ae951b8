package in.usermgmt.application.port.output;

/**
 * Exception thrown when a repository fails to persist a user.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
