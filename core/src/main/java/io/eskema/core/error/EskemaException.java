package io.eskema.core.error;

/**
 * Abstract base for all engine exceptions. Never thrown directly.
 *
 * <p>
 * Ordinary validation failures are {@link io.eskema.core.model.Result} values, not exceptions.
 * Exceptions signal either a programming error ({@link Kind#USAGE}) or a failure the caller
 * explicitly asked to have thrown ({@link Kind#VALIDATION}).
 */
public abstract class EskemaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Category of the error. */
    public enum Kind {
        USAGE,
        VALIDATION
    }

    private final Kind kind;

    protected EskemaException(String message, Kind kind) {
        super(message);
        this.kind = kind;
    }

    protected EskemaException(String message, Throwable cause, Kind kind) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
