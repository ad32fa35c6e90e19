package io.eskema.core.error;

/**
 * Thrown when the synchronous {@code validate()} entry point meets a validator that completes
 * asynchronously. Use {@code validateAsync()} for such chains.
 */
public final class AsyncValidatorException extends EskemaException {

    private static final long serialVersionUID = 1L;

    static final String BASE_MESSAGE = "Cannot call validate() on a validator chain that contains async operations."
            + " Use validateAsync() instead.";

    private final String context;

    public AsyncValidatorException() {
        this(null);
    }

    public AsyncValidatorException(String context) {
        super(context == null ? BASE_MESSAGE : BASE_MESSAGE + " (Context: " + context + ")", Kind.USAGE);
        this.context = context;
    }

    /** Where the async outcome was found, or {@code null}. */
    public String context() {
        return context;
    }
}
