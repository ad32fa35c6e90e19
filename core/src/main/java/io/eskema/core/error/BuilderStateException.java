package io.eskema.core.error;

/** Thrown when a builder chain is modified after {@code build()} froze it. */
public final class BuilderStateException extends EskemaException {

    private static final long serialVersionUID = 1L;

    public BuilderStateException(String message) {
        super(message, Kind.USAGE);
    }
}
