package io.eskema.core.error;

import io.eskema.core.format.ResultFormatter;
import io.eskema.core.model.JsonValues;
import io.eskema.core.model.Result;
import java.time.Instant;

/**
 * Carries a failed {@link Result} through exception-based control flow. Raised by
 * {@code validateOrThrow()}, {@code Result.orThrow()} and the {@code throwInstead} adapter.
 */
public final class ValidatorFailedException extends EskemaException {

    private static final long serialVersionUID = 1L;

    private final transient Result result;
    private final Instant timestamp = Instant.now();

    /**
     * @param result the failed result
     * @throws IllegalArgumentException if {@code result} is valid
     */
    public ValidatorFailedException(Result result) {
        super(ResultFormatter.format(requireInvalid(result)), Kind.VALIDATION);
        this.result = result;
    }

    private static Result requireInvalid(Result result) {
        if (result == null || result.isValid()) {
            throw new IllegalArgumentException("ValidatorFailedException requires an invalid result");
        }
        return result;
    }

    public Result result() {
        return result;
    }

    public Instant timestamp() {
        return timestamp;
    }

    /** Single-line summary for logs. */
    public String summary() {
        return "ValidatorFailed(errors=" + result.expectationCount() + ", type="
                + JsonValues.typeName(result.value()) + ")";
    }
}
