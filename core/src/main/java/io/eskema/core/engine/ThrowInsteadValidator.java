package io.eskema.core.engine;

import io.eskema.core.error.ValidatorFailedException;
import io.eskema.core.model.Result;
import io.eskema.core.spi.Outcome;
import io.eskema.core.spi.Validator;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Raises {@link ValidatorFailedException} instead of returning an invalid result. In an asynchronous
 * chain the exception completes the returned future exceptionally.
 */
public final class ThrowInsteadValidator extends Validator {

    private static final Logger LOG = LoggerFactory.getLogger(ThrowInsteadValidator.class);

    private final Validator child;

    public ThrowInsteadValidator(Validator child) {
        this(child, child.isNullable(), child.isOptional());
    }

    private ThrowInsteadValidator(Validator child, boolean nullable, boolean optional) {
        super(nullable, optional);
        this.child = Objects.requireNonNull(child, "child must not be null");
    }

    @Override
    protected Outcome run(Object value) {
        return run(value, true);
    }

    @Override
    protected Outcome run(Object value, boolean exists) {
        return child.evaluate(value, exists).map(result -> {
            if (result.isNotValid()) {
                LOG.debug("Converting failed result into exception: {}", result.shortDescription());
                throw new ValidatorFailedException(result);
            }
            return Result.valid(result.value());
        });
    }

    @Override
    public Validator copyWith(Boolean nullable, Boolean optional) {
        return new ThrowInsteadValidator(
                child, nullable != null ? nullable : isNullable(), optional != null ? optional : isOptional());
    }
}
