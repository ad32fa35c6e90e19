package io.eskema.core.engine;

import io.eskema.core.model.Result;
import io.eskema.core.spi.ContextualValidator;
import io.eskema.core.spi.Outcome;
import io.eskema.core.spi.Validator;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/** Picks the field validator from the parent map. A {@code null} choice accepts the field. */
public final class ResolveValidator extends ContextualValidator {

    private final Function<Map<?, ?>, Validator> resolver;

    public ResolveValidator(Function<Map<?, ?>, Validator> resolver) {
        this(resolver, false, false);
    }

    private ResolveValidator(Function<Map<?, ?>, Validator> resolver, boolean nullable, boolean optional) {
        super(nullable, optional);
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    @Override
    protected String kind() {
        return "resolve";
    }

    @Override
    protected Outcome evaluateWithParent(Object value, Map<?, ?> parent, boolean exists) {
        Validator chosen = resolver.apply(parent);
        if (chosen == null) {
            return Outcome.of(Result.valid(value));
        }
        return chosen.evaluate(value, exists);
    }

    @Override
    public Validator copyWith(Boolean nullable, Boolean optional) {
        return new ResolveValidator(
                resolver, nullable != null ? nullable : isNullable(), optional != null ? optional : isOptional());
    }
}
