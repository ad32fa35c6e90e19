package io.eskema.core.engine;

import io.eskema.core.model.Expectation;
import io.eskema.core.model.Result;
import io.eskema.core.spi.ContextualValidator;
import io.eskema.core.spi.Outcome;
import io.eskema.core.spi.Validator;
import java.util.Map;
import java.util.Objects;

/**
 * Conditional field validation: {@code condition} is checked against the parent map, then
 * {@code then} or {@code otherwise} checks the field value. The chosen branch keeps its own
 * presence flags.
 */
public final class WhenValidator extends ContextualValidator {

    private final Validator condition;
    private final Validator then;
    private final Validator otherwise;
    private final String message;

    public WhenValidator(Validator condition, Validator then, Validator otherwise, String message) {
        this(condition, then, otherwise, message, false, false);
    }

    private WhenValidator(
            Validator condition,
            Validator then,
            Validator otherwise,
            String message,
            boolean nullable,
            boolean optional) {
        super(nullable, optional);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
        this.then = Objects.requireNonNull(then, "then must not be null");
        this.otherwise = Objects.requireNonNull(otherwise, "otherwise must not be null");
        this.message = message;
    }

    @Override
    protected String kind() {
        return "when";
    }

    @Override
    protected String misuseMessage() {
        return message != null ? message : super.misuseMessage();
    }

    @Override
    protected Outcome evaluateWithParent(Object value, Map<?, ?> parent, boolean exists) {
        return condition
                .evaluate(parent)
                .flatMap(decision -> (decision.isValid() ? then : otherwise).evaluate(value, exists))
                .map(result -> message == null || result.isValid()
                        ? result
                        : Result.invalid(value, Expectation.of(message, value, result.firstExpectation().code())));
    }

    @Override
    public Validator copyWith(Boolean nullable, Boolean optional) {
        return new WhenValidator(
                condition,
                then,
                otherwise,
                message,
                nullable != null ? nullable : isNullable(),
                optional != null ? optional : isOptional());
    }
}
