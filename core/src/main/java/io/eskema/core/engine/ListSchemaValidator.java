package io.eskema.core.engine;

import io.eskema.core.model.Expectation;
import io.eskema.core.model.ExpectationCodes;
import io.eskema.core.model.Result;
import io.eskema.core.predicate.TypeChecks;
import io.eskema.core.spi.Outcome;
import io.eskema.core.spi.Validator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntFunction;

/**
 * Validates list items: either one validator per position (the list must then have exactly that
 * many items) or the same validator for every item. Failures are prefixed with {@code [index]}.
 */
public final class ListSchemaValidator extends Validator {

    private final IntFunction<Validator> itemValidator;
    private final Integer expectedLength;
    private final String message;

    private ListSchemaValidator(
            IntFunction<Validator> itemValidator,
            Integer expectedLength,
            String message,
            boolean nullable,
            boolean optional) {
        super(nullable, optional);
        this.itemValidator = itemValidator;
        this.expectedLength = expectedLength;
        this.message = message;
    }

    /** Item {@code i} is checked by {@code validators.get(i)}. */
    public static ListSchemaValidator positional(List<Validator> validators, String message) {
        List<Validator> copy = List.copyOf(validators);
        return new ListSchemaValidator(copy::get, copy.size(), message, false, false);
    }

    /** Every item is checked by {@code validator}. */
    public static ListSchemaValidator each(Validator validator, String message) {
        Objects.requireNonNull(validator, "validator must not be null");
        return new ListSchemaValidator(i -> validator, null, message, false, false);
    }

    @Override
    protected Outcome run(Object value) {
        if (!(value instanceof List<?> list)) {
            return Outcome.of(Result.invalid(value, TypeChecks.mismatch("List", value)));
        }
        if (expectedLength != null && list.size() != expectedLength) {
            return Outcome.of(Result.invalid(
                    list,
                    Expectation.of(
                            "length [equal to " + expectedLength + "]",
                            list,
                            ExpectationCodes.VALUE_LENGTH_OUT_OF_RANGE,
                            Map.of("length", list.size()))));
        }
        return step(0, list, new ArrayList<>());
    }

    private Outcome step(int from, List<?> list, List<Expectation> failures) {
        for (int i = from; i < list.size(); i++) {
            int index = i;
            Outcome outcome = itemValidator.apply(i).evaluate(list.get(i));
            if (outcome.isPending()) {
                return outcome.flatMap(result -> {
                    collect(index, result, failures);
                    return step(index + 1, list, failures);
                });
            }
            collect(index, outcome.resultNow(), failures);
        }
        return Outcome.of(failures.isEmpty() ? Result.valid(list) : Result.invalid(list, failures));
    }

    private void collect(int index, Result result, List<Expectation> failures) {
        for (Expectation failure : result.expectations()) {
            Expectation e = message != null ? failure.withMessage(message) : failure;
            failures.add(e.withDefaultCode(ExpectationCodes.STRUCTURE_LIST_ITEM_FAILED).prependPath("[" + index + "]"));
        }
    }

    @Override
    public Validator copyWith(Boolean nullable, Boolean optional) {
        return new ListSchemaValidator(
                itemValidator,
                expectedLength,
                message,
                nullable != null ? nullable : isNullable(),
                optional != null ? optional : isOptional());
    }

    @Override
    public String toString() {
        return expectedLength != null ? "eskemaList(" + expectedLength + ")" : "listEach";
    }
}
