package io.eskema.core.engine;

import io.eskema.core.model.Expectation;
import io.eskema.core.model.ExpectationCodes;
import io.eskema.core.model.Result;
import java.util.List;
import java.util.stream.Collectors;

/** Turns expectations into their "not ..." counterparts. */
final class Negation {

    static final String PASSED = "passed";

    private Negation() {}

    static Expectation negate(Expectation expectation, Object value) {
        return expectation
                .withMessage("not " + expectation.message())
                .withValue(value)
                .withDefaultCode(ExpectationCodes.LOGIC_NOT_EXPECTED);
    }

    static List<Expectation> negateAll(List<Expectation> expectations, Object value) {
        return expectations.stream().map(e -> negate(e, value)).collect(Collectors.toList());
    }

    /** Negated form of what a passing result verified, or "not passed" when it recorded nothing. */
    static List<Expectation> ofPassing(Result passing, Object value) {
        List<Expectation> source = passing.satisfied().isEmpty()
                ? List.of(Expectation.of(PASSED, value))
                : passing.satisfied();
        return negateAll(source, value);
    }
}
