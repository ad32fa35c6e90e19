package io.eskema.core.predicate;

import io.eskema.core.engine.FunctionValidator;
import io.eskema.core.model.Expectation;
import io.eskema.core.model.ExpectationCodes;
import io.eskema.core.spi.Validator;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Date-time comparisons. Values must already be date-times (see {@link DateTimes#isDateTime}); use
 * a {@code toDateTime} coercion for strings.
 */
public final class DateChecks {

    private DateChecks() {}

    public static Validator isDateBefore(OffsetDateTime bound, boolean inclusive) {
        Instant limit = bound.toInstant();
        return check(
                "isDateBefore",
                i -> inclusive ? !i.isAfter(limit) : i.isBefore(limit),
                "a DateTime before" + (inclusive ? " or equal to " : " ") + bound,
                ExpectationCodes.VALUE_DATE_OUT_OF_RANGE,
                Data.of("bound", bound.toString(), "op", "before", "inclusive", inclusive));
    }

    public static Validator isDateAfter(OffsetDateTime bound, boolean inclusive) {
        Instant limit = bound.toInstant();
        return check(
                "isDateAfter",
                i -> inclusive ? !i.isBefore(limit) : i.isAfter(limit),
                "a DateTime after" + (inclusive ? " or equal to " : " ") + bound,
                ExpectationCodes.VALUE_DATE_OUT_OF_RANGE,
                Data.of("bound", bound.toString(), "op", "after", "inclusive", inclusive));
    }

    public static Validator isDateBetween(
            OffsetDateTime start, OffsetDateTime end, boolean inclusiveStart, boolean inclusiveEnd) {
        Instant from = start.toInstant();
        Instant to = end.toInstant();
        String interval = (inclusiveStart ? "[" : "(") + (inclusiveEnd ? "]" : ")");
        return check(
                "isDateBetween",
                i -> (inclusiveStart ? !i.isBefore(from) : i.isAfter(from))
                        && (inclusiveEnd ? !i.isAfter(to) : i.isBefore(to)),
                "a DateTime between " + start + " and " + end + " (" + interval + ")",
                ExpectationCodes.VALUE_DATE_OUT_OF_RANGE,
                Data.of(
                        "start", start.toString(),
                        "end", end.toString(),
                        "inclusiveStart", inclusiveStart,
                        "inclusiveEnd", inclusiveEnd));
    }

    /** Same calendar day in UTC. */
    public static Validator isDateSameDay(OffsetDateTime day) {
        LocalDate target = day.atZoneSameInstant(ZoneOffset.UTC).toLocalDate();
        return check(
                "isDateSameDay",
                i -> i.atOffset(ZoneOffset.UTC).toLocalDate().equals(target),
                "a DateTime on the same day as " + target,
                ExpectationCodes.VALUE_DATE_MISMATCH,
                Data.of("targetDay", target.toString()));
    }

    public static Validator isDateInPast(boolean allowNow) {
        return isDateInPast(allowNow, Clock.systemUTC());
    }

    /** {@code now} is read from {@code clock} when the validator is created. */
    public static Validator isDateInPast(boolean allowNow, Clock clock) {
        Instant now = clock.instant();
        return check(
                "isDateInPast",
                i -> allowNow ? !i.isAfter(now) : i.isBefore(now),
                "a DateTime in the past" + (allowNow ? " or now" : ""),
                ExpectationCodes.VALUE_DATE_NOT_PAST,
                Data.of("now", now.toString(), "allowNow", allowNow));
    }

    public static Validator isDateInFuture(boolean allowNow) {
        return isDateInFuture(allowNow, Clock.systemUTC());
    }

    public static Validator isDateInFuture(boolean allowNow, Clock clock) {
        Instant now = clock.instant();
        return check(
                "isDateInFuture",
                i -> allowNow ? !i.isBefore(now) : i.isAfter(now),
                "a DateTime in the future" + (allowNow ? " or now" : ""),
                ExpectationCodes.VALUE_DATE_NOT_FUTURE,
                Data.of("now", now.toString(), "allowNow", allowNow));
    }

    private static Validator check(
            String name, Predicate<Instant> test, String message, String code, Map<String, Object> data) {
        return FunctionValidator.predicate(
                name,
                v -> {
                    Instant instant = DateTimes.toInstant(v);
                    return instant != null && test.test(instant);
                },
                v -> Expectation.of(message, v, code, data));
    }
}
