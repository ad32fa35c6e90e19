package io.eskema.core.builder;

import io.eskema.core.predicate.DateChecks;
import java.time.OffsetDateTime;

/** Date-time bounds. Pair with {@code toDateTime()} when the input is text. */
public interface DateTimeSteps<B> extends ChainSteps<B> {

    default B before(OffsetDateTime bound) {
        return before(bound, false);
    }

    default B before(OffsetDateTime bound, boolean inclusive) {
        return add(DateChecks.isDateBefore(bound, inclusive));
    }

    default B after(OffsetDateTime bound) {
        return after(bound, false);
    }

    default B after(OffsetDateTime bound, boolean inclusive) {
        return add(DateChecks.isDateAfter(bound, inclusive));
    }

    default B betweenDates(OffsetDateTime start, OffsetDateTime end) {
        return betweenDates(start, end, true, true);
    }

    default B betweenDates(OffsetDateTime start, OffsetDateTime end, boolean inclusiveStart, boolean inclusiveEnd) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end must not be before start");
        }
        return add(DateChecks.isDateBetween(start, end, inclusiveStart, inclusiveEnd));
    }

    default B sameDay(OffsetDateTime day) {
        return add(DateChecks.isDateSameDay(day));
    }

    default B inPast() {
        return inPast(true);
    }

    default B inPast(boolean allowNow) {
        return add(DateChecks.isDateInPast(allowNow));
    }

    default B inFuture() {
        return inFuture(true);
    }

    default B inFuture(boolean allowNow) {
        return add(DateChecks.isDateInFuture(allowNow));
    }
}
