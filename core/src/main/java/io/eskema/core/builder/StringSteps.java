package io.eskema.core.builder;

import io.eskema.core.predicate.Cached;
import io.eskema.core.predicate.StringChecks;
import io.eskema.core.transform.Transformers;
import java.util.regex.Pattern;

/**
 * String content checks, plus normalizers that rewrite the value seen by the constraints added so
 * far.
 */
public interface StringSteps<B> extends ChainSteps<B> {

    default B matches(Pattern pattern) {
        return add(StringChecks.matches(pattern));
    }

    default B matches(String regex) {
        return matches(Pattern.compile(regex));
    }

    default B email() {
        return add(Cached.IS_EMAIL);
    }

    default B lowerCase() {
        return add(Cached.IS_LOWER_CASE);
    }

    default B upperCase() {
        return add(Cached.IS_UPPER_CASE);
    }

    default B intString() {
        return add(Cached.IS_INT_STRING);
    }

    default B doubleString() {
        return add(Cached.IS_DOUBLE_STRING);
    }

    default B numString() {
        return add(Cached.IS_NUM_STRING);
    }

    default B boolString() {
        return add(Cached.IS_BOOL_STRING);
    }

    /** ISO-8601 date or date-time text. */
    default B date() {
        return add(Cached.IS_DATE);
    }

    default B trim() {
        return wrap(Transformers::trim);
    }

    default B collapseWhitespace() {
        return wrap(Transformers::collapseWhitespace);
    }

    default B toLowerCase() {
        return wrap(Transformers::toLowerCase);
    }

    default B toUpperCase() {
        return wrap(Transformers::toUpperCase);
    }
}
