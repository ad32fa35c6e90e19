package io.eskema.core.format;

/**
 * Limits applied when rendering a {@link io.eskema.core.model.Result} as text.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param maxValueLength  longest value rendering before it is truncated with an ellipsis
 *                        (default: 120)
 * @param maxErrorsToList number of expectations listed before the rest are summarised
 *                        (default: 20)
 */
public record FormatOptions(int maxValueLength, int maxErrorsToList) {

    /** Default limits: 120 characters, 20 expectations. */
    public static final FormatOptions DEFAULT = new FormatOptions(120, 20);

    public FormatOptions {
        if (maxValueLength <= 0) {
            throw new IllegalArgumentException("maxValueLength must be positive, got: " + maxValueLength);
        }
        if (maxErrorsToList <= 0) {
            throw new IllegalArgumentException("maxErrorsToList must be positive, got: " + maxErrorsToList);
        }
    }
}
