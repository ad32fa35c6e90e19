package io.eskema.core.format;

import io.eskema.core.model.Expectation;
import io.eskema.core.model.JsonValues;
import io.eskema.core.model.Result;
import java.util.List;

/**
 * Renders results as multi-line reports:
 *
 * <pre>
 * Validation failed (errors: 2) for value (LinkedHashMap): {"age":"x"}
 *   1) .age: int [code=type.mismatch] {data={expected=int, found=String}}
 *   2) .name: String [code=type.mismatch]
 * </pre>
 *
 * <p>
 * Read-only over the outcome model. Thread-safe, stateless.
 */
public final class ResultFormatter {

    private ResultFormatter() {}

    /** Formats with {@link FormatOptions#DEFAULT}. */
    public static String format(Result result) {
        return format(result, FormatOptions.DEFAULT);
    }

    /** {@code Valid (<Type>): <value>} for valid results, the failure report otherwise. */
    public static String format(Result result, FormatOptions options) {
        if (result.isValid()) {
            return "Valid (" + JsonValues.typeName(result.value()) + "): " + valueRepr(result.value(), options);
        }
        return formatFailure(result, options);
    }

    private static String formatFailure(Result result, FormatOptions options) {
        StringBuilder out = new StringBuilder();
        out.append("Validation failed (errors: ").append(result.expectationCount()).append(')');
        out.append(" for value (").append(JsonValues.typeName(result.value())).append("): ");
        out.append(valueRepr(result.value(), options)).append('\n');

        List<Expectation> expectations = result.expectations();
        int shown = Math.min(expectations.size(), options.maxErrorsToList());
        for (int i = 0; i < shown; i++) {
            Expectation e = expectations.get(i);
            out.append("  ").append(i + 1).append(") ").append(e.description());
            if (e.code() != null) {
                out.append(" [code=").append(e.code()).append(']');
            }
            if (!e.data().isEmpty()) {
                out.append(" {data=").append(e.data()).append('}');
            }
            out.append('\n');
        }

        int remaining = expectations.size() - shown;
        if (remaining > 0) {
            out.append("  … (").append(remaining).append(" more not shown)\n");
        }
        return out.toString().stripTrailing();
    }

    private static String valueRepr(Object value, FormatOptions options) {
        String repr = JsonValues.prettify(value);
        if (repr.length() > options.maxValueLength()) {
            return repr.substring(0, options.maxValueLength()) + "…";
        }
        return repr;
    }
}
