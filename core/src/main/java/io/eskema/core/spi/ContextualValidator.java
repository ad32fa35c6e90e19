package io.eskema.core.spi;

import io.eskema.core.model.Expectation;
import io.eskema.core.model.ExpectationCodes;
import io.eskema.core.model.Result;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A validator whose decision depends on the map that holds the value. It only makes sense as the
 * direct validator of a map schema field; anywhere else it fails with
 * {@link ExpectationCodes#LOGIC_CONTEXTUAL_MISUSE}.
 */
public abstract class ContextualValidator extends Validator {

    private static final Logger LOG = LoggerFactory.getLogger(ContextualValidator.class);

    protected ContextualValidator(boolean nullable, boolean optional) {
        super(nullable, optional);
    }

    /** Short name used in the misuse message, e.g. {@code when}. */
    protected abstract String kind();

    /** Evaluates the field value once presence short-circuits have been applied. */
    protected abstract Outcome evaluateWithParent(Object value, Map<?, ?> parent, boolean exists);

    protected String misuseMessage() {
        return "`" + kind() + "` validator can only be used inside an `eskema` map validator";
    }

    @Override
    protected final Outcome run(Object value) {
        LOG.debug("{} evaluated outside a map schema", kind());
        return Outcome.of(Result.invalid(
                value, Expectation.of(misuseMessage(), value, ExpectationCodes.LOGIC_CONTEXTUAL_MISUSE)));
    }

    @Override
    public final Outcome evaluateField(Object value, Map<?, ?> parent, boolean exists) {
        if (acceptsWithoutRunning(value, exists)) {
            return Outcome.of(Result.valid(value));
        }
        return evaluateWithParent(value, parent, exists);
    }
}
