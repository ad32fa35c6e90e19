package io.eskema.core.error;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.eskema.core.model.Expectation;
import io.eskema.core.model.ExpectationCodes;
import io.eskema.core.model.Result;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: one abstract root, usage errors and requested failures. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void eskemaExceptionIsAbstractAndRoot() {
        assertThat(EskemaException.class).isAbstract();
        assertThat(EskemaException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    // --- Usage errors ---

    @Test
    void asyncValidatorExceptionIsUsageError() {
        var ex = new AsyncValidatorException();

        assertThat(ex).isInstanceOf(EskemaException.class);
        assertThat(ex.kind()).isEqualTo(EskemaException.Kind.USAGE);
        assertThat(ex.context()).isNull();
        assertThat(ex.detail())
                .isEqualTo("Cannot call validate() on a validator chain that contains async operations."
                        + " Use validateAsync() instead.");
    }

    @Test
    void asyncValidatorExceptionNamesItsContext() {
        var ex = new AsyncValidatorException("all[isString, asyncCheck]");

        assertThat(ex.context()).isEqualTo("all[isString, asyncCheck]");
        assertThat(ex.getMessage()).endsWith("(Context: all[isString, asyncCheck])");
    }

    @Test
    void builderStateExceptionIsUsageError() {
        var ex = new BuilderStateException("chain frozen");

        assertThat(ex).isInstanceOf(EskemaException.class);
        assertThat(ex.kind()).isEqualTo(EskemaException.Kind.USAGE);
        assertThat(ex.detail()).isEqualTo("chain frozen");
    }

    // --- Requested failures ---

    @Test
    void validatorFailedExceptionCarriesTheResult() {
        var result = Result.invalid(
                "x",
                List.of(
                        Expectation.of("int", "x", ExpectationCodes.TYPE_MISMATCH),
                        Expectation.of("less than 3", "x")));

        var ex = new ValidatorFailedException(result);

        assertThat(ex.kind()).isEqualTo(EskemaException.Kind.VALIDATION);
        assertThat(ex.result()).isSameAs(result);
        assertThat(ex.timestamp()).isNotNull();
        assertThat(ex.summary()).isEqualTo("ValidatorFailed(errors=2, type=String)");
        assertThat(ex.getMessage()).startsWith("Validation failed (errors: 2) for value (String): \"x\"");
    }

    @Test
    void validatorFailedExceptionRejectsValidResult() {
        assertThatThrownBy(() -> new ValidatorFailedException(Result.valid(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
