package io.eskema.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.eskema.core.Eskema;
import io.eskema.core.builder.Builders;
import io.eskema.core.builder.ChainState;
import io.eskema.core.error.AsyncValidatorException;
import io.eskema.core.model.Result;
import io.eskema.core.predicate.Cached;
import io.eskema.core.spi.ContextualValidator;
import io.eskema.core.spi.Validator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Tests for the debug diagnostics emitted on rejected unknown keys, async steps reached from
 * {@code validate()}, coercion replacement and contextual misuse.
 */
@DisplayName("DiagnosticLoggingTest")
class DiagnosticLoggingTest {

    private final List<Logger> loggers = new ArrayList<>();
    private final List<Level> previousLevels = new ArrayList<>();
    private ListAppender<ILoggingEvent> logAppender;

    @BeforeEach
    void setUp() {
        logAppender = new ListAppender<>();
        logAppender.start();
        for (Class<?> type : List.of(
                MapSchemaValidator.class, Validator.class, ChainState.class, ContextualValidator.class)) {
            Logger logger = (Logger) LoggerFactory.getLogger(type);
            previousLevels.add(logger.getLevel());
            logger.setLevel(Level.DEBUG);
            logger.addAppender(logAppender);
            loggers.add(logger);
        }
    }

    @AfterEach
    void tearDown() {
        for (int i = 0; i < loggers.size(); i++) {
            loggers.get(i).detachAppender(logAppender);
            loggers.get(i).setLevel(previousLevels.get(i));
        }
        logAppender.stop();
    }

    private List<String> messages() {
        return logAppender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
    }

    @Test
    void strictSchemaLogsUnknownKeys() {
        Eskema.eskemaStrict(Map.of("id", Cached.IS_INT)).validate(Map.of("id", 1, "debug", true));

        assertThat(messages()).contains("Strict map schema rejected unknown keys [debug]");
        assertThat(logAppender.list).allMatch(e -> e.getLevel() == Level.DEBUG);
    }

    @Test
    void asyncStepInSyncValidationIsLogged() {
        Validator async = Eskema.asyncValidator(v -> CompletableFuture.completedFuture(Result.valid(v)));

        assertThatThrownBy(() -> async.validate("x")).isInstanceOf(AsyncValidatorException.class);

        assertThat(messages()).anyMatch(m -> m.startsWith("Synchronous validate() reached an asynchronous step"));
    }

    @Test
    void coercionReplacementIsLogged() {
        Builders.v().string().toInt().gt(1).toDouble().build();

        assertThat(messages()).contains("Coercion DOUBLE replaces INT; 1 post-coercion constraint(s) dropped");
    }

    @Test
    void contextualMisuseIsLogged() {
        Eskema.when(Eskema.valid(), Eskema.valid(), Eskema.valid()).validate(1);

        assertThat(messages()).contains("when evaluated outside a map schema");
    }

    @Test
    void validationWithoutIncidentsLogsNothing() {
        Eskema.eskema(Map.of("id", Cached.IS_INT)).validate(Map.of("id", 1));

        assertThat(logAppender.list).isEmpty();
    }
}
