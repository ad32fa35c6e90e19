package io.eskema.core.builder;

import io.eskema.core.engine.AllValidator;
import io.eskema.core.engine.FunctionValidator;
import io.eskema.core.engine.NotValidator;
import io.eskema.core.error.BuilderStateException;
import io.eskema.core.spi.Validator;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutable state shared by every typed view of one builder chain.
 *
 * <p>
 * Constraints added before the first coercion land in the pre list, later ones in the post list.
 * A coercion to another built-in kind replaces the previous one and discards the post list; a custom
 * pivot composes with it. {@link #build()} freezes the state.
 */
public final class ChainState {

    private static final Logger LOG = LoggerFactory.getLogger(ChainState.class);

    private final List<Validator> pre = new ArrayList<>();
    private final List<Validator> post = new ArrayList<>();
    private Coercion coercion;
    private UnaryOperator<Validator> prefix;
    private boolean negateNext;
    private boolean nullable;
    private boolean optional;
    private boolean frozen;

    ChainState() {}

    void add(Validator validator) {
        checkOpen();
        current().add(validator);
    }

    /** Replaces the current constraints with {@code fn} applied to their conjunction. */
    void wrap(UnaryOperator<Validator> fn) {
        checkOpen();
        List<Validator> target = current();
        if (target.isEmpty()) {
            return;
        }
        Validator wrapped = fn.apply(combine(target));
        target.clear();
        target.add(wrapped);
    }

    private List<Validator> current() {
        return coercion != null ? post : pre;
    }

    void setTransform(CoercionKind kind, UnaryOperator<Validator> transformer, boolean dropPre) {
        checkOpen();
        if (coercion == null) {
            coercion = new Coercion(kind, transformer, !dropPre);
            if (dropPre) {
                pre.clear();
            }
            return;
        }
        if (kind == CoercionKind.CUSTOM || coercion.kind() == CoercionKind.CUSTOM) {
            LOG.debug("Composing coercion {} after {}", kind, coercion.kind());
            UnaryOperator<Validator> previous = coercion.transformer();
            coercion = new Coercion(kind, child -> previous.apply(transformer.apply(child)), coercion.preservePre());
        } else {
            LOG.debug(
                    "Coercion {} replaces {}; {} post-coercion constraint(s) dropped",
                    kind,
                    coercion.kind(),
                    post.size());
            coercion = new Coercion(kind, transformer, !dropPre);
            if (dropPre) {
                pre.clear();
            }
        }
        post.clear();
    }

    boolean isCoerced(CoercionKind kind) {
        return coercion != null && coercion.kind() == kind;
    }

    /**
     * Closes the chain built so far and continues on the value {@code fn} extracts from its output.
     * Earlier constraints and coercions still run first, on the original value.
     */
    void pivot(UnaryOperator<Validator> fn) {
        checkOpen();
        Validator head = assemble();
        UnaryOperator<Validator> outer = prefix;
        pre.clear();
        post.clear();
        coercion = null;
        prefix = child -> {
            Validator step = new AllValidator(List.of(head, fn.apply(child)));
            return outer != null ? outer.apply(step) : step;
        };
    }

    void negateNext() {
        checkOpen();
        negateNext = true;
    }

    /** Wraps {@code validator} in {@code not} when a negation is pending, clearing it. */
    Validator applyNegation(Validator validator) {
        if (!negateNext) {
            return validator;
        }
        negateNext = false;
        return new NotValidator(validator, null);
    }

    boolean takeNegation() {
        boolean pending = negateNext;
        negateNext = false;
        return pending;
    }

    void markNullable() {
        checkOpen();
        nullable = true;
    }

    void markOptional() {
        checkOpen();
        optional = true;
    }

    Validator build() {
        frozen = true;
        Validator tail = assemble();
        Validator core = prefix != null ? prefix.apply(tail) : tail;
        return core.copyWith(nullable, optional);
    }

    private Validator assemble() {
        if (coercion == null) {
            return pre.isEmpty() ? FunctionValidator.VALID : combine(pre);
        }
        Validator coerced = coercion.transformer().apply(post.isEmpty() ? FunctionValidator.VALID : combine(post));
        return coercion.preservePre() && !pre.isEmpty() ? new AllValidator(List.of(combine(pre), coerced)) : coerced;
    }

    private static Validator combine(List<Validator> validators) {
        return validators.size() == 1 ? validators.get(0) : new AllValidator(validators);
    }

    private void checkOpen() {
        if (frozen) {
            throw new BuilderStateException("builder chain was already built; start a new chain with Builders.v()");
        }
    }
}
