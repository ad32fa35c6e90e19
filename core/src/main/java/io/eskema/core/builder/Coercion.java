package io.eskema.core.builder;

import io.eskema.core.spi.Validator;
import java.util.function.UnaryOperator;

/** The active coercion of a chain: how to wrap the post-coercion validators. */
record Coercion(CoercionKind kind, UnaryOperator<Validator> transformer, boolean preservePre) {}
