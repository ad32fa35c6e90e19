package io.eskema.core.builder;

/**
 * Target domain of a builder coercion. {@code toNum} and {@code toBigInt} share {@link #DOUBLE}.
 */
public enum CoercionKind {
    INT,
    DOUBLE,
    BOOL,
    STRING,
    DATETIME,
    JSON,
    CUSTOM
}
