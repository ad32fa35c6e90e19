package io.eskema.core.builder;

/**
 * Fluent entry point.
 *
 * <pre>{@code
 * Validator age = Builders.v().string().toInt().between(0, 130).build();
 * Validator tags = Builders.v().list().lengthMin(1).each(Cached.IS_STRING).optional().build();
 * }</pre>
 */
public final class Builders {

    private Builders() {}

    public static RootBuilder v() {
        return RootBuilder.INSTANCE;
    }
}
