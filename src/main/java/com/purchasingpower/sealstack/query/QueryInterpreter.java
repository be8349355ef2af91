package com.purchasingpower.sealstack.query;

/**
 * Turns a {@link ModuleRequest} into an {@link Intent}.
 *
 * <p>Implementations never fail. An empty or unrecognised query yields an intent
 * with empty tag sets on every layer.
 *
 * @since 1.0.0
 */
public interface QueryInterpreter {

    Intent interpret(ModuleRequest request);
}
