/**
 * Query interpretation: from a caller's request to per-layer tag sets.
 *
 * <p>The interpreter is a keyword heuristic, not language understanding. It is kept
 * behind {@link com.purchasingpower.sealstack.query.QueryInterpreter} so routing,
 * scoring and assembly do not depend on how the intent was produced.
 *
 * @since 1.0.0
 */
package com.purchasingpower.sealstack.query;
