/**
 * Core domain values: coordinates, patterns and seal layers.
 *
 * <p>Everything in this package is immutable. The pattern store owns every
 * {@link com.purchasingpower.sealstack.core.Pattern} for the lifetime of the
 * process; other components only hold read references.
 *
 * @since 1.0.0
 */
package com.purchasingpower.sealstack.core;
