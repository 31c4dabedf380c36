package io.workermanifest.core.resolve;

/**
 * How an environment overlay relates to the top-level value of one target field.
 *
 * <ul>
 *   <li>{@link #MUST_INHERIT}: the top-level value is always used; overlays cannot set it.
 *   <li>{@link #MAY_OVERRIDE}: the overlay value wins when set, else the top-level value.
 *   <li>{@link #MUST_NOT_INHERIT}: the overlay value (possibly absent) is used; the top-level
 *       value never leaks into an environment.
 *   <li>{@link #TOP_LEVEL_ONLY}: only the top level can declare the field, and its value is
 *       carried into every environment.
 *   <li>{@link #COMPUTED}: derived from several inputs, see {@link InheritanceResolver}.
 * </ul>
 */
public enum InheritancePolicy {
    MUST_INHERIT,
    MAY_OVERRIDE,
    MUST_NOT_INHERIT,
    TOP_LEVEL_ONLY,
    COMPUTED;

    /**
     * Picks the effective value for an environment under this policy.
     *
     * @param topLevel the top-level value, may be null
     * @param overlay  the overlay value, may be null
     * @throws IllegalStateException for {@link #COMPUTED}, which has no generic rule
     */
    public <T> T apply(T topLevel, T overlay) {
        return switch (this) {
            case MUST_INHERIT, TOP_LEVEL_ONLY -> topLevel;
            case MAY_OVERRIDE -> overlay != null ? overlay : topLevel;
            case MUST_NOT_INHERIT -> overlay;
            case COMPUTED -> throw new IllegalStateException(this + " fields have no generic inheritance rule");
        };
    }
}
