package io.workermanifest.core.resolve;

/** The fields of an {@code EffectiveTarget} and the inheritance policy each one follows. */
public enum TargetField {
    TARGET_KIND(InheritancePolicy.MUST_INHERIT),
    ACCOUNT_ID(InheritancePolicy.MAY_OVERRIDE),
    WEBPACK_CONFIG(InheritancePolicy.MAY_OVERRIDE),
    NAME(InheritancePolicy.COMPUTED),
    KV_NAMESPACES(InheritancePolicy.MUST_NOT_INHERIT),
    SITE(InheritancePolicy.TOP_LEVEL_ONLY);

    private final InheritancePolicy policy;

    TargetField(InheritancePolicy policy) {
        this.policy = policy;
    }

    public InheritancePolicy policy() {
        return policy;
    }
}
