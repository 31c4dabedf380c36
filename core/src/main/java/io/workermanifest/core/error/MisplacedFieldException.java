package io.workermanifest.core.error;

/**
 * Thrown when a known manifest key shows up inside the wrong table. The classic case is
 * {@code kv-namespaces} written after a {@code [site]} header, which TOML nests under
 * {@code site}.
 */
public final class MisplacedFieldException extends ManifestFormatException {

    private static final long serialVersionUID = 1L;

    private final String field;
    private final String foundIn;
    private final String belongsIn;

    public MisplacedFieldException(String field, String foundIn, String belongsIn, String source) {
        super(
                String.format(
                        "'%s' should not live under the [%s] table; please move it to the %s, above [%s]",
                        field, foundIn, belongsIn, foundIn),
                source);
        this.field = field;
        this.foundIn = foundIn;
        this.belongsIn = belongsIn;
    }

    /** The misplaced key, e.g. {@code kv-namespaces}. */
    public String field() {
        return field;
    }

    /** The table the key was found in, e.g. {@code site}. */
    public String foundIn() {
        return foundIn;
    }

    /** Where the key belongs, e.g. {@code top level}. */
    public String belongsIn() {
        return belongsIn;
    }
}
