package io.workermanifest.core.model;

import java.util.Objects;

/**
 * A KV namespace binding declared in a {@code kv-namespaces} array.
 *
 * @param id      namespace identifier in the account
 * @param binding variable name the namespace is bound to inside the worker
 * @param bucket  local directory to upload into the namespace, or null
 */
public record KvNamespace(String id, String binding, String bucket) {

    public KvNamespace {
        Objects.requireNonNull(id, "kv namespace id must not be null");
        Objects.requireNonNull(binding, "kv namespace binding must not be null");
    }
}
