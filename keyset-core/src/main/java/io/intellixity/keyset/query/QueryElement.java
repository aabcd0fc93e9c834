package io.intellixity.keyset.query;

/**
 * Node of the backend-agnostic filter tree.
 *
 * <p>Implementations: {@link Condition}, {@link LogicalGroup}, {@link NotElement}, {@link NativeFilter}.
 * Store bindings render the tree to their native predicate form.</p>
 */
public interface QueryElement {
}
