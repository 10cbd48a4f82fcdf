package com.schemaops.advisory;

/**
 * Key pair for the two-argument advisory lock functions.
 * {@code key1} derives only from the namespace, {@code key2} only from the identifier.
 */
public record TwoPartKey(int key1, int key2) {
}
