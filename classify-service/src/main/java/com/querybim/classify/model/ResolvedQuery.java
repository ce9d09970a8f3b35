package com.querybim.classify.model;

/**
 * A query with every optional field resolved: {@code requestId} falls back to the
 * zero-based position, {@code depth} to 2, and the Uniclass type filter is upper-cased.
 */
public record ResolvedQuery(int position, long requestId, String text, String uniclassType, int depth) {
}
