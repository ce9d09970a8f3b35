package com.querybim.classify.model;

import java.util.List;

/**
 * One embedding vector, or the marker for a query the provider could not embed.
 */
public final class Embedding {
    private static final Embedding FAILED = new Embedding(List.of());

    private final List<Double> values;

    private Embedding(List<Double> values) {
        this.values = values;
    }

    public static Embedding of(List<Double> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("embedding must contain at least one value");
        }
        return new Embedding(List.copyOf(values));
    }

    public static Embedding failed() {
        return FAILED;
    }

    public boolean isPresent() {
        return this != FAILED;
    }

    public List<Double> values() {
        if (!isPresent()) {
            throw new IllegalStateException("embedding failed, no values available");
        }
        return values;
    }

    @Override
    public String toString() {
        return isPresent() ? "Embedding[dim=" + values.size() + "]" : "Embedding[failed]";
    }
}
