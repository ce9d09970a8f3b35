package com.querybim.classify.service;

import java.util.ArrayList;
import java.util.List;

public final class QueryChunker {

    private QueryChunker() {
    }

    /**
     * Splits {@code items} into contiguous chunks of at most {@code maxChunkSize} elements.
     * Concatenating the chunks in order yields the input again.
     */
    public static <T> List<List<T>> chunk(List<T> items, int maxChunkSize) {
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("maxChunkSize must be positive, was " + maxChunkSize);
        }
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        List<List<T>> chunks = new ArrayList<>((items.size() + maxChunkSize - 1) / maxChunkSize);
        for (int start = 0; start < items.size(); start += maxChunkSize) {
            int end = Math.min(start + maxChunkSize, items.size());
            chunks.add(List.copyOf(items.subList(start, end)));
        }
        return chunks;
    }
}
