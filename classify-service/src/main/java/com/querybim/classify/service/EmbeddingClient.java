package com.querybim.classify.service;

import com.querybim.classify.model.Embedding;

import java.util.List;

public interface EmbeddingClient {
    /**
     * Embeds one provider-sized batch. Never throws: the returned list always has the
     * same length as {@code texts}, with {@link Embedding#failed()} for texts that could
     * not be embedded.
     */
    List<Embedding> embedBatch(List<String> texts);
}
