package com.nevis.chat.service;

import com.nevis.chat.model.ModelSpec;

import java.util.List;

public interface ModelCatalogService {

    /**
     * Models that can currently be served, ordered by provider then newest name first.
     */
    List<ModelSpec> catalog();

    /**
     * Resolves a requested model id against the catalog.
     *
     * @param requestedModelId {@code null} or blank selects the configured default
     * @throws com.nevis.chat.exception.ModelCatalogException when the catalog is empty
     * @throws com.nevis.chat.exception.InvalidTurnRequestException when the id is malformed or not offered
     */
    ModelSpec resolve(String requestedModelId);
}
