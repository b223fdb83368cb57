package com.nevis.chat.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.nevis.chat.config.ProviderProperties;
import com.nevis.chat.config.TurnProperties;
import com.nevis.chat.exception.InvalidTurnRequestException;
import com.nevis.chat.exception.ModelCatalogException;
import com.nevis.chat.infra.ModelDiscoveryClient;
import com.nevis.chat.model.ModelId;
import com.nevis.chat.model.ModelSpec;
import com.nevis.chat.model.ProviderId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
public class ModelCatalogServiceImpl implements ModelCatalogService {

    private static final Set<String> OPENAI_ALLOWED_MODELS = ModelPresets.forProvider(ProviderId.OPENAI).stream()
        .map(ModelSpec::apiModel)
        .collect(Collectors.toUnmodifiableSet());

    static final Duration DISCOVERY_FAILURE_TTL = Duration.ofSeconds(30);

    private final ModelDiscoveryClient discoveryClient;
    private final ProviderProperties providerProperties;
    private final TurnProperties turnProperties;

    private final Cache<String, List<String>> discoveryCache;
    // providers whose last discovery failed serve presets until the entry expires
    private final Cache<String, String> failedDiscovery;

    public ModelCatalogServiceImpl(ModelDiscoveryClient discoveryClient, ProviderProperties providerProperties,
                                   TurnProperties turnProperties) {
        this.discoveryClient = discoveryClient;
        this.providerProperties = providerProperties;
        this.turnProperties = turnProperties;
        this.discoveryCache = Caffeine.newBuilder()
            .expireAfterWrite(providerProperties.discoveryCacheTtl())
            .maximumSize(64)
            .build();
        this.failedDiscovery = Caffeine.newBuilder()
            .expireAfterWrite(DISCOVERY_FAILURE_TTL)
            .maximumSize(64)
            .build();
    }

    @Override
    public List<ModelSpec> catalog() {
        List<ModelSpec> entries = new ArrayList<>();
        for (ProviderId provider : ProviderId.values()) {
            Optional<String> houseKey = providerProperties.houseKey(provider);
            if (houseKey.isEmpty()) {
                if (turnProperties.allowClientKeyOverride()) {
                    entries.addAll(ModelPresets.forProvider(provider));
                }
                continue;
            }
            entries.addAll(providerCatalog(provider, houseKey.get()));
        }
        return dedupeAndSort(entries);
    }

    @Override
    public ModelSpec resolve(String requestedModelId) {
        List<ModelSpec> catalog = catalog();
        if (catalog.isEmpty()) {
            throw new ModelCatalogException(
                "No models are available. Configure at least one provider API key.", "no_models");
        }

        String requested = requestedModelId == null ? "" : requestedModelId.trim();
        if (!requested.isEmpty()) {
            if (ModelId.parse(requested).isEmpty()) {
                throw new InvalidTurnRequestException("Invalid model id: " + requested, "invalid_model_id");
            }
            return catalog.stream()
                .filter(model -> model.id().equals(requested))
                .findFirst()
                .orElseThrow(() -> new InvalidTurnRequestException(
                    "Unsupported model id: " + requested, "unsupported_model_id"));
        }

        return catalog.stream()
            .filter(model -> model.id().equals(turnProperties.defaultModelId()))
            .findFirst()
            .orElse(catalog.get(0));
    }

    private List<ModelSpec> providerCatalog(ProviderId provider, String apiKey) {
        if (!providerProperties.discoveryEnabled()) {
            return ModelPresets.forProvider(provider);
        }

        String cacheKey = provider.wireName() + ":" + fingerprint(apiKey);
        String lastFailure = failedDiscovery.getIfPresent(cacheKey);
        if (lastFailure != null) {
            log.debug("Discovery for {} failed recently ({}), using presets", provider.wireName(), lastFailure);
            return ModelPresets.forProvider(provider);
        }

        try {
            List<String> discovered = discoveryCache.get(cacheKey,
                key -> List.copyOf(discoveryClient.listModels(provider, apiKey)));
            if (provider == ProviderId.OPENAI) {
                discovered = discovered.stream().filter(OPENAI_ALLOWED_MODELS::contains).toList();
            }
            if (!discovered.isEmpty()) {
                return discovered.stream()
                    .map(apiModel -> ModelPresets.forDiscovered(provider, apiModel))
                    .toList();
            }
            log.debug("Discovery for {} returned no usable models, using presets", provider.wireName());
        } catch (RuntimeException e) {
            failedDiscovery.put(cacheKey, e.getClass().getSimpleName());
            log.warn("Model discovery failed for {}, using presets: {}", provider.wireName(), e.getMessage());
        }
        return ModelPresets.forProvider(provider);
    }

    private static List<ModelSpec> dedupeAndSort(List<ModelSpec> entries) {
        Map<String, ModelSpec> unique = new LinkedHashMap<>();
        for (ModelSpec entry : entries) {
            unique.putIfAbsent(entry.id(), entry);
        }
        List<ProviderId> order = Arrays.asList(ProviderId.values());
        return unique.values().stream()
            .sorted(Comparator.<ModelSpec>comparingInt(model -> order.indexOf(model.provider()))
                .thenComparing(ModelSpec::apiModel, Comparator.reverseOrder()))
            .toList();
    }

    private static String fingerprint(String apiKey) {
        return apiKey.length() + ":" + Integer.toHexString(apiKey.hashCode());
    }
}
