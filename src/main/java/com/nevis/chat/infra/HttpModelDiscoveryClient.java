package com.nevis.chat.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.nevis.chat.config.ProviderProperties;
import com.nevis.chat.model.ProviderId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Slf4j
@Component
public class HttpModelDiscoveryClient implements ModelDiscoveryClient {

    private static final List<String> OPENAI_EXCLUDED_FRAGMENTS = List.of(
        "audio", "transcribe", "tts", "realtime", "image", "search", "codex", "instruct");

    private final RestClient restClient;
    private final ProviderProperties providerProperties;

    public HttpModelDiscoveryClient(RestClient.Builder restClientBuilder, ProviderProperties providerProperties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(providerProperties.discoveryTimeout());
        requestFactory.setReadTimeout(providerProperties.discoveryTimeout());
        this.restClient = restClientBuilder.requestFactory(requestFactory).build();
        this.providerProperties = providerProperties;
    }

    @Override
    public List<String> listModels(ProviderId provider, String apiKey) {
        String baseUrl = providerProperties.baseUrl(provider);
        List<String> models = switch (provider) {
            case OPENAI -> listOpenAi(baseUrl, apiKey);
            case ANTHROPIC -> listAnthropic(baseUrl, apiKey);
            case GEMINI -> listGemini(baseUrl, apiKey);
        };
        log.debug("Discovered {} models for {}", models.size(), provider.wireName());
        return models;
    }

    private List<String> listOpenAi(String baseUrl, String apiKey) {
        JsonNode json = restClient.get()
            .uri(baseUrl + "/models")
            .header("Authorization", "Bearer " + apiKey)
            .retrieve()
            .body(JsonNode.class);

        List<String> ids = new ArrayList<>();
        for (JsonNode item : arrayField(json, "data")) {
            String id = item.path("id").asText("");
            if (id.startsWith("gpt-") && OPENAI_EXCLUDED_FRAGMENTS.stream().noneMatch(id::contains)) {
                ids.add(id);
            }
        }
        return dedupeAndSort(ids);
    }

    private List<String> listAnthropic(String baseUrl, String apiKey) {
        JsonNode json = restClient.get()
            .uri(baseUrl + "/v1/models")
            .header("x-api-key", apiKey)
            .header("anthropic-version", "2023-06-01")
            .retrieve()
            .body(JsonNode.class);

        List<String> ids = new ArrayList<>();
        for (JsonNode item : arrayField(json, "data")) {
            String id = item.path("id").asText("");
            if (id.startsWith("claude")) {
                ids.add(id);
            }
        }
        return dedupeAndSort(ids);
    }

    private List<String> listGemini(String baseUrl, String apiKey) {
        JsonNode json = restClient.get()
            .uri(baseUrl + "/models")
            .header("x-goog-api-key", apiKey)
            .retrieve()
            .body(JsonNode.class);

        List<String> ids = new ArrayList<>();
        for (JsonNode item : arrayField(json, "models")) {
            String name = item.path("name").asText("");
            if (!name.startsWith("models/") || !canGenerateContent(item)) {
                continue;
            }
            String apiModel = name.substring("models/".length()).trim();
            if (apiModel.startsWith("gemini")) {
                ids.add(apiModel);
            }
        }
        return dedupeAndSort(ids);
    }

    private static boolean canGenerateContent(JsonNode item) {
        JsonNode methods = item.path("supportedGenerationMethods");
        if (!methods.isArray() || methods.isEmpty()) {
            return true;
        }
        for (JsonNode method : methods) {
            if ("generatecontent".equals(method.asText("").toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static Iterable<JsonNode> arrayField(JsonNode json, String field) {
        if (json == null || !json.path(field).isArray()) {
            return List.of();
        }
        return json.path(field);
    }

    private static List<String> dedupeAndSort(List<String> ids) {
        Set<String> unique = new LinkedHashSet<>(ids);
        List<String> sorted = new ArrayList<>(unique);
        sorted.sort(Comparator.reverseOrder());
        return sorted;
    }
}
