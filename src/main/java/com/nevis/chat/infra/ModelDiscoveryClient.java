package com.nevis.chat.infra;

import com.nevis.chat.model.ProviderId;

import java.util.List;

public interface ModelDiscoveryClient {

    /**
     * Lists the api model names the provider currently serves for this key, newest first.
     */
    List<String> listModels(ProviderId provider, String apiKey);
}
