package com.nevis.chat.infra;

import com.nevis.chat.model.ProviderRequest;
import com.nevis.chat.model.ProviderResponse;

/**
 * Sends one grounded conversation to an upstream model. Any failure surfaces as an unchecked exception.
 */
public interface ProviderClient {

    ProviderResponse chat(ProviderRequest request);
}
