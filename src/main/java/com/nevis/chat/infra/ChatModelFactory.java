package com.nevis.chat.infra;

import com.nevis.chat.model.ModelSpec;
import dev.langchain4j.model.chat.ChatModel;

@FunctionalInterface
public interface ChatModelFactory {

    ChatModel create(ModelSpec model, String apiKey, double temperature, int maxOutputTokens);
}
