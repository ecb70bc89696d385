package com.deepansh.gateway.llm;

import java.util.Locale;

/**
 * Backends reachable through the OpenAI-compatible chat-completions protocol.
 */
public enum ProviderKind {
    OPENAI("https://api.openai.com/v1", true),
    OLLAMA("https://ollama.com/v1", false),
    ZAI("https://api.z.ai/api/paas/v4", true),
    MISTRAL("https://api.mistral.ai/v1", true);

    private final String defaultBaseUrl;
    private final boolean apiKeyRequired;

    ProviderKind(String defaultBaseUrl, boolean apiKeyRequired) {
        this.defaultBaseUrl = defaultBaseUrl;
        this.apiKeyRequired = apiKeyRequired;
    }

    public String defaultBaseUrl() {
        return defaultBaseUrl;
    }

    public boolean apiKeyRequired() {
        return apiKeyRequired;
    }

    public static ProviderKind fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("provider kind is required");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown provider: " + name, e);
        }
    }
}
