package com.linlay.archinsight.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Registers a gateway over the application's Spring AI {@code ChatClient} when {@code provider}
 * is set.
 */
@ConfigurationProperties(prefix = "insight.llm.gateway")
public class LlmGatewayProperties {

    private String provider;
    private String systemPrompt;

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }
}
