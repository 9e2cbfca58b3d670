package com.linlay.archinsight.llm;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class LlmGatewayRegistry {

    private final Map<String, LlmGateway> gateways = new LinkedHashMap<>();

    public LlmGatewayRegistry(List<LlmGateway> gateways) {
        if (gateways == null) {
            return;
        }
        for (LlmGateway gateway : gateways) {
            if (gateway == null) {
                continue;
            }
            LlmGateway previous = this.gateways.putIfAbsent(gateway.provider(), gateway);
            if (previous != null) {
                throw new IllegalStateException("Duplicate gateway for provider: " + gateway.provider());
            }
        }
    }

    public LlmGateway require(String provider) {
        LlmGateway gateway = gateways.get(provider);
        if (gateway == null) {
            throw new IllegalStateException(provider + " gateway is not configured");
        }
        return gateway;
    }

    public Set<String> providers() {
        return Set.copyOf(gateways.keySet());
    }
}
