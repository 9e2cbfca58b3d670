package com.linlay.archinsight.llm;

import org.springframework.ai.chat.messages.Message;

import java.util.List;

/**
 * A single text-generation provider. Implementations throw {@link LlmCallException} so that retry
 * classification sees the provider's code and status.
 */
public interface LlmGateway {

    String provider();

    String generate(List<Message> conversation);
}
