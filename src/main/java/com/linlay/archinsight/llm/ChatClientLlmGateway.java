package com.linlay.archinsight.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * {@link LlmGateway} backed by a Spring AI {@link ChatClient}.
 */
public class ChatClientLlmGateway implements LlmGateway {

    private static final Logger log = LoggerFactory.getLogger(ChatClientLlmGateway.class);

    private final String provider;
    private final ChatClient chatClient;
    private final String systemPrompt;

    public ChatClientLlmGateway(String provider, ChatClient chatClient, String systemPrompt) {
        if (!StringUtils.hasText(provider)) {
            throw new IllegalArgumentException("provider must not be blank");
        }
        if (chatClient == null) {
            throw new IllegalArgumentException("chatClient must not be null");
        }
        this.provider = provider.trim();
        this.chatClient = chatClient;
        this.systemPrompt = systemPrompt;
    }

    @Override
    public String provider() {
        return provider;
    }

    @Override
    public String generate(List<Message> conversation) {
        ChatResponse response;
        try {
            ChatClient.ChatClientRequestSpec request = chatClient.prompt();
            if (StringUtils.hasText(systemPrompt)) {
                request = request.system(systemPrompt);
            }
            response = request.messages(conversation == null ? List.of() : conversation)
                    .call()
                    .chatResponse();
        } catch (LlmCallException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw translate(ex);
        }

        logUsage(response);
        String content = response != null && response.getResult() != null && response.getResult().getOutput() != null
                ? response.getResult().getOutput().getText()
                : null;
        if (!StringUtils.hasText(content)) {
            throw new LlmCallException("Empty or null content in " + provider + " response", "empty_response", null);
        }
        return content;
    }

    LlmCallException translate(RuntimeException ex) {
        String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        if (ex instanceof WebClientResponseException webError) {
            return new LlmCallException(message, null, webError.getStatusCode().value(), ex);
        }
        if (ex instanceof RestClientResponseException restError) {
            return new LlmCallException(message, null, restError.getStatusCode().value(), ex);
        }
        return new LlmCallException(message, transportCode(ex), null, ex);
    }

    private String transportCode(Throwable error) {
        Throwable cause = error;
        while (cause != null) {
            if (cause instanceof SocketTimeoutException || cause instanceof TimeoutException) {
                return "ETIMEDOUT";
            }
            if (cause instanceof UnknownHostException) {
                return "ENOTFOUND";
            }
            if (cause instanceof IOException) {
                return "ECONNRESET";
            }
            cause = cause.getCause();
        }
        return null;
    }

    private void logUsage(ChatResponse response) {
        if (response == null || response.getMetadata() == null || response.getMetadata().getUsage() == null) {
            return;
        }
        Integer total = response.getMetadata().getUsage().getTotalTokens();
        if (total != null && total > 0) {
            log.debug("{}: +{} tokens (model={})", provider, total, response.getMetadata().getModel());
        }
    }
}
