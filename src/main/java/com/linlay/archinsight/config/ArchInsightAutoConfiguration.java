package com.linlay.archinsight.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.archinsight.conversation.ConversationOrchestrator;
import com.linlay.archinsight.insight.ArchitectureInsightService;
import com.linlay.archinsight.insight.DocumentationAssembler;
import com.linlay.archinsight.insight.DocumentationService;
import com.linlay.archinsight.insight.InsightAssembler;
import com.linlay.archinsight.llm.ChatClientLlmGateway;
import com.linlay.archinsight.llm.LlmGateway;
import com.linlay.archinsight.llm.LlmGatewayRegistry;
import com.linlay.archinsight.llm.ResilientLlmCaller;
import com.linlay.archinsight.llm.ratelimit.RateLimitConfig;
import com.linlay.archinsight.llm.ratelimit.RateLimiter;
import com.linlay.archinsight.llm.retry.RetryExecutor;
import com.linlay.archinsight.llm.retry.RetryPolicy;
import com.linlay.archinsight.parser.LlmJsonExtractor;
import com.linlay.archinsight.parser.TolerantResponseParser;
import com.linlay.archinsight.runtime.Sleeper;
import com.linlay.archinsight.workspace.LocalWorkspaceFileAccess;
import com.linlay.archinsight.workspace.ToolResponseFormatter;
import com.linlay.archinsight.workspace.WorkspaceFileAccess;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;
import java.time.Clock;

@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
        "org.springframework.ai.model.chat.client.autoconfigure.ChatClientAutoConfiguration"
})
@EnableConfigurationProperties({
        LlmRetryProperties.class,
        RateLimitProperties.class,
        LlmGatewayProperties.class,
        InsightLoopProperties.class,
        InsightParserProperties.class,
        WorkspaceProperties.class
})
public class ArchInsightAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper insightObjectMapper() {
        return new ObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy insightRetryPolicy(LlmRetryProperties properties) {
        return properties.toPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryExecutor retryExecutor() {
        return new RetryExecutor(Sleeper.SYSTEM);
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimiter rateLimiter(RateLimitProperties properties) {
        RateLimiter rateLimiter = RateLimiter.withDefaults(Clock.systemUTC(), Sleeper.SYSTEM, properties.getBuffer());
        properties.getProviders().forEach((provider, limit) ->
                rateLimiter.configure(provider, new RateLimitConfig(limit.getMaxRequests(), limit.getWindow())));
        return rateLimiter;
    }

    @Bean
    @ConditionalOnBean(ChatClient.Builder.class)
    @ConditionalOnProperty(prefix = "insight.llm.gateway", name = "provider")
    public ChatClientLlmGateway chatClientLlmGateway(ChatClient.Builder chatClientBuilder, LlmGatewayProperties properties) {
        return new ChatClientLlmGateway(properties.getProvider(), chatClientBuilder.build(), properties.getSystemPrompt());
    }

    @Bean
    @ConditionalOnMissingBean
    public LlmGatewayRegistry llmGatewayRegistry(ObjectProvider<LlmGateway> gateways) {
        return new LlmGatewayRegistry(gateways.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public ResilientLlmCaller resilientLlmCaller(
            LlmGatewayRegistry gateways,
            RateLimiter rateLimiter,
            RetryExecutor retryExecutor,
            RetryPolicy insightRetryPolicy
    ) {
        return new ResilientLlmCaller(gateways, rateLimiter, retryExecutor, insightRetryPolicy);
    }

    @Bean
    @ConditionalOnMissingBean(WorkspaceFileAccess.class)
    public LocalWorkspaceFileAccess workspaceFileAccess(WorkspaceProperties properties) {
        return new LocalWorkspaceFileAccess(Path.of(properties.getRoot()), properties.getSkippedDirectories());
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolResponseFormatter toolResponseFormatter(InsightLoopProperties properties) {
        return new ToolResponseFormatter(properties.maxFileChars());
    }

    @Bean
    @ConditionalOnMissingBean
    public ConversationOrchestrator conversationOrchestrator(
            WorkspaceFileAccess fileAccess,
            ToolResponseFormatter formatter,
            ObjectMapper objectMapper,
            InsightLoopProperties properties
    ) {
        return new ConversationOrchestrator(
                fileAccess,
                formatter,
                objectMapper,
                properties.maxRequestsPerIteration(),
                properties.continuationPrompt(),
                properties.defaultGrepResults()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public TolerantResponseParser tolerantResponseParser(InsightParserProperties properties) {
        return new TolerantResponseParser(properties.toSettings());
    }

    @Bean
    @ConditionalOnMissingBean
    public LlmJsonExtractor llmJsonExtractor() {
        return new LlmJsonExtractor();
    }

    @Bean
    @ConditionalOnMissingBean
    public InsightAssembler insightAssembler(ObjectMapper objectMapper, TolerantResponseParser parser) {
        return new InsightAssembler(objectMapper, parser);
    }

    @Bean
    @ConditionalOnMissingBean
    public ArchitectureInsightService architectureInsightService(
            ResilientLlmCaller llmCaller,
            ConversationOrchestrator orchestrator,
            LlmJsonExtractor jsonExtractor,
            InsightAssembler assembler,
            ObjectMapper objectMapper,
            InsightLoopProperties properties
    ) {
        return new ArchitectureInsightService(
                llmCaller,
                orchestrator,
                jsonExtractor,
                assembler,
                objectMapper,
                properties.maxIterations()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentationAssembler documentationAssembler(
            ObjectMapper objectMapper,
            TolerantResponseParser parser,
            LlmJsonExtractor jsonExtractor
    ) {
        return new DocumentationAssembler(objectMapper, parser, jsonExtractor);
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentationService documentationService(
            ResilientLlmCaller llmCaller,
            ConversationOrchestrator orchestrator,
            LlmJsonExtractor jsonExtractor,
            DocumentationAssembler assembler,
            ObjectMapper objectMapper,
            InsightLoopProperties properties
    ) {
        return new DocumentationService(
                llmCaller,
                orchestrator,
                jsonExtractor,
                assembler,
                objectMapper,
                properties.maxIterations()
        );
    }
}
