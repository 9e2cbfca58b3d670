package com.linlay.archinsight.insight;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.archinsight.conversation.ConversationOrchestrator;
import com.linlay.archinsight.llm.LlmCallException;
import com.linlay.archinsight.llm.LlmGateway;
import com.linlay.archinsight.llm.LlmGatewayRegistry;
import com.linlay.archinsight.llm.ResilientLlmCaller;
import com.linlay.archinsight.llm.ratelimit.RateLimiter;
import com.linlay.archinsight.llm.retry.RetryExecutor;
import com.linlay.archinsight.llm.retry.RetryPolicy;
import com.linlay.archinsight.parser.LlmJsonExtractor;
import com.linlay.archinsight.parser.TolerantResponseParser;
import com.linlay.archinsight.runtime.MutableClock;
import com.linlay.archinsight.runtime.RecordingSleeper;
import com.linlay.archinsight.workspace.FileResponse;
import com.linlay.archinsight.workspace.ToolResponseFormatter;
import com.linlay.archinsight.workspace.WorkspaceFileAccess;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.Message;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ArchitectureInsightServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final LlmGateway gateway = mock(LlmGateway.class);
    private final WorkspaceFileAccess fileAccess = mock(WorkspaceFileAccess.class);
    private final MutableClock clock = new MutableClock(0L);
    private final RecordingSleeper sleeper = new RecordingSleeper(clock);

    private ArchitectureInsightService service() {
        when(gateway.provider()).thenReturn("claude");
        ResilientLlmCaller caller = new ResilientLlmCaller(
                new LlmGatewayRegistry(List.of(gateway)),
                RateLimiter.withDefaults(clock, sleeper, RateLimiter.DEFAULT_BUFFER),
                new RetryExecutor(sleeper),
                RetryPolicy.DEFAULT
        );
        ConversationOrchestrator orchestrator =
                new ConversationOrchestrator(fileAccess, new ToolResponseFormatter(5000), objectMapper);
        return new ArchitectureInsightService(
                caller,
                orchestrator,
                new LlmJsonExtractor(),
                new InsightAssembler(objectMapper, new TolerantResponseParser()),
                objectMapper,
                3
        );
    }

    @Test
    void generateInsightsShouldFulfilRequestsThenMapFinalJson() {
        ArchitectureInsightService service = service();
        when(fileAccess.readFiles(anyList())).thenReturn(List.of(new FileResponse("src/main.ts", "boot()", 1, true)));
        List<List<Message>> seen = new ArrayList<>();
        when(gateway.generate(anyList())).thenAnswer(invocation -> {
            seen.add(invocation.getArgument(0));
            return seen.size() == 1
                    ? "I need more context.\n```json\n{\"requests\":[{\"type\":\"file\",\"path\":\"src/main.ts\"}]}\n```"
                    : "{\"overallAssessment\":\"Single entry point.\",\"strengths\":[\"Simple\"]}";
        });

        ArchitectureInsights insights = service.generateInsights(new InsightRequest("claude", "Analyze this repo"));

        assertThat(insights.overallAssessment()).isEqualTo("Single entry point.");
        assertThat(insights.strengths()).containsExactly("Simple");
        assertThat(seen).hasSize(2);
        assertThat(seen.get(1)).hasSize(4);
        verify(fileAccess).readFiles(List.of("src/main.ts"));
    }

    @Test
    void proseReplyShouldBeParsed() {
        ArchitectureInsightService service = service();
        when(gateway.generate(anyList())).thenReturn("""
                ## Overall Assessment
                Reasonable layering with a few leaks.

                ## Strengths
                - Typed boundaries between modules
                """);

        ArchitectureInsights insights = service.generateInsights(new InsightRequest("claude", "Analyze"));

        assertThat(insights.overallAssessment()).isEqualTo("Reasonable layering with a few leaks.");
        assertThat(insights.strengths()).containsExactly("Typed boundaries between modules");
        assertThat(insights.rawContent()).contains("## Strengths");
    }

    @Test
    void transientFailureShouldBeRetriedInsideOneIteration() {
        ArchitectureInsightService service = service();
        when(gateway.generate(anyList()))
                .thenThrow(new LlmCallException("overloaded", "overloaded_error", 503))
                .thenReturn("{\"overallAssessment\":\"fine\"}");

        ArchitectureInsights insights = service.generateInsights(new InsightRequest("claude", "Analyze"));

        assertThat(insights.overallAssessment()).isEqualTo("fine");
        assertThat(sleeper.sleepMillis()).containsExactly(1000L);
    }

    @Test
    void fatalFailureShouldPropagate() {
        ArchitectureInsightService service = service();
        when(gateway.generate(anyList())).thenThrow(new LlmCallException("invalid x-api-key", "authentication_error", 401));

        assertThatThrownBy(() -> service.generateInsights(new InsightRequest("claude", "Analyze")))
                .isInstanceOf(LlmCallException.class)
                .hasMessage("invalid x-api-key");
    }

    @Test
    void streamShouldEmitProgressThenCompletion() {
        ArchitectureInsightService service = service();
        when(fileAccess.readFiles(anyList())).thenReturn(List.of());
        when(gateway.generate(anyList()))
                .thenReturn("{\"requests\":[{\"type\":\"file\",\"path\":\"a.ts\"}]}")
                .thenReturn("{\"overallAssessment\":\"done\"}");

        List<InsightEvent> events = service.streamInsights(new InsightRequest("claude", "Analyze", 2, null))
                .collectList()
                .block(Duration.ofSeconds(5));

        assertThat(events).extracting(InsightEvent::type).containsExactly(
                InsightEvent.Type.ITERATION_STARTED,
                InsightEvent.Type.ITERATION_COMPLETED,
                InsightEvent.Type.ITERATION_STARTED,
                InsightEvent.Type.ITERATION_COMPLETED,
                InsightEvent.Type.COMPLETED
        );
        InsightEvent last = events.get(events.size() - 1);
        assertThat(last.insights().overallAssessment()).isEqualTo("done");
        assertThat(last.stats().modelCalls()).isEqualTo(2);
        assertThat(last.stats().toolRequests()).isEqualTo(1);
    }

    @Test
    void streamShouldSurfaceErrors() {
        ArchitectureInsightService service = service();
        when(gateway.generate(anyList())).thenThrow(new LlmCallException("bad request", null, 400));

        assertThatThrownBy(() -> service.streamInsights(new InsightRequest("claude", "Analyze"))
                .collectList()
                .block(Duration.ofSeconds(5)))
                .isInstanceOf(LlmCallException.class)
                .hasMessage("bad request");
    }

    @Test
    void productPurposeShouldUseSameLoop() {
        ArchitectureInsightService service = service();
        when(gateway.generate(anyList())).thenReturn(
                "{\"productPurpose\":\"Explain repositories\",\"contextualFactors\":[\"VS Code extension\"]}");

        ProductPurposeAnalysis analysis = service.analyzeProductPurpose(new InsightRequest("claude", "Why?"));

        assertThat(analysis.productPurpose()).isEqualTo("Explain repositories");
        assertThat(analysis.contextualFactors()).containsExactly("VS Code extension");
    }

    @Test
    void requestShouldValidateInputs() {
        assertThatThrownBy(() -> new InsightRequest(" ", "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InsightRequest("claude", "")).isInstanceOf(IllegalArgumentException.class);
        assertThat(new InsightRequest("claude", "x", -4, null).maxIterations()).isZero();
    }
}
