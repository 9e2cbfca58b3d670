package com.linlay.archinsight.insight;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.archinsight.conversation.ConversationOrchestrator;
import com.linlay.archinsight.conversation.GenerationCall;
import com.linlay.archinsight.conversation.IterationCallbacks;
import com.linlay.archinsight.llm.ResilientLlmCaller;
import com.linlay.archinsight.parser.LlmJsonExtractor;
import com.linlay.archinsight.runtime.CancellationToken;
import com.linlay.archinsight.runtime.OrchestrationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

public class ArchitectureInsightService {

    private static final Logger log = LoggerFactory.getLogger(ArchitectureInsightService.class);

    public static final int DEFAULT_MAX_ITERATIONS = 3;

    private final ResilientLlmCaller llmCaller;
    private final ConversationOrchestrator orchestrator;
    private final LlmJsonExtractor jsonExtractor;
    private final InsightAssembler assembler;
    private final ObjectMapper objectMapper;
    private final int defaultMaxIterations;

    public ArchitectureInsightService(
            ResilientLlmCaller llmCaller,
            ConversationOrchestrator orchestrator,
            LlmJsonExtractor jsonExtractor,
            InsightAssembler assembler,
            ObjectMapper objectMapper,
            int defaultMaxIterations
    ) {
        this.llmCaller = llmCaller;
        this.orchestrator = orchestrator;
        this.jsonExtractor = jsonExtractor;
        this.assembler = assembler;
        this.objectMapper = objectMapper;
        this.defaultMaxIterations = defaultMaxIterations > 0 ? defaultMaxIterations : DEFAULT_MAX_ITERATIONS;
    }

    public ArchitectureInsights generateInsights(InsightRequest request) {
        return generateInsights(request, IterationCallbacks.NONE);
    }

    public ArchitectureInsights generateInsights(InsightRequest request, IterationCallbacks callbacks) {
        OrchestrationContext context = new OrchestrationContext(request.provider(), request.cancellation());
        ArchitectureInsights insights = run(context, request, callbacks);
        log.info("[insight:{}] finished: {}", context.runId(), context.snapshot());
        return insights;
    }

    /**
     * Runs the analysis on a worker thread and reports each iteration as it happens. Cancelling
     * the subscription cancels the run at its next suspension point.
     */
    public Flux<InsightEvent> streamInsights(InsightRequest request) {
        return Flux.<InsightEvent>create(sink -> {
            CancellationToken token = request.cancellation() == CancellationToken.none()
                    ? CancellationToken.create()
                    : request.cancellation();
            sink.onCancel(() -> {
                if (!token.isCancelled()) {
                    token.cancel("subscriber cancelled");
                }
            });
            OrchestrationContext context = new OrchestrationContext(request.provider(), token);

            IterationCallbacks progress = new IterationCallbacks() {
                @Override
                public void onIterationStart(int iteration, int maxIterations) {
                    emit(sink, InsightEvent.iterationStarted(iteration, maxIterations));
                }

                @Override
                public void onIterationComplete(ObjectNode result, int iteration, int maxIterations) {
                    emit(sink, InsightEvent.iterationCompleted(iteration, maxIterations));
                }
            };

            try {
                ArchitectureInsights insights = run(context, request, progress);
                emit(sink, InsightEvent.completed(insights, context.snapshot()));
                if (!sink.isCancelled()) {
                    sink.complete();
                }
            } catch (RuntimeException ex) {
                log.warn("[insight:{}] analysis failed", context.runId(), ex);
                if (!sink.isCancelled()) {
                    sink.error(ex);
                }
            }
        }, FluxSink.OverflowStrategy.BUFFER).subscribeOn(Schedulers.boundedElastic());
    }

    public ProductPurposeAnalysis analyzeProductPurpose(InsightRequest request) {
        OrchestrationContext context = new OrchestrationContext(request.provider(), request.cancellation());
        ObjectNode result = orchestrator.runIterations(
                context,
                maxIterations(request),
                request::prompt,
                generationCall(context),
                IterationCallbacks.NONE
        );
        return assembler.toProductPurpose(result);
    }

    private ArchitectureInsights run(OrchestrationContext context, InsightRequest request, IterationCallbacks callbacks) {
        ObjectNode result = orchestrator.runIterations(
                context,
                maxIterations(request),
                request::prompt,
                generationCall(context),
                callbacks
        );
        ArchitectureInsights insights = assembler.toArchitectureInsights(result);
        if (!insights.warnings().isEmpty()) {
            log.warn("[insight:{}] {} parse warning(s)", context.runId(), insights.warnings().size());
        }
        return insights;
    }

    private GenerationCall generationCall(OrchestrationContext context) {
        return JsonReplyGeneration.of(llmCaller, jsonExtractor, objectMapper, context);
    }

    private int maxIterations(InsightRequest request) {
        return request.maxIterations() > 0 ? request.maxIterations() : defaultMaxIterations;
    }

    private void emit(FluxSink<InsightEvent> sink, InsightEvent event) {
        if (!sink.isCancelled()) {
            sink.next(event);
        }
    }
}
