package com.linlay.archinsight.insight;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.archinsight.conversation.ConversationOrchestrator;
import com.linlay.archinsight.conversation.IterationCallbacks;
import com.linlay.archinsight.llm.LlmCallException;
import com.linlay.archinsight.llm.ResilientLlmCaller;
import com.linlay.archinsight.parser.LlmJsonExtractor;
import com.linlay.archinsight.runtime.CancellationToken;
import com.linlay.archinsight.runtime.OrchestrationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Documentation pipeline: one call per file, one call per module rollup, then the bounded
 * iteration loop for product-level docs.
 */
public class DocumentationService {

    private static final Logger log = LoggerFactory.getLogger(DocumentationService.class);

    private final ResilientLlmCaller llmCaller;
    private final ConversationOrchestrator orchestrator;
    private final LlmJsonExtractor jsonExtractor;
    private final DocumentationAssembler assembler;
    private final ObjectMapper objectMapper;
    private final int defaultMaxIterations;

    public DocumentationService(
            ResilientLlmCaller llmCaller,
            ConversationOrchestrator orchestrator,
            LlmJsonExtractor jsonExtractor,
            DocumentationAssembler assembler,
            ObjectMapper objectMapper,
            int defaultMaxIterations
    ) {
        this.llmCaller = llmCaller;
        this.orchestrator = orchestrator;
        this.jsonExtractor = jsonExtractor;
        this.assembler = assembler;
        this.objectMapper = objectMapper;
        this.defaultMaxIterations = defaultMaxIterations > 0
                ? defaultMaxIterations
                : ArchitectureInsightService.DEFAULT_MAX_ITERATIONS;
    }

    public FileSummary summarizeFile(String provider, String file, String role, String prompt) {
        OrchestrationContext context = new OrchestrationContext(provider, CancellationToken.none());
        String content = llmCaller.call(context, List.of(new UserMessage(requirePrompt(prompt))));
        return assembler.toFileSummary(content, file, role);
    }

    /**
     * A failed generation call yields a {@link ModuleSummary#failed} placeholder so one module does
     * not sink the rollup of the others. Cancellation still propagates.
     */
    public ModuleSummary summarizeModule(
            String provider,
            String module,
            String moduleType,
            List<FileSummary> files,
            String prompt
    ) {
        OrchestrationContext context = new OrchestrationContext(provider, CancellationToken.none());
        log.info("[insight:{}] module rollup {} ({}), files={}", context.runId(), module, moduleType,
                files == null ? 0 : files.size());
        try {
            String content = llmCaller.call(context, List.of(new UserMessage(requirePrompt(prompt))));
            return assembler.toModuleSummary(content, module, moduleType, files);
        } catch (LlmCallException ex) {
            log.warn("[insight:{}] module summary for {} failed: {}", context.runId(), module, ex.getMessage());
            return ModuleSummary.failed(module, moduleType, files);
        }
    }

    public ProductDocumentation generateProductDocumentation(InsightRequest request) {
        return generateProductDocumentation(request, IterationCallbacks.NONE);
    }

    public ProductDocumentation generateProductDocumentation(InsightRequest request, IterationCallbacks callbacks) {
        OrchestrationContext context = new OrchestrationContext(request.provider(), request.cancellation());
        ObjectNode result = orchestrator.runIterations(
                context,
                request.maxIterations() > 0 ? request.maxIterations() : defaultMaxIterations,
                request::prompt,
                JsonReplyGeneration.of(llmCaller, jsonExtractor, objectMapper, context),
                callbacks
        );
        log.info("[insight:{}] product docs finished: {}", context.runId(), context.snapshot());
        return assembler.toProductDocumentation(result);
    }

    private static String requirePrompt(String prompt) {
        if (!StringUtils.hasText(prompt)) {
            throw new IllegalArgumentException("prompt must not be blank");
        }
        return prompt;
    }
}
