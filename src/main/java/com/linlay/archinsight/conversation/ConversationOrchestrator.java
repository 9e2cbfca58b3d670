package com.linlay.archinsight.conversation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.archinsight.runtime.CancellationToken;
import com.linlay.archinsight.runtime.OrchestrationContext;
import com.linlay.archinsight.workspace.FileResponse;
import com.linlay.archinsight.workspace.GrepResponse;
import com.linlay.archinsight.workspace.ToolResponseFormatter;
import com.linlay.archinsight.workspace.WorkspaceFileAccess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Drives the bounded "ask for more context" loop: generate, fulfil the file and search requests of
 * the reply, feed the results back, and repeat until the model stops asking or the iteration bound
 * is reached. Iterations run strictly one after another.
 * <p>
 * Failures of the generation call or of a fulfilment propagate and end the run; retrying is the
 * job of the call wrapper.
 */
public class ConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    public static final String REQUESTS_FIELD = "requests";
    public static final String DEFAULT_CONTINUATION_PROMPT =
            "Please provide your final analysis based on the additional information provided above.";
    public static final int DEFAULT_MAX_REQUESTS_PER_ITERATION = 5;

    private final WorkspaceFileAccess fileAccess;
    private final ToolResponseFormatter formatter;
    private final ObjectMapper objectMapper;
    private final int maxRequestsPerIteration;
    private final String continuationPrompt;
    private final int defaultGrepResults;

    public ConversationOrchestrator(
            WorkspaceFileAccess fileAccess,
            ToolResponseFormatter formatter,
            ObjectMapper objectMapper
    ) {
        this(fileAccess, formatter, objectMapper, DEFAULT_MAX_REQUESTS_PER_ITERATION, DEFAULT_CONTINUATION_PROMPT,
                ToolRequest.DEFAULT_GREP_RESULTS);
    }

    public ConversationOrchestrator(
            WorkspaceFileAccess fileAccess,
            ToolResponseFormatter formatter,
            ObjectMapper objectMapper,
            int maxRequestsPerIteration,
            String continuationPrompt,
            int defaultGrepResults
    ) {
        this.fileAccess = fileAccess;
        this.formatter = formatter;
        this.objectMapper = objectMapper;
        this.maxRequestsPerIteration = maxRequestsPerIteration > 0
                ? maxRequestsPerIteration
                : DEFAULT_MAX_REQUESTS_PER_ITERATION;
        this.continuationPrompt = StringUtils.hasText(continuationPrompt)
                ? continuationPrompt
                : DEFAULT_CONTINUATION_PROMPT;
        this.defaultGrepResults = defaultGrepResults > 0 ? defaultGrepResults : ToolRequest.DEFAULT_GREP_RESULTS;
    }

    public ObjectNode runIterations(
            int maxIterations,
            Supplier<String> initialPromptFactory,
            GenerationCall generationCall,
            IterationCallbacks callbacks
    ) {
        return runIterations(
                new OrchestrationContext("default", CancellationToken.none()),
                maxIterations,
                initialPromptFactory,
                generationCall,
                callbacks
        );
    }

    public ObjectNode runIterations(
            OrchestrationContext context,
            int maxIterations,
            Supplier<String> initialPromptFactory,
            GenerationCall generationCall,
            IterationCallbacks callbacks
    ) {
        if (initialPromptFactory == null || generationCall == null) {
            throw new IllegalArgumentException("initialPromptFactory and generationCall must not be null");
        }
        IterationCallbacks observers = callbacks == null ? IterationCallbacks.NONE : callbacks;
        ConversationState state = new ConversationState(maxIterations);
        ObjectNode finalResult = null;

        while (true) {
            int iteration = state.nextIteration();
            context.incrementIterations();
            log.debug("[insight:{}] iteration {}/{}", context.runId(), iteration, maxIterations);

            if (iteration == 1) {
                state.appendUser(initialPromptFactory.get());
            } else {
                state.appendUser(continuationPrompt);
            }

            observers.onIterationStart(iteration, maxIterations);
            context.cancellation().throwIfCancelled("generation call " + iteration);
            finalResult = generationCall.generate(state.turns());
            if (finalResult == null) {
                finalResult = objectMapper.createObjectNode();
            }
            observers.onIterationComplete(finalResult, iteration, maxIterations);

            List<JsonNode> rawRequests = rawRequests(finalResult);
            if (rawRequests.isEmpty() || state.exhausted()) {
                log.info("[insight:{}] completed after {} iteration(s)", context.runId(), iteration);
                break;
            }

            List<ToolRequest> requests = readRequests(context, rawRequests);
            context.incrementToolRequests(requests.size());
            log.info("[insight:{}] processing {} request(s) in iteration {}",
                    context.runId(), requests.size(), iteration);

            String additionalInfo = fulfil(context, requests);
            state.appendAssistant(serialize(finalResult));
            state.appendUser(additionalInfo);
        }

        finalResult.remove(REQUESTS_FIELD);
        return finalResult;
    }

    private List<JsonNode> rawRequests(ObjectNode result) {
        JsonNode requests = result.get(REQUESTS_FIELD);
        if (requests == null || !requests.isArray()) {
            return List.of();
        }
        List<JsonNode> entries = new ArrayList<>();
        requests.forEach(entries::add);
        return entries;
    }

    private List<ToolRequest> readRequests(OrchestrationContext context, List<JsonNode> rawRequests) {
        List<JsonNode> limited = rawRequests.subList(0, Math.min(maxRequestsPerIteration, rawRequests.size()));
        if (rawRequests.size() > limited.size()) {
            log.debug("[insight:{}] dropping {} request(s) above the per-iteration limit of {}",
                    context.runId(), rawRequests.size() - limited.size(), maxRequestsPerIteration);
        }
        List<ToolRequest> requests = new ArrayList<>();
        for (JsonNode raw : limited) {
            try {
                requests.add(objectMapper.treeToValue(raw, ToolRequest.class));
            } catch (JsonProcessingException ex) {
                log.warn("[insight:{}] ignoring malformed request {}: {}", context.runId(), raw, ex.getOriginalMessage());
            }
        }
        return requests;
    }

    private String fulfil(OrchestrationContext context, List<ToolRequest> requests) {
        List<String> paths = new ArrayList<>();
        List<ToolRequest.GrepRequest> searches = new ArrayList<>();
        for (ToolRequest request : requests) {
            if (request instanceof ToolRequest.FileRequest file) {
                paths.add(file.path());
            } else if (request instanceof ToolRequest.GrepRequest grep) {
                searches.add(grep);
            }
        }

        List<FileResponse> files = List.of();
        if (!paths.isEmpty()) {
            context.cancellation().throwIfCancelled("reading " + paths.size() + " file(s)");
            files = fileAccess.readFiles(paths);
        }
        List<GrepResponse> matches = new ArrayList<>();
        for (ToolRequest.GrepRequest search : searches) {
            context.cancellation().throwIfCancelled("searching for " + search.pattern());
            matches.add(fileAccess.grep(search.pattern(), search.filePattern(), search.effectiveMaxResults(defaultGrepResults)));
        }
        return formatter.format(files, matches);
    }

    private String serialize(ObjectNode result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize generation result", ex);
        }
    }
}
