package com.linlay.archinsight.insight;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.archinsight.conversation.GenerationCall;
import com.linlay.archinsight.llm.ResilientLlmCaller;
import com.linlay.archinsight.parser.LlmJsonExtractor;
import com.linlay.archinsight.runtime.OrchestrationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link GenerationCall} over the resilient caller. A reply without a JSON object is kept whole
 * under {@link InsightAssembler#RAW_CONTENT_FIELD}.
 */
final class JsonReplyGeneration {

    private static final Logger log = LoggerFactory.getLogger(JsonReplyGeneration.class);

    private JsonReplyGeneration() {
    }

    static GenerationCall of(
            ResilientLlmCaller llmCaller,
            LlmJsonExtractor jsonExtractor,
            ObjectMapper objectMapper,
            OrchestrationContext context
    ) {
        return turns -> {
            String content = llmCaller.call(context, turns);
            return jsonExtractor.extractObject(content).orElseGet(() -> {
                log.debug("[insight:{}] reply carries no JSON object, keeping it as raw text", context.runId());
                ObjectNode raw = objectMapper.createObjectNode();
                raw.put(InsightAssembler.RAW_CONTENT_FIELD, content);
                return raw;
            });
        };
    }
}
