package com.linlay.archinsight.conversation;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.ai.chat.messages.Message;

import java.util.List;

/**
 * One generation round trip. The returned object may carry a {@code requests} array of
 * {@link ToolRequest} entries asking for more context.
 */
@FunctionalInterface
public interface GenerationCall {

    ObjectNode generate(List<Message> conversation);
}
