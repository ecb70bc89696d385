package com.deepansh.gateway.core;

import com.deepansh.gateway.model.ChatRequest;
import com.deepansh.gateway.model.Message;
import com.deepansh.gateway.model.ToolCall;
import com.deepansh.gateway.tool.ToolResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversation of one loop turn. Owned by the thread running the turn and only
 * ever appended to: each tool round adds the assistant's call record followed by
 * one tool message per call.
 */
public class ConversationState {

    private final ChatRequest template;
    private final List<Message> messages;

    public ConversationState(ChatRequest template) {
        this.template = template;
        this.messages = new ArrayList<>(template.getMessages() != null ? template.getMessages() : List.of());
    }

    /** The request for the next round: the template with the conversation so far. */
    public ChatRequest nextRequest() {
        return template.toBuilder()
                .messages(new ArrayList<>(messages))
                .build();
    }

    public void appendToolRound(String assistantText, List<ToolCall> calls, List<ToolResult> results) {
        messages.add(Message.assistantToolCalls(
                assistantText == null || assistantText.isEmpty() ? null : assistantText, calls));
        for (ToolResult result : results) {
            messages.add(Message.toolResult(result.callId(), result.text()));
        }
    }
}
