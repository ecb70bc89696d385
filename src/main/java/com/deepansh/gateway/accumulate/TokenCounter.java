package com.deepansh.gateway.accumulate;

import com.deepansh.gateway.model.ChatChunk;
import com.deepansh.gateway.model.ContentPart;
import com.deepansh.gateway.model.JsonSupport;
import com.deepansh.gateway.model.Message;
import com.deepansh.gateway.model.ToolCall;
import com.deepansh.gateway.model.Usage;

import java.util.List;

/**
 * Running usage estimate for one request, for backends that omit token counts.
 */
public class TokenCounter {

    /** Conversation framing added once per prompt */
    static final int CHAT_TEMPLATE_OVERHEAD = 4;
    /** Role markers and separators around each message */
    static final int PER_MESSAGE_OVERHEAD = 3;
    /** Flat cost of an image part */
    static final int IMAGE_TOKENS = 85;

    private int promptTokens;
    private int completionTokens;

    public void addPromptMessages(List<Message> messages) {
        promptTokens += CHAT_TEMPLATE_OVERHEAD;
        if (messages == null) {
            return;
        }
        for (Message msg : messages) {
            if (msg.getRole() != null) {
                promptTokens += TokenEstimator.estimate(msg.getRole().name());
            }
            promptTokens += contentTokens(msg);
            promptTokens += toolCallTokens(msg.getToolCalls());
            promptTokens += PER_MESSAGE_OVERHEAD;
        }
    }

    public void addPromptText(String text) {
        promptTokens += TokenEstimator.estimate(text);
    }

    public void addCompletionText(String text) {
        completionTokens += TokenEstimator.estimate(text);
    }

    public void addCompletionMessage(Message msg) {
        if (msg == null) {
            return;
        }
        completionTokens += contentTokens(msg);
        completionTokens += toolCallTokens(msg.getToolCalls());
    }

    public void addCompletionDelta(ChatChunk.Delta delta) {
        if (delta == null) {
            return;
        }
        completionTokens += TokenEstimator.estimate(delta.getContent());
        completionTokens += TokenEstimator.estimate(delta.getReasoningContent());
        if (delta.getToolCalls() != null) {
            for (ChatChunk.ToolCallDelta call : delta.getToolCalls()) {
                if (call.getFunction() != null) {
                    completionTokens += TokenEstimator.estimate(call.getFunction().getName());
                    completionTokens += TokenEstimator.estimate(call.getFunction().getArguments());
                }
            }
        }
    }

    public Usage usage() {
        return new Usage(promptTokens, completionTokens);
    }

    /** The reported usage when the backend sent real counts, otherwise this estimate. */
    public Usage injectIfMissing(Usage reported) {
        if (reported == null || reported.isEmpty()) {
            return usage();
        }
        return reported;
    }

    public void reset() {
        promptTokens = 0;
        completionTokens = 0;
    }

    private static int contentTokens(Message msg) {
        if (msg.getParts() == null) {
            return TokenEstimator.estimate(msg.getText());
        }
        int tokens = 0;
        for (ContentPart part : msg.getParts()) {
            if (part.getText() != null) {
                tokens += TokenEstimator.estimate(part.getText());
            }
            if (part.isImage()) {
                tokens += IMAGE_TOKENS;
            }
        }
        return tokens;
    }

    private static int toolCallTokens(List<ToolCall> calls) {
        if (calls == null) {
            return 0;
        }
        int tokens = 0;
        for (ToolCall call : calls) {
            tokens += TokenEstimator.estimate(call.getName());
            if (call.getArguments() != null && !call.getArguments().isEmpty()) {
                tokens += TokenEstimator.estimate(JsonSupport.writeArguments(call.getArguments()));
            }
        }
        return tokens;
    }
}
