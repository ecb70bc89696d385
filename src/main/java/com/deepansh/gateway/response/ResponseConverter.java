package com.deepansh.gateway.response;

import com.deepansh.gateway.model.ChatRequest;
import com.deepansh.gateway.model.ChatResponse;
import com.deepansh.gateway.model.ContentPart;
import com.deepansh.gateway.model.JsonSupport;
import com.deepansh.gateway.model.Message;
import com.deepansh.gateway.model.ResponseObject;
import com.deepansh.gateway.model.ResponseObject.OutputContent;
import com.deepansh.gateway.model.ResponseObject.OutputItem;
import com.deepansh.gateway.model.ResponseRequest;
import com.deepansh.gateway.model.ResponseStatus;
import com.deepansh.gateway.model.ToolCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps between the Responses protocol and chat completions.
 *
 * Accepted {@code input} shapes: a bare string (one user message), or a list of items:
 * <ul>
 *   <li>{@code message} (or a bare {@code {role, content}}), {@code user_message},
 *       {@code system_message}, {@code assistant_message}</li>
 *   <li>{@code function_call}: an earlier call by the model</li>
 *   <li>{@code function_call_output} / {@code tool_call_result}: the result of such a call</li>
 * </ul>
 * Other item types are skipped.
 */
@Component
@Slf4j
public class ResponseConverter {

    public ChatRequest toChatRequest(ResponseRequest request) {
        List<Message> messages = new ArrayList<>();
        if (request.getInstructions() != null && !request.getInstructions().isBlank()) {
            messages.add(Message.system(request.getInstructions()));
        }
        messages.addAll(toMessages(request.getInput()));
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("input must contain at least one message");
        }

        return ChatRequest.builder()
                .model(request.getModel())
                .messages(messages)
                .tools(request.getTools() != null && !request.getTools().isEmpty()
                        ? new ArrayList<>(request.getTools()) : null)
                .maxCompletionTokens(request.getMaxOutputTokens())
                .temperature(request.getTemperature())
                .topP(request.getTopP())
                .build();
    }

    public ResponseObject toResponseObject(ChatResponse chat, String id, String model, long createdAt) {
        List<OutputItem> output = new ArrayList<>();
        ChatResponse.Choice choice = chat.firstChoice();
        if (choice != null && choice.getMessage() != null) {
            Message message = choice.getMessage();
            output.add(messageItem(ResponseIds.newMessageItemId(), message.contentAsText()));
            if (message.getToolCalls() != null) {
                for (ToolCall call : message.getToolCalls()) {
                    output.add(functionCallItem(call));
                }
            }
        }

        return ResponseObject.builder()
                .id(id)
                .createdAt(createdAt)
                .status(ResponseStatus.completed)
                .model(model != null ? model : chat.getModel())
                .output(output)
                .usage(chat.getUsage() != null ? ResponseObject.ResponseUsage.from(chat.getUsage()) : null)
                .build();
    }

    /** A completed assistant message item holding one output_text part. */
    public static OutputItem messageItem(String itemId, String text) {
        List<OutputContent> content = new ArrayList<>();
        content.add(OutputContent.outputText(text));
        return OutputItem.builder()
                .id(itemId)
                .type(OutputItem.TYPE_MESSAGE)
                .role("assistant")
                .status(ResponseStatus.completed.name())
                .content(content)
                .build();
    }

    public static OutputItem functionCallItem(ToolCall call) {
        return OutputItem.builder()
                .id(call.getId())
                .type(OutputItem.TYPE_FUNCTION_CALL)
                .status(ResponseStatus.completed.name())
                .callId(call.getId())
                .name(call.getName())
                .arguments(JsonSupport.writeArguments(call.getArguments()))
                .build();
    }

    List<Message> toMessages(Object input) {
        List<Message> messages = new ArrayList<>();
        if (input == null) {
            return messages;
        }
        if (input instanceof String text) {
            messages.add(Message.user(text));
            return messages;
        }
        if (!(input instanceof List<?> items)) {
            throw new IllegalArgumentException("input must be a string or a list of items");
        }

        for (Object raw : items) {
            if (!(raw instanceof Map<?, ?> item)) {
                continue;
            }
            String type = stringValue(item, "type");
            if (type == null && item.containsKey("role")) {
                type = "message";
            }
            if (type == null) {
                continue;
            }
            switch (type) {
                case "message", "user_message", "system_message", "assistant_message" ->
                        messages.add(messageFrom(type, item));
                case "function_call" -> appendFunctionCall(messages, item);
                case "function_call_output", "tool_call_result" -> messages.add(toolResultFrom(item));
                default -> log.debug("Skipping input item of type {}", type);
            }
        }
        return messages;
    }

    private Message messageFrom(String type, Map<?, ?> item) {
        Message message = Message.builder().role(roleFor(type, stringValue(item, "role"))).build();
        Object content = item.get("content");
        if (content instanceof List<?> parts) {
            message.setParts(toParts(parts));
        } else {
            message.setText(content != null ? content.toString() : "");
        }
        return message;
    }

    /** Consecutive calls share one assistant message, as chat completions expects. */
    private void appendFunctionCall(List<Message> messages, Map<?, ?> item) {
        String callId = stringValue(item, "call_id");
        ToolCall call = ToolCall.builder()
                .id(callId != null ? callId : stringValue(item, "id"))
                .name(stringValue(item, "name"))
                .arguments(argumentsOf(item.get("arguments")))
                .build();

        Message last = messages.isEmpty() ? null : messages.get(messages.size() - 1);
        if (last != null && last.getRole() == Message.Role.assistant && last.hasToolCalls()) {
            last.getToolCalls().add(call);
        } else {
            messages.add(Message.assistantToolCalls(null, List.of(call)));
        }
    }

    private Message toolResultFrom(Map<?, ?> item) {
        String callId = stringValue(item, "call_id");
        if (callId == null) {
            callId = stringValue(item, "tool_call_id");
        }
        Object output = item.containsKey("output") ? item.get("output") : item.get("content");
        String text = output == null ? "" : output instanceof String s ? s : JsonSupport.write(output);
        return Message.toolResult(callId, text);
    }

    private List<ContentPart> toParts(List<?> rawParts) {
        List<ContentPart> parts = new ArrayList<>();
        for (Object raw : rawParts) {
            if (!(raw instanceof Map<?, ?> part)) {
                continue;
            }
            String type = stringValue(part, "type");
            if ("input_image".equals(type) || ContentPart.TYPE_IMAGE_URL.equals(type)) {
                Object url = part.get("image_url");
                if (url instanceof Map<?, ?> nested) {
                    parts.add(ContentPart.imageUrl(stringValue(nested, "url"), stringValue(nested, "detail")));
                } else if (url != null) {
                    parts.add(ContentPart.imageUrl(url.toString(), stringValue(part, "detail")));
                }
            } else {
                String text = stringValue(part, "text");
                if (text != null) {
                    parts.add(ContentPart.text(text));
                }
            }
        }
        return parts;
    }

    private Map<String, Object> argumentsOf(Object raw) {
        if (raw instanceof Map<?, ?>) {
            return JsonSupport.parseArguments(JsonSupport.write(raw));
        }
        return JsonSupport.parseArguments(raw != null ? raw.toString() : null);
    }

    private static Message.Role roleFor(String type, String role) {
        switch (type) {
            case "system_message":
                return Message.Role.system;
            case "assistant_message":
                return Message.Role.assistant;
            case "user_message":
                return Message.Role.user;
            default:
                if ("system".equals(role) || "developer".equals(role)) {
                    return Message.Role.system;
                }
                if ("assistant".equals(role)) {
                    return Message.Role.assistant;
                }
                return Message.Role.user;
        }
    }

    private static String stringValue(Map<?, ?> map, String key) {
        Object value = map.get(key);
        return value instanceof String s ? s : null;
    }
}
