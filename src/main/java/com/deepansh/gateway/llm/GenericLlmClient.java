package com.deepansh.gateway.llm;

import com.deepansh.gateway.accumulate.TokenCounter;
import com.deepansh.gateway.config.GatewayProperties;
import com.deepansh.gateway.context.CancellationToken;
import com.deepansh.gateway.context.ExecutionContext;
import com.deepansh.gateway.context.Suspensions;
import com.deepansh.gateway.model.ChatChunk;
import com.deepansh.gateway.model.ChatRequest;
import com.deepansh.gateway.model.ChatResponse;
import com.deepansh.gateway.stream.ChatStream;
import com.deepansh.gateway.stream.EventStream;
import com.deepansh.gateway.stream.SseLineDecoder;
import com.deepansh.gateway.stream.StreamException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;

/**
 * Client for any backend speaking the OpenAI chat-completions protocol
 * (OpenAI, Ollama, Mistral, Z.AI).
 *
 * Error handling:
 *
 * | Situation                   | Result                                          |
 * |-----------------------------|-------------------------------------------------|
 * | 4xx / 5xx with error body   | ProviderException carrying type, code, param    |
 * | 4xx / 5xx, unparsable body  | ProviderException type "unknown", raw body      |
 * | network error               | ResourceAccessException from RestClient         |
 * | no usage in the response    | usage estimated locally with TokenCounter       |
 *
 * Nothing is retried here.
 */
@Slf4j
public class GenericLlmClient implements ProviderCompleter {

    private static final String COMPLETIONS_PATH = "/chat/completions";

    private final ProviderKind kind;
    private final GatewayProperties.Provider props;
    private final ObjectMapper objectMapper;
    private final ExecutorService ioExecutor;
    private final int bufferCapacity;
    private final RestClient restClient;

    public GenericLlmClient(ProviderKind kind,
                            GatewayProperties.Provider props,
                            ObjectMapper objectMapper,
                            RestClient.Builder restClientBuilder,
                            ExecutorService ioExecutor,
                            int bufferCapacity) {
        this.kind = kind;
        this.props = props;
        this.objectMapper = objectMapper;
        this.ioExecutor = ioExecutor;
        this.bufferCapacity = bufferCapacity;

        String baseUrl = props.getBaseUrl() == null || props.getBaseUrl().isBlank()
                ? kind.defaultBaseUrl() : props.getBaseUrl();
        RestClient.Builder builder = restClientBuilder
                .baseUrl(stripTrailingSlash(baseUrl))
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE);
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + props.getApiKey());
        }
        this.restClient = builder.build();
    }

    @Override
    public ChatResponse complete(ExecutionContext ctx, ChatRequest request) {
        ChatRequest wire = toWireRequest(request, false);
        log.debug("Sending {} messages to {} [model={}]", wire.getMessages().size(), kind, wire.getModel());

        ChatResponse response = Suspensions.await(ctx, ioExecutor, () -> restClient.post()
                .uri(COMPLETIONS_PATH)
                .body(wire)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw toProviderException(res.getStatusCode().value(), readBody(res.getBody()));
                })
                .body(ChatResponse.class));

        if (response == null || response.getChoices() == null || response.getChoices().isEmpty()) {
            throw ProviderException.serverError(kind + " returned no choices in response");
        }

        if (response.getUsage() == null || response.getUsage().isEmpty()) {
            TokenCounter counter = new TokenCounter();
            counter.addPromptMessages(wire.getMessages());
            counter.addCompletionMessage(response.firstMessage());
            response.setUsage(counter.injectIfMissing(response.getUsage()));
            log.debug("{} sent no usage, estimated {}", kind, response.getUsage());
        }
        log.debug("{} finish_reason: {}", kind,
                response.firstChoice() != null ? response.firstChoice().getFinishReason() : null);
        return response;
    }

    @Override
    public ChatStream streamComplete(ExecutionContext ctx, ChatRequest request) {
        ChatRequest wire = toWireRequest(request, true);
        log.debug("Streaming {} messages to {} [model={}]", wire.getMessages().size(), kind, wire.getModel());

        return ChatStream.start(ctx, ioExecutor, bufferCapacity, (producerCtx, sink) ->
                restClient.post()
                        .uri(COMPLETIONS_PATH)
                        .accept(MediaType.TEXT_EVENT_STREAM)
                        .body(wire)
                        .exchange((req, res) -> {
                            if (res.getStatusCode().isError()) {
                                throw toProviderException(res.getStatusCode().value(), readBody(res.getBody()));
                            }
                            pump(producerCtx.cancellation(), res, wire, sink);
                            return null;
                        }));
    }

    /** Reads SSE chunks until [DONE], the end of the body, or cancellation. */
    private void pump(CancellationToken token, ClientHttpResponse res, ChatRequest wire,
                      EventStream.Sink<ChatChunk> sink) throws IOException {
        TokenCounter counter = new TokenCounter();
        counter.addPromptMessages(wire.getMessages());
        boolean usageSeen = false;
        ChatChunk last = null;

        // closing the response unblocks a read stuck on the socket
        try (CancellationToken.Registration ignored = token.onCancel(res::close);
             SseLineDecoder decoder = new SseLineDecoder(res.getBody())) {
            String data;
            while ((data = decoder.nextData()) != null) {
                token.throwIfCancelled();
                ChatChunk chunk = parseChunk(data);
                if (chunk == null) {
                    continue;
                }
                if (chunk.getUsage() != null && !chunk.getUsage().isEmpty()) {
                    usageSeen = true;
                }
                if (chunk.getChoices() != null) {
                    chunk.getChoices().forEach(c -> counter.addCompletionDelta(c.getDelta()));
                }
                last = chunk;
                if (!sink.emit(chunk)) {
                    return;
                }
            }
        } catch (IOException e) {
            token.throwIfCancelled();
            throw new StreamException("streaming error: " + e.getMessage(), e);
        }

        if (!usageSeen && last != null) {
            sink.emit(ChatChunk.usageOnly(last.getId(), last.getModel(), last.getCreated(), counter.usage()));
        }
    }

    private ChatChunk parseChunk(String data) {
        try {
            JsonNode node = objectMapper.readTree(data);
            if (node.has("error")) {
                throw toProviderException(500, data);
            }
            return objectMapper.treeToValue(node, ChatChunk.class);
        } catch (JsonProcessingException e) {
            log.warn("Skipping unparsable chunk from {}: {}", kind, e.getOriginalMessage());
            return null;
        }
    }

    private ChatRequest toWireRequest(ChatRequest request, boolean stream) {
        ChatRequest.ChatRequestBuilder wire = request.toBuilder()
                .stream(stream ? Boolean.TRUE : null)
                .streamOptions(stream ? new ChatRequest.StreamOptions(true) : null);
        if (request.getModel() == null || request.getModel().isBlank()) {
            wire.model(props.getModel());
        }
        if (request.getMaxTokens() == null && request.getMaxCompletionTokens() == null && props.getMaxTokens() > 0) {
            wire.maxTokens(props.getMaxTokens());
        }
        if (request.getTemperature() == null && props.getTemperature() > 0) {
            wire.temperature(props.getTemperature());
        }
        if (request.hasTools() && request.getToolChoice() == null) {
            wire.toolChoice("auto");
        }
        return wire.build();
    }

    /**
     * Maps an error body in the {@code {"error": {...}}} envelope to a ProviderException.
     * Bodies that do not parse keep their raw text as the message.
     */
    ProviderException toProviderException(int status, String body) {
        log.error("{} error [{}]: {}", kind, status, body);
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isObject()) {
                return new ProviderException(status,
                        textOrNull(error, "type"),
                        textOrNull(error, "message"),
                        textOrNull(error, "code"),
                        textOrNull(error, "param"));
            }
            if (error.isTextual()) {
                return new ProviderException(status, "unknown", error.asText(), null, null);
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
        }
        return new ProviderException(status, "unknown", body, null, null);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String readBody(InputStream body) throws IOException {
        return new String(body.readAllBytes(), StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
