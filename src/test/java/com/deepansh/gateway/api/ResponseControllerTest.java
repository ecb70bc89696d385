package com.deepansh.gateway.api;

import com.deepansh.gateway.context.CancellableContext;
import com.deepansh.gateway.exception.GlobalExceptionHandler;
import com.deepansh.gateway.llm.ProviderException;
import com.deepansh.gateway.model.ResponseObject;
import com.deepansh.gateway.model.ResponseRequest;
import com.deepansh.gateway.model.ResponseStatus;
import com.deepansh.gateway.response.ResponseNotFoundException;
import com.deepansh.gateway.response.ResponseService;
import com.deepansh.gateway.response.ResponseTimeoutException;
import com.deepansh.gateway.stream.ResponseStream;
import com.deepansh.gateway.stream.ResponseStreamEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ResponseControllerTest {

    @Mock ResponseService responseService;
    @Mock RequestContexts contexts;

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        lenient().when(contexts.open()).thenAnswer(inv -> CancellableContext.background());
        mockMvc = MockMvcBuilders.standaloneSetup(new ResponseController(responseService, contexts, executor))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void create_background_returnsPlaceholder() throws Exception {
        when(responseService.create(any(), any())).thenReturn(ResponseObject.builder()
                .id("resp_1").createdAt(100L).status(ResponseStatus.in_progress).model("m").build());

        mockMvc.perform(post("/v1/responses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"model\":\"m\",\"input\":\"hi\",\"background\":true,\"max_output_tokens\":32}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("resp_1"))
                .andExpect(jsonPath("$.object").value("response"))
                .andExpect(jsonPath("$.status").value("in_progress"))
                .andExpect(jsonPath("$.created_at").value(100));

        ArgumentCaptor<ResponseRequest> request = ArgumentCaptor.forClass(ResponseRequest.class);
        verify(responseService).create(any(), request.capture());
        assertThat(request.getValue().isBackground()).isTrue();
        assertThat(request.getValue().getMaxOutputTokens()).isEqualTo(32);
        assertThat(request.getValue().getInput()).isEqualTo("hi");
    }

    @Test
    void get_unknownId_is404() throws Exception {
        when(responseService.get(any(), eq("resp_missing"))).thenThrow(new ResponseNotFoundException("resp_missing"));

        mockMvc.perform(get("/v1/responses/resp_missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.type").value("not_found"))
                .andExpect(jsonPath("$.error.message").value("response not found: resp_missing"))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void get_stillRunning_is504() throws Exception {
        when(responseService.get(any(), eq("resp_1"))).thenThrow(new ResponseTimeoutException("resp_1"));

        mockMvc.perform(get("/v1/responses/resp_1"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.error.type").value("timeout"));
    }

    @Test
    void providerError_is502WithCode() throws Exception {
        when(responseService.create(any(), any())).thenThrow(ProviderException.rateLimit("Slow down"));

        mockMvc.perform(post("/v1/responses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"model\":\"m\",\"input\":\"hi\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error.type").value("rate_limit_error"))
                .andExpect(jsonPath("$.error.code").value("rate_limit_exceeded"));
    }

    @Test
    void invalidInput_is400() throws Exception {
        when(responseService.create(any(), any()))
                .thenThrow(new IllegalArgumentException("input must contain at least one message"));

        mockMvc.perform(post("/v1/responses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"model\":\"m\",\"input\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.type").value("invalid_request_error"));
    }

    @Test
    void cancel_returnsFinalForm() throws Exception {
        when(responseService.cancel(any(), eq("resp_1"))).thenReturn(ResponseObject.builder()
                .id("resp_1").status(ResponseStatus.cancelled).build());

        mockMvc.perform(post("/v1/responses/resp_1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("cancelled"))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void delete_returnsDeletionMarker() throws Exception {
        mockMvc.perform(delete("/v1/responses/resp_1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("resp_1"))
                .andExpect(jsonPath("$.object").value("response"))
                .andExpect(jsonPath("$.deleted").value(true));

        verify(responseService).delete("resp_1");
    }

    @Test
    void delete_unknownId_is404() throws Exception {
        doThrow(new ResponseNotFoundException("resp_x")).when(responseService).delete("resp_x");

        mockMvc.perform(delete("/v1/responses/resp_x"))
                .andExpect(status().isNotFound());
    }

    @Test
    void stream_clientAlreadyGone_pumpEndsQuietlyAndReleasesContext() {
        CancellableContext ctx = CancellableContext.background();
        when(contexts.open(any())).thenReturn(ctx);
        when(responseService.stream(any(), any())).thenAnswer(inv -> ResponseStream.start(inv.getArgument(0), executor, 16,
                (producerCtx, sink) -> sink.emit(new ResponseStreamEvent("response.created", Map.of()))));
        ExecutorService pumpExecutor = mock(ExecutorService.class);
        ResponseController controller = new ResponseController(responseService, contexts, pumpExecutor);
        ResponseRequest request = new ResponseRequest();
        request.setModel("m");
        request.setInput("hi");
        request.setStream(true);

        SseEmitter emitter = (SseEmitter) controller.create(request);
        ArgumentCaptor<Runnable> pump = ArgumentCaptor.forClass(Runnable.class);
        verify(pumpExecutor).execute(pump.capture());
        emitter.complete();

        assertThatCode(() -> pump.getValue().run()).doesNotThrowAnyException();
        assertThat(ctx.isCancelled()).isTrue();
    }
}
