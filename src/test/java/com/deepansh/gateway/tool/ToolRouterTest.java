package com.deepansh.gateway.tool;

import com.deepansh.gateway.context.CancellableContext;
import com.deepansh.gateway.context.RequestEnvironment;
import com.deepansh.gateway.model.ToolDescriptor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ToolRouterTest {

    @Mock ToolProvider local;
    @Mock ToolProvider weather;
    @Mock ToolProvider search;

    private final ToolRouter router = new ToolRouter();

    @Test
    void resolve_picksFirstRemoteWhoseNamespacePrefixesName() {
        when(weather.namespace()).thenReturn("weather_");
        RequestEnvironment env = RequestEnvironment.builder()
                .localProvider(local)
                .remoteProvider(weather)
                .remoteProvider(search)
                .build();

        assertThat(router.resolve(env, "weather_forecast")).isSameAs(weather);
    }

    @Test
    void resolve_fallsBackToLocal() {
        when(weather.namespace()).thenReturn("weather_");
        RequestEnvironment env = RequestEnvironment.builder()
                .localProvider(local)
                .remoteProvider(weather)
                .build();

        assertThat(router.resolve(env, "echo")).isSameAs(local);
    }

    @Test
    void resolve_emptyNamespaceNeverMatches() {
        when(search.namespace()).thenReturn("");
        RequestEnvironment env = RequestEnvironment.builder()
                .localProvider(local)
                .remoteProvider(search)
                .build();

        assertThat(router.resolve(env, "anything")).isSameAs(local);
    }

    @Test
    void resolve_noOwner_throwsUnknownTool() {
        when(weather.namespace()).thenReturn("weather_");
        RequestEnvironment env = RequestEnvironment.builder().remoteProvider(weather).build();

        assertThatThrownBy(() -> router.resolve(env, "echo"))
                .isInstanceOf(UnknownToolException.class)
                .hasMessage("no tool provider available for tool: echo");
    }

    @Test
    void collectTools_localFirst_andSkipsFailingProvider() {
        when(local.listTools(any())).thenReturn(List.of(descriptor("echo")));
        when(weather.listTools(any())).thenThrow(new IllegalStateException("unreachable"));
        when(weather.namespace()).thenReturn("weather_");
        when(search.listTools(any())).thenReturn(List.of(descriptor("search_web")));
        RequestEnvironment env = RequestEnvironment.builder()
                .localProvider(local)
                .remoteProvider(weather)
                .remoteProvider(search)
                .build();

        List<ToolDescriptor> tools = router.collectTools(CancellableContext.of(env));

        assertThat(tools).extracting(ToolDescriptor::getName).containsExactly("echo", "search_web");
    }

    private static ToolDescriptor descriptor(String name) {
        return ToolDescriptor.builder().name(name).description(name).build();
    }
}
