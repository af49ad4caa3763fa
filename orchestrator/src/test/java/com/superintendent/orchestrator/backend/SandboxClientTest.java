package com.superintendent.orchestrator.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.superintendent.orchestrator.backend.dto.ExecResponse;
import com.superintendent.orchestrator.backend.dto.StepExecuteRequest;
import com.superintendent.orchestrator.backend.dto.StepExecuteResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * SandboxClient against a mocked java.net.http client: URLs, bodies and error mapping.
 */
@ExtendWith(MockitoExtension.class)
class SandboxClientTest {

    @Mock HttpClient           http;
    @Mock HttpResponse<String> response;

    SandboxClient client;

    @BeforeEach
    void setUp() {
        client = new SandboxClient("http://executor:8000/", new ObjectMapper(), http);
    }

    @Test
    void executeStep_postsJsonAndParsesResponse() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("""
                {"success":true,"message":"ok","data":{"repo_path":"/abs/app"}}
                """);
        when(http.<String>send(any(), any())).thenReturn(response);

        StepExecuteResponse resp = client.executeStep(new StepExecuteRequest(
                "validate_repo", "validate_repo", Map.of(), Map.of(), Map.of()));

        assertThat(resp.success()).isTrue();
        assertThat(resp.data()).containsEntry("repo_path", "/abs/app");

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http).send(captor.capture(), any());
        assertThat(captor.getValue().uri().toString()).isEqualTo("http://executor:8000/steps/execute");
        assertThat(captor.getValue().method()).isEqualTo("POST");
    }

    @Test
    void exec_encodesSandboxNameInPath() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"exit_code\":1,\"stdout\":\"\",\"stderr\":\"\"}");
        when(http.<String>send(any(), any())).thenReturn(response);

        ExecResponse resp = client.exec("superintendent-agent-1", "true", 5);

        assertThat(resp.exit_code()).isEqualTo(1);
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http).send(captor.capture(), any());
        assertThat(captor.getValue().uri().getPath()).isEqualTo("/sandboxes/superintendent-agent-1/exec");
    }

    @Test
    void non2xx_throwsBackendExceptionWithStatus() throws Exception {
        when(response.statusCode()).thenReturn(500);
        when(response.body()).thenReturn("kaboom");
        when(http.<String>send(any(), any())).thenReturn(response);

        assertThatThrownBy(() -> client.exec("sb", "true", 5))
                .isInstanceOf(BackendException.class)
                .hasMessageContaining("HTTP 500")
                .hasMessageContaining("kaboom");
    }

    @Test
    void ioError_wrappedInBackendException() throws Exception {
        when(http.<String>send(any(), any())).thenThrow(new IOException("connection refused"));

        assertThatThrownBy(() -> client.executeStep(new StepExecuteRequest("a", "validate_repo",
                Map.of(), Map.of(), Map.of())))
                .isInstanceOf(BackendException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
