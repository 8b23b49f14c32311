package io.sqlpulse.monitor.engine.recommendation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sqlpulse.monitor.common.analysis.DefaultThresholds;
import io.sqlpulse.monitor.common.analysis.Finding;
import io.sqlpulse.monitor.common.check.InspectionLevel;
import io.sqlpulse.monitor.engine.MonitorConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AnthropicReasoningClientTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private HttpClient httpClient;
    private HttpResponse<String> httpResponse;
    private AnthropicReasoningClient client;
    private ReasoningRequest request;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws Exception {
        httpClient = mock(HttpClient.class);
        httpResponse = mock(HttpResponse.class);
        MonitorConfig config = MonitorConfig.builder()
                .reasoningApiKey("test-key")
                .reasoningModel("claude-3-sonnet-20240229")
                .build();
        client = new AnthropicReasoningClient(config, httpClient, mapper);
        Finding finding = new Finding(DefaultThresholds.byName("connection_usage").orElseThrow(), "connections", 95.0);
        request = ReasoningRequest.bounded(InspectionLevel.BASIC, List.of(finding), List.of(), 32768, mapper);
    }

    @Test
    void shouldBuildMessagesRequestBody() throws Exception {
        // When
        JsonNode body = mapper.readTree(client.buildBody(request));

        // Then
        assertThat(body.path("model").asText()).isEqualTo("claude-3-sonnet-20240229");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(4096);
        assertThat(body.path("system").asText()).isEqualTo(AnthropicReasoningClient.SYSTEM_PROMPT);
        assertThat(body.path("messages").get(0).path("role").asText()).isEqualTo("user");
        assertThat(body.path("messages").get(0).path("content").asText()).contains("connections.usage_percent:WARNING");
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldParseTextContentOfReply() throws Exception {
        // Given
        when(httpResponse.statusCode()).thenReturn(200);
        when(httpResponse.body()).thenReturn("{\"content\":[{\"type\":\"text\",\"text\":"
                + "\"{\\\"recommendations\\\":[{\\\"findings\\\":[\\\"connections.usage_percent:WARNING\\\"],"
                + "\\\"priority\\\":\\\"high\\\",\\\"advice\\\":\\\"Pool connections.\\\"}]}\"}]}");
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(httpResponse);

        // When
        ReasoningResponse response = client.analyze(request);

        // Then
        assertThat(response.getItems()).singleElement()
                .satisfies(item -> assertThat(item.getAdvice()).isEqualTo("Pool connections."));
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any(HttpResponse.BodyHandler.class));
        assertThat(captor.getValue().headers().firstValue("x-api-key")).hasValue("test-key");
        assertThat(captor.getValue().headers().firstValue("anthropic-version")).hasValue(AnthropicReasoningClient.API_VERSION);
        assertThat(captor.getValue().method()).isEqualTo("POST");
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldFailOnErrorStatus() throws Exception {
        // Given
        when(httpResponse.statusCode()).thenReturn(401);
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(httpResponse);

        // When & Then
        assertThatThrownBy(() -> client.analyze(request))
                .isInstanceOf(RecommendationServiceException.class)
                .hasMessageContaining("401");
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldWrapTransportErrors() throws Exception {
        // Given
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenThrow(new IOException("Connection reset"));

        // When & Then
        assertThatThrownBy(() -> client.analyze(request))
                .isInstanceOf(RecommendationServiceException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
