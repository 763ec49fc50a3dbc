package com.openforge.recall.embedding;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class EmbeddingClientTest {

    private static final String OK_BODY = """
            {"object":"list","data":[{"object":"embedding","index":0,"embedding":[0.25,-0.5,1.0]}],
             "model":"text-embedding-3-small","usage":{"prompt_tokens":3,"total_tokens":3}}
            """;

    private HttpClient           httpClient;
    private HttpResponse<String> response;
    private EmbeddingClient      client;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws Exception {
        httpClient = mock(HttpClient.class);
        response   = mock(HttpResponse.class);
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

        ObjectMapper mapper = new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        client = new EmbeddingClient(httpClient, mapper, new EmbeddingProperties(
                "http://embeddings.local/v1", "sk-test", "text-embedding-3-small", 3, 5, 10));
    }

    @Test
    void parsesFirstVector() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn(OK_BODY);

        float[] vector = client.embed("hello");

        assertThat(vector).containsExactly(0.25f, -0.5f, 1.0f);
        ArgumentCaptor<HttpRequest> sent = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(sent.capture(), any());
        assertThat(sent.getValue().uri().toString()).isEqualTo("http://embeddings.local/v1/embeddings");
        assertThat(sent.getValue().headers().firstValue("Authorization")).contains("Bearer sk-test");
    }

    @Test
    void rateLimitIsReportedAsEmbeddingFailure() {
        when(response.statusCode()).thenReturn(429);

        assertThatThrownBy(() -> client.embed("hello"))
                .isInstanceOf(EmbeddingClient.EmbeddingException.class)
                .hasMessageContaining("rate-limited");
    }

    @Test
    void serverErrorCarriesStatusAndBody() {
        when(response.statusCode()).thenReturn(503);
        when(response.body()).thenReturn("upstream down");

        assertThatThrownBy(() -> client.embed("hello"))
                .isInstanceOf(EmbeddingClient.EmbeddingException.class)
                .hasMessageContaining("503")
                .hasMessageContaining("upstream down");
    }

    @Test
    void emptyDataIsAParseFailure() {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"object\":\"list\",\"data\":[]}");

        assertThatThrownBy(() -> client.embed("hello"))
                .isInstanceOf(EmbeddingClient.EmbeddingException.class)
                .hasMessageContaining("parse");
    }

    @Test
    void vectorWithAMissingComponentIsRejected() {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"object\":\"list\",\"data\":[{\"index\":0,\"embedding\":[0.25,null,1.0]}]}");

        assertThatThrownBy(() -> client.embed("hello"))
                .isInstanceOf(EmbeddingClient.EmbeddingException.class)
                .hasMessageContaining("non-finite");
    }

    @Test
    void networkErrorIsWrapped() throws Exception {
        doThrow(new IOException("connection reset")).when(httpClient).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> client.embed("hello"))
                .isInstanceOf(EmbeddingClient.EmbeddingException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void blankTextIsRejectedWithoutACall() {
        assertThatThrownBy(() -> client.embed("  "))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(httpClient);
    }
}
