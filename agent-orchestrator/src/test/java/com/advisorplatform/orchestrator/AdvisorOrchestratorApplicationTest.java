package com.advisorplatform.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full context on the local template backends: an educational question needs no market
 * data, so the request runs end to end without any external service.
 */
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "spring.r2dbc.url=r2dbc:h2:mem:///orchestrator-it;DB_CLOSE_DELAY=-1",
        "trace.write-retries=1"
    })
@AutoConfigureWebTestClient(timeout = "10s")
class AdvisorOrchestratorApplicationTest {

    @Autowired
    private WebTestClient client;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("a request streams to a final event and leaves one trace hop per agent hop")
    void endToEnd() throws Exception {
        List<ServerSentEvent<String>> frames = client.post().uri("/api/v1/advisory/stream")
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.TEXT_EVENT_STREAM)
            .bodyValue("{\"query\":\"Explain what diversification means\"}")
            .exchange()
            .expectStatus().isOk()
            .returnResult(new ParameterizedTypeReference<ServerSentEvent<String>>() {})
            .getResponseBody()
            .collectList()
            .block(Duration.ofSeconds(10));

        assertThat(frames).isNotEmpty();
        ServerSentEvent<String> last = frames.get(frames.size() - 1);
        assertThat(last.event()).isEqualTo("final");
        assertThat(frames).noneMatch(f -> "specialist_result".equals(f.event()));

        JsonNode fin = objectMapper.readTree(last.data());
        String correlationId = fin.path("correlationId").asText();
        assertThat(fin.path("payload").path("recommendation").asText()).isEqualTo("HOLD");
        JsonNode proposal = fin.path("payload").path("proposedAction");
        assertThat(proposal.isNull() || proposal.isMissingNode()).isTrue();

        long segments = frames.stream().filter(f -> "reasoning_segment".equals(f.event())).count();
        long turns = frames.stream().filter(f -> "debate_turn".equals(f.event())).count();
        // intent + segments + critic turns + finalize
        long expectedHops = 1 + segments + turns + 1;

        JsonNode hops = awaitHops(correlationId, expectedHops);
        assertThat(hops.size()).isEqualTo((int) expectedHops);
        assertThat(hops.get(0).path("component").asText()).isEqualTo("intent");
        assertThat(hops.get(hops.size() - 1).path("component").asText()).isEqualTo("finalize");
    }

    @Test
    void agentStatusListsComponents() {
        client.get().uri("/api/v1/agents/status")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[?(@.component == 'router')].status").isEqualTo("ready");
    }

    // trace writes are fire-and-forget, so poll until they have landed
    private JsonNode awaitHops(String correlationId, long expected) throws Exception {
        JsonNode hops = objectMapper.createArrayNode();
        for (int attempt = 0; attempt < 50 && hops.size() < expected; attempt++) {
            String body = client.get().uri("/api/v1/traces/{id}", correlationId)
                .exchange()
                .expectBody(String.class)
                .returnResult()
                .getResponseBody();
            if (body != null && !body.isBlank()) {
                hops = objectMapper.readTree(body);
            }
            if (hops.size() < expected) {
                Thread.sleep(100);
            }
        }
        return hops;
    }
}
