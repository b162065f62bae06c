package com.williamcallahan.boxhunt.service.source;

import com.williamcallahan.boxhunt.config.HarvestProperties;
import com.williamcallahan.boxhunt.model.Candidate;
import com.williamcallahan.boxhunt.testutil.WebClientStubs;
import com.williamcallahan.boxhunt.types.SourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class PexelsApiClientTest {

    private static final String RESPONSE = """
        {
          "page": 1,
          "per_page": 2,
          "photos": [
            {"id": 1, "width": 4000, "height": 3000, "alt": "Stack of cardboard boxes",
             "src": {"original": "https://images.pexels.test/1/original.jpg", "medium": "https://images.pexels.test/1/medium.jpg"}},
            {"id": 2, "width": 1200, "height": 800,
             "src": {"original": "https://images.pexels.test/2/original.jpg"}},
            {"id": 3, "width": 10, "height": 10, "alt": "no source"}
          ]
        }
        """;

    private HarvestProperties properties;
    private List<ClientRequest> captured;

    @BeforeEach
    void setUp() {
        properties = new HarvestProperties();
        properties.getPexels().setApiKey("pexels-key");
        properties.getPexels().setBaseUrl("https://api.pexels.test/v1");
        captured = new CopyOnWriteArrayList<>();
    }

    private PexelsApiClient client(HttpStatus status, String body) {
        return new PexelsApiClient(
            WebClientStubs.respondingWith(request -> WebClientStubs.json(status, body), captured), properties);
    }

    @Test
    void mapsPhotosToCandidates() {
        StepVerifier.create(client(HttpStatus.OK, RESPONSE).search("cardboard box", 10))
            .assertNext(candidates -> {
                assertThat(candidates).hasSize(2);
                Candidate first = candidates.get(0);
                assertThat(first.url()).isEqualTo("https://images.pexels.test/1/original.jpg");
                assertThat(first.thumbnailUrl()).isEqualTo("https://images.pexels.test/1/medium.jpg");
                assertThat(first.title()).isEqualTo("Stack of cardboard boxes");
                assertThat(first.source()).isEqualTo("pexels");
                assertThat(first.width()).isEqualTo(4000);
                assertThat(first.height()).isEqualTo(3000);
                assertThat(candidates.get(1).title()).isEmpty();
                assertThat(candidates.get(1).thumbnailUrl()).isEmpty();
            })
            .verifyComplete();
    }

    @Test
    void sendsRawKeyAndClampedPageSize() {
        PexelsApiClient client = client(HttpStatus.OK, RESPONSE);

        client.search("cardboard box", 500).block();

        assertThat(captured).hasSize(1);
        ClientRequest request = captured.get(0);
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("pexels-key");
        assertThat(request.url().getPath()).isEqualTo("/v1/search");
        assertThat(request.url().getQuery()).contains("query=cardboard box", "per_page=80", "size=medium");
    }

    @Test
    void resultIsTruncatedToRequestedLimit() {
        StepVerifier.create(client(HttpStatus.OK, RESPONSE).search("box", 1))
            .assertNext(candidates -> assertThat(candidates).hasSize(1))
            .verifyComplete();
    }

    @Test
    void missingKeyReturnsEmptyWithoutCalling() {
        properties.getPexels().setApiKey("  ");
        PexelsApiClient client = client(HttpStatus.OK, RESPONSE);

        StepVerifier.create(client.search("box", 5))
            .assertNext(candidates -> assertThat(candidates).isEmpty())
            .verifyComplete();
        assertThat(client.isConfigured()).isFalse();
        assertThat(captured).isEmpty();
    }

    @Test
    void non200ReturnsEmpty() {
        StepVerifier.create(client(HttpStatus.UNAUTHORIZED, "{\"error\":\"bad key\"}").search("box", 5))
            .assertNext(candidates -> assertThat(candidates).isEmpty())
            .verifyComplete();
    }

    @Test
    void transportErrorReturnsEmpty() {
        PexelsApiClient client = new PexelsApiClient(
            WebClientStubs.failingWith(new IllegalStateException("connection refused")), properties);

        StepVerifier.create(client.search("box", 5))
            .assertNext(candidates -> assertThat(candidates).isEmpty())
            .verifyComplete();
    }

    @Test
    void clampsPageSize() {
        PexelsApiClient client = client(HttpStatus.OK, RESPONSE);

        assertThat(client.clampPageSize(0)).isEqualTo(1);
        assertThat(client.clampPageSize(20)).isEqualTo(20);
        assertThat(client.clampPageSize(81)).isEqualTo(PexelsApiClient.MAX_PER_PAGE);
        assertThat(client.type()).isEqualTo(SourceType.KEYWORD_API);
    }
}
