package villagecompute.newsdigest.integration.slack;

import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.newsdigest.TestFixtures;
import villagecompute.newsdigest.WireMockTestBase;
import villagecompute.newsdigest.api.types.ChannelResponseType;
import villagecompute.newsdigest.exceptions.ConfigurationException;

/**
 * Tests for the Slack incoming-webhook transport against a WireMock server.
 */
class SlackWebhookClientTest extends WireMockTestBase {

    private SlackWebhookClient client;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUpClient() {
        objectMapper = new ObjectMapper();
        client = new SlackWebhookClient();
        client.config = TestFixtures.config(baseUrl() + TestFixtures.WEBHOOK_PATH);
        client.objectMapper = objectMapper;
    }

    @Test
    void testSend_PostsJsonPayload() throws Exception {
        // Given
        stubSlackWebhook(200);
        ObjectNode payload = objectMapper.createObjectNode().put("text", "hello");

        // When
        ChannelResponseType response = client.send(payload);

        // Then
        assertTrue(response.isSuccess());
        assertNull(response.retryAfter());
        wireMockServer.verify(postRequestedFor(urlPathEqualTo(TestFixtures.WEBHOOK_PATH))
                .withHeader("Content-Type", equalTo("application/json"))
                .withRequestBody(equalToJson("{\"text\": \"hello\"}")));
    }

    @Test
    void testSend_RateLimitedCarriesRetryAfter() throws Exception {
        stubSlackWebhookRateLimited("5");

        ChannelResponseType response = client.send(objectMapper.createObjectNode());

        assertTrue(response.isRateLimited());
        assertEquals(Duration.ofSeconds(5), response.retryAfter());
    }

    @Test
    void testSend_ServerErrorReturnedAsStatus() throws Exception {
        stubSlackWebhook(500);

        ChannelResponseType response = client.send(objectMapper.createObjectNode());

        assertEquals(500, response.statusCode());
        assertEquals("error", response.body());
    }

    @Test
    void testParseRetryAfter() {
        assertEquals(Duration.ofSeconds(30), SlackWebhookClient.parseRetryAfter(" 30 "));
        assertEquals(Duration.ZERO, SlackWebhookClient.parseRetryAfter("0"));
        assertNull(SlackWebhookClient.parseRetryAfter(null));
        assertNull(SlackWebhookClient.parseRetryAfter("-1"));
        assertNull(SlackWebhookClient.parseRetryAfter("Wed, 21 Oct 2015 07:28:00 GMT"));
    }

    @Test
    void testValidateConfiguration_RejectsMissingUrl() {
        client.config = TestFixtures.config("  ");

        assertThrows(ConfigurationException.class, client::validateConfiguration);
    }

    @Test
    void testValidateConfiguration_RejectsNonHttpUrl() {
        client.config = TestFixtures.config("ftp://hooks.example.com/x");

        assertThrows(ConfigurationException.class, client::validateConfiguration);
    }

    @Test
    void testValidateConfiguration_AcceptsHttpsUrl() {
        client.config = TestFixtures.config();

        client.validateConfiguration();
    }
}
