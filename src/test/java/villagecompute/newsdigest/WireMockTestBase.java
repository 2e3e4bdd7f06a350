package villagecompute.newsdigest;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Abstract base class for tests requiring WireMock HTTP mocking.
 *
 * <p>
 * Provides WireMock server lifecycle management:
 * <ul>
 * <li>Starts WireMock server on random port before each test</li>
 * <li>Stops and resets server after each test</li>
 * <li>Provides helper methods for stubbing the Slack webhook and RSS endpoints</li>
 * </ul>
 */
public abstract class WireMockTestBase {

    /** WireMock HTTP server for stubbing external endpoints. */
    protected WireMockServer wireMockServer;

    @BeforeEach
    protected void startWireMock() {
        // Start WireMock server on random port to avoid conflicts
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();

        WireMock.configureFor("localhost", wireMockServer.port());
    }

    @AfterEach
    protected void stopWireMock() {
        // Stop and reset WireMock server to prevent test pollution
        if (wireMockServer != null && wireMockServer.isRunning()) {
            wireMockServer.resetAll();
            wireMockServer.stop();
        }
    }

    protected String baseUrl() {
        return "http://localhost:" + wireMockServer.port();
    }

    /**
     * Stubs the Slack webhook to answer every POST with the given status.
     *
     * @param status
     *            HTTP status to return
     */
    protected void stubSlackWebhook(int status) {
        wireMockServer.stubFor(WireMock.post(WireMock.urlPathEqualTo(TestFixtures.WEBHOOK_PATH))
                .willReturn(WireMock.aResponse().withStatus(status).withBody(status == 200 ? "ok" : "error")));
    }

    /**
     * Stubs a rate-limited Slack webhook response.
     *
     * @param retryAfter
     *            raw Retry-After header value
     */
    protected void stubSlackWebhookRateLimited(String retryAfter) {
        wireMockServer.stubFor(WireMock.post(WireMock.urlPathEqualTo(TestFixtures.WEBHOOK_PATH)).willReturn(
                WireMock.aResponse().withStatus(429).withHeader("Retry-After", retryAfter).withBody("rate_limited")));
    }

    /**
     * Stubs an RSS feed at the given path with a stub file from test resources.
     *
     * @param path
     *            URL path of the feed
     * @param resourcePath
     *            stub file relative to src/test/resources/
     */
    protected void stubRssFeed(String path, String resourcePath) {
        wireMockServer.stubFor(WireMock.get(WireMock.urlPathEqualTo(path)).willReturn(WireMock.aResponse()
                .withStatus(200).withHeader("Content-Type", "application/rss+xml").withBody(loadStubFile(resourcePath))));
    }

    /**
     * Loads a stub file from the test resources directory.
     *
     * @param resourcePath
     *            the path to the stub file (relative to src/test/resources/)
     * @return the stub file contents as a UTF-8 string
     * @throws RuntimeException
     *             if the file cannot be read or does not exist
     */
    protected String loadStubFile(String resourcePath) {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new RuntimeException("Stub file not found in test resources: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load stub file: " + resourcePath, e);
        }
    }
}
