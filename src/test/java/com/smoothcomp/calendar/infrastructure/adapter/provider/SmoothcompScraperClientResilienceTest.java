package com.smoothcomp.calendar.infrastructure.adapter.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.smoothcomp.calendar.domain.port.out.SourceUnavailableException;
import com.smoothcomp.calendar.infrastructure.adapter.extractor.EventPageExtractor;
import com.smoothcomp.calendar.infrastructure.config.RetrofitSourceConfig;
import com.smoothcomp.calendar.infrastructure.config.SmoothcompProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(classes = {
        SmoothcompScraperClientResilienceTest.TestConfig.class,
        SmoothcompScraperClient.class,
        EventPageExtractor.class,
        RetrofitSourceConfig.class,
        SmoothcompProperties.class
})
@TestPropertySource(properties = {
        "resilience4j.retry.instances.smoothcomp-listing.max-attempts=3",
        "resilience4j.retry.instances.smoothcomp-listing.wait-duration=50ms",
        "resilience4j.retry.instances.smoothcomp-listing.enable-exponential-backoff=false",
        "resilience4j.circuitbreaker.instances.smoothcomp-listing.sliding-window-size=5",
        "resilience4j.circuitbreaker.instances.smoothcomp-listing.minimum-number-of-calls=5",
        "resilience4j.circuitbreaker.instances.smoothcomp-listing.failure-rate-threshold=50",
        "resilience4j.circuitbreaker.instances.smoothcomp-listing.wait-duration-in-open-state=1m"
})
class SmoothcompScraperClientResilienceTest {

    private static final String LISTING_PATH = "/en/events/upcoming";

    private static final WireMockServer wireMockServer =
            new WireMockServer(WireMockConfiguration.options().dynamicPort());

    @Autowired
    private SmoothcompScraperClient client;

    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    @Autowired
    private EventPageExtractor extractor;

    @Autowired
    private ObjectMapper objectMapper;

    @TestConfiguration
    @EnableAutoConfiguration(exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
    static class TestConfig {
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        if (!wireMockServer.isRunning()) {
            wireMockServer.start();
        }
        registry.add("smoothcomp.source.base-url", () -> wireMockServer.baseUrl() + "/");
    }

    @AfterAll
    static void stopServer() {
        wireMockServer.stop();
    }

    @BeforeEach
    void setUp() {
        wireMockServer.resetAll();
        circuitBreakerRegistry.circuitBreaker("smoothcomp-listing").reset();
    }

    @Test
    void shouldRetryListingAndEventuallySucceed() {
        // Given: first two calls fail, third succeeds
        wireMockServer.stubFor(get(urlEqualTo(LISTING_PATH))
                .inScenario("Retry Scenario")
                .whenScenarioStateIs("Started")
                .willReturn(aResponse().withStatus(502))
                .willSetStateTo("FirstFailed"));
        wireMockServer.stubFor(get(urlEqualTo(LISTING_PATH))
                .inScenario("Retry Scenario")
                .whenScenarioStateIs("FirstFailed")
                .willReturn(aResponse().withStatus(503))
                .willSetStateTo("SecondFailed"));
        wireMockServer.stubFor(get(urlEqualTo(LISTING_PATH))
                .inScenario("Retry Scenario")
                .whenScenarioStateIs("SecondFailed")
                .willReturn(aResponse().withStatus(200).withBody(
                        "<script type=\"application/ld+json\">{\"@type\":\"ItemList\",\"itemListElement\":"
                                + "[{\"url\":\"https://smoothcomp.com/en/event/1\"}]}</script>")));

        // When
        List<String> urls = client.listEventReferences();

        // Then
        assertThat(urls).containsExactly("https://smoothcomp.com/en/event/1");
        wireMockServer.verify(3, getRequestedFor(urlEqualTo(LISTING_PATH)));
    }

    @Test
    void shouldGiveUpAfterMaxAttemptsWithoutFallback() {
        // Given
        wireMockServer.stubFor(get(urlEqualTo(LISTING_PATH)).willReturn(aResponse().withStatus(500)));

        // When & Then
        assertThatThrownBy(() -> client.listEventReferences())
                .isInstanceOf(SourceUnavailableException.class);
        wireMockServer.verify(3, getRequestedFor(urlEqualTo(LISTING_PATH)));
    }

    @Test
    void shouldOpenCircuitAfterRepeatedFailures() {
        // Given
        wireMockServer.stubFor(get(urlEqualTo(LISTING_PATH)).willReturn(aResponse().withStatus(500)));

        // When: two calls, three attempts each, every attempt recorded by the breaker
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> client.listEventReferences()).isInstanceOf(RuntimeException.class);
        }

        // Then
        assertThat(circuitBreakerRegistry.circuitBreaker("smoothcomp-listing").getState())
                .isEqualTo(CircuitBreaker.State.OPEN);
    }

    @Test
    void shouldParsePagesWithApplicationObjectMapper() {
        assertThat(ReflectionTestUtils.getField(extractor, "objectMapper")).isSameAs(objectMapper);
    }
}
