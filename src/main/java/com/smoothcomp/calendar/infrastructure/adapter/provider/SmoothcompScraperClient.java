package com.smoothcomp.calendar.infrastructure.adapter.provider;

import com.smoothcomp.calendar.domain.model.EventFetchResult;
import com.smoothcomp.calendar.domain.port.out.ExternalEventSource;
import com.smoothcomp.calendar.domain.port.out.SourceUnavailableException;
import com.smoothcomp.calendar.infrastructure.adapter.extractor.EventPageExtractor;
import com.smoothcomp.calendar.infrastructure.config.SmoothcompProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import retrofit2.Response;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

@Component
public class SmoothcompScraperClient implements ExternalEventSource {

    private static final Logger logger = LoggerFactory.getLogger(SmoothcompScraperClient.class);

    private final SmoothcompApi smoothcompApi;
    private final EventPageExtractor extractor;
    private final String listingPath;

    public SmoothcompScraperClient(SmoothcompApi smoothcompApi,
                                   EventPageExtractor extractor,
                                   SmoothcompProperties properties) {
        this.smoothcompApi = smoothcompApi;
        this.extractor = extractor;
        this.listingPath = properties.getSource().getListingPath();
    }

    /**
     * No fallback on purpose: an empty listing would make the refresh retire every event.
     */
    @Override
    @CircuitBreaker(name = "smoothcomp-listing")
    @Retry(name = "smoothcomp-listing")
    public List<String> listEventReferences() {
        logger.debug("Fetching event listing {}", listingPath);

        Response<String> response;
        try {
            response = smoothcompApi.fetchPage(listingPath).execute();
        } catch (IOException e) {
            throw new SourceUnavailableException("Failed to fetch event listing: " + e.getMessage(), e);
        }

        if (!response.isSuccessful() || response.body() == null) {
            throw new SourceUnavailableException("Event listing returned HTTP " + response.code());
        }

        List<String> urls = extractor.extractEventReferences(response.body())
                .orElseThrow(() -> new SourceUnavailableException("Event listing has no ItemList metadata"));
        logger.info("Found {} event URLs", urls.size());
        return urls;
    }

    @Override
    public EventFetchResult fetchEventDetail(String url) {
        try {
            Response<String> response = smoothcompApi.fetchPage(url).execute();
            if (!response.isSuccessful()) {
                logger.debug("Event page {} returned HTTP {}", url, response.code());
                return EventFetchResult.skipped("HTTP " + response.code());
            }

            return extractor.extractEvent(response.body(), url)
                    .map(EventFetchResult::found)
                    .orElseGet(() -> EventFetchResult.skipped("empty page"));

        } catch (IOException e) {
            logger.warn("Error fetching {}: {}", url, e.getMessage());
            return EventFetchResult.skipped(e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("Failed to read event page {}: {}", url, e.getMessage());
            return EventFetchResult.skipped(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    @Override
    public Optional<String> eventIdOf(String url) {
        return extractor.eventIdOf(url);
    }
}
