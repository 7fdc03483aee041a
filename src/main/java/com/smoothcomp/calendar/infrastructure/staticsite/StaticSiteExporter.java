package com.smoothcomp.calendar.infrastructure.staticsite;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smoothcomp.calendar.domain.model.Event;
import com.smoothcomp.calendar.domain.model.EventFilter;
import com.smoothcomp.calendar.domain.port.out.EventRepository;
import com.smoothcomp.calendar.infrastructure.calendar.ICalendarRenderer;
import com.smoothcomp.calendar.infrastructure.config.SmoothcompProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Writes the cached events as static files: {@code metadata.json} plus one calendar per
 * country under {@code calendars/}.
 */
@Component
public class StaticSiteExporter {

    private static final Logger logger = LoggerFactory.getLogger(StaticSiteExporter.class);

    static final String UNKNOWN_COUNTRY = "Unknown";
    static final String METADATA_FILE = "metadata.json";
    static final String CALENDARS_DIR = "calendars";

    private static final Pattern NON_SLUG_CHARS = Pattern.compile("[^\\w\\s-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SEPARATORS = Pattern.compile("[-\\s]+", Pattern.UNICODE_CHARACTER_CLASS);

    private final EventRepository eventRepository;
    private final ICalendarRenderer renderer;
    private final ObjectMapper objectMapper;
    private final SmoothcompProperties.Calendar calendarProperties;
    private final Clock clock;

    public StaticSiteExporter(EventRepository eventRepository,
                              ICalendarRenderer renderer,
                              ObjectMapper objectMapper,
                              SmoothcompProperties properties,
                              Clock clock) {
        this.eventRepository = eventRepository;
        this.renderer = renderer;
        this.objectMapper = objectMapper;
        this.calendarProperties = properties.getCalendar();
        this.clock = clock;
    }

    /**
     * @throws UncheckedIOException if a file cannot be written
     */
    public StaticMetadata export(Path outputDir) {
        List<Event> events = eventRepository.findEvents(EventFilter.none());
        Map<String, List<Event>> byCountry = groupByCountry(events);

        List<StaticMetadata.CountryEntry> countries = byCountry.entrySet().stream()
                .filter(entry -> !UNKNOWN_COUNTRY.equals(entry.getKey()))
                .sorted(Comparator.<Map.Entry<String, List<Event>>>comparingInt(entry -> entry.getValue().size())
                        .reversed()
                        .thenComparing(Map.Entry::getKey))
                .map(entry -> new StaticMetadata.CountryEntry(
                        entry.getKey(), slugify(entry.getKey()), entry.getValue().size()))
                .toList();

        StaticMetadata metadata = new StaticMetadata(clock.instant().toString(), events.size(), countries);

        try {
            Path calendarsDir = Files.createDirectories(outputDir.resolve(CALENDARS_DIR));
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(outputDir.resolve(METADATA_FILE).toFile(), metadata);

            for (StaticMetadata.CountryEntry country : countries) {
                String name = calendarProperties.getNamePrefix() + " " + country.name() + " Events";
                byte[] calendar = renderer.render(byCountry.get(country.name()), name, calendarProperties.getTtlMinutes());
                Files.write(calendarsDir.resolve(country.slug() + ".ics"), calendar);
                logger.info("  {}: {} events", country.name(), country.count());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write static site to " + outputDir, e);
        }

        logger.info("Wrote {} events and {} country calendars to {}", events.size(), countries.size(), outputDir);
        return metadata;
    }

    private static Map<String, List<Event>> groupByCountry(List<Event> events) {
        Map<String, List<Event>> byCountry = new LinkedHashMap<>();
        for (Event event : events) {
            String country = event.country() == null || event.country().isBlank()
                    ? UNKNOWN_COUNTRY
                    : event.country();
            byCountry.computeIfAbsent(country, key -> new ArrayList<>()).add(event);
        }
        return byCountry;
    }

    /**
     * "Bosnia & Herzegovina" becomes "bosnia-herzegovina".
     */
    static String slugify(String text) {
        String slug = text.toLowerCase(Locale.ROOT).strip();
        slug = NON_SLUG_CHARS.matcher(slug).replaceAll("");
        return SEPARATORS.matcher(slug).replaceAll("-");
    }
}
