package com.smoothcomp.calendar.infrastructure.adapter.extractor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smoothcomp.calendar.domain.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls event data out of Smoothcomp pages. Pure functions over the page text, no I/O.
 *
 * <p>Structured JSON-LD metadata is preferred; an event page without it degrades to a
 * title-only record.
 */
@Component
public class EventPageExtractor {

    private static final Logger logger = LoggerFactory.getLogger(EventPageExtractor.class);

    private static final Pattern JSON_LD_PATTERN = Pattern.compile(
            "<script[^>]*type\\s*=\\s*[\"']application/ld\\+json[\"'][^>]*>(.*?)</script>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern TITLE_PATTERN = Pattern.compile(
            "<title[^>]*>(.*?)</title>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern EVENT_ID_PATTERN = Pattern.compile("/event/(\\d+)");
    private static final Pattern TITLE_SUFFIX_PATTERN = Pattern.compile("\\s*\\|\\s*Smoothcomp.*$", Pattern.DOTALL);

    static final String UNKNOWN_EVENT = "Unknown Event";
    static final String DEFAULT_SPORT = "Grappling";

    private final ObjectMapper objectMapper;

    public EventPageExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Event URLs from the listing page's ItemList, in listing order.
     *
     * @return empty if the page carries no ItemList metadata
     */
    public Optional<List<String>> extractEventReferences(String html) {
        for (JsonNode node : jsonLdNodes(html)) {
            if (!hasType(node, "ItemList")) {
                continue;
            }
            List<String> urls = new ArrayList<>();
            for (JsonNode item : node.path("itemListElement")) {
                String url = text(item, "url");
                if (url != null) {
                    urls.add(url);
                }
            }
            return Optional.of(urls);
        }
        return Optional.empty();
    }

    /**
     * Event from a detail page: the SportsEvent JSON-LD block if present, otherwise a
     * record built from the page title.
     *
     * @return empty only for a blank page
     */
    public Optional<Event> extractEvent(String html, String url) {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }

        String eventId = eventIdOf(url).orElse(url);

        for (JsonNode node : jsonLdNodes(html)) {
            if (hasType(node, "SportsEvent")) {
                return Optional.of(fromJsonLd(node, eventId, url));
            }
        }

        logger.debug("No SportsEvent metadata on {}, falling back to page title", url);
        return Optional.of(Event.titleOnly(eventId, titleOf(html), url));
    }

    public Optional<String> eventIdOf(String url) {
        if (url == null) {
            return Optional.empty();
        }
        Matcher matcher = EVENT_ID_PATTERN.matcher(url);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private Event fromJsonLd(JsonNode data, String eventId, String url) {
        JsonNode location = data.path("location");
        JsonNode address = location.path("address");

        return new Event(
                eventId,
                Optional.ofNullable(text(data, "name")).orElse(UNKNOWN_EVENT),
                url,
                parseDate(text(data, "startDate")),
                parseDate(text(data, "endDate")),
                text(location, "name"),
                text(address, "addressLocality"),
                nameOf(address.path("addressCountry")),
                Optional.ofNullable(text(data, "sport")).orElse(DEFAULT_SPORT),
                nameOf(data.path("organizer")),
                null,
                true
        );
    }

    private String titleOf(String html) {
        Matcher matcher = TITLE_PATTERN.matcher(html);
        if (!matcher.find()) {
            return UNKNOWN_EVENT;
        }
        String title = HtmlUtils.htmlUnescape(matcher.group(1)).trim();
        title = TITLE_SUFFIX_PATTERN.matcher(title).replaceFirst("");
        return title.isEmpty() ? UNKNOWN_EVENT : title;
    }

    /**
     * Every parsable JSON-LD object on the page; top-level arrays are flattened.
     */
    private List<JsonNode> jsonLdNodes(String html) {
        List<JsonNode> nodes = new ArrayList<>();
        if (html == null) {
            return nodes;
        }

        Matcher matcher = JSON_LD_PATTERN.matcher(html);
        while (matcher.find()) {
            try {
                JsonNode root = objectMapper.readTree(matcher.group(1).trim());
                if (root == null) {
                    continue;
                }
                if (root.isArray()) {
                    root.forEach(nodes::add);
                } else {
                    nodes.add(root);
                }
            } catch (JsonProcessingException e) {
                logger.debug("Ignoring malformed JSON-LD block: {}", e.getOriginalMessage());
            }
        }
        return nodes;
    }

    private static boolean hasType(JsonNode node, String type) {
        JsonNode typeNode = node.path("@type");
        if (typeNode.isArray()) {
            for (JsonNode t : typeNode) {
                if (type.equals(t.asText())) {
                    return true;
                }
            }
            return false;
        }
        return type.equals(typeNode.asText(null));
    }

    /**
     * Plain string, or an object carrying a {@code name}.
     */
    private static String nameOf(JsonNode node) {
        return node.isObject() ? text(node, "name") : scalar(node);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null ? null : scalar(value);
    }

    private static String scalar(JsonNode node) {
        if (!node.isValueNode() || node.isNull()) {
            return null;
        }
        return blankToNull(node.asText());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    /**
     * ISO-8601 with offset, without offset (UTC) or date-only (start of day UTC).
     */
    static Instant parseDate(String value) {
        if (value == null) {
            return null;
        }
        String text = value.length() > 10 ? value.replace(' ', 'T') : value;

        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through to zone-less forms
        }
        try {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // fall through to date-only
        }
        try {
            return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            logger.debug("Unparsable date '{}'", value);
            return null;
        }
    }
}
