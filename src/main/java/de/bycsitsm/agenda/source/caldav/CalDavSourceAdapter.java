package de.bycsitsm.agenda.source.caldav;

import de.bycsitsm.agenda.AgendaException;
import de.bycsitsm.agenda.EventNotFoundException;
import de.bycsitsm.agenda.SourceUnavailableException;
import de.bycsitsm.agenda.ValidationException;
import de.bycsitsm.agenda.source.CalendarSource;
import de.bycsitsm.agenda.source.CanonicalEvent;
import de.bycsitsm.agenda.source.DraftEvent;
import de.bycsitsm.agenda.source.EventPatch;
import de.bycsitsm.agenda.source.SourceAdapter;
import de.bycsitsm.agenda.time.TimeNormalizer;
import de.bycsitsm.agenda.time.TimeWindow;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.IOException;
import java.io.StringReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * {@link SourceAdapter} for CalDAV servers, using Java's built-in {@link HttpClient}.
 * <p>
 * Events are listed with a {@code calendar-query} REPORT restricted to the
 * requested time range. Each event is stored as its own {@code .ics} resource,
 * and the resource href serves as the event id. Writes are single
 * {@code PUT}/{@code DELETE} requests guarded by ETags; nothing is retried.
 */
@Component
public class CalDavSourceAdapter implements SourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(CalDavSourceAdapter.class);

    private static final String DAV_NS = "DAV:";
    private static final String CALDAV_NS = "urn:ietf:params:xml:ns:caldav";

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private static final DateTimeFormatter CALDAV_UTC = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'")
            .withZone(ZoneOffset.UTC);

    private static final Pattern OCCURRENCE_ID = Pattern.compile(".+"
            + EventICalMapper.OCCURRENCE_SEPARATOR + "-?\\d+$");

    /**
     * XML body for a REPORT request that fetches all events overlapping a time range.
     */
    private static final String CALENDAR_QUERY_XML = """
            <?xml version="1.0" encoding="UTF-8"?>
            <c:calendar-query xmlns:d="DAV:" xmlns:c="urn:ietf:params:xml:ns:caldav">
              <d:prop>
                <d:getetag/>
                <c:calendar-data/>
              </d:prop>
              <c:filter>
                <c:comp-filter name="VCALENDAR">
                  <c:comp-filter name="VEVENT">
                    <c:time-range start="%s" end="%s"/>
                  </c:comp-filter>
                </c:comp-filter>
              </c:filter>
            </c:calendar-query>
            """;

    private final CalDavProperties properties;
    private final EventICalMapper mapper;
    private final HttpClient httpClient;

    public CalDavSourceAdapter(CalDavProperties properties, TimeNormalizer timeNormalizer) {
        this.properties = properties;
        this.mapper = new EventICalMapper(timeNormalizer.zone());

        var clientBuilder = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (properties.trustAllCertificates()) {
            log.warn("CalDAV adapter is configured to accept all SSL certificates including self-signed. "
                    + "Set agenda.caldav.trust-all-certificates=false to enforce certificate validation.");
            clientBuilder.sslContext(createTrustAllSslContext());
        }
        this.httpClient = clientBuilder.build();
    }

    @Override
    public List<CanonicalEvent> list(CalendarSource source, Instant windowStart, Instant windowEnd) {
        var window = new TimeWindow(windowStart, windowEnd);
        var url = normalizeUrl(source.externalRef());
        var body = CALENDAR_QUERY_XML.formatted(CALDAV_UTC.format(windowStart), CALDAV_UTC.format(windowEnd));

        log.debug("Sending REPORT calendar-query to {} for {} - {}", url, windowStart, windowEnd);
        var response = send(source, request(url)
                .method("REPORT", HttpRequest.BodyPublishers.ofString(body))
                .header("Content-Type", "application/xml; charset=utf-8")
                .header("Depth", "1"));

        if (response.statusCode() != 207) {
            throw unavailable(source, response.statusCode(), "list events");
        }

        var events = new ArrayList<CanonicalEvent>();
        for (var resource : parseCalendarQueryResponse(source, response.body())) {
            try {
                events.addAll(mapper.toEvents(source, resource.href(), resource.calendarData(), window));
            } catch (RuntimeException e) {
                log.warn("Skipping unreadable resource {} in calendar {}: {}", resource.href(), source.id(),
                        e.getMessage());
            }
        }
        log.debug("Calendar {} returned {} event(s)", source.id(), events.size());
        return events;
    }

    @Override
    public CanonicalEvent create(CalendarSource source, DraftEvent draft) {
        if (draft.title() == null || draft.title().isBlank()) {
            throw new ValidationException("Cannot create an event in '" + source.displayName() + "' without a title.");
        }
        if (draft.start() == null) {
            throw new ValidationException("Cannot create '" + draft.title() + "' without a start time.");
        }

        var uid = UUID.randomUUID().toString();
        var url = normalizeUrl(source.externalRef()) + uid + ".ics";
        var payload = mapper.toICalendar(uid, draft);

        log.info("Creating '{}' in calendar {}", draft.title(), source.id());
        var response = send(source, request(url)
                .PUT(HttpRequest.BodyPublishers.ofString(payload))
                .header("Content-Type", "text/calendar; charset=utf-8")
                .header("If-None-Match", "*"));

        switch (response.statusCode()) {
            case 200, 201, 204 -> log.info("Created '{}' at {}", draft.title(), url);
            default -> throw unavailable(source, response.statusCode(), "create '" + draft.title() + "'");
        }

        var href = URI.create(url).getPath();
        var created = mapper.toMasterEvent(source, href, payload);
        if (created == null) {
            throw new AgendaException("Created event '" + draft.title() + "' could not be read back.");
        }
        return created;
    }

    @Override
    public CanonicalEvent update(CalendarSource source, String externalEventId, EventPatch patch) {
        requireWholeResource(externalEventId);
        var url = resolveHref(normalizeUrl(source.externalRef()), externalEventId);

        log.debug("Sending GET to {}", url);
        var current = send(source, request(url).GET());
        if (current.statusCode() == 404 || current.statusCode() == 410) {
            throw new EventNotFoundException("Event " + externalEventId + " no longer exists in calendar '"
                    + source.displayName() + "'.");
        }
        if (current.statusCode() != 200) {
            throw unavailable(source, current.statusCode(), "read event " + externalEventId);
        }

        var patched = mapper.applyPatch(current.body(), patch);
        if (patched == null) {
            throw new EventNotFoundException("Resource " + externalEventId + " in calendar '"
                    + source.displayName() + "' holds no event.");
        }

        var put = request(url)
                .PUT(HttpRequest.BodyPublishers.ofString(patched))
                .header("Content-Type", "text/calendar; charset=utf-8");
        current.headers().firstValue("ETag").ifPresent(etag -> put.header("If-Match", etag));

        log.info("Updating event {} in calendar {}", externalEventId, source.id());
        var response = send(source, put);
        switch (response.statusCode()) {
            case 200, 201, 204 -> log.info("Updated event {} in calendar {}", externalEventId, source.id());
            default -> throw unavailable(source, response.statusCode(), "update event " + externalEventId);
        }

        var updated = mapper.toMasterEvent(source, externalEventId, patched);
        if (updated == null) {
            throw new AgendaException("Updated event " + externalEventId + " could not be read back.");
        }
        return updated;
    }

    @Override
    public void delete(CalendarSource source, String externalEventId) {
        requireWholeResource(externalEventId);
        var url = resolveHref(normalizeUrl(source.externalRef()), externalEventId);

        log.info("Deleting event {} from calendar {}", externalEventId, source.id());
        var response = send(source, request(url).DELETE());
        switch (response.statusCode()) {
            case 200, 202, 204 -> log.info("Deleted event {} from calendar {}", externalEventId, source.id());
            case 404, 410 -> throw new EventNotFoundException("Event " + externalEventId
                    + " is already absent from calendar '" + source.displayName() + "'.");
            default -> throw unavailable(source, response.statusCode(), "delete event " + externalEventId);
        }
    }

    @Override
    public boolean isWritable(String externalEventId) {
        return !OCCURRENCE_ID.matcher(externalEventId).matches();
    }

    /**
     * A calendar object resource returned by a {@code calendar-query} REPORT.
     *
     * @param href         the path of the resource
     * @param etag         the entity tag, if the server sent one
     * @param calendarData the iCalendar text
     */
    record CalendarResource(String href, @Nullable String etag, String calendarData) {
    }

    /**
     * Parses a {@code calendar-query} multistatus response into its calendar resources.
     * Responses without a successful status or without calendar data are skipped.
     */
    List<CalendarResource> parseCalendarQueryResponse(CalendarSource source, String xml) {
        var resources = new ArrayList<CalendarResource>();
        try {
            var factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            var builder = factory.newDocumentBuilder();
            var document = builder.parse(new InputSource(new StringReader(xml)));

            var responses = document.getElementsByTagNameNS(DAV_NS, "response");
            for (int i = 0; i < responses.getLength(); i++) {
                var response = (Element) responses.item(i);
                var href = getTextContent(response, DAV_NS, "href");
                if (href == null || href.isBlank()) {
                    continue;
                }

                if (!isSuccessResponse(response)) {
                    continue;
                }

                var calendarData = getPropertyText(response, CALDAV_NS, "calendar-data");
                if (calendarData == null) {
                    continue;
                }

                resources.add(new CalendarResource(href.strip(), getPropertyText(response, DAV_NS, "getetag"),
                        calendarData));
            }
        } catch (Exception e) {
            throw new SourceUnavailableException(source.id(), "Calendar '" + source.displayName()
                    + "' sent an unreadable response: " + e.getMessage(), e);
        }
        return resources;
    }

    private HttpResponse<String> send(CalendarSource source, HttpRequest.Builder builder) {
        try {
            return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SourceUnavailableException(source.id(), "Calendar '" + source.displayName()
                    + "' is unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(source.id(), "Request to calendar '" + source.displayName()
                    + "' was interrupted.", e);
        }
    }

    private HttpRequest.Builder request(String url) {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(REQUEST_TIMEOUT);
        if (!properties.username().isBlank()) {
            var credentials = Base64.getEncoder().encodeToString(
                    (properties.username() + ":" + properties.password()).getBytes(StandardCharsets.UTF_8));
            builder.header("Authorization", "Basic " + credentials);
        }
        return builder;
    }

    private SourceUnavailableException unavailable(CalendarSource source, int status, String action) {
        var reason = switch (status) {
            case 401 -> "authentication failed, please check the configured username and password";
            case 403 -> "access denied";
            case 404 -> "calendar URL not found, please check the URL";
            case 412 -> "the event was changed on the server in the meantime";
            default -> "server returned unexpected status " + status;
        };
        return new SourceUnavailableException(source.id(),
                "Could not " + action + " in calendar '" + source.displayName() + "': " + reason + ".");
    }

    private void requireWholeResource(String externalEventId) {
        if (!isWritable(externalEventId)) {
            throw new ValidationException("Event " + externalEventId
                    + " is one occurrence of a recurring series and cannot be changed on its own.");
        }
    }

    private boolean isSuccessResponse(Element response) {
        var propstats = response.getElementsByTagNameNS(DAV_NS, "propstat");
        for (int i = 0; i < propstats.getLength(); i++) {
            var propstat = (Element) propstats.item(i);
            var statusText = getTextContent(propstat, DAV_NS, "status");
            if (statusText != null && statusText.contains("200")) {
                return true;
            }
        }
        return false;
    }

    private @Nullable String getPropertyText(Element response, String namespace, String localName) {
        var propstats = response.getElementsByTagNameNS(DAV_NS, "propstat");
        for (int i = 0; i < propstats.getLength(); i++) {
            var propstat = (Element) propstats.item(i);
            var props = propstat.getElementsByTagNameNS(DAV_NS, "prop");
            for (int j = 0; j < props.getLength(); j++) {
                var prop = (Element) props.item(j);
                var elements = prop.getElementsByTagNameNS(namespace, localName);
                if (elements.getLength() > 0) {
                    var text = elements.item(0).getTextContent();
                    return (text != null && !text.isBlank()) ? text.strip() : null;
                }
            }
        }
        return null;
    }

    private @Nullable String getTextContent(Element parent, String namespace, String localName) {
        var elements = parent.getElementsByTagNameNS(namespace, localName);
        if (elements.getLength() > 0) {
            return elements.item(0).getTextContent();
        }
        return null;
    }

    /**
     * Resolves an href (which may be relative) against the collection URL
     * to produce an absolute URL.
     */
    String resolveHref(String baseUrl, String href) {
        if (href.startsWith("http://") || href.startsWith("https://")) {
            return href;
        }
        return URI.create(baseUrl).resolve(href).toString();
    }

    String normalizeUrl(String url) {
        var normalized = url.strip();
        if (!normalized.endsWith("/")) {
            normalized += "/";
        }
        if (!normalized.startsWith("http://") && !normalized.startsWith("https://")) {
            normalized = "https://" + normalized;
        }
        return normalized;
    }

    /**
     * Creates an {@link SSLContext} that trusts all certificates, including self-signed ones.
     */
    private static SSLContext createTrustAllSslContext() {
        try {
            var trustAllManager = new X509TrustManager() {
                @Override
                public void checkClientTrusted(X509Certificate[] chain, String authType) {
                    // Trust all client certificates
                }

                @Override
                public void checkServerTrusted(X509Certificate[] chain, String authType) {
                    // Trust all server certificates
                }

                @Override
                public X509Certificate[] getAcceptedIssuers() {
                    return new X509Certificate[0];
                }
            };

            var sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, new TrustManager[]{trustAllManager}, null);
            return sslContext;
        } catch (NoSuchAlgorithmException | KeyManagementException e) {
            throw new AgendaException("Failed to create SSL context for trusting all certificates.", e);
        }
    }
}
