package de.bycsitsm.agenda.schedule;

import de.bycsitsm.agenda.AgendaException;
import de.bycsitsm.agenda.AgendaProperties;
import de.bycsitsm.agenda.SourceUnavailableException;
import de.bycsitsm.agenda.source.CanonicalEvent;
import de.bycsitsm.agenda.source.RegisteredSource;
import de.bycsitsm.agenda.source.SourceRegistry;
import de.bycsitsm.agenda.time.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reads all configured calendars for a window and merges their events into one
 * canonical sequence.
 * <p>
 * Calendars are queried in parallel, each bounded by the configured source
 * timeout. A calendar that fails or times out is reported in
 * {@link AggregatedEvents#sourceErrors()} and left out of the result; it never
 * fails the whole read. The merged events are ordered by start, then by
 * calendar registration order, then by title, so identical backend state
 * always yields identical output.
 */
@Service
public class EventAggregator {

    private static final Logger log = LoggerFactory.getLogger(EventAggregator.class);

    private final SourceRegistry sourceRegistry;
    private final EventClassifier eventClassifier;
    private final ExecutorService sourceExecutor;
    private final Duration sourceTimeout;

    public EventAggregator(SourceRegistry sourceRegistry, EventClassifier eventClassifier,
                           ExecutorService sourceExecutor, AgendaProperties properties) {
        this.sourceRegistry = sourceRegistry;
        this.eventClassifier = eventClassifier;
        this.sourceExecutor = sourceExecutor;
        this.sourceTimeout = properties.sourceTimeout();
    }

    public AggregatedEvents aggregate(TimeWindow window) {
        return aggregate(window.start(), window.end());
    }

    /**
     * Reads every calendar for {@code [windowStart, windowEnd)}.
     *
     * @throws AgendaException if the calling thread is interrupted while waiting
     */
    public AggregatedEvents aggregate(Instant windowStart, Instant windowEnd) {
        var pending = new LinkedHashMap<RegisteredSource, Future<List<CanonicalEvent>>>();
        for (var registered : sourceRegistry.sources()) {
            pending.put(registered, sourceExecutor.submit(
                    () -> registered.adapter().list(registered.source(), windowStart, windowEnd)));
        }

        var events = new ArrayList<CanonicalEvent>();
        var sourceErrors = new LinkedHashMap<String, SourceUnavailableException>();
        var deadline = System.nanoTime() + sourceTimeout.toNanos();

        for (var entry : pending.entrySet()) {
            var source = entry.getKey().source();
            var future = entry.getValue();
            try {
                var remaining = Math.max(0, deadline - System.nanoTime());
                for (var event : future.get(remaining, TimeUnit.NANOSECONDS)) {
                    events.add(event.withKind(eventClassifier.classify(event, source)));
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                sourceErrors.put(source.id(), new SourceUnavailableException(source.id(),
                        "Calendar '" + source.displayName() + "' did not answer within "
                                + sourceTimeout.toMillis() + " ms.", e));
            } catch (ExecutionException e) {
                sourceErrors.put(source.id(), asUnavailable(entry.getKey(), e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pending.values().forEach(abandoned -> abandoned.cancel(true));
                throw new AgendaException("Reading calendars was interrupted.", e);
            }
        }

        sourceErrors.values().forEach(error -> log.warn("Calendar {} skipped: {}", error.getSourceId(),
                error.getMessage()));

        events.sort(Comparator.comparing(CanonicalEvent::start)
                .thenComparingInt(event -> sourceRegistry.orderOf(event.sourceId()))
                .thenComparing(CanonicalEvent::title)
                .thenComparing(CanonicalEvent::externalEventId));

        log.info("Aggregated {} event(s) from {} of {} calendar(s) for {} - {}", events.size(),
                pending.size() - sourceErrors.size(), pending.size(), windowStart, windowEnd);
        return new AggregatedEvents(events, sourceErrors);
    }

    private static SourceUnavailableException asUnavailable(RegisteredSource registered, Throwable cause) {
        if (cause instanceof SourceUnavailableException unavailable) {
            return unavailable;
        }
        var source = registered.source();
        return new SourceUnavailableException(source.id(),
                "Calendar '" + source.displayName() + "' failed: " + cause.getMessage(), cause);
    }
}
