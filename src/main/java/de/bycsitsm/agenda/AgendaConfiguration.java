package de.bycsitsm.agenda;

import de.bycsitsm.agenda.source.CalendarSource;
import de.bycsitsm.agenda.source.RegisteredSource;
import de.bycsitsm.agenda.source.SourceRegistry;
import de.bycsitsm.agenda.source.caldav.CalDavSourceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Infrastructure beans shared by all components. Everything built here is
 * created once at startup and never changed afterwards.
 */
@Configuration
class AgendaConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AgendaConfiguration.class);

    @Bean
    Clock clock(AgendaProperties properties) {
        return Clock.system(ZoneId.of(properties.timezone()));
    }

    @Bean
    SourceRegistry sourceRegistry(AgendaProperties properties, CalDavSourceAdapter calDavSourceAdapter) {
        var sources = properties.sources().stream()
                .map(source -> new RegisteredSource(
                        new CalendarSource(source.id(), source.displayName(), source.kind(), source.url()),
                        calDavSourceAdapter))
                .toList();
        if (sources.isEmpty()) {
            log.warn("No calendar sources configured. Set agenda.sources[0].id and agenda.sources[0].url.");
        } else {
            log.info("Configured {} calendar source(s): {}", sources.size(),
                    sources.stream().map(registered -> registered.source().id()).toList());
        }
        return new SourceRegistry(sources);
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService sourceExecutor() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            var thread = new Thread(runnable, "agenda-source-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
