package com.smoothcomp.calendar.infrastructure.staticsite;

import com.smoothcomp.calendar.application.RefreshEventsUseCase;
import com.smoothcomp.calendar.application.RefreshSummary;
import com.smoothcomp.calendar.infrastructure.config.SmoothcompProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Batch mode: one refresh, one export, then the process exits.
 * Exit code is 1 when the refresh did not complete; the export still runs so the
 * output reflects the best data in the store.
 */
@Component
@ConditionalOnProperty(prefix = "smoothcomp.static-site", name = "enabled", havingValue = "true")
public class StaticSiteRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StaticSiteRunner.class);

    private final RefreshEventsUseCase refreshEvents;
    private final StaticSiteExporter exporter;
    private final ConfigurableApplicationContext context;
    private final Path outputDir;

    public StaticSiteRunner(RefreshEventsUseCase refreshEvents,
                            StaticSiteExporter exporter,
                            ConfigurableApplicationContext context,
                            SmoothcompProperties properties) {
        this.refreshEvents = refreshEvents;
        this.exporter = exporter;
        this.context = context;
        this.outputDir = Path.of(properties.getStaticSite().getOutputDir());
    }

    @Override
    public void run(ApplicationArguments args) {
        logger.info("Static mode, output directory: {}", outputDir.toAbsolutePath());

        int exitCode = generate();
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }

    int generate() {
        Optional<RefreshSummary> summary = refreshEvents.refreshIfIdle();
        boolean refreshed = summary.map(RefreshSummary::isCompleted).orElse(false);
        if (!refreshed) {
            logger.warn("Refresh did not complete ({}), exporting current store contents",
                    summary.map(s -> s.status() + ": " + s.error()).orElse("another refresh was running"));
        }

        StaticMetadata metadata = exporter.export(outputDir);
        logger.info("Done: {} events, {} countries", metadata.total_events(), metadata.countries().size());
        return refreshed ? 0 : 1;
    }
}
