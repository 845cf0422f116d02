package io.seriesfetch.analytics;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import io.seriesfetch.error.PipelineException;
import io.seriesfetch.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * CLI that fetches an analytics series or the full report and writes it as JSON.
 */
@CommandLine.Command(name = "analytics-report", mixinStandardHelpOptions = true,
        description = "Fetch analytics time series under quota and write them as JSON")
public final class AnalyticsReportMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(AnalyticsReportMain.class);

    enum SeriesKind { USERS, REVENUE, REPORT }

    @CommandLine.Option(names = {"-p", "--property-id"}, description = "Numeric property id; default from GA4_PROPERTY_ID")
    String propertyId;

    @CommandLine.Option(names = {"-d", "--days"}, description = "Days ending yesterday; default from GA4_DATE_RANGE_DAYS")
    Integer days;

    @CommandLine.Option(names = {"-s", "--start"}, description = "Start date (yyyy-MM-dd)")
    LocalDate startDate;

    @CommandLine.Option(names = {"-e", "--end"}, description = "End date (yyyy-MM-dd); default yesterday")
    LocalDate endDate;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output file; default stdout")
    Path output;

    @CommandLine.Option(names = "--series", description = "One of: ${COMPLETION-CANDIDATES}", defaultValue = "REPORT")
    SeriesKind series;

    private final Function<AnalyticsConfig, Module> modules;
    private final PrintStream out;

    public AnalyticsReportMain() {
        this(AnalyticsModule::new, System.out);
    }

    AnalyticsReportMain(Function<AnalyticsConfig, Module> modules, PrintStream out) {
        this.modules = modules;
        this.out = out;
    }

    public static void main(String[] args) {
        int code = commandLine(new AnalyticsReportMain()).execute(args);
        System.exit(code);
    }

    static CommandLine commandLine(AnalyticsReportMain command) {
        return new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() throws Exception {
        AnalyticsConfig config = AnalyticsConfig.fromEnv();
        if (propertyId != null) config = config.withPropertyId(propertyId);
        try {
            MetricCatalog.requirePropertyId(config.propertyId());
        } catch (InvalidArgumentException e) {
            System.err.println(e.getMessage());
            return 2;
        }

        Injector injector = Guice.createInjector(modules.apply(config));
        PipelineOrchestrator orchestrator = injector.getInstance(PipelineOrchestrator.class);
        try {
            DateRange range = DateRanges.resolve(days, startDate, endDate, config.days(), injector.getInstance(Clock.class));
            Object result = fetch(injector, orchestrator, range);
            write(result);
            Metrics metrics = injector.getInstance(Metrics.class);
            log.info("Done: {} upstream sub-request(s), {} cache hit(s), {} retry attempt(s)",
                    metrics.count("analytics.fetch.subrequests"), metrics.count("cache.hits"),
                    metrics.count("retry.attempts"));
            return 0;
        } catch (InvalidRangeException | InvalidArgumentException e) {
            System.err.println(e.getMessage());
            return 2;
        } catch (PipelineException e) {
            log.error("Fetch failed: {}", e.getMessage(), e);
            System.err.println("Fetch failed: " + e.getMessage());
            return 1;
        } finally {
            orchestrator.close();
        }
    }

    private Object fetch(Injector injector, PipelineOrchestrator orchestrator, DateRange range) throws InterruptedException {
        log.info("Fetching {} for property {} over {}", series, orchestrator.propertyId(), range);
        switch (series) {
            case USERS:
                return orchestrator.fetch(orchestrator.propertyId(), PipelineOrchestrator.DAILY_USERS_METRICS,
                        PipelineOrchestrator.DATE_ONLY, range);
            case REVENUE:
                return orchestrator.fetchDailyRevenue(range);
            case REPORT:
            default:
                return injector.getInstance(AnalyticsReportService.class).buildReport(range);
        }
    }

    private void write(Object result) throws IOException {
        String json = AnalyticsJson.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        if (output == null) {
            out.println(json);
            return;
        }
        if (output.getParent() != null) Files.createDirectories(output.getParent());
        Files.writeString(output, json + System.lineSeparator());
        log.info("Wrote {}", output);
    }
}
