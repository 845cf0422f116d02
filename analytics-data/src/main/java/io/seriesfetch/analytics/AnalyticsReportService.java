package io.seriesfetch.analytics;

import io.seriesfetch.error.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Builds {@link AnalyticsReport}s through the orchestrator, so every series it needs is split, quota-governed,
 * retried and cached like any other fetch.
 */
public class AnalyticsReportService {
    private static final Logger log = LoggerFactory.getLogger(AnalyticsReportService.class);

    static final List<String> USER_METRICS = List.of(
            MetricCatalog.TOTAL_USERS, MetricCatalog.ACTIVE_USERS, MetricCatalog.AVERAGE_SESSION_DURATION);

    private final PipelineOrchestrator orchestrator;
    private final String propertyId;
    private final Clock clock;

    public AnalyticsReportService(PipelineOrchestrator orchestrator, String propertyId, Clock clock) {
        this.orchestrator = orchestrator;
        this.propertyId = MetricCatalog.requirePropertyId(propertyId);
        this.clock = clock;
    }

    public AnalyticsReport buildReport(int days) throws InterruptedException {
        return buildReport(DateRanges.lastDays(days, clock));
    }

    public AnalyticsReport buildReport(LocalDate start, LocalDate end) throws InterruptedException {
        return buildReport(new DateRange(start, end));
    }

    public AnalyticsReport buildReport(DateRange range) throws InterruptedException {
        log.info("Building report for property {} over {}", propertyId, range);
        NormalizedSeries users = orchestrator.fetch(propertyId, USER_METRICS, PipelineOrchestrator.DATE_ONLY, range);
        NormalizedSeries revenue = fetchRevenue(range);

        AnalyticsReport.PeriodTotals current = AnalyticsReport.PeriodTotals.of(users, revenue);
        AnalyticsReport.PeriodTotals previous = previousPeriodTotals(DateRanges.previousPeriod(range));
        double arpu = current.totalUsers() > 0 ? current.totalRevenue() / current.totalUsers() : 0.0;

        AnalyticsReport.Summary summary = new AnalyticsReport.Summary(
                current.totalUsers(), current.activeUsers(), current.totalRevenue(), current.adRevenue(),
                current.inAppPurchaseRevenue(), sessionDurationMinutes(users), arpu,
                previous, AnalyticsReport.Deltas.between(current, previous));
        return new AnalyticsReport(
                new AnalyticsReport.Metadata(propertyId, range.start(), range.end(), clock.instant()),
                users, revenue, summary);
    }

    /** Mean of the days with a positive average session duration, seconds converted to minutes. */
    static double sessionDurationMinutes(NormalizedSeries users) {
        double sum = 0;
        int n = 0;
        for (NormalizedRow row : users.rows()) {
            double seconds = row.value(MetricCatalog.AVERAGE_SESSION_DURATION);
            if (seconds > 0) {
                sum += seconds;
                n++;
            }
        }
        return n == 0 ? 0.0 : sum / n / 60.0;
    }

    private NormalizedSeries fetchRevenue(DateRange range) throws InterruptedException {
        return orchestrator.fetch(propertyId, PipelineOrchestrator.DAILY_REVENUE_METRICS, PipelineOrchestrator.DATE_ONLY, range)
                .withDerived(MetricCatalog.AD_REVENUE, PipelineOrchestrator::adRevenue);
    }

    private AnalyticsReport.PeriodTotals previousPeriodTotals(DateRange previous) throws InterruptedException {
        try {
            NormalizedSeries users = orchestrator.fetch(propertyId, PipelineOrchestrator.DAILY_USERS_METRICS,
                    PipelineOrchestrator.DATE_ONLY, previous);
            return AnalyticsReport.PeriodTotals.of(users, fetchRevenue(previous));
        } catch (PipelineException e) {
            log.warn("Previous period {} unavailable, comparing against zeros: {}", previous, e.getMessage());
            return AnalyticsReport.PeriodTotals.ZERO;
        }
    }
}
