package io.seriesfetch.analytics;

import io.seriesfetch.retry.ExponentialBackoffRetryPolicy;
import io.seriesfetch.retry.FailureClassifier;
import io.seriesfetch.retry.RetryExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class AnalyticsReportServiceTest {
    private final Clock clock = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);
    private final LocalDate currentStart = LocalDate.of(2024, 3, 11);
    private PipelineOrchestrator orchestrator;

    private final ScriptedTransport transport = new ScriptedTransport((metric, date) -> {
        switch (metric) {
            case "totalUsers": return "10";
            case "activeUsers": return "5";
            case "averageSessionDuration": return date.getDayOfMonth() % 2 == 0 ? "120" : "0";
            case "totalRevenue": return "3";
            case "purchaseRevenue": return "1";
            default: return "0";
        }
    });

    @AfterEach
    void close() {
        if (orchestrator != null) orchestrator.close();
    }

    private AnalyticsReportService service() {
        orchestrator = PipelineOrchestrator.builder()
                .transport(transport)
                .propertyId("42")
                .clock(clock)
                .retry(new RetryExecutor(new ExponentialBackoffRetryPolicy(2, 1, 1), FailureClassifier.DEFAULT, millis -> {}, null))
                .build();
        return new AnalyticsReportService(orchestrator, "42", clock);
    }

    @Test
    void buildsSummaryFromDailySeries() throws Exception {
        AnalyticsReport report = service().buildReport(4);

        assertEquals("42", report.metadata().propertyId());
        assertEquals(currentStart, report.metadata().startDate());
        assertEquals(LocalDate.of(2024, 3, 14), report.metadata().endDate());
        assertEquals(clock.instant(), report.metadata().generatedAt());
        assertEquals(4, report.dailyUsers().size());
        assertEquals(4, report.dailyRevenue().size());
        assertEquals(2.0, report.dailyRevenue().rows().get(0).value("adRevenue"), 1e-9);

        AnalyticsReport.Summary s = report.summary();
        assertEquals(40, s.totalUsers());
        assertEquals(20, s.activeUsers());
        assertEquals(12.0, s.totalRevenue(), 1e-9);
        assertEquals(4.0, s.inAppPurchaseRevenue(), 1e-9);
        assertEquals(8.0, s.adRevenue(), 1e-9);
        assertEquals(0.3, s.arpu(), 1e-9);
        assertEquals(2.0, s.sessionDurationMinutes(), 1e-9);

        assertEquals(40, s.previousPeriod().totalUsers());
        assertEquals(0.0, s.deltas().totalUsers(), 1e-9);
        assertEquals(0.0, s.deltas().adRevenue(), 1e-9);
        assertEquals(4, transport.callCount());
    }

    @Test
    void previousPeriodFailureDegradesToZeros() throws Exception {
        transport.hook((call, n) -> {
            if (call.start().isBefore(currentStart)) throw new AuthException("403 on previous period");
        });

        AnalyticsReport.Summary s = service().buildReport(4).summary();

        assertEquals(AnalyticsReport.PeriodTotals.ZERO, s.previousPeriod());
        assertNull(s.deltas().totalUsers());
        assertNull(s.deltas().totalRevenue());
        assertEquals(40, s.totalUsers());
    }

    @Test
    void currentPeriodFailureFailsTheReport() {
        transport.hook((call, n) -> { throw new AuthException("401"); });
        assertThrows(AuthException.class, () -> service().buildReport(4));
    }

    @Test
    void reportSerializesWithIsoDates() throws Exception {
        String json = AnalyticsJson.MAPPER.writeValueAsString(service().buildReport(2));

        assertTrue(json.contains("\"startDate\":\"2024-03-13\""), json);
        assertTrue(json.contains("\"dailyUsers\":[{\"date\":\"2024-03-13\""), json);
        assertTrue(json.contains("\"generatedAt\":\"2024-03-15T10:00:00Z\""), json);
    }

    @Test
    void sessionDurationIgnoresZeroDays() {
        NormalizedSeries none = NormalizedSeries.empty();
        assertEquals(0.0, AnalyticsReportService.sessionDurationMinutes(none));
    }
}
