package io.seriesfetch.analytics;

import java.time.Instant;
import java.time.LocalDate;
import java.util.OptionalDouble;

/**
 * Dashboard-ready bundle: both daily series plus period totals compared with the period before.
 */
public record AnalyticsReport(Metadata metadata, NormalizedSeries dailyUsers, NormalizedSeries dailyRevenue,
                              Summary summary) {

    public record Metadata(String propertyId, LocalDate startDate, LocalDate endDate, Instant generatedAt) {}

    public record Summary(long totalUsers, long activeUsers, double totalRevenue, double adRevenue,
                          double inAppPurchaseRevenue, double sessionDurationMinutes, double arpu,
                          PeriodTotals previousPeriod, Deltas deltas) {}

    public record PeriodTotals(long totalUsers, long activeUsers, double totalRevenue, double adRevenue,
                               double inAppPurchaseRevenue) {
        public static final PeriodTotals ZERO = new PeriodTotals(0, 0, 0.0, 0.0, 0.0);

        /** Sums daily users and revenue; ad revenue is taken from the totals, never below 0. */
        public static PeriodTotals of(NormalizedSeries users, NormalizedSeries revenue) {
            double total = revenue.sum(MetricCatalog.TOTAL_REVENUE);
            double purchase = revenue.sum(MetricCatalog.PURCHASE_REVENUE);
            return new PeriodTotals(
                    Math.round(users.sum(MetricCatalog.TOTAL_USERS)),
                    Math.round(users.sum(MetricCatalog.ACTIVE_USERS)),
                    total, Math.max(0.0, total - purchase), purchase);
        }
    }

    /** Percentage changes against the previous period; null where the previous value was 0. */
    public record Deltas(Double totalUsers, Double activeUsers, Double totalRevenue, Double adRevenue,
                         Double inAppPurchaseRevenue) {
        public static Deltas between(PeriodTotals current, PeriodTotals previous) {
            return new Deltas(
                    boxed(DateRanges.delta(current.totalUsers(), previous.totalUsers())),
                    boxed(DateRanges.delta(current.activeUsers(), previous.activeUsers())),
                    boxed(DateRanges.delta(current.totalRevenue(), previous.totalRevenue())),
                    boxed(DateRanges.delta(current.adRevenue(), previous.adRevenue())),
                    boxed(DateRanges.delta(current.inAppPurchaseRevenue(), previous.inAppPurchaseRevenue())));
        }

        private static Double boxed(OptionalDouble d) {
            return d.isPresent() ? d.getAsDouble() : null;
        }
    }
}
