package io.seriesfetch.analytics;

import java.util.Collection;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Names the pipeline accepts, checked before anything goes upstream.
 */
public final class MetricCatalog {
    public static final String DATE = "date";

    public static final String TOTAL_USERS = "totalUsers";
    public static final String ACTIVE_USERS = "activeUsers";
    public static final String NEW_USERS = "newUsers";
    public static final String SESSIONS = "sessions";
    public static final String AVERAGE_SESSION_DURATION = "averageSessionDuration";
    public static final String SCREEN_PAGE_VIEWS = "screenPageViews";
    public static final String EVENT_COUNT = "eventCount";
    public static final String TOTAL_REVENUE = "totalRevenue";
    public static final String PURCHASE_REVENUE = "purchaseRevenue";

    /** Derived locally from total and purchase revenue; not requestable upstream. */
    public static final String AD_REVENUE = "adRevenue";

    public static final Set<String> METRICS = Set.of(
            TOTAL_USERS, ACTIVE_USERS, NEW_USERS, SESSIONS, AVERAGE_SESSION_DURATION,
            SCREEN_PAGE_VIEWS, EVENT_COUNT, TOTAL_REVENUE, PURCHASE_REVENUE);

    public static final Set<String> DIMENSIONS = Set.of(DATE);

    private static final Pattern PROPERTY_ID = Pattern.compile("\\d+");

    private MetricCatalog() {}

    public static void validate(Collection<String> metrics, Collection<String> dimensions) {
        if (metrics == null || metrics.isEmpty()) {
            throw new InvalidArgumentException("at least one metric is required");
        }
        for (String m : metrics) {
            if (!METRICS.contains(m)) throw new InvalidArgumentException("unknown metric: " + m);
        }
        if (dimensions == null || !dimensions.contains(DATE)) {
            throw new InvalidArgumentException("a time series request must include the '" + DATE + "' dimension");
        }
        for (String d : dimensions) {
            if (!DIMENSIONS.contains(d)) throw new InvalidArgumentException("unknown dimension: " + d);
        }
    }

    /** Returns the id unchanged if it is a numeric property id. */
    public static String requirePropertyId(String propertyId) {
        if (propertyId == null || propertyId.isBlank()) {
            throw new InvalidArgumentException("property id is required");
        }
        if (!PROPERTY_ID.matcher(propertyId).matches()) {
            String hint = propertyId.startsWith("G-")
                    ? " (" + propertyId + " looks like a measurement id; use the numeric property id instead)"
                    : "";
            throw new InvalidArgumentException("property id must be numeric: " + propertyId + hint);
        }
        return propertyId;
    }
}
