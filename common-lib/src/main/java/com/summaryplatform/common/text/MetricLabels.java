package com.summaryplatform.common.text;

import java.util.Locale;
import java.util.Map;

/**
 * Plural noun phrase used to name a metric inside generated sentences.
 * Known metrics have fixed labels; any other camelCase name is split into
 * lower-case words ({@code pageViews} reads "page views").
 */
public final class MetricLabels {

    private static final Map<String, String> KNOWN = Map.of(
        "activeUsers",     "active users",
        "hits",            "hits",
        "sessionsPerUser", "sessions per user");

    private MetricLabels() {}

    public static String of(String metric) {
        if (metric == null || metric.isBlank()) return "values";
        String known = KNOWN.get(metric);
        if (known != null) return known;
        return metric.replaceAll("([a-z0-9])([A-Z])", "$1 $2")
            .replace('_', ' ')
            .toLowerCase(Locale.ROOT)
            .trim();
    }
}
