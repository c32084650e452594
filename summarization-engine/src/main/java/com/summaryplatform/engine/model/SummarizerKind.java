package com.summaryplatform.engine.model;

/**
 * Closed set of summarizers the engine can run. Dispatch over it is done with
 * exhaustive {@code switch} expressions.
 */
public enum SummarizerKind {
    TREND_WEEKLY_ELABORATION,
    WEEKDAY_WEEKEND_RELATIVE,
    TREND_WEEKLY_COMPARISON_AVERAGE,
    TREND_WEEKLY_COMPARISON_RATE;

    /**
     * Heading shown above the summaries of this kind.
     */
    public String title() {
        return switch (this) {
            case TREND_WEEKLY_ELABORATION        -> "Trend Weekly Elaboration";
            case WEEKDAY_WEEKEND_RELATIVE        -> "Weekday Weekend Relative";
            case TREND_WEEKLY_COMPARISON_AVERAGE -> "Trend Weekly Comparison - Average";
            case TREND_WEEKLY_COMPARISON_RATE    -> "Trend Weekly Comparison - Rate";
        };
    }
}
