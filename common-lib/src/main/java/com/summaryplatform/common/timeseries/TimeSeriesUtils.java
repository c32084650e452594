package com.summaryplatform.common.timeseries;

import com.summaryplatform.common.exception.InsufficientDataException;
import com.summaryplatform.common.exception.InvalidInputException;
import com.summaryplatform.common.model.NumericPoint;
import com.summaryplatform.common.model.TimeSeriesPoint;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Conversion, grouping and rescaling helpers for time series.
 *
 * <p>Time is expressed in local days since the epoch once a series is numeric,
 * so a week is a period of {@value #WEEK_LENGTH}.
 */
public final class TimeSeriesUtils {

    public static final double DAY_MILLIS = 86_400_000d;
    public static final int WEEK_LENGTH = 7;
    public static final double EPSILON = 1e-5;

    private static final String COMPONENT = "TimeSeriesUtils";

    private TimeSeriesUtils() { /* utility class */ }

    // ── Conversion ──────────────────────────────────────────────────

    public static NumericPoint toNumericPoint(TimeSeriesPoint point) {
        return toNumericPoint(point, ZoneOffset.UTC);
    }

    /**
     * Maps a timestamp to days since the epoch on the wall clock of {@code zone}.
     * Local midnights land on whole days even across daylight-saving changes,
     * so calendar days and weeks stay contiguous.
     */
    public static NumericPoint toNumericPoint(TimeSeriesPoint point, ZoneId zone) {
        if (point == null || point.x() == null) {
            throw new InvalidInputException(COMPONENT, "Time series point without timestamp");
        }
        LocalDateTime local = LocalDateTime.ofInstant(point.x(), zone);
        return new NumericPoint(local.toInstant(ZoneOffset.UTC).toEpochMilli() / DAY_MILLIS, point.y());
    }

    public static List<NumericPoint> toNumericPoints(List<TimeSeriesPoint> points) {
        return toNumericPoints(points, ZoneOffset.UTC);
    }

    /**
     * Converts to numeric form in {@code zone} and sorts chronologically.
     */
    public static List<NumericPoint> toNumericPoints(List<TimeSeriesPoint> points, ZoneId zone) {
        if (points == null || points.isEmpty()) return List.of();
        List<NumericPoint> numeric = new ArrayList<>(points.size());
        for (TimeSeriesPoint point : points) {
            numeric.add(toNumericPoint(point, zone));
        }
        numeric.sort(Comparator.comparingDouble(NumericPoint::x));
        return Collections.unmodifiableList(numeric);
    }

    // ── Grouping ────────────────────────────────────────────────────

    /**
     * Partitions points into contiguous, non-overlapping buckets of
     * {@code periodLength} counted from the earliest point. Buckets come back in
     * chronological order, a trailing partial bucket is kept, and a period with
     * no observations produces no bucket.
     */
    public static List<List<NumericPoint>> groupByPeriod(List<NumericPoint> points, double periodLength) {
        if (!(periodLength > 0) || !Double.isFinite(periodLength)) {
            throw new InvalidInputException(COMPONENT, "Period length must be positive, got " + periodLength);
        }
        if (points == null || points.isEmpty()) return List.of();

        List<NumericPoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparingDouble(NumericPoint::x));
        double origin = sorted.get(0).x();

        Map<Long, List<NumericPoint>> buckets = new TreeMap<>();
        for (NumericPoint point : sorted) {
            if (!Double.isFinite(point.x())) {
                throw new InvalidInputException(COMPONENT, "Non-numeric point " + point);
            }
            long index = (long) Math.floor((point.x() - origin) / periodLength);
            buckets.computeIfAbsent(index, k -> new ArrayList<>()).add(point);
        }

        List<List<NumericPoint>> grouped = new ArrayList<>(buckets.size());
        for (List<NumericPoint> bucket : buckets.values()) {
            grouped.add(List.copyOf(bucket));
        }
        return List.copyOf(grouped);
    }

    public static List<List<NumericPoint>> groupByWeek(List<NumericPoint> points) {
        return groupByPeriod(points, WEEK_LENGTH);
    }

    // ── Normalization ───────────────────────────────────────────────

    /**
     * Rescales both x and y linearly onto [0, 1]. A degenerate range maps to 0.
     */
    public static List<NumericPoint> normalize(List<NumericPoint> points) {
        return rescale(points, true);
    }

    /**
     * Rescales y onto [0, 1] and leaves x untouched.
     */
    public static List<NumericPoint> normalizeY(List<NumericPoint> points) {
        return rescale(points, false);
    }

    private static List<NumericPoint> rescale(List<NumericPoint> points, boolean includeX) {
        if (points == null || points.isEmpty()) return List.of();

        double minX = Double.POSITIVE_INFINITY, maxX = Double.NEGATIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
        for (NumericPoint p : points) {
            if (!Double.isFinite(p.x()) || !Double.isFinite(p.y())) {
                throw new InvalidInputException(COMPONENT, "Non-numeric point " + p);
            }
            minX = Math.min(minX, p.x());
            maxX = Math.max(maxX, p.x());
            minY = Math.min(minY, p.y());
            maxY = Math.max(maxY, p.y());
        }

        List<NumericPoint> rescaled = new ArrayList<>(points.size());
        for (NumericPoint p : points) {
            double x = includeX ? scale(p.x(), minX, maxX) : p.x();
            rescaled.add(new NumericPoint(x, scale(p.y(), minY, maxY)));
        }
        return List.copyOf(rescaled);
    }

    private static double scale(double value, double min, double max) {
        double range = max - min;
        return range == 0 ? 0.0 : (value - min) / range;
    }

    // ── Statistics & calendar ───────────────────────────────────────

    public static double mean(List<NumericPoint> points) {
        if (points == null || points.isEmpty()) {
            throw new InsufficientDataException(COMPONENT, "Mean of an empty point set");
        }
        double sum = 0;
        for (NumericPoint p : points) sum += p.y();
        return sum / points.size();
    }

    public static boolean isWeekend(TimeSeriesPoint point, ZoneId zone) {
        DayOfWeek day = point.x().atZone(zone).getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
