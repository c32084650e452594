package com.summaryplatform.common.trend;

import com.summaryplatform.common.exception.InsufficientDataException;
import com.summaryplatform.common.exception.InvalidInputException;
import com.summaryplatform.common.model.NumericPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure trend routines over {@link NumericPoint} sequences: linear regression,
 * centered moving-average smoothing and additive seasonal decomposition.
 *
 * <p>Inputs are expected in chronological (ascending x) order. Outputs are new
 * unmodifiable lists; inputs are never mutated. All routines are deterministic.
 */
public final class TrendAnalysis {

    private static final String COMPONENT = "TrendAnalysis";

    private TrendAnalysis() { /* utility class */ }

    // ── Linear regression ───────────────────────────────────────────

    /**
     * Ordinary least squares over the given points.
     *
     * @throws InsufficientDataException when fewer than two distinct x values exist
     * @throws InvalidInputException     when any coordinate is NaN or infinite
     */
    public static LinearModel fitLinearModel(List<NumericPoint> points) {
        if (points == null || points.size() < 2) {
            throw new InsufficientDataException(COMPONENT,
                "Linear fit needs at least 2 points, got " + (points == null ? 0 : points.size()));
        }
        requireFinite(points);

        int n = points.size();
        double meanX = 0, meanY = 0;
        for (NumericPoint p : points) {
            meanX += p.x();
            meanY += p.y();
        }
        meanX /= n;
        meanY /= n;

        // centered sums keep epoch-day magnitudes from eating precision
        double sxx = 0, sxy = 0;
        for (NumericPoint p : points) {
            double dx = p.x() - meanX;
            sxx += dx * dx;
            sxy += dx * (p.y() - meanY);
        }

        if (sxx == 0) {
            throw new InsufficientDataException(COMPONENT, "Linear fit needs at least 2 distinct x values");
        }

        double gradient = sxy / sxx;
        return new LinearModel(gradient, meanY - gradient * meanX);
    }

    // ── Smoothing ───────────────────────────────────────────────────

    /**
     * Averages each point with {@code window / 2} neighbours on each side. Edge
     * points without a full window are dropped, so the output is shorter than
     * the input by {@code 2 * (window / 2)} points (or empty).
     */
    public static List<NumericPoint> centeredMovingAverage(List<NumericPoint> points, int window) {
        if (window < 1) {
            throw new InvalidInputException(COMPONENT, "Moving-average window must be >= 1, got " + window);
        }
        if (points == null || points.isEmpty()) return List.of();
        requireFinite(points);

        int half = window / 2;
        List<NumericPoint> smoothed = new ArrayList<>();
        for (int i = half; i < points.size() - half; i++) {
            double sum = 0;
            for (int j = i - half; j <= i + half; j++) {
                sum += points.get(j).y();
            }
            smoothed.add(new NumericPoint(points.get(i).x(), sum / (2 * half + 1)));
        }
        return List.copyOf(smoothed);
    }

    // ── Decomposition ───────────────────────────────────────────────

    /**
     * Additive decomposition {@code observed = trend + seasonal + residual}.
     *
     * <p>Trend is the centered moving average with window {@code period}.
     * Seasonal is the mean detrended value of every phase {@code round(x) mod period},
     * broadcast back onto the points of that phase. Only indices that have a
     * trend value are retained.
     */
    public static Decomposition additiveDecompose(List<NumericPoint> points, int period) {
        if (period < 1) {
            throw new InvalidInputException(COMPONENT, "Decomposition period must be >= 1, got " + period);
        }
        List<NumericPoint> trend = centeredMovingAverage(points, period);
        if (trend.isEmpty()) return Decomposition.empty();

        int offset = period / 2;
        List<NumericPoint> observed = points.subList(offset, offset + trend.size());

        double[] phaseSums = new double[period];
        int[] phaseCounts = new int[period];
        for (int i = 0; i < trend.size(); i++) {
            int phase = phaseOf(observed.get(i).x(), period);
            phaseSums[phase] += observed.get(i).y() - trend.get(i).y();
            phaseCounts[phase]++;
        }

        List<NumericPoint> seasonal = new ArrayList<>(trend.size());
        List<NumericPoint> residual = new ArrayList<>(trend.size());
        for (int i = 0; i < trend.size(); i++) {
            NumericPoint point = observed.get(i);
            int phase = phaseOf(point.x(), period);
            double seasonalY = phaseSums[phase] / phaseCounts[phase];
            seasonal.add(new NumericPoint(point.x(), seasonalY));
            residual.add(new NumericPoint(point.x(), point.y() - trend.get(i).y() - seasonalY));
        }

        return new Decomposition(observed, trend, seasonal, residual);
    }

    // ── Helpers ─────────────────────────────────────────────────────

    private static int phaseOf(double x, int period) {
        return (int) Math.floorMod(Math.round(x), (long) period);
    }

    private static void requireFinite(List<NumericPoint> points) {
        for (NumericPoint p : points) {
            if (!Double.isFinite(p.x()) || !Double.isFinite(p.y())) {
                throw new InvalidInputException(COMPONENT, "Non-numeric point " + p);
            }
        }
    }
}
