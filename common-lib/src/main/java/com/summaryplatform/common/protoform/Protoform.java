package com.summaryplatform.common.protoform;

import com.summaryplatform.common.exception.InvalidInputException;

import java.util.Arrays;
import java.util.List;

/**
 * Fuzzy building blocks for linguistic summaries of the form
 * "Q of X are P".
 *
 * <p>Three trapezoid shapes are offered:
 * <pre>
 *   trapmf(a, b, c, d)   0 ../‾‾‾‾\.. 0     rises a→b, plateau b→c, falls c→d
 *   trapmfL(c, d)        1 ‾‾‾‾\.... 0     left shoulder
 *   trapmfR(a, b)        0 ..../‾‾‾‾ 1     right shoulder
 * </pre>
 *
 * <p>Every returned function is clamped to [0, 1] and rejects NaN input.
 * No state. No Spring dependency.
 */
public final class Protoform {

    private static final String COMPONENT = "Protoform";

    private Protoform() { /* utility class */ }

    // ── Membership functions ────────────────────────────────────────

    public static MembershipFunction trapmf(double a, double b, double c, double d) {
        requireBreakpoints(a, b, c, d);
        return value -> {
            requireNumber(value);
            if (value < a) return 0.0;
            if (value < b) return clamp((value - a) / (b - a));
            if (value <= c) return 1.0;
            if (value < d) return clamp((d - value) / (d - c));
            return 0.0;
        };
    }

    public static MembershipFunction trapmfL(double c, double d) {
        requireBreakpoints(c, d);
        return value -> {
            requireNumber(value);
            if (value <= c) return 1.0;
            if (value < d) return clamp((d - value) / (d - c));
            return 0.0;
        };
    }

    public static MembershipFunction trapmfR(double a, double b) {
        requireBreakpoints(a, b);
        return value -> {
            requireNumber(value);
            if (value < a) return 0.0;
            if (value < b) return clamp((value - a) / (b - a));
            return 1.0;
        };
    }

    // ── Quantifier affirmation ──────────────────────────────────────

    /**
     * Sigma-count: the normalized fuzzy cardinality of {@code points} in the set
     * described by {@code membership}. An empty set yields 0.
     */
    public static <T> double sigmaCountQA(List<T> points, PointMembershipFunction<? super T> membership) {
        if (points == null || points.isEmpty()) return 0.0;

        double sum = 0.0;
        for (T point : points) {
            sum += membership.degree(point);
        }
        return clamp(sum / points.size());
    }

    /**
     * Truth degree of "Q of the points are P" where {@code quantifier} is the
     * membership function of Q over the sigma-count ratio.
     */
    public static <T> double sigmaCountQA(List<T> points,
                                          PointMembershipFunction<? super T> membership,
                                          MembershipFunction quantifier) {
        return quantifier.degree(sigmaCountQA(points, membership));
    }

    // ── Helpers ─────────────────────────────────────────────────────

    static double clamp(double degree) {
        return Math.min(1.0, Math.max(0.0, degree));
    }

    private static void requireNumber(double value) {
        if (Double.isNaN(value)) {
            throw new InvalidInputException(COMPONENT, "Membership input must be a number, got NaN");
        }
    }

    private static void requireBreakpoints(double... breakpoints) {
        for (int i = 0; i < breakpoints.length; i++) {
            if (!Double.isFinite(breakpoints[i])) {
                throw new InvalidInputException(COMPONENT, "Breakpoint " + i + " is not finite: " + breakpoints[i]);
            }
            if (i > 0 && breakpoints[i] < breakpoints[i - 1]) {
                throw new InvalidInputException(COMPONENT, "Breakpoints must be non-decreasing, got "
                    + Arrays.toString(breakpoints));
            }
        }
    }
}
