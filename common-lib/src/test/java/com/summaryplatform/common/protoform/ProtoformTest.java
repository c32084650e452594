package com.summaryplatform.common.protoform;

import com.summaryplatform.common.exception.InvalidInputException;
import com.summaryplatform.common.model.NumericPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of the trapezoid membership family and sigma-count
 * quantifier affirmation.
 */
class ProtoformTest {

    private static final double[] PROBES = {
        Double.NEGATIVE_INFINITY, -1e9, -10, -2.5, -1, -0.5, 0, 0.25, 0.5, 1, 1.5, 2, 2.5,
        3, 3.5, 4, 5, 10, 1e9, Double.POSITIVE_INFINITY
    };

    // ── trapmf() ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("trapmf() symmetric trapezoid")
    class TrapmfTests {

        private final MembershipFunction fn = Protoform.trapmf(0, 1, 3, 4);

        @Test
        @DisplayName("0 outside, 1 on plateau, linear on slopes")
        void shape() {
            assertEquals(0.0, fn.degree(-1));
            assertEquals(0.0, fn.degree(0));
            assertEquals(0.5, fn.degree(0.5), 1e-12);
            assertEquals(1.0, fn.degree(1));
            assertEquals(1.0, fn.degree(2));
            assertEquals(1.0, fn.degree(3));
            assertEquals(0.5, fn.degree(3.5), 1e-12);
            assertEquals(0.0, fn.degree(4));
            assertEquals(0.0, fn.degree(10));
        }

        @Test
        @DisplayName("degree always in [0, 1] for any finite or infinite input")
        void bounded() {
            for (double probe : PROBES) {
                double degree = fn.degree(probe);
                assertTrue(degree >= 0.0 && degree <= 1.0, "degree out of range at " + probe);
            }
        }

        @Test
        @DisplayName("rising segment non-decreasing, falling segment non-increasing")
        void monotonicSegments() {
            double previous = fn.degree(0);
            for (double x = 0; x <= 1; x += 0.05) {
                double degree = fn.degree(x);
                assertTrue(degree >= previous, "rising segment dropped at " + x);
                previous = degree;
            }
            previous = fn.degree(3);
            for (double x = 3; x <= 4; x += 0.05) {
                double degree = fn.degree(x);
                assertTrue(degree <= previous, "falling segment rose at " + x);
                previous = degree;
            }
        }

        @Test
        @DisplayName("degenerate vertical edges do not divide by zero")
        void verticalEdges() {
            MembershipFunction crisp = Protoform.trapmf(1, 1, 2, 2);
            assertEquals(0.0, crisp.degree(0.999));
            assertEquals(1.0, crisp.degree(1));
            assertEquals(1.0, crisp.degree(2));
            assertEquals(0.0, crisp.degree(2.001));
        }

        @Test
        @DisplayName("NaN input → InvalidInputException")
        void nanInput() {
            assertThrows(InvalidInputException.class, () -> fn.degree(Double.NaN));
        }

        @Test
        @DisplayName("decreasing breakpoints → InvalidInputException")
        void badBreakpoints() {
            assertThrows(InvalidInputException.class, () -> Protoform.trapmf(0, 2, 1, 3));
            assertThrows(InvalidInputException.class, () -> Protoform.trapmf(0, Double.NaN, 1, 3));
        }
    }

    // ── trapmfL() / trapmfR() ─────────────────────────────────────────────

    @Nested
    @DisplayName("trapmfL() / trapmfR() shoulders")
    class ShoulderTests {

        @Test
        @DisplayName("left shoulder: 1 below c, falling to 0 at d")
        void leftShoulder() {
            MembershipFunction fn = Protoform.trapmfL(1, 3);
            assertEquals(1.0, fn.degree(Double.NEGATIVE_INFINITY));
            assertEquals(1.0, fn.degree(1));
            assertEquals(0.5, fn.degree(2), 1e-12);
            assertEquals(0.0, fn.degree(3));
            assertEquals(0.0, fn.degree(100));
        }

        @Test
        @DisplayName("right shoulder mirrors left shoulder")
        void rightShoulderMirrorsLeft() {
            MembershipFunction left = Protoform.trapmfL(-3, -1);
            MembershipFunction right = Protoform.trapmfR(1, 3);
            for (double probe : PROBES) {
                assertEquals(left.degree(-probe), right.degree(probe), 1e-12, "asymmetric at " + probe);
            }
        }

        @Test
        @DisplayName("shoulders are monotonic and bounded")
        void monotonic() {
            MembershipFunction left = Protoform.trapmfL(0, 2);
            MembershipFunction right = Protoform.trapmfR(0, 2);
            double previousLeft = 1.0;
            double previousRight = 0.0;
            for (double x = -1; x <= 3; x += 0.1) {
                assertTrue(left.degree(x) <= previousLeft);
                assertTrue(right.degree(x) >= previousRight);
                previousLeft = left.degree(x);
                previousRight = right.degree(x);
            }
        }

        @Test
        @DisplayName("NaN input → InvalidInputException")
        void nanInput() {
            assertThrows(InvalidInputException.class, () -> Protoform.trapmfL(0, 1).degree(Double.NaN));
            assertThrows(InvalidInputException.class, () -> Protoform.trapmfR(0, 1).degree(Double.NaN));
        }
    }

    // ── sigmaCountQA() ────────────────────────────────────────────────────

    @Nested
    @DisplayName("sigmaCountQA()")
    class SigmaCountTests {

        @Test
        @DisplayName("empty set → 0")
        void emptySet() {
            assertEquals(0.0, Protoform.sigmaCountQA(Collections.<NumericPoint>emptyList(), p -> 1.0));
        }

        @Test
        @DisplayName("null set → 0")
        void nullSet() {
            assertEquals(0.0, Protoform.<NumericPoint>sigmaCountQA(null, p -> 1.0));
        }

        @Test
        @DisplayName("normalized sum of membership degrees")
        void normalizedSum() {
            MembershipFunction high = Protoform.trapmfR(0, 10);
            List<NumericPoint> points = List.of(
                NumericPoint.of(0, 0), NumericPoint.of(1, 5), NumericPoint.of(2, 10), NumericPoint.of(3, 20));
            // 0 + 0.5 + 1 + 1 = 2.5 over 4 points
            assertEquals(0.625, Protoform.sigmaCountQA(points, p -> high.degree(p.y())), 1e-12);
        }

        @Test
        @DisplayName("quantifier 'most' applied on top of the sigma count")
        void quantified() {
            MembershipFunction most = Protoform.trapmfR(0.5, 0.75);
            List<NumericPoint> points = List.of(
                NumericPoint.of(0, 1), NumericPoint.of(1, 1), NumericPoint.of(2, 1), NumericPoint.of(3, 0));
            // 3 of 4 satisfy → 0.75 → most = 1
            assertEquals(1.0, Protoform.sigmaCountQA(points, p -> p.y(), most), 1e-12);
            // 2 of 4 → 0.5 → most = 0
            assertEquals(0.0, Protoform.sigmaCountQA(points.subList(1, 4), p -> p.y() > 0 ? 0.5 : 0.0, most));
        }
    }
}
