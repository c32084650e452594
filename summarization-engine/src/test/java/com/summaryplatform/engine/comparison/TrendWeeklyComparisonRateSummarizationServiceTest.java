package com.summaryplatform.engine.comparison;

import com.summaryplatform.common.model.Summary;
import com.summaryplatform.common.model.SummaryGroup;
import com.summaryplatform.engine.TestSeries;
import com.summaryplatform.engine.datasource.SummarizationDataSource;
import com.summaryplatform.engine.elaboration.TrendWeeklyElaborationSummarizationService;
import com.summaryplatform.engine.elaboration.WeekdayWeekendRelativeSummarizationService;
import com.summaryplatform.engine.model.SummaryConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrendWeeklyComparisonRateSummarizationServiceTest {

    private static final SummaryConfig CONFIG = TestSeries.config("demo", 14);

    private static String only(List<Summary> summaries) {
        assertEquals(1, summaries.size());
        assertEquals(1.0, summaries.get(0).validity());
        return summaries.get(0).text();
    }

    private static String compare(double first, double second, double equalValidity) {
        return only(TrendWeeklyComparisonRateSummarizationService.compare(List.of(first, second), equalValidity, CONFIG));
    }

    @Nested
    @DisplayName("compare()")
    class Compare {

        @Test
        @DisplayName("sign change beyond the rate threshold is a reversal")
        void reversal() {
            assertEquals("The active users was <b>decreasing</b> in the <b>second week</b> but "
                    + "<b>increasing</b> in the <b>first week</b>.",
                compare(3, -4, 1.0));
        }

        @Test
        @DisplayName("small sign change is not a reversal")
        void smallSignChange() {
            assertEquals("The active users in the <b>second week</b> increased <b>in the same rate as</b> "
                    + "the <b>first week</b>.",
                compare(0.5, -0.5, 1.0));
        }

        @Test
        @DisplayName("close rates are the same rate")
        void sameRate() {
            assertEquals("The active users in the <b>second week</b> increased <b>in the same rate as</b> "
                    + "the <b>first week</b>.",
                compare(3, 3.2, 1.0));
        }

        @Test
        @DisplayName("much faster growth names percentage and per-day difference")
        void faster() {
            assertEquals("The active users in the <b>second week</b> increased <b>400% (4 more user increased "
                    + "per day) faster than</b> the <b>first week</b>.",
                compare(1, 5, 1.0));
        }

        @Test
        @DisplayName("slower decline reads as less and slower")
        void slowerDecline() {
            String text = compare(-10, -4, 1.0);

            assertTrue(text.contains(" decreased <b>60% (6 less user decreased per day) slower than</b>"), text);
        }

        @Test
        @DisplayName("a zero previous rate yields a finite percentage")
        void zeroPreviousRate() {
            String text = compare(-1e-5, 5, 1.0);

            assertTrue(text.contains("faster than"), text);
            assertFalse(text.contains("\u221E") || text.contains("NaN") || text.contains("Infinity"), text);
        }

        @Test
        @DisplayName("two zero rates are the same rate")
        void zeroRates() {
            assertTrue(compare(-1e-5, -1e-5, 1.0).contains("<b>in the same rate as</b>"));
        }

        @Test
        @DisplayName("sentences name the configured metric")
        void namesMetric() {
            SummaryConfig hits = SummaryConfig.of("demo", "hits", TestSeries.START, TestSeries.START.plusDays(13));

            assertEquals("The hits was <b>decreasing</b> in the <b>second week</b> but "
                    + "<b>increasing</b> in the <b>first week</b>.",
                only(TrendWeeklyComparisonRateSummarizationService.compare(List.of(3.0, -4.0), 1.0, hits)));
        }

        @Test
        @DisplayName("weekday qualifier appears when weekdays and weekends differ")
        void qualifier() {
            assertTrue(compare(3, 3.2, 0.7).startsWith("The active users <b>of weekdays</b> in the"));
            assertTrue(compare(3, -4, 0.2).startsWith("The active users <b>of weekdays</b> was"));
            assertFalse(compare(3, 3.2, 0.71).contains("of weekdays"));
        }
    }

    @Nested
    @DisplayName("service")
    class Service {

        private TrendWeeklyComparisonRateSummarizationService serviceOver(double[] ys) {
            TestSeries.InMemorySupplier supplier = new TestSeries.InMemorySupplier().with("demo", TestSeries.daily(ys));
            SummarizationDataSource dataSource = new SummarizationDataSource(supplier);
            return new TrendWeeklyComparisonRateSummarizationService(
                new WeekdayWeekendRelativeSummarizationService(dataSource, ZoneOffset.UTC),
                new TrendWeeklyElaborationSummarizationService(dataSource, ZoneOffset.UTC));
        }

        @Test
        @DisplayName("rates are the weekly gradients")
        void properties() {
            double[] ys = TestSeries.linearWeeks(new double[] {100, 200}, new double[] {3, -4});

            StepVerifier.create(serviceOver(ys).properties(CONFIG))
                .assertNext(p -> {
                    assertEquals(2, p.weekRates().size());
                    assertEquals(3.0, p.weekRates().get(0), 1e-9);
                    assertEquals(-4.0, p.weekRates().get(1), 1e-9);
                    assertEquals(1.0, p.weekdayWeekendEqualValidity());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("rise then fall is reported as a reversal")
        void reversal() {
            double[] ys = TestSeries.linearWeeks(new double[] {100, 200}, new double[] {3, -4});

            StepVerifier.create(serviceOver(ys).summaries(CONFIG))
                .assertNext(groups -> {
                    assertEquals("Trend Weekly Comparison - Rate", groups.get(0).title());
                    assertEquals("The active users was <b>decreasing</b> in the <b>second week</b> but "
                            + "<b>increasing</b> in the <b>first week</b>.",
                        only(groups.get(0).summaries()));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("insufficient data yields an empty titled group")
        void insufficient() {
            StepVerifier.create(serviceOver(new double[] {1, 2, 3}).summaries(TestSeries.config("demo", 3)))
                .assertNext(groups -> assertEquals(List.of(SummaryGroup.empty("Trend Weekly Comparison - Rate")), groups))
                .verifyComplete();
        }
    }
}
