package com.summaryplatform.engine.elaboration;

import com.summaryplatform.common.exception.InsufficientDataException;
import com.summaryplatform.common.model.Summary;
import com.summaryplatform.common.model.SummaryGroup;
import com.summaryplatform.engine.TestSeries;
import com.summaryplatform.engine.datasource.SummarizationDataSource;
import com.summaryplatform.engine.datasource.SyntheticActivityTimeSeriesSupplier;
import com.summaryplatform.engine.model.SummaryConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrendWeeklyElaborationSummarizationServiceTest {

    private static final double TOLERANCE = 1e-9;

    private static TrendWeeklyElaborationSummarizationService serviceOver(TestSeries.InMemorySupplier supplier) {
        return new TrendWeeklyElaborationSummarizationService(new SummarizationDataSource(supplier), ZoneOffset.UTC);
    }

    @Nested
    @DisplayName("properties")
    class Properties {

        @Test
        @DisplayName("one linear model per full week")
        void modelsPerWeek() {
            double[] ys = TestSeries.linearWeeks(new double[] {100, 200}, new double[] {3, -4});
            TestSeries.InMemorySupplier supplier = new TestSeries.InMemorySupplier().with("demo", TestSeries.daily(ys));

            StepVerifier.create(serviceOver(supplier).properties(TestSeries.config("demo", 14)))
                .assertNext(p -> {
                    assertEquals(2, p.numOfWeeks());
                    assertEquals(2, p.weekLinearModels().size());
                    assertEquals(3.0, p.weekLinearModels().get(0).gradient(), TOLERANCE);
                    assertEquals(-4.0, p.weekLinearModels().get(1).gradient(), TOLERANCE);
                    assertEquals(7, p.weekPointArrays().get(1).size());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("weeks stay seven calendar days across a daylight-saving change")
        void daylightSavingWeeks() {
            ZoneId newYork = ZoneId.of("America/New_York");
            SyntheticActivityTimeSeriesSupplier supplier = new SyntheticActivityTimeSeriesSupplier(
                42L, 1000, 100, 3000, 300, 1.5, 0.2, 0.6, 0.0, 0.0, newYork);
            TrendWeeklyElaborationSummarizationService service =
                new TrendWeeklyElaborationSummarizationService(new SummarizationDataSource(supplier), newYork);
            SummaryConfig config = SummaryConfig.of("demo", "activeUsers",
                LocalDate.of(2024, 3, 4), LocalDate.of(2024, 3, 17));

            StepVerifier.create(service.properties(config))
                .assertNext(p -> {
                    assertEquals(List.of(7, 7), p.weekPointArrays().stream().map(List::size).toList());
                    assertEquals(2, p.weekLinearModels().size());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("a single-point trailing week ends the model list")
        void truncatesAtUnfittableWeek() {
            double[] ys = new double[15];
            Arrays.fill(ys, 50);
            TestSeries.InMemorySupplier supplier = new TestSeries.InMemorySupplier().with("demo", TestSeries.daily(ys));

            StepVerifier.create(serviceOver(supplier).properties(TestSeries.config("demo", 15)))
                .assertNext(p -> {
                    assertEquals(3, p.numOfWeeks());
                    assertEquals(2, p.weekLinearModels().size());
                    assertEquals(9, p.decomposition().size());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("fewer than two weeks is insufficient data")
        void singleWeek() {
            TestSeries.InMemorySupplier supplier = new TestSeries.InMemorySupplier()
                .with("demo", TestSeries.daily(1, 2, 3, 4, 5, 6));

            StepVerifier.create(serviceOver(supplier).properties(TestSeries.config("demo", 6)))
                .expectError(InsufficientDataException.class)
                .verify();
        }

        @Test
        @DisplayName("equal configs fetch the series once")
        void fetchOnce() {
            TestSeries.InMemorySupplier supplier = new TestSeries.InMemorySupplier()
                .with("demo", TestSeries.daily(TestSeries.constantWeeks(1, 2)));
            TrendWeeklyElaborationSummarizationService service = serviceOver(supplier);

            service.properties(TestSeries.config("demo", 14)).block();
            service.properties(TestSeries.config("demo", 14)).block();
            service.summaries(TestSeries.config("demo", 14)).block();

            assertEquals(1, supplier.fetches());
        }
    }

    @Nested
    @DisplayName("summaries")
    class Summaries {

        @Test
        @DisplayName("steep rise then flat week")
        void describesDynamics() {
            double[] ys = TestSeries.linearWeeks(new double[] {0, 6}, new double[] {1, 0});
            TestSeries.InMemorySupplier supplier = new TestSeries.InMemorySupplier().with("demo", TestSeries.daily(ys));

            List<SummaryGroup> groups = serviceOver(supplier).summaries(TestSeries.config("demo", 14)).block();

            assertNotNull(groups);
            assertEquals(1, groups.size());
            assertEquals("Trend Weekly Elaboration", groups.get(0).title());
            assertEquals(List.of(
                    Summary.of("The active users <b>increased quickly</b> in the <b>first week</b>.", 1.0),
                    Summary.of("The active users <b>stayed constant</b> in the <b>second week</b>.", 1.0)),
                groups.get(0).summaries());
        }

        @Test
        @DisplayName("sentences name the configured metric")
        void namesMetric() {
            double[] ys = TestSeries.linearWeeks(new double[] {0, 6}, new double[] {1, 0});
            TestSeries.InMemorySupplier supplier = new TestSeries.InMemorySupplier().with("demo", TestSeries.daily(ys));
            SummaryConfig config = SummaryConfig.of("demo", "sessionsPerUser", TestSeries.START, TestSeries.START.plusDays(13));

            List<SummaryGroup> groups = serviceOver(supplier).summaries(config).block();

            assertNotNull(groups);
            assertEquals("The sessions per user <b>stayed constant</b> in the <b>second week</b>.",
                groups.get(0).summaries().get(1).text());
        }

        @Test
        @DisplayName("every validity lies in (0, 1]")
        void validitiesBounded() {
            double[] ys = TestSeries.linearWeeks(new double[] {10, 40, 20}, new double[] {2, -1, 0.5});
            TestSeries.InMemorySupplier supplier = new TestSeries.InMemorySupplier().with("demo", TestSeries.daily(ys));

            List<SummaryGroup> groups = serviceOver(supplier).summaries(TestSeries.config("demo", 21)).block();

            assertNotNull(groups);
            assertFalse(groups.get(0).summaries().isEmpty());
            for (Summary summary : groups.get(0).summaries()) {
                assertTrue(summary.validity() > 0 && summary.validity() <= 1, summary.text());
            }
        }

        @Test
        @DisplayName("insufficient data yields an empty titled group")
        void insufficientData() {
            TestSeries.InMemorySupplier supplier = new TestSeries.InMemorySupplier()
                .with("demo", TestSeries.daily(1, 2, 3));

            StepVerifier.create(serviceOver(supplier).summaries(TestSeries.config("demo", 3)))
                .assertNext(groups -> assertEquals(List.of(SummaryGroup.empty("Trend Weekly Elaboration")), groups))
                .verifyComplete();
        }
    }

    @Test
    @DisplayName("unknown dataset yields an empty group, not an error")
    void unknownDataset() {
        SummaryConfig config = TestSeries.config("missing", 14);
        List<SummaryGroup> groups = serviceOver(new TestSeries.InMemorySupplier()).summaries(config).block();

        assertNotNull(groups);
        assertTrue(groups.get(0).summaries().isEmpty());
    }
}
