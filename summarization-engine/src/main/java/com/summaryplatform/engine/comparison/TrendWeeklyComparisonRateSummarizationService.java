package com.summaryplatform.engine.comparison;

import com.summaryplatform.common.exception.InsufficientDataException;
import com.summaryplatform.common.model.Summary;
import com.summaryplatform.common.model.SummaryGroup;
import com.summaryplatform.common.text.MetricLabels;
import com.summaryplatform.common.text.Ordinals;
import com.summaryplatform.common.trend.LinearModel;
import com.summaryplatform.engine.elaboration.TrendWeeklyElaborationSummarizationService;
import com.summaryplatform.engine.elaboration.WeekdayWeekendRelativeSummarizationService;
import com.summaryplatform.engine.model.SummarizerKind;
import com.summaryplatform.engine.model.SummaryConfig;
import com.summaryplatform.engine.service.SummarizationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static com.summaryplatform.common.text.NumberFormatter.formatY;

/**
 * One sentence per adjacent pair of fitted weeks comparing their rate of
 * change (regression gradient, per day).
 *
 * <h3>Decision policy</h3>
 * <pre>
 * rate            = gradient + 1e-5
 * rateDiff        = rate[i+1] − rate[i]
 * reversal        : |rateDiff| > rateDiffThreshold and rate[i] × rate[i+1] < 0
 *                   → "was decreasing in week i+1 but increasing in week i"
 * otherwise       : pct = (|rate[i+1]| − |rate[i]|) / |rate[i]| × 100
 *                   (|rate[i]| floored at 1e-5)
 *                   |pct| > percentageThreshold and |rateDiff| > rateDiffThreshold
 *                   → "X% (Δ more user increased per day) faster than"
 *                   else → "in the same rate as"
 * </pre>
 * Sentences are qualified with "of weekdays" when weekdays and weekends are not
 * equal enough ({@code weekdayWeekendEqualValidity ≤ weekdayQualifierThreshold}).
 */
@Service
public class TrendWeeklyComparisonRateSummarizationService
        extends SummarizationService<TrendWeeklyComparisonRateProperties> {

    private static final Logger log = LoggerFactory.getLogger(TrendWeeklyComparisonRateSummarizationService.class);

    static final double RATE_EPSILON = 1e-5;

    private final WeekdayWeekendRelativeSummarizationService weekdayWeekendRelativeService;
    private final TrendWeeklyElaborationSummarizationService trendWeeklyElaborationService;

    public TrendWeeklyComparisonRateSummarizationService(
            WeekdayWeekendRelativeSummarizationService weekdayWeekendRelativeService,
            TrendWeeklyElaborationSummarizationService trendWeeklyElaborationService) {
        this.weekdayWeekendRelativeService = weekdayWeekendRelativeService;
        this.trendWeeklyElaborationService = trendWeeklyElaborationService;
    }

    @Override
    public SummarizerKind kind() {
        return SummarizerKind.TREND_WEEKLY_COMPARISON_RATE;
    }

    @Override
    public List<SummarizationService<?>> upstream() {
        return List.of(weekdayWeekendRelativeService, trendWeeklyElaborationService);
    }

    @Override
    protected Mono<TrendWeeklyComparisonRateProperties> createProperties(SummaryConfig config) {
        return Mono.zip(
                weekdayWeekendRelativeService.properties(config),
                trendWeeklyElaborationService.properties(config))
            .map(tuple -> new TrendWeeklyComparisonRateProperties(
                tuple.getT2().weekLinearModels().stream().map(LinearModel::gradient).toList(),
                tuple.getT1().weekdayWeekendEqualValidity()));
    }

    @Override
    protected Mono<List<SummaryGroup>> createSummaries(SummaryConfig config) {
        return properties(config)
            .map(properties -> List.of(SummaryGroup.of(title(),
                compare(properties.weekRates(), properties.weekdayWeekendEqualValidity(), config))))
            .onErrorResume(InsufficientDataException.class, e -> {
                log.info("No rate comparison. dataset={} reason={}", config.datasetId(), e.getMessage());
                return Mono.just(List.of(SummaryGroup.empty(title())));
            });
    }

    static List<Summary> compare(List<Double> weekRates, double weekdayWeekendEqualValidity, SummaryConfig config) {
        List<Summary> summaries = new ArrayList<>();
        String metricLabel = MetricLabels.of(config.metric());
        String weekdayWeekendDescriptor = weekdayWeekendEqualValidity > config.weekdayQualifierThreshold()
            ? ""
            : "<b>of weekdays</b> ";

        for (int i = 0; i < weekRates.size() - 1; i++) {
            double currentWeekRate = weekRates.get(i) + RATE_EPSILON;
            double nextWeekRate = weekRates.get(i + 1) + RATE_EPSILON;
            double currentWeekRateAbsolute = Math.abs(currentWeekRate);
            double nextWeekRateAbsolute = Math.abs(nextWeekRate);

            double rateDiffAbsolute = Math.abs(nextWeekRate - currentWeekRate);
            double absoluteRateDiff = nextWeekRateAbsolute - currentWeekRateAbsolute;

            String text;
            if (rateDiffAbsolute > config.rateDiffThreshold() && currentWeekRate * nextWeekRate < 0) {
                text = String.format(
                    "The %s %swas <b>%s</b> in the <b>%s week</b> but <b>%s</b> in the <b>%s week</b>.",
                    metricLabel, weekdayWeekendDescriptor, dynamicDescriptor(nextWeekRate), Ordinals.of(i + 1),
                    dynamicDescriptor(currentWeekRate), Ordinals.of(i));
            } else {
                double percentageChange = absoluteRateDiff / Math.max(currentWeekRateAbsolute, RATE_EPSILON) * 100;
                String percentageChangeDescriptor = percentageChange >= 0 ? "more" : "less";
                String speedDescriptor = percentageChange >= 0 ? "faster" : "slower";
                String directionDescriptor = currentWeekRate >= 0 ? "increased" : "decreased";

                String percentageChangeText =
                    Math.abs(percentageChange) > config.percentageThreshold()
                        && rateDiffAbsolute > config.rateDiffThreshold()
                    ? String.format("%s%% (%s %s user %s per day) %s than",
                        formatY(Math.abs(percentageChange)), formatY(Math.abs(absoluteRateDiff)),
                        percentageChangeDescriptor, directionDescriptor, speedDescriptor)
                    : "in the same rate as";

                text = String.format(
                    "The %s %sin the <b>%s week</b> %s <b>%s</b> the <b>%s week</b>.",
                    metricLabel, weekdayWeekendDescriptor, Ordinals.of(i + 1), directionDescriptor,
                    percentageChangeText, Ordinals.of(i));
            }
            summaries.add(Summary.of(text, 1.0));
        }
        return summaries;
    }

    private static String dynamicDescriptor(double rate) {
        return rate >= 0 ? "increasing" : "decreasing";
    }
}
