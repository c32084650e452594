package com.summaryplatform.engine.comparison;

import com.summaryplatform.common.exception.InsufficientDataException;
import com.summaryplatform.common.model.NumericPoint;
import com.summaryplatform.common.model.Summary;
import com.summaryplatform.common.model.SummaryGroup;
import com.summaryplatform.common.text.MetricLabels;
import com.summaryplatform.common.text.Ordinals;
import com.summaryplatform.common.timeseries.TimeSeriesUtils;
import com.summaryplatform.engine.elaboration.TrendWeeklyElaborationSummarizationService;
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
 * One sentence per adjacent week pair comparing the weeks' average value:
 * <pre>
 * percentageChange = (mean[i+1] − mean[i]) / mean[i] × 100
 * |percentageChange| > percentageThreshold → "X% more/less than"
 * otherwise                                → "similar to"
 * </pre>
 */
@Service
public class TrendWeeklyComparisonAverageSummarizationService
        extends SummarizationService<TrendWeeklyComparisonAverageProperties> {

    private static final Logger log = LoggerFactory.getLogger(TrendWeeklyComparisonAverageSummarizationService.class);

    private final TrendWeeklyElaborationSummarizationService trendWeeklyElaborationService;

    public TrendWeeklyComparisonAverageSummarizationService(
            TrendWeeklyElaborationSummarizationService trendWeeklyElaborationService) {
        this.trendWeeklyElaborationService = trendWeeklyElaborationService;
    }

    @Override
    public SummarizerKind kind() {
        return SummarizerKind.TREND_WEEKLY_COMPARISON_AVERAGE;
    }

    @Override
    public List<SummarizationService<?>> upstream() {
        return List.of(trendWeeklyElaborationService);
    }

    @Override
    protected Mono<TrendWeeklyComparisonAverageProperties> createProperties(SummaryConfig config) {
        return trendWeeklyElaborationService.properties(config)
            .map(elaboration -> {
                List<Double> averages = new ArrayList<>(elaboration.numOfWeeks());
                for (List<NumericPoint> week : elaboration.weekPointArrays()) {
                    averages.add(TimeSeriesUtils.mean(week));
                }
                return new TrendWeeklyComparisonAverageProperties(averages);
            });
    }

    @Override
    protected Mono<List<SummaryGroup>> createSummaries(SummaryConfig config) {
        return properties(config)
            .map(properties -> List.of(SummaryGroup.of(title(), compare(properties.weekYAverages(), config))))
            .onErrorResume(InsufficientDataException.class, e -> {
                log.info("No average comparison. dataset={} reason={}", config.datasetId(), e.getMessage());
                return Mono.just(List.of(SummaryGroup.empty(title())));
            });
    }

    static List<Summary> compare(List<Double> weekYAverages, SummaryConfig config) {
        List<Summary> summaries = new ArrayList<>();
        String metricLabel = MetricLabels.of(config.metric());

        for (int i = 0; i < weekYAverages.size() - 1; i++) {
            double current = weekYAverages.get(i);
            double next = weekYAverages.get(i + 1);

            double percentageIncrease = (next - current) / nonZero(current) * 100;
            String percentageChangeDescriptor = percentageIncrease >= 0 ? "more" : "less";
            double percentageIncreaseAbsolute = Math.abs(percentageIncrease);
            String percentageChangeText = percentageIncreaseAbsolute > config.percentageThreshold()
                ? formatY(percentageIncreaseAbsolute) + "% " + percentageChangeDescriptor + " than"
                : "similar to";

            String text = String.format(
                "The average %s of the <b>%s week</b> was <b>%s</b> the <b>%s week</b>.",
                metricLabel, Ordinals.of(i + 1), percentageChangeText, Ordinals.of(i));
            summaries.add(Summary.of(text, 1.0));
        }
        return summaries;
    }

    private static double nonZero(double value) {
        return Math.abs(value) < TimeSeriesUtils.EPSILON ? Math.copySign(TimeSeriesUtils.EPSILON, value) : value;
    }
}
