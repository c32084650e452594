package com.summaryplatform.engine.elaboration;

import com.summaryplatform.common.model.NumericPoint;
import com.summaryplatform.common.model.Summary;
import com.summaryplatform.common.model.SummaryGroup;
import com.summaryplatform.common.model.TimeSeriesPoint;
import com.summaryplatform.common.protoform.MembershipFunction;
import com.summaryplatform.common.protoform.Protoform;
import com.summaryplatform.common.text.MetricLabels;
import com.summaryplatform.common.timeseries.TimeSeriesUtils;
import com.summaryplatform.engine.datasource.SummarizationDataSource;
import com.summaryplatform.engine.model.SummarizerKind;
import com.summaryplatform.engine.model.SummaryConfig;
import com.summaryplatform.engine.service.SummarizationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Compares weekday and weekend observations.
 *
 * <h3>Properties</h3>
 * <pre>
 * normalizedDifference        = |weekdayMean − weekendMean| / (max(|weekdayMean|, |weekendMean|) + ε)
 * weekdayWeekendEqualValidity = trapmfL(0.05, 0.15)(normalizedDifference)
 * </pre>
 * With no weekday or no weekend points the validity is 1: nothing tells them apart.
 *
 * <h3>Summaries</h3>
 * <p>Protoform "most weekdays had more / fewer / similar active users than
 * weekends", each weekday point being judged against the weekend mean and the
 * sigma count quantified with "most". Sentences with validity 0 are dropped.
 */
@Service
public class WeekdayWeekendRelativeSummarizationService
        extends SummarizationService<WeekdayWeekendRelativeProperties> {

    private static final Logger log = LoggerFactory.getLogger(WeekdayWeekendRelativeSummarizationService.class);

    private static final MembershipFunction EQUAL = Protoform.trapmfL(0.05, 0.15);
    private static final MembershipFunction MOST  = Protoform.trapmfR(0.5, 0.75);

    private static final MembershipFunction MORE    = Protoform.trapmfR(0.05, 0.15);
    private static final MembershipFunction SIMILAR = Protoform.trapmf(-0.15, -0.05, 0.05, 0.15);
    private static final MembershipFunction FEWER   = Protoform.trapmfL(-0.15, -0.05);

    private final SummarizationDataSource dataSource;
    private final ZoneId zone;

    public WeekdayWeekendRelativeSummarizationService(SummarizationDataSource dataSource, ZoneId zone) {
        this.dataSource = dataSource;
        this.zone       = zone;
    }

    @Override
    public SummarizerKind kind() {
        return SummarizerKind.WEEKDAY_WEEKEND_RELATIVE;
    }

    @Override
    protected Mono<WeekdayWeekendRelativeProperties> createProperties(SummaryConfig config) {
        return dataSource.points(config).map(points -> relate(split(points)));
    }

    @Override
    protected Mono<List<SummaryGroup>> createSummaries(SummaryConfig config) {
        return Mono.zip(dataSource.points(config), properties(config))
            .map(tuple -> List.of(SummaryGroup.of(title(), describe(split(tuple.getT1()), tuple.getT2(), config))));
    }

    // ── Properties ──────────────────────────────────────────────────

    private Split split(List<TimeSeriesPoint> points) {
        List<NumericPoint> weekdays = new ArrayList<>();
        List<NumericPoint> weekends = new ArrayList<>();
        for (TimeSeriesPoint point : points) {
            NumericPoint numeric = TimeSeriesUtils.toNumericPoint(point, zone);
            if (TimeSeriesUtils.isWeekend(point, zone)) {
                weekends.add(numeric);
            } else {
                weekdays.add(numeric);
            }
        }
        return new Split(weekdays, weekends);
    }

    static WeekdayWeekendRelativeProperties relate(Split split) {
        if (split.weekdays().isEmpty() || split.weekends().isEmpty()) {
            return new WeekdayWeekendRelativeProperties(split.weekdays().size(), split.weekends().size(),
                meanOrZero(split.weekdays()), meanOrZero(split.weekends()), 0.0, 1.0);
        }

        double weekdayMean = TimeSeriesUtils.mean(split.weekdays());
        double weekendMean = TimeSeriesUtils.mean(split.weekends());
        double scale = Math.max(Math.abs(weekdayMean), Math.abs(weekendMean)) + TimeSeriesUtils.EPSILON;
        double normalizedDifference = Math.abs(weekdayMean - weekendMean) / scale;

        return new WeekdayWeekendRelativeProperties(split.weekdays().size(), split.weekends().size(),
            weekdayMean, weekendMean, normalizedDifference, EQUAL.degree(normalizedDifference));
    }

    private static double meanOrZero(List<NumericPoint> points) {
        return points.isEmpty() ? 0.0 : TimeSeriesUtils.mean(points);
    }

    // ── Summaries ───────────────────────────────────────────────────

    List<Summary> describe(Split split, WeekdayWeekendRelativeProperties properties, SummaryConfig config) {
        if (!properties.comparable()) {
            log.info("Weekday/weekend comparison skipped. weekdays={} weekends={}",
                properties.weekdayCount(), properties.weekendCount());
            return List.of();
        }

        double weekendMean = properties.weekendMean();
        double scale = Math.abs(weekendMean) + TimeSeriesUtils.EPSILON;

        String metricLabel = MetricLabels.of(config.metric());
        List<Summary> summaries = new ArrayList<>();
        addIfValid(summaries, "Most <b>weekdays</b> had <b>more</b> " + metricLabel + " than <b>weekends</b>.",
            Protoform.sigmaCountQA(split.weekdays(), p -> MORE.degree((p.y() - weekendMean) / scale), MOST));
        addIfValid(summaries, "Most <b>weekdays</b> had <b>similar</b> " + metricLabel + " to <b>weekends</b>.",
            Protoform.sigmaCountQA(split.weekdays(), p -> SIMILAR.degree((p.y() - weekendMean) / scale), MOST));
        addIfValid(summaries, "Most <b>weekdays</b> had <b>fewer</b> " + metricLabel + " than <b>weekends</b>.",
            Protoform.sigmaCountQA(split.weekdays(), p -> FEWER.degree((p.y() - weekendMean) / scale), MOST));
        return summaries;
    }

    private static void addIfValid(List<Summary> summaries, String text, double validity) {
        if (validity > 0) {
            summaries.add(Summary.of(text, validity));
        }
    }

    record Split(List<NumericPoint> weekdays, List<NumericPoint> weekends) {}
}
