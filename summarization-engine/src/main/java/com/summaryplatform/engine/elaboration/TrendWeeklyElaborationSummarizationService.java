package com.summaryplatform.engine.elaboration;

import com.summaryplatform.common.exception.InsufficientDataException;
import com.summaryplatform.common.model.NumericPoint;
import com.summaryplatform.common.model.Summary;
import com.summaryplatform.common.model.SummaryGroup;
import com.summaryplatform.common.model.TimeSeriesPoint;
import com.summaryplatform.common.protoform.MembershipFunction;
import com.summaryplatform.common.protoform.Protoform;
import com.summaryplatform.common.text.MetricLabels;
import com.summaryplatform.common.text.Ordinals;
import com.summaryplatform.common.timeseries.TimeSeriesUtils;
import com.summaryplatform.common.trend.Decomposition;
import com.summaryplatform.common.trend.LinearModel;
import com.summaryplatform.common.trend.TrendAnalysis;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups the configured series into weeks and fits a linear model per week.
 *
 * <p>Properties require at least two weeks (comparisons need an adjacent pair);
 * otherwise they fail with {@link InsufficientDataException}. A week that cannot
 * be fitted ends the model list, so comparisons simply see fewer models.
 *
 * <p>Summaries describe each week's dynamic ("increased", "stayed constant", …).
 * The descriptor comes from the angle of the week's regression line on a chart
 * where the whole series spans the unit square, so the chart diagonal is 45°.
 */
@Service
public class TrendWeeklyElaborationSummarizationService
        extends SummarizationService<TrendWeeklyElaborationProperties> {

    private static final Logger log = LoggerFactory.getLogger(TrendWeeklyElaborationSummarizationService.class);

    static final double CHART_DIAGONAL_ANGLE = 45.0;
    static final int MIN_WEEKS = 2;

    /** Angle descriptors, in degrees, relative to the chart diagonal. */
    private static final Map<String, MembershipFunction> DYNAMIC_DESCRIPTORS = new LinkedHashMap<>();
    static {
        double d = CHART_DIAGONAL_ANGLE;
        DYNAMIC_DESCRIPTORS.put("decreased quickly", Protoform.trapmfL(-0.75 * d, -0.5 * d));
        DYNAMIC_DESCRIPTORS.put("decreased",         Protoform.trapmf(-0.75 * d, -0.5 * d, -0.25 * d, -0.1 * d));
        DYNAMIC_DESCRIPTORS.put("stayed constant",   Protoform.trapmf(-0.25 * d, -0.1 * d, 0.1 * d, 0.25 * d));
        DYNAMIC_DESCRIPTORS.put("increased",         Protoform.trapmf(0.1 * d, 0.25 * d, 0.5 * d, 0.75 * d));
        DYNAMIC_DESCRIPTORS.put("increased quickly", Protoform.trapmfR(0.5 * d, 0.75 * d));
    }

    private final SummarizationDataSource dataSource;
    private final ZoneId zone;

    public TrendWeeklyElaborationSummarizationService(SummarizationDataSource dataSource, ZoneId zone) {
        this.dataSource = dataSource;
        this.zone       = zone;
    }

    @Override
    public SummarizerKind kind() {
        return SummarizerKind.TREND_WEEKLY_ELABORATION;
    }

    @Override
    protected Mono<TrendWeeklyElaborationProperties> createProperties(SummaryConfig config) {
        return dataSource.points(config).map(points -> elaborate(points, config));
    }

    @Override
    protected Mono<List<SummaryGroup>> createSummaries(SummaryConfig config) {
        return properties(config)
            .map(properties -> List.of(SummaryGroup.of(title(), describeWeeks(properties, config))))
            .onErrorResume(InsufficientDataException.class, e -> {
                log.info("No weekly elaboration. dataset={} reason={}", config.datasetId(), e.getMessage());
                return Mono.just(List.of(SummaryGroup.empty(title())));
            });
    }

    // ── Properties ──────────────────────────────────────────────────

    TrendWeeklyElaborationProperties elaborate(List<TimeSeriesPoint> points, SummaryConfig config) {
        List<NumericPoint> numeric = TimeSeriesUtils.toNumericPoints(points, zone);
        List<List<NumericPoint>> weeks = TimeSeriesUtils.groupByWeek(numeric);

        if (weeks.size() < MIN_WEEKS) {
            throw new InsufficientDataException(name(),
                "Weekly elaboration needs at least " + MIN_WEEKS + " weeks, got " + weeks.size()
                    + " for dataset=" + config.datasetId());
        }

        List<LinearModel> models = new ArrayList<>(weeks.size());
        for (int i = 0; i < weeks.size(); i++) {
            try {
                models.add(TrendAnalysis.fitLinearModel(weeks.get(i)));
            } catch (InsufficientDataException e) {
                log.warn("Week not fittable, truncating models. dataset={} week={} reason={}",
                    config.datasetId(), i, e.getMessage());
                break;
            }
        }

        Decomposition decomposition = TrendAnalysis.additiveDecompose(numeric, TimeSeriesUtils.WEEK_LENGTH);
        log.debug("Weekly elaboration complete. dataset={} weeks={} models={}",
            config.datasetId(), weeks.size(), models.size());
        return new TrendWeeklyElaborationProperties(weeks, models, decomposition);
    }

    // ── Summaries ───────────────────────────────────────────────────

    List<Summary> describeWeeks(TrendWeeklyElaborationProperties properties, SummaryConfig config) {
        String metricLabel = MetricLabels.of(config.metric());
        double minX = Double.POSITIVE_INFINITY, maxX = Double.NEGATIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
        for (List<NumericPoint> week : properties.weekPointArrays()) {
            for (NumericPoint p : week) {
                minX = Math.min(minX, p.x());
                maxX = Math.max(maxX, p.x());
                minY = Math.min(minY, p.y());
                maxY = Math.max(maxY, p.y());
            }
        }
        double xRange = maxX - minX;
        double yRange = maxY - minY;

        List<Summary> summaries = new ArrayList<>();
        List<LinearModel> models = properties.weekLinearModels();
        for (int i = 0; i < models.size(); i++) {
            double normalizedGradient = models.get(i).gradient() * xRange / (yRange + TimeSeriesUtils.EPSILON);
            double angle = Math.toDegrees(Math.atan(normalizedGradient));

            for (Map.Entry<String, MembershipFunction> descriptor : DYNAMIC_DESCRIPTORS.entrySet()) {
                double validity = descriptor.getValue().degree(angle);
                if (validity > 0) {
                    String text = String.format("The %s <b>%s</b> in the <b>%s week</b>.",
                        metricLabel, descriptor.getKey(), Ordinals.of(i));
                    summaries.add(Summary.of(text, validity));
                }
            }
        }
        return summaries;
    }
}
