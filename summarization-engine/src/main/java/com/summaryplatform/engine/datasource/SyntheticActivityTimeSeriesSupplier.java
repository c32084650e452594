package com.summaryplatform.engine.datasource;

import com.summaryplatform.common.exception.ConfigException;
import com.summaryplatform.common.model.TimeSeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Deterministic daily web-analytics series used when no external data source
 * is wired in.
 *
 * <p>Each day's value is drawn from a Gaussian around the metric's mean, scaled
 * down on weekends and shifted by a growth term counted from the first day of
 * the range. The noise is seeded from {@code (seed, datasetId, metric, day)},
 * so a query always yields the same series.
 *
 * <p>Supported metrics: {@code activeUsers}, {@code hits}, {@code sessionsPerUser}.
 */
@Component
public class SyntheticActivityTimeSeriesSupplier implements TimeSeriesSupplier {

    private static final Logger log = LoggerFactory.getLogger(SyntheticActivityTimeSeriesSupplier.class);

    private final Map<String, MetricProfile> profiles;
    private final long seed;
    private final double weekendFactor;
    private final double dailyGrowth;
    private final double offset;
    private final ZoneId zone;

    public SyntheticActivityTimeSeriesSupplier(
            @Value("${summarization.dataset.seed:42}") long seed,
            @Value("${summarization.dataset.avg-users:1000}") double avgUsers,
            @Value("${summarization.dataset.user-std-dev:100}") double userStdDev,
            @Value("${summarization.dataset.avg-hits:3000}") double avgHits,
            @Value("${summarization.dataset.hit-std-dev:300}") double hitStdDev,
            @Value("${summarization.dataset.avg-sessions-per-user:1.5}") double avgSessionsPerUser,
            @Value("${summarization.dataset.sessions-per-user-std-dev:0.2}") double sessionsPerUserStdDev,
            @Value("${summarization.dataset.weekend-factor:0.6}") double weekendFactor,
            @Value("${summarization.dataset.daily-growth:0.0}") double dailyGrowth,
            @Value("${summarization.dataset.offset:0.0}") double offset,
            ZoneId zone) {
        this.profiles = Map.of(
            "activeUsers",     new MetricProfile(avgUsers, userStdDev),
            "hits",            new MetricProfile(avgHits, hitStdDev),
            "sessionsPerUser", new MetricProfile(avgSessionsPerUser, sessionsPerUserStdDev));
        this.seed          = seed;
        this.weekendFactor = weekendFactor;
        this.dailyGrowth   = dailyGrowth;
        this.offset        = offset;
        this.zone          = zone;
    }

    @Override
    public Mono<List<TimeSeriesPoint>> fetch(TimeSeriesQuery query) {
        MetricProfile profile = profiles.get(query.metric());
        if (profile == null) {
            return Mono.error(new ConfigException("SyntheticActivityTimeSeriesSupplier",
                "Unknown metric '" + query.metric() + "', expected one of " + profiles.keySet()));
        }
        return Mono.fromCallable(() -> generate(query, profile))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(points -> log.debug("Synthetic series generated. dataset={} metric={} days={}",
                query.datasetId(), query.metric(), points.size()));
    }

    private List<TimeSeriesPoint> generate(TimeSeriesQuery query, MetricProfile profile) {
        List<TimeSeriesPoint> points = new ArrayList<>();
        LocalDate origin = query.startDate();
        for (LocalDate day = origin; !day.isAfter(query.endDate()); day = day.plusDays(1)) {
            Random random = new Random(Objects.hash(seed, query.datasetId(), query.metric(), day.toEpochDay()));
            double base = profile.mean() + dailyGrowth * (day.toEpochDay() - origin.toEpochDay());
            if (isWeekend(day)) {
                base *= weekendFactor;
            }
            double value = Math.max(0.0, base + offset + random.nextGaussian() * profile.stdDev());
            points.add(TimeSeriesPoint.of(day.atStartOfDay(zone).toInstant(), value));
        }
        return points;
    }

    private static boolean isWeekend(LocalDate day) {
        return day.getDayOfWeek() == DayOfWeek.SATURDAY || day.getDayOfWeek() == DayOfWeek.SUNDAY;
    }

    private record MetricProfile(double mean, double stdDev) {}
}
