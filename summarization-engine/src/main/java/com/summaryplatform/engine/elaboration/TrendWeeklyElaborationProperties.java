package com.summaryplatform.engine.elaboration;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.summaryplatform.common.model.NumericPoint;
import com.summaryplatform.common.trend.Decomposition;
import com.summaryplatform.common.trend.LinearModel;

import java.util.List;

/**
 * Weekly structure of a series.
 *
 * <ul>
 *   <li>{@code weekPointArrays}: points grouped by week, chronological</li>
 *   <li>{@code weekLinearModels}: one model per week, aligned with {@code weekPointArrays};
 *       may be shorter when a trailing week cannot be fitted</li>
 *   <li>{@code decomposition}: weekly additive decomposition of the whole series</li>
 * </ul>
 */
public record TrendWeeklyElaborationProperties(
    @JsonProperty("weekPointArrays") List<List<NumericPoint>> weekPointArrays,
    @JsonProperty("weekLinearModels") List<LinearModel> weekLinearModels,
    @JsonProperty("decomposition") Decomposition decomposition
) {
    public TrendWeeklyElaborationProperties {
        weekPointArrays = weekPointArrays.stream().map(List::copyOf).toList();
        weekLinearModels = List.copyOf(weekLinearModels);
    }

    public int numOfWeeks() {
        return weekPointArrays.size();
    }
}
