package com.atmosight.app;

import com.atmosight.core.model.AnalysisResult;
import com.atmosight.core.model.ClimateQuery;
import com.atmosight.core.model.ExtremeResult;
import com.atmosight.core.model.SampleSet;

import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Objects;

/**
 * Plain-language summary of an {@link AnalysisResult}.
 *
 * <p>
 * A day is called "more volatile" when its empirical extreme-year share
 * exceeds the volatility threshold, otherwise "generally stable".
 * </p>
 */
public class InsightNarrative {

    private final double volatilityThreshold;

    public InsightNarrative(double volatilityThreshold) {
        if (!(volatilityThreshold >= 0 && volatilityThreshold <= 1)) {
            throw new IllegalArgumentException("volatilityThreshold must be in [0, 1], got: " + volatilityThreshold);
        }
        this.volatilityThreshold = volatilityThreshold;
    }

    public boolean isVolatile(ExtremeResult extreme) {
        return extreme.getExceedanceProbability() > volatilityThreshold;
    }

    public String render(AnalysisResult result) {
        Objects.requireNonNull(result, "result must not be null");
        ClimateQuery query = result.getQuery();
        SampleSet samples = result.getSampleSet();
        ExtremeResult extreme = result.getExtreme();
        String unit = query.getVariable().getUnit();

        StringBuilder sb = new StringBuilder();
        sb.append("Weather Insight for ").append(query.getLocationName()).append('\n');
        String trend = result.getTrend().getDirection().label();
        sb.append(String.format(Locale.ROOT, "On %s, %s has shown %s %s pattern over %d years (%d-%d).\n",
                dayLabel(query),
                query.getVariable().getLabel().toLowerCase(Locale.ROOT),
                trend.startsWith("i") ? "an" : "a", trend,
                samples.size(), samples.firstYear(), samples.lastYear()));
        sb.append(String.format(Locale.ROOT, "  - Typical value: %.2f %s\n", extreme.getMean(), unit));
        sb.append(String.format(Locale.ROOT, "  - Rare extremes occurred in ~%.1f%% of years\n",
                extreme.getExceedanceProbability() * 100));
        sb.append("This means the selected day is historically ")
                .append(isVolatile(extreme) ? "more volatile" : "generally stable")
                .append(", based on NASA POWER observations.\n");
        sb.append(keyStatistics(result));
        return sb.toString();
    }

    /** Average, maximum and minimum of the yearly samples. */
    public String keyStatistics(AnalysisResult result) {
        ExtremeResult extreme = result.getExtreme();
        String unit = result.getQuery().getVariable().getUnit();
        return String.format(Locale.ROOT, "Average: %.2f %s | Maximum: %.2f %s | Minimum: %.2f %s",
                extreme.getMean(), unit, extreme.getMaximum(), unit, extreme.getMinimum(), unit);
    }

    private static String dayLabel(ClimateQuery query) {
        String month = query.getTargetDay().getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
        return String.format(Locale.ROOT, "%s %02d", month, query.getTargetDay().getDayOfMonth());
    }
}
