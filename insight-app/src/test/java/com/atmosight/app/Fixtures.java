package com.atmosight.app;

import com.atmosight.core.analysis.DistributionModeler;
import com.atmosight.core.analysis.ExtremeEventEstimator;
import com.atmosight.core.analysis.InsightAggregator;
import com.atmosight.core.analysis.TrendEstimator;
import com.atmosight.core.config.AnalysisConfig;
import com.atmosight.core.model.AnalysisResult;
import com.atmosight.core.model.ClimateQuery;
import com.atmosight.core.model.ClimatologicalSample;
import com.atmosight.core.model.DistributionResult;
import com.atmosight.core.model.SampleSet;
import com.atmosight.core.model.Variable;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Shared fixtures for the app tests.
 */
final class Fixtures {

    private Fixtures() {
    }

    /** Result for consecutive years from 1991, analysed with default settings. */
    static AnalysisResult result(Variable variable, double... values) {
        List<ClimatologicalSample> list = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            list.add(new ClimatologicalSample(1991 + i, values[i], 5));
        }
        SampleSet samples = new SampleSet(variable, list);
        DistributionResult distribution = new DistributionModeler(new AnalysisConfig()).fitDistribution(samples);
        return new InsightAggregator().aggregate(query(variable), samples,
                new TrendEstimator().fit(samples),
                new ExtremeEventEstimator(2.0).estimate(samples, distribution),
                distribution);
    }

    static ClimateQuery query(Variable variable) {
        return ClimateQuery.builder()
                .locationName("Faisalabad")
                .location(31.4187, 73.0791)
                .variable(variable)
                .targetDay(7, 5)
                .windowDays(2)
                .build();
    }

    /** A POWER daily point document with one value per day. */
    static String powerJson(Variable variable, int fromYear, int toYear, ToDoubleFunction<LocalDate> value) {
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode root = mapper.createObjectNode();
        ObjectNode daily = root.putObject("properties").putObject("parameter").putObject(variable.getCode());
        for (LocalDate d = LocalDate.of(fromYear, 1, 1); d.getYear() <= toYear; d = d.plusDays(1)) {
            daily.put(d.format(DateTimeFormatter.BASIC_ISO_DATE), value.applyAsDouble(d));
        }
        root.putObject("header").put("fill_value", -999.0);
        return root.toString();
    }
}
