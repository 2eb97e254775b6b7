package com.atmosight.app;

import com.atmosight.core.error.AnalysisStage;
import com.atmosight.core.error.MalformedRecordException;
import com.atmosight.core.model.RawRecord;
import com.atmosight.core.model.Variable;
import com.atmosight.core.source.SeriesResponse;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a NASA POWER daily point response into {@link RawRecord}s.
 *
 * <p>
 * The expected shape is
 * </p>
 *
 * <pre>
 * {
 *   "header":     { "fill_value": -999.0, ... },
 *   "properties": { "parameter": { "T2M": { "19910101": 12.4, ... } } }
 * }
 * </pre>
 *
 * <p>
 * Values are passed through untouched: fill values and nulls are left for
 * the normalizer to mark as missing. Anything other than a number or null
 * is rejected with {@link MalformedRecordException}, as is a document that
 * lacks the requested parameter.
 * </p>
 */
public class PowerResponseReader {

    private static final Logger LOG = LoggerFactory.getLogger(PowerResponseReader.class);

    /** POWER's documented fill value, used when the header omits one. */
    public static final double DEFAULT_FILL_VALUE = -999.0;

    private final ObjectMapper mapper;

    public PowerResponseReader() {
        this.mapper = new ObjectMapper();
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @param in       the JSON document; not closed
     * @param variable the parameter to extract
     * @return the records in document order with the fill value as sentinel
     * @throws IOException              if the stream is not valid JSON
     * @throws MalformedRecordException if the document does not match the POWER schema
     */
    public SeriesResponse read(InputStream in, Variable variable) throws IOException {
        Objects.requireNonNull(in, "input must not be null");
        Objects.requireNonNull(variable, "variable must not be null");
        return parse(mapper.readTree(in), variable);
    }

    /**
     * @see #read(InputStream, Variable)
     */
    public SeriesResponse read(String json, Variable variable) throws IOException {
        Objects.requireNonNull(json, "json must not be null");
        Objects.requireNonNull(variable, "variable must not be null");
        return parse(mapper.readTree(json), variable);
    }

    private SeriesResponse parse(JsonNode root, Variable variable) {
        if (root == null || !root.isObject()) {
            throw malformed("Document root must be a JSON object");
        }

        JsonNode parameters = root.path("properties").path("parameter");
        if (!parameters.isObject()) {
            throw malformed("Document has no 'properties.parameter' object");
        }
        JsonNode daily = parameters.get(variable.getCode());
        if (daily == null || !daily.isObject()) {
            List<String> available = new ArrayList<>();
            parameters.fieldNames().forEachRemaining(available::add);
            throw malformed("Parameter " + variable.getCode() + " not present; document holds " + available);
        }

        double fillValue = fillValue(root.path("header").path("fill_value"));

        List<RawRecord> records = new ArrayList<>(daily.size());
        Iterator<Map.Entry<String, JsonNode>> fields = daily.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isNull()) {
                records.add(new RawRecord(field.getKey(), null, variable));
            } else if (value.isNumber()) {
                records.add(new RawRecord(field.getKey(), value.doubleValue(), variable));
            } else {
                throw malformed(variable.getCode() + " value for '" + field.getKey()
                        + "' is not a number: " + value);
            }
        }

        LOG.debug("Read {} {} records (fill value {})", records.size(), variable.getCode(), fillValue);
        return new SeriesResponse(records, fillValue);
    }

    private static double fillValue(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return DEFAULT_FILL_VALUE;
        }
        if (!node.isNumber()) {
            throw malformed("header.fill_value is not a number: " + node);
        }
        return node.doubleValue();
    }

    private static MalformedRecordException malformed(String message) {
        return new MalformedRecordException(AnalysisStage.NORMALIZE, message);
    }
}
