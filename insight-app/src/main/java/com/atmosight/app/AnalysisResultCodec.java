package com.atmosight.app;

import com.atmosight.core.model.AnalysisResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;

/**
 * JSON codec for {@link AnalysisResult}.
 *
 * <p>
 * Doubles are written in their shortest round-trip form, so a decoded
 * result equals the one that was encoded. Calendar days are written as ISO
 * strings ({@code --07-15}) rather than arrays.
 * </p>
 */
public class AnalysisResultCodec {

    private final ObjectMapper mapper;

    public AnalysisResultCodec() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        this.mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String toJson(AnalysisResult result) throws JsonProcessingException {
        return mapper.writeValueAsString(Objects.requireNonNull(result, "result must not be null"));
    }

    public byte[] toBytes(AnalysisResult result) throws JsonProcessingException {
        return mapper.writeValueAsBytes(Objects.requireNonNull(result, "result must not be null"));
    }

    /** Write {@code result} to {@code out}, leaving the stream open. */
    public void write(AnalysisResult result, OutputStream out) throws IOException {
        Objects.requireNonNull(out, "out must not be null");
        out.write(toBytes(result));
    }

    public AnalysisResult fromJson(String json) throws JsonProcessingException {
        return mapper.readValue(Objects.requireNonNull(json, "json must not be null"), AnalysisResult.class);
    }

    public AnalysisResult read(InputStream in) throws IOException {
        return mapper.readValue(Objects.requireNonNull(in, "in must not be null"), AnalysisResult.class);
    }
}
