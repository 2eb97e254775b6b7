package com.atmosight.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * Year-ordered climatological samples for one variable.
 *
 * <p>
 * Samples are sorted by year on construction, so two sets built from the
 * same samples in different orders are equal and yield bit-identical
 * statistics. Years must be distinct and at least one sample is required.
 * </p>
 *
 * <h3>Fingerprint</h3>
 * <p>
 * A SHA-256 digest of the variable and the (year, value) sequence. Every
 * result derived from a set records it, which is how consumers check that
 * several results describe the same samples. It is recomputed, not read,
 * when a set is deserialized.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(value = "fingerprint", allowGetters = true)
public final class SampleSet {

    private final Variable variable;
    private final List<ClimatologicalSample> samples;
    private final String fingerprint;

    /**
     * @param variable the variable the samples measure
     * @param samples  samples in any order
     * @throws IllegalArgumentException if {@code samples} is empty or repeats a year
     */
    @JsonCreator
    public SampleSet(@JsonProperty("variable") Variable variable,
                     @JsonProperty("samples") List<ClimatologicalSample> samples) {
        this.variable = Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(samples, "samples must not be null");
        if (samples.isEmpty()) {
            throw new IllegalArgumentException("SampleSet requires at least one sample");
        }

        List<ClimatologicalSample> sorted = new ArrayList<>(samples);
        sorted.sort(Comparator.comparingInt(ClimatologicalSample::getYear));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).getYear() == sorted.get(i - 1).getYear()) {
                throw new IllegalArgumentException("Duplicate sample year: " + sorted.get(i).getYear());
            }
        }
        this.samples = List.copyOf(sorted);
        this.fingerprint = digest(variable, this.samples);
    }

    public Variable getVariable() {
        return variable;
    }

    public List<ClimatologicalSample> getSamples() {
        return samples;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    @JsonIgnore
    public int size() {
        return samples.size();
    }

    @JsonIgnore
    public double[] values() {
        return samples.stream().mapToDouble(ClimatologicalSample::getValue).toArray();
    }

    @JsonIgnore
    public int[] years() {
        return samples.stream().mapToInt(ClimatologicalSample::getYear).toArray();
    }

    @JsonIgnore
    public int firstYear() {
        return samples.get(0).getYear();
    }

    @JsonIgnore
    public int lastYear() {
        return samples.get(samples.size() - 1).getYear();
    }

    /**
     * @param otherFingerprint fingerprint recorded by a derived result
     * @return {@code true} if the result was derived from exactly these samples
     */
    public boolean sameSamplesAs(String otherFingerprint) {
        return fingerprint.equals(otherFingerprint);
    }

    private static String digest(Variable variable, List<ClimatologicalSample> samples) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            md.update(variable.name().getBytes(StandardCharsets.UTF_8));
            ByteBuffer buffer = ByteBuffer.allocate(Integer.BYTES + Long.BYTES);
            for (ClimatologicalSample sample : samples) {
                buffer.clear();
                buffer.putInt(sample.getYear());
                buffer.putLong(Double.doubleToLongBits(sample.getValue()));
                md.update(buffer.array());
            }
            return HexFormat.of().formatHex(md.digest());
        } catch (NoSuchAlgorithmException e) {
            // every JRE must ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SampleSet that))
            return false;
        return variable == that.variable && samples.equals(that.samples);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, samples);
    }

    @Override
    public String toString() {
        return "SampleSet{" +
                "variable=" + variable +
                ", size=" + samples.size() +
                ", years=" + firstYear() + ".." + lastYear() +
                '}';
    }
}
