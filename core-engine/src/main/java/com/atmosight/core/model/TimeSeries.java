package com.atmosight.core.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Date-ordered daily series of one variable at one location.
 *
 * <p>
 * Invariants enforced at construction: no duplicate dates, every entry is a
 * finite value or an explicit missing marker. Instances are immutable and
 * may be shared between threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeries {

    private final Variable variable;
    private final NavigableMap<LocalDate, DailyObservation> observations;
    private final int validCount;

    /**
     * @param variable     the observed variable
     * @param observations observations in any order
     * @throws IllegalArgumentException if two observations share a date
     */
    public TimeSeries(Variable variable, Collection<DailyObservation> observations) {
        this.variable = Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(observations, "observations must not be null");

        NavigableMap<LocalDate, DailyObservation> byDate = new TreeMap<>();
        int valid = 0;
        for (DailyObservation observation : observations) {
            if (byDate.putIfAbsent(observation.getDate(), observation) != null) {
                throw new IllegalArgumentException("Duplicate observation date: " + observation.getDate());
            }
            if (!observation.isMissing()) {
                valid++;
            }
        }
        this.observations = Collections.unmodifiableNavigableMap(byDate);
        this.validCount = valid;
    }

    public Variable getVariable() {
        return variable;
    }

    /** @return all observations in date order, missing ones included */
    public List<DailyObservation> getObservations() {
        return List.copyOf(observations.values());
    }

    public int size() {
        return observations.size();
    }

    public int getValidCount() {
        return validCount;
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    /** @return distinct calendar years that have at least one entry */
    public SortedSet<Integer> years() {
        SortedSet<Integer> years = new TreeSet<>();
        for (LocalDate date : observations.keySet()) {
            years.add(date.getYear());
        }
        return years;
    }

    /**
     * Observations dated within {@code [from, to]}, both inclusive, in date
     * order.
     */
    public List<DailyObservation> between(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            return List.of();
        }
        return new ArrayList<>(observations.subMap(from, true, to, true).values());
    }

    @Override
    public String toString() {
        return "TimeSeries{" +
                "variable=" + variable +
                ", size=" + observations.size() +
                ", valid=" + validCount +
                (observations.isEmpty() ? "" : ", from=" + observations.firstKey() + ", to=" + observations.lastKey()) +
                '}';
    }
}
