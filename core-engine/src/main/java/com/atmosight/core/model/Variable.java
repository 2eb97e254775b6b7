package com.atmosight.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Daily weather variables supported by the analysis, keyed by their NASA
 * POWER parameter code.
 *
 * <p>
 * Each variable declares the distribution family used when the caller does
 * not choose one: symmetric variables default to {@link DistributionFamily#NORMAL},
 * bounded-below skewed ones to {@link DistributionFamily#GAMMA}.
 * </p>
 *
 * @since 1.0.0
 */
public enum Variable {

    TEMPERATURE("T2M", "Temperature", "°C", DistributionFamily.NORMAL),
    PRECIPITATION("PRECTOTCORR", "Rainfall", "mm/day", DistributionFamily.GAMMA),
    WIND_SPEED("WS2M", "Wind Speed", "m/s", DistributionFamily.GAMMA),
    RELATIVE_HUMIDITY("RH2M", "Relative Humidity", "%", DistributionFamily.NORMAL),
    SOLAR_RADIATION("ALLSKY_SFC_SW_DWN", "Solar Radiation", "kWh/m²/day", DistributionFamily.NORMAL);

    private final String code;
    private final String label;
    private final String unit;
    private final DistributionFamily defaultFamily;

    Variable(String code, String label, String unit, DistributionFamily defaultFamily) {
        this.code = code;
        this.label = label;
        this.unit = unit;
        this.defaultFamily = defaultFamily;
    }

    /** @return the POWER parameter code, e.g. {@code T2M} */
    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public String getUnit() {
        return unit;
    }

    public DistributionFamily getDefaultFamily() {
        return defaultFamily;
    }

    /**
     * Resolve a variable from either its enum name or its POWER code,
     * case-insensitively.
     *
     * @param value name or code, e.g. {@code precipitation} or {@code PRECTOTCORR}
     * @return the matching variable
     * @throws IllegalArgumentException if nothing matches
     */
    public static Variable parse(String value) {
        Objects.requireNonNull(value, "Variable name must not be null");
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Variable v : values()) {
            if (v.name().equals(normalized) || v.code.equals(normalized)) {
                return v;
            }
        }
        throw new IllegalArgumentException("Unknown variable: '" + value
                + "'. Supported: temperature, precipitation, wind_speed, relative_humidity, solar_radiation");
    }
}
