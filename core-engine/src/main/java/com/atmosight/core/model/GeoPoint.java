package com.atmosight.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Latitude/longitude pair identifying the analysed location.
 *
 * <p>
 * The core never does geodesic arithmetic on it; it is an opaque key that
 * the geocoding collaborator produced.
 * </p>
 *
 * @since 1.0.0
 */
public final class GeoPoint {

    private final double latitude;
    private final double longitude;

    @JsonCreator
    public GeoPoint(@JsonProperty("latitude") double latitude,
                    @JsonProperty("longitude") double longitude) {
        if (!Double.isFinite(latitude) || latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("latitude must be in [-90, 90], got: " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("longitude must be in [-180, 180], got: " + longitude);
        }
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GeoPoint that))
            return false;
        return Double.compare(latitude, that.latitude) == 0
                && Double.compare(longitude, that.longitude) == 0;
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(latitude, longitude);
    }

    @Override
    public String toString() {
        return "(" + latitude + ", " + longitude + ")";
    }
}
