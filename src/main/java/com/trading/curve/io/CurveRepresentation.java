package com.trading.curve.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Externally visible form of a yield curve: its points and type tag.
 * Strategies are not part of it; they are selected again by name when the
 * curve is rebuilt.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CurveRepresentation {
    private double[] tenors;
    private double[] rates;
    @JsonProperty("curve_type")
    private String curveType;
}
