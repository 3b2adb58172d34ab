package com.trading.curve.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

/**
 * POJO representation of a declarative curve definition.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CurveDefinition {
    private CurveInfo curve;

    /** What to build the curve from and which strategies to use. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class CurveInfo {
        private String name, source, interpolation, compounding, bootstrapper, index;
        @JsonProperty("day_count")
        private String dayCount;
        @JsonProperty("primary_index")
        private String primaryIndex;
        private List<PointDef> points;
        private List<BondDef> bonds;
        private List<DepositDef> deposits;
        /** Quotes per index code, for multi-index curves. */
        private Map<String, List<PointDef>> quotes;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PointDef {
        private double tenor, rate;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class BondDef {
        private double maturity, coupon, price;
        private int frequency = 2;
        @JsonProperty("face_value")
        private double faceValue = 100.0;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class DepositDef {
        private double maturity, rate;
    }
}
