package com.trading.curve.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trading.curve.engine.YieldCurve;
import com.trading.curve.exception.CurveValidationException;

/**
 * JSON form of {@link CurveRepresentation}:
 * {@code {"tenors": [...], "rates": [...], "curve_type": "spot"}}.
 */
public final class CurveJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CurveJson() {
        // Utility class
    }

    public static String write(YieldCurve curve) {
        return write(curve.toRepresentation());
    }

    public static String write(CurveRepresentation representation) {
        try {
            return MAPPER.writeValueAsString(representation);
        } catch (JsonProcessingException e) {
            throw new CurveValidationException("Failed to serialize curve representation", e);
        }
    }

    /**
     * @throws CurveValidationException if the text is not a curve
     *                                  representation.
     */
    public static CurveRepresentation read(String json) {
        CurveRepresentation rep;
        try {
            rep = MAPPER.readValue(json, CurveRepresentation.class);
        } catch (JsonProcessingException e) {
            throw new CurveValidationException("Malformed curve representation: " + e.getOriginalMessage(), e);
        }
        if (rep == null || rep.getTenors() == null || rep.getRates() == null)
            throw new CurveValidationException("Curve representation must carry 'tenors' and 'rates'");
        return rep;
    }

    static ObjectMapper mapper() {
        return MAPPER;
    }
}
