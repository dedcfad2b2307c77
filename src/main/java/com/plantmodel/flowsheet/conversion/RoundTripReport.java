package com.plantmodel.flowsheet.conversion;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of a round-trip check. {@code regenerated} is the notation produced on the way.
 */
@Value
@Builder
public class RoundTripReport {

    public enum Direction {
        NOTATION_TO_MODEL_TO_NOTATION,
        MODEL_TO_NOTATION_TO_MODEL
    }

    Direction direction;
    String regenerated;

    @Singular
    List<String> differences;

    public boolean isValid() {
        return differences.isEmpty();
    }
}
