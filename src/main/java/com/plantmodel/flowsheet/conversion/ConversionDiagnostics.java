package com.plantmodel.flowsheet.conversion;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Warnings and notes collected during one conversion call.
 *
 * Pure structure only: no logging, no formatting.
 */
@Getter
public class ConversionDiagnostics {
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public void warn(String message) {
        warnings.add(message);
    }

    public void info(String message) {
        infos.add(message);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
