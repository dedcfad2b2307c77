package com.plantmodel.flowsheet.notation;

import java.util.Locale;

import com.plantmodel.flowsheet.exception.ConfigurationException;

/**
 * Output dialect of {@link NotationWriter}.
 */
public enum NotationVersion {
    /** Units, parameters and arrows only. */
    V1,
    /** V1 plus {@code {kind:values}} stream tags. */
    V2;

    public static NotationVersion fromString(String value) {
        if (value == null || value.isBlank()) {
            return V2;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unsupported notation version '" + value + "'. Supported: v1, v2", e);
        }
    }
}
