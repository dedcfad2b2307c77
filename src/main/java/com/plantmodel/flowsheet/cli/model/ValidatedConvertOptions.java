package com.plantmodel.flowsheet.cli.model;

import com.plantmodel.flowsheet.notation.NotationVersion;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Values derived while validating "convert" and "round-trip" options.
 */
@Data
@AllArgsConstructor
public class ValidatedConvertOptions {
    String notationText;
    NotationVersion notationVersion;
}
