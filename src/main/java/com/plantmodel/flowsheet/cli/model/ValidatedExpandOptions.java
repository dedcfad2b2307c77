package com.plantmodel.flowsheet.cli.model;

import java.util.Map;

import com.plantmodel.flowsheet.value.ParameterValue;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Values derived while validating "expand" options.
 */
@Data
@AllArgsConstructor
public class ValidatedExpandOptions {
    String blockId;
    Map<String, ParameterValue> parameters;
}
