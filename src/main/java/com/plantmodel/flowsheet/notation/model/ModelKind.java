package com.plantmodel.flowsheet.notation.model;

/**
 * Granularity of an intermediate model.
 */
public enum ModelKind {
    /** Coarse abstract process blocks, expanded into equipment on conversion. */
    BLOCK,
    /** Concrete equipment units. */
    DETAILED
}
