package com.ainnovators.viewer.backend.model;

/**
 * Schema generation of a raw context document.
 */
public enum ContextSchema {
    UNRECOGNIZED, // No state object, or a stage_outputs that is not an object; served untyped
    EMPTY, // State object without stage data from either generation
    STRUCTURED, // Stage data only under state.stage_outputs
    LEGACY, // Stage data only in flat state fields
    MIXED // Both generations present; structured entries win
}
