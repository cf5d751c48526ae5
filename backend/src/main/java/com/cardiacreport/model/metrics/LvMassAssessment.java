package com.cardiacreport.model.metrics;

/**
 * LV mass (g), mass index (g/m²) with its severity tier, and relative wall thickness.
 * The index and severity are null when no BSA is known.
 */
public record LvMassAssessment(
    double mass,
    double relativeWallThickness,
    Double massIndex,
    String severity
) {
}
