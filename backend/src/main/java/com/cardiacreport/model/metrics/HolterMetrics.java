package com.cardiacreport.model.metrics;

import lombok.Builder;

import java.util.List;

/**
 * Rhythm flags raised by a Holter recording.
 */
@Builder(toBuilder = true)
public record HolterMetrics(
    boolean bradycardia,
    boolean tachycardia,
    boolean atrialFibrillation,
    boolean significantPauses,
    boolean frequentVes,
    boolean frequentSves,
    boolean avBlock,
    List<String> summaryLines
) {

    public boolean anyFinding() {
        return bradycardia || tachycardia || atrialFibrillation || significantPauses
            || frequentVes || frequentSves || avBlock;
    }
}
