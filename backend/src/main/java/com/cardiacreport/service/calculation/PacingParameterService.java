package com.cardiacreport.service.calculation;

import com.cardiacreport.util.ReportFormat;
import org.springframework.stereotype.Service;

/**
 * Pacing Parameter Service
 *
 * Programming suggestions for a device follow-up:
 * - myPACE lower rate (HFpEF): ((length * -0.37) + 135) * (LVEF / 50)^(1/4)
 * - upper tracking rate: 85% of predicted maximal heart rate
 * - rate-adaptive AV delay: 5 ms shorter per 10 bpm between lower and upper rate, never below 50 ms
 * - PVARP: 60000 / UTR - sensed AV - 20, never below 0
 */
@Service
public class PacingParameterService {

    static final int MIN_AV_DELAY_MS = 50;
    static final int SENSED_PACED_OFFSET_MS = 30;

    public Long myPaceLowerRate(Double lengthCm, Double lvef) {
        if (lengthCm == null || lengthCm == 0 || lvef == null || lvef <= 0) return null;
        double factor = Math.sqrt(Math.sqrt(lvef / 50.0));
        return ReportFormat.roundToLong((lengthCm * -0.37 + 135.0) * factor);
    }

    public Long upperTrackingSuggestion(Long predictedMaxHr) {
        if (predictedMaxHr == null) return null;
        return ReportFormat.roundToLong(predictedMaxHr * 0.85);
    }

    /**
     * AV delay shortening at the upper rate. Zero when the upper rate does not exceed the lower rate.
     */
    public Long avDelayReduction(Integer lowerRate, Integer upperTracking) {
        if (lowerRate == null || upperTracking == null) return null;
        int diff = upperTracking - lowerRate;
        if (diff <= 0) return 0L;
        return ReportFormat.roundToLong(diff / 10.0 * 5.0);
    }

    public Long rateAdaptiveAvDelay(Integer baseDelay, Long reduction) {
        if (baseDelay == null || reduction == null) return null;
        return Math.max(MIN_AV_DELAY_MS, baseDelay - reduction);
    }

    public Long optimalPvarp(Integer upperTracking, Integer sensedAvDelay) {
        if (upperTracking == null || upperTracking <= 0 || sensedAvDelay == null) return null;
        return Math.max(0L, ReportFormat.roundToLong(60000.0 / upperTracking - sensedAvDelay - 20.0));
    }

    /**
     * Sensed AV delay derived from the paced AV delay (paced - 30 ms, at least 50 ms).
     */
    public Long recommendedSensedAvDelay(Integer pacedAvDelay) {
        if (pacedAvDelay == null) return null;
        return (long) Math.max(MIN_AV_DELAY_MS, pacedAvDelay - SENSED_PACED_OFFSET_MS);
    }
}
