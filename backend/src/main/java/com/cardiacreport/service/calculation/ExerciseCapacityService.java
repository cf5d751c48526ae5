package com.cardiacreport.service.calculation;

import com.cardiacreport.model.enums.Sex;
import com.cardiacreport.model.metrics.Vo2Percentile;
import com.cardiacreport.util.ReportFormat;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Exercise Capacity Service
 *
 * Predicted maximal heart rate, VO2 estimated from cycle ergometer workload and
 * its position in the reference distribution for sex and age decade.
 */
@Service
public class ExerciseCapacityService {

    /** Reference VO2 (ml/kg/min) per decade: p95, p75, p50, p25, p5. */
    private static final Map<Integer, double[]> MALE_REFERENCE = Map.of(
        20, new double[] {54, 48, 43, 38, 33},
        30, new double[] {50, 44, 40, 35, 30},
        40, new double[] {47, 41, 36, 32, 28},
        50, new double[] {43, 38, 33, 29, 25},
        60, new double[] {38, 34, 30, 26, 22},
        70, new double[] {34, 30, 26, 23, 20}
    );

    private static final Map<Integer, double[]> FEMALE_REFERENCE = Map.of(
        20, new double[] {43, 38, 34, 30, 26},
        30, new double[] {40, 36, 32, 28, 24},
        40, new double[] {36, 32, 29, 26, 22},
        50, new double[] {33, 30, 27, 24, 20},
        60, new double[] {30, 27, 24, 21, 18},
        70, new double[] {27, 25, 22, 19, 17}
    );

    private static final int DEFAULT_AGE = 50;

    /**
     * 208 - 0.7 * age, rounded. Null without age.
     */
    public Long predictedMaxHeartRate(Double age) {
        if (age == null) return null;
        return ReportFormat.roundToLong(208 - 0.7 * age);
    }

    /**
     * VO2 = 1.8 * watt * 6.12 / weight + 7, one decimal. Null without workload or positive weight.
     */
    public Double estimateVo2(Integer watt, Double weight) {
        if (watt == null || watt == 0 || weight == null || weight <= 0) return null;
        return ReportFormat.round(1.8 * watt * 6.12 / weight + 7, 1);
    }

    /**
     * Decade bucket: under 30 maps to 20, 70 and older to 70. Unknown age counts as 50.
     */
    public int ageBucket(Double age) {
        int years = age != null ? (int) age.doubleValue() : DEFAULT_AGE;
        if (years < 30) return 20;
        if (years >= 70) return 70;
        return years / 10 * 10;
    }

    /**
     * Place an observed VO2 against the reference table. Null without VO2.
     */
    public Vo2Percentile vo2Percentile(Sex sex, Double age, Double vo2) {
        if (vo2 == null) return null;
        int bucket = ageBucket(age);
        double[] ref = referenceFor(sex, bucket);
        double p95 = ref[0];
        double p75 = ref[1];
        double p50 = ref[2];
        double p25 = ref[3];
        double p5 = ref[4];

        double percent = ReportFormat.round(vo2 / p50 * 100, 1);
        if (vo2 >= p95) return new Vo2Percentile(bucket, p50, percent, ">=95%", "Uitstekende inspanningscapaciteit");
        if (vo2 >= p75) return new Vo2Percentile(bucket, p50, percent, "75-95%", "Bovengemiddelde inspanningscapaciteit");
        if (vo2 >= p25) return new Vo2Percentile(bucket, p50, percent, "25-75%", "Normale inspanningscapaciteit");
        if (vo2 >= p5) return new Vo2Percentile(bucket, p50, percent, "5-25%", "Ondergemiddelde inspanningscapaciteit");
        return new Vo2Percentile(bucket, p50, percent, "<5%", "Slechte inspanningscapaciteit");
    }

    /**
     * Median reference VO2 for sex and age.
     */
    public double medianVo2(Sex sex, Double age) {
        return referenceFor(sex, ageBucket(age))[2];
    }

    /**
     * Workload at which the VO2 formula reaches the median: weight * (p50 - 7) / 1.8 / 6.12, one decimal.
     */
    public Double predictedWatt(Sex sex, Double age, Double weight) {
        if (weight == null || weight <= 0) return null;
        double p50 = medianVo2(sex, age);
        return ReportFormat.round(weight * (p50 - 7) / 1.8 / 6.12, 1);
    }

    private static double[] referenceFor(Sex sex, int bucket) {
        Map<Integer, double[]> table = sex != null && sex.isMale() ? MALE_REFERENCE : FEMALE_REFERENCE;
        return table.get(bucket);
    }
}
