package com.cardiacreport.service.metrics;

import com.cardiacreport.model.enums.AorticSegment;
import com.cardiacreport.model.enums.RegurgitationValve;
import com.cardiacreport.model.enums.Sex;
import com.cardiacreport.model.metrics.AorticSegmentAssessment;
import com.cardiacreport.model.metrics.AorticStenosisAssessment;
import com.cardiacreport.model.metrics.EchoMetrics;
import com.cardiacreport.model.metrics.LvMassAssessment;
import com.cardiacreport.model.patient.PatientContext;
import com.cardiacreport.model.study.EchoMeasurements;
import com.cardiacreport.service.calculation.AorticDimensionService;
import com.cardiacreport.service.calculation.ChamberClassificationService;
import com.cardiacreport.service.calculation.LeftVentricleService;
import com.cardiacreport.service.calculation.ValveSeverityService;
import com.cardiacreport.util.BodySurfaceArea;
import com.cardiacreport.util.ReportFormat;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Echo Metrics Service
 *
 * Runs every echo classifier and calculator once and gathers the results,
 * together with the automatic labels the report falls back to when the
 * clinician made no choice.
 */
@Service
public class EchoMetricsService {

    private final LeftVentricleService leftVentricle;
    private final ChamberClassificationService chambers;
    private final ValveSeverityService valves;
    private final AorticDimensionService aorta;

    public EchoMetricsService(LeftVentricleService leftVentricle,
                              ChamberClassificationService chambers,
                              ValveSeverityService valves,
                              AorticDimensionService aorta) {
        this.leftVentricle = leftVentricle;
        this.chambers = chambers;
        this.valves = valves;
        this.aorta = aorta;
    }

    public EchoMetrics compute(EchoMeasurements m) {
        PatientContext patient = m.patient();
        Sex sex = patient != null ? patient.sex() : null;
        Double bsa = patient != null ? patient.bsa() : null;

        // Left ventricle
        LvMassAssessment mass = leftVentricle.assessMass(m.ivsd(), m.lvidd(), m.lvpw(), bsa, sex);
        String hypertrophy = autoHypertrophy(m, mass, sex);
        String dilatation = ReportFormat.firstNonBlank(
            leftVentricle.classifyLvidd(m.lvidd(), bsa, sex), LeftVentricleService.NOT_DILATED);
        Double lvidsIndexed = BodySurfaceArea.index(m.lvids(), bsa, 2);
        int lvidsGrade = leftVentricle.gradeLvids(m.lvids(), lvidsIndexed, sex);
        String lvefClass = leftVentricle.classifyLvef(m.lvef(), sex);

        // Atria
        Double lavi = chambers.laVolumeIndex(m.laVolume(), bsa);
        Double ravi = chambers.raVolumeIndex(m.raVolume(), bsa);

        // Valves
        AorticStenosisAssessment stenosis = valves.assessAorticStenosis(m.akVmax(), m.akMean(), m.ava(), m.sv(), bsa);
        int mitral = valves.scoreMitralRegurgitation(m.mkEroa(), m.mkRegvol(), m.mkRf());
        int tricuspid = valves.scoreTricuspidRegurgitation(m.tkEroa(), m.tkRegvol(), m.tkVcw(), m.tkRf());
        int pulmonary = valves.scorePulmonaryRegurgitation(m.pkEroa(), m.pkRegvol(), m.pkRf(),
            m.pkDtRegjet(), m.pkPhtRegjet(), m.pkPrIndex());

        List<AorticSegmentAssessment> segments = aorta.assessSegments(aorticDiameters(m), patient);

        EchoMetrics metrics = EchoMetrics.builder()
            .bsa(bsa)
            .lvMass(mass != null ? mass.mass() : null)
            .massIndex(mass != null ? mass.massIndex() : null)
            .massSeverity(mass != null ? mass.severity() : null)
            .rwt(mass != null ? mass.relativeWallThickness() : null)
            .lvHypertrophyAuto(hypertrophy)
            .lviddIndexed(BodySurfaceArea.index(m.lvidd(), bsa, 1))
            .lvDilatationAuto(dilatation)
            .lvidsIndexed(lvidsIndexed)
            .lvesdi(BodySurfaceArea.index(m.lvids(), bsa, 1))
            .lvidsGrade(m.lvids() != null ? lvidsGrade : null)
            .lvidsLabel(m.lvids() != null ? leftVentricle.lvidsLabel(lvidsGrade) : null)
            .teichholzEf(leftVentricle.teichholzEf(m.lvidd(), m.lvids()))
            .lvefClass(lvefClass)
            .systolicAuto(leftVentricle.systolicPhrase(lvefClass))
            .diastolicSuggestion(chambers.suggestDiastolicFunction(m.ea(), m.ee(), lavi, m.paspRaw()))
            .lavi(lavi)
            .laSuggested(chambers.classifyLavi(lavi))
            .ravi(ravi)
            .raDilatationAuto(chambers.classifyRa(ravi, sex))
            .rvHypertrophyAuto(chambers.classifyRvHypertrophy(m.rvfwd()))
            .rvDilatationAuto(chambers.classifyRvDilatation(m.rvbd(), m.rvmd()))
            .rvFunctionAuto(chambers.classifyTapse(m.tapse()))
            .paspText(chambers.paspText(m.paspRaw(), m.cvd()))
            .aorticSegments(segments)
            .stenosis(stenosis)
            .mitralScore(mitral)
            .mitralSuggested(RegurgitationValve.MITRAL.labelFor(mitral))
            .tricuspidScore(tricuspid)
            .tricuspidSuggested(RegurgitationValve.TRICUSPID.labelFor(tricuspid))
            .pulmonaryScore(pulmonary)
            .pulmonarySuggested(RegurgitationValve.PULMONARY.labelFor(pulmonary))
            .build();

        return metrics.toBuilder().summaryLines(summarize(m, metrics)).build();
    }

    /**
     * Geometry needs all three wall measurements and a BSA. Without BSA the septum alone decides.
     */
    private String autoHypertrophy(EchoMeasurements m, LvMassAssessment mass, Sex sex) {
        if (mass != null && mass.severity() != null) {
            return leftVentricle.classifyGeometry(mass.severity(), mass.relativeWallThickness());
        }
        String bySeptum = leftVentricle.classifyIvsd(m.ivsd(), sex);
        return bySeptum != null ? bySeptum : LeftVentricleService.NORMOTROPHIC;
    }

    static Map<AorticSegment, Double> aorticDiameters(EchoMeasurements m) {
        Map<AorticSegment, Double> diameters = new EnumMap<>(AorticSegment.class);
        if (m.aoa() != null) diameters.put(AorticSegment.AOA, m.aoa());
        if (m.aosv() != null) diameters.put(AorticSegment.AOSV, m.aosv());
        if (m.aostj() != null) diameters.put(AorticSegment.AOSTJ, m.aostj());
        if (m.ascao() != null) diameters.put(AorticSegment.ASCAO, m.ascao());
        return diameters;
    }

    private List<String> summarize(EchoMeasurements m, EchoMetrics metrics) {
        List<String> lines = new ArrayList<>();
        if (metrics.bsa() != null) {
            lines.add("BSA: " + ReportFormat.fixed(metrics.bsa(), 2) + " m²");
        }
        if (metrics.lvMass() != null) {
            String line = "LV massa: " + ReportFormat.plain(metrics.lvMass()) + " g";
            if (metrics.massIndex() != null) {
                line += " (LVMI " + ReportFormat.plain(metrics.massIndex()) + " g/m², " + metrics.massSeverity() + ")";
            }
            lines.add(line + ", RWT " + ReportFormat.plain(metrics.rwt()));
        }
        lines.add("LV hypertrofie: " + metrics.lvHypertrophyAuto());
        if (metrics.lviddIndexed() != null) {
            lines.add("LVIDd index: " + ReportFormat.plain(metrics.lviddIndexed()) + " mm/m² - "
                + capitalize(metrics.lvDilatationAuto()));
        }
        if (metrics.lvidsLabel() != null) {
            String line = "LVIDs: " + ReportFormat.plain(m.lvids()) + " mm";
            if (metrics.lvesdi() != null) {
                line += " (index " + ReportFormat.plain(metrics.lvesdi()) + " mm/m²)";
            }
            lines.add(line + " - " + metrics.lvidsLabel());
        }
        if (metrics.teichholzEf() != null) {
            lines.add("Teichholz EF: " + ReportFormat.plain(metrics.teichholzEf()) + "%");
        }
        if (metrics.lvefClass() != null) {
            lines.add("LVEF " + ReportFormat.plain(m.lvef()) + "%: " + metrics.lvefClass());
        }
        if (metrics.lavi() != null) {
            lines.add("LAVI: " + ReportFormat.plain(metrics.lavi()) + " mL/m² - " + metrics.laSuggested());
        }
        if (metrics.ravi() != null) {
            lines.add("RAVI: " + ReportFormat.plain(metrics.ravi()) + " mL/m² - " + metrics.raDilatationAuto());
        }
        for (AorticSegmentAssessment segment : metrics.aorticSegments()) {
            String line = segment.segment().getAbbreviation() + ": " + ReportFormat.whole(segment.diameter()) + " mm";
            if (segment.indexed() != null) {
                line += ", " + ReportFormat.fixed(segment.indexed(), 1) + " mm/m² - "
                    + (segment.dilated() ? "Gedilateerd" : "Niet gedilateerd");
            }
            if (segment.predictedLower() != null) {
                line += " (voorspeld " + ReportFormat.plain(segment.predictedLower()) + "-"
                    + ReportFormat.plain(segment.predictedUpper()) + " mm)";
            }
            lines.add(line);
        }
        if (hasStenosisInput(m)) {
            lines.add("AK: " + metrics.stenosisGrade().getLabel()
                + (metrics.stenosis().lowFlowLowGradient() ? " (low-flow low-gradient)" : ""));
        }
        if (metrics.mitralScore() > 0) lines.add("MK: " + metrics.mitralSuggested());
        if (metrics.tricuspidScore() > 0) lines.add("TK: " + metrics.tricuspidSuggested());
        if (metrics.pulmonaryScore() > 0) lines.add("PK: " + metrics.pulmonarySuggested());
        lines.add(metrics.paspText());
        return lines;
    }

    private static boolean hasStenosisInput(EchoMeasurements m) {
        return m.akVmax() != null || m.akMean() != null || m.ava() != null;
    }

    private static String capitalize(String text) {
        if (!ReportFormat.hasText(text)) return text;
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
