package com.cardiacreport.service.report;

import com.cardiacreport.model.metrics.AorticSegmentAssessment;
import com.cardiacreport.model.metrics.AorticStenosisAssessment;
import com.cardiacreport.model.metrics.EchoMetrics;
import com.cardiacreport.model.study.EchoMeasurements;
import com.cardiacreport.service.calculation.ChamberClassificationService;
import com.cardiacreport.util.ReportFormat;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

import static com.cardiacreport.util.ReportFormat.firstNonBlank;
import static com.cardiacreport.util.ReportFormat.fixed;
import static com.cardiacreport.util.ReportFormat.plain;
import static com.cardiacreport.util.ReportFormat.whole;

/**
 * Echo Report Service
 *
 * Composes the narrative echo report and its one-paragraph brief.
 * A label the clinician chose always wins over the automatic classification.
 *
 * Section order of the full report:
 *   LV, diastolic function, LA, aorta, (blank), RV, RA, (blank),
 *   AK, MK, TK, PK, pericardium, endocardium, IVC
 */
@Service
public class EchoReportService {

    static final String DEFAULT_AK_MORPHOLOGY = "Normale tricuspiede morfologie";
    static final String DEFAULT_AK_CALCIFICATION = "Geen calcificatie";
    static final String DEFAULT_REGURGITATION = "Geen regurgitatie";
    static final String DEFAULT_IVC_DILATATION = "niet gedilateerd";
    static final String DEFAULT_IVC_VARIATION = "met bewaarde ademhalingsvariatie";
    static final String LOW_FLOW_NOTE = " (low-flow low-gradient patroon: AVA <1.0 cm² of indexed <0.6 cm²/m²"
        + " met mean <40 mmHg en SVi <=35 mL/m²)";
    static final String NO_ECHO_DATA = "Geen echogegevens beschikbaar.";

    // ========================================================================
    // Public API
    // ========================================================================

    public String composeFullReport(EchoMeasurements m, EchoMetrics metrics) {
        List<String> report = new ArrayList<>();
        report.add(leftVentricleLine(m, metrics));
        report.add(diastolicLine(m, metrics));
        report.add(atriumLine("LA", laLabel(m, metrics), metrics.lavi()));
        report.addAll(aortaLines(metrics.aorticSegments()));
        report.add("");
        report.add(rightVentricleLine(m, metrics));
        report.add(atriumLine("RA", firstNonBlank(m.raDilatatie(), metrics.raDilatationAuto()), metrics.ravi()));
        report.add("");
        report.add(aorticValveLine(m, metrics));
        report.add(mitralLine(m, metrics));
        report.add(tricuspidLine(m, metrics));
        report.add(pulmonaryLine(m, metrics));
        report.add("Pericardium is normaal zonder effusie.");
        report.add("Endocardium geen tekens van infectie.");
        report.add(ivcLine(m));
        return String.join("\n", report);
    }

    /**
     * Systolic function, LV size, LA, aortic stenosis, regurgitations and PASP, joined by "; "
     * and closed with a single period.
     */
    public String composeBrief(EchoMeasurements m, EchoMetrics metrics) {
        List<String> parts = new ArrayList<>();

        List<String> systolic = new ArrayList<>();
        String systolicPhrase = systolicLabel(m, metrics);
        if (ReportFormat.hasText(systolicPhrase)) systolic.add(systolicPhrase);
        if (m.lvef() != null) systolic.add("LVEF " + fixed(m.lvef(), 0) + "%");
        if (!systolic.isEmpty()) parts.add(String.join(" ", systolic));

        if (m.lvidd() != null || ReportFormat.hasText(m.lvDilatatieChoice())) {
            parts.add("LV: " + firstNonBlank(m.lvDilatatieChoice(), metrics.lvDilatationAuto()));
        }
        String la = firstNonBlank(m.laChoice(), metrics.laSuggested());
        if (ReportFormat.hasText(la)) parts.add("LA: " + la);
        parts.add("AK: " + stenosisLabel(m, metrics));
        addIfPresent(parts, "MK: ", regurgitationLabel(m.mkRegurgitatie(), metrics.mitralSuggested()));
        addIfPresent(parts, "TK: ", regurgitationLabel(m.tkRegurgitatie(), metrics.tricuspidSuggested()));
        addIfPresent(parts, "PK: ", regurgitationLabel(m.pkRegurgitatie(), metrics.pulmonarySuggested()));
        if (ReportFormat.hasText(metrics.paspText())) parts.add(withoutFinalPeriod(metrics.paspText().trim()));

        String text = String.join("; ", parts).trim();
        return text.isEmpty() ? NO_ECHO_DATA : text + ".";
    }

    /**
     * Stenosis label printed in the AK line: the clinician's choice, else the shared grade.
     */
    public String stenosisLabel(EchoMeasurements m, EchoMetrics metrics) {
        return firstNonBlank(m.akStenose(), metrics.stenosisGrade().getLabel());
    }

    // ========================================================================
    // Left heart
    // ========================================================================

    private String leftVentricleLine(EchoMeasurements m, EchoMetrics metrics) {
        List<String> parts = new ArrayList<>();
        String hypertrophy = firstNonBlank(m.lvHypertrofieChoice(), metrics.lvHypertrophyAuto());
        if (ReportFormat.hasText(hypertrophy)) parts.add(hypertrophy);

        List<String> measurements = new ArrayList<>();
        if (m.ivsd() != null) measurements.add("IVSd " + plain(m.ivsd()) + " mm");
        if (m.lvpw() != null) measurements.add("LVPWd " + plain(m.lvpw()) + " mm");
        if (metrics.massIndex() != null) measurements.add("LVMI " + plain(metrics.massIndex()) + " g/m²");
        if (metrics.rwt() != null) measurements.add("RWT " + plain(metrics.rwt()));
        if (!measurements.isEmpty()) parts.add("(" + String.join(", ", measurements) + ")");

        String dilatation = firstNonBlank(m.lvDilatatieChoice(), metrics.lvDilatationAuto());
        if (ReportFormat.hasText(dilatation)) {
            parts.add(m.lvidd() != null ? dilatation + " (LVIDd " + plain(m.lvidd()) + " mm)" : dilatation);
        }

        String systolic = ReportFormat.orEmpty(systolicLabel(m, metrics));
        if (m.lvef() != null) systolic = systolic + " (LVEF " + plain(m.lvef()) + "%)";
        if (!systolic.isEmpty()) parts.add("met " + systolic);

        return "LV: " + String.join(", ", parts) + ".";
    }

    private String diastolicLine(EchoMeasurements m, EchoMetrics metrics) {
        String line = ReportFormat.orEmpty(firstNonBlank(m.lvDiastolischeFunctie(), metrics.diastolicSuggestion()));
        List<String> extras = new ArrayList<>();
        if (m.ea() != null) extras.add("E/A " + fixed(m.ea(), 1));
        if (m.ee() != null) extras.add("E/e' " + fixed(m.ee(), 1));
        if (!extras.isEmpty()) line = line + " (" + String.join(", ", extras) + ")";
        return line + ".";
    }

    private String laLabel(EchoMeasurements m, EchoMetrics metrics) {
        return firstNonBlank(firstNonBlank(m.laChoice(), metrics.laSuggested()), ChamberClassificationService.LA_NOT_DILATED);
    }

    private String atriumLine(String prefix, String label, Double index) {
        String name = "LA".equals(prefix) ? "LAVI" : "RAVI";
        if (index != null) {
            return prefix + ": " + ReportFormat.orEmpty(label) + ". (" + name + " " + plain(index) + " mL/m²).";
        }
        return prefix + ": " + ReportFormat.orEmpty(label) + ".";
    }

    private String systolicLabel(EchoMeasurements m, EchoMetrics metrics) {
        return firstNonBlank(m.systolicOption(), metrics.systolicAuto());
    }

    // ========================================================================
    // Aorta
    // ========================================================================

    private List<String> aortaLines(List<AorticSegmentAssessment> segments) {
        List<String> lines = new ArrayList<>();
        if (segments == null || segments.isEmpty()) return lines;

        List<String> items = new ArrayList<>();
        List<String> dilated = new ArrayList<>();
        for (AorticSegmentAssessment s : segments) {
            String abbreviation = s.segment().getAbbreviation();
            String diameter = whole(s.diameter());
            if (s.indexed() == null) {
                items.add(abbreviation + " " + diameter + " mm");
                continue;
            }
            String indexed = fixed(s.indexed(), 1);
            items.add(abbreviation + " " + diameter + " mm, " + indexed + " mm/m²");
            if (s.dilated()) {
                dilated.add(s.segment().getDescription() + " (" + abbreviation + ") is gedilateerd ("
                    + diameter + " mm, " + indexed + " mm/m²).");
            }
        }
        String overall = dilated.isEmpty() ? "Aorta niet gedilateerd" : "Aorta gedilateerd";
        lines.add("AO: " + overall + " (" + String.join(", ", items) + ").");
        lines.addAll(dilated);
        return lines;
    }

    // ========================================================================
    // Right heart
    // ========================================================================

    private String rightVentricleLine(EchoMeasurements m, EchoMetrics metrics) {
        String label = ReportFormat.orEmpty(firstNonBlank(m.rvHypertrofie(), metrics.rvHypertrophyAuto()));
        List<String> details = new ArrayList<>();
        if (m.rvfwd() != null) details.add("RVFWd " + whole(m.rvfwd()) + "mm");
        if (m.rvbd() != null) details.add("RVBDd " + whole(m.rvbd()) + "mm");
        if (m.rvmd() != null) details.add("RVMDd " + whole(m.rvmd()) + "mm");
        if (!details.isEmpty()) label = label + " (" + String.join("; ", details) + ")";

        String dilatation = ReportFormat.orEmpty(firstNonBlank(m.rvDilatatie(), metrics.rvDilatationAuto()));
        String function = ReportFormat.orEmpty(firstNonBlank(m.rvFunctie(), metrics.rvFunctionAuto()));
        String pasp = ReportFormat.orEmpty(metrics.paspText());
        if (m.tapse() != null) {
            return "RV: " + label + ", " + dilatation + " met " + function
                + " (TAPSE " + plain(m.tapse()) + " mm). " + pasp;
        }
        return "RV: " + label + ", " + dilatation + " met " + function + ". " + pasp;
    }

    // ========================================================================
    // Valves
    // ========================================================================

    private String aorticValveLine(EchoMeasurements m, EchoMetrics metrics) {
        AorticStenosisAssessment stenosis = metrics.stenosis();
        List<String> parts = new ArrayList<>();
        if (m.akVmax() != null) parts.add("Vmax " + fixed(m.akVmax(), 2) + " m/s");
        if (m.akMean() != null) parts.add("MeanG " + whole(m.akMean()) + " mmHg");
        if (m.ava() != null) {
            Double avaIndexed = stenosis != null ? stenosis.avaIndexed() : null;
            parts.add(avaIndexed != null
                ? "AVA " + fixed(m.ava(), 2) + " cm², " + fixed(avaIndexed, 2) + " cm²/m²"
                : "AVA " + fixed(m.ava(), 2) + " cm²");
        }
        if (m.sv() != null) {
            Double svIndexed = stenosis != null ? stenosis.strokeVolumeIndexed() : null;
            parts.add(svIndexed != null
                ? "SV " + whole(m.sv()) + " mL, SVi " + fixed(svIndexed, 1) + " mL/m²"
                : "SV " + whole(m.sv()) + " mL");
        }

        String lowFlow = stenosis != null && stenosis.lowFlowLowGradient() ? LOW_FLOW_NOTE : "";
        String line = "AK: " + firstNonBlank(m.akMorfologie(), DEFAULT_AK_MORPHOLOGY) + ". "
            + firstNonBlank(m.akCalcificatie(), DEFAULT_AK_CALCIFICATION) + ". "
            + stenosisLabel(m, metrics) + lowFlow;
        if (!parts.isEmpty()) line += " (" + String.join(", ", parts) + ")";
        return line + ". " + firstNonBlank(m.akRegurgitatie(), DEFAULT_REGURGITATION) + ".";
    }

    private String mitralLine(EchoMeasurements m, EchoMetrics metrics) {
        List<String> parts = regurgitationParts(m.mkEroa(), m.mkRegvol(), m.mkRf());
        return valveLine("MK", regurgitationLabel(m.mkRegurgitatie(), metrics.mitralSuggested()), parts);
    }

    private String tricuspidLine(EchoMeasurements m, EchoMetrics metrics) {
        List<String> parts = regurgitationParts(m.tkEroa(), m.tkRegvol(), m.tkRf());
        if (m.tkVcw() != null) parts.add("VCW " + fixed(m.tkVcw(), 2) + " cm");
        return valveLine("TK", regurgitationLabel(m.tkRegurgitatie(), metrics.tricuspidSuggested()), parts);
    }

    private String pulmonaryLine(EchoMeasurements m, EchoMetrics metrics) {
        List<String> parts = regurgitationParts(m.pkEroa(), m.pkRegvol(), m.pkRf());
        if (m.pkDtRegjet() != null) parts.add("DT " + whole(m.pkDtRegjet()) + " ms");
        if (m.pkPhtRegjet() != null) parts.add("PHT " + whole(m.pkPhtRegjet()) + " ms");
        if (m.pkPrIndex() != null) parts.add("PR-index " + fixed(m.pkPrIndex(), 2));
        return valveLine("PK", regurgitationLabel(m.pkRegurgitatie(), metrics.pulmonarySuggested()), parts);
    }

    private static List<String> regurgitationParts(Double eroa, Double regVol, Double rf) {
        List<String> parts = new ArrayList<>();
        if (eroa != null) parts.add("EROA " + fixed(eroa, 2) + " cm²");
        if (regVol != null) parts.add("RegVol " + whole(regVol) + " mL");
        if (rf != null) parts.add("RF " + fixed(rf, 0) + "%");
        return parts;
    }

    private static String valveLine(String prefix, String label, List<String> parts) {
        String line = prefix + ": Normale morfologie. " + ReportFormat.orEmpty(label);
        if (parts.isEmpty()) return line + ".";
        return line + " (" + String.join(", ", parts) + ").";
    }

    private static String regurgitationLabel(String choice, String suggested) {
        return firstNonBlank(choice, suggested);
    }

    // ========================================================================
    // Venous return
    // ========================================================================

    private String ivcLine(EchoMeasurements m) {
        String line = "IVC is " + firstNonBlank(m.ivcDilatatie(), DEFAULT_IVC_DILATATION) + " "
            + firstNonBlank(m.ivcVariatie(), DEFAULT_IVC_VARIATION) + ".";
        if (ReportFormat.hasText(m.cvd())) line += " CVD bedraagt " + m.cvd().trim() + " mmHg.";
        return line;
    }

    private static void addIfPresent(List<String> parts, String prefix, String label) {
        if (ReportFormat.hasText(label)) parts.add(prefix + label);
    }

    private static String withoutFinalPeriod(String text) {
        return text.endsWith(".") ? text.substring(0, text.length() - 1) : text;
    }
}
