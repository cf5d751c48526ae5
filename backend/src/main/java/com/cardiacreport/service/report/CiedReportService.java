package com.cardiacreport.service.report;

import com.cardiacreport.model.metrics.CiedMetrics;
import com.cardiacreport.model.study.CiedMeasurements;
import com.cardiacreport.model.study.LeadMeasurements;
import com.cardiacreport.util.ReportFormat;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Device follow-up report: lead measurements, pacing percentages and AV delays,
 * then a conclusion block that is always present.
 */
@Service
public class CiedReportService {

    static final String NOT_APPLICABLE = "n.v.t.";
    static final String NO_EVENTS = "Geen events";

    public String composeFullReport(CiedMeasurements m, CiedMetrics metrics) {
        List<String> measurements = new ArrayList<>();
        addLeadLine(measurements, "Atrium", m.leadRa(), m.atrialFields());
        addLeadLine(measurements, "Ventrikel", m.leadRv(), m.ventFields());
        addLeadLine(measurements, "LV", m.leadLv(), m.lvFields());

        List<String> pacing = new ArrayList<>();
        if (m.atrialPacingPct() != null) pacing.add("Atrium " + truncate(m.atrialPacingPct()) + "%");
        if (m.ventricularPacingPct() != null) pacing.add("Ventrikel " + truncate(m.ventricularPacingPct()) + "%");
        if (m.lvPacingPct() != null) pacing.add("LV " + truncate(m.lvPacingPct()) + "%");
        if (!pacing.isEmpty()) measurements.add("Pacing percentages: " + String.join(", ", pacing) + ".");

        addAvDelayLine(measurements, "Sensed", m.sensedAvDelay(), metrics.rateAdaptiveSensedAv());
        addAvDelayLine(measurements, "Paced", m.pacedAvDelay(), metrics.rateAdaptivePacedAv());

        List<String> output = new ArrayList<>();
        if (!measurements.isEmpty()) {
            output.add("Meetwaarden:");
            output.addAll(measurements);
            output.add("");
        }
        output.add("Conclusie:");
        output.addAll(conclusion(m));
        return String.join("\n", output);
    }

    private List<String> conclusion(CiedMeasurements m) {
        List<String> lines = new ArrayList<>();

        String sentence = "Correcte werking van " + ReportFormat.firstNonBlank(m.deviceType(), "apparaat")
            + " (" + ReportFormat.orEmpty(m.deviceBrand()) + ")";
        if (m.lowerRate() != null && m.upperTracking() != null) {
            sentence += " modus " + ReportFormat.orEmpty(m.programmingMode()) + "-" + m.lowerRate() + "/" + m.upperTracking();
        }
        sentence += ReportFormat.hasText(m.indicationText()) ? " ter behandeling van " + m.indicationText() + "." : ".";
        lines.add(sentence);

        lines.add("Goede en stabiele waardes voor " + ReportFormat.joinDutch(List.of(
            m.sensingAccepted() ? "sensing" : "sensing: afwijkend",
            m.pacingAccepted() ? "pacing" : "pacing: afwijkend",
            m.impedanceAccepted() ? "impedantie" : "impedantie: afwijkend")) + ".");

        String events = m.egmEvents();
        if (ReportFormat.hasText(events) && !NO_EVENTS.equals(events)) {
            lines.add("De EGM uitlezing toont: " + events + ".");
        } else {
            lines.add("De EGM uitlezing toont geen events.");
        }

        lines.add(Boolean.TRUE.equals(m.settingsChanged())
            ? "Instellingen gewijzigd tijdens follow-up."
            : "Instellingen ongewijzigd.");
        lines.add(Boolean.TRUE.equals(m.patientDependent())
            ? "Patiënt is pacemakerafhankelijk."
            : "Patiënt is niet afhankelijk.");

        String battery = ReportFormat.hasText(m.batteryStatus())
            ? m.batteryStatus().trim()
            : "Batterijstatus niet gerapporteerd";
        lines.add("Batterij: " + battery + ".");
        return lines;
    }

    private static void addLeadLine(List<String> lines, String name, Boolean present, LeadMeasurements lead) {
        if (!Boolean.TRUE.equals(present) || lead == null || !lead.hasReadings()) return;
        String location = ReportFormat.hasText(lead.location()) ? " Locatie: " + lead.location().trim() + "." : "";
        lines.add(name + ": sensing " + clean(lead.sensing()) + " mV, drempel " + clean(lead.thresholdV())
            + " V @ " + clean(lead.thresholdMs()) + " ms (" + ReportFormat.firstNonBlank(lead.polarity(), NOT_APPLICABLE)
            + "), impedantie " + clean(lead.impedance()) + " Ω, " + (lead.markedUnstable() ? "onstabiel" : "stabiel")
            + "." + location);
    }

    private static void addAvDelayLine(List<String> lines, String kind, Integer delay, Long rateAdaptive) {
        if (delay == null) return;
        if (rateAdaptive != null) {
            lines.add(kind + " AV delay: " + delay + " ms (Rate-adaptive AV delay at peak UTR: " + rateAdaptive + " ms).");
        } else {
            lines.add(kind + " AV delay: " + delay + " ms.");
        }
    }

    private static String clean(String value) {
        return ReportFormat.hasText(value) ? value.trim() : NOT_APPLICABLE;
    }

    private static long truncate(double percentage) {
        return (long) percentage;
    }
}
