package com.cardiacreport.service.report;

import com.cardiacreport.model.enums.ReportTextKey;
import com.cardiacreport.model.letter.ClinicalExam;
import com.cardiacreport.model.letter.InvestigationSection;
import com.cardiacreport.util.ReportFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Consultation Letter Service
 *
 * Composes the letter to the referring physician:
 * - history, anamnesis and medication blocks
 * - clinical examination with a fixed general inspection line
 * - full study reports in a fixed order, picked by label
 * - discussion, closing and signature
 */
@Slf4j
@Service
public class ConsultationLetterService {

    static final String RULE = "-------------------------";
    static final String CLOSING = "Met collegiale hoogachting,";
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd-MM-yyyy");

    /**
     * Labels used when the letter is assembled from stored full reports.
     */
    public static final Map<ReportTextKey, String> STORED_REPORT_LABELS;

    static {
        Map<ReportTextKey, String> labels = new LinkedHashMap<>();
        labels.put(ReportTextKey.FULL_ECG, "ECG");
        labels.put(ReportTextKey.FULL_FIETSTEST, "Fietsproef");
        labels.put(ReportTextKey.FULL_ECHO, "Echocardiografie");
        labels.put(ReportTextKey.FULL_HOLTER, "Holter-monitoring");
        labels.put(ReportTextKey.FULL_CIED, "Device uitlezing");
        STORED_REPORT_LABELS = Collections.unmodifiableMap(labels);
    }

    private enum Investigation {
        ECG("Elektrocardiogram in rust", "ecg", "elektrocardiogram"),
        CYCLO_ERGOMETRY("Cyclo-ergometrie", "fietstest", "fietsproef", "cyclo", "ergometrie"),
        ECHO("Transthoracale Echocardiografie", "echo", "transthoracale", "transthoracische"),
        DEVICE("Device controle", "cied", "device", "pacemaker"),
        HOLTER("Holter", "holter");

        private final String heading;
        private final String[] labelFragments;

        Investigation(String heading, String... labelFragments) {
            this.heading = heading;
            this.labelFragments = labelFragments;
        }
    }

    private final String signature;

    public ConsultationLetterService(@Value("${report.letter.signature:Dr. A. Ballet Cardiologie}") String signature) {
        this.signature = signature;
    }

    public String compose(LocalDate consultDate,
                          String voorgeschiedenis,
                          String anamnese,
                          String thuismedicatie,
                          ClinicalExam exam,
                          List<InvestigationSection> investigations,
                          String bespreking) {
        String dateText = consultDate != null ? consultDate.format(DATE_FORMAT) : "vandaag";
        List<InvestigationSection> sections = investigations != null ? investigations : List.of();

        List<String> lines = new ArrayList<>();
        lines.add("Geachte collega");
        lines.add("");
        lines.add("Wij zagen uw patiënt op de raadpleging cardiologie op " + dateText + ".");
        lines.add("");

        addBlock(lines, "Voorgeschiedenis", block(voorgeschiedenis));
        addBlock(lines, "Anamnese", block(anamnese));
        addBlock(lines, "Huidige Medicatie", block(thuismedicatie));

        lines.add("Klinisch onderzoek");
        lines.add(RULE);
        lines.addAll(examLines(exam != null ? exam : ClinicalExam.empty()));
        lines.add("");

        for (Investigation investigation : Investigation.values()) {
            InvestigationSection section = findSection(sections, investigation);
            if (section == null) continue;
            String heading = ReportFormat.hasText(section.performedOn())
                ? investigation.heading + " (" + section.performedOn() + ")"
                : investigation.heading;
            addBlock(lines, heading, section.text());
        }

        addBlock(lines, "Bespreking", block(bespreking));
        lines.add(CLOSING);
        lines.add(signature);

        log.debug("Composed consultation letter with {} investigation section(s)", sections.size());
        return String.join("\n", lines).strip() + "\n";
    }

    /**
     * Turns stored full report texts into letter sections. Reports without text are skipped.
     */
    public List<InvestigationSection> sectionsFromReports(Map<ReportTextKey, String> texts,
                                                          Map<ReportTextKey, String> performedOn) {
        List<InvestigationSection> sections = new ArrayList<>();
        STORED_REPORT_LABELS.forEach((key, label) -> {
            String text = texts.get(key);
            if (!ReportFormat.hasText(text)) return;
            sections.add(new InvestigationSection(label, text.strip(), performedOn.get(key)));
        });
        return sections;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static List<String> examLines(ClinicalExam exam) {
        List<String> lines = new ArrayList<>();
        lines.add("Algemene inspectie: normale indruk");
        if (exam.pulse() != null) {
            lines.add("Pols " + ReportFormat.whole(exam.pulse()) + "/min.");
        }
        if (exam.systolic() != null && exam.diastolic() != null) {
            lines.add("Bloeddruk " + ReportFormat.whole(exam.systolic()) + "/" + ReportFormat.whole(exam.diastolic())
                + " mmHg.");
        }
        if (ReportFormat.hasText(exam.auscultation())) {
            lines.add("Hartauscultatie: " + exam.auscultation().strip());
        }
        return lines;
    }

    private static InvestigationSection findSection(List<InvestigationSection> sections, Investigation investigation) {
        for (InvestigationSection section : sections) {
            if (!ReportFormat.hasText(section.text())) continue;
            String label = ReportFormat.orEmpty(section.label()).toLowerCase(Locale.ROOT);
            for (String fragment : investigation.labelFragments) {
                if (label.contains(fragment)) return section;
            }
        }
        return null;
    }

    private static void addBlock(List<String> lines, String heading, String body) {
        lines.add(heading);
        lines.add(RULE);
        lines.add(body);
        lines.add("");
    }

    private static String block(String value) {
        return ReportFormat.hasText(value) ? value.strip() : "-";
    }
}
