package com.cardiacreport.service.report;

import com.cardiacreport.model.enums.Sex;
import com.cardiacreport.model.metrics.AorticStenosisAssessment;
import com.cardiacreport.model.metrics.EchoMetrics;
import com.cardiacreport.model.patient.PatientContext;
import com.cardiacreport.model.study.EchoMeasurements;
import com.cardiacreport.model.study.RecommendationFlags;
import com.cardiacreport.service.calculation.AorticDimensionService;
import com.cardiacreport.util.BodySurfaceArea;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Guideline Recommendation Service
 *
 * Valve and aorta recommendations for an echo study, with evidence class and level.
 * Blocks are emitted in a fixed order: severe mitral regurgitation, severe aortic
 * stenosis, then aortic size. Clinical flags are only consulted inside the block
 * they belong to.
 */
@Slf4j
@Service
public class GuidelineRecommendationService {

    static final String SEVERE_MR_LABEL = "Ernstige mitralis regurgitatie";
    static final String SEVERE_AS_LABEL = "Ernstige stenose";

    private final AorticDimensionService aorta;

    public GuidelineRecommendationService(AorticDimensionService aorta) {
        this.aorta = aorta;
    }

    public List<String> recommend(EchoMeasurements m, EchoMetrics metrics) {
        List<String> recs = new ArrayList<>();
        RecommendationFlags flags = m.flagsOrNone();
        PatientContext patient = m.patient();
        Sex sex = patient != null ? patient.sex() : null;
        Double bsa = patient != null ? patient.bsa() : null;

        boolean severeMr = isSevereMitralRegurgitation(m, metrics);
        boolean severeAs = isSevereAorticStenosis(m, metrics);

        if (severeMr) {
            addMitralBlock(recs, m, flags, bsa);
        }
        if (severeAs) {
            addAorticStenosisBlock(recs, m, metrics, flags, patient);
        }
        addAortaBlock(recs, m, metrics, sex, severeAs);

        log.debug("Guideline engine: severeMr={}, severeAs={}, {} recommendations", severeMr, severeAs, recs.size());
        return recs;
    }

    public boolean isSevereMitralRegurgitation(EchoMeasurements m, EchoMetrics metrics) {
        String label = m.mkRegurgitatie();
        return (label != null && label.contains(SEVERE_MR_LABEL)) || metrics.mitralScore() == 3;
    }

    /**
     * Severe when the chosen label says so or the shared grade is severe or worse.
     */
    public boolean isSevereAorticStenosis(EchoMeasurements m, EchoMetrics metrics) {
        String label = m.akStenose();
        return (label != null && label.contains(SEVERE_AS_LABEL)) || metrics.stenosisGrade().isSevere();
    }

    // ========================================================================
    // Mitral regurgitation
    // ========================================================================

    private void addMitralBlock(List<String> recs, EchoMeasurements m, RecommendationFlags flags, Double bsa) {
        Double lvesdi = BodySurfaceArea.index(m.lvids(), bsa, 1);
        Double lavi = BodySurfaceArea.index(m.laVolume(), bsa, 1);

        recs.add("Ernstige primaire mitralisregurgitatie vastgesteld.");
        if (flags.hasMitralSymptoms()) {
            recs.add("Mitralisklepchirurgie is aangewezen bij ernstige primaire MR met symptomen (I-B).");
        }
        if (m.lvef() != null && m.lvef() <= 60) recs.add("Chirurgie aangewezen: LVEF ≤60% (I-B).");
        if (m.lvids() != null && m.lvids() > 40) recs.add("Chirurgie aangewezen: LVESD >40 mm (I-B).");
        if (lvesdi != null && lvesdi >= 20) recs.add("Chirurgie aangewezen: LVESDi ≥20 mm/m² (I-B).");
        if (m.paspRaw() != null && m.paspRaw() > 50) recs.add("Pulmonale hypertensie met sPAP >50 mmHg (IIa-B).");
        if (lavi != null && lavi > 60) recs.add("LA dilatatie (LAVI >60 mL/m²) (IIa-B).");
        if (flags.hasAtrialFibrillation()) recs.add("Voorkamerfibrillatie bij ernstige MR (IIa-B).");
        recs.add("Chirurgisch klepherstel heeft de voorkeur (I-B).");
        recs.add("Minimaal invasieve klepchirurgie kan overwogen worden (IIb).");
        if (flags.hasMitralSymptoms()) {
            recs.add("TEER kan worden overwogen bij symptomatische ernstige MR met hoog chirurgisch risico"
                + " en geschikte anatomie.");
        }
    }

    // ========================================================================
    // Aortic stenosis
    // ========================================================================

    private void addAorticStenosisBlock(List<String> recs, EchoMeasurements m, EchoMetrics metrics,
                                        RecommendationFlags flags, PatientContext patient) {
        AorticStenosisAssessment stenosis = metrics.stenosis();
        Sex sex = patient != null ? patient.sex() : null;

        recs.add("Ernstige aortaklepstenose vastgesteld.");
        if (flags.hasAorticStenosisSymptoms()) {
            recs.add("Interventie aangewezen bij symptomatische ernstige AS (I-B).");
        }
        if (stenosis != null && stenosis.lowFlowLowGradient()) {
            recs.add("Low-flow low-gradient patroon met ernstig stenoseprofiel.");
        }
        if (m.lvef() != null) {
            if (m.lvef() < 50) {
                recs.add("Interventie aangewezen bij LVEF <50% zonder andere oorzaak (I-B).");
            } else if (m.lvef() < 55) {
                recs.add("Interventie te overwegen bij LVEF <55% zonder andere oorzaak (IIa).");
            }
        }
        if (flags.hasSystolicPressureDrop()) recs.add("Bloeddrukdaling >20 mmHg bij inspanning (IIa).");
        if (m.akMean() != null && m.akMean() > 60) recs.add("Zeer ernstige AS: mean gradiënt >60 mmHg (IIa).");
        if (m.akVmax() != null && m.akVmax() > 5.0) recs.add("Zeer ernstige AS: Vmax >5.0 m/s (IIa).");

        Double calcium = flags.calciumScore();
        if (calcium != null && calcium > 0) {
            double limit = sex != null && sex.isMale() ? 2000 : 1200;
            if (calcium > limit) recs.add("Ernstige calcificatie ondersteunt interventie (IIa).");
        }
        if (flags.vmaxProgression() != null && flags.vmaxProgression() > 0.3) {
            recs.add("Vmax-progressie >0.3 m/s/jaar (IIa).");
        }
        if (flags.bnp() != null && flags.bnp() > 0) {
            recs.add("Verhoogde BNP/NT-proBNP ondersteunt interventie (IIa).");
        }

        Double age = patient != null ? patient.age() : null;
        if (age != null) {
            if ((int) age.doubleValue() >= 70) {
                recs.add("TAVI aanbevolen bij geschikte anatomie (I-A).");
            } else {
                recs.add("SAVR aanbevolen bij leeftijd <70 jaar en laag operatierisico (I-B)."
                    + " TAVI kan worden overwogen afhankelijk van anatomie/risico (IIa/IIb).");
            }
        }
    }

    // ========================================================================
    // Aorta
    // ========================================================================

    private void addAortaBlock(List<String> recs, EchoMeasurements m, EchoMetrics metrics, Sex sex, boolean severeAs) {
        Double maxAo = aorta.maxDiameter(metrics.aorticSegments());
        if (maxAo == null) return;
        Double maxIndexed = aorta.maxIndexed(metrics.aorticSegments());
        String morphology = m.akMorfologie() != null ? m.akMorfologie().toLowerCase(Locale.ROOT) : "";
        boolean bicuspid = morphology.contains("bicus");
        boolean male = sex != null && sex.isMale();

        if (maxAo >= 55) {
            recs.add("Aorta ascendens ≥55 mm: chirurgie aanbevolen (I-B).");
        } else if (maxAo >= 50) {
            if (bicuspid || male) {
                recs.add("Aorta ascendens ≥50 mm: overweeg chirurgie (IIa), zeker bij bicuspide anatomie of man.");
            } else {
                recs.add("Aorta ascendens ≥50 mm: overweeg chirurgie (IIa).");
            }
        }
        if (maxAo >= 45 && severeAs) {
            recs.add("Bij indicatie voor klepchirurgie en AscAo ≥45 mm: gelijktijdige aortachirurgie overwegen (IIa).");
        }

        if (maxAo >= 45 && maxAo < 50) {
            recs.add("AscAo 45-49 mm: controle CT/MRI/echo om de 6-12 maanden.");
        } else if (maxAo >= 40 && maxAo < 45) {
            recs.add("AscAo 40-44 mm: controle beeldvorming jaarlijks.");
        } else if (maxIndexed != null && maxIndexed > 17 && maxAo < 40) {
            recs.add("AscAo index >17 mm/m²: overweeg jaarlijkse opvolging ondanks absolute <40 mm.");
        } else if (maxAo >= 37) {
            recs.add("AscAo 37-39 mm: herbeoordeling binnen 2-3 jaar indien stabiel.");
        }

        if (maxAo >= 30 && maxAo < 40) {
            recs.add("Aorta 30-40 mm: TTE elke 3 jaar.");
        }
        if (maxAo >= 40 && maxAo <= 44) {
            recs.add("Aorta 40-44 mm: baseline CT/MR aorta + TTE controle in 1 jaar; bij groei >3 mm/jaar bevestigen"
                + " met CT/MR en daarna elke 6 maanden TTE; bij groei <3 mm/jaar TTE elke 2 jaar.");
        }
        if (maxAo >= 45 && maxAo <= 49) {
            recs.add("Aorta 45-49 mm: baseline CT/MR aorta en TTE elke 6 maanden.");
        }
        if (maxAo >= 50 && maxAo <= 52) {
            recs.add("Aorta 50-52 mm: baseline CT/MR aorta; bij hoog-risico kenmerken (familiale aorta-event,"
                + " ongecontroleerde hypertensie, leeftijd <50 j) kan chirurgie overwogen worden (IIb); anders elke"
                + " 6 maanden nieuwe beeldvorming; bij groei >3 mm/jaar chirurgie overwegen.");
        }
        if (maxAo >= 50 && maxAo <= 54) {
            recs.add("Aorta 50-54 mm: baseline CT/MR aorta; bij wortel-fenotype en bicuspide klep chirurgie (I);"
                + " bij wortel-fenotype en tricuspide klep chirurgie te overwegen (IIb).");
        }
        if (maxAo > 55) {
            recs.add("Aorta >55 mm: chirurgie (I).");
        }
        recs.add("Bij aorta-aneurysma of thoracale dissectie met HTAD-risicofactoren genetische testing aangewezen"
            + " (<60 j, geen klassieke risicofactoren, familiaal plots overlijden, andere aneurysmata, familiale TAD,"
            + " syndromale kenmerken Marfan/Loeys-Dietz/Ehlers-Danlos).");
    }
}
