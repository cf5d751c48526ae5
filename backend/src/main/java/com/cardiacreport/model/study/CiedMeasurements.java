package com.cardiacreport.model.study;

import com.cardiacreport.model.patient.PatientContext;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

/**
 * Cardiac implantable electronic device follow-up input.
 *
 * <p>Global checks default to "ok" when not supplied, the other flags default to false.
 * The LVEF is only used for the myPACE lower rate suggestion.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CiedMeasurements(
    PatientContext patient,
    String deviceType,
    String deviceBrand,
    String programmingMode,
    Integer lowerRate,
    Integer upperTracking,
    String indicationText,
    Boolean leadRa,
    Boolean leadRv,
    Boolean leadLv,
    String otherLeads,
    Boolean sensingOk,
    Boolean pacingOk,
    Boolean impedanceOk,
    String egmEvents,
    Double atrialPacingPct,
    Double ventricularPacingPct,
    Double lvPacingPct,
    Boolean settingsChanged,
    Boolean patientDependent,
    String batteryStatus,
    Integer sensedAvDelay,
    Integer pacedAvDelay,
    Double lvef,
    LeadMeasurements atrialFields,
    LeadMeasurements ventFields,
    LeadMeasurements lvFields
) {

    public boolean sensingAccepted() {
        return !Boolean.FALSE.equals(sensingOk);
    }

    public boolean pacingAccepted() {
        return !Boolean.FALSE.equals(pacingOk);
    }

    public boolean impedanceAccepted() {
        return !Boolean.FALSE.equals(impedanceOk);
    }
}
