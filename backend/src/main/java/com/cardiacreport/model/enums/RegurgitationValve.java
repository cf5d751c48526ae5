package com.cardiacreport.model.enums;

/**
 * Heart valves with a regurgitation grading.
 * The Dutch adjective is used to build the report label for a severity score.
 */
public enum RegurgitationValve {
    MITRAL("mitralis"),
    TRICUSPID("tricuspidalis"),
    PULMONARY("pulmonalis");

    private static final String NONE_LABEL = "Geen regurgitatie";

    private final String adjective;

    RegurgitationValve(String adjective) {
        this.adjective = adjective;
    }

    /**
     * Label for a 0-3 severity score, e.g. "Matige mitralis regurgitatie".
     */
    public String labelFor(int score) {
        return switch (score) {
            case 1 -> "Milde " + adjective + " regurgitatie";
            case 2 -> "Matige " + adjective + " regurgitatie";
            case 3 -> "Ernstige " + adjective + " regurgitatie";
            default -> NONE_LABEL;
        };
    }
}
