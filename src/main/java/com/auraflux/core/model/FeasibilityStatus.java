package com.auraflux.core.model;

/**
 * Feasibility rating of a research topic, with the search advice shown alongside it.
 */
public enum FeasibilityStatus {
    HIGH("Focus your next search using specialized academic databases (e.g., Scopus, Web of Science) "
            + "targeting the specific geographical and time scope."),
    MEDIUM("Use a combination of general search engines and credible institutional reports "
            + "(e.g., OECD, World Bank) to solidify your topic."),
    LOW("The topic is highly niche or information-scarce. Start with broad keyword searches and general "
            + "encyclopedias to establish foundational context before narrowing down.");

    private final String resourceSuggestion;

    FeasibilityStatus(String resourceSuggestion) {
        this.resourceSuggestion = resourceSuggestion;
    }

    public String resourceSuggestion() {
        return resourceSuggestion;
    }

    /**
     * Rates a 0-10 availability score: niche topics and scores below 4 are LOW, 8 and above HIGH.
     */
    public static FeasibilityStatus fromScore(int score, boolean niche) {
        if (niche || score < 4) {
            return LOW;
        }
        return score >= 8 ? HIGH : MEDIUM;
    }
}
