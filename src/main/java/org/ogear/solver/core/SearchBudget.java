package org.ogear.solver.core;

/**
 * Per-search cap on expanded states.
 * <p>
 * The reference state space is tiny and finite, so the cap only turns a latent modeling
 * bug (a malformed table that keeps producing new states) into a reported error.
 */
public final class SearchBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    static final String PROP_MAX_EXPANDED = "ogear.search.maxExpandedStates";

    private static final SearchBudget UNLIMITED = new SearchBudget(UNBOUNDED);

    private final int maxExpandedStates;

    private SearchBudget(int maxExpandedStates) {
        this.maxExpandedStates = normalizeBound(maxExpandedStates);
    }

    /**
     * Creates a budget with an explicit bound; non-positive values mean unbounded.
     */
    public static SearchBudget of(int maxExpandedStates) {
        return new SearchBudget(maxExpandedStates);
    }

    public static SearchBudget unbounded() {
        return UNLIMITED;
    }

    /**
     * Loads the bound from the {@value #PROP_MAX_EXPANDED} system property.
     */
    public static SearchBudget defaults() {
        return SearchBudget.of(readBound(PROP_MAX_EXPANDED));
    }

    /**
     * Validates the running expanded-state count against the bound.
     *
     * @throws SearchBudgetExceededException when the count is over the bound.
     */
    void checkExpandedStates(int expandedStates) {
        if (expandedStates > maxExpandedStates) {
            throw new SearchBudgetExceededException(expandedStates, maxExpandedStates);
        }
    }

    public int maxExpandedStates() {
        return maxExpandedStates;
    }

    public boolean isBounded() {
        return maxExpandedStates != UNBOUNDED;
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }

    @Override
    public String toString() {
        return isBounded() ? "SearchBudget{maxExpandedStates=" + maxExpandedStates + "}" : "SearchBudget{unbounded}";
    }
}
