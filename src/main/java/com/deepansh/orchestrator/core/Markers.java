package com.deepansh.orchestrator.core;

import java.util.Locale;

/**
 * Plain-text signals the machines look for in generated output.
 */
public final class Markers {

    /** A reflection saying the response needs no more work */
    public static final String NO_FURTHER_IMPROVEMENT = "NO FURTHER IMPROVEMENT";

    /** A step result saying the rest of the plan cannot work */
    public static final String PLAN_INVALID = "PLAN INVALID";

    private Markers() {
    }

    public static boolean contains(String text, String marker) {
        return text != null && text.toUpperCase(Locale.ROOT).contains(marker);
    }
}
