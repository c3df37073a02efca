package com.deckscript.script.deck;

/** Chart kinds accepted by slide.addChart. */
public enum ChartType {
    AREA("area"),
    BAR("bar"),
    BAR3D("bar3D"),
    BUBBLE("bubble"),
    DOUGHNUT("doughnut"),
    LINE("line"),
    PIE("pie"),
    RADAR("radar"),
    SCATTER("scatter");

    private final String backendName;

    ChartType(String backendName) {
        this.backendName = backendName;
    }

    public String backendName() {
        return backendName;
    }

    /** Exact backend-name lookup; null when the name is not a chart constant. */
    public static ChartType fromName(String name) {
        if (name == null) return null;
        for (ChartType t : values()) {
            if (t.backendName.equals(name)) return t;
        }
        return null;
    }
}
