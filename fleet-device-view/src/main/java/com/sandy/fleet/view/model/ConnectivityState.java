package com.sandy.fleet.view.model;

public enum ConnectivityState {
    UNKNOWN("unknown", 0),
    REACHABLE("reachable", 0x8),
    UNREACHABLE("unreachable", -0x8);

    private final String label;
    private final int weight;

    ConnectivityState(String label, int weight) {
        this.label = label;
        this.weight = weight;
    }

    public String label() {
        return label;
    }

    public int weight() {
        return weight;
    }
}
