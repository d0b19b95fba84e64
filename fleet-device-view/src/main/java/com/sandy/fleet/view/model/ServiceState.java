package com.sandy.fleet.view.model;

public enum ServiceState {
    UNKNOWN(0),
    AVAILABLE(0x4),
    UNAVAILABLE(-0x4),
    CONNECTING(-0x2);

    private final int weight;

    ServiceState(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }
}
