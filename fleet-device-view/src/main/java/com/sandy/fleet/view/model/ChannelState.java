package com.sandy.fleet.view.model;

public enum ChannelState {
    UNKNOWN("unknown", 0),
    CONNECTED("connected", 0x1),
    DISCONNECTED("disconnected", -0x1);

    private final String label;
    private final int weight;

    ChannelState(String label, int weight) {
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
