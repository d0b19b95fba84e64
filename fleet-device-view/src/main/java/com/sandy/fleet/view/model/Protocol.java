package com.sandy.fleet.view.model;

/**
 * Management protocol carried by one device channel.
 */
public enum Protocol {
    UNKNOWN("unknown"),
    GNMI("gnmi"),
    P4RUNTIME("p4runtime"),
    GNOI("gnoi");

    private final String label;

    Protocol(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
