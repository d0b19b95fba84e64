package com.sandy.fleet.view.model;

/**
 * Stream that supplied the descriptive fields of a {@link DeviceRecord}.
 */
public enum RecordSource {
    TOPOLOGY,
    CONFIGURATION
}
