package com.sandy.fleet.view.model;

/**
 * Type tag of a topology object. Only {@link #ENTITY} objects describe devices.
 */
public enum EntityType {
    UNSPECIFIED,
    ENTITY,
    RELATIONSHIP,
    KIND
}
