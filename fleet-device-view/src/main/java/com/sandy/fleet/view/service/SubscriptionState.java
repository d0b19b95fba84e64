package com.sandy.fleet.view.service;

/**
 * Lifecycle of one watched stream. Only ACTIVE holds a transport call.
 */
public enum SubscriptionState {
    IDLE,
    ACTIVE,
    COMPLETED,
    ERRORED,
    CANCELLED
}
