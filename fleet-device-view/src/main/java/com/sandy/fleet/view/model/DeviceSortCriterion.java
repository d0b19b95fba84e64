package com.sandy.fleet.view.model;

public enum DeviceSortCriterion {
    ALPHABETICAL,
    STATUS,
    KIND,
    VERSION
}
