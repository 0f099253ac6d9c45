package com.hvacintel.consumption.model;

/**
 * Progress of one device version through the attribution pipeline.
 */
public enum AttributionState {
    PENDING,
    DIRECT_COMPUTED,
    DIRECT_OK,
    DIRECT_EMPTY,
    INDIRECT_COMPUTED,
    CONSOLIDATED
}
