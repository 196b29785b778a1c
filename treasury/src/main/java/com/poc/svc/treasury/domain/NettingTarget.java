package com.poc.svc.treasury.domain;

/**
 * Reference point each entity's net position is measured against before matching.
 */
public enum NettingTarget {
    /** Raw signed entity balance; every entity is brought to zero. */
    ZERO,
    /** Deviation from the mean entity balance; every entity is brought to the mean. */
    AVERAGE
}
