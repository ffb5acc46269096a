package com.shardql.model;

/**
 * Shape of an aggregate below its outer key.
 */
public enum AggregateLayout {
    /** outer key -> inner key -> leaf */
    NESTED,
    /** outer key -> leaf; every unit must have a distinct outer key */
    FLAT
}
