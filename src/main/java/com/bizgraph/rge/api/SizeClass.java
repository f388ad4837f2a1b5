package com.bizgraph.rge.api;

/** Coarse headcount band of a business. */
public enum SizeClass {
    MICRO, SMALL, MEDIUM, LARGE, ENTERPRISE
}
