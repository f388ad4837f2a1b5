package com.bizgraph.rge.api;

/** The kinds of query the engine answers and caches. */
public enum QueryShape {
    /** Best path between a source and a target. */
    PATH,
    /** Every node within the hop bound of a source. */
    NEIGHBORHOOD,
    /** A business and its direct relationships. Always one hop. */
    NETWORK
}
