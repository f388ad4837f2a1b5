package com.bizgraph.rge.api;

import java.util.List;

/** A business together with its direct relationships. */
public record BusinessNetworkView(BusinessNode business, List<Adjacency> relationships) {

    public BusinessNetworkView {
        relationships = List.copyOf(relationships);
    }
}
