package com.bizgraph.rge.api;

/** Kind of mutation carried by a relationship change or invalidation event. */
public enum ChangeKind {
    CREATED, UPDATED, DELETED
}
