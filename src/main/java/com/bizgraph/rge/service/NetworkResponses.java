package com.bizgraph.rge.service;

import com.bizgraph.rge.api.*;
import com.bizgraph.rge.service.NetworkResponse.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Builds {@link NetworkResponse} envelopes from query outcomes and errors. */
public final class NetworkResponses {

    private NetworkResponses() {
    }

    public static NetworkResponse network(QueryOutcome<BusinessNetworkView> outcome) {
        BusinessNetworkView view = outcome.value();
        String owner = view.business().id();
        List<RelationshipView> rels = new ArrayList<>(view.relationships().size());
        for (Adjacency a : view.relationships())
            rels.add(relationship(owner, a.edge()));

        Payload data = new Payload();
        data.setBusiness(business(view.business()));
        data.setRelationships(rels);
        return envelope(NetworkResponse.SUCCESS, data, rels.size(), outcome);
    }

    /**
     * @param sourceNode profile of the path's source, rendered as {@code data.business}
     */
    public static NetworkResponse path(BusinessNode sourceNode, QueryOutcome<PathResult> outcome) {
        PathResult p = outcome.value();
        List<RelationshipView> rels = new ArrayList<>(p.edges().size());
        for (int i = 0; i < p.edges().size(); i++)
            rels.add(relationship(p.nodes().get(i), p.edges().get(i)));

        PathView pv = new PathView();
        pv.setSource(p.source());
        pv.setTarget(p.target());
        pv.setNodes(p.nodes());
        pv.setHops(p.hops());
        pv.setWeight(p.weight());
        pv.setMaxDepth(p.maxDepth());

        Payload data = new Payload();
        data.setBusiness(sourceNode == null ? null : business(sourceNode));
        data.setRelationships(rels);
        data.setPath(pv);
        return envelope(p.found() ? NetworkResponse.SUCCESS : NetworkResponse.NO_PATH, data, rels.size(), outcome);
    }

    /**
     * Relationships of a neighbourhood are the edges of the best paths to each
     * neighbour (a spanning tree of the neighbourhood), each listed once.
     */
    public static NetworkResponse neighborhood(BusinessNode sourceNode, QueryOutcome<Neighborhood> outcome) {
        Neighborhood n = outcome.value();
        Map<String, RelationshipView> tree = new LinkedHashMap<>();
        List<NeighborView> neighbors = new ArrayList<>(n.size());
        for (NeighborEntry e : n.entries()) {
            NeighborView nv = new NeighborView();
            nv.setBusinessId(e.nodeId());
            nv.setDistance(e.distance());
            nv.setWeight(e.weight());
            nv.setPath(e.path());
            neighbors.add(nv);
            for (int i = 0; i < e.edges().size(); i++) {
                RelationshipEdge edge = e.edges().get(i);
                String from = e.path().get(i);
                tree.putIfAbsent(edge.pair() + "/" + edge.type(), relationship(from, edge));
            }
        }

        Payload data = new Payload();
        data.setBusiness(sourceNode == null ? null : business(sourceNode));
        data.setRelationships(new ArrayList<>(tree.values()));
        data.setNeighbors(neighbors);
        return envelope(NetworkResponse.SUCCESS, data, tree.size(), outcome);
    }

    public static NetworkResponse error(GraphQueryException e) {
        return error(e.code(), e.getMessage());
    }

    public static NetworkResponse error(ErrorCode code, String message) {
        ErrorBody body = new ErrorBody();
        body.setCode(code.name());
        body.setMessage(message);
        NetworkResponse r = new NetworkResponse();
        r.setStatus(NetworkResponse.ERROR);
        r.setError(body);
        return r;
    }

    static BusinessView business(BusinessNode node) {
        BusinessView b = new BusinessView();
        b.setId(node.id());
        b.setName(node.name());
        b.setCategory(node.category());
        b.setLocation(node.location());
        b.setSizeClass(node.sizeClass() == null ? null : node.sizeClass().name().toLowerCase(Locale.ROOT));
        b.setCreatedAt(node.createdAt());
        b.setUpdatedAt(node.updatedAt());
        return b;
    }

    static RelationshipView relationship(String from, RelationshipEdge edge) {
        RelationshipView r = new RelationshipView();
        r.setSourceId(from);
        r.setBusinessId(edge.other(from));
        r.setRelationshipType(edge.type().wireName());
        r.setWeight(edge.weight());
        r.setTransactionVolume(edge.transactionVolume());
        r.setFrequency(edge.frequency().wireName());
        r.setCreatedAt(edge.createdAt());
        r.setLastTransaction(edge.lastTransaction());
        return r;
    }

    private static NetworkResponse envelope(String status, Payload data, long totalRelationships,
            QueryOutcome<?> outcome) {
        Metadata meta = new Metadata();
        meta.setTotalRelationships(totalRelationships);
        meta.setQueryTimeMs(outcome.queryTimeMillis());
        meta.setCacheHit(outcome.cacheHit());
        meta.setSnapshotVersion(outcome.snapshotVersion());

        NetworkResponse r = new NetworkResponse();
        r.setStatus(status);
        r.setData(data);
        r.setMetadata(meta);
        return r;
    }
}
