package com.bizgraph.rge.io;

import com.bizgraph.rge.api.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Parses network seed files and loads them into a {@link GraphStore}.
 *
 * Businesses are loaded before relationships, so a relationship may only
 * reference businesses declared in the same file or already in the store.
 * Duplicate (pair, type) records in one file are a conflict.
 */
public final class NetworkDefinitionLoader {
    private static final Logger log = LogManager.getLogger(NetworkDefinitionLoader.class);

    private NetworkDefinitionLoader() {
    }

    /** Counts of what a load wrote. */
    public record LoadSummary(String name, int businesses, int relationships) {
    }

    public static NetworkDefinition parse(String json) {
        try {
            return requireNetwork(JsonSupport.mapper().readValue(json, NetworkDefinition.class));
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed network definition: " + e.getMessage(), e);
        }
    }

    public static NetworkDefinition parseFile(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read network definition from " + path, e);
        }
    }

    public static NetworkDefinition parseResource(String resource) {
        try (InputStream in = NetworkDefinitionLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Network definition not found on classpath: " + resource);
            return requireNetwork(JsonSupport.mapper().readValue(in, NetworkDefinition.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read network definition " + resource, e);
        }
    }

    /**
     * @param defaultTime timestamp used where the file leaves one out
     * @throws UnknownEntityException if a relationship references an unknown business
     * @throws EdgeConflictException  if the file declares a (pair, type) twice
     */
    public static LoadSummary load(NetworkDefinition def, GraphStore store, WeightFunction weightFn,
            Instant defaultTime) {
        NetworkDefinition.NetworkInfo info = def.getNetwork();
        int nodes = 0, edges = 0;

        for (NetworkDefinition.BusinessDef b : nullSafe(info.getBusinesses())) {
            Instant at = b.getCreatedAt() != null ? b.getCreatedAt() : defaultTime;
            SizeClass size = b.getSizeClass() == null ? SizeClass.SMALL
                    : SizeClass.valueOf(b.getSizeClass().trim().toUpperCase(Locale.ROOT));
            store.putNode(new BusinessNode(b.getId(), b.getName(), b.getCategory(), b.getLocation(), size, at, at));
            nodes++;
        }

        for (NetworkDefinition.RelationshipDef r : nullSafe(info.getRelationships())) {
            Instant created = r.getCreatedAt() != null ? r.getCreatedAt() : defaultTime;
            BigDecimal volume = r.getTransactionVolume() != null ? r.getTransactionVolume() : BigDecimal.ZERO;
            RelationshipEdge edge = RelationshipEdge.create(r.getSource(), r.getTarget(),
                    RelationshipType.fromWire(r.getType()), volume, Frequency.fromWire(r.getFrequency()), created,
                    r.getLastTransaction(), weightFn);
            store.upsertEdge(edge, false);
            edges++;
        }

        log.info("Loaded network '{}': {} businesses, {} relationships", info.getName(), nodes, edges);
        return new LoadSummary(info.getName(), nodes, edges);
    }

    private static NetworkDefinition requireNetwork(NetworkDefinition def) {
        if (def == null || def.getNetwork() == null)
            throw new IllegalArgumentException("Missing 'network' key");
        return def;
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }
}
