package com.bizgraph.rge;

import com.bizgraph.rge.api.*;
import com.bizgraph.rge.io.EngineConfig;
import com.bizgraph.rge.io.EngineConfigLoader;
import com.bizgraph.rge.io.JsonSupport;
import com.bizgraph.rge.io.NetworkDefinitionLoader;
import com.bizgraph.rge.service.NetworkQueryService;
import com.bizgraph.rge.service.NetworkResponses;
import com.bizgraph.rge.service.QueryOutcome;
import com.bizgraph.rge.service.RelationshipChange;

import lombok.extern.log4j.Log4j2;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Loads the sample network, runs a few queries and a mutation, and optionally
 * keeps the HTTP server up.
 *
 * <pre>
 * BusinessNetworkDemo [--serve] [--config path/to/bizgraph.json] [--network path/to/network.json]
 * </pre>
 */
@Log4j2
public class BusinessNetworkDemo {

    public static void main(String[] args) throws Exception {
        boolean serve = false;
        String configPath = null, networkPath = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--serve" -> serve = true;
                case "--config" -> configPath = args[++i];
                case "--network" -> networkPath = args[++i];
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
        }

        EngineConfig config = configPath != null ? EngineConfigLoader.load(Path.of(configPath))
                : EngineConfigLoader.loadDefault();

        BusinessNetwork network = BusinessNetwork.builder().config(config).build();
        network.load(networkPath != null ? NetworkDefinitionLoader.parseFile(Path.of(networkPath))
                : NetworkDefinitionLoader.parseResource("sample_network.json"));

        NetworkQueryService queries = network.queries();

        // 1. Best path, computed then served from cache
        for (int i = 0; i < 2; i++) {
            QueryOutcome<PathResult> path = queries.findPath("granite-tools", "fjord-finance", network.newDeadline());
            log.info("Path {} (cache_hit={}, {} hops, weight {})", path.value().nodes(), path.cacheHit(),
                    path.value().hops(), String.format("%.4f", path.value().weight()));
        }

        // 2. Neighbourhood envelope as it goes over the wire
        Deadline deadline = network.newDeadline();
        QueryOutcome<Neighborhood> hood = queries.neighborhood("delta-builders", 2, deadline);
        BusinessNode source = queries.business("delta-builders", deadline).orElseThrow();
        log.info("Neighbourhood envelope:\n{}", JsonSupport.mapper().writerWithDefaultPrettyPrinter()
                .writeValueAsString(NetworkResponses.neighborhood(source, hood)));

        // 3. A new relationship drops the cached direct network of both ends
        queries.network("evergreen-design", network.newDeadline());
        Instant now = Instant.now();
        queries.applyRelationshipChange(RelationshipChange.created("evergreen-design", "fjord-finance",
                RelationshipType.CLIENT, new BigDecimal("5400"), Frequency.MONTHLY, now), network.newDeadline());
        QueryOutcome<BusinessNetworkView> after = queries.network("evergreen-design", network.newDeadline());
        log.info("evergreen-design now has {} relationships (cache_hit={})", after.value().relationships().size(),
                after.cacheHit());

        log.info("Stats: {}", network.stats().dump());

        if (serve) {
            network.startServer(config.getServer().getPort());
            Runtime.getRuntime().addShutdownHook(new Thread(network::close, "bizgraph-shutdown"));
            log.info("Serving on port {}; Ctrl+C to stop", config.getServer().getPort());
            Thread.currentThread().join();
        } else {
            network.close();
        }
    }
}
