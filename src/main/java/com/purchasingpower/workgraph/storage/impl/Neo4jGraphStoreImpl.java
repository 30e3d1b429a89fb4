package com.purchasingpower.workgraph.storage.impl;

import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.storage.CypherRunner;
import com.purchasingpower.workgraph.storage.GraphStore;
import com.purchasingpower.workgraph.storage.GraphTransaction;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Session;
import org.neo4j.driver.TransactionContext;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Neo4j implementation of GraphStore.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class Neo4jGraphStoreImpl implements GraphStore {

    @Value("${neo4j.uri:bolt://localhost:7687}")
    private String neo4jUri;

    @Value("${neo4j.username:neo4j}")
    private String neo4jUsername;

    @Value("${neo4j.password:password}")
    private String neo4jPassword;

    @Value("${neo4j.connect-on-startup:true}")
    private boolean connectOnStartup;

    private Driver driver;

    public Neo4jGraphStoreImpl() {
    }

    Neo4jGraphStoreImpl(String uri, String username, String password) {
        this.neo4jUri = uri;
        this.neo4jUsername = username;
        this.neo4jPassword = password;
        this.connectOnStartup = true;
    }

    @PostConstruct
    public void init() {
        log.info("Initializing Neo4j GraphStore at: {}", neo4jUri);
        driver = GraphDatabase.driver(neo4jUri,
                AuthTokens.basic(neo4jUsername, neo4jPassword));
        if (connectOnStartup) {
            createSchema();
        }
    }

    @PreDestroy
    public void close() {
        if (driver != null) {
            driver.close();
            log.info("Neo4j GraphStore connection closed");
        }
    }

    private void createSchema() {
        try (Session session = driver.session()) {
            session.run("CREATE CONSTRAINT work_item_id IF NOT EXISTS FOR (n:WorkItem) REQUIRE n.id IS UNIQUE");
            session.run("CREATE CONSTRAINT contributor_id IF NOT EXISTS FOR (c:Contributor) REQUIRE c.id IS UNIQUE");
            session.run("CREATE CONSTRAINT graph_id IF NOT EXISTS FOR (g:Graph) REQUIRE g.id IS UNIQUE");

            session.run("CREATE INDEX work_item_type IF NOT EXISTS FOR (n:WorkItem) ON (n.type)");
            session.run("CREATE INDEX work_item_status IF NOT EXISTS FOR (n:WorkItem) ON (n.status)");
            session.run("CREATE INDEX work_item_priority IF NOT EXISTS FOR (n:WorkItem) ON (n.priorityComputed)");
            session.run("CREATE INDEX work_item_updated IF NOT EXISTS FOR (n:WorkItem) ON (n.updatedAt)");
            session.run("CREATE INDEX graph_status IF NOT EXISTS FOR (g:Graph) ON (g.status)");
            session.run("CREATE INDEX graph_team IF NOT EXISTS FOR (g:Graph) ON (g.teamId)");

            log.info("✅ Neo4j constraints and indexes created");
        } catch (Exception e) {
            log.warn("⚠️  Failed to create schema: {}", e.getMessage());
        }
    }

    @Override
    public List<Map<String, Object>> read(String cypher, Map<String, Object> parameters) {
        return readTransaction(tx -> tx.run(cypher, parameters));
    }

    @Override
    public <T> T readTransaction(Function<CypherRunner, T> work) {
        long startTime = System.currentTimeMillis();
        try (Session session = driver.session()) {
            T result = session.executeRead(tx -> work.apply(runner(tx, "📊 [GRAPH DB READ]")));
            log.debug("📊 [GRAPH DB READ] Completed in {}ms", System.currentTimeMillis() - startTime);
            return result;
        } catch (Neo4jException e) {
            log.error("Graph read failed", e);
            throw GraphOperationException.storage(e.getMessage(), e);
        }
    }

    @Override
    public List<Map<String, Object>> write(String cypher, Map<String, Object> parameters) {
        return writeTransaction(tx -> tx.run(cypher, parameters));
    }

    @Override
    public <T> T writeTransaction(Function<CypherRunner, T> work) {
        long startTime = System.currentTimeMillis();
        try (Session session = driver.session()) {
            T result = session.executeWrite(tx -> work.apply(runner(tx, "✍️  [GRAPH DB WRITE]")));
            log.debug("✍️  [GRAPH DB WRITE] Completed in {}ms", System.currentTimeMillis() - startTime);
            return result;
        } catch (Neo4jException e) {
            log.error("Graph write failed", e);
            throw GraphOperationException.storage(e.getMessage(), e);
        }
    }

    @Override
    public GraphTransaction beginTransaction() {
        Session session = driver.session();
        try {
            return new Neo4jGraphTransaction(session);
        } catch (Neo4jException e) {
            session.close();
            throw GraphOperationException.storage("Could not open transaction: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean verifyConnectivity() {
        try {
            driver.verifyConnectivity();
            return true;
        } catch (Exception e) {
            log.warn("⚠️  Neo4j connectivity check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getUri() {
        return neo4jUri;
    }

    private CypherRunner runner(TransactionContext tx, String logPrefix) {
        return (cypher, parameters) -> {
            log.debug("{} Query: {}", logPrefix, cypher);
            log.debug("{} Parameters: {}", logPrefix, parameters);
            return tx.run(cypher, parameters != null ? parameters : Map.of())
                .list(Neo4jValueMapper::toRow);
        };
    }
}
