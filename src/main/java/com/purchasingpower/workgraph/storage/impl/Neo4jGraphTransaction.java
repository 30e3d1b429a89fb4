package com.purchasingpower.workgraph.storage.impl;

import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.storage.GraphTransaction;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Session;
import org.neo4j.driver.Transaction;
import org.neo4j.driver.exceptions.Neo4jException;

import java.util.List;
import java.util.Map;

/**
 * Explicit Neo4j transaction bound to its own session.
 */
@Slf4j
class Neo4jGraphTransaction implements GraphTransaction {

    private final Session session;
    private final Transaction transaction;

    Neo4jGraphTransaction(Session session) {
        this.session = session;
        this.transaction = session.beginTransaction();
    }

    @Override
    public List<Map<String, Object>> run(String cypher, Map<String, Object> parameters) {
        log.debug("🔁 [GRAPH DB TX] Query: {}", cypher);
        log.debug("🔁 [GRAPH DB TX] Parameters: {}", parameters);
        try {
            return transaction.run(cypher, parameters != null ? parameters : Map.of())
                .list(Neo4jValueMapper::toRow);
        } catch (Neo4jException e) {
            throw GraphOperationException.storage(e.getMessage(), e);
        }
    }

    @Override
    public void commit() {
        try {
            transaction.commit();
        } catch (Neo4jException e) {
            throw GraphOperationException.storage("Commit failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void rollback() {
        if (transaction.isOpen()) {
            transaction.rollback();
        }
    }

    @Override
    public boolean isOpen() {
        return transaction.isOpen();
    }

    @Override
    public void close() {
        try {
            transaction.close();
        } finally {
            session.close();
        }
    }
}
