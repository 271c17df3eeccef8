package com.cdm.modelgraph.config;

import org.neo4j.driver.Driver;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.neo4j.core.transaction.Neo4jTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Neo4j Configuration
 * Registers the Neo4j transaction manager and the programmatic transaction template
 * that wraps each entity's reconciliation in a single transaction.
 */
@Configuration
@EnableTransactionManagement
public class Neo4jConfig {

    @Bean(name = "neo4jTransactionManager")
    public PlatformTransactionManager neo4jTransactionManager(Driver driver) {
        return new Neo4jTransactionManager(driver);
    }

    /**
     * Used instead of @Transactional so the per-entity lock can be held
     * for the whole lifetime of the transaction, commit included.
     */
    @Bean(name = "neo4jTransactionOperations")
    public TransactionOperations neo4jTransactionOperations(
            @Qualifier("neo4jTransactionManager") PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }
}
