package com.cdm.modelgraph.service;

import com.cdm.modelgraph.config.ReconciliationProperties;
import com.cdm.modelgraph.graph.InMemoryGraphStore;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Wires the engine against an {@link InMemoryGraphStore} without a Spring context.
 */
class EngineFixture {

    final InMemoryGraphStore store = new InMemoryGraphStore();
    final ReconciliationProperties properties = new ReconciliationProperties();
    final TransactionOperations tx = TransactionOperations.withoutTransaction();

    final SelectorParser parser = new SelectorParser();
    final SelectorFormatter formatter = new SelectorFormatter();
    final EntityLockRegistry locks = new EntityLockRegistry(properties);
    final ExpectedEdgeResolver resolver = new ExpectedEdgeResolver(store);
    final ActualEdgeReader reader = new ActualEdgeReader(store);
    final DriverEdgeReconciler reconciler = new DriverEdgeReconciler(store, reader);

    final DriverReconciliationService drivers = new DriverReconciliationService(
            store, parser, formatter, resolver, reader, reconciler, locks, tx, properties);
    final ObjectRelationshipService relationships = new ObjectRelationshipService(store, locks, tx, properties);
    final AllPairsRelationshipEnforcer allPairs = new AllPairsRelationshipEnforcer(
            store, relationships, locks, tx, properties);
    final TierChainBuilder tiers = new TierChainBuilder(store, drivers, locks, tx, properties);
    final GroupPartExclusivityAuditor groupAuditor = new GroupPartExclusivityAuditor(
            store, new GroupOwnerChooser(), tx);
    final ModelEntityService entities = new ModelEntityService(store, drivers, relationships, tiers, locks, tx);
}
