package com.cdm.modelgraph.exception;

public class EntityLockTimeoutException extends ModelGraphException {

    public EntityLockTimeoutException(String entityKey, long timeoutMs) {
        super("Another reconciliation is still running for " + entityKey + " (waited " + timeoutMs + "ms)");
    }
}
