package com.pgost.migration.model;

/**
 * Kind of row mutation captured by the change-capture triggers.
 * The names match what the trigger function writes (PL/pgSQL's TG_OP).
 */
public enum ChangeOperation {
    INSERT,
    UPDATE,
    DELETE;
    
    public boolean carriesRowImage() {
        return this != DELETE;
    }
}
