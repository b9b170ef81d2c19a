package net.vortexdevelopment.vcache.invalidation;

public enum WriteOperation {
    CREATE,
    UPDATE,
    DELETE
}
