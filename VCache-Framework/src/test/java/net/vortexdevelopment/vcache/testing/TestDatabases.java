package net.vortexdevelopment.vcache.testing;

import net.vortexdevelopment.vcache.cache.backend.CacheDatabase;

import java.util.UUID;

/**
 * In-memory H2 databases for tests. Every call returns a fresh, initialized database.
 */
public class TestDatabases {

    public static CacheDatabase createInMemory() {
        return createInMemory("test_" + UUID.randomUUID().toString().replace("-", ""));
    }

    public static CacheDatabase createInMemory(String dbName) {
        CacheDatabase database = CacheDatabase.inMemory(dbName);
        database.init();
        return database;
    }
}
