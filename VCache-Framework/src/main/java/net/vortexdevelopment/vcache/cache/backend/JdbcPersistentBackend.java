package net.vortexdevelopment.vcache.cache.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import net.vortexdevelopment.vcache.cache.CacheException;
import net.vortexdevelopment.vcache.cache.PersistentBackend;
import net.vortexdevelopment.vcache.debug.DebugLogger;
import org.jetbrains.annotations.Nullable;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Persistent cache layer stored in a single key/value table.
 * <p>
 * Values and tags are stored as JSON. The value's class name is stored next to it and the
 * value is read back as that class, so a cached {@code Long} or POJO keeps its type. Maps,
 * lists and sets are recorded by their interface and come back as {@code LinkedHashMap},
 * {@code ArrayList} and {@code HashSet}; generic element types are not recorded, so the
 * elements of a collection come back as JSON-native types.
 * Expired rows are removed when read or by {@link #purgeExpired()}.
 */
@Slf4j
public class JdbcPersistentBackend implements PersistentBackend {

    public static final String DEFAULT_TABLE = "cache_entries";

    private static final TypeReference<List<String>> TAG_LIST = new TypeReference<>() {
    };

    private final CacheDatabase database;
    private final String table;
    private final Duration defaultTtl;
    private final Clock clock;
    private final ObjectMapper mapper;

    public JdbcPersistentBackend(CacheDatabase database, Duration defaultTtl) {
        this(database, DEFAULT_TABLE, defaultTtl, Clock.systemUTC(), new ObjectMapper());
    }

    public JdbcPersistentBackend(CacheDatabase database, String table, Duration defaultTtl, Clock clock,
                                 ObjectMapper mapper) {
        this.database = Objects.requireNonNull(database, "database");
        this.table = Objects.requireNonNull(table, "table");
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Create the cache table if it does not exist.
     */
    public void init() {
        database.connect(connection -> {
            try (Statement stmt = connection.createStatement()) {
                stmt.executeUpdate("CREATE TABLE IF NOT EXISTS " + table + " (\n"
                        + "  cache_key VARCHAR(255) NOT NULL,\n"
                        + "  cache_value LONGTEXT NOT NULL,\n"
                        + "  value_type VARCHAR(255) NULL,\n"
                        + "  tags TEXT NOT NULL,\n"
                        + "  created_at BIGINT NOT NULL,\n"
                        + "  expires_at BIGINT NULL,\n"
                        + "  PRIMARY KEY (cache_key)\n"
                        + ")");
            }
        });
        log.info("Persistent cache table ready table={}", table);
    }

    @Override
    @Nullable
    public Object get(String key) {
        return database.connect(connection -> {
            String json;
            String valueType;
            long expiresAt;
            boolean hasExpiry;
            try (PreparedStatement ps = connection.prepareStatement(
                    "SELECT cache_value, value_type, expires_at FROM " + table + " WHERE cache_key = ?")) {
                ps.setString(1, key);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return null;
                    }
                    json = rs.getString(1);
                    valueType = rs.getString(2);
                    expiresAt = rs.getLong(3);
                    hasExpiry = !rs.wasNull();
                }
            }

            if (hasExpiry && clock.millis() >= expiresAt) {
                deleteKey(connection, key);
                DebugLogger.log("Persistent entry expired for key: %s", key);
                return null;
            }
            return mapper.readValue(json, resolveType(key, valueType));
        });
    }

    @Override
    public void set(String key, Object value, @Nullable Duration ttl, Set<String> tags) {
        String valueJson;
        String tagsJson;
        try {
            valueJson = mapper.writeValueAsString(value);
            tagsJson = mapper.writeValueAsString(new ArrayList<>(tags));
        } catch (JsonProcessingException e) {
            throw new CacheException("Value for key " + key + " is not serializable", e);
        }

        String valueType = typeName(value);
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        long now = clock.millis();
        Long expiresAt = effectiveTtl.isZero() || effectiveTtl.isNegative() ? null : now + effectiveTtl.toMillis();

        database.connect(connection -> {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                deleteKey(connection, key);
                try (PreparedStatement ps = connection.prepareStatement(
                        "INSERT INTO " + table + " (cache_key, cache_value, value_type, tags, created_at, expires_at) VALUES (?, ?, ?, ?, ?, ?)")) {
                    ps.setString(1, key);
                    ps.setString(2, valueJson);
                    ps.setString(3, valueType);
                    ps.setString(4, tagsJson);
                    ps.setLong(5, now);
                    if (expiresAt == null) {
                        ps.setNull(6, Types.BIGINT);
                    } else {
                        ps.setLong(6, expiresAt);
                    }
                    ps.executeUpdate();
                }
                connection.commit();
            } catch (Exception e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
        });
    }

    @Override
    public boolean delete(String key) {
        return database.connect(connection -> deleteKey(connection, key) > 0);
    }

    @Override
    public void clear() {
        database.connect(connection -> {
            try (Statement stmt = connection.createStatement()) {
                int removed = stmt.executeUpdate("DELETE FROM " + table);
                log.info("Cache cleared layer=persistent entries={}", removed);
            }
        });
    }

    /**
     * Scans every row and removes those whose stored tags intersect {@code tags}.
     */
    @Override
    public int invalidateByTags(Set<String> tags) {
        if (tags.isEmpty()) {
            return 0;
        }
        return database.connect(connection -> {
            List<String> matching = new ArrayList<>();
            try (PreparedStatement ps = connection.prepareStatement("SELECT cache_key, tags FROM " + table);
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    List<String> entryTags = mapper.readValue(rs.getString(2), TAG_LIST);
                    for (String tag : entryTags) {
                        if (tags.contains(tag)) {
                            matching.add(rs.getString(1));
                            break;
                        }
                    }
                }
            }

            int removed = 0;
            for (String key : matching) {
                removed += deleteKey(connection, key);
            }
            log.info("Cache invalidated by tags layer=persistent tags={} count={}", tags, removed);
            return removed;
        });
    }

    /**
     * @return number of expired rows removed
     */
    public int purgeExpired() {
        return database.connect(connection -> {
            try (PreparedStatement ps = connection.prepareStatement(
                    "DELETE FROM " + table + " WHERE expires_at IS NOT NULL AND expires_at <= ?")) {
                ps.setLong(1, clock.millis());
                return ps.executeUpdate();
            }
        });
    }

    private int deleteKey(Connection connection, String key) throws Exception {
        try (PreparedStatement ps = connection.prepareStatement("DELETE FROM " + table + " WHERE cache_key = ?")) {
            ps.setString(1, key);
            return ps.executeUpdate();
        }
    }

    static String typeName(Object value) {
        if (value instanceof Map) {
            return Map.class.getName();
        }
        if (value instanceof List) {
            return List.class.getName();
        }
        if (value instanceof Set) {
            return Set.class.getName();
        }
        if (value instanceof Collection) {
            return Collection.class.getName();
        }
        return value.getClass().getName();
    }

    private Class<?> resolveType(String key, @Nullable String valueType) {
        if (valueType == null) {
            return Object.class;
        }
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = JdbcPersistentBackend.class.getClassLoader();
        }
        try {
            return Class.forName(valueType, false, loader);
        } catch (ClassNotFoundException e) {
            log.warn("Stored value type not found, reading as JSON key={} valueType={}", key, valueType);
            return Object.class;
        }
    }
}
