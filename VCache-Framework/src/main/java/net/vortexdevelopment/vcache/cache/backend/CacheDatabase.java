package net.vortexdevelopment.vcache.cache.backend;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import net.vortexdevelopment.vcache.cache.CacheException;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Pooled JDBC access for the persistent cache layer. Supports H2 (file or in-memory),
 * MySQL and MariaDB.
 */
@Slf4j
public class CacheDatabase {

    public static final String IN_MEMORY = "mem";

    private final HikariConfig hikariConfig;
    private final String type;
    private HikariDataSource hikariDataSource;

    /**
     * @param h2File database file for H2, or {@value #IN_MEMORY} for an in-memory database
     */
    public CacheDatabase(String type, String host, String port, String database, String username,
                         String password, int maxPoolSize, String h2File) {
        this.type = type.toLowerCase(Locale.ENGLISH);
        hikariConfig = new HikariConfig();

        switch (this.type) {
            case "h2" -> {
                hikariConfig.setDriverClassName("org.h2.Driver");
                if (h2File.equalsIgnoreCase(IN_MEMORY)) {
                    hikariConfig.setJdbcUrl("jdbc:h2:mem:" + database + ";DB_CLOSE_DELAY=-1;MODE=MySQL;DATABASE_TO_LOWER=TRUE;CASE_INSENSITIVE_IDENTIFIERS=TRUE");
                } else {
                    hikariConfig.setJdbcUrl("jdbc:h2:file:./" + h2File.replace('\\', '/') + ";AUTO_RECONNECT=TRUE;MODE=MySQL;DATABASE_TO_LOWER=TRUE;CASE_INSENSITIVE_IDENTIFIERS=TRUE");
                }
            }
            case "mysql" -> {
                hikariConfig.setDriverClassName("com.mysql.cj.jdbc.Driver");
                hikariConfig.setJdbcUrl("jdbc:mysql://" + host + ":" + port + "/" + database + "?autoReconnect=true&useSSL=false");
            }
            case "mariadb" -> {
                hikariConfig.setDriverClassName("org.mariadb.jdbc.Driver");
                hikariConfig.setJdbcUrl("jdbc:mariadb://" + host + ":" + port + "/" + database + "?autoReconnect=true&useSSL=false");
            }
            default -> throw new IllegalArgumentException("Unsupported database type: " + type);
        }

        hikariConfig.setUsername(username);
        hikariConfig.setPassword(password);
        hikariConfig.setMaximumPoolSize(maxPoolSize);
        hikariConfig.setPoolName("vcache-" + database);
        hikariConfig.addDataSourceProperty("cachePrepStmts", "true");
        hikariConfig.addDataSourceProperty("prepStmtCacheSize", "250");
        hikariConfig.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");
    }

    /**
     * In-memory H2 database, mainly for tests and single-process deployments.
     */
    public static CacheDatabase inMemory(String database) {
        return new CacheDatabase("h2", "", "", database, "sa", "", 4, IN_MEMORY);
    }

    public void init() {
        hikariDataSource = new HikariDataSource(hikariConfig);
        log.info("Cache database pool started type={} url={}", type, hikariConfig.getJdbcUrl());
    }

    public boolean isH2() {
        return "h2".equals(type);
    }

    public Connection getConnection() throws SQLException {
        if (hikariDataSource == null) {
            throw new IllegalStateException("Cache database not initialized");
        }
        return hikariDataSource.getConnection();
    }

    public void connect(VoidConnection connection) {
        try (Connection conn = getConnection()) {
            connection.connect(conn);
        } catch (CacheException e) {
            throw e;
        } catch (Exception e) {
            throw new CacheException("Database connection error", e);
        }
    }

    public <T> T connect(ConnectionResult<T> connection) {
        try (Connection conn = getConnection()) {
            return connection.connect(conn);
        } catch (CacheException e) {
            throw e;
        } catch (Exception e) {
            throw new CacheException("Database connection error", e);
        }
    }

    public void shutdown() {
        if (hikariDataSource != null) {
            hikariDataSource.close();
            log.info("Cache database pool closed type={}", type);
        }
    }

    public interface VoidConnection {

        void connect(Connection connection) throws Exception;
    }

    public interface ConnectionResult<T> {

        T connect(Connection connection) throws Exception;
    }
}
