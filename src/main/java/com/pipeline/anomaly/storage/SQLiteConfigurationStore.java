package com.pipeline.anomaly.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.anomaly.core.ConfigurationStore;
import com.pipeline.anomaly.exception.ConfigurationException;
import com.pipeline.anomaly.exception.PortUnavailableException;
import com.pipeline.anomaly.model.Pipeline;
import com.pipeline.anomaly.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于SQLite的管道配置存储。
 *
 * 单表 pipelines(name, definition, updated_at)，definition 为Jackson序列化的管道JSON。
 * 所有操作串行执行，SQLite错误包装为 PortUnavailableException。
 */
public class SQLiteConfigurationStore implements ConfigurationStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SQLiteConfigurationStore.class);

    static final String PORT = "configuration-store";

    private final String dbPath;
    private final ObjectMapper mapper = JsonSupport.mapper();
    private Connection connection;

    public SQLiteConfigurationStore(String dbPath) {
        this.dbPath = dbPath;

        File parent = new File(dbPath).getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new PortUnavailableException(PORT, "init",
                    new IllegalStateException("Failed to create directory: " + parent));
        }
        initDatabase();
        log.info("SQLiteConfigurationStore initialized. Path: {}", dbPath);
    }

    private void initDatabase() {
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            connection.setAutoCommit(true);
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("CREATE TABLE IF NOT EXISTS pipelines ("
                        + "name TEXT PRIMARY KEY, "
                        + "definition TEXT NOT NULL, "
                        + "updated_at INTEGER NOT NULL)");
            }
        } catch (SQLException e) {
            log.error("Failed to initialize configuration database {}: {}", dbPath, e.getMessage(), e);
            throw new PortUnavailableException(PORT, "init", e);
        }
    }

    @Override
    public synchronized List<Pipeline> list() {
        List<Pipeline> pipelines = new ArrayList<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT name, definition FROM pipelines ORDER BY name")) {
            while (rs.next()) {
                String name = rs.getString("name");
                try {
                    pipelines.add(mapper.readValue(rs.getString("definition"), Pipeline.class));
                } catch (JsonProcessingException e) {
                    log.error("Stored definition of pipeline '{}' is unreadable, skipped: {}",
                            name, e.getOriginalMessage());
                }
            }
        } catch (SQLException e) {
            log.error("Failed to list pipelines: {}", e.getMessage(), e);
            throw new PortUnavailableException(PORT, "list", e);
        }
        return pipelines;
    }

    @Override
    public synchronized Pipeline get(String name) {
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT definition FROM pipelines WHERE name = ?")) {
            stmt.setString(1, name);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return mapper.readValue(rs.getString("definition"), Pipeline.class);
            }
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Stored definition of pipeline '" + name
                    + "' is unreadable: " + e.getOriginalMessage());
        } catch (SQLException e) {
            log.error("Failed to read pipeline '{}': {}", name, e.getMessage(), e);
            throw new PortUnavailableException(PORT, "get", e);
        }
    }

    @Override
    public synchronized void save(Pipeline pipeline) {
        String name = pipeline.getName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pipeline name must not be null or blank");
        }
        String json;
        try {
            json = mapper.writeValueAsString(pipeline);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Pipeline '" + name + "' cannot be serialized: "
                    + e.getOriginalMessage());
        }
        try (PreparedStatement stmt = connection.prepareStatement(
                "INSERT OR REPLACE INTO pipelines (name, definition, updated_at) VALUES (?, ?, ?)")) {
            stmt.setString(1, name);
            stmt.setString(2, json);
            stmt.setLong(3, System.currentTimeMillis());
            stmt.executeUpdate();
            log.info("Pipeline '{}' saved.", name);
        } catch (SQLException e) {
            log.error("Failed to save pipeline '{}': {}", name, e.getMessage(), e);
            throw new PortUnavailableException(PORT, "save", e);
        }
    }

    @Override
    public synchronized boolean delete(String name) {
        try (PreparedStatement stmt = connection.prepareStatement("DELETE FROM pipelines WHERE name = ?")) {
            stmt.setString(1, name);
            boolean deleted = stmt.executeUpdate() > 0;
            if (deleted) {
                log.info("Pipeline '{}' deleted.", name);
            } else {
                log.debug("Pipeline '{}' not found, nothing to delete.", name);
            }
            return deleted;
        } catch (SQLException e) {
            log.error("Failed to delete pipeline '{}': {}", name, e.getMessage(), e);
            throw new PortUnavailableException(PORT, "delete", e);
        }
    }

    @Override
    public synchronized void close() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
            log.info("SQLiteConfigurationStore closed.");
        } catch (SQLException e) {
            log.warn("Error closing configuration database: {}", e.getMessage());
        }
    }
}
