package io.macroq.stage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SqliteRecordStore implements RecordStore {
    private final Path dbFile;
    private final String jdbcUrl;

    public SqliteRecordStore(Path dbFile) {
        this.dbFile = dbFile;
        this.jdbcUrl = "jdbc:sqlite:" + dbFile.toString();
    }

    @Override
    public void init() {
        try {
            Path parent = dbFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize record database directory: " + dbFile, e);
        }
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            st.execute("""
                    CREATE TABLE IF NOT EXISTS staged_records (
                        name TEXT PRIMARY KEY,
                        content BLOB NOT NULL,
                        size_bytes INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            validatePragma(st, "journal_mode", "wal");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize staged record schema", e);
        }
    }

    Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=5000");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    @Override
    public void write(String name, byte[] content) {
        requireValid(name);
        String sql = """
                INSERT INTO staged_records(name,content,size_bytes,updated_at_ms) VALUES(?,?,?,?)
                ON CONFLICT(name) DO UPDATE SET content=excluded.content,size_bytes=excluded.size_bytes,updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, name);
            ps.setBytes(2, content);
            ps.setLong(3, content.length);
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to write staged record: " + name, e);
        }
    }

    @Override
    public Optional<byte[]> read(String name) {
        requireValid(name);
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT content FROM staged_records WHERE name=?")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.ofNullable(rs.getBytes(1));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read staged record: " + name, e);
        }
    }

    @Override
    public boolean exists(String name) {
        requireValid(name);
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT 1 FROM staged_records WHERE name=?")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to look up staged record: " + name, e);
        }
    }

    @Override
    public boolean delete(String name) {
        requireValid(name);
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM staged_records WHERE name=?")) {
            ps.setString(1, name);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete staged record: " + name, e);
        }
    }

    @Override
    public List<String> list() {
        List<String> names = new ArrayList<>();
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT name FROM staged_records ORDER BY name");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                names.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list staged records", e);
        }
        return names;
    }

    @Override
    public String describe() {
        return "sqlite:" + dbFile;
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    private static void requireValid(String name) {
        if (!RecordNames.isValid(name)) {
            throw new IllegalArgumentException("invalid record name: " + name);
        }
    }
}
