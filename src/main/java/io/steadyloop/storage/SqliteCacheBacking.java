package io.steadyloop.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.steadyloop.cache.CacheBacking;
import io.steadyloop.pool.PooledHandle;
import io.steadyloop.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Result cache rows in the engine database. Values are stored as JSON together with their
 * concrete class name; a row that no longer deserializes is dropped and reads as a miss.
 */
public final class SqliteCacheBacking<V> implements CacheBacking<V> {
    private static final Logger log = LoggerFactory.getLogger(SqliteCacheBacking.class);

    private final Database database;
    private final Class<V> valueType;
    private final Clock clock;

    public SqliteCacheBacking(Database database, Class<V> valueType, Clock clock) {
        this.database = database;
        this.valueType = valueType;
        this.clock = clock;
    }

    @Override
    public Optional<Stored<V>> load(String key, long nowMs) {
        String type;
        String json;
        long expiresAtMs;
        try (PooledHandle<Connection> h = database.lease();
             PreparedStatement ps = h.get().prepareStatement(
                     "SELECT value_type,value_json,expires_at_ms FROM result_cache WHERE cache_key=?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                type = rs.getString("value_type");
                json = rs.getString("value_json");
                long raw = rs.getLong("expires_at_ms");
                expiresAtMs = rs.wasNull() ? -1L : raw;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read cache entry: " + key, e);
        }
        if (expiresAtMs >= 0L && nowMs >= expiresAtMs) {
            delete(key);
            return Optional.empty();
        }
        V value;
        try {
            Class<?> stored = Class.forName(type);
            if (!valueType.isAssignableFrom(stored)) {
                throw new ClassCastException(type + " is not a " + valueType.getName());
            }
            value = valueType.cast(Jsons.compactMapper().readValue(json, stored));
        } catch (ClassNotFoundException | ClassCastException | JsonProcessingException e) {
            log.warn("Dropping unreadable cache entry {} ({})", key, e.toString());
            delete(key);
            return Optional.empty();
        }
        return Optional.of(new Stored<>(value, expiresAtMs, tagsOf(key)));
    }

    @Override
    public void save(String key, V value, long expiresAtMs, Set<String> tags) {
        String json;
        try {
            json = Jsons.compactMapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Cache entry {} kept in memory only: {} is not JSON serializable", key, value.getClass().getName());
            return;
        }
        try (PooledHandle<Connection> h = database.lease()) {
            Connection c = h.get();
            c.setAutoCommit(false);
            try (PreparedStatement dropTags = c.prepareStatement("DELETE FROM result_cache_tags WHERE cache_key=?");
                 PreparedStatement upsert = c.prepareStatement(
                         "INSERT OR REPLACE INTO result_cache(cache_key,value_type,value_json,expires_at_ms,size_bytes,created_at_ms) VALUES(?,?,?,?,?,?)");
                 PreparedStatement tag = c.prepareStatement(
                         "INSERT OR IGNORE INTO result_cache_tags(cache_key,tag) VALUES(?,?)")) {
                dropTags.setString(1, key);
                dropTags.executeUpdate();
                upsert.setString(1, key);
                upsert.setString(2, value.getClass().getName());
                upsert.setString(3, json);
                if (expiresAtMs < 0L) {
                    upsert.setNull(4, Types.INTEGER);
                } else {
                    upsert.setLong(4, expiresAtMs);
                }
                upsert.setInt(5, json.getBytes(StandardCharsets.UTF_8).length);
                upsert.setLong(6, clock.millis());
                upsert.executeUpdate();
                for (String t : tags) {
                    tag.setString(1, key);
                    tag.setString(2, t);
                    tag.addBatch();
                }
                if (!tags.isEmpty()) {
                    tag.executeBatch();
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to store cache entry: " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        return exec("DELETE FROM result_cache WHERE cache_key=?", ps -> ps.setString(1, key)) > 0;
    }

    @Override
    public List<String> deleteByTag(String tag) {
        List<String> keys = keys("SELECT cache_key FROM result_cache_tags WHERE tag=?", tag);
        for (String key : keys) {
            delete(key);
        }
        return keys;
    }

    @Override
    public List<String> deleteMatching(String fragment) {
        List<String> keys = keys("SELECT cache_key FROM result_cache WHERE instr(cache_key, ?) > 0", fragment);
        for (String key : keys) {
            delete(key);
        }
        return keys;
    }

    @Override
    public int deleteExpired(long nowMs) {
        return exec("DELETE FROM result_cache WHERE expires_at_ms IS NOT NULL AND expires_at_ms<=?",
                ps -> ps.setLong(1, nowMs));
    }

    @Override
    public int clear() {
        return exec("DELETE FROM result_cache", ps -> { });
    }

    private Set<String> tagsOf(String key) {
        return new LinkedHashSet<>(keys("SELECT tag FROM result_cache_tags WHERE cache_key=? ORDER BY tag", key));
    }

    private List<String> keys(String sql, String arg) {
        List<String> out = new ArrayList<>();
        try (PooledHandle<Connection> h = database.lease(); PreparedStatement ps = h.get().prepareStatement(sql)) {
            ps.setString(1, arg);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("DB query failed", e);
        }
        return out;
    }

    private int exec(String sql, Binder binder) {
        try (PooledHandle<Connection> h = database.lease(); PreparedStatement ps = h.get().prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("DB exec failed", e);
        }
    }

    private interface Binder { void bind(PreparedStatement ps) throws SQLException; }
}
