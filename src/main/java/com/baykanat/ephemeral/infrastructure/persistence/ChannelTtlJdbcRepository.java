package com.baykanat.ephemeral.infrastructure.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** ephemeral_channels tablosu: kanal TTL'lerinin okunması, toplu upsert ve yapılandırmada olmayanların silinmesi. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ChannelTtlJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String UPSERT_SQL = """
            INSERT INTO ephemeral_channels (channel_id, ttl_seconds, updated_at)
            VALUES (?, ?, NOW())
            ON CONFLICT (channel_id) DO UPDATE SET ttl_seconds = EXCLUDED.ttl_seconds, updated_at = NOW()
            """;

    /** Tüm kanal → TTL kayıtları, channel_id sırasıyla. */
    public Map<Long, Duration> findAll() {
        List<Map.Entry<Long, Duration>> rows = jdbcTemplate.query(
                "SELECT channel_id, ttl_seconds FROM ephemeral_channels ORDER BY channel_id",
                (rs, rowNum) -> Map.entry(rs.getLong("channel_id"), Duration.ofSeconds(rs.getLong("ttl_seconds"))));

        Map<Long, Duration> channels = new LinkedHashMap<>();
        rows.forEach(row -> channels.put(row.getKey(), row.getValue()));
        return channels;
    }

    /** Verilen kanalları toplu upsert eder; mevcut TTL'ler güncellenir. */
    public void upsertAll(Map<Long, Duration> channels) {
        if (channels.isEmpty()) {
            return;
        }

        List<Object[]> batchArgs = channels.entrySet().stream()
                .map(entry -> new Object[]{
                        Objects.requireNonNull(entry.getKey(), "channelId"),
                        Objects.requireNonNull(entry.getValue(), "ttl").toSeconds()})
                .toList();
        jdbcTemplate.batchUpdate(UPSERT_SQL, Objects.requireNonNull(batchArgs));
    }

    /** Verilen kanallar dışındaki tüm kayıtları siler; silinen satır sayısını döner. */
    public int deleteAllExcept(Set<Long> keep) {
        if (keep.isEmpty()) {
            return jdbcTemplate.update("DELETE FROM ephemeral_channels");
        }
        Object[] ids = keep.toArray();
        return jdbcTemplate.update("DELETE FROM ephemeral_channels WHERE channel_id <> ALL (?)",
                ps -> ps.setArray(1, ps.getConnection().createArrayOf("bigint", ids)));
    }
}
