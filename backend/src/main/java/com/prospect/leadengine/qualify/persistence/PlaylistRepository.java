package com.prospect.leadengine.qualify.persistence;

import com.prospect.leadengine.qualify.model.Lead;
import com.prospect.leadengine.qualify.model.PriorityTier;
import com.prospect.leadengine.qualify.playlist.DailyCandidate;
import com.prospect.leadengine.qualify.playlist.EngagementStats;
import com.prospect.leadengine.qualify.playlist.LeadEngagement;
import com.prospect.leadengine.qualify.playlist.MemberStatus;
import com.prospect.leadengine.qualify.playlist.Playlist;
import com.prospect.leadengine.qualify.playlist.PlaylistCriteria;
import com.prospect.leadengine.qualify.playlist.PlaylistMember;
import com.prospect.leadengine.qualify.playlist.PlaylistPerformance;
import com.prospect.leadengine.qualify.playlist.PlaylistStatus;
import com.prospect.leadengine.qualify.playlist.PlaylistType;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.prospect.leadengine.qualify.persistence.JsonColumns.toInstant;
import static com.prospect.leadengine.qualify.persistence.JsonColumns.toTimestamp;

@Repository
public class PlaylistRepository {
    private static final RowMapper<PlaylistMember> MEMBER_MAPPER = (rs, rowNum) -> new PlaylistMember(
        rs.getLong("id"),
        rs.getLong("playlist_id"),
        rs.getLong("lead_id"),
        rs.getString("company_name"),
        rs.getDouble("score"),
        parsePriority(rs.getString("priority")),
        toInstant(rs.getTimestamp("added_at")),
        MemberStatus.fromValue(rs.getString("status"))
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final JsonColumns json;
    private final RowMapper<Playlist> playlistMapper;

    public PlaylistRepository(
        NamedParameterJdbcTemplate jdbc,
        TransactionTemplate transactionTemplate,
        JsonColumns json
    ) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
        this.json = json;
        this.playlistMapper = (rs, rowNum) -> new Playlist(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("description"),
            PlaylistType.fromValue(rs.getString("playlist_type")),
            json.read(rs.getString("criteria_json"), PlaylistCriteria.class, PlaylistCriteria.any()),
            rs.getInt("target_size"),
            rs.getInt("refresh_hours"),
            rs.getString("owner_id"),
            PlaylistStatus.fromValue(rs.getString("status")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("last_refreshed_at"))
        );
    }

    public Playlist insert(Playlist playlist) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO playlists (
                    name, description, playlist_type, criteria_json, target_size, refresh_hours,
                    owner_id, status, created_at
                )
                VALUES (
                    :name, :description, :type, :criteria, :targetSize, :refreshHours,
                    :ownerId, :status, :createdAt
                )
                """,
            new MapSqlParameterSource()
                .addValue("name", playlist.name())
                .addValue("description", playlist.description())
                .addValue("type", playlist.type().value())
                .addValue("criteria", json.write(playlist.criteria() == null ? PlaylistCriteria.any() : playlist.criteria()))
                .addValue("targetSize", playlist.targetSize())
                .addValue("refreshHours", playlist.refreshHours())
                .addValue("ownerId", playlist.ownerId())
                .addValue("status", playlist.status().value())
                .addValue("createdAt", toTimestamp(playlist.createdAt())),
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return playlist.withId(key == null ? null : key.longValue());
    }

    public Optional<Playlist> findById(long id) {
        List<Playlist> rows = jdbc.query(
            "SELECT * FROM playlists WHERE id = :id",
            new MapSqlParameterSource("id", id),
            playlistMapper
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<Playlist> findAll(boolean includeArchived) {
        String sql = includeArchived
            ? "SELECT * FROM playlists ORDER BY created_at DESC, id DESC"
            : "SELECT * FROM playlists WHERE status = 'active' ORDER BY created_at DESC, id DESC";
        return jdbc.query(sql, new MapSqlParameterSource(), playlistMapper);
    }

    public List<Playlist> findActiveDynamic() {
        return jdbc.query(
            """
                SELECT *
                FROM playlists
                WHERE status = 'active' AND playlist_type = 'dynamic'
                ORDER BY CASE WHEN last_refreshed_at IS NULL THEN 0 ELSE 1 END, last_refreshed_at ASC, id ASC
                """,
            new MapSqlParameterSource(),
            playlistMapper
        );
    }

    public boolean updateStatus(long playlistId, PlaylistStatus status) {
        return jdbc.update(
            "UPDATE playlists SET status = :status WHERE id = :id",
            new MapSqlParameterSource()
                .addValue("id", playlistId)
                .addValue("status", status.value())
        ) > 0;
    }

    /**
     * Swaps the whole membership of a playlist and stamps the refresh time in one transaction, so readers see
     * either the old members or the new ones.
     */
    public int replaceMembers(long playlistId, List<Lead> leads, Instant refreshedAt) {
        Integer inserted = transactionTemplate.execute(status -> {
            jdbc.update(
                "DELETE FROM playlist_leads WHERE playlist_id = :playlistId",
                new MapSqlParameterSource("playlistId", playlistId)
            );
            int count = insertMembers(playlistId, leads, refreshedAt);
            jdbc.update(
                "UPDATE playlists SET last_refreshed_at = :refreshedAt WHERE id = :id",
                new MapSqlParameterSource()
                    .addValue("id", playlistId)
                    .addValue("refreshedAt", toTimestamp(refreshedAt))
            );
            return count;
        });
        return inserted == null ? 0 : inserted;
    }

    /**
     * Adds leads that are not members yet. Returns how many were added.
     */
    public int addMembers(long playlistId, List<Lead> leads, Instant addedAt) {
        Integer inserted = transactionTemplate.execute(status -> {
            List<Lead> fresh = new ArrayList<>();
            for (Lead lead : leads) {
                if (lead.id() != null && !isMember(playlistId, lead.id())) {
                    fresh.add(lead);
                }
            }
            return insertMembers(playlistId, fresh, addedAt);
        });
        return inserted == null ? 0 : inserted;
    }

    public boolean isMember(long playlistId, long leadId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM playlist_leads WHERE playlist_id = :playlistId AND lead_id = :leadId",
            new MapSqlParameterSource()
                .addValue("playlistId", playlistId)
                .addValue("leadId", leadId),
            Long.class
        );
        return count != null && count > 0;
    }

    private int insertMembers(long playlistId, List<Lead> leads, Instant addedAt) {
        if (leads == null || leads.isEmpty()) {
            return 0;
        }
        List<MapSqlParameterSource> batch = new ArrayList<>();
        for (Lead lead : leads) {
            if (lead.id() == null) {
                continue;
            }
            batch.add(new MapSqlParameterSource()
                .addValue("playlistId", playlistId)
                .addValue("leadId", lead.id())
                .addValue("companyName", lead.companyName())
                .addValue("score", lead.score())
                .addValue("priority", lead.priority().name())
                .addValue("addedAt", toTimestamp(addedAt)));
        }
        if (batch.isEmpty()) {
            return 0;
        }
        jdbc.batchUpdate(
            """
                INSERT INTO playlist_leads (playlist_id, lead_id, company_name, score, priority, added_at, status)
                VALUES (:playlistId, :leadId, :companyName, :score, :priority, :addedAt, 'new')
                """,
            batch.toArray(new MapSqlParameterSource[0])
        );
        return batch.size();
    }

    public List<PlaylistMember> findMembers(long playlistId) {
        return jdbc.query(
            """
                SELECT *
                FROM playlist_leads
                WHERE playlist_id = :playlistId
                ORDER BY score DESC, id ASC
                """,
            new MapSqlParameterSource("playlistId", playlistId),
            MEMBER_MAPPER
        );
    }

    public boolean updateMemberStatus(long playlistId, long leadId, MemberStatus status) {
        return jdbc.update(
            """
                UPDATE playlist_leads
                SET status = :status
                WHERE playlist_id = :playlistId AND lead_id = :leadId
                """,
            new MapSqlParameterSource()
                .addValue("playlistId", playlistId)
                .addValue("leadId", leadId)
                .addValue("status", status.value())
        ) > 0;
    }

    /**
     * Untouched members of active playlists, best score first and most recently added first among equals.
     */
    public List<DailyCandidate> findDailyCandidates(int limit) {
        return jdbc.query(
            """
                SELECT pl.*, p.name AS playlist_name
                FROM playlist_leads pl
                JOIN playlists p ON p.id = pl.playlist_id
                WHERE p.status = 'active' AND pl.status = 'new'
                ORDER BY pl.score DESC, pl.added_at DESC, pl.id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", Math.max(1, limit)),
            (rs, rowNum) -> new DailyCandidate(MEMBER_MAPPER.mapRow(rs, rowNum), rs.getString("playlist_name"))
        );
    }

    public Optional<PlaylistPerformance> performance(long playlistId) {
        Optional<Playlist> playlist = findById(playlistId);
        if (playlist.isEmpty()) {
            return Optional.empty();
        }
        Playlist found = playlist.get();
        Map<String, EngagementStats> engagement = engagementByAction(playlistId);
        PlaylistPerformance performance = jdbc.queryForObject(
            """
                SELECT COUNT(*) AS total,
                       COALESCE(AVG(score), 0) AS avg_score,
                       COUNT(CASE WHEN priority = 'HOT' THEN 1 END) AS hot,
                       COUNT(CASE WHEN priority = 'WARM' THEN 1 END) AS warm,
                       COUNT(CASE WHEN status = 'contacted' THEN 1 END) AS contacted
                FROM playlist_leads
                WHERE playlist_id = :playlistId
                """,
            new MapSqlParameterSource("playlistId", playlistId),
            (rs, rowNum) -> {
                long total = rs.getLong("total");
                long contacted = rs.getLong("contacted");
                return new PlaylistPerformance(
                    playlistId,
                    found.name(),
                    found.description(),
                    found.createdAt(),
                    found.lastRefreshedAt(),
                    total,
                    round2(rs.getDouble("avg_score")),
                    rs.getLong("hot"),
                    rs.getLong("warm"),
                    contacted,
                    total == 0 ? 0.0 : round2(contacted * 100.0 / total),
                    engagement
                );
            }
        );
        return Optional.ofNullable(performance);
    }

    public LeadEngagement insertEngagement(LeadEngagement engagement) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO lead_engagement (playlist_id, lead_id, user_id, action_type, outcome, notes, action_at)
                VALUES (:playlistId, :leadId, :userId, :actionType, :outcome, :notes, :actionAt)
                """,
            new MapSqlParameterSource()
                .addValue("playlistId", engagement.playlistId())
                .addValue("leadId", engagement.leadId())
                .addValue("userId", engagement.userId())
                .addValue("actionType", engagement.actionType())
                .addValue("outcome", engagement.outcome())
                .addValue("notes", engagement.notes())
                .addValue("actionAt", toTimestamp(engagement.actionAt())),
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return new LeadEngagement(
            key == null ? null : key.longValue(),
            engagement.playlistId(),
            engagement.leadId(),
            engagement.userId(),
            engagement.actionType(),
            engagement.outcome(),
            engagement.notes(),
            engagement.actionAt()
        );
    }

    private Map<String, EngagementStats> engagementByAction(long playlistId) {
        List<Map.Entry<String, EngagementStats>> rows = jdbc.query(
            """
                SELECT action_type,
                       COUNT(*) AS total,
                       COUNT(CASE WHEN outcome = :positive THEN 1 END) AS positive
                FROM lead_engagement
                WHERE playlist_id = :playlistId
                GROUP BY action_type
                ORDER BY action_type
                """,
            new MapSqlParameterSource()
                .addValue("playlistId", playlistId)
                .addValue("positive", LeadEngagement.POSITIVE_OUTCOME),
            (rs, rowNum) -> Map.entry(
                rs.getString("action_type"),
                new EngagementStats(rs.getLong("total"), rs.getLong("positive"))
            )
        );
        Map<String, EngagementStats> byAction = new LinkedHashMap<>();
        for (Map.Entry<String, EngagementStats> row : rows) {
            byAction.put(row.getKey(), row.getValue());
        }
        return byAction;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static PriorityTier parsePriority(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        for (PriorityTier tier : PriorityTier.values()) {
            if (tier.name().equalsIgnoreCase(raw.trim())) {
                return tier;
            }
        }
        return null;
    }
}
