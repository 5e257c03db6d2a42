package com.prospect.leadengine.qualify.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.prospect.leadengine.qualify.model.CompanySize;
import com.prospect.leadengine.qualify.model.Sector;
import com.prospect.leadengine.qualify.playlist.UserPreferences;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.prospect.leadengine.qualify.persistence.JsonColumns.toTimestamp;

@Repository
public class UserPreferencesRepository {
    private static final TypeReference<List<Sector>> SECTORS = new TypeReference<>() {};
    private static final TypeReference<List<CompanySize>> SIZES = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;

    public UserPreferencesRepository(NamedParameterJdbcTemplate jdbc, JsonColumns json) {
        this.jdbc = jdbc;
        this.json = json;
    }

    public Optional<UserPreferences> find(String userId) {
        List<UserPreferences> rows = jdbc.query(
            """
                SELECT user_id, preferred_sectors_json, preferred_company_sizes_json, min_score, max_leads_per_day
                FROM user_preferences
                WHERE user_id = :userId
                """,
            new MapSqlParameterSource("userId", userId),
            (rs, rowNum) -> new UserPreferences(
                rs.getString("user_id"),
                json.read(rs.getString("preferred_sectors_json"), SECTORS, List.of()),
                json.read(rs.getString("preferred_company_sizes_json"), SIZES, List.of()),
                rs.getDouble("min_score"),
                rs.getInt("max_leads_per_day")
            )
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public void save(UserPreferences preferences) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("userId", preferences.userId())
            .addValue("sectors", json.write(preferences.preferredSectors()))
            .addValue("sizes", json.write(preferences.preferredCompanySizes()))
            .addValue("minScore", preferences.minScore())
            .addValue("maxLeadsPerDay", preferences.maxLeadsPerDay())
            .addValue("updatedAt", toTimestamp(Instant.now()));
        int updated = jdbc.update(
            """
                UPDATE user_preferences
                SET preferred_sectors_json = :sectors,
                    preferred_company_sizes_json = :sizes,
                    min_score = :minScore,
                    max_leads_per_day = :maxLeadsPerDay,
                    updated_at = :updatedAt
                WHERE user_id = :userId
                """,
            params
        );
        if (updated == 0) {
            jdbc.update(
                """
                    INSERT INTO user_preferences (
                        user_id, preferred_sectors_json, preferred_company_sizes_json,
                        min_score, max_leads_per_day, updated_at
                    )
                    VALUES (:userId, :sectors, :sizes, :minScore, :maxLeadsPerDay, :updatedAt)
                    """,
                params
            );
        }
    }
}
