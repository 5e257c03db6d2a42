package com.prospect.leadengine.qualify.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.prospect.leadengine.qualify.model.CloudMaturity;
import com.prospect.leadengine.qualify.model.CompanySize;
import com.prospect.leadengine.qualify.model.DecisionMaker;
import com.prospect.leadengine.qualify.model.Lead;
import com.prospect.leadengine.qualify.model.Sector;
import com.prospect.leadengine.qualify.model.TechnographicSummary;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.prospect.leadengine.qualify.persistence.JsonColumns.toInstant;
import static com.prospect.leadengine.qualify.persistence.JsonColumns.toTimestamp;

@Repository
public class LeadRepository {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<List<DecisionMaker>> DECISION_MAKERS = new TypeReference<>() {};
    private static final TypeReference<Map<String, Double>> SCORE_DETAILS = new TypeReference<>() {};
    private static final String SELECT_COLUMNS = """
        SELECT id, company_name, tax_id, website, email, phone, address, city, region,
               sector, company_size, employee_count, annual_revenue, profile_url,
               decision_makers_json, technologies_json, cloud_maturity, uses_target_cloud,
               competitor_cloud, pain_points_json, technographics_json, score, score_details_json, notes, source,
               extracted_at, updated_at
        FROM leads
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;
    private final RowMapper<Lead> leadRowMapper;

    public LeadRepository(NamedParameterJdbcTemplate jdbc, JsonColumns json) {
        this.jdbc = jdbc;
        this.json = json;
        this.leadRowMapper = (rs, rowNum) -> Lead.builder(rs.getString("company_name"))
            .id(rs.getLong("id"))
            .taxId(rs.getString("tax_id"))
            .website(rs.getString("website"))
            .email(rs.getString("email"))
            .phone(rs.getString("phone"))
            .address(rs.getString("address"))
            .city(rs.getString("city"))
            .region(rs.getString("region"))
            .sector(Sector.fromValue(rs.getString("sector")))
            .companySize(CompanySize.fromValue(rs.getString("company_size")))
            .employeeCount(rs.getObject("employee_count", Integer.class))
            .annualRevenue(rs.getObject("annual_revenue", Double.class))
            .profileUrl(rs.getString("profile_url"))
            .decisionMakers(json.read(rs.getString("decision_makers_json"), DECISION_MAKERS, List.of()))
            .technologies(json.read(rs.getString("technologies_json"), STRING_LIST, List.of()))
            .cloudMaturity(CloudMaturity.fromValue(rs.getString("cloud_maturity")))
            .usesTargetCloud(rs.getBoolean("uses_target_cloud"))
            .competitorCloud(rs.getString("competitor_cloud"))
            .painPoints(json.read(rs.getString("pain_points_json"), STRING_LIST, List.of()))
            .technographics(json.read(rs.getString("technographics_json"), TechnographicSummary.class, null))
            .score(rs.getDouble("score"))
            .scoreDetails(json.read(rs.getString("score_details_json"), SCORE_DETAILS, Map.of()))
            .notes(rs.getString("notes"))
            .source(rs.getString("source"))
            .extractedAt(toInstant(rs.getTimestamp("extracted_at")))
            .updatedAt(toInstant(rs.getTimestamp("updated_at")))
            .build();
    }

    /**
     * Inserts a lead without an id, updates one that has an id. Returns the lead carrying its id.
     */
    public Lead save(Lead lead) {
        if (lead.id() != null && update(lead)) {
            return lead;
        }
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO leads (
                    company_name, tax_id, website, email, phone, address, city, region,
                    sector, company_size, employee_count, annual_revenue, profile_url,
                    decision_makers_json, technologies_json, cloud_maturity, uses_target_cloud,
                    competitor_cloud, pain_points_json, technographics_json, score, score_details_json, notes, source,
                    extracted_at, updated_at
                )
                VALUES (
                    :companyName, :taxId, :website, :email, :phone, :address, :city, :region,
                    :sector, :companySize, :employeeCount, :annualRevenue, :profileUrl,
                    :decisionMakers, :technologies, :cloudMaturity, :usesTargetCloud,
                    :competitorCloud, :painPoints, :technographics, :score, :scoreDetails, :notes, :source,
                    :extractedAt, :updatedAt
                )
                """,
            params(lead),
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return lead.withId(key == null ? null : key.longValue());
    }

    public List<Lead> saveAll(Collection<Lead> leads) {
        return leads.stream().map(this::save).toList();
    }

    private boolean update(Lead lead) {
        int updated = jdbc.update(
            """
                UPDATE leads
                SET company_name = :companyName,
                    tax_id = :taxId,
                    website = :website,
                    email = :email,
                    phone = :phone,
                    address = :address,
                    city = :city,
                    region = :region,
                    sector = :sector,
                    company_size = :companySize,
                    employee_count = :employeeCount,
                    annual_revenue = :annualRevenue,
                    profile_url = :profileUrl,
                    decision_makers_json = :decisionMakers,
                    technologies_json = :technologies,
                    cloud_maturity = :cloudMaturity,
                    uses_target_cloud = :usesTargetCloud,
                    competitor_cloud = :competitorCloud,
                    pain_points_json = :painPoints,
                    technographics_json = :technographics,
                    score = :score,
                    score_details_json = :scoreDetails,
                    notes = :notes,
                    source = :source,
                    extracted_at = :extractedAt,
                    updated_at = :updatedAt
                WHERE id = :id
                """,
            params(lead).addValue("id", lead.id())
        );
        return updated > 0;
    }

    public Optional<Lead> findById(long id) {
        List<Lead> rows = jdbc.query(
            SELECT_COLUMNS + " WHERE id = :id",
            new MapSqlParameterSource("id", id),
            leadRowMapper
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Leads at or above {@code minScore}, best first, most recently updated first among equal scores.
     */
    public List<Lead> findByMinScore(double minScore, int limit) {
        return jdbc.query(
            SELECT_COLUMNS + """
                 WHERE score >= :minScore
                ORDER BY score DESC, updated_at DESC, id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("minScore", minScore)
                .addValue("limit", Math.max(1, limit)),
            leadRowMapper
        );
    }

    /**
     * The full lead pool, ordered by score descending then id, as consumed by playlist matching.
     */
    public List<Lead> findAll() {
        return jdbc.query(SELECT_COLUMNS + " ORDER BY score DESC, id ASC", new MapSqlParameterSource(), leadRowMapper);
    }

    public List<Lead> findByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return jdbc.query(
            SELECT_COLUMNS + " WHERE id IN (:ids) ORDER BY score DESC, id ASC",
            new MapSqlParameterSource("ids", ids),
            leadRowMapper
        );
    }

    public long count() {
        Long total = jdbc.queryForObject("SELECT COUNT(*) FROM leads", new MapSqlParameterSource(), Long.class);
        return total == null ? 0L : total;
    }

    private MapSqlParameterSource params(Lead lead) {
        Instant now = Instant.now();
        return new MapSqlParameterSource()
            .addValue("companyName", lead.companyName())
            .addValue("taxId", lead.taxId())
            .addValue("website", lead.website())
            .addValue("email", lead.email())
            .addValue("phone", lead.phone())
            .addValue("address", lead.address())
            .addValue("city", lead.city())
            .addValue("region", lead.region())
            .addValue("sector", lead.sector() == null ? null : lead.sector().value())
            .addValue("companySize", lead.companySize() == null ? null : lead.companySize().value())
            .addValue("employeeCount", lead.employeeCount())
            .addValue("annualRevenue", lead.annualRevenue())
            .addValue("profileUrl", lead.profileUrl())
            .addValue("decisionMakers", json.write(lead.decisionMakers()))
            .addValue("technologies", json.write(lead.technologies()))
            .addValue("cloudMaturity", lead.cloudMaturity() == null ? null : lead.cloudMaturity().value())
            .addValue("usesTargetCloud", lead.usesTargetCloud())
            .addValue("competitorCloud", lead.competitorCloud())
            .addValue("painPoints", json.write(lead.painPoints()))
            .addValue("technographics", json.write(lead.technographics()))
            .addValue("score", lead.score())
            .addValue("scoreDetails", json.write(lead.scoreDetails()))
            .addValue("notes", lead.notes())
            .addValue("source", lead.source())
            .addValue("extractedAt", toTimestamp(lead.extractedAt() == null ? now : lead.extractedAt()))
            .addValue("updatedAt", toTimestamp(lead.updatedAt() == null ? now : lead.updatedAt()));
    }
}
