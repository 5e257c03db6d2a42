package com.prospect.leadengine.qualify.persistence;

import com.prospect.leadengine.qualify.jobchange.AlertStatus;
import com.prospect.leadengine.qualify.jobchange.ChangeType;
import com.prospect.leadengine.qualify.jobchange.ContactStatus;
import com.prospect.leadengine.qualify.jobchange.JobChangeEvent;
import com.prospect.leadengine.qualify.jobchange.JobChangeView;
import com.prospect.leadengine.qualify.jobchange.TrackedContact;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.prospect.leadengine.qualify.persistence.JsonColumns.toInstant;
import static com.prospect.leadengine.qualify.persistence.JsonColumns.toTimestamp;

/**
 * Tracked contacts and the job-change events detected for them.
 */
@Repository
public class TrackedContactRepository {
    private static final RowMapper<TrackedContact> CONTACT_MAPPER = (rs, rowNum) -> new TrackedContact(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("profile_url"),
        rs.getString("email"),
        rs.getString("phone"),
        rs.getString("current_company"),
        rs.getString("current_title"),
        rs.getString("original_company"),
        rs.getString("original_title"),
        rs.getDouble("original_lead_score"),
        toInstant(rs.getTimestamp("added_at")),
        toInstant(rs.getTimestamp("last_checked_at")),
        ContactStatus.fromValue(rs.getString("status"))
    );
    private static final RowMapper<JobChangeEvent> EVENT_MAPPER = (rs, rowNum) -> new JobChangeEvent(
        rs.getLong("id"),
        rs.getLong("contact_id"),
        rs.getString("previous_company"),
        rs.getString("new_company"),
        rs.getString("previous_title"),
        rs.getString("new_title"),
        ChangeType.fromValue(rs.getString("change_type")),
        toInstant(rs.getTimestamp("detected_at")),
        rs.getDouble("opportunity_score"),
        AlertStatus.fromValue(rs.getString("alert_status"))
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;

    public TrackedContactRepository(NamedParameterJdbcTemplate jdbc, TransactionTemplate transactionTemplate) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
    }

    public boolean existsByProfileUrl(String profileUrl) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM tracked_contacts WHERE profile_url = :profileUrl",
            new MapSqlParameterSource("profileUrl", profileUrl),
            Long.class
        );
        return count != null && count > 0;
    }

    /**
     * Starts tracking a contact. Returns false when the profile is already tracked.
     */
    public boolean insertIfAbsent(TrackedContact contact) {
        if (existsByProfileUrl(contact.profileUrl())) {
            return false;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO tracked_contacts (
                        name, profile_url, email, phone, current_company, current_title,
                        original_company, original_title, original_lead_score, added_at, status
                    )
                    VALUES (
                        :name, :profileUrl, :email, :phone, :currentCompany, :currentTitle,
                        :originalCompany, :originalTitle, :originalLeadScore, :addedAt, 'active'
                    )
                    """,
                new MapSqlParameterSource()
                    .addValue("name", contact.name())
                    .addValue("profileUrl", contact.profileUrl())
                    .addValue("email", contact.email())
                    .addValue("phone", contact.phone())
                    .addValue("currentCompany", contact.currentCompany())
                    .addValue("currentTitle", contact.currentRole())
                    .addValue("originalCompany", contact.originalCompany())
                    .addValue("originalTitle", contact.originalRole())
                    .addValue("originalLeadScore", contact.originalLeadScore())
                    .addValue("addedAt", toTimestamp(contact.addedAt() == null ? Instant.now() : contact.addedAt()))
            );
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    public Optional<TrackedContact> findByProfileUrl(String profileUrl) {
        List<TrackedContact> rows = jdbc.query(
            "SELECT * FROM tracked_contacts WHERE profile_url = :profileUrl",
            new MapSqlParameterSource("profileUrl", profileUrl),
            CONTACT_MAPPER
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Active contacts due for a check: never-checked first, then the oldest check.
     */
    public List<TrackedContact> findDueForCheck(int limit) {
        return jdbc.query(
            """
                SELECT *
                FROM tracked_contacts
                WHERE status = 'active'
                ORDER BY CASE WHEN last_checked_at IS NULL THEN 0 ELSE 1 END, last_checked_at ASC, id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", Math.max(1, limit)),
            CONTACT_MAPPER
        );
    }

    public void recordCheck(long contactId, String currentCompany, String currentRole, Instant checkedAt) {
        jdbc.update(
            """
                UPDATE tracked_contacts
                SET current_company = :currentCompany,
                    current_title = :currentTitle,
                    last_checked_at = :checkedAt
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", contactId)
                .addValue("currentCompany", currentCompany)
                .addValue("currentTitle", currentRole)
                .addValue("checkedAt", toTimestamp(checkedAt))
        );
    }

    /**
     * Stores a detected change and moves the contact's current values in one transaction, so a failed update
     * never leaves an event behind that the next poll would detect again.
     */
    public JobChangeEvent recordChange(JobChangeEvent event, String currentCompany, String currentRole, Instant checkedAt) {
        return transactionTemplate.execute(status -> {
            JobChangeEvent stored = insertEvent(event);
            recordCheck(event.contactId(), currentCompany, currentRole, checkedAt);
            return stored;
        });
    }

    public JobChangeEvent insertEvent(JobChangeEvent event) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO job_change_events (
                    contact_id, previous_company, new_company, previous_title, new_title,
                    change_type, detected_at, opportunity_score, alert_status
                )
                VALUES (
                    :contactId, :previousCompany, :newCompany, :previousTitle, :newTitle,
                    :changeType, :detectedAt, :opportunityScore, :alertStatus
                )
                """,
            new MapSqlParameterSource()
                .addValue("contactId", event.contactId())
                .addValue("previousCompany", event.previousCompany())
                .addValue("newCompany", event.newCompany())
                .addValue("previousTitle", event.previousRole())
                .addValue("newTitle", event.newRole())
                .addValue("changeType", event.changeType().value())
                .addValue("detectedAt", toTimestamp(event.detectedAt()))
                .addValue("opportunityScore", event.opportunityScore())
                .addValue("alertStatus", (event.alertStatus() == null ? AlertStatus.NEW : event.alertStatus()).value()),
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return new JobChangeEvent(
            key == null ? null : key.longValue(),
            event.contactId(),
            event.previousCompany(),
            event.newCompany(),
            event.previousRole(),
            event.newRole(),
            event.changeType(),
            event.detectedAt(),
            event.opportunityScore(),
            event.alertStatus() == null ? AlertStatus.NEW : event.alertStatus()
        );
    }

    public List<JobChangeEvent> findEventsForContact(long contactId) {
        return jdbc.query(
            "SELECT * FROM job_change_events WHERE contact_id = :contactId ORDER BY detected_at DESC, id DESC",
            new MapSqlParameterSource("contactId", contactId),
            EVENT_MAPPER
        );
    }

    /**
     * Events detected at or after {@code since} with at least {@code minScore}, best opportunity first, newest
     * first among equal scores.
     */
    public List<JobChangeView> findRecentChanges(Instant since, double minScore) {
        return jdbc.query(
            """
                SELECT e.*, c.name AS contact_name, c.profile_url, c.original_company, c.original_lead_score
                FROM job_change_events e
                JOIN tracked_contacts c ON c.id = e.contact_id
                WHERE e.detected_at >= :since
                  AND e.opportunity_score >= :minScore
                ORDER BY e.opportunity_score DESC, e.detected_at DESC, e.id DESC
                """,
            new MapSqlParameterSource()
                .addValue("since", toTimestamp(since))
                .addValue("minScore", minScore),
            (rs, rowNum) -> new JobChangeView(
                EVENT_MAPPER.mapRow(rs, rowNum),
                rs.getString("contact_name"),
                rs.getString("profile_url"),
                rs.getString("original_company"),
                rs.getDouble("original_lead_score")
            )
        );
    }

    public boolean updateAlertStatus(long eventId, AlertStatus status) {
        int updated = jdbc.update(
            "UPDATE job_change_events SET alert_status = :status WHERE id = :id",
            new MapSqlParameterSource()
                .addValue("id", eventId)
                .addValue("status", status.value())
        );
        return updated > 0;
    }

    /**
     * Marks active contacts inactive when their last check, or their addition if never checked, predates the cutoff.
     */
    public int markInactiveNotCheckedSince(Instant cutoff) {
        return jdbc.update(
            """
                UPDATE tracked_contacts
                SET status = 'inactive'
                WHERE status = 'active'
                  AND COALESCE(last_checked_at, added_at) < :cutoff
                """,
            new MapSqlParameterSource("cutoff", toTimestamp(cutoff))
        );
    }

    public int deleteEventsDetectedBefore(Instant cutoff) {
        return jdbc.update(
            "DELETE FROM job_change_events WHERE detected_at < :cutoff",
            new MapSqlParameterSource("cutoff", toTimestamp(cutoff))
        );
    }

    public long countByStatus(ContactStatus status) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM tracked_contacts WHERE status = :status",
            new MapSqlParameterSource("status", status.value()),
            Long.class
        );
        return count == null ? 0L : count;
    }
}
