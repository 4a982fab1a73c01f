package com.delta.talentmatch.screening.persistence;

import com.delta.talentmatch.screening.model.CandidateProfile;
import com.delta.talentmatch.screening.model.CandidateStatus;
import com.delta.talentmatch.screening.model.JobRequirement;
import com.delta.talentmatch.screening.model.NewCandidate;
import com.delta.talentmatch.screening.model.ScoreBreakdown;
import com.delta.talentmatch.screening.model.ScoringQueueStats;
import com.delta.talentmatch.screening.model.ScoringState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class ScreeningJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(ScreeningJdbcRepository.class);
    private static final TypeReference<Map<String, String>> MAP_STRING = new TypeReference<>() {};
    private static final TypeReference<List<String>> LIST_STRING = new TypeReference<>() {};
    private static final int CLAIM_BATCH = 5;
    private static final int MAX_ERROR_LENGTH = 500;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public ScreeningJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public long insertJobRequirement(String title, String description, List<String> requiredSkills, Instant createdAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("title", title)
            .addValue("description", description)
            .addValue("requiredSkillsJson", writeJson(requiredSkills == null ? List.of() : requiredSkills))
            .addValue("createdAt", Timestamp.from(createdAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO job_requirements (title, description, required_skills_json, created_at)
                VALUES (:title, :description, :requiredSkillsJson, :createdAt)
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public JobRequirement findJobRequirement(long jobId) {
        List<JobRequirement> rows = jdbc.query(
            """
                SELECT id, title, description, required_skills_json, created_at
                FROM job_requirements
                WHERE id = :jobId
                """,
            new MapSqlParameterSource().addValue("jobId", jobId),
            (rs, rowNum) -> new JobRequirement(
                rs.getLong("id"),
                rs.getString("title"),
                rs.getString("description"),
                readList(rs.getString("required_skills_json")),
                toInstant(rs.getTimestamp("created_at"))
            )
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public Long findCandidateIdByFingerprint(String fingerprint) {
        List<Long> rows = jdbc.query(
            """
                SELECT id
                FROM candidates
                WHERE submission_fingerprint = :fingerprint
                """,
            new MapSqlParameterSource().addValue("fingerprint", fingerprint),
            (rs, rowNum) -> rs.getLong("id")
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public long insertCandidate(NewCandidate candidate) {
        Instant now = candidate.submittedAt();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", candidate.jobId())
            .addValue("name", candidate.name())
            .addValue("email", candidate.email())
            .addValue("phone", candidate.phone())
            .addValue("resumeReference", candidate.resumeReference())
            .addValue("answersJson", writeJson(candidate.answers() == null ? Map.of() : candidate.answers()))
            .addValue("tagsJson", writeJson(List.of()))
            .addValue("status", CandidateStatus.APPLIED.name())
            .addValue("scoringState", ScoringState.UNSCORED.name())
            .addValue("fingerprint", candidate.submissionFingerprint())
            .addValue("submittedAt", Timestamp.from(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO candidates (
                    job_id, name, email, phone, resume_reference, answers_json, tags_json, notes,
                    status, scoring_state, submission_fingerprint, submitted_at, updated_at
                )
                VALUES (
                    :jobId, :name, :email, :phone, :resumeReference, :answersJson, :tagsJson, '',
                    :status, :scoringState, :fingerprint, :submittedAt, :submittedAt
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public CandidateProfile findCandidate(long candidateId) {
        List<CandidateProfile> rows = jdbc.query(
            "SELECT * FROM candidates WHERE id = :id",
            new MapSqlParameterSource().addValue("id", candidateId),
            candidateMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<CandidateProfile> findScoredCandidates(long jobId) {
        return jdbc.query(
            """
                SELECT *
                FROM candidates
                WHERE job_id = :jobId
                  AND breakdown_json IS NOT NULL
                ORDER BY id ASC
                """,
            new MapSqlParameterSource().addValue("jobId", jobId),
            candidateMapper()
        );
    }

    /**
     * Moves an unscored candidate into scoring. Returns false when another worker got there first.
     */
    public boolean claimUnscored(long candidateId, Instant now) {
        return claim(candidateId, now, List.of(ScoringState.UNSCORED.name()));
    }

    /** Claims a candidate for an explicit re-score, whatever its settled state. */
    public boolean claimForRescore(long candidateId, Instant now) {
        return claim(candidateId, now, List.of(ScoringState.UNSCORED.name(), ScoringState.SCORED.name()));
    }

    public Long claimNextUnscored(Instant now, int maxAttempts) {
        List<Long> ids = jdbc.query(
            """
                SELECT id
                FROM candidates
                WHERE scoring_state = 'UNSCORED'
                  AND scoring_attempts < :maxAttempts
                ORDER BY submitted_at ASC, id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("maxAttempts", maxAttempts)
                .addValue("limit", CLAIM_BATCH),
            (rs, rowNum) -> rs.getLong("id")
        );
        for (Long id : ids) {
            if (claimUnscored(id, now)) {
                return id;
            }
        }
        return null;
    }

    /**
     * Stores the whole scoring outcome in one statement so a breakdown is never partially replaced.
     *
     * @return false when the candidate is no longer claimed, e.g. after a stale-claim requeue
     */
    public boolean saveScore(
        long candidateId,
        String resumeText,
        boolean parsingFailed,
        String parseErrorCode,
        ScoreBreakdown breakdown,
        Instant scoredAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", candidateId)
            .addValue("resumeText", resumeText)
            .addValue("parsingFailed", parsingFailed)
            .addValue("parseErrorCode", parseErrorCode)
            .addValue("totalScore", breakdown.totalScore())
            .addValue("grade", breakdown.grade().name())
            .addValue("breakdownJson", writeJson(breakdown))
            .addValue("scoringState", ScoringState.SCORED.name())
            .addValue("scoredAt", Timestamp.from(scoredAt));
        int updated = jdbc.update(
            """
                UPDATE candidates
                SET resume_text = :resumeText,
                    parsing_failed = :parsingFailed,
                    parse_error_code = :parseErrorCode,
                    total_score = :totalScore,
                    grade = :grade,
                    breakdown_json = :breakdownJson,
                    scoring_state = :scoringState,
                    claimed_at = NULL,
                    last_scoring_error = NULL,
                    scored_at = :scoredAt,
                    updated_at = :scoredAt
                WHERE id = :id
                  AND scoring_state = 'SCORING_IN_PROGRESS'
                """,
            params
        );
        return updated == 1;
    }

    /**
     * Returns a claimed candidate to its settled state after a failed attempt: scored candidates keep their
     * previous breakdown, unscored ones go back to the queue.
     */
    public void releaseClaim(long candidateId, String error) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", candidateId)
            .addValue("error", truncate(error))
            .addValue("now", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                UPDATE candidates
                SET scoring_state = CASE WHEN breakdown_json IS NULL THEN 'UNSCORED' ELSE 'SCORED' END,
                    claimed_at = NULL,
                    last_scoring_error = :error,
                    updated_at = :now
                WHERE id = :id
                  AND scoring_state = 'SCORING_IN_PROGRESS'
                """,
            params
        );
    }

    public int requeueStaleClaims(Instant claimedBefore) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("cutoff", Timestamp.from(claimedBefore))
            .addValue("now", Timestamp.from(Instant.now()));
        return jdbc.update(
            """
                UPDATE candidates
                SET scoring_state = CASE WHEN breakdown_json IS NULL THEN 'UNSCORED' ELSE 'SCORED' END,
                    claimed_at = NULL,
                    last_scoring_error = 'stale_claim',
                    updated_at = :now
                WHERE scoring_state = 'SCORING_IN_PROGRESS'
                  AND claimed_at < :cutoff
                """,
            params
        );
    }

    public int updateStatus(long candidateId, CandidateStatus status) {
        return updateColumn(candidateId, "status", status.name());
    }

    public int updateTags(long candidateId, List<String> tags) {
        return updateColumn(candidateId, "tags_json", writeJson(tags == null ? List.of() : tags));
    }

    public int updateNotes(long candidateId, String notes) {
        return updateColumn(candidateId, "notes", notes == null ? "" : notes);
    }

    public ScoringQueueStats fetchQueueStats(int maxAttempts) {
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("maxAttempts", maxAttempts);
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT scoring_state,
                       CASE WHEN scoring_state = 'UNSCORED' AND scoring_attempts >= :maxAttempts THEN 1 ELSE 0 END AS parked,
                       COUNT(*) AS cnt
                FROM candidates
                GROUP BY scoring_state,
                         CASE WHEN scoring_state = 'UNSCORED' AND scoring_attempts >= :maxAttempts THEN 1 ELSE 0 END
                """,
            params,
            rs -> {
                String key = rs.getInt("parked") == 1 ? "PARKED" : rs.getString("scoring_state");
                counts.merge(key, rs.getLong("cnt"), Long::sum);
            }
        );
        return new ScoringQueueStats(
            counts.getOrDefault(ScoringState.UNSCORED.name(), 0L),
            counts.getOrDefault(ScoringState.SCORING_IN_PROGRESS.name(), 0L),
            counts.getOrDefault(ScoringState.SCORED.name(), 0L),
            counts.getOrDefault("PARKED", 0L)
        );
    }

    private boolean claim(long candidateId, Instant now, List<String> fromStates) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", candidateId)
            .addValue("fromStates", fromStates)
            .addValue("now", Timestamp.from(now));
        int updated = jdbc.update(
            """
                UPDATE candidates
                SET scoring_state = 'SCORING_IN_PROGRESS',
                    scoring_attempts = scoring_attempts + 1,
                    claimed_at = :now,
                    updated_at = :now
                WHERE id = :id
                  AND scoring_state IN (:fromStates)
                """,
            params
        );
        return updated == 1;
    }

    private int updateColumn(long candidateId, String column, String value) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", candidateId)
            .addValue("value", value)
            .addValue("now", Timestamp.from(Instant.now()));
        return jdbc.update(
            "UPDATE candidates SET " + column + " = :value, updated_at = :now WHERE id = :id",
            params
        );
    }

    private RowMapper<CandidateProfile> candidateMapper() {
        return (rs, rowNum) -> new CandidateProfile(
            rs.getLong("id"),
            rs.getLong("job_id"),
            rs.getString("name"),
            rs.getString("email"),
            rs.getString("phone"),
            rs.getString("resume_reference"),
            rs.getString("resume_text"),
            rs.getBoolean("parsing_failed"),
            rs.getString("parse_error_code"),
            readMap(rs.getString("answers_json")),
            readList(rs.getString("tags_json")),
            rs.getString("notes"),
            CandidateStatus.fromValue(rs.getString("status")),
            ScoringState.valueOf(rs.getString("scoring_state")),
            readBreakdown(rs.getLong("id"), rs.getString("breakdown_json")),
            toInstant(rs.getTimestamp("submitted_at")),
            toInstant(rs.getTimestamp("scored_at"))
        );
    }

    private ScoreBreakdown readBreakdown(long candidateId, String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, ScoreBreakdown.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable score breakdown for candidate {}", candidateId, e);
            return null;
        }
    }

    private Map<String, String> readMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, String> parsed = objectMapper.readValue(json, MAP_STRING);
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException e) {
            log.warn("Unreadable answers JSON", e);
            return Map.of();
        }
    }

    private List<String> readList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<String> parsed = objectMapper.readValue(json, LIST_STRING);
            return parsed == null ? List.of() : parsed;
        } catch (JsonProcessingException e) {
            log.warn("Unreadable list JSON", e);
            return List.of();
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
