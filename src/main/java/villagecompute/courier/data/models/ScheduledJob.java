package villagecompute.courier.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Panache entity for a named, schedulable unit of recurring work.
 *
 * <p>
 * The row carries its own scheduling state ({@code last_run_at}, {@code next_run_at}, {@code retry_at}) so that any
 * process ticking the scheduler can decide due-ness from the database alone. Every scheduler-side state change is a
 * conditional update on {@code version}, which is how two ticking processes avoid firing the same slot twice.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (BIGSERIAL, PK)</li>
 * <li>{@code name} (TEXT, UNIQUE) - Human-readable identifier</li>
 * <li>{@code template_type} (TEXT) - Key of the {@link villagecompute.courier.jobs.JobTemplate} to run</li>
 * <li>{@code parameters} (JSONB) - Template parameters, validated by the template</li>
 * <li>{@code schedule_kind} (TEXT) - INTERVAL or CRON</li>
 * <li>{@code interval_seconds} (INT) - Period of INTERVAL jobs</li>
 * <li>{@code cron_expression} / {@code timezone} - Expression and zone of CRON jobs</li>
 * <li>{@code timeout_seconds}, {@code max_retries}, {@code retry_delay_seconds} - Execution policy</li>
 * <li>{@code notify_on_success} / {@code notify_on_failure} (JSONB) - Trigger names enqueued after a run</li>
 * <li>{@code last_run_at} / {@code next_run_at} - Regular schedule bookkeeping</li>
 * <li>{@code retry_at} / {@code retry_attempt} - Pending retry of the last failed run, if any</li>
 * <li>{@code deleted_at} - Soft-delete marker; deleted jobs keep their execution history</li>
 * <li>{@code version} (BIGINT) - Incremented by every conditional scheduler update</li>
 * </ul>
 */
@Entity
@Table(
        name = "scheduled_jobs")
@NamedQuery(
        name = ScheduledJob.QUERY_FIND_DUE,
        query = "FROM ScheduledJob WHERE enabled = true AND deletedAt IS NULL "
                + "AND (nextRunAt <= :now OR retryAt <= :now) ORDER BY nextRunAt ASC")
@NamedQuery(
        name = ScheduledJob.QUERY_FIND_BY_NAME,
        query = "FROM ScheduledJob WHERE name = :name AND deletedAt IS NULL")
public class ScheduledJob extends PanacheEntityBase {

    public static final String QUERY_FIND_DUE = "ScheduledJob.findDue";
    public static final String QUERY_FIND_BY_NAME = "ScheduledJob.findByName";

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "name",
            nullable = false,
            unique = true)
    public String name;

    @Column(
            name = "description")
    public String description;

    @Column(
            name = "template_type",
            nullable = false)
    public String templateType;

    @Column(
            name = "parameters")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> parameters;

    @Column(
            name = "schedule_kind",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public ScheduleKind scheduleKind;

    @Column(
            name = "interval_seconds")
    public Integer intervalSeconds;

    @Column(
            name = "cron_expression")
    public String cronExpression;

    @Column(
            name = "timezone")
    public String timezone;

    @Column(
            name = "enabled",
            nullable = false)
    public boolean enabled;

    @Column(
            name = "timeout_seconds",
            nullable = false)
    public int timeoutSeconds;

    @Column(
            name = "max_retries",
            nullable = false)
    public int maxRetries;

    @Column(
            name = "retry_delay_seconds",
            nullable = false)
    public int retryDelaySeconds;

    @Column(
            name = "notify_on_success")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<String> notifyOnSuccess = new ArrayList<>();

    @Column(
            name = "notify_on_failure")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<String> notifyOnFailure = new ArrayList<>();

    @Column(
            name = "created_by")
    public String createdBy;

    @Column(
            name = "last_run_at")
    public Instant lastRunAt;

    @Column(
            name = "next_run_at")
    public Instant nextRunAt;

    @Column(
            name = "last_status")
    @Enumerated(EnumType.STRING)
    public JobExecution.Status lastStatus;

    @Column(
            name = "retry_at")
    public Instant retryAt;

    @Column(
            name = "retry_attempt")
    public Integer retryAttempt;

    @Column(
            name = "deleted_at")
    public Instant deletedAt;

    @Column(
            name = "version",
            nullable = false)
    public long version;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * How the next run time of a job is derived.
     */
    public enum ScheduleKind {
        /**
         * Fixed period in seconds after the previous run.
         */
        INTERVAL,

        /**
         * Next occurrence of a cron expression in the job's timezone.
         */
        CRON
    }

    /**
     * Finds enabled, non-deleted jobs whose regular run or pending retry is due.
     *
     * @param now
     *            reference time
     * @return due jobs, earliest next run first
     */
    public static List<ScheduledJob> findDue(Instant now) {
        return find("#" + QUERY_FIND_DUE, Parameters.with("now", now)).list();
    }

    public static ScheduledJob findByName(String name) {
        if (name == null) {
            return null;
        }
        return find("#" + QUERY_FIND_BY_NAME, Parameters.with("name", name)).firstResult();
    }

    /**
     * Lists non-deleted jobs ordered by name.
     *
     * @param includeDisabled
     *            whether disabled jobs are included
     */
    public static List<ScheduledJob> findActive(boolean includeDisabled) {
        if (includeDisabled) {
            return list("deletedAt IS NULL ORDER BY name");
        }
        return list("deletedAt IS NULL AND enabled = true ORDER BY name");
    }

    /**
     * Claims the regular slot of a job: records the run and advances {@code next_run_at}, but only if nobody else
     * changed the row since it was read. A pending retry is left in place.
     *
     * @return true if this caller owns the run
     */
    public static boolean claimScheduledRun(Long id, long expectedVersion, Instant runAt, Instant nextRunAt) {
        int updated = update(
                "lastRunAt = ?1, nextRunAt = ?2, version = version + 1, updatedAt = ?1 WHERE id = ?3 AND version = ?4",
                runAt, nextRunAt, id, expectedVersion);
        return updated == 1;
    }

    /**
     * Claims a pending retry of a job. {@code nextRunAt} is the regular slot after the retry; it equals the stored
     * value unless that slot was held back while the retry waited.
     *
     * @return true if this caller owns the retry
     */
    public static boolean claimRetryRun(Long id, long expectedVersion, Instant now, Instant nextRunAt) {
        int updated = update(
                "retryAt = null, nextRunAt = ?2, version = version + 1, updatedAt = ?1 WHERE id = ?3 "
                        + "AND version = ?4 AND retryAt IS NOT NULL",
                now, nextRunAt, id, expectedVersion);
        return updated == 1;
    }

    /**
     * Records that a follow-up attempt is due at {@code retryAt}.
     */
    public static void scheduleRetry(Long id, Instant retryAt, int attempt) {
        update("retryAt = ?1, retryAttempt = ?2, version = version + 1, updatedAt = ?3 WHERE id = ?4", retryAt,
                attempt, Instant.now(), id);
    }

    /**
     * Stores the status of the latest finished execution.
     */
    public static void recordLastStatus(Long id, JobExecution.Status status) {
        update("lastStatus = ?1, updatedAt = ?2 WHERE id = ?3", status, Instant.now(), id);
    }
}
