package villagecompute.courier.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Page;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One timed run of a {@link ScheduledJob}.
 *
 * <p>
 * A row is inserted as {@code RUNNING} before the task body starts and updated exactly once to a final status. Rows
 * still {@code RUNNING} long after their timeout belong to a process that died mid-run; the scheduler tick marks them
 * {@code TIMEOUT}.
 */
@Entity
@Table(
        name = "job_executions",
        indexes = {@Index(
                name = "idx_job_executions_job_started",
                columnList = "job_id, started_at"),
                @Index(
                        name = "idx_job_executions_status",
                        columnList = "status")})
public class JobExecution extends PanacheEntityBase {

    /** {@code triggeredBy} value for runs fired by the scheduler tick. */
    public static final String TRIGGERED_BY_SCHEDULER = "scheduler";

    /** Prefix of {@code triggeredBy} for operator-initiated runs, followed by the actor. */
    public static final String TRIGGERED_BY_MANUAL_PREFIX = "manual:";

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "job_id",
            nullable = false)
    public Long jobId;

    @Column(
            name = "job_name",
            nullable = false)
    public String jobName;

    @Column(
            name = "template_type",
            nullable = false)
    public String templateType;

    @Column(
            name = "triggered_by",
            nullable = false)
    public String triggeredBy;

    @Column(
            name = "attempt",
            nullable = false)
    public int attempt;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public Status status;

    @Column(
            name = "timeout_seconds",
            nullable = false)
    public int timeoutSeconds;

    @Column(
            name = "started_at",
            nullable = false)
    public Instant startedAt;

    @Column(
            name = "finished_at")
    public Instant finishedAt;

    @Column(
            name = "duration_seconds")
    public Double durationSeconds;

    @Column(
            name = "message")
    public String message;

    @Column(
            name = "result")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> result;

    @Column(
            name = "errors")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<String> errors = new ArrayList<>();

    @Column(
            name = "execution_host")
    public String executionHost;

    /**
     * Execution statuses. Every status except {@code RUNNING} is final.
     */
    public enum Status {
        RUNNING, SUCCESS, FAILED, TIMEOUT;

        /**
         * Whether a run ending in this status is eligible for the job's retry policy.
         */
        public boolean isRetryable() {
            return this == FAILED || this == TIMEOUT;
        }
    }

    /**
     * Pages through a job's executions, newest first.
     *
     * @param jobId
     *            owning job
     * @param status
     *            optional status filter (null for all)
     * @param page
     *            zero-based page index
     * @param size
     *            page size
     */
    public static List<JobExecution> findByJob(Long jobId, Status status, int page, int size) {
        if (status == null) {
            return find("jobId = ?1 ORDER BY startedAt DESC, id DESC", jobId).page(Page.of(page, size)).list();
        }
        return find("jobId = ?1 AND status = ?2 ORDER BY startedAt DESC, id DESC", jobId, status)
                .page(Page.of(page, size)).list();
    }

    public static long countByJob(Long jobId, Status status) {
        if (status == null) {
            return count("jobId", jobId);
        }
        return count("jobId = ?1 AND status = ?2", jobId, status);
    }

    public static boolean hasRunning(Long jobId) {
        return count("jobId = ?1 AND status = ?2", jobId, Status.RUNNING) > 0;
    }

    public static List<JobExecution> findRunning() {
        return list("status", Status.RUNNING);
    }

    /**
     * Moves a RUNNING execution to TIMEOUT if it is still RUNNING.
     *
     * @return true if the row was updated
     */
    public static boolean expire(Long id, Instant now, String error) {
        JobExecution execution = findById(id);
        if (execution == null || execution.status != Status.RUNNING) {
            return false;
        }
        execution.status = Status.TIMEOUT;
        execution.finishedAt = now;
        execution.durationSeconds = (now.toEpochMilli() - execution.startedAt.toEpochMilli()) / 1000.0;
        execution.errors = new ArrayList<>(List.of(error));
        return true;
    }

    /**
     * Deletes finished executions that started before the cutoff.
     */
    public static long deleteFinishedBefore(Instant cutoff) {
        return delete("status <> ?1 AND startedAt < ?2", Status.RUNNING, cutoff);
    }
}
