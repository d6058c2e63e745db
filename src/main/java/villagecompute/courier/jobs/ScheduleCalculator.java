package villagecompute.courier.jobs;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import villagecompute.courier.data.models.ScheduledJob;
import villagecompute.courier.exceptions.ValidationException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pure schedule arithmetic for interval and cron jobs.
 *
 * <p>
 * Nothing here touches the database or the clock: callers pass {@code now}, the last run and the anchor (the instant
 * the schedule was last set). Cron expressions are parsed with cron-utils in the configured dialect and evaluated in the
 * job's timezone, UTC when none is given.
 */
public final class ScheduleCalculator {

    private static final Map<CronType, CronParser> PARSERS = new ConcurrentHashMap<>();

    private ScheduleCalculator() {
        // Utility class, no instantiation
    }

    /**
     * A job schedule detached from its entity.
     *
     * @param kind
     *            INTERVAL or CRON
     * @param intervalSeconds
     *            period of INTERVAL schedules
     * @param cronExpression
     *            expression of CRON schedules
     * @param timezone
     *            zone id of CRON schedules (null means UTC)
     */
    public record Schedule(ScheduledJob.ScheduleKind kind, Integer intervalSeconds, String cronExpression,
            String timezone) {

        public static Schedule interval(int seconds) {
            return new Schedule(ScheduledJob.ScheduleKind.INTERVAL, seconds, null, null);
        }

        public static Schedule cron(String expression, String timezone) {
            return new Schedule(ScheduledJob.ScheduleKind.CRON, null, expression, timezone);
        }

        public static Schedule of(ScheduledJob job) {
            return new Schedule(job.scheduleKind, job.intervalSeconds, job.cronExpression, job.timezone);
        }
    }

    /**
     * Rejects schedules that could never be evaluated at tick time.
     *
     * @throws ValidationException
     *             for a missing kind, a non-positive interval, a malformed cron expression or an unknown timezone
     */
    public static void validate(Schedule schedule, CronType cronType) {
        if (schedule == null || schedule.kind() == null) {
            throw new ValidationException("Schedule kind is required (interval or cron)");
        }
        switch (schedule.kind()) {
            case INTERVAL -> {
                if (schedule.intervalSeconds() == null || schedule.intervalSeconds() <= 0) {
                    throw new ValidationException("Interval schedules require interval_seconds > 0");
                }
            }
            case CRON -> {
                parseCron(schedule.cronExpression(), cronType);
                zoneOf(schedule.timezone());
            }
        }
    }

    /**
     * Next run time strictly after {@code reference}.
     *
     * @return the next run, or null when a cron expression has no further occurrence
     */
    public static Instant nextRunAfter(Schedule schedule, CronType cronType, Instant reference) {
        if (schedule.kind() == ScheduledJob.ScheduleKind.INTERVAL) {
            return reference.plusSeconds(schedule.intervalSeconds());
        }
        ExecutionTime executionTime = ExecutionTime.forCron(parseCron(schedule.cronExpression(), cronType));
        ZonedDateTime from = reference.atZone(zoneOf(schedule.timezone()));
        return executionTime.nextExecution(from).map(ZonedDateTime::toInstant).orElse(null);
    }

    /**
     * First run time of a schedule set (or reset) at {@code now}: immediately for interval jobs, at the next
     * occurrence for cron jobs.
     */
    public static Instant firstRun(Schedule schedule, CronType cronType, Instant now) {
        if (schedule.kind() == ScheduledJob.ScheduleKind.INTERVAL) {
            return now;
        }
        return nextRunAfter(schedule, cronType, now);
    }

    /**
     * Whether a job is due, judged from its last run alone.
     *
     * <p>
     * The scheduler does not call this: it reads the precomputed {@code ScheduledJob.nextRunAt}, which
     * {@link #firstRun} and {@link #nextRunAfter} maintain and which stays authoritative after a schedule edit. This is
     * the reference rule those stored values follow.
     *
     * <p>
     * Interval jobs with no prior run are due at once; otherwise when {@code now - lastRunAt >= interval}. Cron jobs are
     * due when the next occurrence after {@code lastRunAt} (or after {@code anchor} if they never ran) is not after
     * {@code now}.
     *
     * @param lastRunAt
     *            last regular run, null if never run
     * @param anchor
     *            when the schedule was set, used by cron jobs that never ran
     */
    static boolean isDue(Schedule schedule, CronType cronType, Instant lastRunAt, Instant anchor, Instant now) {
        if (schedule.kind() == ScheduledJob.ScheduleKind.INTERVAL) {
            return lastRunAt == null || !now.isBefore(lastRunAt.plusSeconds(schedule.intervalSeconds()));
        }
        Instant reference = lastRunAt != null ? lastRunAt : anchor;
        Instant next = nextRunAfter(schedule, cronType, reference);
        return next != null && !next.isAfter(now);
    }

    static Cron parseCron(String expression, CronType cronType) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("Cron schedules require an expression");
        }
        CronParser parser = PARSERS.computeIfAbsent(cronType,
                type -> new CronParser(CronDefinitionBuilder.instanceDefinitionFor(type)));
        try {
            return parser.parse(expression.trim()).validate();
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    static ZoneId zoneOf(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new ValidationException("Unknown timezone: " + timezone, e);
        }
    }
}
