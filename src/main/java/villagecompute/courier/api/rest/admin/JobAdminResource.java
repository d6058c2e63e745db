package villagecompute.courier.api.rest.admin;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import villagecompute.courier.api.types.CreateJobRequestType;
import villagecompute.courier.api.types.JobExecutionPageType;
import villagecompute.courier.api.types.JobExecutionType;
import villagecompute.courier.api.types.JobTemplateType;
import villagecompute.courier.api.types.NotifyOnType;
import villagecompute.courier.api.types.RetryPolicyType;
import villagecompute.courier.api.types.ScheduleType;
import villagecompute.courier.api.types.ScheduledJobType;
import villagecompute.courier.api.types.UpdateJobRequestType;
import villagecompute.courier.data.models.JobExecution;
import villagecompute.courier.data.models.ScheduledJob;
import villagecompute.courier.exceptions.ResourceNotFoundException;
import villagecompute.courier.exceptions.ValidationException;
import villagecompute.courier.jobs.JobTemplateRegistry;
import villagecompute.courier.observability.LoggingConfig;
import villagecompute.courier.services.JobExecutorService;
import villagecompute.courier.services.JobRegistryService;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Admin REST endpoints for scheduled jobs.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /admin/api/jobs} – list jobs</li>
 * <li>{@code POST /admin/api/jobs} – create a job</li>
 * <li>{@code GET|PATCH|DELETE /admin/api/jobs/{id}} – read, partially update, delete</li>
 * <li>{@code POST /admin/api/jobs/{id}/enable|disable} – toggle scheduling</li>
 * <li>{@code POST /admin/api/jobs/{id}/run} – run now and wait for the outcome</li>
 * <li>{@code GET /admin/api/jobs/{id}/executions} – execution history</li>
 * <li>{@code GET /admin/api/jobs/templates} – registered templates</li>
 * </ul>
 *
 * <p>
 * <b>Security:</b> Assumes deployment behind authenticated admin gateway; the {@code actor} query parameter is recorded
 * as given.
 */
@Path("/admin/api/jobs")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class JobAdminResource {

    private static final Logger LOG = Logger.getLogger(JobAdminResource.class);

    @Inject
    JobRegistryService registry;

    @Inject
    JobExecutorService executor;

    @Inject
    JobTemplateRegistry templates;

    @GET
    public Response listJobs(@QueryParam("include_disabled") @DefaultValue("true") boolean includeDisabled) {
        List<ScheduledJobType> jobs = registry.listJobs(includeDisabled).stream().map(JobAdminResource::toType)
                .toList();
        return Response.ok(jobs).build();
    }

    @GET
    @Path("/templates")
    public Response listTemplates() {
        List<JobTemplateType> response = templates.list().stream()
                .map(t -> new JobTemplateType(t.templateType(), t.description(), t.defaultParameters())).toList();
        return Response.ok(response).build();
    }

    @GET
    @Path("/{id}")
    public Response getJob(@PathParam("id") Long id) {
        return handle(() -> Response.ok(toType(registry.getJob(id))).build());
    }

    /**
     * Creates a job.
     *
     * @param actor
     *            operator recorded as {@code created_by}
     * @return 201 with the created job, 400 on validation failure
     */
    @POST
    public Response createJob(@Valid CreateJobRequestType request,
            @QueryParam("actor") @DefaultValue("admin") String actor) {
        if (request == null) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("Request body required"))
                    .build();
        }
        return handle(() -> {
            ScheduledJob job = registry.createJob(request, actor);
            LOG.infof("Job %d '%s' created by %s", job.id, job.name, actor);
            return Response.status(Response.Status.CREATED).entity(toType(job)).build();
        });
    }

    /**
     * Partially updates a job. Null fields are left unchanged; a new schedule recomputes the next run.
     */
    @PATCH
    @Path("/{id}")
    public Response updateJob(@PathParam("id") Long id, @Valid UpdateJobRequestType request) {
        if (request == null) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("Request body required"))
                    .build();
        }
        return handle(() -> Response.ok(toType(registry.updateJob(id, request))).build());
    }

    @DELETE
    @Path("/{id}")
    public Response deleteJob(@PathParam("id") Long id) {
        return handle(() -> {
            boolean softDeleted = registry.deleteJob(id);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("id", id);
            body.put("soft_deleted", softDeleted);
            return Response.ok(body).build();
        });
    }

    @POST
    @Path("/{id}/enable")
    public Response enableJob(@PathParam("id") Long id) {
        return handle(() -> Response.ok(toType(registry.setEnabled(id, true))).build());
    }

    @POST
    @Path("/{id}/disable")
    public Response disableJob(@PathParam("id") Long id) {
        return handle(() -> Response.ok(toType(registry.setEnabled(id, false))).build());
    }

    /**
     * Runs the job now on the request thread and returns the finished execution. Disabled jobs can be run manually.
     *
     * @param actor
     *            operator, recorded as {@code triggered_by = "manual:<actor>"}
     */
    @POST
    @Path("/{id}/run")
    public Response runJob(@PathParam("id") Long id, @QueryParam("actor") @DefaultValue("admin") String actor) {
        return handle(() -> {
            ScheduledJob job = registry.getJob(id);
            LoggingConfig.setRequestOrigin("/admin/api/jobs/" + id + "/run");
            LOG.infof("Manual run of job %d '%s' requested by %s", job.id, job.name, actor);
            JobExecution execution = executor.run(job, JobExecution.TRIGGERED_BY_MANUAL_PREFIX + actor);
            return Response.ok(toType(execution)).build();
        });
    }

    @GET
    @Path("/{id}/executions")
    public Response listExecutions(@PathParam("id") Long id, @QueryParam("status") String status,
            @QueryParam("page") @DefaultValue("0") int page, @QueryParam("size") @DefaultValue("20") int size) {
        return handle(() -> {
            registry.getJob(id);
            JobExecution.Status filter = parseStatus(status);
            List<JobExecutionType> executions = registry.getExecutions(id, filter, page, size).stream()
                    .map(JobAdminResource::toType).toList();
            long total = registry.countExecutions(id, filter);
            return Response.ok(new JobExecutionPageType(executions, total, page, size)).build();
        });
    }

    private static JobExecution.Status parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return JobExecution.Status.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown execution status: " + status, e);
        }
    }

    private Response handle(Supplier<Response> action) {
        try {
            return action.get();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
        } catch (Exception e) {
            LOG.errorf(e, "Job admin request failed");
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Job admin request failed")).build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    static ScheduledJobType toType(ScheduledJob job) {
        ScheduleType schedule = new ScheduleType(job.scheduleKind.name().toLowerCase(Locale.ROOT),
                job.intervalSeconds, job.cronExpression, job.timezone);
        return new ScheduledJobType(job.id, job.name, job.description, job.templateType, job.parameters, schedule,
                job.enabled, job.timeoutSeconds, new RetryPolicyType(job.maxRetries, job.retryDelaySeconds),
                new NotifyOnType(job.notifyOnSuccess, job.notifyOnFailure), job.lastRunAt, job.nextRunAt,
                job.lastStatus != null ? job.lastStatus.name().toLowerCase(Locale.ROOT) : null, job.retryAt,
                job.retryAttempt, job.createdBy, job.createdAt, job.updatedAt);
    }

    static JobExecutionType toType(JobExecution execution) {
        return new JobExecutionType(execution.id, execution.jobId, execution.jobName, execution.templateType,
                execution.triggeredBy, execution.attempt, execution.status.name().toLowerCase(Locale.ROOT),
                execution.startedAt, execution.finishedAt, execution.durationSeconds, execution.message,
                execution.result, execution.errors);
    }

    /**
     * Simple error response record for API errors.
     */
    public record ErrorResponse(String error) {
    }
}
