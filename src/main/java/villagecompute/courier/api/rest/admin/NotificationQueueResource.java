package villagecompute.courier.api.rest.admin;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import villagecompute.courier.api.types.EnqueueNotificationRequestType;
import villagecompute.courier.api.types.NotificationRequestType;
import villagecompute.courier.data.models.NotificationRequest;
import villagecompute.courier.exceptions.ResourceNotFoundException;
import villagecompute.courier.exceptions.ValidationException;
import villagecompute.courier.notifications.DeliveryMode;
import villagecompute.courier.notifications.NotificationChannel;
import villagecompute.courier.notifications.NotificationPriority;
import villagecompute.courier.services.NotificationQueueService;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Admin REST endpoints for the notification queue.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /admin/api/notifications/health} – counts by status, success rate, stuck and backlog age</li>
 * <li>{@code POST /admin/api/notifications} – enqueue a notification</li>
 * <li>{@code GET /admin/api/notifications/{id}} – request status</li>
 * <li>{@code POST /admin/api/notifications/{id}/cancel} – cancel a pending request</li>
 * </ul>
 *
 * <p>
 * <b>Security:</b> Assumes deployment behind authenticated admin gateway.
 */
@Path("/admin/api/notifications")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class NotificationQueueResource {

    private static final Logger LOG = Logger.getLogger(NotificationQueueResource.class);

    @Inject
    NotificationQueueService queueService;

    @GET
    @Path("/health")
    public Response health() {
        return Response.ok(queueService.getQueueHealth()).build();
    }

    /**
     * Enqueues a notification.
     *
     * @return 201 with the created request, 400 for a blank recipient or trigger, no channels, or an unknown
     *         channel, priority or delivery mode
     */
    @POST
    public Response enqueue(EnqueueNotificationRequestType request) {
        if (request == null) {
            return badRequest("Request body required");
        }
        try {
            List<NotificationChannel> channels = request.channels() == null ? List.of()
                    : request.channels().stream().map(NotificationChannel::fromString).toList();
            NotificationPriority priority = NotificationPriority.fromString(request.priority());
            DeliveryMode mode = request.deliveryMode() == null || request.deliveryMode().isBlank() ? null
                    : DeliveryMode.valueOf(request.deliveryMode().trim().toUpperCase(Locale.ROOT));

            UUID id = queueService.enqueue(request.recipient(), request.trigger(), channels, priority,
                    request.templateData(), mode, request.scheduledFor());
            return Response.status(Response.Status.CREATED).entity(toType(queueService.get(id))).build();
        } catch (ValidationException | IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }
    }

    @GET
    @Path("/{id}")
    public Response getNotification(@PathParam("id") UUID id) {
        try {
            return Response.ok(toType(queueService.get(id))).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new JobAdminResource.ErrorResponse(e.getMessage()))
                    .build();
        }
    }

    /**
     * Cancels a PENDING request.
     *
     * @return 200 with {@code cancelled: true}, 409 when the request already left PENDING, 404 when unknown
     */
    @POST
    @Path("/{id}/cancel")
    public Response cancel(@PathParam("id") UUID id) {
        try {
            boolean cancelled = queueService.cancel(id);
            if (!cancelled) {
                return Response.status(Response.Status.CONFLICT)
                        .entity(new JobAdminResource.ErrorResponse("Notification is no longer pending: " + id))
                        .build();
            }
            LOG.infof("Notification %s cancelled via admin API", id);
            return Response.ok(Map.of("id", id, "cancelled", true)).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new JobAdminResource.ErrorResponse(e.getMessage()))
                    .build();
        }
    }

    private static Response badRequest(String message) {
        return Response.status(Response.Status.BAD_REQUEST).entity(new JobAdminResource.ErrorResponse(message))
                .build();
    }

    static NotificationRequestType toType(NotificationRequest request) {
        return new NotificationRequestType(request.id, request.recipient, request.trigger,
                request.channels.stream().map(c -> c.name().toLowerCase(Locale.ROOT)).toList(),
                request.deliveryMode.name().toLowerCase(Locale.ROOT),
                request.priority.name().toLowerCase(Locale.ROOT), request.status.name().toLowerCase(Locale.ROOT),
                request.attempts, request.statusReason, request.templateData, request.processingStartedAt,
                request.scheduledFor, request.createdAt, request.updatedAt, request.completedAt);
    }
}
