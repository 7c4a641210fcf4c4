package io.github.chirino.conversations.api;

import io.github.chirino.conversations.api.dto.ErrorResponse;
import io.github.chirino.conversations.branch.CorruptBranchKeyException;
import io.github.chirino.conversations.store.ResourceConflictException;
import io.github.chirino.conversations.store.ResourceNotFoundException;
import io.github.chirino.conversations.store.StorageException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Map;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Maps store failures to structured JSON error responses. Unexpected exceptions are logged with
 * their stack trace.
 */
public class GlobalExceptionMapper {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    @ServerExceptionMapper
    public Response handleNotFound(ResourceNotFoundException e) {
        return error(
                Response.Status.NOT_FOUND,
                "Not found",
                "not_found",
                Map.of("resource", e.getResource(), "id", e.getId()));
    }

    @ServerExceptionMapper
    public Response handleConflict(ResourceConflictException e) {
        LOG.debugf("Conflict on %s %s: %s", e.getResource(), e.getId(), e.getMessage());
        return error(
                Response.Status.CONFLICT,
                "Conflict",
                "conflict",
                Map.of("resource", e.getResource(), "id", e.getId(), "message", e.getMessage()));
    }

    @ServerExceptionMapper
    public Response handleIllegalArgument(IllegalArgumentException e) {
        return badRequest(e.getMessage() != null ? e.getMessage() : "Invalid argument");
    }

    @ServerExceptionMapper
    public Response handleCorruptBranchKey(CorruptBranchKeyException e) {
        return badRequest(e.getMessage());
    }

    @ServerExceptionMapper
    public Response handleStorage(StorageException e) {
        LOG.errorf(e, "Storage failure");
        return error(
                Response.Status.INTERNAL_SERVER_ERROR,
                "Storage error",
                e.getCode(),
                e.getDetails());
    }

    @ServerExceptionMapper
    public Response handleException(Exception e) {
        // For WebApplicationException (includes JAX-RS responses), preserve the original status
        if (e instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            if (status >= 500) {
                LOG.errorf(e, "Server error %d", status);
            }
            return wae.getResponse();
        }

        LOG.errorf(e, "Unhandled exception");
        return error(
                Response.Status.INTERNAL_SERVER_ERROR,
                "Internal server error",
                "internal_error",
                Map.of(
                        "message",
                        e.getMessage() != null ? e.getMessage() : e.getClass().getName()));
    }

    private static Response badRequest(String message) {
        return error(
                Response.Status.BAD_REQUEST,
                "Bad request",
                "bad_request",
                Map.of("message", message));
    }

    private static Response error(
            Response.Status status, String error, String code, Map<String, Object> details) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(error, code, details))
                .build();
    }
}
