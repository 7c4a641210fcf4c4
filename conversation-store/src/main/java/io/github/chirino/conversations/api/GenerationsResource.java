package io.github.chirino.conversations.api;

import io.github.chirino.conversations.api.dto.GenerationDto;
import io.github.chirino.conversations.api.dto.GenerationUpdateRequest;
import io.github.chirino.conversations.api.dto.StartGenerationRequest;
import io.github.chirino.conversations.store.ResourceNotFoundException;
import io.github.chirino.conversations.streaming.GenerationRecorder;
import io.github.chirino.conversations.streaming.InFlightGeneration;
import io.github.chirino.conversations.streaming.StreamingWriteCoordinator;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Duration;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Incremental writes of assistant messages by an external generation loop. The loop starts a
 * generation, sends the full content so far with each update and finishes it, optionally as
 * stopped. Clients follow progress by polling the conversation's messages.
 */
@Path("/v1/conversations/{conversationId}/generations")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class GenerationsResource {

    @Inject StreamingWriteCoordinator coordinator;

    @ConfigProperty(name = "conversation-store.generation.cancel-timeout", defaultValue = "30s")
    Duration cancelTimeout;

    @POST
    public Response startGeneration(
            @PathParam("conversationId") String conversationId, StartGenerationRequest request) {
        GenerationRecorder recorder =
                coordinator.start(conversationId, request != null ? request.getBranch() : null);
        GenerationDto dto = new GenerationDto();
        dto.setConversationId(conversationId);
        dto.setMessageId(recorder.messageId());
        dto.setBranch(recorder.branch());
        return Response.status(Response.Status.CREATED).entity(dto).build();
    }

    @GET
    public Response getGeneration(@PathParam("conversationId") String conversationId) {
        InFlightGeneration generation =
                coordinator
                        .inFlight(conversationId)
                        .orElseThrow(
                                () -> new ResourceNotFoundException("generation", conversationId));
        GenerationDto dto = new GenerationDto();
        dto.setConversationId(conversationId);
        dto.setMessageId(generation.messageId());
        dto.setBranch(generation.branch());
        dto.setCancelRequested(generation.isCancelRequested());
        return Response.ok(dto).build();
    }

    @PUT
    @Path("/{messageId}")
    public Response updateGeneration(
            @PathParam("conversationId") String conversationId,
            @PathParam("messageId") String messageId,
            GenerationUpdateRequest request) {
        ConversationsResource.require(request, "request body");
        boolean patched =
                coordinator.patch(
                        conversationId,
                        request.getBranch(),
                        messageId,
                        request.getContent(),
                        request.getThinking(),
                        request.getToolResults());
        if (!patched) {
            throw new ResourceNotFoundException("message", messageId);
        }
        return Response.noContent().build();
    }

    @POST
    @Path("/{messageId}/finish")
    public Response finishGeneration(
            @PathParam("conversationId") String conversationId,
            @PathParam("messageId") String messageId,
            GenerationUpdateRequest request) {
        GenerationUpdateRequest update =
                request != null ? request : new GenerationUpdateRequest();
        boolean finished =
                coordinator.finish(
                        conversationId,
                        update.getBranch(),
                        messageId,
                        update.getContent(),
                        update.getThinking(),
                        update.getToolResults(),
                        update.isStopped());
        if (!finished) {
            throw new ResourceNotFoundException("message", messageId);
        }
        return Response.noContent().build();
    }

    /**
     * Requests cancellation. With {@code wait=true} the call returns once the generation has been
     * finalized. A generation loop that does not stop within the cancel timeout is finalized as
     * stopped by this call.
     */
    @DELETE
    public Response cancelGeneration(
            @PathParam("conversationId") String conversationId,
            @QueryParam("wait") boolean wait) {
        if (!wait) {
            boolean requested = coordinator.requestCancel(conversationId);
            return Response.ok(Map.of("cancelRequested", requested, "completed", false)).build();
        }
        StreamingWriteCoordinator.CancelOutcome outcome =
                coordinator.cancel(conversationId, cancelTimeout);
        return Response.ok(
                        Map.of(
                                "cancelRequested", outcome.requested(),
                                "completed", outcome.completed(),
                                "forced", outcome.forced()))
                .build();
    }
}
