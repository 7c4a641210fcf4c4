package io.github.chirino.conversations.api;

import io.github.chirino.conversations.api.dto.AddMessageRequest;
import io.github.chirino.conversations.api.dto.ConversationDto;
import io.github.chirino.conversations.api.dto.CreateConversationRequest;
import io.github.chirino.conversations.api.dto.EditMessageRequest;
import io.github.chirino.conversations.api.dto.EditResultDto;
import io.github.chirino.conversations.api.dto.MessageDto;
import io.github.chirino.conversations.api.dto.RetryMessageRequest;
import io.github.chirino.conversations.api.dto.SessionIdRequest;
import io.github.chirino.conversations.api.dto.SetBranchRequest;
import io.github.chirino.conversations.api.dto.SwitchBranchRequest;
import io.github.chirino.conversations.api.dto.TruncateRequest;
import io.github.chirino.conversations.api.dto.UpdateConversationRequest;
import io.github.chirino.conversations.branch.BranchCodec;
import io.github.chirino.conversations.branch.BranchCoordinate;
import io.github.chirino.conversations.config.ConversationStoreSelector;
import io.github.chirino.conversations.store.ConversationStore;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

@Path("/v1")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConversationsResource {

    private static final Logger LOG = Logger.getLogger(ConversationsResource.class);

    @Inject ConversationStoreSelector storeSelector;

    private ConversationStore store() {
        return storeSelector.getStore();
    }

    @GET
    @Path("/conversations")
    public Response listConversations() {
        return Response.ok(data(store().listConversations())).build();
    }

    @GET
    @Path("/conversations/search")
    public Response searchConversations(@QueryParam("query") String query) {
        return Response.ok(data(store().searchConversations(query))).build();
    }

    @POST
    @Path("/conversations")
    public Response createConversation(CreateConversationRequest request) {
        ConversationDto dto =
                store().createConversation(
                        request != null ? request : new CreateConversationRequest());
        return Response.status(Response.Status.CREATED).entity(dto).build();
    }

    @GET
    @Path("/conversations/{conversationId}")
    public Response getConversation(
            @PathParam("conversationId") String conversationId,
            @QueryParam("branch") String branch) {
        return Response.ok(store().getConversation(conversationId, parseBranch(branch))).build();
    }

    @PATCH
    @Path("/conversations/{conversationId}")
    public Response updateConversation(
            @PathParam("conversationId") String conversationId,
            UpdateConversationRequest request) {
        ConversationDto dto =
                store().updateConversation(conversationId, require(request, "request body"));
        return Response.ok(dto).build();
    }

    @DELETE
    @Path("/conversations/{conversationId}")
    public Response deleteConversation(@PathParam("conversationId") String conversationId) {
        store().deleteConversation(conversationId);
        return Response.noContent().build();
    }

    @POST
    @Path("/conversations/{conversationId}/duplicate")
    public Response duplicateConversation(@PathParam("conversationId") String conversationId) {
        ConversationDto dto = store().duplicateConversation(conversationId);
        return Response.status(Response.Status.CREATED).entity(dto).build();
    }

    @GET
    @Path("/conversations/{conversationId}/messages")
    public Response getMessages(
            @PathParam("conversationId") String conversationId,
            @QueryParam("branch") String branch,
            @QueryParam("before") Integer before) {
        BranchCoordinate coordinate = parseBranch(branch);
        List<MessageDto> messages =
                before != null
                        ? store().getMessagesUpTo(conversationId, coordinate, before)
                        : store().getMessages(conversationId, coordinate);
        return Response.ok(data(messages)).build();
    }

    @POST
    @Path("/conversations/{conversationId}/messages")
    public Response addMessage(
            @PathParam("conversationId") String conversationId, AddMessageRequest request) {
        MessageDto dto = store().appendMessage(conversationId, require(request, "request body"));
        return Response.status(Response.Status.CREATED).entity(dto).build();
    }

    @POST
    @Path("/conversations/{conversationId}/messages/edit")
    public Response editMessage(
            @PathParam("conversationId") String conversationId, EditMessageRequest request) {
        require(request, "request body");
        EditResultDto result =
                store().editMessage(
                        conversationId,
                        request.getBranch(),
                        require(request.getUserMessageIndex(), "userMessageIndex"),
                        request.getContent());
        LOG.debugf(
                "Edit created branch %s for conversationId=%s",
                BranchCodec.encode(result.getBranch()), conversationId);
        return Response.status(Response.Status.CREATED).entity(result).build();
    }

    @POST
    @Path("/conversations/{conversationId}/messages/retry")
    public Response retryMessage(
            @PathParam("conversationId") String conversationId, RetryMessageRequest request) {
        require(request, "request body");
        MessageDto dto =
                store().retryMessage(
                        conversationId,
                        request.getBranch(),
                        require(request.getPosition(), "position"),
                        request.getContent(),
                        request.getThinking(),
                        request.getToolResults());
        return Response.status(Response.Status.CREATED).entity(dto).build();
    }

    @POST
    @Path("/conversations/{conversationId}/messages/truncate")
    public Response truncateMessages(
            @PathParam("conversationId") String conversationId, TruncateRequest request) {
        require(request, "request body");
        boolean deleted =
                store().truncateFrom(
                        conversationId,
                        request.getBranch(),
                        require(request.getPosition(), "position"));
        return Response.ok(Map.of("deleted", deleted)).build();
    }

    @GET
    @Path("/conversations/{conversationId}/branches")
    public Response listBranches(@PathParam("conversationId") String conversationId) {
        return Response.ok(data(store().listBranches(conversationId))).build();
    }

    @PUT
    @Path("/conversations/{conversationId}/branches/current")
    public Response setCurrentBranch(
            @PathParam("conversationId") String conversationId, SetBranchRequest request) {
        require(request, "request body");
        store().setCurrentBranch(conversationId, require(request.getBranch(), "branch"));
        return Response.noContent().build();
    }

    @POST
    @Path("/conversations/{conversationId}/branches/switch")
    public Response switchBranch(
            @PathParam("conversationId") String conversationId, SwitchBranchRequest request) {
        require(request, "request body");
        Optional<BranchCoordinate> target =
                store().switchBranch(
                        conversationId,
                        request.getBranch(),
                        require(request.getUserMessageIndex(), "userMessageIndex"),
                        require(request.getDirection(), "direction"));
        Map<String, Object> response = new HashMap<>();
        response.put("switched", target.isPresent());
        response.put("branch", target.orElse(null));
        return Response.ok(response).build();
    }

    @GET
    @Path("/conversations/{conversationId}/versions")
    public Response getVersionInfo(
            @PathParam("conversationId") String conversationId,
            @QueryParam("branch") String branch,
            @QueryParam("userMessageIndex") Integer userMessageIndex) {
        return Response.ok(
                        store().getVersionInfo(
                                conversationId,
                                parseBranch(branch),
                                require(userMessageIndex, "userMessageIndex")))
                .build();
    }

    @GET
    @Path("/conversations/{conversationId}/session")
    public Response getSessionId(@PathParam("conversationId") String conversationId) {
        Map<String, Object> response = new HashMap<>();
        response.put("sessionId", store().getSessionId(conversationId).orElse(null));
        return Response.ok(response).build();
    }

    @PUT
    @Path("/conversations/{conversationId}/session")
    public Response setSessionId(
            @PathParam("conversationId") String conversationId, SessionIdRequest request) {
        store().setSessionId(conversationId, require(request, "request body").getSessionId());
        return Response.noContent().build();
    }

    @GET
    @Path("/conversations/{conversationId}/settings")
    public Response getSettings(@PathParam("conversationId") String conversationId) {
        return Response.ok(store().getSettings(conversationId)).build();
    }

    @PATCH
    @Path("/conversations/{conversationId}/settings")
    public Response updateSettings(
            @PathParam("conversationId") String conversationId, Map<String, Object> changes) {
        return Response.ok(store().updateSettings(conversationId, require(changes, "settings")))
                .build();
    }

    @GET
    @Path("/conversations/{conversationId}/paths")
    public Response getPaths(@PathParam("conversationId") String conversationId) {
        Map<String, Object> response = new HashMap<>();
        response.put("workspace", store().getWorkspacePath(conversationId).toString());
        response.put("memories", store().getMemoriesPath(conversationId).toString());
        return Response.ok(response).build();
    }

    static BranchCoordinate parseBranch(String branch) {
        return branch == null || branch.isBlank() ? null : BranchCodec.decode(branch.trim());
    }

    static <T> T require(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    private static Map<String, Object> data(List<?> items) {
        Map<String, Object> response = new HashMap<>();
        response.put("data", items);
        return response;
    }
}
