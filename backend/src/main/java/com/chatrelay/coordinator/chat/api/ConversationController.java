package com.chatrelay.coordinator.chat.api;

import com.chatrelay.coordinator.auth.service.jwt.JwtService;
import com.chatrelay.coordinator.chat.service.EventRouter;
import com.chatrelay.coordinator.chat.service.RoomManager;
import com.chatrelay.coordinator.common.api.ApiResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * HTTP side of the coordinator: history for clients catching up after a reconnect, and the hooks
 * the conversation service calls when membership changes or a conversation is deleted.
 */
@RestController
@RequestMapping("/api/v1")
public class ConversationController {

    private final JwtService jwtService;
    private final EventRouter eventRouter;
    private final RoomManager roomManager;
    private final byte[] internalToken;

    public ConversationController(
            JwtService jwtService,
            EventRouter eventRouter,
            RoomManager roomManager,
            @Value("${app.internal.token:dev-internal-token-change-me}") String internalToken
    ) {
        this.jwtService = jwtService;
        this.eventRouter = eventRouter;
        this.roomManager = roomManager;
        this.internalToken = internalToken.getBytes(StandardCharsets.UTF_8);
    }

    @GetMapping("/conversations/{conversationId}/messages")
    public ApiResponse<MessagePage> history(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable String conversationId,
            @RequestParam(name = "since_seq", defaultValue = "0") long sinceSeq,
            @RequestParam(name = "limit", defaultValue = "50") int limit
    ) {
        var token = JwtService.extractBearerToken(authorization)
                .orElseThrow(() -> new IllegalArgumentException("missing_token"));
        var claims = jwtService.parse(token);
        return ApiResponse.ok(eventRouter.fetchHistory(claims.userId(), conversationId, sinceSeq, limit));
    }

    @PostMapping("/internal/conversations/{conversationId}/membership-changed")
    public ApiResponse<Void> membershipChanged(
            @RequestHeader(value = "X-Internal-Token", required = false) String token,
            @PathVariable String conversationId
    ) {
        requireInternal(token);
        roomManager.invalidate(conversationId);
        return ApiResponse.ok(null);
    }

    @DeleteMapping("/internal/conversations/{conversationId}")
    public ApiResponse<Void> conversationDeleted(
            @RequestHeader(value = "X-Internal-Token", required = false) String token,
            @PathVariable String conversationId
    ) {
        requireInternal(token);
        eventRouter.teardownConversation(conversationId);
        return ApiResponse.ok(null);
    }

    private void requireInternal(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("unauthorized");
        }
        if (!MessageDigest.isEqual(internalToken, token.getBytes(StandardCharsets.UTF_8))) {
            throw new IllegalArgumentException("forbidden");
        }
    }
}
