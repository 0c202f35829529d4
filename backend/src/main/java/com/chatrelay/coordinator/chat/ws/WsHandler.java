package com.chatrelay.coordinator.chat.ws;

import com.chatrelay.coordinator.auth.service.jwt.JwtClaims;
import com.chatrelay.coordinator.auth.service.jwt.JwtService;
import com.chatrelay.coordinator.chat.repo.ChatStore;
import com.chatrelay.coordinator.chat.service.EventRouter;
import com.chatrelay.coordinator.common.error.ChatException;
import com.chatrelay.coordinator.common.error.StaleDispatchTargetException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

@Component
public class WsHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(WsHandler.class);

    private final ObjectMapper objectMapper;
    private final JwtService jwtService;
    private final ConnectionRegistry connectionRegistry;
    private final EventRouter eventRouter;
    private final int sendTimeLimitMs;
    private final int sendBufferSizeLimit;
    private final int syncPageSize;

    public WsHandler(
            ObjectMapper objectMapper,
            JwtService jwtService,
            ConnectionRegistry connectionRegistry,
            EventRouter eventRouter,
            @Value("${app.ws.send-time-limit-ms:10000}") int sendTimeLimitMs,
            @Value("${app.ws.send-buffer-size-limit:524288}") int sendBufferSizeLimit,
            @Value("${app.history.max-page-size:200}") int syncPageSize
    ) {
        this.objectMapper = objectMapper;
        this.jwtService = jwtService;
        this.connectionRegistry = connectionRegistry;
        this.eventRouter = eventRouter;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.sendBufferSizeLimit = sendBufferSizeLimit;
        this.syncPageSize = syncPageSize;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        var handle = connectionRegistry.attach(new WebSocketTransport(session, sendTimeLimitMs, sendBufferSizeLimit));

        // Optional: token in the query string, e.g. /ws?token=...
        var token = parseQueryParams(session.getUri()).get("token");
        if (token != null && !token.isBlank()) {
            authenticate(handle, token);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        connectionRegistry.find(session.getId()).ifPresent(connectionRegistry::unregister);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("ws_transport_error sessionId={}", session.getId(), exception);
        connectionRegistry.find(session.getId()).ifPresent(connectionRegistry::unregister);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        var handle = connectionRegistry.find(session.getId()).orElse(null);
        if (handle == null) {
            return;
        }
        final String rid = "ws_" + session.getId() + "_" + System.nanoTime();
        try {
            JsonNode root = objectMapper.readTree(message.getPayload());
            var type = root.path("type").asText(null);
            if (type == null) {
                sendError(handle, "missing_type", rid);
                return;
            }

            connectionRegistry.touch(handle);

            switch (type) {
                case "authenticate" -> {
                    var token = root.path("token").asText(null);
                    if (token == null || token.isBlank()) {
                        sendError(handle, "missing_token", rid);
                        return;
                    }
                    authenticate(handle, token);
                }
                case "send_message" -> handleSendMessage(handle, root, rid);
                case "typing_start" -> handleTyping(handle, root, rid, true);
                case "typing_stop" -> handleTyping(handle, root, rid, false);
                case "mark_read" -> handleMarkRead(handle, root, rid);
                case "sync" -> handleSync(handle, root, rid);
                case "ping" -> reply(handle, obj("type", "pong"));
                default -> sendError(handle, "unsupported_type", rid);
            }
        } catch (JsonProcessingException ex) {
            sendError(handle, "invalid_json", rid);
        } catch (ChatException ex) {
            sendError(handle, ex.code(), rid);
        } catch (IllegalArgumentException ex) {
            sendError(handle, ex.getMessage(), rid);
        } catch (Exception ex) {
            log.warn("ws_internal_error rid={} sessionId={} payload={}", rid, session.getId(), safeOneLine(message.getPayload()), ex);
            sendError(handle, "ws_internal_error", rid);
        }
    }

    private void authenticate(ConnectionHandle handle, String token) {
        final JwtClaims claims;
        try {
            claims = jwtService.parse(token);
        } catch (ExpiredJwtException ex) {
            sendError(handle, "token_expired", null);
            closeQuietly(handle);
            return;
        } catch (JwtException | IllegalArgumentException ex) {
            sendError(handle, "invalid_token", null);
            closeQuietly(handle);
            return;
        }

        var result = connectionRegistry.register(handle, claims.userId());
        if (!result.bound()) {
            return;
        }

        ObjectNode ok = objectMapper.createObjectNode();
        ok.put("type", "auth_ok");
        ok.put("user_id", claims.userId());
        ok.put("connection_id", handle.id());
        reply(handle, ok);
    }

    private void handleSendMessage(ConnectionHandle handle, JsonNode root, String rid) {
        if (!requireAuthenticated(handle, rid)) return;
        var conversationId = requireConversationId(handle, root, rid);
        if (conversationId == null) return;

        var content = root.path("content");
        var text = content.path("text").asText(null);
        var attachmentRef = content.path("attachment_ref").asText(null);
        var clientMsgId = root.path("client_msg_id").asText(null);

        var result = eventRouter.sendMessage(handle, conversationId, new ChatStore.MessagePayload(text, attachmentRef));

        ObjectNode ack = objectMapper.createObjectNode();
        ack.put("type", "message_ack");
        ack.put("conversation_id", conversationId);
        if (clientMsgId != null && !clientMsgId.isBlank()) {
            ack.put("client_msg_id", clientMsgId);
        }
        ack.put("seq", result.seq());
        ack.put("event_seq", result.eventSeq());
        ack.put("timestamp", result.acceptedAt().toEpochMilli());
        reply(handle, ack);
    }

    private void handleTyping(ConnectionHandle handle, JsonNode root, String rid, boolean typing) {
        if (!requireAuthenticated(handle, rid)) return;
        var conversationId = requireConversationId(handle, root, rid);
        if (conversationId == null) return;

        if (typing) {
            eventRouter.startTyping(handle, conversationId);
        } else {
            eventRouter.stopTyping(handle, conversationId);
        }
    }

    private void handleMarkRead(ConnectionHandle handle, JsonNode root, String rid) {
        if (!requireAuthenticated(handle, rid)) return;
        var conversationId = requireConversationId(handle, root, rid);
        if (conversationId == null) return;

        if (!root.path("up_to_seq").canConvertToLong()) {
            sendError(handle, "missing_up_to_seq", rid);
            return;
        }
        var upToSeq = root.path("up_to_seq").asLong();
        var cursor = eventRouter.markRead(handle, conversationId, upToSeq);

        ObjectNode ok = objectMapper.createObjectNode();
        ok.put("type", "mark_read_ok");
        ok.put("conversation_id", conversationId);
        ok.put("last_read_seq", cursor);
        reply(handle, ok);
    }

    private void handleSync(ConnectionHandle handle, JsonNode root, String rid) {
        if (!requireAuthenticated(handle, rid)) return;
        var conversationId = requireConversationId(handle, root, rid);
        if (conversationId == null) return;

        var sinceSeq = root.path("since_seq").asLong(0);
        var page = eventRouter.fetchHistory(handle.userId(), conversationId, sinceSeq, syncPageSize);

        ObjectNode res = objectMapper.createObjectNode();
        res.put("type", "sync_res");
        res.put("conversation_id", conversationId);
        res.put("since_seq", sinceSeq);

        ArrayNode arr = objectMapper.createArrayNode();
        for (var item : page.messages()) {
            arr.add(objectMapper.valueToTree(item));
        }
        res.set("messages", arr);
        res.put("has_more", page.has_more());
        res.put("next_since_seq", page.next_since_seq());
        reply(handle, res);
    }

    private boolean requireAuthenticated(ConnectionHandle handle, String rid) {
        if (handle.isAuthenticated()) return true;
        sendError(handle, "unauthorized", rid);
        return false;
    }

    private String requireConversationId(ConnectionHandle handle, JsonNode root, String rid) {
        var conversationId = root.path("conversation_id").asText(null);
        if (conversationId == null || conversationId.isBlank()) {
            sendError(handle, "missing_conversation_id", rid);
            return null;
        }
        return conversationId;
    }

    private static Map<String, String> parseQueryParams(URI uri) {
        if (uri == null || uri.getRawQuery() == null || uri.getRawQuery().isBlank()) {
            return Map.of();
        }
        var out = new HashMap<String, String>();
        for (var pair : uri.getRawQuery().split("&")) {
            if (pair == null || pair.isBlank()) continue;
            var idx = pair.indexOf('=');
            var key = urlDecode(idx < 0 ? pair : pair.substring(0, idx));
            var val = idx < 0 ? "" : urlDecode(pair.substring(idx + 1));
            if (key != null && !key.isBlank()) {
                out.put(key, val == null ? "" : val);
            }
        }
        return out;
    }

    private static String urlDecode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            return s;
        }
    }

    private void sendError(ConnectionHandle handle, String code, String rid) {
        ObjectNode err = objectMapper.createObjectNode();
        err.put("type", "error");
        err.put("code", code);
        err.put("message", errorMessageForCode(code));
        if (rid != null && !rid.isBlank()) {
            err.put("rid", rid);
        }
        reply(handle, err);
    }

    private String errorMessageForCode(String code) {
        if (code == null || code.isBlank()) return "error";
        return switch (code) {
            case "missing_type" -> "missing field: type";
            case "invalid_json" -> "frame is not valid json";
            case "missing_token" -> "missing auth token";
            case "token_expired" -> "auth token expired";
            case "invalid_token" -> "invalid auth token";
            case "unauthorized" -> "authenticate first";
            case "duplicate_binding" -> "connection already authenticated";
            case "missing_conversation_id" -> "missing field: conversation_id";
            case "missing_up_to_seq" -> "missing field: up_to_seq";
            case "invalid_seq" -> "sequence numbers start at 1";
            case "empty_message" -> "message needs content.text or content.attachment_ref";
            case "not_a_member" -> "not a member of this conversation";
            case "membership_unavailable" -> "conversation membership temporarily unavailable";
            case "persistence_failure" -> "message could not be stored";
            case "message_not_found" -> "message not found";
            case "unsupported_type" -> "unsupported message type";
            case "ws_internal_error" -> "internal websocket error";
            default -> code;
        };
    }

    private void reply(ConnectionHandle handle, ObjectNode node) {
        try {
            handle.send(objectMapper.writeValueAsString(node));
        } catch (StaleDispatchTargetException | JsonProcessingException ex) {
            log.debug("ws_reply_dropped connectionId={}", handle.id(), ex);
        }
    }

    private void closeQuietly(ConnectionHandle handle) {
        connectionRegistry.unregister(handle);
        handle.closeTransport();
    }

    private String safeOneLine(String s) {
        if (s == null) return "";
        var x = s.replaceAll("[\\r\\n\\t]", " ");
        return x.length() > 500 ? x.substring(0, 500) + "..." : x;
    }

    private ObjectNode obj(String k, String v) {
        ObjectNode n = objectMapper.createObjectNode();
        n.put(k, v);
        return n;
    }
}
