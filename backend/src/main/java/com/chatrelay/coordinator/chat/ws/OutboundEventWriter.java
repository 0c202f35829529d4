package com.chatrelay.coordinator.chat.ws;

import com.chatrelay.coordinator.chat.api.OutboundEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;

@Component
public class OutboundEventWriter {

    private final ObjectMapper objectMapper;

    public OutboundEventWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode toJson(OutboundEvent event) {
        ObjectNode evt = objectMapper.createObjectNode();
        evt.put("type", event.type());
        evt.put("actor_id", event.actorId());
        evt.put("timestamp", event.at().toEpochMilli());

        if (event instanceof OutboundEvent.MessageDelivered m) {
            evt.put("conversation_id", m.conversationId());
            evt.put("seq", m.seq());
            evt.put("event_seq", m.eventSeq());
            ObjectNode content = objectMapper.createObjectNode();
            if (m.text() != null) content.put("text", m.text());
            if (m.attachmentRef() != null) content.put("attachment_ref", m.attachmentRef());
            evt.set("content", content);
        } else if (event instanceof OutboundEvent.TypingStarted t) {
            evt.put("conversation_id", t.conversationId());
            evt.put("event_seq", t.eventSeq());
        } else if (event instanceof OutboundEvent.TypingStopped t) {
            evt.put("conversation_id", t.conversationId());
            evt.put("event_seq", t.eventSeq());
            if (t.expired()) evt.put("expired", true);
        } else if (event instanceof OutboundEvent.MessageRead r) {
            evt.put("conversation_id", r.conversationId());
            evt.put("up_to_seq", r.upToSeq());
            evt.put("event_seq", r.eventSeq());
        } else if (event instanceof OutboundEvent.PresenceChanged p) {
            evt.put("status", p.status().wireName());
            if (p.lastSeen() != null) evt.put("last_seen", p.lastSeen().toEpochMilli());
        }
        return evt;
    }

    public String write(OutboundEvent event) {
        try {
            return objectMapper.writeValueAsString(toJson(event));
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
