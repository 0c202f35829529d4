package com.chatrelay.coordinator.chat.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

class WebSocketTransport implements ConnectionTransport {

    private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);

    private final WebSocketSession session;

    WebSocketTransport(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String frame) throws IOException {
        session.sendMessage(new TextMessage(frame));
    }

    @Override
    public void close() {
        try {
            if (session.isOpen()) {
                session.close(CloseStatus.NOT_ACCEPTABLE);
            }
        } catch (IOException ex) {
            log.debug("ws_close_failed sessionId={}", session.getId(), ex);
        }
    }
}
