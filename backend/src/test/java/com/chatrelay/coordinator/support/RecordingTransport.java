package com.chatrelay.coordinator.support;

import com.chatrelay.coordinator.chat.ws.ConnectionTransport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingTransport implements ConnectionTransport {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String id;
    private final List<String> frames = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failWrites;

    public RecordingTransport(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(String frame) throws IOException {
        if (failWrites) throw new IOException("broken pipe");
        frames.add(frame);
    }

    @Override
    public void close() {
        open = false;
    }

    public void failWrites() {
        this.failWrites = true;
    }

    public List<JsonNode> frames() {
        return frames.stream().map(RecordingTransport::parse).toList();
    }

    public List<JsonNode> framesOfType(String type) {
        return frames().stream().filter(f -> type.equals(f.path("type").asText())).toList();
    }

    private static JsonNode parse(String s) {
        try {
            return MAPPER.readTree(s);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
