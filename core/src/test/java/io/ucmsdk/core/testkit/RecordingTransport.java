package io.ucmsdk.core.testkit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ucmsdk.core.engine.RequestPayload;
import io.ucmsdk.core.spi.ApiTransport;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Transport fake: records every payload and answers with canned bodies or a
 * failure. Queued bodies are used in order; the last one then repeats.
 */
public final class RecordingTransport implements ApiTransport {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final List<RequestPayload> sent = new CopyOnWriteArrayList<>();
    private final Deque<JsonNode> responses = new ArrayDeque<>();
    private volatile RuntimeException failure;

    /** Answers every call with the given JSON body. */
    public RecordingTransport respondWith(String json) {
        return respondInTurn(json);
    }

    /** Answers successive calls with the given JSON bodies. */
    public synchronized RecordingTransport respondInTurn(String... bodies) {
        responses.clear();
        for (String json : bodies) {
            try {
                responses.add(JSON.readTree(json));
            } catch (Exception e) {
                throw new IllegalArgumentException("Invalid test response: " + json, e);
            }
        }
        this.failure = null;
        return this;
    }

    /** Fails every call with the given exception. */
    public RecordingTransport failWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public synchronized JsonNode send(String operation, String apiVersion, RequestPayload payload) {
        sent.add(payload);
        if (failure != null) {
            throw failure;
        }
        return responses.size() > 1 ? responses.poll() : responses.peek();
    }

    public List<RequestPayload> sent() {
        return sent;
    }

    /** The last payload sent so far. */
    public RequestPayload lastPayload() {
        if (sent.isEmpty()) {
            throw new AssertionError("Nothing was sent");
        }
        return sent.get(sent.size() - 1);
    }
}
