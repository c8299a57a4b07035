package com.streamsupervisor.controller;

import com.streamsupervisor.exception.StreamException;
import com.streamsupervisor.model.ErrorKind;
import com.streamsupervisor.model.StreamResult;
import com.streamsupervisor.model.StreamSnapshot;
import com.streamsupervisor.service.StreamRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@Slf4j
@RestController
@RequestMapping("/api/streams")
@RequiredArgsConstructor
public class StreamController {
    private final StreamRegistry registry;

    @GetMapping
    public List<StreamSnapshot> listStreams() {
        return registry.list();
    }

    @GetMapping("/{streamId}")
    public ResponseEntity<?> getStream(@PathVariable String streamId) {
        return respond(streamId, () -> registry.get(streamId));
    }

    @PostMapping("/{streamId}/start")
    public ResponseEntity<?> startStream(@PathVariable String streamId,
                                         @RequestParam(value = "loop", defaultValue = "-1") String loop) {
        int loopCount;
        try {
            loopCount = Integer.parseInt(loop.trim());
        } catch (NumberFormatException e) {
            return badRequest(streamId, "loop must be an integer, got '" + loop + "'");
        }
        if (loopCount < -1) {
            return badRequest(streamId, "loop must be -1 (infinite) or >= 0, got " + loopCount);
        }
        return respond(streamId, () -> registry.start(streamId, loopCount));
    }

    @PostMapping("/{streamId}/stop")
    public ResponseEntity<?> stopStream(@PathVariable String streamId) {
        return respond(streamId, () -> registry.stop(streamId));
    }

    @PostMapping("/start-all")
    public List<StreamResult> startAll() {
        List<StreamResult> results = registry.startAll();
        logFailures("start-all", results);
        return results;
    }

    @PostMapping("/stop-all")
    public List<StreamResult> stopAll() {
        List<StreamResult> results = registry.stopAll();
        logFailures("stop-all", results);
        return results;
    }

    private ResponseEntity<?> respond(String streamId, Supplier<StreamSnapshot> operation) {
        try {
            return ResponseEntity.ok(operation.get());
        } catch (StreamException e) {
            if (e.getKind() != ErrorKind.NOT_FOUND) {
                log.error("Operation on stream {} failed: {}", streamId, e.getMessage());
            }
            return ResponseEntity.status(statusOf(e.getKind()))
                    .body(errorBody(e.getKind().name(), streamId, e.getMessage()));
        }
    }

    private static HttpStatus statusOf(ErrorKind kind) {
        switch (kind) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case NAMING_COLLISION:
                return HttpStatus.CONFLICT;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static ResponseEntity<Map<String, Object>> badRequest(String streamId, String message) {
        return ResponseEntity.badRequest().body(errorBody("BAD_REQUEST", streamId, message));
    }

    private static Map<String, Object> errorBody(String error, String streamId, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("streamId", streamId);
        body.put("message", message);
        return body;
    }

    private static void logFailures(String operation, List<StreamResult> results) {
        results.stream()
                .filter(r -> !r.isSuccess())
                .forEach(r -> log.warn("{}: stream {} failed: {}", operation, r.getId(), r.getMessage()));
    }
}
