package com.phillippitts.streamscribe.presentation.controller;

import com.phillippitts.streamscribe.domain.SessionSnapshot;
import com.phillippitts.streamscribe.service.session.TranscriptionSessionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP surface of the session manager. Audio posted here takes the same path as WebSocket frames.
 */
@RestController
@RequestMapping("/stream")
class StreamController {

    private static final Logger LOG = LogManager.getLogger(StreamController.class);

    private final TranscriptionSessionService sessionService;

    StreamController(TranscriptionSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping("/audio")
    ResponseEntity<AudioResponse> audio(@Valid @RequestBody AudioRequest request) {
        sessionService.processBase64(request.sessionId(), request.audioData());
        return ResponseEntity.ok(new AudioResponse(true, "Audio accepted"));
    }

    @PostMapping("/{sessionId}/connect")
    ResponseEntity<SessionSnapshot> connect(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.connect(sessionId));
    }

    @PostMapping("/process-now/{sessionId}")
    ResponseEntity<Map<String, Object>> processNow(@PathVariable String sessionId) {
        Optional<String> flushed = sessionService.flushNow(sessionId);
        int length = flushed.map(String::length).orElse(0);
        LOG.info("Forced flush for session {}: {} characters", sessionId, length);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "sessionId", sessionId,
                "flushedCharacters", length
        ));
    }

    @GetMapping("/status/{sessionId}")
    ResponseEntity<SessionSnapshot> status(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.status(sessionId));
    }

    @DeleteMapping("/{sessionId}")
    ResponseEntity<AudioResponse> disconnect(@PathVariable String sessionId) {
        sessionService.disconnect(sessionId);
        return ResponseEntity.ok(new AudioResponse(true, "Session closed"));
    }

    @GetMapping("/sessions")
    ResponseEntity<List<SessionSnapshot>> sessions() {
        return ResponseEntity.ok(sessionService.listSessions());
    }

    record AudioRequest(@NotBlank String audioData, @NotBlank String sessionId) {}

    record AudioResponse(boolean success, String message) {}
}
