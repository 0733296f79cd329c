package com.ai.supportdesk.controller;

import com.ai.supportdesk.component.ResponsePhrases;
import com.ai.supportdesk.dto.ConversationReply;
import com.ai.supportdesk.dto.EngineStats;
import com.ai.supportdesk.dto.MessageRequest;
import com.ai.supportdesk.dto.ResetRequest;
import com.ai.supportdesk.dto.SuggestionsResponse;
import com.ai.supportdesk.service.ConversationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping(value = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class SupportController {

    private static final Logger log = LoggerFactory.getLogger(SupportController.class);

    private final ConversationEngine engine;
    private final ResponsePhrases phrases;

    public SupportController(ConversationEngine engine, ResponsePhrases phrases) {
        this.engine = engine;
        this.phrases = phrases;
    }

    @GetMapping("/suggestions")
    public ResponseEntity<SuggestionsResponse> suggestions(@RequestParam(value = "prefix", defaultValue = "") String prefix) {
        return ResponseEntity.ok(new SuggestionsResponse(prefix, engine.getSuggestions(prefix)));
    }

    @PostMapping(value = "/message", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ConversationReply> message(@RequestBody MessageRequest request) {
        return ResponseEntity.ok(engine.processMessage(request.getSessionId(), request.getMessage()));
    }

    @PostMapping("/reset")
    public ResponseEntity<Map<String, Object>> reset(@RequestBody(required = false) ResetRequest request) {
        String sessionId = request != null ? request.getSessionId() : null;
        engine.resetSession(sessionId);
        log.debug("Reset requested for session {}", sessionId);
        return ResponseEntity.ok(Map.of("success", true, "message", phrases.sessionReset()));
    }

    @GetMapping("/stats")
    public ResponseEntity<EngineStats> stats() {
        return ResponseEntity.ok(engine.stats());
    }
}
