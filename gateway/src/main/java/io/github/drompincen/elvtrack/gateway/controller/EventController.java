package io.github.drompincen.elvtrack.gateway.controller;

import io.github.drompincen.elvtrack.runtime.record.EventService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/events")
public class EventController {

    private final EventService eventService;

    public EventController(EventService eventService) {
        this.eventService = eventService;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> log(@RequestBody Map<String, Object> body) {
        return ResponseEntity.ok(eventService.logEvent(body));
    }
}
