package io.github.drompincen.elvtrack.gateway.controller;

import io.github.drompincen.elvtrack.persistence.store.DocumentStore;
import io.github.drompincen.elvtrack.persistence.store.StoreDiagnostics;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class StatusController {

    private final DocumentStore store;
    private final boolean mongoUriConfigured;

    public StatusController(DocumentStore store,
                            @Value("${ELVTRACK_MONGO_URI:}") String mongoUri) {
        this.store = store;
        this.mongoUriConfigured = !mongoUri.isBlank();
    }

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", "ELV tracking backend is running");
    }

    /** Never fails: store problems are reported in the body. */
    @GetMapping("/test")
    public Map<String, Object> test() {
        StoreDiagnostics diagnostics = store.describe();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("backend", "running");
        body.put("store_type", diagnostics.type());
        body.put("database", diagnostics.database());
        body.put("database_reachable", diagnostics.reachable());
        body.put("collections", diagnostics.collections());
        if (diagnostics.error() != null) {
            body.put("database_error", diagnostics.error());
        }
        body.put("mongo_uri_configured", mongoUriConfigured);
        return body;
    }
}
