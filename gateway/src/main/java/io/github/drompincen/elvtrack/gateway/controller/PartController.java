package io.github.drompincen.elvtrack.gateway.controller;

import io.github.drompincen.elvtrack.runtime.record.PartService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/parts")
public class PartController {

    private final PartService partService;

    public PartController(PartService partService) {
        this.partService = partService;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> register(@RequestBody Map<String, Object> body) {
        return ResponseEntity.ok(partService.register(body));
    }

    @GetMapping
    public List<Map<String, Object>> list(@RequestParam(name = "vehicle_id", required = false) String vehicleId,
                                          @RequestParam(required = false) Integer limit) {
        return partService.list(vehicleId, limit);
    }
}
