package io.github.drompincen.elvtrack.gateway.controller;

import io.github.drompincen.elvtrack.protocol.api.VehicleStatus;
import io.github.drompincen.elvtrack.runtime.record.VehicleService;
import io.github.drompincen.elvtrack.runtime.validation.PayloadReader;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/vehicles")
public class VehicleController {

    private final VehicleService vehicleService;

    public VehicleController(VehicleService vehicleService) {
        this.vehicleService = vehicleService;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestBody Map<String, Object> body) {
        return ResponseEntity.ok(vehicleService.create(body));
    }

    @GetMapping
    public List<Map<String, Object>> list(@RequestParam(required = false) String status,
                                          @RequestParam(required = false) Integer limit) {
        VehicleStatus filter = PayloadReader.parseWire("status", VehicleStatus.class, status);
        return vehicleService.list(filter, limit);
    }

    @GetMapping("/{vehicleId}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String vehicleId) {
        return ResponseEntity.ok(vehicleService.get(vehicleId));
    }

    @GetMapping("/{vehicleId}/history")
    public List<Map<String, Object>> history(@PathVariable String vehicleId) {
        return vehicleService.history(vehicleId);
    }
}
