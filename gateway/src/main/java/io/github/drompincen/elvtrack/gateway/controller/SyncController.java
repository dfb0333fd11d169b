package io.github.drompincen.elvtrack.gateway.controller;

import io.github.drompincen.elvtrack.protocol.sync.SyncEnvelope;
import io.github.drompincen.elvtrack.protocol.sync.SyncResponse;
import io.github.drompincen.elvtrack.runtime.sync.SyncReconciler;
import org.springframework.web.bind.annotation.*;

/** Offline batch upload. Per-mutation failures come back in the body with HTTP 200. */
@RestController
@RequestMapping("/api/sync")
public class SyncController {

    private final SyncReconciler reconciler;

    public SyncController(SyncReconciler reconciler) {
        this.reconciler = reconciler;
    }

    @PostMapping
    public SyncResponse sync(@RequestBody SyncEnvelope envelope) {
        return reconciler.reconcile(envelope.mutations());
    }
}
