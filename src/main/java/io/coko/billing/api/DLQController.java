package io.coko.billing.api;

import io.coko.billing.dlq.DeadLetterQueueService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Manual review of failed renewals and dead tasks.
 */
@RestController
@RequestMapping("/api/billing/dlq")
public class DLQController {

    private final DeadLetterQueueService dlqService;

    public DLQController(DeadLetterQueueService dlqService) {
        this.dlqService = dlqService;
    }

    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> unresolved() {
        return ResponseEntity.ok(dlqService.getUnresolvedEntries());
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        int unresolvedCount = dlqService.getUnresolvedCount();
        return ResponseEntity.ok(Map.of(
            "unresolvedCount", unresolvedCount,
            "status", unresolvedCount > 100 ? "WARNING" : "OK"
        ));
    }

    /**
     * POST /api/billing/dlq/{dlqId}/resolve with {"notes": "..."}
     */
    @PostMapping("/{dlqId}/resolve")
    public ResponseEntity<Map<String, Object>> resolveEntry(@PathVariable String dlqId,
            @RequestBody(required = false) Map<String, String> request) {
        UUID id = ApiRequests.uuid(dlqId, "dlqId");
        String notes = request != null ? request.getOrDefault("notes", "") : "";
        dlqService.markResolved(id, ApiRequests.actor(), notes);
        return ResponseEntity.ok(Map.of(
            "dlqId", dlqId,
            "status", "resolved"
        ));
    }

    /**
     * Only TASK entries can be requeued; renewal entries are picked up by the next billing run.
     */
    @PostMapping("/{dlqId}/requeue")
    public ResponseEntity<Map<String, Object>> requeue(@PathVariable String dlqId) {
        dlqService.requeue(ApiRequests.uuid(dlqId, "dlqId"), ApiRequests.actor());
        return ResponseEntity.ok(Map.of(
            "dlqId", dlqId,
            "status", "requeued"
        ));
    }
}
