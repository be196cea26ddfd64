package com.ace.eval.api;

import com.ace.eval.ledger.FaultLedger;
import com.ace.eval.ledger.LedgerModels;
import com.ace.eval.review.OperatorReviewService;
import com.ace.eval.task.TaskModels;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/ledger")
public class FaultLedgerController {
    private final FaultLedger faultLedger;
    private final OperatorReviewService reviewService;

    public FaultLedgerController(FaultLedger faultLedger, OperatorReviewService reviewService) {
        this.faultLedger = faultLedger;
        this.reviewService = reviewService;
    }

    @GetMapping("/dead-letters")
    public ResponseEntity<List<LedgerModels.LedgerEntry>> deadLetters(@RequestParam(required = false) String assignmentId) {
        return ResponseEntity.ok(faultLedger.listDeadLettered(assignmentId));
    }

    @GetMapping("/tasks/{taskId}")
    public ResponseEntity<List<LedgerModels.LedgerEntry>> history(@PathVariable String taskId) {
        return ResponseEntity.ok(faultLedger.history(taskId));
    }

    @PostMapping("/tasks/{taskId}/resubmit")
    public ResponseEntity<Void> resubmit(@PathVariable String taskId) {
        reviewService.resubmit(taskId);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/tasks/{taskId}/manual-score")
    public ResponseEntity<TaskModels.TaskOutcome> manualScore(@PathVariable String taskId, @RequestBody ManualScoreRequest request) {
        return ResponseEntity.ok(reviewService.manuallyScore(taskId, request.scores(), request.note()));
    }

    @PostMapping("/tasks/{taskId}/exclude")
    public ResponseEntity<Void> exclude(@PathVariable String taskId) {
        reviewService.exclude(taskId);
        return ResponseEntity.noContent().build();
    }

    public record ManualScoreRequest(Map<TaskModels.Dimension, Double> scores, String note) {}
}
