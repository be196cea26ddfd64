package com.ace.eval.api;

import com.ace.eval.aggregation.ReportModels;
import com.ace.eval.aggregation.ReportService;
import com.ace.eval.execution.ExecutionModels;
import com.ace.eval.execution.TaskDispatcher;
import com.ace.eval.task.TaskModels.Task;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api")
public class TaskController {
    private final TaskDispatcher dispatcher;
    private final ReportService reportService;

    public TaskController(TaskDispatcher dispatcher, ReportService reportService) {
        this.dispatcher = dispatcher;
        this.reportService = reportService;
    }

    @PostMapping("/tasks")
    public ResponseEntity<ExecutionModels.SubmitAck> submit(@RequestBody TaskBatchRequest request) {
        if (request == null || request.tasks() == null) {
            throw new IllegalArgumentException("tasks must be provided");
        }
        int accepted = 0;
        List<ExecutionModels.SubmitRejection> rejected = new ArrayList<>();
        for (Task task : request.tasks()) {
            try {
                dispatcher.submit(task);
                accepted++;
            } catch (IllegalStateException e) {
                rejected.add(new ExecutionModels.SubmitRejection(task.taskId(), e.getMessage()));
            }
        }
        return ResponseEntity.accepted().body(new ExecutionModels.SubmitAck(accepted, rejected));
    }

    @GetMapping("/lanes")
    public ResponseEntity<List<ExecutionModels.LaneStatus>> lanes() {
        return ResponseEntity.ok(dispatcher.status());
    }

    @PostMapping("/assignments/{assignmentId}/learners/{learnerId}/manifest")
    public ResponseEntity<ReportModels.AssignmentManifest> manifest(@PathVariable String assignmentId,
                                                                   @PathVariable String learnerId,
                                                                   @RequestBody ReportModels.ManifestRequest request) {
        return ResponseEntity.ok(reportService.registerManifest(assignmentId, learnerId, request.expectedTaskIds()));
    }

    @PostMapping("/assignments/{assignmentId}/withdraw")
    public ResponseEntity<ReportModels.WithdrawalAck> withdraw(@PathVariable String assignmentId) {
        return ResponseEntity.ok(reportService.withdraw(assignmentId));
    }

    public record TaskBatchRequest(List<Task> tasks) {}
}
