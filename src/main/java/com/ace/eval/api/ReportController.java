package com.ace.eval.api;

import com.ace.eval.aggregation.ReportModels;
import com.ace.eval.aggregation.ReportService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/reports")
public class ReportController {
    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping("/{assignmentId}/learners/{learnerId}")
    public ResponseEntity<ReportModels.Report> report(@PathVariable String assignmentId, @PathVariable String learnerId) {
        return ResponseEntity.ok(reportService.report(learnerId, assignmentId));
    }

    @GetMapping("/{assignmentId}/summary")
    public ResponseEntity<ReportModels.BatchSummary> summary(@PathVariable String assignmentId) {
        return ResponseEntity.ok(reportService.batchSummary(assignmentId));
    }
}
