package com.proofsmith.controller;

import com.proofsmith.benchmark.BenchmarkRunner;
import com.proofsmith.benchmark.BenchmarkSummary;
import com.proofsmith.benchmark.TaskEvaluation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/benchmark")
public class BenchmarkController {

    private final BenchmarkRunner runner;

    public BenchmarkController(BenchmarkRunner runner) {
        this.runner = runner;
    }

    /** Body {@code {"task": "task_id_0"}} runs one task; an empty body runs the whole suite. */
    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> run(
            @RequestBody(required = false) Map<String, String> request
    ) {

        String taskId = request != null ? request.get("task") : null;

        List<TaskEvaluation> evaluations;
        if (taskId != null && !taskId.isBlank()) {
            TaskEvaluation evaluation = runner.runTask(taskId.trim());
            if (evaluation == null) {
                return ResponseEntity.notFound().build();
            }
            evaluations = List.of(evaluation);
        } else {
            evaluations = runner.runAll();
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("evaluations", evaluations);
        body.put("summary",     BenchmarkSummary.of(evaluations));
        return ResponseEntity.ok(body);
    }
}
