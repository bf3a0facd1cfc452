package com.proofsmith.controller;

import com.proofsmith.orchestrator.ProofOrchestrator;
import com.proofsmith.orchestrator.ProofSolution;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/prove")
public class ProofController {

    private final ProofOrchestrator orchestrator;

    public ProofController(ProofOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/run")
    public ResponseEntity<Map<String, String>> prove(
            @RequestBody Map<String, String> request
    ) {

        String description = request.get("description");
        String template    = request.get("template");

        if (description == null || description.isBlank()
                || template == null || template.isBlank()) {
            return ResponseEntity.badRequest().build();
        }

        ProofSolution solution = orchestrator.solve(description, template);

        return ResponseEntity.ok(solution.toMap());
    }
}
