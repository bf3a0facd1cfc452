package com.proofsmith.controller;

import com.proofsmith.core.retrieval.VectorIndex;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/index")
public class IndexController {

    private final VectorIndex index;

    public IndexController(VectorIndex index) {
        this.index = index;
    }

    @PostMapping("/documents")
    public ResponseEntity<Map<String, Object>> addDocument(
            @RequestBody Map<String, String> request
    ) {

        String content = request.get("content");

        if (content == null || content.isBlank()) {
            return ResponseEntity.badRequest().build();
        }

        int added = index.addDocument(content, request.get("source"));

        return ResponseEntity.ok(Map.of("chunks", added, "total", index.size()));
    }
}
