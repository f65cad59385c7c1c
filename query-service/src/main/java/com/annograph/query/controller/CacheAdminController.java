package com.annograph.query.controller;

import com.annograph.query.model.InvalidationResult;
import com.annograph.query.service.DocumentQueryService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/cache")
public class CacheAdminController {

    private final DocumentQueryService documentQueryService;

    public CacheAdminController(DocumentQueryService documentQueryService) {
        this.documentQueryService = documentQueryService;
    }

    @PostMapping("/invalidate")
    public InvalidationResult invalidate(
            @RequestParam("documentId") long documentId,
            @RequestParam(value = "extractId", required = false) Long extractId
    ) {
        long removed = documentQueryService.invalidate(documentId, extractId);
        return new InvalidationResult(documentId, extractId, removed);
    }
}
