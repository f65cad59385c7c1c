package com.annograph.query.controller;

import com.annograph.query.model.DatacellRecord;
import com.annograph.query.model.ExtractRecord;
import com.annograph.query.permission.UserResolver;
import com.annograph.query.service.ExtractQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/extracts")
public class ExtractController {

    private final ExtractQueryService extractQueryService;
    private final UserResolver userResolver;

    public ExtractController(ExtractQueryService extractQueryService, UserResolver userResolver) {
        this.extractQueryService = extractQueryService;
        this.userResolver = userResolver;
    }

    @GetMapping
    public List<ExtractRecord> extracts(
            @RequestParam(value = "corpusId", required = false) Long corpusId,
            @RequestHeader(value = UserResolver.USER_HEADER, required = false) String userId
    ) {
        return extractQueryService.visibleExtracts(userResolver.resolve(userId), corpusId);
    }

    @GetMapping("/{extractId}/datacells")
    public List<DatacellRecord> datacells(
            @PathVariable("extractId") long extractId,
            @RequestParam(value = "documentId", required = false) Long documentId,
            @RequestHeader(value = UserResolver.USER_HEADER, required = false) String userId
    ) {
        return extractQueryService.extractDatacells(userResolver.resolve(userId), extractId, documentId);
    }
}
