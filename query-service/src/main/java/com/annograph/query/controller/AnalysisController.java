package com.annograph.query.controller;

import com.annograph.query.model.AnalysisRecord;
import com.annograph.query.model.AnnotationRecord;
import com.annograph.query.permission.UserResolver;
import com.annograph.query.service.AnalysisQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/analyses")
public class AnalysisController {

    private final AnalysisQueryService analysisQueryService;
    private final UserResolver userResolver;

    public AnalysisController(AnalysisQueryService analysisQueryService, UserResolver userResolver) {
        this.analysisQueryService = analysisQueryService;
        this.userResolver = userResolver;
    }

    @GetMapping
    public List<AnalysisRecord> analyses(
            @RequestParam(value = "corpusId", required = false) Long corpusId,
            @RequestHeader(value = UserResolver.USER_HEADER, required = false) String userId
    ) {
        return analysisQueryService.visibleAnalyses(userResolver.resolve(userId), corpusId);
    }

    @GetMapping("/{analysisId}/annotations")
    public List<AnnotationRecord> annotations(
            @PathVariable("analysisId") long analysisId,
            @RequestParam(value = "documentId", required = false) Long documentId,
            @RequestHeader(value = UserResolver.USER_HEADER, required = false) String userId
    ) {
        return analysisQueryService.analysisAnnotations(userResolver.resolve(userId), analysisId, documentId);
    }
}
