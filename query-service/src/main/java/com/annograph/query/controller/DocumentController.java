package com.annograph.query.controller;

import com.annograph.aggregate.view.AnnotationSummary;
import com.annograph.query.filter.FilterSet;
import com.annograph.query.model.AnnotationRecord;
import com.annograph.query.model.RelationshipRecord;
import com.annograph.query.model.RelationshipSummary;
import com.annograph.query.permission.UserResolver;
import com.annograph.query.service.DocumentQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/documents")
public class DocumentController {

    private final DocumentQueryService documentQueryService;
    private final UserResolver userResolver;

    public DocumentController(DocumentQueryService documentQueryService, UserResolver userResolver) {
        this.documentQueryService = documentQueryService;
        this.userResolver = userResolver;
    }

    @GetMapping("/{documentId}/annotations")
    public List<AnnotationRecord> annotations(
            @PathVariable("documentId") long documentId,
            @RequestParam(value = "corpusId", required = false) Long corpusId,
            @RequestParam(value = "pages", required = false) List<Integer> pages,
            @RequestParam(value = "structural", required = false) Boolean structural,
            @RequestParam(value = "analysisId", required = false) Long analysisId,
            @RequestParam(value = "extractId", required = false) Long extractId,
            @RequestHeader(value = UserResolver.USER_HEADER, required = false) String userId
    ) {
        FilterSet filters = FilterSet.of(corpusId, pages, structural, analysisId, extractId);
        return documentQueryService.fetchDocumentAnnotations(documentId, userResolver.resolve(userId), filters);
    }

    @GetMapping("/{documentId}/relationships")
    public List<RelationshipRecord> relationships(
            @PathVariable("documentId") long documentId,
            @RequestParam(value = "corpusId", required = false) Long corpusId,
            @RequestParam(value = "pages", required = false) List<Integer> pages,
            @RequestParam(value = "structural", required = false) Boolean structural,
            @RequestParam(value = "analysisId", required = false) Long analysisId,
            @RequestParam(value = "extractId", required = false) Long extractId,
            @RequestParam(value = "strictExtractMode", defaultValue = "false") boolean strictExtractMode,
            @RequestHeader(value = UserResolver.USER_HEADER, required = false) String userId
    ) {
        FilterSet filters = FilterSet.of(corpusId, pages, structural, analysisId, extractId, strictExtractMode);
        return documentQueryService.fetchDocumentRelationships(documentId, userResolver.resolve(userId), filters);
    }

    @GetMapping("/{documentId}/extracts/{extractId}/summary")
    public AnnotationSummary extractSummary(
            @PathVariable("documentId") long documentId,
            @PathVariable("extractId") long extractId,
            @RequestHeader(value = UserResolver.USER_HEADER, required = false) String userId
    ) {
        return documentQueryService.getExtractAnnotationSummary(documentId, extractId, userResolver.resolve(userId));
    }

    @GetMapping("/{documentId}/corpuses/{corpusId}/relationship-summary")
    public RelationshipSummary relationshipSummary(
            @PathVariable("documentId") long documentId,
            @PathVariable("corpusId") long corpusId,
            @RequestHeader(value = UserResolver.USER_HEADER, required = false) String userId
    ) {
        return documentQueryService.getRelationshipSummary(documentId, corpusId, userResolver.resolve(userId));
    }
}
