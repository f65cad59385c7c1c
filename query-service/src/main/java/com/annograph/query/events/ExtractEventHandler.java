package com.annograph.query.events;

import com.annograph.aggregate.AggregateViewManager;
import com.annograph.query.service.DocumentQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ExtractEventHandler {

    private static final Logger log = LoggerFactory.getLogger(ExtractEventHandler.class);

    private final AggregateViewManager aggregateViewManager;
    private final DocumentQueryService documentQueryService;

    public ExtractEventHandler(AggregateViewManager aggregateViewManager, DocumentQueryService documentQueryService) {
        this.aggregateViewManager = aggregateViewManager;
        this.documentQueryService = documentQueryService;
    }

    /**
     * Drops the cached retrievals of the touched document and extract right away, then asks for
     * an aggregate rebuild. The rebuild invalidates again once the new view is in place.
     *
     * @return true when a rebuild was scheduled by this event
     */
    public boolean handle(ExtractEvent event) {
        if (!event.type().triggersRefresh()) {
            log.debug("event=extract_event_ignored type={} extract_id={}", event.type(), event.extractId());
            return false;
        }
        if (event.documentId() != null && event.extractId() != null) {
            documentQueryService.invalidate(event.documentId(), event.extractId());
        }
        boolean scheduled = aggregateViewManager.refresh(event.type().reason(), event.documentId(), event.extractId());
        log.info(
                "event=extract_event_handled type={} extract_id={} document_id={} datacell_id={} refresh_scheduled={}",
                event.type(),
                event.extractId(),
                event.documentId(),
                event.datacellId(),
                scheduled
        );
        return scheduled;
    }
}
