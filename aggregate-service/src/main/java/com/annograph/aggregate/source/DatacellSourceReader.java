package com.annograph.aggregate.source;

import java.util.List;

/**
 * Read access to datacell provenance. Both methods hit the backing store directly.
 */
public interface DatacellSourceReader {

    List<DatacellSourceLink> loadAllSourceLinks();

    List<DatacellSourceLink> loadSourceLinks(long extractId, long documentId);
}
