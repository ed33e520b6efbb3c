package com.healthtech.olap.etl.source;

import com.healthtech.olap.data.source.SourceSnapshot;

/**
 * Extracts the normalized OLTP tables a run needs. Implementations only read; the source is never written.
 */
public interface OltpSourceReader {

    SourceSnapshot read();
}
