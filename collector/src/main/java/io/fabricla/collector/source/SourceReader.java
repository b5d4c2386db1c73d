package io.fabricla.collector.source;

import io.fabricla.collector.model.CollectionWindow;
import io.fabricla.collector.model.DetailLevel;
import io.fabricla.collector.model.EntityRef;
import io.fabricla.collector.model.RawRecord;
import io.fabricla.core.Source;

/**
 * Opens the record sequence of one entity over a window. Nothing is fetched until the returned source is polled.
 */
public interface SourceReader {
    Source<RawRecord> read(EntityRef entity, CollectionWindow window, DetailLevel detail);
}
