package io.fabricla.collector.normalize;

import io.fabricla.collector.error.NormalizationException;
import io.fabricla.collector.model.NormalizedRecord;
import io.fabricla.collector.model.RawRecord;
import io.fabricla.collector.model.StreamSchema;
import io.fabricla.collector.model.StreamSchemas;
import io.fabricla.core.Transform;

import java.util.List;
import java.util.Set;

/**
 * Maps a tagged raw record onto its stream's fixed schema. Records of streams the run does not collect map to
 * nothing. No I/O.
 */
public class RecordNormalizer implements Transform<RawRecord, NormalizedRecord> {
    private final Set<String> enabledStreams;

    public RecordNormalizer(Set<String> enabledStreams) {
        this.enabledStreams = Set.copyOf(enabledStreams);
    }

    @Override
    public List<NormalizedRecord> apply(RawRecord raw) throws NormalizationException {
        StreamSchema schema = StreamSchemas.forKind(raw.kind());
        if (!enabledStreams.contains(schema.stream())) return List.of();
        NormalizedRecord.Builder out = schema.newRecord();
        try {
            RecordMapping.forKind(raw.kind()).map(raw, out);
        } catch (IllegalArgumentException e) {
            throw new NormalizationException(raw.kind() + " record for " + raw.entity() + " does not fit " + schema.stream() + ": " + e.getMessage(), e);
        }
        return List.of(out.build());
    }
}
