package io.github.galkahana.extractionrunner;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Durable form of a checkpoint, as written to disk.
 *
 * @param processedIds Ids of every completed task, failed ones included
 * @param failedIds Failed task id to its last error message
 * @param stats Counters at the time of writing
 * @param lastFlush Time of writing
 */
record CheckpointRecord(List<String> processedIds, Map<String, String> failedIds,
                        CheckpointStats stats, Instant lastFlush) {
}
