package transit.sentinel.ingestor.decoder;

/**
 * @param entities entities in the message
 * @param skipped entities that yielded no record (no position, no trip id, or neither payload)
 * @param tripUpdates stop-level records, after fan-out
 */
public record DecodeStats(int entities, int positions, int tripUpdates, int skipped) {
}
