package transit.sentinel.ingestor.pipeline;

/**
 * Steps of one cycle, in execution order. A cycle that fails resumes at the step that failed.
 */
public enum Stage {
    APPEND_RAW,
    RECORD_ALERTS,
    PUBLISH,
    PROMOTE,
    AGGREGATE,
    DONE;

    Stage next() {
        return this == DONE ? DONE : values()[ordinal() + 1];
    }
}
