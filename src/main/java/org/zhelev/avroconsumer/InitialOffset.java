package org.zhelev.avroconsumer;

/**
 * Where a consumer group starts reading a partition that has no usable committed offset.
 */
public enum InitialOffset {

    OLDEST("earliest"),
    NEWEST("latest"),
    /** Only resume from committed offsets; polling fails for partitions without one. */
    COMMITTED("none");

    private final String autoOffsetReset;

    InitialOffset(String autoOffsetReset) {
        this.autoOffsetReset = autoOffsetReset;
    }

    /**
     * @return the value for Kafka's {@code auto.offset.reset}
     */
    public String getAutoOffsetReset() {
        return autoOffsetReset;
    }
}
