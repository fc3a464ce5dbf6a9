package org.zhelev.avroconsumer.transport;

import org.apache.kafka.common.TopicPartition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A change of the partitions owned by this group member.
 */
public final class GroupNotification {

    public enum Type {
        /** Partitions are being revoked; {@code released} lists them. */
        REBALANCE_START,
        /** Partitions were assigned; {@code claimed} lists the new ones, {@code current} the whole assignment. */
        REBALANCE_OK,
        /** Partitions were lost without an orderly revoke, e.g. after a session timeout. */
        REBALANCE_ERROR
    }

    private final Type type;
    private final Map<String, List<Integer>> claimed;
    private final Map<String, List<Integer>> released;
    private final Map<String, List<Integer>> current;

    public GroupNotification(Type type, Map<String, List<Integer>> claimed, Map<String, List<Integer>> released,
                             Map<String, List<Integer>> current) {
        this.type = type;
        this.claimed = Collections.unmodifiableMap(claimed);
        this.released = Collections.unmodifiableMap(released);
        this.current = Collections.unmodifiableMap(current);
    }

    public static GroupNotification of(Type type, Collection<TopicPartition> claimed,
                                       Collection<TopicPartition> released, Collection<TopicPartition> current) {
        return new GroupNotification(type, byTopic(claimed), byTopic(released), byTopic(current));
    }

    static Map<String, List<Integer>> byTopic(Collection<TopicPartition> partitions) {
        Map<String, List<Integer>> byTopic = new TreeMap<>();
        for (TopicPartition partition : partitions) {
            byTopic.computeIfAbsent(partition.topic(), topic -> new ArrayList<>()).add(partition.partition());
        }
        byTopic.replaceAll((topic, list) -> {
            Collections.sort(list);
            return Collections.unmodifiableList(list);
        });
        return byTopic;
    }

    public Type getType() {
        return type;
    }

    public Map<String, List<Integer>> getClaimed() {
        return claimed;
    }

    public Map<String, List<Integer>> getReleased() {
        return released;
    }

    public Map<String, List<Integer>> getCurrent() {
        return current;
    }

    @Override
    public String toString() {
        return "GroupNotification{" + type + ", claimed=" + claimed + ", released=" + released + ", current=" + current + '}';
    }
}
