package com.parleysystems.routing;

import com.parleysystems.message.AgentId;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps topic names to the agents subscribed to them.
 * Membership only; delivery is done by the router.
 */
class TopicRegistry {

    private final ConcurrentHashMap<String, Set<AgentId>> subscribers = new ConcurrentHashMap<>();

    boolean subscribe(String topic, AgentId agentId) {
        Objects.requireNonNull(topic, "topic cannot be null");
        Objects.requireNonNull(agentId, "agentId cannot be null");
        return subscribers.computeIfAbsent(topic, t -> ConcurrentHashMap.newKeySet()).add(agentId);
    }

    boolean unsubscribe(String topic, AgentId agentId) {
        boolean[] removed = {false};
        subscribers.computeIfPresent(topic, (t, members) -> {
            removed[0] = members.remove(agentId);
            return members.isEmpty() ? null : members;
        });
        return removed[0];
    }

    /**
     * Removes the agent from every topic.
     *
     * @return the number of topics the agent was removed from
     */
    int unsubscribeAll(AgentId agentId) {
        int count = 0;
        for (String topic : subscribers.keySet()) {
            if (unsubscribe(topic, agentId)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Snapshot of a topic's subscribers, sorted by id so fan-out order is stable.
     */
    Set<AgentId> subscribers(String topic) {
        Set<AgentId> members = subscribers.get(topic);
        if (members == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(new TreeSet<>(members));
    }

    Set<String> topics() {
        return Collections.unmodifiableSet(new TreeSet<>(subscribers.keySet()));
    }
}
