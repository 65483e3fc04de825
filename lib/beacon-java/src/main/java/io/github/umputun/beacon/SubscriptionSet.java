package io.github.umputun.beacon;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Subscribed channels and groups, each with a presence flag, plus per-channel presence state.
 * Insertion order is kept so request paths are deterministic. All methods are atomic.
 */
final class SubscriptionSet {

    static final String PRESENCE_SUFFIX = "-pnpres";

    private final Map<String, Boolean> channels = new LinkedHashMap<>();
    private final Map<String, Boolean> groups = new LinkedHashMap<>();
    private final Map<String, JsonElement> state = new LinkedHashMap<>();
    private long version;

    /**
     * Adds channels and groups. Names ending in -pnpres are added as their base name with presence on.
     * Re-adding an existing name only upgrades its presence flag.
     *
     * @return names that were not subscribed before
     */
    synchronized SubscriptionChange add(Collection<String> channelNames, Collection<String> groupNames,
                                        boolean withPresence) {
        List<String> before = polledNames();
        List<String> addedChannels = addAll(channels, channelNames, withPresence);
        List<String> addedGroups = addAll(groups, groupNames, withPresence);
        if (!before.equals(polledNames())) {
            version++;
        }
        return SubscriptionChange.subscribed(addedChannels, addedGroups);
    }

    /**
     * Removes channels and groups together with their presence state.
     *
     * @return names that were actually subscribed
     */
    synchronized SubscriptionChange remove(Collection<String> channelNames, Collection<String> groupNames) {
        List<String> removedChannels = removeAll(channels, channelNames);
        List<String> removedGroups = removeAll(groups, groupNames);
        removedChannels.forEach(state::remove);
        SubscriptionChange change = SubscriptionChange.unsubscribed(removedChannels, removedGroups);
        if (!change.isEmpty()) {
            version++;
        }
        return change;
    }

    synchronized SubscriptionChange removeAll() {
        SubscriptionChange change = SubscriptionChange.unsubscribed(
                new ArrayList<>(channels.keySet()), new ArrayList<>(groups.keySet()));
        channels.clear();
        groups.clear();
        state.clear();
        if (!change.isEmpty()) {
            version++;
        }
        return change;
    }

    /**
     * Turns presence off for the given names, keeping the subscriptions.
     *
     * @return presence names (with -pnpres) that stopped being polled
     */
    synchronized SubscriptionChange removePresence(Collection<String> channelNames, Collection<String> groupNames) {
        List<String> removedChannels = clearPresence(channels, channelNames);
        List<String> removedGroups = clearPresence(groups, groupNames);
        SubscriptionChange change = SubscriptionChange.unsubscribed(removedChannels, removedGroups);
        if (!change.isEmpty()) {
            version++;
        }
        return change;
    }

    /**
     * Replaces presence state of the given subscribed channels. JSON null removes the state.
     *
     * @return channels whose state was updated
     */
    synchronized List<String> putState(Collection<String> channelNames, JsonElement value) {
        List<String> updated = new ArrayList<>();
        for (String name : channelNames) {
            String channel = trimPresence(name);
            if (!channels.containsKey(channel)) {
                continue;
            }
            if (value == null || value.isJsonNull()) {
                state.remove(channel);
            } else {
                state.put(channel, value.deepCopy());
            }
            updated.add(channel);
        }
        if (!updated.isEmpty()) {
            version++;
        }
        return updated;
    }

    synchronized Snapshot snapshot() {
        JsonObject stateCopy = new JsonObject();
        state.forEach((k, v) -> stateCopy.add(k, v.deepCopy()));
        return new Snapshot(
                new ArrayList<>(channels.keySet()),
                new ArrayList<>(groups.keySet()),
                expand(channels),
                expand(groups),
                stateCopy);
    }

    /**
     * Returns a counter that changes whenever the polled names or the presence state change.
     */
    synchronized long version() {
        return version;
    }

    synchronized boolean isEmpty() {
        return channels.isEmpty() && groups.isEmpty();
    }

    synchronized List<String> channels() {
        return List.copyOf(channels.keySet());
    }

    synchronized List<String> groups() {
        return List.copyOf(groups.keySet());
    }

    static String presenceName(String name) {
        return name + PRESENCE_SUFFIX;
    }

    static boolean isPresenceName(String name) {
        return name != null && name.endsWith(PRESENCE_SUFFIX);
    }

    static String trimPresence(String name) {
        if (isPresenceName(name)) {
            return name.substring(0, name.length() - PRESENCE_SUFFIX.length());
        }
        return name;
    }

    private List<String> polledNames() {
        List<String> names = expand(channels);
        names.addAll(expand(groups));
        return names;
    }

    private static List<String> addAll(Map<String, Boolean> target, Collection<String> names, boolean withPresence) {
        List<String> added = new ArrayList<>();
        for (String raw : names) {
            if (raw == null || raw.isEmpty()) {
                continue;
            }
            boolean presence = withPresence || isPresenceName(raw);
            String name = trimPresence(raw);
            Boolean existing = target.get(name);
            if (existing == null) {
                target.put(name, presence);
                added.add(name);
            } else if (presence && !existing) {
                target.put(name, true);
            }
        }
        return added;
    }

    private static List<String> removeAll(Map<String, Boolean> target, Collection<String> names) {
        List<String> removed = new ArrayList<>();
        for (String raw : names) {
            String name = trimPresence(raw);
            if (target.remove(name) != null) {
                removed.add(name);
            }
        }
        return removed;
    }

    private static List<String> clearPresence(Map<String, Boolean> target, Collection<String> names) {
        List<String> cleared = new ArrayList<>();
        for (String raw : names) {
            String name = trimPresence(raw);
            if (Boolean.TRUE.equals(target.get(name))) {
                target.put(name, false);
                cleared.add(presenceName(name));
            }
        }
        return cleared;
    }

    private static List<String> expand(Map<String, Boolean> source) {
        List<String> result = new ArrayList<>();
        source.forEach((name, presence) -> {
            result.add(name);
            if (presence) {
                result.add(presenceName(name));
            }
        });
        return result;
    }

    /**
     * Immutable copy of the set taken under the lock.
     */
    static final class Snapshot {
        private final List<String> channels;
        private final List<String> groups;
        private final List<String> allChannels;
        private final List<String> allGroups;
        private final JsonObject state;

        Snapshot(List<String> channels, List<String> groups, List<String> allChannels, List<String> allGroups,
                 JsonObject state) {
            this.channels = Collections.unmodifiableList(channels);
            this.groups = Collections.unmodifiableList(groups);
            this.allChannels = Collections.unmodifiableList(allChannels);
            this.allGroups = Collections.unmodifiableList(allGroups);
            this.state = state;
        }

        /** subscribed channel names without presence twins */
        List<String> channels() {
            return channels;
        }

        List<String> groups() {
            return groups;
        }

        /** channel names as polled, including -pnpres twins */
        List<String> allChannels() {
            return allChannels;
        }

        List<String> allGroups() {
            return allGroups;
        }

        JsonObject state() {
            return state;
        }

        boolean isEmpty() {
            return channels.isEmpty() && groups.isEmpty();
        }
    }
}
