package io.github.umputun.beacon;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Remembers the keys of the last N envelopes. Used only from the subscribe thread.
 */
final class DuplicateFilter {

    private final int capacity;
    private final Set<String> keys = new LinkedHashSet<>();

    DuplicateFilter(int capacity) {
        this.capacity = capacity;
    }

    /**
     * Records a key.
     *
     * @return true if the key was already in the window
     */
    boolean seen(String key) {
        if (keys.contains(key)) {
            return true;
        }
        keys.add(key);
        if (keys.size() > capacity) {
            Iterator<String> oldest = keys.iterator();
            oldest.next();
            oldest.remove();
        }
        return false;
    }

    void clear() {
        keys.clear();
    }

    int size() {
        return keys.size();
    }
}
