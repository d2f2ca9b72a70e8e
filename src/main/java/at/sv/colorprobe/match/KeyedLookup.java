package at.sv.colorprobe.match;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * A key/value lookup that resolves duplicate keys according to a {@link DuplicateKeyPolicy} and counts how many
 * duplicates it has seen.
 */
public final class KeyedLookup<K, V> {

    private final Map<K, V> entries = new HashMap<>();
    private final DuplicateKeyPolicy policy;
    private int duplicateCount;

    public KeyedLookup(DuplicateKeyPolicy policy) {
        this.policy = policy;
    }

    public void put(K key, V value) {
        if (entries.containsKey(key)) {
            duplicateCount++;
            if (policy == DuplicateKeyPolicy.FIRST_WRITE_WINS) {
                return;
            }
        }
        entries.put(key, value);
    }

    public @Nullable V get(K key) {
        return entries.get(key);
    }

    public boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public int getDuplicateCount() {
        return duplicateCount;
    }
}
