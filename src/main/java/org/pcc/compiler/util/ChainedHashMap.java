package org.pcc.compiler.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * A hash map that resolves collisions by separate chaining: every bucket holds a
 * singly-linked list of entries.
 * <p>
 * String keys are hashed with DJB2 ({@code h = 5381; h = h * 33 + c}), all other keys
 * with their {@link Object#hashCode()}. The table starts with {@value #INITIAL_CAPACITY}
 * buckets and doubles once the size exceeds three quarters of the capacity.
 * Null keys are rejected; null values are allowed.
 *
 * @param <K> The key type.
 * @param <V> The value type.
 */
public class ChainedHashMap<K, V> {

    static final int INITIAL_CAPACITY = 16;

    private static final class Entry<K, V> {
        final K key;
        V value;
        Entry<K, V> next;

        Entry(K key, V value, Entry<K, V> next) {
            this.key = key;
            this.value = value;
            this.next = next;
        }
    }

    private Entry<K, V>[] buckets;
    private int size;

    public ChainedHashMap() {
        this(INITIAL_CAPACITY);
    }

    /**
     * Creates a map with the given number of buckets.
     * @param initialCapacity The initial bucket count, at least 1.
     */
    public ChainedHashMap(int initialCapacity) {
        if (initialCapacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive: " + initialCapacity);
        }
        this.buckets = newTable(initialCapacity);
    }

    @SuppressWarnings("unchecked")
    private static <K, V> Entry<K, V>[] newTable(int capacity) {
        return (Entry<K, V>[]) new Entry[capacity];
    }

    /**
     * Computes the DJB2 hash of a string, using unsigned 32-bit arithmetic.
     * @param s The string to hash.
     * @return The hash as a non-negative long.
     */
    public static long djb2(String s) {
        long hash = 5381;
        for (int i = 0; i < s.length(); i++) {
            hash = ((hash << 5) + hash + s.charAt(i)) & 0xFFFFFFFFL;
        }
        return hash;
    }

    private int indexFor(Object key, int capacity) {
        long hash = key instanceof String s ? djb2(s) : (key.hashCode() & 0xFFFFFFFFL);
        return (int) (hash % capacity);
    }

    /**
     * Associates the value with the key, replacing any previous value.
     * @return The previous value, or null if the key was absent.
     */
    public V put(K key, V value) {
        Objects.requireNonNull(key, "key");
        int index = indexFor(key, buckets.length);
        for (Entry<K, V> e = buckets[index]; e != null; e = e.next) {
            if (e.key.equals(key)) {
                V old = e.value;
                e.value = value;
                return old;
            }
        }
        buckets[index] = new Entry<>(key, value, buckets[index]);
        size++;
        if (size > buckets.length * 3 / 4) {
            resize(buckets.length * 2);
        }
        return null;
    }

    public V get(Object key) {
        Entry<K, V> e = find(key);
        return e == null ? null : e.value;
    }

    public boolean containsKey(Object key) {
        return find(key) != null;
    }

    private Entry<K, V> find(Object key) {
        Objects.requireNonNull(key, "key");
        for (Entry<K, V> e = buckets[indexFor(key, buckets.length)]; e != null; e = e.next) {
            if (e.key.equals(key)) {
                return e;
            }
        }
        return null;
    }

    /**
     * Removes the mapping for the key.
     * @return The removed value, or null if the key was absent.
     */
    public V remove(Object key) {
        Objects.requireNonNull(key, "key");
        int index = indexFor(key, buckets.length);
        Entry<K, V> prev = null;
        for (Entry<K, V> e = buckets[index]; e != null; prev = e, e = e.next) {
            if (e.key.equals(key)) {
                if (prev == null) {
                    buckets[index] = e.next;
                } else {
                    prev.next = e.next;
                }
                size--;
                return e.value;
            }
        }
        return null;
    }

    private void resize(int newCapacity) {
        Entry<K, V>[] newBuckets = newTable(newCapacity);
        for (Entry<K, V> head : buckets) {
            Entry<K, V> e = head;
            while (e != null) {
                Entry<K, V> next = e.next;
                int index = indexFor(e.key, newCapacity);
                e.next = newBuckets[index];
                newBuckets[index] = e;
                e = next;
            }
        }
        buckets = newBuckets;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * @return The current number of buckets.
     */
    public int capacity() {
        return buckets.length;
    }

    /**
     * Removes all entries and shrinks the table back to its initial capacity.
     */
    public void clear() {
        buckets = newTable(INITIAL_CAPACITY);
        size = 0;
    }

    /**
     * @return A snapshot of all keys in bucket order.
     */
    public List<K> keys() {
        List<K> keys = new ArrayList<>(size);
        forEach((k, v) -> keys.add(k));
        return keys;
    }

    /**
     * @return A snapshot of all values in bucket order.
     */
    public List<V> values() {
        List<V> values = new ArrayList<>(size);
        forEach((k, v) -> values.add(v));
        return values;
    }

    public void forEach(BiConsumer<? super K, ? super V> action) {
        for (Entry<K, V> head : buckets) {
            for (Entry<K, V> e = head; e != null; e = e.next) {
                action.accept(e.key, e.value);
            }
        }
    }
}
