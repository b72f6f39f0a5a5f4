package hr.juren.conflator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Keyed store that collapses repeated writes per key with a {@link ConflationPolicy}
 * and exposes only the keys written since the last {@link #reset()}.
 * <p>
 * Not thread safe. A host sharing an instance between a producer and a consumer
 * has to run {@code set} and the drain-then-reset cycle under the same lock.
 */
public final class ConflatedContainer<K, V, C, R> implements Iterable<K> {

    private static final Logger log = LoggerFactory.getLogger(ConflatedContainer.class);

    private final ConflationPolicy<V, C, R> policy;
    private final Map<K, C> values = new LinkedHashMap<>();
    private final Set<K> dirty = new LinkedHashSet<>();
    // merge basis: current state of dirty keys, carried state of clean ones
    private final Map<K, Conflated<C, R>> states = new HashMap<>();

    public ConflatedContainer(ConflationPolicy<V, C, R> policy) {
        this.policy = Objects.requireNonNull(policy);
    }

    public void set(K key, V value) {
        var basis = states.get(key);
        Conflated<C, R> next;
        try {
            next = basis == null ? policy.init(value) : policy.merge(value, basis);
        } catch (ClassCastException e) {
            log.debug("conflator.type_mismatch name={} key={} error={}", policy.name(), key, e.getMessage());
            throw new TypeMismatchException(
                    "%s cannot conflate %s for key %s".formatted(policy.name(), value, key), e);
        }
        Objects.requireNonNull(next, "policy returned no state");

        states.put(key, next);
        values.put(key, next.value());
        dirty.add(key);
    }

    public C get(K key) {
        if (!dirty.contains(key))
            throw new KeyNotDirtyException(key, values.containsKey(key));
        return values.get(key);
    }

    public boolean contains(K key) {
        return dirty.contains(key);
    }

    public boolean isDirty(K key) {
        return contains(key);
    }

    public void delete(K key) {
        if (!dirty.remove(key))
            throw new KeyNotFoundException(key);
        values.remove(key);
        states.remove(key);
        log.debug("conflator.delete name={} key={}", policy.name(), key);
    }

    public int size() {
        return dirty.size();
    }

    public boolean isEmpty() {
        return dirty.isEmpty();
    }

    public Iterable<K> keys() {
        return snapshot(Function.identity());
    }

    public Iterable<C> values() {
        return snapshot(values::get);
    }

    public Iterable<Map.Entry<K, C>> items() {
        return snapshot(key -> new AbstractMap.SimpleImmutableEntry<>(key, values.get(key)));
    }

    @Override
    public Iterator<K> iterator() {
        return keys().iterator();
    }

    /**
     * Closes the current interval. No key stays dirty; every closing entry keeps
     * whatever raw state {@link ConflationPolicy#onReset} hands back.
     */
    public void reset() {
        int closed = dirty.size();
        // ask the policy for every key before touching state, a failing hook leaves the interval open
        Map<K, Conflated<C, R>> carried = new HashMap<>();
        for (K key : dirty) {
            carried.put(key, policy.onReset(states.get(key)));
        }
        carried.forEach((key, state) -> {
            if (state == null) {
                states.remove(key);
            } else {
                states.put(key, state);
            }
        });
        dirty.clear();
        log.debug("conflator.reset name={} closed={} entries={}", policy.name(), closed, values.size());
    }

    /**
     * Hands every dirty item to {@code consumer}, then resets.
     *
     * @return number of items handed over
     */
    public int drain(BiConsumer<? super K, ? super C> consumer) {
        Objects.requireNonNull(consumer);
        int drained = 0;
        for (var item : items()) {
            consumer.accept(item.getKey(), item.getValue());
            drained++;
        }
        reset();
        log.debug("conflator.drain name={} drained={}", policy.name(), drained);
        return drained;
    }

    public void clear() {
        int entries = values.size();
        dirty.clear();
        values.clear();
        states.clear();
        log.debug("conflator.clear name={} entries={}", policy.name(), entries);
    }

    /**
     * Every value ever written and not deleted, dirty or not.
     */
    public Map<K, C> data() {
        return Collections.unmodifiableMap(values);
    }

    public ContainerSummary describe() {
        return new ContainerSummary(policy.name(), dirty.size(), values.size());
    }

    @Override
    public String toString() {
        return describe().toString();
    }

    private <T> Iterable<T> snapshot(Function<K, T> mapper) {
        List<K> keys = new ArrayList<>(dirty);
        return () -> new SnapshotIterator<>(keys, mapper);
    }

    private final class SnapshotIterator<T> implements Iterator<T> {
        private final List<K> keys;
        private final Function<K, T> mapper;
        private int idx;
        private K next;
        private boolean hasNext;

        SnapshotIterator(List<K> keys, Function<K, T> mapper) {
            this.keys = keys;
            this.mapper = mapper;
            advance();
        }

        // skips keys deleted or reset after the snapshot was taken
        private void advance() {
            hasNext = false;
            while (idx < keys.size()) {
                K candidate = keys.get(idx++);
                if (dirty.contains(candidate)) {
                    next = candidate;
                    hasNext = true;
                    return;
                }
            }
        }

        @Override
        public boolean hasNext() {
            return hasNext;
        }

        @Override
        public T next() {
            if (!hasNext)
                throw new NoSuchElementException();
            T result = mapper.apply(next);
            advance();
            return result;
        }
    }
}
