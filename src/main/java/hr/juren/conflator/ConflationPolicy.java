package hr.juren.conflator;

/**
 * Strategy deciding how repeated writes for one key collapse into a single value.
 *
 * @param <V> type written by the producer
 * @param <C> conflated type handed to the consumer
 * @param <R> raw state kept next to the conflated value
 */
public interface ConflationPolicy<V, C, R> {

    Conflated<C, R> init(V value);       // first write of a key in an interval

    Conflated<C, R> merge(V value, Conflated<C, R> previous); // every later write

    /**
     * Called by {@link ConflatedContainer#reset()} for every entry that was dirty.
     * The returned state is what the next write of the key merges into; {@code null}
     * makes that write start over with {@link #init(Object)}.
     */
    default Conflated<C, R> onReset(Conflated<C, R> closed) {
        return closed;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
