package hr.juren.conflator;

import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Factory methods for containers with the built-in policies.
 */
public final class Conflators {

    private Conflators() {
    }

    public static <K, V, C, R> ConflatedContainer<K, V, C, R> create(ConflationPolicy<V, C, R> policy) {
        return new ConflatedContainer<>(policy);
    }

    /** Keeps the latest value written. */
    public static <K, V> ConflatedContainer<K, V, V, Void> lastValue() {
        return new ConflatedContainer<>(new LastValuePolicy<>());
    }

    public static <K, V extends Comparable<? super V>> ConflatedContainer<K, V, Ohlc<V>, Void> ohlc() {
        return new ConflatedContainer<>(new OhlcPolicy<V>());
    }

    public static <K, V extends Number> ConflatedContainer<K, V, Double, ?> mean() {
        return new ConflatedContainer<>(new MeanPolicy<V>());
    }

    public static <K, V> ConflatedContainer<K, V, List<V>, List<V>> batch() {
        return new ConflatedContainer<>(new BatchPolicy<>());
    }

    public static <K, V> ConflatedContainer<K, V, MostFrequent<V>, Map<V, Long>> mode() {
        return new ConflatedContainer<>(new ModePolicy<>());
    }

    public static <K, V, C> ConflatedContainer<K, V, C, List<V>> reducer(
            BiFunction<? super V, ? super List<V>, ? extends C> reducer) {
        return reducer(reducer, null);
    }

    /**
     * @param name shown by {@link ConflatedContainer#describe()}; {@code null} for the default
     */
    public static <K, V, C> ConflatedContainer<K, V, C, List<V>> reducer(
            BiFunction<? super V, ? super List<V>, ? extends C> reducer, String name) {
        return new ConflatedContainer<>(new ReducerPolicy<>(reducer, name));
    }
}
