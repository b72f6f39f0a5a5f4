package hr.juren.conflator;

public record Ohlc<V>(V open, V high, V low, V close) {

    static <V> Ohlc<V> of(V value) {
        return new Ohlc<>(value, value, value, value);
    }
}
