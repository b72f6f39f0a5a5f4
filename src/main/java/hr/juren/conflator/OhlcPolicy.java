package hr.juren.conflator;

// the bar is carried over a reset and keeps extending
final class OhlcPolicy<V extends Comparable<? super V>> implements ConflationPolicy<V, Ohlc<V>, Void> {

    @Override
    public Conflated<Ohlc<V>, Void> init(V value) {
        return Conflated.of(Ohlc.of(requireOrderable(value)));
    }

    @Override
    public Conflated<Ohlc<V>, Void> merge(V value, Conflated<Ohlc<V>, Void> previous) {
        requireOrderable(value);
        var bar = previous.value();
        V high = value.compareTo(bar.high()) > 0 ? value : bar.high();
        V low = value.compareTo(bar.low()) < 0 ? value : bar.low();
        return Conflated.of(new Ohlc<>(bar.open(), high, low, value));
    }

    @Override
    public String name() {
        return "OHLCConflator";
    }

    private static <V> V requireOrderable(V value) {
        if (value == null)
            throw new TypeMismatchException("OHLC needs orderable values, got null");
        return value;
    }
}
