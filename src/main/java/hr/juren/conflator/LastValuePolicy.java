package hr.juren.conflator;

final class LastValuePolicy<V> implements ConflationPolicy<V, V, Void> {

    @Override
    public Conflated<V, Void> init(V value) {
        return Conflated.of(value);
    }

    @Override
    public Conflated<V, Void> merge(V value, Conflated<V, Void> previous) {
        return Conflated.of(value);
    }

    @Override
    public String name() {
        return "Conflator";
    }
}
