package hr.juren.conflator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

final class BatchPolicy<V> implements ConflationPolicy<V, List<V>, List<V>> {

    @Override
    public Conflated<List<V>, List<V>> init(V value) {
        List<V> buffer = new ArrayList<>();
        buffer.add(value);
        return new Conflated<>(snapshot(buffer), buffer);
    }

    @Override
    public Conflated<List<V>, List<V>> merge(V value, Conflated<List<V>, List<V>> previous) {
        var buffer = previous.raw();
        buffer.add(value);
        return new Conflated<>(snapshot(buffer), buffer);
    }

    @Override
    public Conflated<List<V>, List<V>> onReset(Conflated<List<V>, List<V>> closed) {
        return null;
    }

    @Override
    public String name() {
        return "BatchConflator";
    }

    private static <V> List<V> snapshot(List<V> buffer) {
        return Collections.unmodifiableList(new ArrayList<>(buffer));
    }
}
