package hr.juren.conflator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

final class ReducerPolicy<V, C> implements ConflationPolicy<V, C, List<V>> {

    static final String DEFAULT_NAME = "ReducerConflator";

    private final BiFunction<? super V, ? super List<V>, ? extends C> reducer;
    private final String name;

    ReducerPolicy(BiFunction<? super V, ? super List<V>, ? extends C> reducer, String name) {
        this.reducer = Objects.requireNonNull(reducer);
        this.name = name == null ? DEFAULT_NAME : name;
    }

    @Override
    public Conflated<C, List<V>> init(V value) {
        return apply(value, new ArrayList<>());
    }

    @Override
    public Conflated<C, List<V>> merge(V value, Conflated<C, List<V>> previous) {
        return apply(value, previous.raw());
    }

    @Override
    public Conflated<C, List<V>> onReset(Conflated<C, List<V>> closed) {
        return null;
    }

    @Override
    public String name() {
        return name;
    }

    private Conflated<C, List<V>> apply(V value, List<V> past) {
        C conflated = reducer.apply(value, Collections.unmodifiableList(new ArrayList<>(past)));
        past.add(value);
        return new Conflated<>(conflated, past);
    }
}
