package hr.juren.conflator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

// ties go to the value seen first in the interval
final class ModePolicy<V> implements ConflationPolicy<V, MostFrequent<V>, Map<V, Long>> {

    @Override
    public Conflated<MostFrequent<V>, Map<V, Long>> init(V value) {
        Map<V, Long> counts = new LinkedHashMap<>();
        counts.put(value, 1L);
        return new Conflated<>(new MostFrequent<>(value, 1), counts);
    }

    @Override
    public Conflated<MostFrequent<V>, Map<V, Long>> merge(V value, Conflated<MostFrequent<V>, Map<V, Long>> previous) {
        var counts = previous.raw();
        var mode = previous.value();
        long count = counts.merge(value, 1L, Long::sum);
        if (count > mode.count()
                || count == mode.count() && seenBefore(counts, value, mode.value())) {
            mode = new MostFrequent<>(value, count);
        }
        return new Conflated<>(mode, counts);
    }

    @Override
    public Conflated<MostFrequent<V>, Map<V, Long>> onReset(Conflated<MostFrequent<V>, Map<V, Long>> closed) {
        return null;
    }

    @Override
    public String name() {
        return "ModeConflator";
    }

    // counts iterate in first-seen order
    private static <V> boolean seenBefore(Map<V, Long> counts, V candidate, V incumbent) {
        if (Objects.equals(candidate, incumbent))
            return false;
        for (V seen : counts.keySet()) {
            if (Objects.equals(seen, candidate))
                return true;
            if (Objects.equals(seen, incumbent))
                return false;
        }
        return false;
    }
}
