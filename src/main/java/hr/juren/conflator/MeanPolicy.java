package hr.juren.conflator;

final class MeanPolicy<V extends Number> implements ConflationPolicy<V, Double, MeanPolicy.Accumulator> {

    record Accumulator(double sum, long count) {}

    @Override
    public Conflated<Double, Accumulator> init(V value) {
        double v = toDouble(value);
        return new Conflated<>(v, new Accumulator(v, 1));
    }

    @Override
    public Conflated<Double, Accumulator> merge(V value, Conflated<Double, Accumulator> previous) {
        var acc = previous.raw();
        double sum = acc.sum() + toDouble(value);
        long count = acc.count() + 1;
        return new Conflated<>(sum / count, new Accumulator(sum, count));
    }

    @Override
    public Conflated<Double, Accumulator> onReset(Conflated<Double, Accumulator> closed) {
        return null; // next interval averages from scratch
    }

    @Override
    public String name() {
        return "MeanConflator";
    }

    private static double toDouble(Number value) {
        if (value == null)
            throw new TypeMismatchException("mean needs numeric values, got null");
        return value.doubleValue();
    }
}
