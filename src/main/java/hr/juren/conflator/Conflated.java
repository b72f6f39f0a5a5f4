package hr.juren.conflator;

// raw is null for policies that keep nothing beyond the value
public record Conflated<C, R>(C value, R raw) {

    public static <C, R> Conflated<C, R> of(C value) {
        return new Conflated<>(value, null);
    }
}
