package hr.juren.conflator;

public record MostFrequent<V>(V value, long count) {}
