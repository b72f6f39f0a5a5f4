package hr.juren.conflator;

import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.openjdk.jmh.annotations.Mode.AverageTime;
import static org.openjdk.jmh.annotations.Mode.Throughput;

@Fork(value = 1)
@Warmup(iterations = 3, time = 1, timeUnit = SECONDS)
@Measurement(iterations = 5, time = 2, timeUnit = SECONDS)
@BenchmarkMode(Throughput)
@OutputTimeUnit(SECONDS)
public class ConflatedContainerBenchmark {

    // ============================================================================
    // 1. WRITE THROUGHPUT, producer hammering a fixed key space
    // ============================================================================

    @State(Scope.Thread)
    public static class WriteState {
        @Param({"16", "1024", "65536"})
        int keys;

        ConflatedContainer<Integer, Long, Long, Void> lastValue;
        ConflatedContainer<Integer, Long, Ohlc<Long>, Void> ohlc;
        ConflatedContainer<Integer, Long, Double, ?> mean;
        ConflatedContainer<Integer, Long, MostFrequent<Long>, Map<Long, Long>> mode;
        long tick;

        @Setup(Level.Trial)
        public void setup() {
            lastValue = Conflators.lastValue();
            ohlc = Conflators.ohlc();
            mean = Conflators.mean();
            mode = Conflators.mode();
        }

        int nextKey() {
            return (int) (tick++ % keys);
        }
    }

    @Benchmark
    public void lastValueWrite(WriteState state) {
        state.lastValue.set(state.nextKey(), state.tick);
    }

    @Benchmark
    public void ohlcWrite(WriteState state) {
        state.ohlc.set(state.nextKey(), state.tick & 1023);
    }

    @Benchmark
    public void meanWrite(WriteState state) {
        state.mean.set(state.nextKey(), state.tick);
    }

    @Benchmark
    public void modeWrite(WriteState state) {
        state.mode.set(state.nextKey(), state.tick & 7);
    }

    // ============================================================================
    // 2. CONSUMER CYCLE, fill an interval then drain it
    // ============================================================================

    @State(Scope.Thread)
    public static class DrainState {
        @Param({"64", "4096"})
        int keys;

        @Param({"1", "16"})
        int writesPerKey;

        ConflatedContainer<Integer, Long, List<Long>, List<Long>> batch;

        @Setup(Level.Trial)
        public void setup() {
            batch = Conflators.batch();
        }
    }

    @Benchmark
    @BenchmarkMode(AverageTime)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public void batchFillAndDrain(DrainState state, Blackhole bh) {
        for (int w = 0; w < state.writesPerKey; w++) {
            for (int k = 0; k < state.keys; k++) {
                state.batch.set(k, (long) w);
            }
        }
        bh.consume(state.batch.drain((key, values) -> bh.consume(values)));
    }
}
