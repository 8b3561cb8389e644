package philippag.lib.common.math.tolerance;

import java.math.BigDecimal;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

@OutputTimeUnit(TimeUnit.NANOSECONDS)
@BenchmarkMode(Mode.AverageTime)
@Measurement(iterations = 3, time = 3, timeUnit = TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 3, timeUnit = TimeUnit.SECONDS)
@Threads(1)
@Fork(1)
@State(Scope.Benchmark)
public class FixedPointParseBenchmark {

    private static class Args {

        private static final String[] FIXED = {
                "0", "12.5", "-0.35", ".04", "140", "12456.832", "4566.4689", "-0.4993",
                "922337203685477.5807", "1.23456789",
        };

        private static final String[] TOLERANCE = {
                "14.0 +1 -2", "2.0 +/-0.005", "100.0 +0.05/-0.2", "-0.35 +0.01/-0.014",
                "10;0.1;-0.1", "12456.832 +-0.005",
        };

        private static final Fixed64[] FIXED_64 = parse(FIXED, Fixed64::fromString);
    }

    @Benchmark
    public void parseJdkBigDecimal(Blackhole blackhole) {
        perform(Args.FIXED, BigDecimal::new, blackhole);
    }

    @Benchmark
    public void parseFixed64(Blackhole blackhole) {
        perform(Args.FIXED, Fixed64::fromString, blackhole);
    }

    @Benchmark
    public void parseTolerance128(Blackhole blackhole) {
        perform(Args.TOLERANCE, Tolerance128::fromString, blackhole);
    }

    @Benchmark
    public void formatFixed64(Blackhole blackhole) {
        for (var value : Args.FIXED_64) {
            blackhole.consume(value.toString());
        }
    }

    @Benchmark
    public void formatJdkBigDecimal(Blackhole blackhole) {
        for (var value : Args.FIXED_64) {
            blackhole.consume(BigDecimal.valueOf(value.ticks(), 4).stripTrailingZeros().toPlainString());
        }
    }

    private static <T> void perform(String[] args, Function<String, T> parser, Blackhole blackhole) {
        for (String arg : args) {
            blackhole.consume(parser.apply(arg));
        }
    }

    private static Fixed64[] parse(String[] args, Function<String, Fixed64> factory) {
        var result = new Fixed64[args.length];
        for (int i = 0; i < result.length; i++) {
            result[i] = factory.apply(args[i]);
        }
        return result;
    }
}
