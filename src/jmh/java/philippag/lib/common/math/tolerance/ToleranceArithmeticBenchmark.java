package philippag.lib.common.math.tolerance;

import java.math.BigDecimal;
import java.util.concurrent.TimeUnit;
import java.util.function.BinaryOperator;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
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
public class ToleranceArithmeticBenchmark {

    private static class Args {

        private static final String[] STRING = {
                "14.0 +1 -2", "2.0 +/-0.005",
                "100.0 +0.05/-0.2", "-0.35 +0.01/-0.014",
                "12456.832 +/-0.1", "340.993 +0.02/-0.01",
                "4566.4689 +0.5/-0.5", "-0.4993 +0/-0.005",
        };

        private static final Tolerance128[] WIDE = new Tolerance128[STRING.length];
        private static final Tolerance64[] NARROW = new Tolerance64[STRING.length];
        private static final BigDecimal[][] BIG_DECIMAL = new BigDecimal[STRING.length][];

        static {
            for (int i = 0; i < STRING.length; i++) {
                WIDE[i] = Tolerance128.fromString(STRING[i]);
                NARROW[i] = Tolerance64.fromString(STRING[i]);
                BIG_DECIMAL[i] = new BigDecimal[] {
                        new BigDecimal(WIDE[i].value().toString()),
                        new BigDecimal(WIDE[i].plus().toString()),
                        new BigDecimal(WIDE[i].minus().toString()),
                };
            }
        }
    }

    @Param({"false", "true"})
    public boolean reversed;

    @Benchmark
    public void addTolerance128(Blackhole blackhole) {
        perform(Args.WIDE, Tolerance128::add, blackhole);
    }

    @Benchmark
    public void subtractTolerance128(Blackhole blackhole) {
        perform(Args.WIDE, Tolerance128::subtract, blackhole);
    }

    @Benchmark
    public void addTolerance64(Blackhole blackhole) {
        perform(Args.NARROW, Tolerance64::add, blackhole);
    }

    @Benchmark
    public void subtractTolerance64(Blackhole blackhole) {
        perform(Args.NARROW, Tolerance64::subtract, blackhole);
    }

    @Benchmark
    public void subtractJdkBigDecimal(Blackhole blackhole) {
        perform(Args.BIG_DECIMAL, (l, r) -> new BigDecimal[] {
                l[0].subtract(r[0]),
                l[1].subtract(r[2]),
                l[2].subtract(r[1]),
        }, blackhole);
    }

    @Benchmark
    public void roundFixed64(Blackhole blackhole) {
        for (var tolerance : Args.WIDE) {
            blackhole.consume(tolerance.value().round(Unit.MM));
        }
    }

    private <T> void perform(T[] args, BinaryOperator<T> operator, Blackhole blackhole) {
        if (reversed) {
            for (int j = 0; j < args.length;) {
                T lhs = args[j++];
                T rhs = args[j++];
                blackhole.consume(operator.apply(rhs, lhs)); // reversed!
            }
        } else {
            for (int j = 0; j < args.length;) {
                T lhs = args[j++];
                T rhs = args[j++];
                blackhole.consume(operator.apply(lhs, rhs));
            }
        }
    }
}
