package philippag.lib.common.math.cnf;

import java.math.BigInteger;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

@OutputTimeUnit(TimeUnit.MICROSECONDS)
@BenchmarkMode(Mode.AverageTime)
@Measurement(iterations = 3, time = 3, timeUnit = TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 3, timeUnit = TimeUnit.SECONDS)
@Threads(1)
@Fork(value = 1, jvmArgs = "-Xmx2G")
@State(Scope.Benchmark)
public class CnfEncodeBenchmark {

    private static final CnfEncoder<BigInteger> NATURAL = CnfEncoder.natural();
    private static final CnfEncoder<Long> LONG = CnfEncoder.ofLong();

    @Param({"2", "3", "10", "1000000007"})
    public int base;

    @Param({"64", "1024", "16384"})
    public int bits;

    BigInteger naturalBase;
    BigInteger naturalValue;
    long longValue;
    Cnf<BigInteger> cnf;

    @Setup
    public void setup() {
        var rnd = CommonTestBase.createRandom(1000);
        naturalBase = BigInteger.valueOf(base);
        naturalValue = new BigInteger(bits, rnd);
        longValue = naturalValue.longValue() & Long.MAX_VALUE;
        cnf = NATURAL.encode(naturalBase, naturalValue);
    }

    @Benchmark
    public void encodeNatural(Blackhole blackhole) {
        blackhole.consume(NATURAL.encode(naturalBase, naturalValue));
    }

    @Benchmark
    public void encodeLong(Blackhole blackhole) {
        blackhole.consume(LONG.encode((long) base, longValue));
    }

    @Benchmark
    public void evaluateNatural(Blackhole blackhole) {
        blackhole.consume(cnf.evaluate());
    }

    @Benchmark
    public void coefficientsNatural(Blackhole blackhole) {
        var map = cnf.coefficients();
        blackhole.consume(map.get(BigInteger.ONE));
    }
}
