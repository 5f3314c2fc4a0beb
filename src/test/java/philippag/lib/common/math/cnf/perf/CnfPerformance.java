package philippag.lib.common.math.cnf.perf;

import java.math.BigInteger;
import java.util.Locale;
import java.util.function.BiFunction;
import java.util.function.Function;

import org.junit.After;
import org.junit.Test;

import philippag.lib.common.math.cnf.CnfEncoder;
import philippag.lib.common.math.cnf.CommonTestBase;

public class CnfPerformance extends CommonTestBase {

    @Override
    protected boolean isPerformanceTest() {
        return true;
    }

    private static final CnfEncoder<BigInteger> NATURAL = CnfEncoder.natural();
    private static final CnfEncoder<Long> LONG = CnfEncoder.ofLong();

    private static final String[] ARGS_LONG = {
            "2", "9223372036854775807",
            "3", "4052555153018976266",
            "10", "1234567890123456789",
            "16", "81985529216486895",
            "1000", "999999999999999999",
    };

    private static final String[] ARGS_BIG = {
            "2", "7".repeat(1_000),
            "3", "58903457894375873489578943534432949234823472374263462343526",
            "10", "8".repeat(2_000),
            "7", "9".repeat(500),
            "1000000007", "5".repeat(10_000),
    };

    @Test
    public void encodeLong() {
        int REPEATS = 100_000;
        binary("Long  CNF", Long::parseLong, LONG::encode, REPEATS, ARGS_LONG);
        binary("Nat   CNF", BigInteger::new, NATURAL::encode, REPEATS, ARGS_LONG);
        binary("JDK   RDX", BigInteger::new, Radix::digits, REPEATS, ARGS_LONG);
    }

    @Test
    public void encodeBig() {
        int REPEATS = 10;
        binary("Nat   CNF", BigInteger::new, NATURAL::encode, REPEATS, ARGS_BIG);
        binary("JDK   RDX", BigInteger::new, Radix::digits, REPEATS, ARGS_BIG);
    }

    @Test
    public void coefficients() {
        int REPEATS = 10;
        binary("Nat   MAP", BigInteger::new, NATURAL::coefficients, REPEATS, ARGS_BIG);
        binary("Nat   ASC", BigInteger::new, NATURAL::assoc, REPEATS, ARGS_BIG);
    }

    private static class Radix {

        // baseline, only for radixes BigInteger can print
        private static Object digits(BigInteger base, BigInteger value) {
            int radix = base.intValue();
            return radix <= Character.MAX_RADIX ? value.toString(radix) : value.toString();
        }
    }

    private static <T> void binary(String desc, Function<String, T> factory, BiFunction<T, T, ?> operator, int REPEATS, String[] ARGS) {
        long t0 = System.nanoTime();
        long top = 0;

        for (int i = 0; i < REPEATS; i++) {
            for (int j = 0; j < ARGS.length;) {
                T base = factory.apply(ARGS[j++]);
                T value = factory.apply(ARGS[j++]);

                long t1 = System.nanoTime();
                Object result = operator.apply(base, value);
                t1 = System.nanoTime() - t1;

                assert result != null;
                top += t1;
            }
        }

        t0 = System.nanoTime() - t0;
        System.out.printf(Locale.ROOT, "[%12s] %,15d total %,15d op %,15d diff\n", desc, t0 / 1000, top / 1000, (t0 - top) / 1000);
    }

    @After
    public void after() {
        System.out.println("-".repeat(100));
        System.out.println();
    }
}
