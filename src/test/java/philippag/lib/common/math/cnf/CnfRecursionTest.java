package philippag.lib.common.math.cnf;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

public class CnfRecursionTest extends CommonTestBase {

    private static final NaturalArithmetic NATURAL = NaturalArithmetic.instance();
    private static final LongArithmetic LONG = LongArithmetic.instance();

    @Test
    public void unfoldVisitsRemainders() {
        var values = new ArrayList<Long>();
        var exponents = new ArrayList<Long>();
        var powers = new ArrayList<Long>();
        int terms = CnfRecursion.unfold(LONG, 10L, 4021L, Integer.MAX_VALUE, (o, exponent, power) -> {
            values.add(o);
            exponents.add(exponent);
            powers.add(power);
        });
        Assert.assertEquals(3, terms);
        Assert.assertEquals(List.of(4021L, 21L, 1L), values);
        Assert.assertEquals(List.of(3L, 1L, 0L), exponents);
        Assert.assertEquals(List.of(1000L, 10L, 1L), powers);
    }

    @Test
    public void unfoldZero() {
        int terms = CnfRecursion.unfold(LONG, 10L, 0L, 0, (o, exponent, power) -> Assert.fail("visited " + o));
        Assert.assertEquals(0, terms);
    }

    @Test
    public void unfoldDegenerateBase() {
        // log is 0 and the power is 1, so one step reaches zero
        for (long base : new long[] { 0, 1 }) {
            var values = new ArrayList<Long>();
            int terms = CnfRecursion.unfold(LONG, base, 77L, 1, (o, exponent, power) -> {
                Assert.assertEquals(0L, exponent.longValue());
                Assert.assertEquals(1L, power.longValue());
                values.add(o);
            });
            Assert.assertEquals(1, terms);
            Assert.assertEquals(List.of(77L), values);
        }
    }

    @Test
    public void recurseCountsTerms() {
        int count = CnfRecursion.recurse(NATURAL, BigInteger.TWO, BigInteger.valueOf(0b1011_0110), 0, (o, below) -> below + 1);
        Assert.assertEquals(5, count);
        int zero = CnfRecursion.recurse(NATURAL, BigInteger.TWO, BigInteger.ZERO, 0, (o, below) -> below + 1);
        Assert.assertEquals(0, zero);
    }

    @Test
    public void recurseBuildsFromSmallest() {
        // the step for o sees the complete result for o mod b^log(b, o)
        String digits = CnfRecursion.recurse(LONG, 10L, 5_030_201L, "", (o, below) -> o + (below.isEmpty() ? "" : "," + below));
        Assert.assertEquals("5030201,30201,201,1", digits);

        var cnf = CnfRecursion.<Long, List<CnfEntry<Long>>> recurse(LONG, 3L, 100L, List.of(), (o, below) -> {
            long e = LongArithmetic.floorLog(3, o);
            var result = new ArrayList<CnfEntry<Long>>();
            result.add(CnfEntry.of(e, o / LongArithmetic.powExact(3, e)));
            result.addAll(below);
            return result;
        });
        Assert.assertEquals(CnfEncoder.ofLong().encode(3L, 100L).entries(), cnf);
    }

    @Test
    public void remainderMustDecrease() {
        try {
            CnfRecursion.unfold(new BrokenModulo(), 10L, 1234L, Integer.MAX_VALUE, (o, exponent, power) -> {});
            Assert.fail("Expecting IllegalStateException");
        } catch (IllegalStateException e) {
            System.out.println(e);
        }
        try {
            CnfEncoder.of(new BrokenModulo()).encode(10L, 1234L);
            Assert.fail("Expecting IllegalStateException");
        } catch (IllegalStateException e) {
            System.out.println(e);
        }
    }

    @Test
    public void termLimit() {
        Assert.assertEquals(4, CnfRecursion.unfold(LONG, 2L, 15L, 4, (o, exponent, power) -> {}));
        try {
            CnfRecursion.unfold(LONG, 2L, 15L, 3, (o, exponent, power) -> {});
            Assert.fail("Expecting IllegalStateException");
        } catch (IllegalStateException e) {
            System.out.println(e);
        }
        try {
            CnfRecursion.unfold(LONG, 2L, 15L, -1, (o, exponent, power) -> {});
            Assert.fail("Expecting IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            System.out.println(e);
        }
    }

    @Test
    public void stackDepthIndependentOfTerms() {
        // 2^20000 - 1 has 20000 terms in base 2
        var value = BigInteger.ONE.shiftLeft(20_000).subtract(BigInteger.ONE);
        int count = CnfRecursion.recurse(NATURAL, BigInteger.TWO, value, 0, (o, below) -> below + 1);
        Assert.assertEquals(20_000, count);
    }

    /**
     * Returns the dividend unchanged when it is larger than the divisor,
     * which never reaches zero.
     */
    private static final class BrokenModulo implements ValueArithmetic<Long> {

        @Override public int compare(Long lhs, Long rhs)       { return LONG.compare(lhs, rhs); }
        @Override public Long zero()                            { return LONG.zero(); }
        @Override public Long one()                             { return LONG.one(); }
        @Override public Long add(Long lhs, Long rhs)           { return LONG.add(lhs, rhs); }
        @Override public Long multiply(Long lhs, Long rhs)      { return LONG.multiply(lhs, rhs); }
        @Override public Long pow(Long base, Long exponent)     { return LONG.pow(base, exponent); }
        @Override public Long divide(Long dividend, Long divisor) { return LONG.divide(dividend, divisor); }
        @Override public Long log(Long base, Long value)        { return LONG.log(base, value); }
        @Override public Long check(Long value)                 { return LONG.check(value); }
        @Override public Long fromLong(long value)              { return LONG.fromLong(value); }
        @Override public Long parse(CharSequence str)           { return LONG.parse(str); }

        @Override
        public Long modulo(Long dividend, Long divisor) {
            return dividend > divisor ? dividend : LONG.modulo(dividend, divisor);
        }
    }
}
