package philippag.lib.common.math.tolerance;

import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

public class Tolerance128Test extends CommonTestBase {

    @Test
    public void parse() {
        assertTicks(140_000, 10_000, -20_000, Tolerance128.fromString("14.0 +1 -2"));
        assertTicks(140_000, 10_000, -20_000, Tolerance128.fromString("14 +1/-2"));
        assertTicks(140_000, 10_000, -20_000, Tolerance128.fromString("14;1;-2"));
        assertTicks(100_000, 1_000, -1_000, Tolerance128.fromString("10 +/-0.1"));
        assertTicks(100_000, 1_000, -1_000, Tolerance128.fromString("10 +-0.1"));
        assertTicks(100_000, 1_000, -1_000, Tolerance128.fromString("  10   .1 "));
        assertTicks(100_000, 0, 0, Tolerance128.fromString("10"));
        assertTicks(-3_500, 100, -140, Tolerance128.fromString("-0.35 +0.01/-0.014"));
        assertTicks(1_000, 300, 100, Tolerance128.fromString("0.1 +0.03/+0.01"));
    }

    @Test
    public void parseErrors() {
        var e = assertParseError(() -> Tolerance128.fromString(""));
        Assert.assertTrue(e.getMessage(), e.getMessage().contains("empty string"));
        assertParseError(() -> Tolerance128.fromString(" / "));
        e = assertParseError(() -> Tolerance128.fromString("nil"));
        Assert.assertEquals("Tolerance128 not parsable from 'nil'!", e.getMessage());
        Assert.assertTrue(e.getCause() instanceof ToleranceException);
        assertParseError(() -> Tolerance128.fromString("1 2 3 4"));
        assertParseError(() -> Tolerance128.fromString("10 +0.1 -0.1x"));

        // plus below minus
        assertParseError(() -> Tolerance128.fromString("5 0.1 0.2"));
        assertParseError(() -> Tolerance128.fromString("5 -0.1"));
    }

    @Test
    public void parseOverflow() {
        assertOverflow(() -> Tolerance128.fromString("1 300000"));
        assertOverflow(() -> Tolerance128.fromString("1 +0.1 -300000"));
        assertOverflow(() -> Tolerance128.fromString("1000000000000000 +/-0.1"));
    }

    @Test
    public void formatting() {
        var t = Tolerance128.fromString("14.0 +1 -2");
        Assert.assertEquals("14.0 +1.0/-2.0", t.format(1));
        Assert.assertEquals("14.0 +1.0/-2.0", t.toString());
        Assert.assertEquals("14.00 +1.00/-2.00", t.toToleranceString(2));

        Assert.assertEquals("2.0 +/-0.005", Tolerance128.withSym(Fixed64.fromDouble(2.0), Fixed32.fromDouble(0.005)).toString());
        Assert.assertEquals("100.0 +0.05/-0.2", Tolerance128.fromString("100.0 +0.05/-0.2").toString());
        Assert.assertEquals("0.1 +0.01/-0.0", Tolerance128.fromTicks(1_000, 100, 0).toString());
        Assert.assertEquals("0.1 +0.03/+0.01", Tolerance128.fromTicks(1_000, 300, 100).toString());
        Assert.assertEquals("0.1 -0.01/-0.03", Tolerance128.fromTicks(1_000, -100, -300).toString());
        Assert.assertEquals("0.0 +/-0.0", Tolerance128.ZERO.toString());
    }

    @Test
    public void formatRoundsBeforeChoosingSymmetricForm() {
        var t = Tolerance128.fromTicks(0, 1_004, -996);
        Assert.assertEquals("0.0 +0.1004/-0.0996", t.toString());
        Assert.assertEquals("0.00 +/-0.10", t.format(2));
        Assert.assertEquals("0.0000 +0.1004/-0.0996", t.format(9));
        Assert.assertThrows(IllegalArgumentException.class, () -> t.format(-1));
    }

    @Test
    public void alternateAndDebugStrings() {
        var t = Tolerance128.fromString("-0.35 +0.01/-0.014");
        Assert.assertEquals("-3500 +100/-140", t.toAlternateString());
        Assert.assertEquals("Tolerance128(-0.3500 +0.0100 -0.0140)", t.toDebugString());
        Assert.assertEquals("1000 +300/+100", Tolerance128.fromTicks(1_000, 300, 100).toAlternateString());
        Assert.assertEquals("0 +0/-0", Tolerance128.ZERO.toAlternateString());
    }

    @Test
    public void factories() {
        assertTicks(100_000, 1_000, -1_000, Tolerance128.fromDouble(10.0, 0.1));
        assertTicks(1_000_000, 500, -2_000, Tolerance128.fromDouble(100.0, 0.05, -0.2));
        assertTicks(124_568_320, 0, 0, Tolerance128.fromDouble(12456.832));
        assertTicks(1_000, 20, -10, Tolerance128.fromTicks(1_000, 20, -10));
        assertTicks(1_000, 20, -20, Tolerance128.fromTicks(1_000, 20));
        assertTicks(5, 0, 0, Tolerance128.valueOf(Fixed64.fromLong(5)));

        Assert.assertThrows(IllegalArgumentException.class, () -> Tolerance128.fromTicks(1_000, -20, 10));
        Assert.assertThrows(IllegalArgumentException.class, () -> Tolerance128.of(Fixed64.ZERO, Fixed32.fromInt(-1), Fixed32.ZERO));
        assertOverflow(() -> Tolerance128.fromTicks(0, 1L << 32, 0));
        assertOverflow(() -> Tolerance128.fromDouble(0, 1e9, 0));
    }

    @Test
    public void subtractionWidensByOppositeDeviations() {
        var a = Tolerance128.fromTicks(1_000, 0, 0);
        var b = Tolerance128.fromTicks(300, 20, -10);
        Assert.assertEquals(Tolerance128.fromTicks(700, 10, -20), a.subtract(b));
        Assert.assertEquals(Tolerance128.fromTicks(-700, 20, -10), b.subtract(a));
        Assert.assertEquals(Tolerance128.fromTicks(0, 30, -30), b.subtract(b));
        Assert.assertEquals(Tolerance128.fromTicks(200, 20, -10), b.subtract(Fixed64.fromLong(100)));
    }

    @Test
    public void addition() {
        var a = Tolerance128.fromTicks(1_000, 20, -10);
        var b = Tolerance128.fromTicks(300, 5, -5);
        Assert.assertEquals(Tolerance128.fromTicks(1_300, 25, -15), a.add(b));
        Assert.assertEquals(Tolerance128.fromTicks(1_100, 20, -10), a.add(Fixed64.fromLong(100)));
        Assert.assertEquals(a, a.add(Tolerance128.ZERO));
        Assert.assertEquals(Tolerance128.fromTicks(2_300, 45, -25), Tolerance128.sum(List.of(a, b, a)));
        Assert.assertEquals(Tolerance128.ZERO, Tolerance128.sum(List.of()));
    }

    @Test
    public void multiply() {
        var a = Tolerance128.fromTicks(1_000, 20, -10);
        Assert.assertEquals(Tolerance128.fromTicks(3_000, 60, -30), a.multiply(3));
        Assert.assertEquals(Tolerance128.fromTicks(-2_000, 20, -40), a.multiply(-2));
        Assert.assertEquals(Tolerance128.ZERO, a.multiply(0));
    }

    @Test
    public void invert() {
        var a = Tolerance128.fromTicks(1_000, 20, -10);
        Assert.assertEquals(Tolerance128.fromTicks(-1_000, 10, -20), a.invert());
        Assert.assertEquals(a, a.invert().invert());
    }

    @Test
    public void limits() {
        var a = Tolerance128.fromTicks(1_000, 20, -10);
        Assert.assertEquals(Fixed64.fromLong(1_020), a.upperLimit());
        Assert.assertEquals(Fixed64.fromLong(990), a.lowerLimit());
        Assert.assertFalse(a.isSymmetric());
        Assert.assertTrue(Tolerance128.fromTicks(1_000, 20).isSymmetric());
    }

    @Test
    public void containment() {
        var a = Tolerance128.fromString("10 +/-0.1");
        var b = Tolerance128.fromString("10 +0.05/-0.05");
        var c = Tolerance128.fromString("10.08 +/-0.05");
        Assert.assertTrue(b.isInsideOf(a));
        Assert.assertTrue(a.enfold(b));
        Assert.assertFalse(a.isInsideOf(b));
        Assert.assertFalse(b.enfold(a));
        Assert.assertFalse(c.isInsideOf(a));
        Assert.assertFalse(a.enfold(c));
        Assert.assertTrue(a.isInsideOf(a));
        Assert.assertTrue(a.enfold(a));

        Assert.assertTrue(a.enfold(Fixed64.fromString("10.1")));
        Assert.assertTrue(a.enfold(Fixed64.fromString("9.9")));
        Assert.assertFalse(a.enfold(Fixed64.fromString("10.1001")));
        Assert.assertFalse(a.enfold(Fixed64.fromString("9.8999")));
    }

    @Test
    public void narrow() {
        var a = Tolerance128.fromString("10 +/-0.1");
        Assert.assertEquals(Tolerance128.fromString("10 +0.05/-0.02"), a.narrow(Fixed32.fromString("0.05"), Fixed32.fromString("-0.02")));
        Assert.assertEquals(Tolerance128.fromString("10 +/-0.03"), a.narrowSym(Fixed32.fromString("0.03")));
        Assert.assertThrows(IllegalArgumentException.class, () -> a.narrow(Fixed32.fromInt(5), Fixed32.fromInt(10)));
        Assert.assertThrows(IllegalArgumentException.class, () -> a.narrowSym(Fixed32.fromInt(-1)));
    }

    @Test
    public void order() {
        var a = Tolerance128.fromTicks(1_000, 20, -10);
        var b = Tolerance128.fromTicks(1_000, 20, -20);
        var c = Tolerance128.fromTicks(1_000, 30, -10);
        var d = Tolerance128.fromTicks(900, 100, -100);
        var list = new ArrayList<>(List.of(c, a, d, b));
        Collections.sort(list);
        Assert.assertEquals(List.of(d, b, a, c), list);

        Assert.assertEquals(a, Tolerance128.fromString("0.1 +0.002/-0.001"));
        Assert.assertEquals(a.hashCode(), Tolerance128.fromString("0.1 +0.002/-0.001").hashCode());
        Assert.assertNotEquals(a, b);
    }

    @Test
    public void conversions() {
        var t = Tolerance128.fromString("14.0 +1 -2");
        Assert.assertEquals(14.0, t.toDouble(), 0.0);
        Assert.assertArrayEquals(new double[] { 14.0, 1.0, -2.0 }, t.toDoubleArray(), 0.0);

        var narrow = Tolerance128.fromString("12456.832 +/-0.005").toTolerance64();
        Assert.assertEquals(Tolerance64.fromString("12456.832 +/-0.005"), narrow);
        Assert.assertEquals(Tolerance128.fromString("12456.832 +/-0.005"), Tolerance128.valueOf(narrow));

        assertOverflow(() -> Tolerance128.fromString("300000 +/-0.005").toTolerance64());
        assertOverflow(() -> Tolerance128.fromString("1 +/-4").toTolerance64());
    }

    @Test
    public void bytes() {
        var t = Tolerance128.fromTicks(1, 3, 2);
        byte[] expected = {
            0, 0, 0, 0, 0, 0, 0, 1,
            0, 0, 0, 3,
            0, 0, 0, 2,
        };
        Assert.assertArrayEquals(expected, t.toBigEndianBytes());
        Assert.assertEquals(Tolerance128.BYTES, t.toLittleEndianBytes().length);
        Assert.assertEquals(1, t.toLittleEndianBytes()[0]);
        Assert.assertEquals(t, Tolerance128.fromBigEndian(expected));
        Assert.assertEquals(t, Tolerance128.fromLittleEndian(t.toLittleEndianBytes()));
        Assert.assertEquals(t, Tolerance128.fromNativeEndian(t.toNativeEndianBytes()));
        Assert.assertEquals(t, Tolerance128.fromBytes(t.toBytes(ByteOrder.BIG_ENDIAN), ByteOrder.BIG_ENDIAN));

        Assert.assertThrows(IllegalArgumentException.class, () -> Tolerance128.fromBigEndian(new byte[15]));
        byte[] plusBelowMinus = {
            0, 0, 0, 0, 0, 0, 0, 1,
            0, 0, 0, 2,
            0, 0, 0, 3,
        };
        Assert.assertThrows(IllegalArgumentException.class, () -> Tolerance128.fromBigEndian(plusBelowMinus));
    }
}
