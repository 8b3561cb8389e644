package philippag.lib.common.math.tolerance;

import java.util.Random;

import org.junit.Assert;

abstract class CommonTestBase {

	CommonTestBase()  {
		boolean b = false;
		assert (b = true);
		if (!b) {
			throw new AssertionError("Assertions are not enabled!");
		}
	}

	static int random(Random rnd, int min, int max) {
		return  rnd.nextInt(max - min + 1) + min;
	}

	static long random(Random rnd, long min, long max) {
		return  rnd.nextLong(max - min + 1) + min;
	}

	static long randomTicks(Random rnd, Width width) {
		if (width == Width.BITS_64) {
			return rnd.nextLong();
		}
		return random(rnd, width.min(), width.max());
	}

	/**
	 * [-]digits[.digits] without leading zeros in the integer part.
	 */
	static String randomDecimalString(Random rnd, int maxIntegerDigits, int maxFractionDigits) {
		var sb = new StringBuilder();
		if (rnd.nextBoolean()) {
			sb.append('-');
		}
		int integerDigits = random(rnd, 1, maxIntegerDigits);
		sb.append((char) random(rnd, '1', '9'));
		for (int i = 1; i < integerDigits; i++) {
			sb.append((char) random(rnd, '0', '9'));
		}
		int fractionDigits = random(rnd, 0, maxFractionDigits);
		if (fractionDigits > 0) {
			sb.append('.');
			for (int i = 0; i < fractionDigits; i++) {
				sb.append((char) random(rnd, '0', '9'));
			}
		}
		return sb.toString();
	}

	static void assertTicks(long expected, FixedPoint<?> actual) {
		Assert.assertEquals(actual.toDebugString(), expected, actual.ticks());
	}

	static void assertTicks(long value, long plus, long minus, Tolerance<?, ?, ?> actual) {
		Assert.assertEquals(actual.toDebugString(), value, actual.value().ticks());
		Assert.assertEquals(actual.toDebugString(), plus, actual.plus().ticks());
		Assert.assertEquals(actual.toDebugString(), minus, actual.minus().ticks());
	}

	static ToleranceException assertParseError(Runnable runnable) {
		var e = Assert.assertThrows(ToleranceException.class, runnable::run);
		Assert.assertTrue(e.getMessage(), e.isParseError());
		return e;
	}

	static ToleranceException assertOverflow(Runnable runnable) {
		var e = Assert.assertThrows(ToleranceException.class, runnable::run);
		Assert.assertTrue(e.getMessage(), e.isOverflow());
		return e;
	}
}
