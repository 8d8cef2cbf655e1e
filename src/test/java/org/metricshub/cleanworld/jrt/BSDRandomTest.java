package org.metricshub.cleanworld.jrt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

/**
 * Unit tests for {@link BSDRandom} verifying deterministic sequences.
 */
public class BSDRandomTest {

	@Test
	public void testDeterministicSequence() {
		BSDRandom rng = new BSDRandom(1);
		double[] expected = {
				0.8401877171547095,
				0.3943829268190930,
				0.7830992237586059,
				0.7984400334760733,
				0.9116473579367843,
				0.1975513692933840,
				0.3352227557148890,
				0.7682295948119040,
				0.2777747108031878,
				0.5539699557954305
		};
		for (double expectedValue : expected) {
			assertEquals(expectedValue, rng.nextDouble(), 1e-15);
		}
	}

	@Test
	public void testZeroSeedIsOne() {
		BSDRandom zero = new BSDRandom(0);
		BSDRandom one = new BSDRandom(1);
		for (int i = 0; i < 20; i++) {
			assertEquals(one.nextDouble(), zero.nextDouble(), 0.0);
		}
	}

	@Test
	public void testSetSeedRestartsSequence() {
		BSDRandom rng = new BSDRandom(42);
		int first = rng.nextInt(1000);
		rng.nextInt(1000);
		rng.setSeed(42);
		assertEquals(first, rng.nextInt(1000));
	}

	@Test
	public void testNextIntStaysInRange() {
		BSDRandom rng = new BSDRandom(7);
		for (int i = 0; i < 10000; i++) {
			int v = rng.nextInt(1, 6);
			assertTrue("out of range: " + v, v >= 1 && v <= 6);
			int b = rng.nextInt(3);
			assertTrue("out of range: " + b, b >= 0 && b < 3);
		}
	}

	@Test
	public void testSingleValueRange() {
		BSDRandom rng = new BSDRandom(3);
		for (int i = 0; i < 100; i++) {
			assertEquals(1, rng.nextInt(1, 1));
		}
	}

	@Test
	public void testNonPositiveBound() {
		assertThrows(IllegalArgumentException.class, () -> new BSDRandom(1).nextInt(0));
	}
}
