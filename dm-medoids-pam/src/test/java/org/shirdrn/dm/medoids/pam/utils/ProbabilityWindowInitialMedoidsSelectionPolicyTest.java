package org.shirdrn.dm.medoids.pam.utils;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.shirdrn.dm.medoids.common.DistanceMatrix;
import org.shirdrn.dm.medoids.common.InvalidParameterException;

public class ProbabilityWindowInitialMedoidsSelectionPolicyTest {

	private static DistanceMatrix line(int n) {
		double[][] distances = new double[n][n];
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < n; j++) {
				distances[i][j] = Math.abs(i - j);
			}
		}
		return new DistanceMatrix(distances);
	}

	@Test
	public void testInvalidWindowRejected() {
		assertThrows(InvalidParameterException.class, 
				() -> new ProbabilityWindowInitialMedoidsSelectionPolicy(0.5, 0.5, new Random()));
		assertThrows(InvalidParameterException.class, 
				() -> new ProbabilityWindowInitialMedoidsSelectionPolicy(0.9, 0.8, new Random()));
		assertThrows(InvalidParameterException.class, 
				() -> new ProbabilityWindowInitialMedoidsSelectionPolicy(-0.1, 0.8, new Random()));
		assertThrows(InvalidParameterException.class, 
				() -> new ProbabilityWindowInitialMedoidsSelectionPolicy(0.1, 1.1, new Random()));
	}

	@Test
	public void testWindowBounds() {
		ProbabilityWindowInitialMedoidsSelectionPolicy policy = 
				new ProbabilityWindowInitialMedoidsSelectionPolicy(0.90, 0.99, new Random(1));
		// floor(0.9 * 4) = 3, round(0.99 * 3) = 3
		assertArrayEquals(new int[] {3, 3}, policy.window(4));
		// floor(0.9 * 100) = 90, round(0.99 * 99) = 98
		assertArrayEquals(new int[] {90, 98}, policy.window(100));
		assertArrayEquals(new int[] {0, 0}, policy.window(1));

		// floor(0.95 * 20) = 19 is past round(0.96 * 19) = 18
		ProbabilityWindowInitialMedoidsSelectionPolicy narrow = 
				new ProbabilityWindowInitialMedoidsSelectionPolicy(0.95, 0.96, new Random(1));
		assertArrayEquals(new int[] {18, 19}, narrow.window(20));
	}

	@Test
	public void testSecondMedoidIsFarthestOnSmallLine() {
		DistanceMatrix matrix = line(5);
		for (int seed = 0; seed < 20; seed++) {
			List<Integer> medoids = new ProbabilityWindowInitialMedoidsSelectionPolicy(0.90, 0.99, new Random(seed))
					.select(2, matrix);
			assertEquals(2, medoids.size());
			int first = medoids.get(0);
			// only the last of the 4 sorted candidates is in the window
			int expected = first <= 2 ? 4 : 0;
			assertEquals(expected, (int) medoids.get(1), "first=" + first);
		}
	}

	@Test
	public void testSelectsDistinctMedoidsFromTail() {
		DistanceMatrix matrix = line(200);
		for (int seed = 0; seed < 10; seed++) {
			List<Integer> medoids = new ProbabilityWindowInitialMedoidsSelectionPolicy(0.90, 0.99, new Random(seed))
					.select(5, matrix);
			assertEquals(5, medoids.size());
			assertEquals(5, new HashSet<Integer>(medoids).size());
			int first = medoids.get(0);
			int second = medoids.get(1);
			// 199 candidates, window [179, 196] of the distances to the first medoid
			int farthest = Math.max(first, 199 - first);
			assertTrue(Math.abs(second - first) >= farthest - 19, "first=" + first + ", second=" + second);
		}
	}

	@Test
	public void testSameSeedSameMedoids() {
		DistanceMatrix matrix = line(50);
		List<Integer> m1 = new ProbabilityWindowInitialMedoidsSelectionPolicy(0.5, 0.9, new Random(7)).select(6, matrix);
		List<Integer> m2 = new ProbabilityWindowInitialMedoidsSelectionPolicy(0.5, 0.9, new Random(7)).select(6, matrix);
		assertEquals(m1, m2);
	}
}
