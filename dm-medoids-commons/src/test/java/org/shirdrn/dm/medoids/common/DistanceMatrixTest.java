package org.shirdrn.dm.medoids.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

public class DistanceMatrixTest {

	@Test
	public void testNonSquareRejected() {
		assertThrows(IllegalArgumentException.class, () -> new DistanceMatrix(new double[][] {
			{0, 1, 2},
			{1, 0, 1}
		}));
		assertThrows(IllegalArgumentException.class, () -> new DistanceMatrix(new double[][] {
			{0, 1},
			{1}
		}));
		assertThrows(IllegalArgumentException.class, () -> new DistanceMatrix(null));
	}

	@Test
	public void testNegativeOrNaNDistanceRejected() {
		assertThrows(IllegalArgumentException.class, () -> new DistanceMatrix(new double[][] {
			{0, -1},
			{-1, 0}
		}));
		assertThrows(IllegalArgumentException.class, () -> new DistanceMatrix(new double[][] {
			{0, Double.NaN},
			{Double.NaN, 0}
		}));
	}

	@Test
	public void testInfiniteDistanceRejected() {
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new DistanceMatrix(new double[][] {
			{0, 1, Double.POSITIVE_INFINITY},
			{1, 0, Double.POSITIVE_INFINITY},
			{Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, 0}
		}));
		assertTrue(e.getMessage().contains("(0, 2)"), e.getMessage());
		assertThrows(IllegalArgumentException.class, () -> new DistanceMatrix(new double[][] {
			{0, Double.NEGATIVE_INFINITY},
			{Double.NEGATIVE_INFINITY, 0}
		}));
	}

	@Test
	public void testRowsAreCopied() {
		double[][] distances = {
			{0, 1},
			{1, 0}
		};
		DistanceMatrix matrix = new DistanceMatrix(distances);
		distances[0][1] = 10;
		assertEquals(1.0, matrix.getDistance(0, 1));
		assertEquals(2, matrix.size());
	}

	@Test
	public void testDiagnostics() {
		DistanceMatrix symmetric = new DistanceMatrix(new double[][] {
			{0, 1, 2},
			{1, 0, 3},
			{2, 3, 0}
		});
		assertTrue(symmetric.hasZeroDiagonal());
		assertTrue(symmetric.isSymmetric(0.0));

		DistanceMatrix asymmetric = new DistanceMatrix(new double[][] {
			{1, 1},
			{2, 0}
		});
		assertFalse(asymmetric.hasZeroDiagonal());
		assertFalse(asymmetric.isSymmetric(0.5));
		assertTrue(asymmetric.isSymmetric(1.0));
	}

	@Test
	public void testFromPoints() {
		DistanceMatrix matrix = DistanceMatrix.fromPoints(Arrays.asList(
				new Point2D(0.0, 0.0),
				new Point2D(3.0, 4.0),
				new Point2D(6.0, 8.0)));
		assertEquals(3, matrix.size());
		assertEquals(5.0, matrix.getDistance(0, 1), 1e-12);
		assertEquals(10.0, matrix.getDistance(2, 0), 1e-12);
		assertTrue(matrix.hasZeroDiagonal());
		assertTrue(matrix.isSymmetric(0.0));
	}
}
