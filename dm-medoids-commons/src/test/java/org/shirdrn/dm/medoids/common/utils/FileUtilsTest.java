package org.shirdrn.dm.medoids.common.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.shirdrn.dm.medoids.common.DistanceMatrix;
import org.shirdrn.dm.medoids.common.Point2D;

public class FileUtilsTest {

	private File resource(String name) throws URISyntaxException {
		return new File(getClass().getResource("/" + name).toURI());
	}

	@Test
	public void testReadDistanceMatrixWithMixedDelimiters() throws Exception {
		DistanceMatrix matrix = FileUtils.readDistanceMatrix(resource("line-matrix.txt"));
		assertEquals(5, matrix.size());
		for (int i = 0; i < 5; i++) {
			for (int j = 0; j < 5; j++) {
				assertEquals(Math.abs(i - j), matrix.getDistance(i, j));
			}
		}
		assertTrue(matrix.isSymmetric(0.0));
	}

	@Test
	public void testReadUtf8Matrix() throws Exception {
		DistanceMatrix matrix = FileUtils.readDistanceMatrix(resource("utf8-matrix.txt"));
		assertEquals(3, matrix.size());
		assertEquals(1.5, matrix.getDistance(0, 1));
		assertEquals(0.5, matrix.getDistance(2, 1));
	}

	@Test
	public void testReadRaggedMatrixFails() throws Exception {
		File file = resource("ragged-matrix.txt");
		assertThrows(IllegalArgumentException.class, () -> FileUtils.readDistanceMatrix(file));
	}

	@Test
	public void testReadMalformedNumberFails() throws Exception {
		File file = resource("bad-matrix.txt");
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> FileUtils.readDistanceMatrix(file));
		assertTrue(e.getMessage().contains("bad-matrix.txt:1"));
	}

	@Test
	public void testReadMissingFileFails() {
		assertThrows(RuntimeException.class, () -> FileUtils.readDistanceMatrix(new File("no-such-matrix.txt")));
	}

	@Test
	public void testRead2DPointsSkipsDuplicates() throws Exception {
		List<Point2D> points = new ArrayList<Point2D>();
		FileUtils.read2DPointsFromFiles(points, FileUtils.DEFAULT_DELIMITER_REGEX, resource("points.txt"));
		assertEquals(3, points.size());
		assertEquals(new Point2D(6.0, 8.0), points.get(2));

		DistanceMatrix matrix = DistanceMatrix.fromPoints(points);
		assertEquals(5.0, matrix.getDistance(1, 2), 1e-12);
	}
}
