package org.shirdrn.dm.medoids.common;

import java.util.List;

import org.shirdrn.dm.medoids.common.utils.MetricUtils;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Doubles;

/**
 * Square matrix of finite, non-negative pairwise distances between
 * <code>n</code> points, where a point is identified only by its row/column index.
 * <p>
 * A zero diagonal and symmetry are preconditions of the clustering
 * algorithms; they are not enforced here, but can be checked through
 * {@link #hasZeroDiagonal()} and {@link #isSymmetric(double)}. The given
 * rows are copied, so later changes to the caller's array are not seen.
 */
public class DistanceMatrix {

	private final double[][] distances;
	private final int size;

	public DistanceMatrix(double[][] distances) {
		Preconditions.checkArgument(distances != null, "Required: distances != null!");
		this.size = distances.length;
		this.distances = new double[size][];
		for (int i = 0; i < size; i++) {
			Preconditions.checkArgument(distances[i] != null && distances[i].length == size,
					"Required: square matrix, row %s has %s columns but matrix has %s rows!",
					i, distances[i] == null ? 0 : distances[i].length, size);
			for (int j = 0; j < size; j++) {
				double d = distances[i][j];
				Preconditions.checkArgument(Doubles.isFinite(d) && d >= 0.0,
						"Required: finite, non-negative distance at (%s, %s), but was %s!", i, j, d);
			}
			this.distances[i] = distances[i].clone();
		}
	}

	/**
	 * Builds a matrix of euclidean distances between the given points, in list order.
	 */
	public static DistanceMatrix fromPoints(List<Point2D> points) {
		Preconditions.checkArgument(points != null, "Required: points != null!");
		int n = points.size();
		double[][] distances = new double[n][n];
		for (int i = 0; i < n; i++) {
			for (int j = i + 1; j < n; j++) {
				double d = MetricUtils.euclideanDistance(points.get(i), points.get(j));
				distances[i][j] = d;
				distances[j][i] = d;
			}
		}
		return new DistanceMatrix(distances);
	}

	public int size() {
		return size;
	}

	public double getDistance(int point1, int point2) {
		return distances[point1][point2];
	}

	public boolean hasZeroDiagonal() {
		for (int i = 0; i < size; i++) {
			if(distances[i][i] != 0.0) {
				return false;
			}
		}
		return true;
	}

	public boolean isSymmetric(double tolerance) {
		for (int i = 0; i < size; i++) {
			for (int j = i + 1; j < size; j++) {
				if(Math.abs(distances[i][j] - distances[j][i]) > tolerance) {
					return false;
				}
			}
		}
		return true;
	}

	@Override
	public String toString() {
		return "DistanceMatrix[size=" + size + "]";
	}
}
