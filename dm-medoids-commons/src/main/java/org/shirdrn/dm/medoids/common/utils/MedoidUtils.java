package org.shirdrn.dm.medoids.common.utils;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import org.shirdrn.dm.medoids.common.DistanceMatrix;
import org.shirdrn.dm.medoids.common.Neighbour;

import com.google.common.collect.Lists;

/**
 * Nearest-neighbour queries over a {@link DistanceMatrix}. Ties are broken in
 * favour of the candidate encountered first.
 */
public class MedoidUtils {

	/**
	 * Find the medoid closest to <code>point</code>, scanning medoids in list order.
	 * Returns {@link Neighbour#NONE} for an empty medoid list.
	 */
	public static Neighbour closestMedoid(DistanceMatrix distanceMatrix, List<Integer> medoids, int point) {
		int closestMedoid = -1;
		double closestDistance = Double.POSITIVE_INFINITY;
		for(int medoid : medoids) {
			double distance = distanceMatrix.getDistance(point, medoid);
			if(distance < closestDistance) {
				closestMedoid = medoid;
				closestDistance = distance;
			}
		}
		return closestMedoid < 0 ? Neighbour.NONE : new Neighbour(closestMedoid, closestDistance);
	}

	/**
	 * Find the point closest to <code>medoid</code> among all points not in
	 * <code>exception</code>, scanning points by ascending index.
	 * Returns {@link Neighbour#NONE} when every point is excluded.
	 */
	public static Neighbour closestPoint(DistanceMatrix distanceMatrix, int medoid, Set<Integer> exception) {
		int closestPoint = -1;
		double closestDistance = Double.POSITIVE_INFINITY;
		for (int point = 0; point < distanceMatrix.size(); point++) {
			if(exception.contains(point)) {
				continue;
			}
			double distance = distanceMatrix.getDistance(point, medoid);
			if(distance < closestDistance) {
				closestPoint = point;
				closestDistance = distance;
			}
		}
		return closestPoint < 0 ? Neighbour.NONE : new Neighbour(closestPoint, closestDistance);
	}

	/**
	 * Points <code>0..n-1</code> that are not in <code>medoids</code>, ascending.
	 */
	public static List<Integer> nonMedoids(int n, Collection<Integer> medoids) {
		List<Integer> nonMedoids = Lists.newArrayListWithCapacity(Math.max(0, n - medoids.size()));
		for (int point = 0; point < n; point++) {
			if(!medoids.contains(point)) {
				nonMedoids.add(point);
			}
		}
		return nonMedoids;
	}
}
