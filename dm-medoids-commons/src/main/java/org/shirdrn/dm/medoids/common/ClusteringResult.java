package org.shirdrn.dm.medoids.common;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Final configuration produced by a medoid-based clustering run.
 */
public interface ClusteringResult {

	/**
	 * Medoid indices. The position of a medoid in this list is its cluster id.
	 */
	List<Integer> getMedoids();

	/**
	 * Medoid index to the indices of its members, the medoid included.
	 * Iteration order follows {@link #getMedoids()}.
	 */
	Map<Integer, Set<Integer>> getClusters();

	/**
	 * Sum over all clusters of the mean member-to-medoid distance.
	 */
	double getConfigurationCost();

	/**
	 * Configuration cost after seeding, followed by the cost after each accepted swap.
	 */
	List<Double> getCostHistory();

	int getIterations();

	int getAcceptedSwaps();

	boolean isConverged();

	/**
	 * Cluster id of each point, indexed by point.
	 */
	int[] getLabels();

	int getClusterId(int point);
}
