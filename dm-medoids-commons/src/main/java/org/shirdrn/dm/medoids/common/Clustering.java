package org.shirdrn.dm.medoids.common;

public interface Clustering {

	/**
	 * Run the algorithm with its default settings and keep the result.
	 */
	void clustering();

	/**
	 * Number of points covered by the last result, 0 if never run.
	 */
	int getClusteredCount();

	/**
	 * Result of the last {@link #clustering()} call, or <code>null</code>.
	 */
	ClusteringResult getClusteringResult();
}
