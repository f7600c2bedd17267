package org.shirdrn.dm.medoids.pam.common;

import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.shirdrn.dm.medoids.common.ClusteringResult;
import org.shirdrn.dm.medoids.common.GenericClusteringResult;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Clusters built around a candidate medoid list, together with the
 * configuration cost of that candidate.
 */
public class MedoidAssignment {

	private final ImmutableList<Integer> medoids;
	private final ImmutableMap<Integer, Set<Integer>> clusters;
	private final double configurationCost;

	public MedoidAssignment(List<Integer> medoids, Map<Integer, Set<Integer>> clusters, double configurationCost) {
		super();
		this.medoids = ImmutableList.copyOf(medoids);
		ImmutableMap.Builder<Integer, Set<Integer>> builder = ImmutableMap.builder();
		for(Entry<Integer, Set<Integer>> entry : clusters.entrySet()) {
			builder.put(entry.getKey(), ImmutableSet.copyOf(entry.getValue()));
		}
		this.clusters = builder.build();
		this.configurationCost = configurationCost;
	}

	public List<Integer> getMedoids() {
		return medoids;
	}

	public Map<Integer, Set<Integer>> getClusters() {
		return clusters;
	}

	public double getConfigurationCost() {
		return configurationCost;
	}

	public ClusteringResult toClusteringResult(List<Double> costHistory, int iterations, int acceptedSwaps, boolean converged) {
		return new GenericClusteringResult(medoids, clusters, configurationCost, costHistory, iterations, acceptedSwaps, converged);
	}

	@Override
	public String toString() {
		return "MedoidAssignment[medoids=" + medoids + ", cost=" + configurationCost + "]";
	}
}
