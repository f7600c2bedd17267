package org.shirdrn.dm.medoids.common;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

public class GenericClusteringResult implements ClusteringResult {

	private final ImmutableList<Integer> medoids;
	private final ImmutableMap<Integer, Set<Integer>> clusters;
	private final double configurationCost;
	private final ImmutableList<Double> costHistory;
	private final int iterations;
	private final int acceptedSwaps;
	private final boolean converged;
	private final int[] labels;

	public GenericClusteringResult(List<Integer> medoids, Map<Integer, ? extends Set<Integer>> clusters,
			double configurationCost, List<Double> costHistory, int iterations, int acceptedSwaps, boolean converged) {
		super();
		Preconditions.checkArgument(medoids.size() == clusters.size(),
				"Required: one cluster per medoid, medoids=%s, clusters=%s", medoids, clusters.keySet());
		this.medoids = ImmutableList.copyOf(medoids);
		this.configurationCost = configurationCost;
		this.costHistory = ImmutableList.copyOf(costHistory);
		this.iterations = iterations;
		this.acceptedSwaps = acceptedSwaps;
		this.converged = converged;

		int pointCount = 0;
		ImmutableMap.Builder<Integer, Set<Integer>> builder = ImmutableMap.builder();
		for(Integer medoid : medoids) {
			Set<Integer> members = clusters.get(medoid);
			Preconditions.checkArgument(members != null, "No cluster for medoid %s", medoid);
			builder.put(medoid, ImmutableSet.copyOf(members));
			pointCount += members.size();
		}
		this.clusters = builder.build();

		labels = new int[pointCount];
		Arrays.fill(labels, -1);
		int clusterId = 0;
		for(Entry<Integer, Set<Integer>> entry : this.clusters.entrySet()) {
			for(int point : entry.getValue()) {
				Preconditions.checkArgument(point >= 0 && point < pointCount && labels[point] == -1,
						"Clusters are not a partition of 0..%s, offending point: %s", pointCount - 1, point);
				labels[point] = clusterId;
			}
			clusterId++;
		}
	}

	@Override
	public List<Integer> getMedoids() {
		return medoids;
	}

	@Override
	public Map<Integer, Set<Integer>> getClusters() {
		return clusters;
	}

	@Override
	public double getConfigurationCost() {
		return configurationCost;
	}

	@Override
	public List<Double> getCostHistory() {
		return costHistory;
	}

	@Override
	public int getIterations() {
		return iterations;
	}

	@Override
	public int getAcceptedSwaps() {
		return acceptedSwaps;
	}

	@Override
	public boolean isConverged() {
		return converged;
	}

	@Override
	public int[] getLabels() {
		return labels.clone();
	}

	@Override
	public int getClusterId(int point) {
		return labels[point];
	}

	@Override
	public String toString() {
		return "ClusteringResult[medoids=" + medoids + ", cost=" + configurationCost 
				+ ", iterations=" + iterations + ", acceptedSwaps=" + acceptedSwaps + ", converged=" + converged + "]";
	}
}
