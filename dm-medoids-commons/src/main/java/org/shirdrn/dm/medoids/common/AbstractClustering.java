package org.shirdrn.dm.medoids.common;

import com.google.common.base.Preconditions;

public abstract class AbstractClustering implements Clustering {

	protected final DistanceMatrix distanceMatrix;
	protected final int parallism;
	private volatile ClusteringResult clusteringResult;

	public AbstractClustering(DistanceMatrix distanceMatrix) {
		this(distanceMatrix, 1);
	}

	public AbstractClustering(DistanceMatrix distanceMatrix, int parallism) {
		super();
		Preconditions.checkArgument(distanceMatrix != null, "Required: distanceMatrix != null!");
		InvalidParameterException.check(parallism > 0, "Required: parallism > 0!");
		this.distanceMatrix = distanceMatrix;
		this.parallism = parallism;
	}

	protected void setClusteringResult(ClusteringResult clusteringResult) {
		this.clusteringResult = clusteringResult;
	}

	@Override
	public int getClusteredCount() {
		ClusteringResult result = clusteringResult;
		return result == null ? 0 : result.getLabels().length;
	}

	@Override
	public ClusteringResult getClusteringResult() {
		return clusteringResult;
	}

	public DistanceMatrix getDistanceMatrix() {
		return distanceMatrix;
	}

}
