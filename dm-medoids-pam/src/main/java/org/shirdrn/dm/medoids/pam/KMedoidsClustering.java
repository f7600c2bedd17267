package org.shirdrn.dm.medoids.pam;

import java.io.File;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.shirdrn.dm.medoids.common.AbstractClustering;
import org.shirdrn.dm.medoids.common.ClusteringResult;
import org.shirdrn.dm.medoids.common.DistanceMatrix;
import org.shirdrn.dm.medoids.common.InvalidParameterException;
import org.shirdrn.dm.medoids.common.NamedThreadFactory;
import org.shirdrn.dm.medoids.common.Neighbour;
import org.shirdrn.dm.medoids.common.utils.ClusteringUtils;
import org.shirdrn.dm.medoids.common.utils.FileUtils;
import org.shirdrn.dm.medoids.common.utils.MedoidUtils;
import org.shirdrn.dm.medoids.pam.common.InitialMedoidsSelectionPolicy;
import org.shirdrn.dm.medoids.pam.common.MedoidAssignment;
import org.shirdrn.dm.medoids.pam.utils.ProbabilityWindowInitialMedoidsSelectionPolicy;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.MoreExecutors;

/**
 * K-medoids clustering over a distance matrix, a variant of PAM
 * (Partitioning Around Medoids).
 * <p>
 * Initial medoids come from an {@link InitialMedoidsSelectionPolicy}, by default
 * {@link ProbabilityWindowInitialMedoidsSelectionPolicy}. Points are then
 * distributed round-robin: medoids take turns, in list order, each claiming
 * its closest still unassigned point. This is not the classic "every point
 * goes to its nearest medoid" assignment, and can give a higher cost than it.
 * <p>
 * The configuration cost is the sum over clusters of the mean distance of the
 * members to their medoid. Each iteration tries every (medoid, non-medoid)
 * swap of the medoids current at the start of the iteration, and keeps a swap
 * as soon as it lowers the cost. Iterations stop when the improvement of the
 * last accepted swap is not above the tolerance, when no swap was accepted,
 * or after <code>maxIterations</code> iterations.
 * <p>
 * Instances are immutable; with <code>parallism > 1</code> candidate swaps are
 * evaluated on a thread pool, giving the same result as a sequential run.
 */
public class KMedoidsClustering extends AbstractClustering {

	private static final Log LOG = LogFactory.getLog(KMedoidsClustering.class);
	public static final int DEFAULT_K = 2;
	public static final double DEFAULT_START_PROB = 0.90;
	public static final double DEFAULT_END_PROB = 0.99;
	public static final int DEFAULT_MAX_ITERATIONS = 10;
	public static final double DEFAULT_TOLERANCE = 0.01;
	private static final int SWAPS_PER_WORKER = 4;
	private final int k;
	private final int n;
	private final InitialMedoidsSelectionPolicy initialMedoidsSelectionPolicy;

	public KMedoidsClustering(DistanceMatrix distanceMatrix) {
		this(distanceMatrix, DEFAULT_K);
	}

	public KMedoidsClustering(DistanceMatrix distanceMatrix, int k) {
		this(distanceMatrix, k, DEFAULT_START_PROB, DEFAULT_END_PROB);
	}

	public KMedoidsClustering(DistanceMatrix distanceMatrix, int k, double startProb, double endProb) {
		this(distanceMatrix, k, startProb, endProb, new Random());
	}

	public KMedoidsClustering(DistanceMatrix distanceMatrix, int k, double startProb, double endProb, Random random) {
		this(distanceMatrix, k, startProb, endProb, random, 1);
	}

	public KMedoidsClustering(DistanceMatrix distanceMatrix, int k, double startProb, double endProb, Random random, int parallism) {
		this(distanceMatrix, k, new ProbabilityWindowInitialMedoidsSelectionPolicy(startProb, endProb, random), parallism);
	}

	public KMedoidsClustering(DistanceMatrix distanceMatrix, int k, 
			InitialMedoidsSelectionPolicy initialMedoidsSelectionPolicy, int parallism) {
		super(distanceMatrix, parallism);
		Preconditions.checkArgument(initialMedoidsSelectionPolicy != null, "Required: initialMedoidsSelectionPolicy != null!");
		this.n = distanceMatrix.size();
		InvalidParameterException.check(k > 0, "Required: k > 0!");
		InvalidParameterException.check(k < n, "Required: k < number of points, but k=" + k + ", points=" + n + "!");
		this.k = k;
		this.initialMedoidsSelectionPolicy = initialMedoidsSelectionPolicy;
		if(!distanceMatrix.hasZeroDiagonal()) {
			LOG.warn("Distance matrix has a non-zero diagonal, results may be meaningless");
		}
		if(!distanceMatrix.isSymmetric(0.0)) {
			LOG.warn("Distance matrix is not symmetric, results depend on medoid/point order");
		}
		LOG.info("Config: k=" + k + ", points=" + n + ", parallism=" + parallism 
				+ ", initialMedoidsSelectionPolicy=" + initialMedoidsSelectionPolicy);
	}

	/**
	 * Select <code>k</code> initial medoids with the configured policy.
	 */
	public List<Integer> initializeMedoids() {
		List<Integer> medoids = initialMedoidsSelectionPolicy.select(k, distanceMatrix);
		Preconditions.checkState(medoids.size() == k && Sets.newHashSet(medoids).size() == k,
				"Policy %s must select %s distinct medoids, but got: %s", initialMedoidsSelectionPolicy, k, medoids);
		return Lists.newArrayList(medoids);
	}

	public Neighbour getClosestMedoid(List<Integer> medoids, int point) {
		return MedoidUtils.closestMedoid(distanceMatrix, medoids, point);
	}

	public Neighbour getClosestPoint(int medoid, Set<Integer> exception) {
		return MedoidUtils.closestPoint(distanceMatrix, medoid, exception);
	}

	public List<Integer> getNonMedoids(List<Integer> medoids) {
		return MedoidUtils.nonMedoids(n, medoids);
	}

	/**
	 * Build the clusters of the given medoids round-robin and compute the
	 * configuration cost.
	 */
	public MedoidAssignment associateMedoidsToClosestPoint(List<Integer> medoids) {
		Preconditions.checkArgument(!medoids.isEmpty(), "Required: at least one medoid!");
		Map<Integer, Set<Integer>> clusters = Maps.newLinkedHashMap();
		double[] clusterCosts = new double[medoids.size()];
		Set<Integer> alreadyAssociatedPoints = Sets.newHashSet();
		for(int medoid : medoids) {
			Preconditions.checkArgument(medoid >= 0 && medoid < n, "Medoid out of range: %s", medoid);
			Preconditions.checkArgument(alreadyAssociatedPoints.add(medoid), "Duplicated medoid: %s", medoid);
			Set<Integer> members = Sets.newLinkedHashSet();
			members.add(medoid);
			clusters.put(medoid, members);
		}

		int associatedPoints = alreadyAssociatedPoints.size();
		while(associatedPoints < n) {
			int associatedBefore = associatedPoints;
			for (int i = 0; i < medoids.size(); i++) {
				int medoid = medoids.get(i);
				Neighbour closest = getClosestPoint(medoid, alreadyAssociatedPoints);
				if(!closest.isNone()) {
					clusters.get(medoid).add(closest.getIndex());
					clusterCosts[i] += closest.getDistance();
					alreadyAssociatedPoints.add(closest.getIndex());
					associatedPoints++;
				}
			}
			Preconditions.checkState(associatedPoints > associatedBefore,
					"No medoid can reach the %s unassigned points", n - associatedPoints);
		}

		double configurationCost = 0.0;
		for (int i = 0; i < medoids.size(); i++) {
			configurationCost += clusterCosts[i] / clusters.get(medoids.get(i)).size();
		}
		return new MedoidAssignment(medoids, clusters, configurationCost);
	}

	public ClusteringResult run() {
		return run(DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE);
	}

	public ClusteringResult run(int maxIterations, double tolerance) {
		InvalidParameterException.check(maxIterations >= 0, "Required: maxIterations >= 0!");
		InvalidParameterException.check(tolerance >= 0, "Required: tolerance >= 0!");

		List<Integer> initialMedoids = initializeMedoids();
		LOG.info("Initial selected medoids: " + initialMedoids);
		MedoidAssignment best = associateMedoidsToClosestPoint(initialMedoids);
		List<Double> costHistory = Lists.newArrayList(best.getConfigurationCost());
		LOG.info("Initial configuration cost: " + best.getConfigurationCost());

		ExecutorService executorService = parallism > 1 
				? Executors.newFixedThreadPool(parallism, new NamedThreadFactory("SWAP"))
				: MoreExecutors.newDirectExecutorService();
		int window = parallism > 1 ? parallism * SWAPS_PER_WORKER : 1;
		double costChange = Double.POSITIVE_INFINITY;
		int iteration = 0;
		int acceptedSwaps = 0;
		try {
			while(costChange > tolerance && iteration < maxIterations) {
				costChange = 0.0;
				List<Swap> swaps = enumerateSwaps(best.getMedoids());

				// candidates are evaluated window by window, in scan order; an accepted
				// swap invalidates the rest of the window, so it is evaluated again
				int position = 0;
				while(position < swaps.size()) {
					int end = Math.min(swaps.size(), position + window);
					List<Future<MedoidAssignment>> futures = submit(executorService, swaps.subList(position, end), best.getMedoids());
					int next = end;
					for (int i = 0; i < futures.size(); i++) {
						MedoidAssignment candidate = get(futures.get(i));
						if(candidate != null && candidate.getConfigurationCost() < best.getConfigurationCost()) {
							costChange = best.getConfigurationCost() - candidate.getConfigurationCost();
							LOG.debug("Swap accepted: " + swaps.get(position + i) + ", cost " 
									+ best.getConfigurationCost() + " -> " + candidate.getConfigurationCost());
							best = candidate;
							costHistory.add(best.getConfigurationCost());
							acceptedSwaps++;
							cancel(futures.subList(i + 1, futures.size()));
							next = position + i + 1;
							break;
						}
					}
					position = next;
				}
				LOG.info("Iteration #" + (++iteration) + ": medoids=" + best.getMedoids() 
						+ ", cost=" + best.getConfigurationCost() + ", costChange=" + costChange);
			}
		} finally {
			executorService.shutdownNow();
		}

		boolean converged = costChange <= tolerance;
		ClusteringResult result = best.toClusteringResult(costHistory, iteration, acceptedSwaps, converged);
		LOG.info("Clustering finished: " + result);
		return result;
	}

	@Override
	public void clustering() {
		setClusteringResult(run());
	}

	public int getK() {
		return k;
	}

	private List<Swap> enumerateSwaps(List<Integer> medoids) {
		List<Integer> nonMedoids = getNonMedoids(medoids);
		List<Swap> swaps = Lists.newArrayListWithCapacity(medoids.size() * nonMedoids.size());
		for(int medoid : medoids) {
			for(int nonMedoid : nonMedoids) {
				swaps.add(new Swap(medoid, nonMedoid));
			}
		}
		return swaps;
	}

	private List<Future<MedoidAssignment>> submit(ExecutorService executorService, List<Swap> swaps, List<Integer> currentMedoids) {
		List<Future<MedoidAssignment>> futures = Lists.newArrayListWithCapacity(swaps.size());
		for(Swap swap : swaps) {
			final List<Integer> candidate = swap.apply(currentMedoids);
			futures.add(executorService.submit(new Callable<MedoidAssignment>() {
				@Override
				public MedoidAssignment call() throws Exception {
					return candidate == null ? null : associateMedoidsToClosestPoint(candidate);
				}
			}));
		}
		return futures;
	}

	private MedoidAssignment get(Future<MedoidAssignment> future) {
		try {
			return future.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw Throwables.propagate(e);
		} catch (ExecutionException e) {
			throw Throwables.propagate(e.getCause());
		}
	}

	private void cancel(List<Future<MedoidAssignment>> futures) {
		for(Future<MedoidAssignment> future : futures) {
			future.cancel(true);
		}
	}

	/**
	 * Replace a medoid with a non-medoid point.
	 */
	static class Swap {

		final int medoid;
		final int nonMedoid;

		Swap(int medoid, int nonMedoid) {
			this.medoid = medoid;
			this.nonMedoid = nonMedoid;
		}

		/**
		 * Candidate medoid list: <code>medoid</code> removed, <code>nonMedoid</code> appended.
		 * Returns <code>null</code> if the swap no longer applies to <code>medoids</code>
		 * because an earlier swap of the same iteration removed <code>medoid</code> or
		 * promoted <code>nonMedoid</code>.
		 */
		List<Integer> apply(List<Integer> medoids) {
			if(!medoids.contains(medoid) || medoids.contains(nonMedoid)) {
				return null;
			}
			List<Integer> candidate = Lists.newArrayList(medoids);
			candidate.remove(Integer.valueOf(medoid));
			candidate.add(nonMedoid);
			return candidate;
		}

		@Override
		public String toString() {
			return "Swap[" + medoid + " -> " + nonMedoid + "]";
		}
	}

	public static void main(String[] args) {
		DistanceMatrix distanceMatrix;
		int k = DEFAULT_K;
		if(args.length > 0) {
			distanceMatrix = FileUtils.readDistanceMatrix(new File(args[0]));
			if(args.length > 1) {
				k = Integer.parseInt(args[1]);
			}
		} else {
			distanceMatrix = new DistanceMatrix(new double[][] {
				{0, 1, 2, 3, 4},
				{1, 0, 1, 2, 3},
				{2, 1, 0, 1, 2},
				{3, 2, 1, 0, 1},
				{4, 3, 2, 1, 0}
			});
		}
		KMedoidsClustering c = new KMedoidsClustering(distanceMatrix, k);
		c.clustering();

		ClusteringResult result = c.getClusteringResult();
		System.out.println("== Medoids ==");
		System.out.println(result.getMedoids());
		System.out.println("== Clusters ==");
		System.out.println(ClusteringUtils.formatClusters(result));
		System.out.println("== Clustered points ==");
		ClusteringUtils.printClusters(result);
	}

}
