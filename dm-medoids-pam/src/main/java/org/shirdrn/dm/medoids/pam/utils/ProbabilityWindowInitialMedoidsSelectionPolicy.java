package org.shirdrn.dm.medoids.pam.utils;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.shirdrn.dm.medoids.common.DistanceMatrix;
import org.shirdrn.dm.medoids.common.InvalidParameterException;
import org.shirdrn.dm.medoids.common.Neighbour;
import org.shirdrn.dm.medoids.common.utils.MedoidUtils;
import org.shirdrn.dm.medoids.pam.common.InitialMedoidsSelectionPolicy;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * K-means++ like seeding. After a first medoid chosen uniformly at random,
 * every further medoid is drawn uniformly from a window of the non-medoid
 * points sorted by their distance to the closest medoid selected so far.
 * <p>
 * The window is given as fractions of that sorted list: with the defaults
 * <code>[0.90, 0.99]</code> medoids come from the far tail, but never from
 * the most distant outliers.
 */
public class ProbabilityWindowInitialMedoidsSelectionPolicy implements InitialMedoidsSelectionPolicy {

	private static final Log LOG = LogFactory.getLog(ProbabilityWindowInitialMedoidsSelectionPolicy.class);
	private static final Comparator<Neighbour> BY_DISTANCE = new Comparator<Neighbour>() {
		@Override
		public int compare(Neighbour o1, Neighbour o2) {
			return Double.compare(o1.getDistance(), o2.getDistance());
		}
	};
	private final double startProb;
	private final double endProb;
	private final Random random;

	public ProbabilityWindowInitialMedoidsSelectionPolicy(double startProb, double endProb, Random random) {
		super();
		InvalidParameterException.check(0 <= startProb && startProb < endProb && endProb <= 1,
				"Required: 0 <= startProb < endProb <= 1, but startProb=" + startProb + ", endProb=" + endProb + "!");
		Preconditions.checkArgument(random != null, "Required: random != null!");
		this.startProb = startProb;
		this.endProb = endProb;
		this.random = random;
		LOG.debug("Config: startProb=" + startProb + ", endProb=" + endProb);
	}

	@Override
	public List<Integer> select(int k, DistanceMatrix distanceMatrix) {
		int n = distanceMatrix.size();
		Preconditions.checkArgument(k > 0 && k <= n, "Required: 0 < k <= %s, but k=%s!", n, k);
		List<Integer> medoids = Lists.newArrayList();
		medoids.add(random.nextInt(n));
		LOG.debug("First medoid got: " + medoids.get(0));

		while(medoids.size() < k) {
			// distance of each non-medoid point to its closest medoid
			List<Neighbour> distances = Lists.newArrayList();
			for(int point : MedoidUtils.nonMedoids(n, medoids)) {
				double distance = MedoidUtils.closestMedoid(distanceMatrix, medoids, point).getDistance();
				distances.add(new Neighbour(point, distance));
			}
			Collections.sort(distances, BY_DISTANCE);

			int[] window = window(distances.size());
			int index = window[0] + random.nextInt(window[1] - window[0] + 1);
			int medoid = distances.get(index).getIndex();
			LOG.debug("Medoid got: point=" + medoid + ", window=[" + window[0] + ", " + window[1] + "], candidates=" + distances.size());
			medoids.add(medoid);
		}
		return medoids;
	}

	/**
	 * Inclusive bounds of the selection window over <code>count</code> sorted candidates.
	 * Bounds in reverse order are swapped; both are kept inside <code>[0, count-1]</code>.
	 */
	int[] window(int count) {
		int startIdx = (int) Math.floor(startProb * count);
		int endIdx = (int) Math.round(endProb * (count - 1));
		int low = Math.max(0, Math.min(startIdx, endIdx));
		int high = Math.min(count - 1, Math.max(startIdx, endIdx));
		return new int[] { low, high };
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[startProb=" + startProb + ", endProb=" + endProb + "]";
	}
}
