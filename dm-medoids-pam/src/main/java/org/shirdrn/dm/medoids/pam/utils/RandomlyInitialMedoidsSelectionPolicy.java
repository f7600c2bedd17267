package org.shirdrn.dm.medoids.pam.utils;

import java.util.List;
import java.util.Random;
import java.util.Set;

import org.shirdrn.dm.medoids.common.DistanceMatrix;
import org.shirdrn.dm.medoids.pam.common.InitialMedoidsSelectionPolicy;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

/**
 * Select initial medoids uniformly at random.
 */
public class RandomlyInitialMedoidsSelectionPolicy implements InitialMedoidsSelectionPolicy {

	private final Random random;

	public RandomlyInitialMedoidsSelectionPolicy() {
		this(new Random());
	}

	public RandomlyInitialMedoidsSelectionPolicy(Random random) {
		super();
		Preconditions.checkArgument(random != null, "Required: random != null!");
		this.random = random;
	}

	@Override
	public List<Integer> select(int k, DistanceMatrix distanceMatrix) {
		int n = distanceMatrix.size();
		Preconditions.checkArgument(k > 0 && k <= n, "Required: 0 < k <= %s, but k=%s!", n, k);
		Set<Integer> selectedPoints = Sets.newLinkedHashSet();
		while(selectedPoints.size() < k) {
			selectedPoints.add(random.nextInt(n));
		}
		return Lists.newArrayList(selectedPoints);
	}

}
