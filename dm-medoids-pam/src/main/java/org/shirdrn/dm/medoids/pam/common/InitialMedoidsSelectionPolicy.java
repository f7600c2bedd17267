package org.shirdrn.dm.medoids.pam.common;

import java.util.List;

import org.shirdrn.dm.medoids.common.DistanceMatrix;

public interface InitialMedoidsSelectionPolicy {

	/**
	 * Select <code>k</code> distinct point indices as initial medoids, in selection order.
	 */
	List<Integer> select(int k, DistanceMatrix distanceMatrix);
}
