package org.shirdrn.dm.medoids.common.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.shirdrn.dm.medoids.common.ClusteringResult;
import org.shirdrn.dm.medoids.common.GenericClusteringResult;

public class ClusteringUtilsTest {

	@Test
	public void testFormatClusters() {
		Map<Integer, Set<Integer>> clusters = new LinkedHashMap<Integer, Set<Integer>>();
		clusters.put(1, new LinkedHashSet<Integer>(Arrays.asList(1, 0, 2)));
		clusters.put(4, new LinkedHashSet<Integer>(Arrays.asList(4, 3)));
		ClusteringResult result = new GenericClusteringResult(Arrays.asList(1, 4), clusters, 
				7.0 / 6, Collections.singletonList(7.0 / 6), 1, 0, true);

		assertEquals("1=[1, 0, 2]; 4=[4, 3]", ClusteringUtils.formatClusters(result));
	}
}
