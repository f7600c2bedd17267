package org.shirdrn.dm.medoids.common.utils;

import java.util.Iterator;
import java.util.Map.Entry;
import java.util.Set;

import org.shirdrn.dm.medoids.common.ClusteringResult;

import com.google.common.base.Joiner;

public class ClusteringUtils {

	/**
	 * Print one <code>point,clusterId</code> line per point.
	 */
	public static void printClusters(ClusteringResult result) {
		int[] labels = result.getLabels();
		for (int point = 0; point < labels.length; point++) {
			System.out.println(point + "," + labels[point]);
		}
	}

	/**
	 * Render clusters as <code>medoid=[members]</code>, separated by <code>; </code>.
	 */
	public static String formatClusters(ClusteringResult result) {
		StringBuilder sb = new StringBuilder();
		Iterator<Entry<Integer, Set<Integer>>> iter = result.getClusters().entrySet().iterator();
		while(iter.hasNext()) {
			Entry<Integer, Set<Integer>> entry = iter.next();
			sb.append(entry.getKey()).append("=[").append(Joiner.on(", ").join(entry.getValue())).append("]");
			if(iter.hasNext()) {
				sb.append("; ");
			}
		}
		return sb.toString();
	}
}
