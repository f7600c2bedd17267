package org.shirdrn.dm.medoids.common.utils;

import org.shirdrn.dm.medoids.common.Point2D;

public class MetricUtils {

	public static double euclideanDistance(Point2D p1, Point2D p2) {
		double diffX = p1.getX() - p2.getX();
		double diffY = p1.getY() - p2.getY();
		return Math.sqrt(diffX * diffX + diffY * diffY);
	}

}
