package org.shirdrn.dm.medoids.common;

/**
 * A point on the plane, used to derive a {@link DistanceMatrix} when
 * coordinates are available.
 */
public class Point2D {

	protected final double x;
	protected final double y;

	public Point2D(double x, double y) {
		super();
		this.x = x;
		this.y = y;
	}

	public double getX() {
		return x;
	}

	public double getY() {
		return y;
	}

	@Override
	public int hashCode() {
		return 31 * Double.hashCode(x) + Double.hashCode(y);
	}

	@Override
	public boolean equals(Object obj) {
		if(!(obj instanceof Point2D)) {
			return false;
		}
		Point2D other = (Point2D) obj;
		return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
	}

	@Override
	public String toString() {
		return "(" + x + ", " + y + ")";
	}

}
