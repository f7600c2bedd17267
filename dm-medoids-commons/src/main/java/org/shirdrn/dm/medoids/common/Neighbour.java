package org.shirdrn.dm.medoids.common;

/**
 * Result of a nearest-neighbour query: the index found and its distance.
 * A query without any eligible candidate yields {@link #NONE}.
 */
public final class Neighbour {

	public static final Neighbour NONE = new Neighbour(-1, Double.POSITIVE_INFINITY);

	private final int index;
	private final double distance;

	public Neighbour(int index, double distance) {
		this.index = index;
		this.distance = distance;
	}

	public int getIndex() {
		return index;
	}

	public double getDistance() {
		return distance;
	}

	public boolean isNone() {
		return index < 0;
	}

	@Override
	public String toString() {
		return isNone() ? "Neighbour[none]" : "Neighbour[index=" + index + ", distance=" + distance + "]";
	}
}
