package org.shirdrn.dm.medoids.common;

/**
 * Thrown when a clustering algorithm is configured with parameters outside
 * of their allowed range. The caller has to fix the inputs and construct a
 * new instance.
 */
public class InvalidParameterException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public InvalidParameterException(String message) {
		super(message);
	}

	public static void check(boolean expression, String message) {
		if(!expression) {
			throw new InvalidParameterException(message);
		}
	}
}
