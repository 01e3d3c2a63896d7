package com.github.micycle1.spectraldeform;

/**
 * Thrown when eigen-matrix dimensions, validity flags or per-mode quantity
 * arrays disagree on the number of modes.
 */
public class ShapeMismatchException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public ShapeMismatchException(String message) {
		super(message);
	}
}
