package com.github.micycle1.spectraldeform;

/**
 * Thrown when a scalar argument is not a real number that a profile can
 * complexify (for example a {@code null} or an unsupported {@link Number}
 * subtype).
 */
public class InvalidArgumentTypeException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public InvalidArgumentTypeException(String message) {
		super(message);
	}
}
