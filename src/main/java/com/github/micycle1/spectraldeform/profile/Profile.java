package com.github.micycle1.spectraldeform.profile;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.function.UnaryOperator;

import org.apache.commons.math3.complex.Complex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.spectraldeform.DerivativeNotConfiguredException;
import com.github.micycle1.spectraldeform.InvalidArgumentTypeException;

/**
 * An analytic scalar profile, such as a background field, given as a complex
 * function together with (optionally) its first and second derivatives.
 * <p>
 * Instances are immutable and safe to share between threads, as long as the
 * supplied functions are themselves side-effect free.
 * <p>
 * The real accessors ({@link #realValue(double)} and friends) evaluate the
 * complex function at {@code (x, 0)} and keep only the real part.
 */
public final class Profile {

	private static final Logger LOGGER = LoggerFactory.getLogger(Profile.class);

	private final String name;
	private final String label;
	private final UnaryOperator<Complex> value;
	private final UnaryOperator<Complex> firstDerivative; // nullable
	private final UnaryOperator<Complex> secondDerivative; // nullable

	private Profile(Builder builder) {
		this.name = builder.name;
		this.label = builder.label != null ? builder.label : builder.name;
		this.value = builder.value;
		this.firstDerivative = builder.firstDerivative;
		this.secondDerivative = builder.secondDerivative;
	}

	public static Builder builder(String name, UnaryOperator<Complex> value) {
		return new Builder(name, value);
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the display label; the name when none was given
	 */
	public String getLabel() {
		return label;
	}

	public UnaryOperator<Complex> value() {
		return value;
	}

	/**
	 * @throws DerivativeNotConfiguredException if the profile has no first
	 *                                          derivative
	 */
	public UnaryOperator<Complex> firstDerivative() {
		return require(firstDerivative, 1);
	}

	/**
	 * @throws DerivativeNotConfiguredException if the profile has no second
	 *                                          derivative
	 */
	public UnaryOperator<Complex> secondDerivative() {
		return require(secondDerivative, 2);
	}

	public boolean hasFirstDerivative() {
		return firstDerivative != null;
	}

	public boolean hasSecondDerivative() {
		return secondDerivative != null;
	}

	/**
	 * Evaluates the profile (order 0) or one of its derivatives at a complex
	 * point.
	 */
	public Complex evaluate(int order, Complex z) {
		switch (order) {
			case 0:
				return value.apply(z);
			case 1:
				return firstDerivative().apply(z);
			case 2:
				return secondDerivative().apply(z);
			default:
				throw new IllegalArgumentException("Profile derivative order must be 0, 1 or 2: " + order);
		}
	}

	public double realValue(double x) {
		return value.apply(complexify(x)).getReal();
	}

	public double realFirstDerivative(double x) {
		return firstDerivative().apply(complexify(x)).getReal();
	}

	public double realSecondDerivative(double x) {
		return secondDerivative().apply(complexify(x)).getReal();
	}

	/**
	 * Boxed variant for call sites holding an untyped number.
	 *
	 * @throws InvalidArgumentTypeException if {@code x} is null or not a real
	 *                                      numeric type
	 */
	public double realValue(Number x) {
		return realValue(toReal(x));
	}

	public double realFirstDerivative(Number x) {
		return realFirstDerivative(toReal(x));
	}

	public double realSecondDerivative(Number x) {
		return realSecondDerivative(toReal(x));
	}

	private static Complex complexify(double x) {
		return new Complex(x, 0);
	}

	private double toReal(Number x) {
		if (x instanceof Double || x instanceof Float || x instanceof Integer || x instanceof Long || x instanceof Short || x instanceof Byte
				|| x instanceof BigDecimal || x instanceof BigInteger) {
			return x.doubleValue();
		}
		String type = x == null ? "null" : x.getClass().getName();
		LOGGER.error("{}: Invalid type of the argument ({})", name, type);
		throw new InvalidArgumentTypeException("Profile '" + name + "' expects a real number, got " + type);
	}

	private UnaryOperator<Complex> require(UnaryOperator<Complex> function, int order) {
		if (function == null) {
			LOGGER.error("{}: Derivative of order {} has not been set", name, order);
			throw new DerivativeNotConfiguredException(name, order);
		}
		return function;
	}

	@Override
	public String toString() {
		return "Profile[" + name + (hasFirstDerivative() ? ", d1" : "") + (hasSecondDerivative() ? ", d2" : "") + "]";
	}

	public static final class Builder {

		private final String name;
		private final UnaryOperator<Complex> value;
		private UnaryOperator<Complex> firstDerivative;
		private UnaryOperator<Complex> secondDerivative;
		private String label;

		private Builder(String name, UnaryOperator<Complex> value) {
			this.name = Objects.requireNonNull(name, "name");
			this.value = Objects.requireNonNull(value, "value");
		}

		public Builder firstDerivative(UnaryOperator<Complex> firstDerivative) {
			this.firstDerivative = firstDerivative;
			return this;
		}

		public Builder secondDerivative(UnaryOperator<Complex> secondDerivative) {
			this.secondDerivative = secondDerivative;
			return this;
		}

		public Builder label(String label) {
			this.label = label;
			return this;
		}

		public Profile build() {
			return new Profile(this);
		}
	}
}
