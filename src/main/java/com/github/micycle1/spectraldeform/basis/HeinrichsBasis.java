package com.github.micycle1.spectraldeform.basis;

import org.apache.commons.math3.complex.Complex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.spectraldeform.SpectralConstants;

/**
 * The Heinrichs basis H_n(s) = (1 - s^2) T_n(s), which vanishes at s = &plusmn;1
 * and so carries homogeneous Dirichlet conditions. Derivatives follow from the
 * product rule in terms of {@link ChebyshevBasis}.
 * <p>
 * The Chebyshev derivatives are singular at the endpoints and the (1 - s^2)
 * factor does not cancel this numerically (0 * NaN), for the first derivative
 * and beyond. When {@code s} is exactly the real value 1 or -1 the Chebyshev
 * terms are replaced by their closed-form limits, so every order returns a
 * finite boundary value.
 */
public final class HeinrichsBasis {

	private static final Logger LOGGER = LoggerFactory.getLogger(HeinrichsBasis.class);

	private HeinrichsBasis() {
	}

	/** (1 - s^2) T_n(s) */
	public static Complex value(int n, Complex s) {
		int side = ChebyshevBasis.endpointSide(s);
		return oneMinusSquare(s).multiply(chebyshev(0, n, s, side));
	}

	/** (1 - s^2) T_n' - 2s T_n */
	public static Complex firstDerivative(int n, Complex s) {
		int side = ChebyshevBasis.endpointSide(s);
		return oneMinusSquare(s).multiply(chebyshev(1, n, s, side)) //
				.subtract(s.multiply(2).multiply(chebyshev(0, n, s, side)));
	}

	/** (1 - s^2) T_n'' - 4s T_n' - 2 T_n */
	public static Complex secondDerivative(int n, Complex s) {
		int side = ChebyshevBasis.endpointSide(s);
		return oneMinusSquare(s).multiply(chebyshev(2, n, s, side)) //
				.subtract(s.multiply(4).multiply(chebyshev(1, n, s, side))) //
				.subtract(chebyshev(0, n, s, side).multiply(2));
	}

	/** (1 - s^2) T_n''' - 6s T_n'' - 6 T_n' */
	public static Complex thirdDerivative(int n, Complex s) {
		int side = ChebyshevBasis.endpointSide(s);
		return oneMinusSquare(s).multiply(chebyshev(3, n, s, side)) //
				.subtract(s.multiply(6).multiply(chebyshev(2, n, s, side))) //
				.subtract(chebyshev(1, n, s, side).multiply(6));
	}

	public static Complex derivative(int order, int n, Complex s) {
		switch (order) {
			case 0:
				return value(n, s);
			case 1:
				return firstDerivative(n, s);
			case 2:
				return secondDerivative(n, s);
			case 3:
				return thirdDerivative(n, s);
			default:
				throw new IllegalArgumentException("Derivative order must be in [0, " + SpectralConstants.MAX_DERIVATIVE_ORDER + "]: " + order);
		}
	}

	public static double value(int n, double s) {
		return value(n, new Complex(s, 0)).getReal();
	}

	public static double firstDerivative(int n, double s) {
		return firstDerivative(n, new Complex(s, 0)).getReal();
	}

	public static double secondDerivative(int n, double s) {
		return secondDerivative(n, new Complex(s, 0)).getReal();
	}

	public static double thirdDerivative(int n, double s) {
		return thirdDerivative(n, new Complex(s, 0)).getReal();
	}

	private static Complex chebyshev(int order, int n, Complex s, int side) {
		if (side == 0 || order == 0) {
			return ChebyshevBasis.derivative(order, n, s);
		}
		LOGGER.debug("Endpoint limit used for T_{}^({}) at s={}", n, order, side);
		return new Complex(ChebyshevBasis.endpointDerivative(order, n, side), 0);
	}

	private static Complex oneMinusSquare(Complex s) {
		return Complex.ONE.subtract(s.multiply(s));
	}
}
