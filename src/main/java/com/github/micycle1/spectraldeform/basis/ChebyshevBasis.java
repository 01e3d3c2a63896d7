package com.github.micycle1.spectraldeform.basis;

import org.apache.commons.math3.complex.Complex;

import com.github.micycle1.spectraldeform.SpectralConstants;

/**
 * Chebyshev polynomials of the first kind, T_n(s) = cos(n arccos s), and their
 * first three derivatives. All evaluations go through the trigonometric
 * substitution t = arccos(s), continued analytically for complex s.
 * <p>
 * The derivative forms divide by sin(t), which vanishes at s = &plusmn;1. At
 * those two points the derivatives come back NaN or infinite; this is not
 * trapped. Callers that need boundary values should use
 * {@link #endpointDerivative(int, int, int)}.
 * <p>
 * Reference: J. P. Boyd, <i>Chebyshev and Fourier Spectral Methods</i>, 2001.
 */
public final class ChebyshevBasis {

	private ChebyshevBasis() {
	}

	/**
	 * T_n(s).
	 *
	 * @param n degree, non-negative
	 * @param s position, real or complex
	 * @return cos(n arccos s)
	 */
	public static Complex value(int n, Complex s) {
		checkDegree(n);
		return s.acos().multiply(n).cos();
	}

	/**
	 * T_n'(s) = n sin(nt) / sin(t). Non-finite at s = &plusmn;1.
	 */
	public static Complex firstDerivative(int n, Complex s) {
		checkDegree(n);
		Complex t = s.acos();
		return t.multiply(n).sin().multiply(n).divide(t.sin());
	}

	/**
	 * T_n''(s) = (-n^2 cos(nt) + T_n'(s) cos(t)) / sin^2(t). Non-finite at s =
	 * &plusmn;1.
	 */
	public static Complex secondDerivative(int n, Complex s) {
		checkDegree(n);
		Complex t = s.acos();
		Complex sin = t.sin();
		Complex numerator = t.multiply(n).cos().multiply(-(double) n * n).add(firstDerivative(n, s).multiply(t.cos()));
		return numerator.divide(sin.multiply(sin));
	}

	/**
	 * T_n'''(s) = ((1 - n^2) T_n'(s) + 3 T_n''(s) cos(t)) / sin^2(t). Non-finite at
	 * s = &plusmn;1.
	 */
	public static Complex thirdDerivative(int n, Complex s) {
		checkDegree(n);
		Complex t = s.acos();
		Complex sin = t.sin();
		Complex numerator = firstDerivative(n, s).multiply(1.0 - (double) n * n).add(secondDerivative(n, s).multiply(t.cos()).multiply(3));
		return numerator.divide(sin.multiply(sin));
	}

	/**
	 * Dispatches on derivative order (0 is the value itself).
	 */
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

	/**
	 * Closed-form limit of the k-th derivative at an endpoint,
	 * <code>T_n^(k)(&plusmn;1) = (&plusmn;1)^(n+k) prod_{j&lt;k} (n^2 - j^2) / (2j + 1)</code>.
	 *
	 * @param order derivative order, 0 to 3
	 * @param n     degree
	 * @param side  +1 for s = 1, -1 for s = -1
	 * @return the finite boundary value
	 */
	public static double endpointDerivative(int order, int n, int side) {
		checkDegree(n);
		if (order < 0 || order > SpectralConstants.MAX_DERIVATIVE_ORDER) {
			throw new IllegalArgumentException("Derivative order must be in [0, " + SpectralConstants.MAX_DERIVATIVE_ORDER + "]: " + order);
		}
		if (side != 1 && side != -1) {
			throw new IllegalArgumentException("Endpoint side must be +1 or -1: " + side);
		}
		double n2 = (double) n * n;
		double product = 1;
		for (int j = 0; j < order; j++) {
			product *= (n2 - (double) j * j) / (2 * j + 1);
		}
		if (side < 0 && (n + order) % 2 != 0) {
			product = -product;
		}
		return product;
	}

	/**
	 * @return +1 or -1 if {@code s} is exactly the real endpoint 1 or -1, else 0
	 */
	public static int endpointSide(Complex s) {
		if (s.getImaginary() != 0) {
			return 0;
		}
		if (s.getReal() == 1.0) {
			return 1;
		}
		if (s.getReal() == -1.0) {
			return -1;
		}
		return 0;
	}

	static void checkDegree(int n) {
		if (n < 0) {
			throw new IllegalArgumentException("Degree must be non-negative: " + n);
		}
	}
}
