package com.github.micycle1.spectraldeform.coordinate;

import java.util.Map;

import org.apache.commons.math3.complex.Complex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.spectraldeform.profile.Profile;

/**
 * The complex coordinate transformation y = y(s) used by the spectral
 * deformation method, mapping s in [-1, 1] onto a contour that leaves the real
 * axis between {@code yStart} and {@code yEnd}:
 *
 * <pre>
 * y(s)   = yStart + (yEnd - yStart)(s + 1)/2 - (alpha + i)(beta0 + beta1 s)(s^2 - 1)
 * y'(s)  = (yEnd - yStart)/2 - (alpha + i)(beta1 (3s^2 - 1) + 2 beta0 s)
 * y''(s) = -2 (alpha + i)(3 beta1 s + beta0)
 * </pre>
 *
 * The endpoints are fixed for any parameters since (s^2 - 1) vanishes there.
 * <p>
 * References: J. D. Crawford and P. D. Hislop, Ann. Phys. 189, 265 (1989); J.
 * P. Boyd, <i>Chebyshev and Fourier Spectral Methods</i>, 2001.
 */
public final class ComplexCoordinate {

	private static final Logger LOGGER = LoggerFactory.getLogger(ComplexCoordinate.class);

	private final Profile profile;
	private final DeformationParameters parameters;
	private final double yStart;
	private final double yEnd;

	private ComplexCoordinate(Profile profile, DeformationParameters parameters, double yStart, double yEnd) {
		this.profile = profile;
		this.parameters = parameters;
		this.yStart = yStart;
		this.yEnd = yEnd;
	}

	public static ComplexCoordinate create(double yStart, double yEnd, double alpha, double beta0, double beta1) {
		return create(yStart, yEnd, new DeformationParameters(alpha, beta0, beta1));
	}

	public static ComplexCoordinate create(double yStart, double yEnd, DeformationParameters parameters) {
		final double halfWidth = (yEnd - yStart) / 2;
		final double beta0 = parameters.getBeta0();
		final double beta1 = parameters.getBeta1();
		final Complex factor = new Complex(parameters.getAlpha(), 1);

		Profile profile = Profile.builder(parameters.toString(), s -> {
			Complex affine = s.add(1).multiply(halfWidth).add(yStart);
			Complex shape = s.multiply(beta1).add(beta0);
			return affine.subtract(factor.multiply(shape).multiply(s.multiply(s).subtract(1)));
		}).firstDerivative(s -> {
			Complex shape = s.multiply(s).multiply(3).subtract(1).multiply(beta1).add(s.multiply(2 * beta0));
			return new Complex(halfWidth, 0).subtract(factor.multiply(shape));
		}).secondDerivative(s -> factor.multiply(s.multiply(3 * beta1).add(beta0)).multiply(-2)).build();

		LOGGER.debug("Complex coordinate {} on [{}, {}]", profile.getName(), yStart, yEnd);
		return new ComplexCoordinate(profile, parameters, yStart, yEnd);
	}

	/**
	 * @return true if the spectral deformation is in effect, i.e. any of alpha,
	 *         beta0, beta1 is nonzero
	 */
	public static boolean isDeformed(ComplexCoordinate coordinate) {
		return coordinate.parameters.isNonZero();
	}

	public boolean isDeformed() {
		return isDeformed(this);
	}

	public Profile getProfile() {
		return profile;
	}

	public DeformationParameters getParameters() {
		return parameters;
	}

	public Map<String, Double> getParams() {
		return parameters.asMap();
	}

	public String getName() {
		return profile.getName();
	}

	public double getYStart() {
		return yStart;
	}

	public double getYEnd() {
		return yEnd;
	}

	public Complex value(Complex s) {
		return profile.value().apply(s);
	}

	public Complex firstDerivative(Complex s) {
		return profile.firstDerivative().apply(s);
	}

	public Complex secondDerivative(Complex s) {
		return profile.secondDerivative().apply(s);
	}

	@Override
	public String toString() {
		return "ComplexCoordinate" + profile.getName() + " on [" + yStart + ", " + yEnd + "]";
	}
}
