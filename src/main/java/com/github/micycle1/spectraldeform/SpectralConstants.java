package com.github.micycle1.spectraldeform;

public class SpectralConstants {

	/** Highest derivative order supported by the basis evaluators. */
	public static final int MAX_DERIVATIVE_ORDER = 3;

	public static final String PARAM_ALPHA = "alpha";
	public static final String PARAM_BETA_0 = "beta_0";
	public static final String PARAM_BETA_1 = "beta_1";

	private SpectralConstants() {
	}
}
