package com.github.micycle1.spectraldeform.coordinate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.github.micycle1.spectraldeform.SpectralConstants;

/**
 * Parameters of the complex coordinate map: the deformation amplitude
 * {@code alpha} and the shape coefficients {@code beta_0}, {@code beta_1}.
 */
public final class DeformationParameters {

	/** All-zero parameters; the map reduces to the affine map onto [yStart, yEnd]. */
	public static final DeformationParameters NONE = new DeformationParameters(0, 0, 0);

	private final double alpha;
	private final double beta0;
	private final double beta1;

	public DeformationParameters(double alpha, double beta0, double beta1) {
		this.alpha = alpha;
		this.beta0 = beta0;
		this.beta1 = beta1;
	}

	public double getAlpha() {
		return alpha;
	}

	public double getBeta0() {
		return beta0;
	}

	public double getBeta1() {
		return beta1;
	}

	/**
	 * @return true if any parameter is nonzero
	 */
	public boolean isNonZero() {
		return alpha != 0 || beta0 != 0 || beta1 != 0;
	}

	/**
	 * @return read-only map keyed {@code alpha}, {@code beta_0}, {@code beta_1}, in
	 *         that order
	 */
	public Map<String, Double> asMap() {
		Map<String, Double> map = new LinkedHashMap<>();
		map.put(SpectralConstants.PARAM_ALPHA, alpha);
		map.put(SpectralConstants.PARAM_BETA_0, beta0);
		map.put(SpectralConstants.PARAM_BETA_1, beta1);
		return Collections.unmodifiableMap(map);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof DeformationParameters)) {
			return false;
		}
		DeformationParameters other = (DeformationParameters) o;
		return Double.compare(alpha, other.alpha) == 0 && Double.compare(beta0, other.beta0) == 0 && Double.compare(beta1, other.beta1) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(alpha, beta0, beta1);
	}

	@Override
	public String toString() {
		return "[a" + alpha + "b" + beta0 + "b" + beta1 + "]";
	}
}
