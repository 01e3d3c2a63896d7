package com.github.micycle1.spectraldeform.basis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.github.micycle1.spectraldeform.FiniteDifference;

class HeinrichsBasisTest {

	private static final double E = 1e-10;
	private static final double[] SAMPLES = { -0.85, -0.4, -0.05, 0.2, 0.6, 0.9 };

	@Test
	void definitionIsExactProduct() {
		for (int n = 0; n <= 8; n++) {
			for (double re : SAMPLES) {
				Complex s = new Complex(re, 0.1 * n);
				Complex expected = Complex.ONE.subtract(s.multiply(s)).multiply(ChebyshevBasis.value(n, s));
				assertEquals(expected, HeinrichsBasis.value(n, s));
			}
		}
	}

	@Test
	@DisplayName("Known values of H_3 = -4s^5 + 7s^3 - 3s at s = 0.5")
	void knownValuesDegree3() {
		assertEquals(-0.75, HeinrichsBasis.value(3, 0.5), E);
		assertEquals(1.0, HeinrichsBasis.firstDerivative(3, 0.5), E);
		assertEquals(11.0, HeinrichsBasis.secondDerivative(3, 0.5), E);
		assertEquals(-18.0, HeinrichsBasis.thirdDerivative(3, 0.5), E);
	}

	@Test
	@DisplayName("Each derivative matches a centred difference of the order below")
	void derivativesMatchFiniteDifferences() {
		for (int n = 0; n <= 8; n++) {
			for (double re : SAMPLES) {
				Complex s = new Complex(re, 0);
				for (int order = 1; order <= 3; order++) {
					final int lower = order - 1;
					final int degree = n;
					Complex fd = FiniteDifference.derivative(z -> HeinrichsBasis.derivative(lower, degree, z), s);
					FiniteDifference.assertClose(HeinrichsBasis.derivative(order, n, s), fd, "n=" + n + ", s=" + re + ", order=" + order);
				}
			}
		}
	}

	@Test
	@DisplayName("All orders are finite at both endpoints")
	void finiteAtEndpoints() {
		for (int n = 0; n <= 8; n++) {
			for (int order = 0; order <= 3; order++) {
				assertTrue(Double.isFinite(HeinrichsBasis.derivative(order, n, Complex.ONE).getReal()));
				assertTrue(Double.isFinite(HeinrichsBasis.derivative(order, n, new Complex(-1, 0)).getReal()));
			}
		}
	}

	@Test
	void endpointValuesMatchExplicitPolynomial() {
		// H_3' = -20s^4 + 21s^2 - 3, H_3'' = -80s^3 + 42s, H_3''' = -240s^2 + 42
		assertEquals(0.0, HeinrichsBasis.value(3, 1.0), E);
		assertEquals(-2.0, HeinrichsBasis.firstDerivative(3, 1.0), E);
		assertEquals(-38.0, HeinrichsBasis.secondDerivative(3, 1.0), E);
		assertEquals(-198.0, HeinrichsBasis.thirdDerivative(3, 1.0), E);

		assertEquals(0.0, HeinrichsBasis.value(3, -1.0), E);
		assertEquals(-2.0, HeinrichsBasis.firstDerivative(3, -1.0), E);
		assertEquals(38.0, HeinrichsBasis.secondDerivative(3, -1.0), E);
		assertEquals(-198.0, HeinrichsBasis.thirdDerivative(3, -1.0), E);
	}

	@Test
	void endpointValuesContinuousWithInterior() {
		double s = 1 - 1e-5;
		for (int n = 1; n <= 5; n++) {
			assertEquals(HeinrichsBasis.firstDerivative(n, 1.0), HeinrichsBasis.firstDerivative(n, s), 1e-2);
			assertEquals(HeinrichsBasis.secondDerivative(n, 1.0), HeinrichsBasis.secondDerivative(n, s), 1e-1);
		}
	}
}
