package com.github.micycle1.spectraldeform.coordinate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.github.micycle1.spectraldeform.FiniteDifference;

class ComplexCoordinateTest {

	private static final double E = 1e-12;
	private static final double Y_START = -3.0;
	private static final double Y_END = 5.0;

	private static final List<DeformationParameters> PARAMETER_SETS = List.of( //
			DeformationParameters.NONE, //
			new DeformationParameters(0.5, 0.2, 0.0), //
			new DeformationParameters(-1.3, 0.7, -0.4), //
			new DeformationParameters(0.0, 0.0, 1.1), //
			new DeformationParameters(2.0, -0.6, 0.9));

	private static final Complex[] SAMPLES = { new Complex(-0.9, 0), new Complex(-0.3, 0), new Complex(0.0, 0), new Complex(0.4, 0),
			new Complex(0.85, 0), new Complex(0.2, 0.35) };

	@Test
	@DisplayName("First and second derivatives match finite differences")
	void derivativesAreConsistent() {
		for (DeformationParameters params : PARAMETER_SETS) {
			ComplexCoordinate y = ComplexCoordinate.create(Y_START, Y_END, params);
			for (Complex s : SAMPLES) {
				FiniteDifference.assertClose(y.firstDerivative(s), FiniteDifference.derivative(y::value, s), params + " y' at " + s);
				FiniteDifference.assertClose(y.secondDerivative(s), FiniteDifference.derivative(y::firstDerivative, s), params + " y'' at " + s);
			}
		}
	}

	@Test
	void zeroParametersGiveAffineMap() {
		ComplexCoordinate y = ComplexCoordinate.create(Y_START, Y_END, 0, 0, 0);
		assertFalse(ComplexCoordinate.isDeformed(y));
		for (double s = -1; s <= 1; s += 0.125) {
			Complex value = y.value(new Complex(s, 0));
			assertEquals(Y_START + (Y_END - Y_START) * (s + 1) / 2, value.getReal(), E);
			assertEquals(0.0, value.getImaginary(), E);
			assertEquals((Y_END - Y_START) / 2, y.getProfile().realFirstDerivative(s), E);
			assertEquals(0.0, y.getProfile().realSecondDerivative(s), E);
		}
	}

	@Test
	@DisplayName("Endpoints stay fixed for any deformation")
	void endpointsFixed() {
		for (DeformationParameters params : PARAMETER_SETS) {
			ComplexCoordinate y = ComplexCoordinate.create(Y_START, Y_END, params);
			assertEquals(Y_START, y.value(new Complex(-1, 0)).getReal(), E);
			assertEquals(0.0, y.value(new Complex(-1, 0)).getImaginary(), E);
			assertEquals(Y_END, y.value(Complex.ONE).getReal(), E);
			assertEquals(0.0, y.value(Complex.ONE).getImaginary(), E);
		}
	}

	@Test
	void deformationMovesInteriorOffRealAxis() {
		ComplexCoordinate y = ComplexCoordinate.create(0, 1, 0.0, 0.5, 0.0);
		assertTrue(y.isDeformed());
		// -(0 + i)(0.5)(0 - 1) = 0.5i at s = 0
		Complex mid = y.value(Complex.ZERO);
		assertEquals(0.5, mid.getReal(), E);
		assertEquals(0.5, mid.getImaginary(), E);
		// y'' = -2i * 0.5
		assertEquals(-1.0, y.secondDerivative(Complex.ZERO).getImaginary(), E);
	}

	@Test
	void anySingleNonZeroParameterIsDeformed() {
		assertTrue(ComplexCoordinate.create(0, 1, 1e-9, 0, 0).isDeformed());
		assertTrue(ComplexCoordinate.create(0, 1, 0, -2, 0).isDeformed());
		assertTrue(ComplexCoordinate.create(0, 1, 0, 0, 3).isDeformed());
		assertFalse(ComplexCoordinate.create(0, 1, DeformationParameters.NONE).isDeformed());
	}

	@Test
	void nameAndParams() {
		ComplexCoordinate y = ComplexCoordinate.create(0, 1, 0.5, 0.0, -1.25);
		assertEquals("[a0.5b0.0b-1.25]", y.getName());
		assertEquals(y.getName(), y.getProfile().getLabel());
		Map<String, Double> params = y.getParams();
		assertEquals(List.of("alpha", "beta_0", "beta_1"), List.copyOf(params.keySet()));
		assertEquals(-1.25, params.get("beta_1").doubleValue());
		assertEquals(new DeformationParameters(0.5, 0.0, -1.25), y.getParameters());
		assertEquals(0.0, y.getYStart());
		assertEquals(1.0, y.getYEnd());
	}
}
