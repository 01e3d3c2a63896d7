package com.github.micycle1.spectraldeform.eigen;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.complex.Complex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.spectraldeform.ShapeMismatchException;

/**
 * Post-processing of raw eigensolver output: canonical ordering by eigenvalue
 * and screening of invalid modes.
 * <p>
 * Neither operation mutates its arguments.
 */
public final class EigenmodeProcessor {

	private static final Logger LOGGER = LoggerFactory.getLogger(EigenmodeProcessor.class);

	/**
	 * Real part first, imaginary part as the tie-break. Parts are compared
	 * numerically, so -0.0 and 0.0 are equal; NaN parts sort last.
	 */
	public static final Comparator<Complex> EIGENVALUE_ORDER = (a, b) -> {
		int byReal = compareParts(a.getReal(), b.getReal());
		return byReal != 0 ? byReal : compareParts(a.getImaginary(), b.getImaginary());
	};

	private EigenmodeProcessor() {
	}

	/**
	 * Packs eigenpairs into an {@link EigenMatrix} with columns in ascending
	 * eigenvalue order (see {@link #EIGENVALUE_ORDER}). Equal eigenvalues keep
	 * their input order.
	 *
	 * @param eigenvalues  the {@code size} eigenvalues
	 * @param eigenvectors {@code size x size}; column {@code i} pairs with
	 *                     {@code eigenvalues[i]}
	 */
	public static EigenMatrix sortByEigenvalue(Complex[] eigenvalues, Complex[][] eigenvectors) {
		return sort(EigenMatrix.of(eigenvalues, eigenvectors));
	}

	/**
	 * Reorders the columns of an existing matrix by eigenvalue.
	 *
	 * @throws ShapeMismatchException if the matrix is not {@code (size + 1) x size}
	 */
	public static EigenMatrix sort(EigenMatrix matrix) {
		final int size = matrix.size();
		checkMatrixShape(matrix, size);
		final Complex[] values = matrix.eigenvalues();
		Integer[] order = new Integer[size];
		for (int i = 0; i < size; i++) {
			order[i] = i;
		}
		// object sort is a stable merge sort
		Arrays.sort(order, (a, b) -> EIGENVALUE_ORDER.compare(values[a], values[b]));

		Complex[][] sorted = new Complex[matrix.rows()][size];
		for (int c = 0; c < size; c++) {
			for (int r = 0; r < matrix.rows(); r++) {
				sorted[r][c] = matrix.get(r, order[c]);
			}
		}
		return new EigenMatrix(sorted);
	}

	/**
	 * Replaces every mode whose {@code valid} flag is false with NaN: the whole
	 * column of the eigen matrix becomes {@link Complex#NaN} and the matching
	 * entry of each physical-quantity array becomes {@link Double#NaN}. Shapes and
	 * positions are kept.
	 *
	 * @param matrix             {@code (size + 1) x size} eigen matrix
	 * @param valid              one flag per mode, {@code size} entries
	 * @param physicalQuantities per-mode arrays of length {@code size}
	 * @return the screened matrix and screened copies of the quantity arrays, in
	 *         argument order
	 * @throws ShapeMismatchException if any dimension disagrees with
	 *                                {@code valid.length}; no input is touched
	 */
	public static Pair<EigenMatrix, List<double[]>> screen(EigenMatrix matrix, boolean[] valid, double[]... physicalQuantities) {
		final int size = valid.length;
		checkMatrixShape(matrix, size);
		for (int q = 0; q < physicalQuantities.length; q++) {
			checkQuantityLength(q, physicalQuantities[q].length, size);
		}

		List<double[]> quantities = new ArrayList<>(physicalQuantities.length);
		for (double[] quantity : physicalQuantities) {
			double[] copy = quantity.clone();
			for (int mode = 0; mode < size; mode++) {
				if (!valid[mode]) {
					copy[mode] = Double.NaN;
				}
			}
			quantities.add(copy);
		}
		return Pair.of(screenMatrix(matrix, valid), quantities);
	}

	/**
	 * As {@link #screen(EigenMatrix, boolean[], double[]...)}, for complex
	 * per-mode quantities such as mode amplitudes; invalid entries become
	 * {@link Complex#NaN}.
	 */
	public static Pair<EigenMatrix, List<Complex[]>> screenComplex(EigenMatrix matrix, boolean[] valid, Complex[]... physicalQuantities) {
		final int size = valid.length;
		checkMatrixShape(matrix, size);
		for (int q = 0; q < physicalQuantities.length; q++) {
			checkQuantityLength(q, physicalQuantities[q].length, size);
		}

		List<Complex[]> quantities = new ArrayList<>(physicalQuantities.length);
		for (Complex[] quantity : physicalQuantities) {
			Complex[] copy = quantity.clone();
			for (int mode = 0; mode < size; mode++) {
				if (!valid[mode]) {
					copy[mode] = Complex.NaN;
				}
			}
			quantities.add(copy);
		}
		return Pair.of(screenMatrix(matrix, valid), quantities);
	}

	private static EigenMatrix screenMatrix(EigenMatrix matrix, boolean[] valid) {
		Complex[][] grid = matrix.toArray();
		int screened = 0;
		for (int mode = 0; mode < valid.length; mode++) {
			if (valid[mode]) {
				continue;
			}
			screened++;
			for (Complex[] row : grid) {
				row[mode] = Complex.NaN;
			}
		}
		LOGGER.debug("Screened {} of {} eigenmodes", screened, valid.length);
		return new EigenMatrix(grid);
	}

	private static void checkMatrixShape(EigenMatrix matrix, int size) {
		if (matrix.size() != size || matrix.rows() != size + 1) {
			LOGGER.error("Invalid shape of the input arrays: eigen matrix {}x{} for {} modes", matrix.rows(), matrix.size(), size);
			throw new ShapeMismatchException(
					"Eigen matrix must be " + (size + 1) + "x" + size + " for " + size + " modes, found " + matrix.rows() + "x" + matrix.size());
		}
	}

	private static void checkQuantityLength(int index, int length, int size) {
		if (length != size) {
			LOGGER.error("Invalid shape of the input arrays: physical quantity #{} has length {}, expected {}", index, length, size);
			throw new ShapeMismatchException("Physical quantity #" + index + " has length " + length + ", expected " + size);
		}
	}

	private static int compareParts(double x, double y) {
		if (x < y) {
			return -1;
		}
		if (x > y) {
			return 1;
		}
		boolean xNaN = Double.isNaN(x);
		boolean yNaN = Double.isNaN(y);
		if (xNaN == yNaN) {
			return 0;
		}
		return xNaN ? 1 : -1;
	}
}
