package com.github.micycle1.spectraldeform.eigen;

import java.util.Arrays;

import org.apache.commons.math3.complex.Complex;

import com.github.micycle1.spectraldeform.ShapeMismatchException;

/**
 * Eigenvalues and eigenvectors packed into a {@code (size + 1) x size} grid.
 * Column {@code i} holds mode {@code i}: rows {@code 0..size-1} are its
 * eigenvector components and row {@code size} is its eigenvalue.
 * <p>
 * The grid is copied on construction and on {@link #toArray()}, so instances
 * never alias caller-owned arrays.
 */
public final class EigenMatrix {

	private final Complex[][] grid;
	private final int size;

	public EigenMatrix(Complex[][] grid) {
		if (grid.length == 0) {
			throw new ShapeMismatchException("Eigen matrix needs at least one row");
		}
		int columns = grid[0].length;
		for (Complex[] row : grid) {
			if (row.length != columns) {
				throw new ShapeMismatchException("Ragged eigen matrix: expected " + columns + " columns, found " + row.length);
			}
		}
		this.size = columns;
		this.grid = copy(grid);
	}

	public static EigenMatrix of(Complex[] eigenvalues, Complex[][] eigenvectors) {
		int size = eigenvalues.length;
		if (eigenvectors.length != size) {
			throw new ShapeMismatchException("Expected " + size + " eigenvector rows, found " + eigenvectors.length);
		}
		Complex[][] grid = new Complex[size + 1][];
		for (int r = 0; r < size; r++) {
			if (eigenvectors[r].length != size) {
				throw new ShapeMismatchException("Expected " + size + " eigenvector columns, found " + eigenvectors[r].length + " in row " + r);
			}
			grid[r] = eigenvectors[r];
		}
		grid[size] = eigenvalues;
		return new EigenMatrix(grid);
	}

	/** Number of modes (columns). */
	public int size() {
		return size;
	}

	public int rows() {
		return grid.length;
	}

	public Complex get(int row, int column) {
		return grid[row][column];
	}

	/**
	 * @return the eigenvalue of mode {@code i}, i.e. the last row
	 */
	public Complex eigenvalue(int i) {
		return grid[grid.length - 1][i];
	}

	public Complex[] eigenvalues() {
		return grid[grid.length - 1].clone();
	}

	/**
	 * @return the eigenvector of mode {@code i}, i.e. column {@code i} without its
	 *         last row
	 */
	public Complex[] eigenvector(int i) {
		Complex[] v = new Complex[grid.length - 1];
		for (int r = 0; r < v.length; r++) {
			v[r] = grid[r][i];
		}
		return v;
	}

	public Complex[][] toArray() {
		return copy(grid);
	}

	private static Complex[][] copy(Complex[][] source) {
		Complex[][] out = new Complex[source.length][];
		for (int r = 0; r < source.length; r++) {
			out[r] = source[r].clone();
		}
		return out;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof EigenMatrix)) {
			return false;
		}
		return Arrays.deepEquals(grid, ((EigenMatrix) o).grid);
	}

	@Override
	public int hashCode() {
		return Arrays.deepHashCode(grid);
	}

	@Override
	public String toString() {
		return "EigenMatrix[" + grid.length + "x" + size + "]";
	}
}
