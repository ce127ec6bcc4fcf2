/*-
 * #%L
 * This file is part of PixEdit.
 * %%
 * Copyright (C) 2025 PixEdit developers
 * %%
 * PixEdit is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * PixEdit is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with PixEdit.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package pixedit.lib.kernels;

import java.util.Arrays;
import java.util.Objects;

import pixedit.lib.common.GeneralTools;

/**
 * A 2D grid of weights used for convolution (strictly, correlation).
 * <p>
 * A kernel always has odd dimensions, so that it has a well-defined center at {@code (rows/2, cols/2)}.
 * If constructed with an even number of rows or columns, the kernel is padded with zeros along 
 * the bottom or right so that existing weights keep their top-left position.
 * <p>
 * Kernels are immutable.
 * 
 * @author PixEdit developers
 */
public final class Kernel {
	
	private final int rows;
	private final int cols;
	private final double[] weights;
	
	private Kernel(int rows, int cols, double[] weights) {
		this.rows = rows;
		this.cols = cols;
		this.weights = weights;
	}
	
	/**
	 * Create a kernel from a 2D array of weights, indexed as {@code weights[row][col]}.
	 * Rows may have different lengths, in which case missing values are treated as zero.
	 * @param weights
	 * @return
	 * @throws IllegalArgumentException if the array has no rows or no columns
	 */
	public static Kernel create(double[][] weights) {
		Objects.requireNonNull(weights, "Kernel weights must not be null!");
		int r = weights.length;
		int c = 0;
		for (double[] row : weights)
			c = Math.max(c, row == null ? 0 : row.length);
		if (r == 0 || c == 0)
			throw new IllegalArgumentException("Kernel must have at least one row and one column");
		int rows = r % 2 == 0 ? r + 1 : r;
		int cols = c % 2 == 0 ? c + 1 : c;
		double[] values = new double[rows * cols];
		for (int y = 0; y < r; y++) {
			double[] row = weights[y];
			if (row == null)
				continue;
			for (int x = 0; x < row.length; x++)
				values[y * cols + x] = row[x];
		}
		return new Kernel(rows, cols, values);
	}
	
	/**
	 * Create a kernel from a 2D array of integer weights.
	 * @param weights
	 * @return
	 * @see #create(double[][])
	 */
	public static Kernel create(int[][] weights) {
		double[][] values = new double[weights.length][];
		for (int y = 0; y < weights.length; y++)
			values[y] = Arrays.stream(weights[y]).asDoubleStream().toArray();
		return create(values);
	}
	
	/**
	 * Create a kernel with the specified dimensions and a row-major array of weights.
	 * @param rows
	 * @param cols
	 * @param weights
	 * @return
	 */
	public static Kernel create(int rows, int cols, double... weights) {
		if (rows <= 0 || cols <= 0)
			throw new IllegalArgumentException("Kernel must have at least one row and one column");
		if (weights.length != rows * cols)
			throw new IllegalArgumentException("Expected " + (rows * cols) + " weights, but got " + weights.length);
		double[][] values = new double[rows][cols];
		for (int y = 0; y < rows; y++)
			System.arraycopy(weights, y * cols, values[y], 0, cols);
		return create(values);
	}
	
	/**
	 * Create an identity kernel: 1 at the center, 0 elsewhere.
	 * @param rows
	 * @param cols
	 * @return
	 */
	public static Kernel identity(int rows, int cols) {
		int r = GeneralTools.forceOdd(rows);
		int c = GeneralTools.forceOdd(cols);
		double[] w = new double[r * c];
		w[(r / 2) * c + c / 2] = 1.0;
		return new Kernel(r, c, w);
	}
	
	/**
	 * Number of rows (always odd).
	 * @return
	 */
	public int getRows() {
		return rows;
	}
	
	/**
	 * Number of columns (always odd).
	 * @return
	 */
	public int getCols() {
		return cols;
	}
	
	/**
	 * Row index of the center.
	 * @return
	 */
	public int getCenterRow() {
		return rows / 2;
	}
	
	/**
	 * Column index of the center.
	 * @return
	 */
	public int getCenterCol() {
		return cols / 2;
	}
	
	/**
	 * Get a single weight.
	 * @param row
	 * @param col
	 * @return
	 */
	public double get(int row, int col) {
		return weights[row * cols + col];
	}
	
	/**
	 * Get the weights as a new 2D array.
	 * @return
	 */
	public double[][] toArray() {
		double[][] values = new double[rows][cols];
		for (int y = 0; y < rows; y++)
			System.arraycopy(weights, y * cols, values[y], 0, cols);
		return values;
	}
	
	/**
	 * Get the weights as a new row-major 1D array.
	 * @return
	 */
	public double[] getWeights() {
		return weights.clone();
	}
	
	/**
	 * Sum of all weights.
	 * @return
	 */
	public double sum() {
		double sum = 0;
		for (double w : weights)
			sum += w;
		return sum;
	}
	
	/**
	 * Returns true if every weight is zero.
	 * @return
	 */
	public boolean isZero() {
		for (double w : weights) {
			if (w != 0)
				return false;
		}
		return true;
	}
	
	/**
	 * Return this kernel, or an identity kernel of the same size if all weights are zero.
	 * @return
	 */
	public Kernel nonZeroOrIdentity() {
		return isZero() ? identity(rows, cols) : this;
	}
	
	/**
	 * Return a kernel with weights divided by their sum. 
	 * If the sum is zero (e.g. for an edge detector) this kernel is returned unchanged.
	 * @return
	 */
	public Kernel normalize() {
		double sum = sum();
		if (sum == 0 || sum == 1)
			return this;
		double[] w = new double[weights.length];
		for (int i = 0; i < w.length; i++)
			w[i] = weights[i] / sum;
		return new Kernel(rows, cols, w);
	}

	@Override
	public int hashCode() {
		return Objects.hash(rows, cols) * 31 + Arrays.hashCode(weights);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Kernel))
			return false;
		Kernel other = (Kernel)obj;
		return rows == other.rows && cols == other.cols && Arrays.equals(weights, other.weights);
	}

	@Override
	public String toString() {
		return "Kernel (" + rows + "x" + cols + ") " + Arrays.deepToString(toArray());
	}

}
