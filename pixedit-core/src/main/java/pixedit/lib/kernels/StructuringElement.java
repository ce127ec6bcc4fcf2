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

/**
 * A binary mask defining the neighborhood used for morphological operations.
 * <p>
 * As with {@link Kernel}, the dimensions are always odd and even sizes are padded with 
 * 'off' cells along the bottom or right.
 * 
 * @author PixEdit developers
 */
public final class StructuringElement {
	
	private final int rows;
	private final int cols;
	private final boolean[] mask;
	
	private StructuringElement(int rows, int cols, boolean[] mask) {
		this.rows = rows;
		this.cols = cols;
		this.mask = mask;
	}
	
	/**
	 * Create a structuring element from a 2D boolean mask, indexed as {@code mask[row][col]}.
	 * @param mask
	 * @return
	 */
	public static StructuringElement create(boolean[][] mask) {
		Objects.requireNonNull(mask, "Mask must not be null!");
		int r = mask.length;
		int c = 0;
		for (boolean[] row : mask)
			c = Math.max(c, row == null ? 0 : row.length);
		if (r == 0 || c == 0)
			throw new IllegalArgumentException("Structuring element must have at least one row and one column");
		int rows = r % 2 == 0 ? r + 1 : r;
		int cols = c % 2 == 0 ? c + 1 : c;
		boolean[] values = new boolean[rows * cols];
		for (int y = 0; y < r; y++) {
			boolean[] row = mask[y];
			if (row == null)
				continue;
			for (int x = 0; x < row.length; x++)
				values[y * cols + x] = row[x];
		}
		return new StructuringElement(rows, cols, values);
	}
	
	/**
	 * Create a structuring element from a 2D array where any non-zero value is 'on'.
	 * @param mask
	 * @return
	 */
	public static StructuringElement create(int[][] mask) {
		boolean[][] values = new boolean[mask.length][];
		for (int y = 0; y < mask.length; y++) {
			values[y] = new boolean[mask[y].length];
			for (int x = 0; x < mask[y].length; x++)
				values[y][x] = mask[y][x] != 0;
		}
		return create(values);
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
	 * Returns true if the cell is part of the neighborhood.
	 * @param row
	 * @param col
	 * @return
	 */
	public boolean isOn(int row, int col) {
		return mask[row * cols + col];
	}
	
	/**
	 * Number of 'on' cells.
	 * @return
	 */
	public int countOn() {
		int n = 0;
		for (boolean b : mask) {
			if (b)
				n++;
		}
		return n;
	}
	
	/**
	 * Returns true if no cell is 'on'.
	 * @return
	 */
	public boolean isEmpty() {
		return countOn() == 0;
	}
	
	/**
	 * Return this element, or one of the same size with only the center cell 'on' if it is empty.
	 * @return
	 */
	public StructuringElement nonEmptyOrCentre() {
		if (!isEmpty())
			return this;
		boolean[] values = new boolean[mask.length];
		values[(rows / 2) * cols + cols / 2] = true;
		return new StructuringElement(rows, cols, values);
	}
	
	/**
	 * Get the offsets of all 'on' cells relative to the center, as {@code {dy, dx}} pairs.
	 * @return
	 */
	public int[][] getOffsets() {
		int[][] offsets = new int[countOn()][];
		int cy = rows / 2;
		int cx = cols / 2;
		int i = 0;
		for (int y = 0; y < rows; y++) {
			for (int x = 0; x < cols; x++) {
				if (mask[y * cols + x])
					offsets[i++] = new int[] {y - cy, x - cx};
			}
		}
		return offsets;
	}
	
	/**
	 * Get the mask as a new 2D array of 0 and 1 values.
	 * @return
	 */
	public int[][] toArray() {
		int[][] values = new int[rows][cols];
		for (int y = 0; y < rows; y++) {
			for (int x = 0; x < cols; x++)
				values[y][x] = mask[y * cols + x] ? 1 : 0;
		}
		return values;
	}

	@Override
	public int hashCode() {
		return Objects.hash(rows, cols) * 31 + Arrays.hashCode(mask);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof StructuringElement))
			return false;
		StructuringElement other = (StructuringElement)obj;
		return rows == other.rows && cols == other.cols && Arrays.equals(mask, other.mask);
	}

	@Override
	public String toString() {
		return "StructuringElement (" + rows + "x" + cols + ") " + Arrays.deepToString(toArray());
	}

}
