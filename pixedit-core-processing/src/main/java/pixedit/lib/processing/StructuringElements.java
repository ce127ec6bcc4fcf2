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

package pixedit.lib.processing;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import pixedit.lib.common.GeneralTools;
import pixedit.lib.kernels.StructuringElement;

/**
 * Built-in structuring element shapes.
 * All sizes are forced to be odd.
 * 
 * @author PixEdit developers
 */
public class StructuringElements {
	
	/**
	 * Name of the square preset.
	 */
	public static final String SQUARE = "Square";
	/**
	 * Name of the cross preset.
	 */
	public static final String CROSS = "Cross";
	/**
	 * Name of the ellipse preset.
	 */
	public static final String ELLIPSE = "Ellipse";
	/**
	 * Name of the diamond preset.
	 */
	public static final String DIAMOND = "Diamond";
	/**
	 * Name of the single-cell preset.
	 */
	public static final String CENTRE = "Centre";
	
	private static final List<String> PRESET_NAMES = List.of(SQUARE, CROSS, ELLIPSE, DIAMOND, CENTRE);
	
	// Suppress default constructor for non-instantiability
	private StructuringElements() {
		throw new AssertionError();
	}
	
	/**
	 * All cells on.
	 * @param rows
	 * @param cols
	 * @return
	 */
	public static StructuringElement square(int rows, int cols) {
		boolean[][] mask = createMask(rows, cols);
		for (boolean[] row : mask)
			Arrays.fill(row, true);
		return StructuringElement.create(mask);
	}
	
	/**
	 * Center row and center column on.
	 * @param rows
	 * @param cols
	 * @return
	 */
	public static StructuringElement cross(int rows, int cols) {
		boolean[][] mask = createMask(rows, cols);
		int cy = mask.length / 2;
		int cx = mask[0].length / 2;
		for (int y = 0; y < mask.length; y++) {
			for (int x = 0; x < mask[y].length; x++)
				mask[y][x] = y == cy || x == cx;
		}
		return StructuringElement.create(mask);
	}
	
	/**
	 * Cells inside the ellipse with radii {@code max(1, rows/2)} and {@code max(1, cols/2)} on.
	 * @param rows
	 * @param cols
	 * @return
	 */
	public static StructuringElement ellipse(int rows, int cols) {
		boolean[][] mask = createMask(rows, cols);
		int cy = mask.length / 2;
		int cx = mask[0].length / 2;
		double ry = Math.max(1, mask.length / 2);
		double rx = Math.max(1, mask[0].length / 2);
		for (int y = 0; y < mask.length; y++) {
			for (int x = 0; x < mask[y].length; x++) {
				double dy = y - cy;
				double dx = x - cx;
				mask[y][x] = dy * dy / (ry * ry) + dx * dx / (rx * rx) <= 1.0;
			}
		}
		return StructuringElement.create(mask);
	}
	
	/**
	 * Cells within a city-block distance of {@code max(rows, cols)/2} from the center on.
	 * @param rows
	 * @param cols
	 * @return
	 */
	public static StructuringElement diamond(int rows, int cols) {
		boolean[][] mask = createMask(rows, cols);
		int cy = mask.length / 2;
		int cx = mask[0].length / 2;
		int radius = Math.max(mask.length, mask[0].length) / 2;
		for (int y = 0; y < mask.length; y++) {
			for (int x = 0; x < mask[y].length; x++)
				mask[y][x] = Math.abs(y - cy) + Math.abs(x - cx) <= radius;
		}
		return StructuringElement.create(mask);
	}
	
	/**
	 * Only the center cell on.
	 * @param rows
	 * @param cols
	 * @return
	 */
	public static StructuringElement centre(int rows, int cols) {
		boolean[][] mask = createMask(rows, cols);
		mask[mask.length / 2][mask[0].length / 2] = true;
		return StructuringElement.create(mask);
	}
	
	private static boolean[][] createMask(int rows, int cols) {
		return new boolean[GeneralTools.forceOdd(rows)][GeneralTools.forceOdd(cols)];
	}
	
	/**
	 * Names of the built-in presets. These are reserved, and cannot be used for custom presets.
	 * @return
	 */
	public static List<String> getPresetNames() {
		return PRESET_NAMES;
	}
	
	/**
	 * Create a built-in preset with the specified size.
	 * @param name
	 * @param rows
	 * @param cols
	 * @return the element, or empty if the name is not a built-in preset
	 */
	public static Optional<StructuringElement> preset(String name, int rows, int cols) {
		if (name == null)
			return Optional.empty();
		return switch (name) {
			case SQUARE -> Optional.of(square(rows, cols));
			case CROSS -> Optional.of(cross(rows, cols));
			case ELLIPSE -> Optional.of(ellipse(rows, cols));
			case DIAMOND -> Optional.of(diamond(rows, cols));
			case CENTRE -> Optional.of(centre(rows, cols));
			default -> Optional.empty();
		};
	}

}
