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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixedit.lib.common.GeneralTools;
import pixedit.lib.kernels.Kernel;

/**
 * Built-in convolution kernels.
 * 
 * @author PixEdit developers
 */
public class Kernels {
	
	private final static Logger logger = LoggerFactory.getLogger(Kernels.class);
	
	/**
	 * Name of the identity preset.
	 */
	public static final String IDENTITY = "Identity";
	/**
	 * Name of the box blur preset.
	 */
	public static final String BOX_BLUR = "Box blur 3×3";
	/**
	 * Name of the approximate Gaussian preset.
	 */
	public static final String GAUSSIAN = "Gaussian-ish 3×3";
	/**
	 * Name of the sharpen preset.
	 */
	public static final String SHARPEN = "Sharpen 3×3";
	/**
	 * Name of the emboss preset.
	 */
	public static final String EMBOSS = "Emboss 3×3";
	/**
	 * Name of the horizontal Sobel preset.
	 */
	public static final String SOBEL_X = "Edge (Sobel X)";
	
	private static final List<String> PRESET_NAMES = List.of(IDENTITY, BOX_BLUR, GAUSSIAN, SHARPEN, EMBOSS, SOBEL_X);
	
	private static final double[][] SHARPEN_3x3 = {
			{0, -1, 0},
			{-1, 5, -1},
			{0, -1, 0}
	};
	
	private static final double[][] EMBOSS_3x3 = {
			{-2, -1, 0},
			{-1, 1, 1},
			{0, 1, 2}
	};
	
	private static final double[][] GAUSSIAN_3x3 = {
			{1, 2, 1},
			{2, 4, 2},
			{1, 2, 1}
	};
	
	private static final double[][] SOBEL_X_3x3 = {
			{-1, 0, 1},
			{-2, 0, 2},
			{-1, 0, 1}
	};
	
	// Suppress default constructor for non-instantiability
	private Kernels() {
		throw new AssertionError();
	}
	
	/**
	 * 3x3 sharpening kernel. This should be applied without normalization.
	 * @return
	 */
	public static Kernel sharpen() {
		return Kernel.create(SHARPEN_3x3);
	}
	
	/**
	 * 3x3 emboss kernel. This should be applied without normalization.
	 * @return
	 */
	public static Kernel emboss() {
		return Kernel.create(EMBOSS_3x3);
	}
	
	/**
	 * 3x3 approximation of a Gaussian filter (unnormalized).
	 * @return
	 */
	public static Kernel gaussian3x3() {
		return Kernel.create(GAUSSIAN_3x3);
	}
	
	/**
	 * 3x3 Sobel kernel responding to horizontal gradients.
	 * @return
	 */
	public static Kernel sobelX() {
		return Kernel.create(SOBEL_X_3x3);
	}
	
	/**
	 * Kernel with all weights set to 1 (unnormalized).
	 * @param rows
	 * @param cols
	 * @return
	 */
	public static Kernel boxBlur(int rows, int cols) {
		int r = GeneralTools.forceOdd(rows);
		int c = GeneralTools.forceOdd(cols);
		double[] weights = new double[r * c];
		Arrays.fill(weights, 1.0);
		return Kernel.create(r, c, weights);
	}
	
	/**
	 * Kernel with a single 1 at the center.
	 * @param rows
	 * @param cols
	 * @return
	 */
	public static Kernel identity(int rows, int cols) {
		return Kernel.identity(rows, cols);
	}
	
	/**
	 * Place a 3x3 kernel inside a larger (or smaller) kernel, with zeros elsewhere.
	 * The top-left of the 3x3 kernel is placed at {@code (rows/2 - 1, cols/2 - 1)}, or 0 if this is negative, 
	 * and it is cropped if it does not fit.
	 * @param base
	 * @param rows
	 * @param cols
	 * @return
	 */
	public static Kernel fit3x3(Kernel base, int rows, int cols) {
		int r = GeneralTools.forceOdd(rows);
		int c = GeneralTools.forceOdd(cols);
		double[][] values = new double[r][c];
		int y0 = Math.max(0, r / 2 - 1);
		int x0 = Math.max(0, c / 2 - 1);
		int y1 = Math.min(r, y0 + 3);
		int x1 = Math.min(c, x0 + 3);
		for (int y = y0; y < y1; y++) {
			for (int x = x0; x < x1; x++) {
				int by = y - y0;
				int bx = x - x0;
				if (by < base.getRows() && bx < base.getCols())
					values[y][x] = base.get(by, bx);
			}
		}
		return Kernel.create(values);
	}
	
	/**
	 * Create a motion blur kernel, containing a straight line through the center.
	 * <p>
	 * The kernel has size {@code L x L}, where {@code L} is the length forced to be odd. 
	 * For each {@code t} from {@code -L/2} to {@code L/2} the cell at row {@code round(c + t sin θ)} 
	 * and column {@code round(c + t cos θ)} is marked, where {@code c = L/2} and θ is the negated angle in radians. 
	 * Rounding is half to even. The marked cells share a total weight of 1.
	 * <p>
	 * Because rows increase downwards, the angle is counter-clockwise as seen on screen: 
	 * 0 gives a horizontal line, 90 a vertical line, and positive angles between these slope up to the right 
	 * (e.g. 45 marks the top-right and bottom-left corners of a 3x3 kernel).
	 * 
	 * @param length line length in pixels
	 * @param angleDegrees line angle in degrees, counter-clockwise from the positive x-axis as displayed
	 * @return
	 */
	public static Kernel motion(int length, double angleDegrees) {
		int size = GeneralTools.forceOdd(length);
		if (size != length)
			logger.debug("Motion length {} changed to {}", length, size);
		double[][] values = new double[size][size];
		int center = size / 2;
		double theta = Math.toRadians(-angleDegrees);
		double sin = Math.sin(theta);
		double cos = Math.cos(theta);
		int count = 0;
		for (int t = -(size / 2); t <= size / 2; t++) {
			int y = (int)Math.rint(center + t * sin);
			int x = (int)Math.rint(center + t * cos);
			if (y >= 0 && y < size && x >= 0 && x < size && values[y][x] == 0) {
				values[y][x] = 1.0;
				count++;
			}
		}
		if (count == 0)
			return Kernel.identity(size, size);
		for (double[] row : values) {
			for (int x = 0; x < row.length; x++)
				row[x] /= count;
		}
		return Kernel.create(values);
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
	 * Presets based on a 3x3 kernel are centered using {@link #fit3x3(Kernel, int, int)}.
	 * @param name
	 * @param rows
	 * @param cols
	 * @return the kernel, or empty if the name is not a built-in preset
	 */
	public static Optional<Kernel> preset(String name, int rows, int cols) {
		if (name == null)
			return Optional.empty();
		return switch (name) {
			case IDENTITY -> Optional.of(identity(rows, cols));
			case BOX_BLUR -> Optional.of(boxBlur(rows, cols));
			case GAUSSIAN -> Optional.of(fit3x3(gaussian3x3(), rows, cols));
			case SHARPEN -> Optional.of(fit3x3(sharpen(), rows, cols));
			case EMBOSS -> Optional.of(fit3x3(emboss(), rows, cols));
			case SOBEL_X -> Optional.of(fit3x3(sobelX(), rows, cols));
			default -> Optional.empty();
		};
	}

}
