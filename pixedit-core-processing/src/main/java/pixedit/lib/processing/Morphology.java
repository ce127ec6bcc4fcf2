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

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixedit.lib.images.PixelBuffer;
import pixedit.lib.kernels.StructuringElement;

/**
 * Grayscale morphology using a {@link StructuringElement}.
 * <p>
 * Erosion takes the minimum and dilation the maximum over the 'on' cells of the element, 
 * centered on each pixel. Cells that fall outside the image are ignored.
 * <p>
 * For compound operations, the number of iterations applies to each erosion or dilation step, 
 * e.g. an opening with 2 iterations is two erosions followed by two dilations.
 * 
 * @author PixEdit developers
 */
public class Morphology {
	
	private final static Logger logger = LoggerFactory.getLogger(Morphology.class);
	
	// Suppress default constructor for non-instantiability
	private Morphology() {
		throw new AssertionError();
	}
	
	/**
	 * Get the element that will actually be applied. This is the input element, unless it is empty, 
	 * in which case the center cell is switched on and a warning is logged.
	 * @param element
	 * @return
	 */
	public static StructuringElement checkElement(StructuringElement element) {
		Objects.requireNonNull(element, "Structuring element must not be null!");
		if (element.isEmpty()) {
			logger.warn("Structuring element is empty, the center cell will be used");
			return element.nonEmptyOrCentre();
		}
		return element;
	}
	
	/**
	 * Apply a morphological operation.
	 * @param buffer the input image
	 * @param operation the operation to apply
	 * @param element the structuring element; if empty, only the center cell is used
	 * @param iterations number of times each erosion or dilation is applied; values &lt; 1 are treated as 1
	 * @param mode whether to process the luminance only, or each color channel separately
	 * @return
	 */
	public static PixelBuffer apply(PixelBuffer buffer, MorphOperation operation, StructuringElement element, int iterations, ChannelMode mode) {
		Objects.requireNonNull(buffer);
		Objects.requireNonNull(operation);
		var se = checkElement(element);
		int n = Math.max(1, iterations);
		if (n != iterations)
			logger.debug("Iterations {} changed to {}", iterations, n);
		int[][] offsets = se.getOffsets();
		return ChannelTools.applyToChannels(buffer, mode, (plane, w, h) -> apply(plane, w, h, operation, offsets, n));
	}
	
	/**
	 * Apply a morphological operation, parsing the operation name.
	 * @param buffer
	 * @param operation operation name, e.g. "erode", "opening", "top-hat"
	 * @param element
	 * @param iterations
	 * @param mode
	 * @return
	 * @throws IllegalArgumentException if the operation name is not recognized
	 * @see MorphOperation#fromString(String)
	 */
	public static PixelBuffer apply(PixelBuffer buffer, String operation, StructuringElement element, int iterations, ChannelMode mode) {
		return apply(buffer, MorphOperation.fromString(operation), element, iterations, mode);
	}
	
	/**
	 * Erode an image.
	 * @param buffer
	 * @param element
	 * @param iterations
	 * @param mode
	 * @return
	 */
	public static PixelBuffer erode(PixelBuffer buffer, StructuringElement element, int iterations, ChannelMode mode) {
		return apply(buffer, MorphOperation.ERODE, element, iterations, mode);
	}
	
	/**
	 * Dilate an image.
	 * @param buffer
	 * @param element
	 * @param iterations
	 * @param mode
	 * @return
	 */
	public static PixelBuffer dilate(PixelBuffer buffer, StructuringElement element, int iterations, ChannelMode mode) {
		return apply(buffer, MorphOperation.DILATE, element, iterations, mode);
	}
	
	private static int[] apply(int[] plane, int w, int h, MorphOperation op, int[][] offsets, int iterations) {
		return switch (op) {
			case ERODE -> erode(plane, w, h, offsets, iterations);
			case DILATE -> dilate(plane, w, h, offsets, iterations);
			case OPEN -> dilate(erode(plane, w, h, offsets, iterations), w, h, offsets, iterations);
			case CLOSE -> erode(dilate(plane, w, h, offsets, iterations), w, h, offsets, iterations);
			case GRADIENT -> subtract(dilate(plane, w, h, offsets, iterations), erode(plane, w, h, offsets, iterations));
			case TOP_HAT -> subtract(plane, dilate(erode(plane, w, h, offsets, iterations), w, h, offsets, iterations));
			case BLACK_HAT -> subtract(erode(dilate(plane, w, h, offsets, iterations), w, h, offsets, iterations), plane);
		};
	}
	
	private static int[] erode(int[] plane, int w, int h, int[][] offsets, int iterations) {
		int[] output = plane;
		for (int i = 0; i < iterations; i++)
			output = rankFilter(output, w, h, offsets, false);
		return output;
	}
	
	private static int[] dilate(int[] plane, int w, int h, int[][] offsets, int iterations) {
		int[] output = plane;
		for (int i = 0; i < iterations; i++)
			output = rankFilter(output, w, h, offsets, true);
		return output;
	}
	
	/**
	 * Compute the minimum or maximum over the neighborhood, ignoring offsets outside the image.
	 */
	private static int[] rankFilter(int[] plane, int w, int h, int[][] offsets, boolean max) {
		int[] output = new int[plane.length];
		ParallelTools.forEachRow(w, h, y -> {
			for (int x = 0; x < w; x++) {
				int value = max ? 0 : 255;
				for (int[] offset : offsets) {
					int yy = y + offset[0];
					int xx = x + offset[1];
					if (yy < 0 || yy >= h || xx < 0 || xx >= w)
						continue;
					int v = plane[yy * w + xx];
					if (max ? v > value : v < value)
						value = v;
				}
				output[y * w + x] = value;
			}
		});
		return output;
	}
	
	/**
	 * Saturating subtraction.
	 */
	private static int[] subtract(int[] a, int[] b) {
		int[] output = new int[a.length];
		for (int i = 0; i < a.length; i++)
			output[i] = Math.max(0, a[i] - b[i]);
		return output;
	}

}
