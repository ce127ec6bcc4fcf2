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
import pixedit.lib.kernels.Kernel;

/**
 * Linear filtering with an arbitrary {@link Kernel}.
 * <p>
 * The kernel is applied as a correlation (i.e. it is not flipped), and pixels beyond the image 
 * boundary are obtained by reflection excluding the edge pixel (see {@link ChannelTools#reflect101(int, int)}), 
 * so the output has the same size as the input.
 * 
 * @author PixEdit developers
 */
public class Convolution {
	
	private final static Logger logger = LoggerFactory.getLogger(Convolution.class);
	
	// Suppress default constructor for non-instantiability
	private Convolution() {
		throw new AssertionError();
	}
	
	/**
	 * Get the kernel that will actually be applied. This is the input kernel, unless it contains only zeros, 
	 * in which case an identity kernel of the same size is returned and a warning is logged.
	 * @param kernel
	 * @return
	 */
	public static Kernel checkKernel(Kernel kernel) {
		Objects.requireNonNull(kernel, "Kernel must not be null!");
		if (kernel.isZero()) {
			logger.warn("Kernel contains only zeros, the center value will be set to 1");
			return kernel.nonZeroOrIdentity();
		}
		return kernel;
	}
	
	/**
	 * Filter an image with a kernel.
	 * 
	 * @param buffer the input image
	 * @param kernel the filter kernel; if this contains only zeros, an identity kernel is used instead
	 * @param mode whether to filter the luminance only, or each color channel separately
	 * @param normalize if true, divide the kernel by its sum (provided that this is not zero)
	 * @return the filtered image, with the same size and color mode as the input. 
	 *         Values are clipped to 0-255 and rounded to the nearest integer.
	 */
	public static PixelBuffer convolve(PixelBuffer buffer, Kernel kernel, ChannelMode mode, boolean normalize) {
		Objects.requireNonNull(buffer);
		var k = checkKernel(kernel);
		if (normalize)
			k = k.normalize();
		var finalKernel = k;
		logger.trace("Applying {} to {} ({})", finalKernel, buffer, mode);
		return ChannelTools.applyToChannels(buffer, mode, (plane, w, h) -> correlate(plane, w, h, finalKernel));
	}
	
	/**
	 * Apply a kernel to a single plane, returning the result clipped to 0-255 and rounded.
	 * @param plane
	 * @param width
	 * @param height
	 * @param kernel
	 * @return
	 */
	static int[] correlate(int[] plane, int width, int height, Kernel kernel) {
		int kRows = kernel.getRows();
		int kCols = kernel.getCols();
		int cy = kernel.getCenterRow();
		int cx = kernel.getCenterCol();
		double[] weights = kernel.getWeights();
		
		// Precompute reflected column indices for every output column and kernel column
		int[] xInds = new int[width * kCols];
		for (int x = 0; x < width; x++) {
			for (int j = 0; j < kCols; j++)
				xInds[x * kCols + j] = ChannelTools.reflect101(x + j - cx, width);
		}
		
		int[] output = new int[plane.length];
		ParallelTools.forEachRow(width, height, y -> {
			int[] rowStarts = new int[kRows];
			for (int i = 0; i < kRows; i++)
				rowStarts[i] = ChannelTools.reflect101(y + i - cy, height) * width;
			for (int x = 0; x < width; x++) {
				double sum = 0;
				int w = 0;
				for (int i = 0; i < kRows; i++) {
					int rowStart = rowStarts[i];
					for (int j = 0; j < kCols; j++) {
						double weight = weights[w++];
						if (weight != 0)
							sum += weight * plane[rowStart + xInds[x * kCols + j]];
					}
				}
				output[y * width + x] = clipRound(sum);
			}
		});
		return output;
	}
	
	/**
	 * Clip to the range 0-255, then round half up.
	 * @param value
	 * @return
	 */
	static int clipRound(double value) {
		if (!(value > 0))
			return 0;
		if (value >= 255)
			return 255;
		return (int)Math.floor(value + 0.5);
	}

}
