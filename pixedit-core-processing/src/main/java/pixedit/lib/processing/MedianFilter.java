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
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixedit.lib.common.GeneralTools;
import pixedit.lib.images.PixelBuffer;

/**
 * Median filter with a square window.
 * <p>
 * Borders are handled in the same way as {@link Convolution}, by reflection excluding the edge pixel.
 * 
 * @author PixEdit developers
 */
public class MedianFilter {
	
	private final static Logger logger = LoggerFactory.getLogger(MedianFilter.class);
	
	// Suppress default constructor for non-instantiability
	private MedianFilter() {
		throw new AssertionError();
	}
	
	/**
	 * Apply a median filter.
	 * @param buffer
	 * @param windowSize width and height of the window; this is increased to the next odd number if necessary
	 * @param mode whether to filter the luminance only, or each color channel separately
	 * @return
	 */
	public static PixelBuffer medianFilter(PixelBuffer buffer, int windowSize, ChannelMode mode) {
		Objects.requireNonNull(buffer);
		int size = GeneralTools.forceOdd(windowSize);
		if (size != windowSize)
			logger.debug("Median window size {} changed to {}", windowSize, size);
		if (size == 1)
			return ChannelTools.applyToChannels(buffer, mode, (plane, w, h) -> plane.clone());
		return ChannelTools.applyToChannels(buffer, mode, (plane, w, h) -> median(plane, w, h, size));
	}
	
	static int[] median(int[] plane, int width, int height, int size) {
		int radius = size / 2;
		int nValues = size * size;
		int target = nValues / 2 + 1;
		int[] output = new int[plane.length];
		ParallelTools.forEachRow(width, height, y -> {
			int[] rowStarts = new int[size];
			for (int i = 0; i < size; i++)
				rowStarts[i] = ChannelTools.reflect101(y + i - radius, height) * width;
			int[] counts = new int[256];
			int[] cols = new int[size];
			for (int x = 0; x < width; x++) {
				for (int j = 0; j < size; j++)
					cols[j] = ChannelTools.reflect101(x + j - radius, width);
				Arrays.fill(counts, 0);
				for (int rowStart : rowStarts) {
					for (int col : cols)
						counts[plane[rowStart + col]]++;
				}
				// Find the value with cumulative count reaching the middle position
				int cumulative = 0;
				int v = 0;
				while (v < 255) {
					cumulative += counts[v];
					if (cumulative >= target)
						break;
					v++;
				}
				output[y * width + x] = v;
			}
		});
		return output;
	}

}
