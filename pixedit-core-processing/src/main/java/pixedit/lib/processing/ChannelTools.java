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

import pixedit.lib.images.ColorConversions;
import pixedit.lib.images.ColorMode;
import pixedit.lib.images.PixelBuffer;

/**
 * Helper methods for applying single-channel operations to images.
 * 
 * @author PixEdit developers
 */
public class ChannelTools {
	
	/**
	 * An operation applied to a single channel, stored as an array of {@code width * height} values in the range 0-255.
	 * Implementations must not modify the input array.
	 */
	@FunctionalInterface
	public static interface PlaneOp {
		
		/**
		 * Apply the operation.
		 * @param plane input values
		 * @param width
		 * @param height
		 * @return a new array containing the output values; these will be clipped to 0-255
		 */
		int[] apply(int[] plane, int width, int height);
		
	}
	
	// Suppress default constructor for non-instantiability
	private ChannelTools() {
		throw new AssertionError();
	}
	
	/**
	 * Apply an operation to the channels of an image according to a {@link ChannelMode}.
	 * <ul>
	 * <li>{@link ChannelMode#LUMINANCE}: the operation is applied to the luminance and the result 
	 * is replicated across all color channels</li>
	 * <li>{@link ChannelMode#RGB}: the operation is applied separately to each color channel</li>
	 * </ul>
	 * In both cases the output has the same color mode as the input and any alpha channel is unchanged.
	 * 
	 * @param buffer
	 * @param mode
	 * @param op
	 * @return
	 */
	public static PixelBuffer applyToChannels(PixelBuffer buffer, ChannelMode mode, PlaneOp op) {
		Objects.requireNonNull(buffer);
		Objects.requireNonNull(mode);
		int w = buffer.getWidth();
		int h = buffer.getHeight();
		var colorMode = buffer.getColorMode();
		int[][] planes = new int[colorMode.nChannels()][];
		if (mode == ChannelMode.LUMINANCE || colorMode == ColorMode.GRAY) {
			int[] result = op.apply(ColorConversions.luminancePlane(buffer), w, h);
			for (int c = 0; c < colorMode.nColorChannels(); c++)
				planes[c] = result;
		} else {
			for (int c = 0; c < colorMode.nColorChannels(); c++)
				planes[c] = op.apply(buffer.getPlane(c), w, h);
		}
		if (colorMode.hasAlpha())
			planes[colorMode.getAlphaChannel()] = buffer.getPlane(colorMode.getAlphaChannel());
		return PixelBuffer.fromPlanes(w, h, colorMode, planes);
	}
	
	/**
	 * Get the index of a coordinate after reflecting around the image border, excluding the edge pixel 
	 * (i.e. {@code gfedcb|abcdefgh|gfedcba}).
	 * If the length is 1, 0 is always returned.
	 * 
	 * @param i the requested index, which may be outside the range 0 to length-1
	 * @param length the length of the dimension
	 * @return an index in the range 0 to length-1
	 */
	public static int reflect101(int i, int length) {
		if (i >= 0 && i < length)
			return i;
		if (length == 1)
			return 0;
		int period = 2 * length - 2;
		int ind = Math.floorMod(i, period);
		return ind >= length ? period - ind : ind;
	}

}
