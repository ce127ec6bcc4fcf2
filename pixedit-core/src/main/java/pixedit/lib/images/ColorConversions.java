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

package pixedit.lib.images;

import java.util.Objects;

/**
 * Conversions between {@link ColorMode}s.
 * <p>
 * Luminance uses the ITU-R 601-2 weights (0.299, 0.587, 0.114) in 16-bit fixed point.
 * When converting to a mode with alpha from one without, alpha is set to 255 (opaque);
 * when converting to a mode without alpha, alpha is discarded.
 *
 * @author PixEdit developers
 */
public class ColorConversions {

	// Suppress default constructor for non-instantiability
	private ColorConversions() {
		throw new AssertionError();
	}

	/**
	 * Compute the 8-bit luminance for RGB values.
	 * @param r
	 * @param g
	 * @param b
	 * @return luminance in the range 0-255
	 */
	public static int luminance(int r, int g, int b) {
		return (r * 19595 + g * 38470 + b * 7471 + 0x8000) >> 16;
	}

	/**
	 * Convert a buffer to the specified mode.
	 * @param buffer the input, which is not modified
	 * @param targetMode
	 * @return the input buffer if it already has the requested mode, otherwise a new buffer
	 */
	public static PixelBuffer convert(PixelBuffer buffer, ColorMode targetMode) {
		Objects.requireNonNull(buffer);
		Objects.requireNonNull(targetMode);
		var sourceMode = buffer.getColorMode();
		if (sourceMode == targetMode)
			return buffer;

		byte[] input = buffer.samples();
		int n = buffer.nPixels();
		int nIn = sourceMode.nChannels();
		int nOut = targetMode.nChannels();
		byte[] output = new byte[n * nOut];

		for (int i = 0; i < n; i++) {
			int ind = i * nIn;
			int outInd = i * nOut;
			if (targetMode == ColorMode.GRAY) {
				output[outInd] = (byte)luminance(input[ind] & 0xFF, input[ind+1] & 0xFF, input[ind+2] & 0xFF);
				continue;
			}
			if (sourceMode == ColorMode.GRAY) {
				byte v = input[ind];
				output[outInd] = v;
				output[outInd+1] = v;
				output[outInd+2] = v;
			} else {
				output[outInd] = input[ind];
				output[outInd+1] = input[ind+1];
				output[outInd+2] = input[ind+2];
			}
			if (targetMode.hasAlpha())
				output[outInd+3] = sourceMode.hasAlpha() ? input[ind+3] : (byte)255;
		}
		return PixelBuffer.wrap(buffer.getWidth(), buffer.getHeight(), targetMode, output);
	}

	/**
	 * Compute a luminance plane for any buffer, without creating an intermediate buffer.
	 * @param buffer
	 * @return an array of length {@code width * height}
	 */
	public static int[] luminancePlane(PixelBuffer buffer) {
		if (buffer.getColorMode() == ColorMode.GRAY)
			return buffer.getPlane(0);
		byte[] input = buffer.samples();
		int nIn = buffer.nChannels();
		int[] plane = new int[buffer.nPixels()];
		for (int i = 0; i < plane.length; i++) {
			int ind = i * nIn;
			plane[i] = luminance(input[ind] & 0xFF, input[ind+1] & 0xFF, input[ind+2] & 0xFF);
		}
		return plane;
	}

}
