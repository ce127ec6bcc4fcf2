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

import pixedit.lib.images.ColorConversions;
import pixedit.lib.images.ColorMode;
import pixedit.lib.images.PixelBuffer;

/**
 * Point operations that change the tone or color of an image: grayscale conversion, 
 * brightness/saturation/contrast and levels.
 * <p>
 * None of these methods modify the input buffer.
 * 
 * @author PixEdit developers
 */
public class TonalAdjustments {
	
	private final static Logger logger = LoggerFactory.getLogger(TonalAdjustments.class);
	
	/**
	 * Smallest enhancement factor permitted by {@link #adjustBSC(PixelBuffer, double, double, double)}.
	 */
	public static final double MIN_FACTOR = 0.01;
	
	// Suppress default constructor for non-instantiability
	private TonalAdjustments() {
		throw new AssertionError();
	}
	
	/**
	 * Convert an image to a single luminance channel. Any alpha channel is discarded.
	 * @param buffer
	 * @return
	 * @see ColorConversions#luminance(int, int, int)
	 */
	public static PixelBuffer toGrayscale(PixelBuffer buffer) {
		return buffer.convert(ColorMode.GRAY);
	}
	
	/**
	 * Adjust brightness, saturation and contrast, in that order.
	 * <p>
	 * Each step interpolates (or extrapolates) between the image and a 'degenerate' version of it:
	 * <ul>
	 * <li>brightness: a black image</li>
	 * <li>saturation: the grayscale version of the image (ignored for grayscale images)</li>
	 * <li>contrast: a uniform gray image with the mean luminance</li>
	 * </ul>
	 * A factor of 1 leaves the image unchanged. Factors &le; 0 are replaced by {@link #MIN_FACTOR}.
	 * Any alpha channel is unchanged.
	 * 
	 * @param buffer
	 * @param brightness
	 * @param saturation
	 * @param contrast
	 * @return
	 */
	public static PixelBuffer adjustBSC(PixelBuffer buffer, double brightness, double saturation, double contrast) {
		var output = adjustBrightness(buffer, brightness);
		output = adjustSaturation(output, saturation);
		return adjustContrast(output, contrast);
	}
	
	/**
	 * Adjust brightness by scaling all color values.
	 * @param buffer
	 * @param factor
	 * @return
	 */
	public static PixelBuffer adjustBrightness(PixelBuffer buffer, double factor) {
		float f = checkFactor(factor, "brightness");
		if (f == 1f)
			return buffer;
		var mode = buffer.getColorMode();
		byte[] input = buffer.getSamples();
		byte[] output = new byte[input.length];
		int n = mode.nChannels();
		int nColor = mode.nColorChannels();
		for (int i = 0; i < input.length; i += n) {
			for (int c = 0; c < nColor; c++)
				output[i+c] = blend(0, input[i+c] & 0xFF, f);
			if (mode.hasAlpha())
				output[i+nColor] = input[i+nColor];
		}
		return PixelBuffer.createInstance(buffer.getWidth(), buffer.getHeight(), mode, output);
	}
	
	/**
	 * Adjust color saturation by blending with the grayscale image.
	 * Grayscale images are returned unchanged.
	 * @param buffer
	 * @param factor
	 * @return
	 */
	public static PixelBuffer adjustSaturation(PixelBuffer buffer, double factor) {
		float f = checkFactor(factor, "saturation");
		var mode = buffer.getColorMode();
		if (f == 1f || mode == ColorMode.GRAY)
			return buffer;
		byte[] input = buffer.getSamples();
		byte[] output = new byte[input.length];
		int n = mode.nChannels();
		for (int i = 0; i < input.length; i += n) {
			int r = input[i] & 0xFF;
			int g = input[i+1] & 0xFF;
			int b = input[i+2] & 0xFF;
			int gray = ColorConversions.luminance(r, g, b);
			output[i] = blend(gray, r, f);
			output[i+1] = blend(gray, g, f);
			output[i+2] = blend(gray, b, f);
			if (mode.hasAlpha())
				output[i+3] = input[i+3];
		}
		return PixelBuffer.createInstance(buffer.getWidth(), buffer.getHeight(), mode, output);
	}
	
	/**
	 * Adjust contrast by blending with a uniform image at the mean luminance (rounded to an integer).
	 * @param buffer
	 * @param factor
	 * @return
	 */
	public static PixelBuffer adjustContrast(PixelBuffer buffer, double factor) {
		float f = checkFactor(factor, "contrast");
		if (f == 1f)
			return buffer;
		int mean = meanLuminance(buffer);
		var mode = buffer.getColorMode();
		byte[] input = buffer.getSamples();
		byte[] output = new byte[input.length];
		int n = mode.nChannels();
		int nColor = mode.nColorChannels();
		for (int i = 0; i < input.length; i += n) {
			for (int c = 0; c < nColor; c++)
				output[i+c] = blend(mean, input[i+c] & 0xFF, f);
			if (mode.hasAlpha())
				output[i+nColor] = input[i+nColor];
		}
		return PixelBuffer.createInstance(buffer.getWidth(), buffer.getHeight(), mode, output);
	}
	
	/**
	 * Compute the mean luminance of an image, rounded half up to an integer.
	 * @param buffer
	 * @return
	 */
	public static int meanLuminance(PixelBuffer buffer) {
		long sum = 0;
		for (int v : ColorConversions.luminancePlane(buffer))
			sum += v;
		return (int)(sum / (double)buffer.nPixels() + 0.5);
	}
	
	private static float checkFactor(double factor, String name) {
		if (Double.isNaN(factor) || factor <= 0) {
			logger.debug("Invalid {} factor {}, will use {}", name, factor, MIN_FACTOR);
			return (float)MIN_FACTOR;
		}
		return (float)factor;
	}
	
	/**
	 * Interpolate between a degenerate value and an input value, clipping and truncating the result.
	 */
	private static byte blend(int degenerate, int value, float factor) {
		float v = degenerate + factor * (value - degenerate);
		if (v <= 0f)
			return 0;
		if (v >= 255f)
			return (byte)255;
		return (byte)(int)v;
	}
	
	/**
	 * Create a 256-entry lookup table for a levels adjustment.
	 * <p>
	 * Values &le; black become 0, values &ge; white become 255. Values in between are rescaled to 0-1, 
	 * raised to the power of gamma, then rescaled to 0-255 and rounded (half to even).
	 * 
	 * @param params
	 * @return
	 */
	public static int[] levelsLut(LevelsParams params) {
		int black = params.getBlack();
		int white = params.getWhite();
		double gamma = params.getGamma();
		double scale = 255.0 / (white - black);
		int[] lut = new int[256];
		for (int x = 0; x < 256; x++) {
			double y;
			if (x <= black)
				y = 0.0;
			else if (x >= white)
				y = 255.0;
			else {
				y = (x - black) * scale;
				y = Math.pow(y / 255.0, gamma) * 255.0;
			}
			lut[x] = (int)Math.rint(Math.max(0.0, Math.min(255.0, y)));
		}
		return lut;
	}
	
	/**
	 * Create a 256-entry lookup table for a levels adjustment.
	 * @param black
	 * @param white
	 * @param gamma
	 * @return
	 * @see LevelsParams#of(int, int, double)
	 */
	public static int[] levelsLut(int black, int white, double gamma) {
		return levelsLut(LevelsParams.of(black, white, gamma));
	}
	
	/**
	 * Apply a levels adjustment. The input is converted to grayscale first if necessary, 
	 * so the output is always a grayscale image.
	 * @param buffer
	 * @param params
	 * @return
	 */
	public static PixelBuffer bwLevels(PixelBuffer buffer, LevelsParams params) {
		Objects.requireNonNull(params);
		return applyLut(toGrayscale(buffer), levelsLut(params));
	}
	
	/**
	 * Apply a levels adjustment. The input is converted to grayscale first if necessary.
	 * @param buffer
	 * @param black
	 * @param white
	 * @param gamma
	 * @return
	 * @see #bwLevels(PixelBuffer, LevelsParams)
	 */
	public static PixelBuffer bwLevels(PixelBuffer buffer, int black, int white, double gamma) {
		return bwLevels(buffer, LevelsParams.of(black, white, gamma));
	}
	
	/**
	 * Apply a lookup table to all color channels. Any alpha channel is unchanged.
	 * @param buffer
	 * @param lut array of 256 output values; these are clipped to 0-255
	 * @return
	 */
	public static PixelBuffer applyLut(PixelBuffer buffer, int[] lut) {
		Objects.requireNonNull(buffer);
		if (lut.length != 256)
			throw new IllegalArgumentException("Lookup table must have 256 entries, but has " + lut.length);
		byte[] table = new byte[256];
		for (int i = 0; i < 256; i++)
			table[i] = (byte)Math.max(0, Math.min(255, lut[i]));
		var mode = buffer.getColorMode();
		byte[] input = buffer.getSamples();
		byte[] output = new byte[input.length];
		int n = mode.nChannels();
		int nColor = mode.nColorChannels();
		for (int i = 0; i < input.length; i += n) {
			for (int c = 0; c < nColor; c++)
				output[i+c] = table[input[i+c] & 0xFF];
			if (mode.hasAlpha())
				output[i+nColor] = input[i+nColor];
		}
		return PixelBuffer.createInstance(buffer.getWidth(), buffer.getHeight(), mode, output);
	}
	
	/**
	 * Invert all color channels. Any alpha channel is unchanged.
	 * @param buffer
	 * @return
	 */
	public static PixelBuffer invert(PixelBuffer buffer) {
		int[] lut = new int[256];
		for (int i = 0; i < 256; i++)
			lut[i] = 255 - i;
		return applyLut(buffer, lut);
	}

}
