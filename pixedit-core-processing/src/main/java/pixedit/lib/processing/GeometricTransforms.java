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

import pixedit.lib.images.ColorMode;
import pixedit.lib.images.PixelBuffer;

/**
 * Flips and rotations.
 * <p>
 * Flips and rotations by multiples of 90 degrees only rearrange pixels.
 * Other rotations resample the image using bicubic interpolation, and expand the canvas so that 
 * no part of the input is lost.
 * 
 * @author PixEdit developers
 */
public class GeometricTransforms {
	
	private final static Logger logger = LoggerFactory.getLogger(GeometricTransforms.class);
	
	// Suppress default constructor for non-instantiability
	private GeometricTransforms() {
		throw new AssertionError();
	}
	
	@FunctionalInterface
	private static interface IndexMap {
		/**
		 * Get the source pixel index for an output pixel.
		 */
		int sourceIndex(int x, int y);
	}
	
	private static PixelBuffer permute(PixelBuffer buffer, int outWidth, int outHeight, IndexMap map) {
		var mode = buffer.getColorMode();
		int n = mode.nChannels();
		byte[] input = buffer.getSamples();
		byte[] output = new byte[input.length];
		ParallelTools.forEachRow(outWidth, outHeight, y -> {
			int outInd = y * outWidth * n;
			for (int x = 0; x < outWidth; x++) {
				System.arraycopy(input, map.sourceIndex(x, y) * n, output, outInd, n);
				outInd += n;
			}
		});
		return PixelBuffer.createInstance(outWidth, outHeight, mode, output);
	}
	
	/**
	 * Mirror the image horizontally (left becomes right).
	 * @param buffer
	 * @return
	 */
	public static PixelBuffer flipH(PixelBuffer buffer) {
		int w = buffer.getWidth();
		int h = buffer.getHeight();
		return permute(buffer, w, h, (x, y) -> y * w + (w - 1 - x));
	}
	
	/**
	 * Mirror the image vertically (top becomes bottom).
	 * @param buffer
	 * @return
	 */
	public static PixelBuffer flipV(PixelBuffer buffer) {
		int w = buffer.getWidth();
		int h = buffer.getHeight();
		return permute(buffer, w, h, (x, y) -> (h - 1 - y) * w + x);
	}
	
	/**
	 * Rotate 90 degrees clockwise. The width and height are swapped.
	 * @param buffer
	 * @return
	 */
	public static PixelBuffer rotate90CW(PixelBuffer buffer) {
		int w = buffer.getWidth();
		int h = buffer.getHeight();
		return permute(buffer, h, w, (x, y) -> (h - 1 - x) * w + y);
	}
	
	/**
	 * Rotate 90 degrees counter-clockwise. The width and height are swapped.
	 * @param buffer
	 * @return
	 */
	public static PixelBuffer rotate90CCW(PixelBuffer buffer) {
		int w = buffer.getWidth();
		int h = buffer.getHeight();
		return permute(buffer, h, w, (x, y) -> x * w + (w - 1 - y));
	}
	
	/**
	 * Rotate 180 degrees.
	 * @param buffer
	 * @return
	 */
	public static PixelBuffer rotate180(PixelBuffer buffer) {
		int w = buffer.getWidth();
		int h = buffer.getHeight();
		return permute(buffer, w, h, (x, y) -> (h - 1 - y) * w + (w - 1 - x));
	}
	
	/**
	 * Rotate clockwise by an arbitrary angle.
	 * <p>
	 * Multiples of 90 degrees are handled exactly. Otherwise, the output is large enough to contain 
	 * the entire rotated image, pixels are computed by bicubic interpolation, and any pixels that 
	 * do not map back into the input are filled with transparent black (if the image has alpha) or black.
	 * Color images with alpha are interpolated using premultiplied values.
	 * 
	 * @param buffer
	 * @param angleDegrees clockwise rotation angle
	 * @return
	 */
	public static PixelBuffer rotate(PixelBuffer buffer, double angleDegrees) {
		Objects.requireNonNull(buffer);
		if (!Double.isFinite(angleDegrees))
			throw new IllegalArgumentException("Rotation angle must be finite, but was " + angleDegrees);
		
		// Work with a counter-clockwise angle in the range [0, 360)
		double angle = -angleDegrees % 360.0;
		if (angle < 0)
			angle += 360.0;
		if (angle == 0)
			return permute(buffer, buffer.getWidth(), buffer.getHeight(), (x, y) -> y * buffer.getWidth() + x);
		if (angle == 90)
			return rotate90CCW(buffer);
		if (angle == 180)
			return rotate180(buffer);
		if (angle == 270)
			return rotate90CW(buffer);
		
		int w = buffer.getWidth();
		int h = buffer.getHeight();
		
		// Matrix mapping output coordinates back to input coordinates
		double theta = -Math.toRadians(angle);
		double a = round15(Math.cos(theta));
		double b = round15(Math.sin(theta));
		double d = round15(-Math.sin(theta));
		double e = round15(Math.cos(theta));
		double cx = w / 2.0;
		double cy = h / 2.0;
		double c = a * -cx + b * -cy + cx;
		double f = d * -cx + e * -cy + cy;
		
		double minX = Double.POSITIVE_INFINITY, maxX = Double.NEGATIVE_INFINITY;
		double minY = Double.POSITIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
		for (double[] corner : new double[][] {{0, 0}, {w, 0}, {w, h}, {0, h}}) {
			double tx = a * corner[0] + b * corner[1] + c;
			double ty = d * corner[0] + e * corner[1] + f;
			minX = Math.min(minX, tx);
			maxX = Math.max(maxX, tx);
			minY = Math.min(minY, ty);
			maxY = Math.max(maxY, ty);
		}
		int outWidth = (int)(Math.ceil(maxX) - Math.floor(minX));
		int outHeight = (int)(Math.ceil(maxY) - Math.floor(minY));
		double dx = -(outWidth - w) / 2.0;
		double dy = -(outHeight - h) / 2.0;
		double c2 = a * dx + b * dy + c;
		double f2 = d * dx + e * dy + f;
		logger.debug("Rotating {}x{} image by {} degrees, output size {}x{}", w, h, angleDegrees, outWidth, outHeight);
		
		var mode = buffer.getColorMode();
		int n = mode.nChannels();
		boolean premultiply = mode == ColorMode.RGBA;
		int[] input = toIntSamples(buffer, premultiply);
		byte[] output = new byte[outWidth * outHeight * n];
		
		ParallelTools.forEachRow(outWidth, outHeight, y -> {
			double[] values = new double[n];
			int[] pixel = new int[n];
			for (int x = 0; x < outWidth; x++) {
				double xin = a * (x + 0.5) + b * (y + 0.5) + c2;
				double yin = d * (x + 0.5) + e * (y + 0.5) + f2;
				// Out-of-bounds pixels keep the fill value of 0
				if (xin < 0 || xin >= w || yin < 0 || yin >= h)
					continue;
				bicubic(input, w, h, n, xin, yin, values);
				for (int ch = 0; ch < n; ch++)
					pixel[ch] = clipRound(values[ch]);
				if (premultiply)
					unpremultiply(pixel);
				int outInd = (y * outWidth + x) * n;
				for (int ch = 0; ch < n; ch++)
					output[outInd + ch] = (byte)pixel[ch];
			}
		});
		return PixelBuffer.createInstance(outWidth, outHeight, mode, output);
	}
	
	private static double round15(double value) {
		return Math.round(value * 1e15) / 1e15;
	}
	
	private static int clipRound(double value) {
		if (value <= 0)
			return 0;
		if (value >= 255)
			return 255;
		return (int)Math.round(value);
	}
	
	private static int[] toIntSamples(PixelBuffer buffer, boolean premultiply) {
		byte[] samples = buffer.getSamples();
		int[] values = new int[samples.length];
		for (int i = 0; i < samples.length; i++)
			values[i] = samples[i] & 0xFF;
		if (premultiply) {
			for (int i = 0; i < values.length; i += 4) {
				int alpha = values[i+3];
				for (int c = 0; c < 3; c++)
					values[i+c] = mulDiv255(values[i+c], alpha);
			}
		}
		return values;
	}
	
	/**
	 * Compute {@code round(a * b / 255)} using integer arithmetic.
	 */
	static int mulDiv255(int a, int b) {
		int tmp = a * b + 128;
		return ((tmp >> 8) + tmp) >> 8;
	}
	
	private static void unpremultiply(int[] pixel) {
		int alpha = pixel[3];
		if (alpha == 0 || alpha == 255)
			return;
		for (int c = 0; c < 3; c++)
			pixel[c] = Math.min(255, 255 * pixel[c] / alpha);
	}
	
	/**
	 * Bicubic interpolation at a location in pixel coordinates (pixel centers at +0.5), 
	 * using the cubic convolution kernel with a = -1 and clamping at the image boundary.
	 */
	private static void bicubic(int[] input, int w, int h, int n, double xin, double yin, double[] output) {
		double xs = xin - 0.5;
		double ys = yin - 0.5;
		int x = (int)Math.floor(xs);
		int y = (int)Math.floor(ys);
		double dx = xs - x;
		double dy = ys - y;
		x--;
		y--;
		int[] xInds = new int[4];
		int[] yInds = new int[4];
		for (int i = 0; i < 4; i++) {
			xInds[i] = clamp(x + i, w) * n;
			yInds[i] = clamp(y + i, h) * w * n;
		}
		for (int ch = 0; ch < n; ch++) {
			double[] rows = new double[4];
			for (int j = 0; j < 4; j++) {
				int rowStart = yInds[j] + ch;
				rows[j] = cubic(
						input[rowStart + xInds[0]], input[rowStart + xInds[1]], 
						input[rowStart + xInds[2]], input[rowStart + xInds[3]], dx);
			}
			output[ch] = cubic(rows[0], rows[1], rows[2], rows[3], dy);
		}
	}
	
	private static int clamp(int i, int length) {
		return i < 0 ? 0 : (i >= length ? length - 1 : i);
	}
	
	private static double cubic(double v1, double v2, double v3, double v4, double t) {
		double p1 = v2;
		double p2 = -v1 + v3;
		double p3 = 2 * (v1 - v2) + v3 - v4;
		double p4 = -v1 + v2 - v3 + v4;
		return p1 + t * (p2 + t * (p3 + t * p4));
	}

}
