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

import java.util.Arrays;
import java.util.Objects;

/**
 * A 2D image with 8-bit unsigned samples in one of the supported {@link ColorMode}s.
 * <p>
 * Samples are interleaved and stored in row-major order, so the sample for channel {@code c} at
 * {@code (x, y)} is found at index {@code (y * width + x) * nChannels + c}.
 * <p>
 * A PixelBuffer is treated as a value: all operations that change pixels return a new buffer,
 * and the backing array is never exposed for modification.
 *
 * @author PixEdit developers
 */
public final class PixelBuffer {

	private final int width;
	private final int height;
	private final ColorMode mode;
	private final byte[] samples;

	private PixelBuffer(int width, int height, ColorMode mode, byte[] samples) {
		Objects.requireNonNull(mode, "Color mode must not be null!");
		Objects.requireNonNull(samples, "Samples must not be null!");
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Width and height must be > 0, but requested " + width + "x" + height);
		long expected = (long)width * height * mode.nChannels();
		if (samples.length != expected)
			throw new IllegalArgumentException(
					String.format("Expected %d samples for %dx%d %s image, but got %d",
							expected, width, height, mode, samples.length));
		this.width = width;
		this.height = height;
		this.mode = mode;
		this.samples = samples;
	}

	/**
	 * Create a new buffer with all samples set to 0.
	 * @param width
	 * @param height
	 * @param mode
	 * @return
	 */
	public static PixelBuffer create(int width, int height, ColorMode mode) {
		return new PixelBuffer(width, height, mode, new byte[checkedLength(width, height, mode)]);
	}

	/**
	 * Create a new buffer from interleaved samples. The array is copied.
	 * @param width
	 * @param height
	 * @param mode
	 * @param samples
	 * @return
	 */
	public static PixelBuffer createInstance(int width, int height, ColorMode mode, byte[] samples) {
		return new PixelBuffer(width, height, mode, samples.clone());
	}

	/**
	 * Create a new buffer where every pixel has the same value.
	 * @param width
	 * @param height
	 * @param mode
	 * @param values one value per channel; if only one value is given, it is used for every channel
	 * @return
	 */
	public static PixelBuffer filled(int width, int height, ColorMode mode, int... values) {
		int nChannels = mode.nChannels();
		if (values.length != 1 && values.length != nChannels)
			throw new IllegalArgumentException("Expected 1 or " + nChannels + " values, but got " + values.length);
		byte[] samples = new byte[checkedLength(width, height, mode)];
		for (int i = 0; i < samples.length; i++) {
			int v = values.length == 1 ? values[0] : values[i % nChannels];
			samples[i] = (byte)v;
		}
		return new PixelBuffer(width, height, mode, samples);
	}

	/**
	 * Create a buffer that uses the provided array directly, without copying.
	 * Only for code in this package that has just allocated the array.
	 */
	static PixelBuffer wrap(int width, int height, ColorMode mode, byte[] samples) {
		return new PixelBuffer(width, height, mode, samples);
	}

	/**
	 * Create a buffer from separate channel planes, each containing {@code width * height} values in the range 0-255.
	 * Values outside this range are clipped.
	 * @param width
	 * @param height
	 * @param mode
	 * @param planes one plane per channel of the mode
	 * @return
	 */
	public static PixelBuffer fromPlanes(int width, int height, ColorMode mode, int[]... planes) {
		int nChannels = mode.nChannels();
		if (planes.length != nChannels)
			throw new IllegalArgumentException("Expected " + nChannels + " planes for " + mode + ", but got " + planes.length);
		int n = width * height;
		byte[] samples = new byte[checkedLength(width, height, mode)];
		for (int c = 0; c < nChannels; c++) {
			int[] plane = planes[c];
			if (plane.length != n)
				throw new IllegalArgumentException("Plane " + c + " has length " + plane.length + ", expected " + n);
			for (int i = 0; i < n; i++) {
				int v = plane[i];
				samples[i * nChannels + c] = (byte)(v < 0 ? 0 : (v > 255 ? 255 : v));
			}
		}
		return new PixelBuffer(width, height, mode, samples);
	}

	private static int checkedLength(int width, int height, ColorMode mode) {
		long n = (long)width * height * mode.nChannels();
		if (width <= 0 || height <= 0 || n > Integer.MAX_VALUE)
			throw new IllegalArgumentException("Unsupported image size " + width + "x" + height);
		return (int)n;
	}

	/**
	 * Image width in pixels.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Image height in pixels.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Color mode, which determines the number of channels.
	 * @return
	 */
	public ColorMode getColorMode() {
		return mode;
	}

	/**
	 * Number of channels (including alpha).
	 * @return
	 */
	public int nChannels() {
		return mode.nChannels();
	}

	/**
	 * Number of pixels, i.e. {@code width * height}.
	 * @return
	 */
	public int nPixels() {
		return width * height;
	}

	/**
	 * Get a single sample value in the range 0-255.
	 * @param x
	 * @param y
	 * @param channel
	 * @return
	 */
	public int getSample(int x, int y, int channel) {
		return samples[(y * width + x) * mode.nChannels() + channel] & 0xFF;
	}

	/**
	 * Get all channel values for a single pixel.
	 * @param x
	 * @param y
	 * @return
	 */
	public int[] getPixel(int x, int y) {
		int n = mode.nChannels();
		int[] values = new int[n];
		int ind = (y * width + x) * n;
		for (int c = 0; c < n; c++)
			values[c] = samples[ind + c] & 0xFF;
		return values;
	}

	/**
	 * Extract the values of a single channel as a new array of length {@code width * height}.
	 * @param channel
	 * @return
	 */
	public int[] getPlane(int channel) {
		if (channel < 0 || channel >= mode.nChannels())
			throw new IndexOutOfBoundsException("Channel " + channel + " out of range for " + mode);
		int n = mode.nChannels();
		int[] plane = new int[width * height];
		for (int i = 0; i < plane.length; i++)
			plane[i] = samples[i * n + channel] & 0xFF;
		return plane;
	}

	/**
	 * Get a copy of the interleaved samples.
	 * @return
	 */
	public byte[] getSamples() {
		return samples.clone();
	}
	
	/**
	 * Backing array, for read-only use within this package.
	 */
	byte[] samples() {
		return samples;
	}

	/**
	 * Convert to another color mode, returning this buffer if the mode is unchanged.
	 * @param targetMode
	 * @return
	 * @see ColorConversions#convert(PixelBuffer, ColorMode)
	 */
	public PixelBuffer convert(ColorMode targetMode) {
		return ColorConversions.convert(this, targetMode);
	}

	/**
	 * Returns true if the dimensions and color mode match another buffer.
	 * @param other
	 * @return
	 */
	public boolean isSameShape(PixelBuffer other) {
		return other != null && width == other.width && height == other.height && mode == other.mode;
	}

	@Override
	public int hashCode() {
		return Objects.hash(width, height, mode) * 31 + Arrays.hashCode(samples);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof PixelBuffer))
			return false;
		PixelBuffer other = (PixelBuffer)obj;
		return isSameShape(other) && Arrays.equals(samples, other.samples);
	}

	@Override
	public String toString() {
		return String.format("PixelBuffer (%d x %d, %s)", width, height, mode);
	}

}
