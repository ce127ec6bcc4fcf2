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

package pixedit.lib.awt.common;

import java.awt.image.BufferedImage;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.IndexColorModel;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixedit.lib.images.ColorMode;
import pixedit.lib.images.PixelBuffer;

/**
 * Collection of static methods for converting between {@link BufferedImage} and {@link PixelBuffer}.
 * 
 * @author PixEdit developers
 */
public final class BufferedImageTools {
	
	private final static Logger logger = LoggerFactory.getLogger(BufferedImageTools.class);
	
	// Suppress default constructor for non-instantiability
	private BufferedImageTools() {
		throw new AssertionError();
	}
	
	/**
	 * Get the {@link ColorMode} that best represents an image.
	 * Single-band images (other than indexed color) are grayscale; anything else is RGB or RGBA, 
	 * depending upon whether the color model has alpha.
	 * @param img
	 * @return
	 */
	public static ColorMode getColorMode(BufferedImage img) {
		var colorModel = img.getColorModel();
		if (!(colorModel instanceof IndexColorModel) && img.getSampleModel().getNumBands() == 1)
			return ColorMode.GRAY;
		return colorModel.hasAlpha() ? ColorMode.RGBA : ColorMode.RGB;
	}
	
	/**
	 * Convert a BufferedImage to a PixelBuffer.
	 * <p>
	 * 8-bit component images are read directly from the raster, so pixel values are not altered by 
	 * any color space conversion. Other images are converted via {@link BufferedImage#getRGB(int, int)}.
	 * 16-bit grayscale images are scaled to 8-bit.
	 * 
	 * @param img
	 * @return
	 */
	public static PixelBuffer fromBufferedImage(BufferedImage img) {
		Objects.requireNonNull(img);
		int w = img.getWidth();
		int h = img.getHeight();
		var mode = getColorMode(img);
		var raster = img.getRaster();
		int nBands = raster.getNumBands();
		int transferType = raster.getTransferType();
		
		if (mode == ColorMode.GRAY) {
			int[] plane = raster.getSamples(0, 0, w, h, 0, (int[])null);
			int shift = Math.max(0, img.getSampleModel().getSampleSize(0) - 8);
			if (shift > 0) {
				logger.debug("Scaling {}-bit grayscale image to 8-bit", shift + 8);
				for (int i = 0; i < plane.length; i++)
					plane[i] >>= shift;
			}
			return PixelBuffer.fromPlanes(w, h, mode, plane);
		}
		
		if (img.getColorModel() instanceof ComponentColorModel && transferType == DataBuffer.TYPE_BYTE && nBands == mode.nChannels()) {
			int[][] planes = new int[nBands][];
			for (int b = 0; b < nBands; b++)
				planes[b] = raster.getSamples(0, 0, w, h, b, (int[])null);
			return PixelBuffer.fromPlanes(w, h, mode, planes);
		}
		
		int[] rgb = img.getRGB(0, 0, w, h, null, 0, w);
		int n = mode.nChannels();
		byte[] samples = new byte[rgb.length * n];
		for (int i = 0; i < rgb.length; i++) {
			int val = rgb[i];
			int ind = i * n;
			samples[ind] = (byte)(val >> 16);
			samples[ind+1] = (byte)(val >> 8);
			samples[ind+2] = (byte)val;
			if (n == 4)
				samples[ind+3] = (byte)(val >>> 24);
		}
		return PixelBuffer.createInstance(w, h, mode, samples);
	}
	
	/**
	 * Convert a PixelBuffer to a BufferedImage.
	 * <p>
	 * The image type is {@link BufferedImage#TYPE_BYTE_GRAY}, {@link BufferedImage#TYPE_INT_RGB} or 
	 * {@link BufferedImage#TYPE_INT_ARGB}, according to the color mode.
	 * 
	 * @param buffer
	 * @return
	 */
	public static BufferedImage toBufferedImage(PixelBuffer buffer) {
		Objects.requireNonNull(buffer);
		int w = buffer.getWidth();
		int h = buffer.getHeight();
		var mode = buffer.getColorMode();
		if (mode == ColorMode.GRAY) {
			var img = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
			img.getRaster().setSamples(0, 0, w, h, 0, buffer.getPlane(0));
			return img;
		}
		var img = new BufferedImage(w, h, mode.hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
		byte[] samples = buffer.getSamples();
		int n = mode.nChannels();
		int[] rgb = new int[w * h];
		for (int i = 0; i < rgb.length; i++) {
			int ind = i * n;
			int alpha = mode.hasAlpha() ? samples[ind+3] & 0xFF : 255;
			rgb[i] = (alpha << 24) | ((samples[ind] & 0xFF) << 16) | ((samples[ind+1] & 0xFF) << 8) | (samples[ind+2] & 0xFF);
		}
		img.setRGB(0, 0, w, h, rgb, 0, w);
		return img;
	}

}
