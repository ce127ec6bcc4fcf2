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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.awt.image.BufferedImage;
import java.util.Random;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.api.Test;

import pixedit.lib.images.ColorMode;
import pixedit.lib.images.PixelBuffer;

@SuppressWarnings("javadoc")
public class TestBufferedImageTools {
	
	private static PixelBuffer createRandom(ColorMode mode) {
		byte[] samples = new byte[11 * 7 * mode.nChannels()];
		new Random(mode.ordinal()).nextBytes(samples);
		return PixelBuffer.createInstance(11, 7, mode, samples);
	}
	
	@ParameterizedTest
	@EnumSource(ColorMode.class)
	public void test_roundTrip(ColorMode mode) {
		var buffer = createRandom(mode);
		var img = BufferedImageTools.toBufferedImage(buffer);
		assertEquals(11, img.getWidth());
		assertEquals(7, img.getHeight());
		assertEquals(mode, BufferedImageTools.getColorMode(img));
		assertEquals(buffer, BufferedImageTools.fromBufferedImage(img));
	}
	
	@Test
	public void test_bgrRaster() {
		var img = new BufferedImage(2, 1, BufferedImage.TYPE_3BYTE_BGR);
		img.setRGB(0, 0, 0xFF102030);
		img.setRGB(1, 0, 0xFFFFFFFF);
		var buffer = BufferedImageTools.fromBufferedImage(img);
		assertEquals(ColorMode.RGB, buffer.getColorMode());
		assertArrayEquals(new int[] {0x10, 0x20, 0x30}, buffer.getPixel(0, 0));
		assertArrayEquals(new int[] {255, 255, 255}, buffer.getPixel(1, 0));
	}
	
	@Test
	public void test_16bitGray() {
		var img = new BufferedImage(2, 1, BufferedImage.TYPE_USHORT_GRAY);
		img.getRaster().setSample(0, 0, 0, 65535);
		img.getRaster().setSample(1, 0, 0, 0x1234);
		var buffer = BufferedImageTools.fromBufferedImage(img);
		assertEquals(ColorMode.GRAY, buffer.getColorMode());
		assertArrayEquals(new int[] {255, 0x12}, buffer.getPlane(0));
	}
	
	@Test
	public void test_indexedColor() {
		var img = new BufferedImage(3, 1, BufferedImage.TYPE_BYTE_BINARY);
		img.setRGB(1, 0, 0xFFFFFFFF);
		var buffer = BufferedImageTools.fromBufferedImage(img);
		assertEquals(ColorMode.RGB, buffer.getColorMode());
		assertArrayEquals(new int[] {0, 255, 0}, buffer.getPlane(1));
	}

}
