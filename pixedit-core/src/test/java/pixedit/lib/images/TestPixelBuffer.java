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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestPixelBuffer {
	
	@Test
	public void test_lengthInvariant() {
		assertThrows(IllegalArgumentException.class, () -> PixelBuffer.createInstance(2, 2, ColorMode.RGB, new byte[11]));
		assertThrows(IllegalArgumentException.class, () -> PixelBuffer.create(0, 2, ColorMode.GRAY));
		var buffer = PixelBuffer.createInstance(2, 2, ColorMode.RGBA, new byte[16]);
		assertEquals(4, buffer.nChannels());
		assertEquals(4, buffer.nPixels());
	}
	
	@Test
	public void test_createInstanceCopies() {
		byte[] samples = {1, 2, 3, 4};
		var buffer = PixelBuffer.createInstance(2, 2, ColorMode.GRAY, samples);
		samples[0] = 100;
		assertEquals(1, buffer.getSample(0, 0, 0));
		assertNotSame(buffer.getSamples(), buffer.getSamples());
	}
	
	@Test
	public void test_samplesCannotBeModified() {
		var buffer = PixelBuffer.filled(2, 2, ColorMode.RGB, 10, 20, 30);
		var copy = PixelBuffer.createInstance(2, 2, ColorMode.RGB, buffer.getSamples());
		buffer.getSamples()[0] = (byte)200;
		buffer.getPlane(0)[0] = 200;
		buffer.getPixel(0, 0)[0] = 200;
		assertEquals(10, buffer.getSample(0, 0, 0));
		assertEquals(copy, buffer);
		
		// Conversions within the package share no storage with their input
		var gray = buffer.convert(ColorMode.GRAY);
		gray.getSamples()[0] = 0;
		assertNotEquals(0, gray.getSample(0, 0, 0));
		assertEquals(copy, buffer);
	}
	
	@Test
	public void test_unsignedSamples() {
		var buffer = PixelBuffer.filled(3, 2, ColorMode.RGB, 255, 128, 0);
		assertArrayEquals(new int[] {255, 128, 0}, buffer.getPixel(2, 1));
		assertEquals(255, buffer.getSample(0, 0, 0));
		assertArrayEquals(new int[] {128, 128, 128, 128, 128, 128}, buffer.getPlane(1));
	}
	
	@Test
	public void test_fromPlanesClips() {
		var buffer = PixelBuffer.fromPlanes(2, 1, ColorMode.GRAY, new int[] {-5, 300});
		assertArrayEquals(new int[] {0, 255}, buffer.getPlane(0));
		assertThrows(IllegalArgumentException.class, () -> PixelBuffer.fromPlanes(2, 1, ColorMode.RGB, new int[2]));
	}
	
	@Test
	public void test_valueEquality() {
		var a = PixelBuffer.filled(4, 3, ColorMode.RGBA, 1, 2, 3, 4);
		var b = PixelBuffer.filled(4, 3, ColorMode.RGBA, 1, 2, 3, 4);
		var c = PixelBuffer.filled(3, 4, ColorMode.RGBA, 1, 2, 3, 4);
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		assertNotEquals(a, c);
	}
	
	@Nested
	class Conversions {
		
		@Test
		public void test_grayToRgb() {
			var gray = PixelBuffer.filled(2, 2, ColorMode.GRAY, 77);
			var rgb = gray.convert(ColorMode.RGB);
			assertArrayEquals(new int[] {77, 77, 77}, rgb.getPixel(1, 1));
			var rgba = gray.convert(ColorMode.RGBA);
			assertArrayEquals(new int[] {77, 77, 77, 255}, rgba.getPixel(0, 1));
		}
		
		@Test
		public void test_rgbToGray() {
			var rgb = PixelBuffer.filled(1, 1, ColorMode.RGB, 255, 0, 0);
			assertEquals(76, rgb.convert(ColorMode.GRAY).getSample(0, 0, 0));
			var white = PixelBuffer.filled(1, 1, ColorMode.RGBA, 255, 255, 255, 10);
			assertEquals(255, white.convert(ColorMode.GRAY).getSample(0, 0, 0));
		}
		
		@Test
		public void test_rgbaToRgbDropsAlpha() {
			var rgba = PixelBuffer.filled(1, 1, ColorMode.RGBA, 10, 20, 30, 40);
			assertArrayEquals(new int[] {10, 20, 30}, rgba.convert(ColorMode.RGB).getPixel(0, 0));
		}
		
		@Test
		public void test_sameModeReturnsInput() {
			var rgb = PixelBuffer.filled(1, 1, ColorMode.RGB, 1, 2, 3);
			assertSame(rgb, rgb.convert(ColorMode.RGB));
		}
		
		@Test
		public void test_luminanceWeights() {
			assertEquals(0, ColorConversions.luminance(0, 0, 0));
			assertEquals(255, ColorConversions.luminance(255, 255, 255));
			assertEquals(150, ColorConversions.luminance(0, 255, 0));
			assertEquals(29, ColorConversions.luminance(0, 0, 255));
		}
		
	}
	
	@Test
	public void test_colorModeLabels() {
		assertEquals(ColorMode.GRAY, ColorMode.fromLabel("L"));
		assertEquals(ColorMode.RGBA, ColorMode.fromLabel("rgba"));
		assertThrows(IllegalArgumentException.class, () -> ColorMode.fromLabel("CMYK"));
		assertArrayEquals(new String[] {"R", "G", "B", "A"}, ColorMode.RGBA.getChannelNames());
		assertEquals(3, ColorMode.RGBA.nColorChannels());
		assertEquals(-1, ColorMode.RGB.getAlphaChannel());
	}

}
