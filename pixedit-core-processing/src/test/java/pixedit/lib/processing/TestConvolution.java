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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;

import pixedit.lib.images.ColorMode;
import pixedit.lib.images.PixelBuffer;
import pixedit.lib.kernels.Kernel;

@SuppressWarnings("javadoc")
public class TestConvolution {
	
	@Test
	public void test_constantImageWithNormalizedKernel() {
		var buffer = PixelBuffer.filled(5, 5, ColorMode.GRAY, 100);
		assertEquals(buffer, Convolution.convolve(buffer, Kernels.boxBlur(3, 3), ChannelMode.LUMINANCE, true));
		assertEquals(buffer, Convolution.convolve(buffer, Kernels.gaussian3x3(), ChannelMode.RGB, true));
		assertEquals(buffer, Convolution.convolve(buffer, Kernels.sharpen(), ChannelMode.RGB, false));
	}
	
	@Test
	public void test_zeroSumKernelIsNotNormalized() {
		var buffer = PixelBuffer.filled(4, 4, ColorMode.GRAY, 100);
		var output = Convolution.convolve(buffer, Kernels.sobelX(), ChannelMode.LUMINANCE, true);
		assertEquals(PixelBuffer.filled(4, 4, ColorMode.GRAY, 0), output);
	}
	
	@Test
	public void test_zeroKernelIsIdentity() {
		var buffer = PixelBuffer.fromPlanes(3, 2, ColorMode.GRAY, new int[] {1, 2, 3, 4, 5, 6});
		var zero = Kernel.create(new double[3][3]);
		assertEquals(Kernel.identity(3, 3), Convolution.checkKernel(zero));
		assertEquals(buffer, Convolution.convolve(buffer, zero, ChannelMode.RGB, true));
		
		var sharpen = Kernels.sharpen();
		assertSame(sharpen, Convolution.checkKernel(sharpen));
	}
	
	@Test
	public void test_scalingKernel() {
		var buffer = PixelBuffer.fromPlanes(2, 1, ColorMode.GRAY, new int[] {100, 200});
		var kernel = Kernel.create(new double[][] {{2}});
		assertArrayEquals(new int[] {200, 255}, Convolution.convolve(buffer, kernel, ChannelMode.RGB, false).getPlane(0));
		assertEquals(buffer, Convolution.convolve(buffer, kernel, ChannelMode.RGB, true));
	}
	
	@Test
	public void test_reflectBorders() {
		// Shifting left by one column reflects the last column around the edge
		var buffer = PixelBuffer.fromPlanes(4, 1, ColorMode.GRAY, new int[] {10, 20, 30, 40});
		var shift = Kernel.create(new double[][] {{0, 0, 1}});
		assertArrayEquals(new int[] {20, 30, 40, 30}, Convolution.convolve(buffer, shift, ChannelMode.RGB, false).getPlane(0));
		var shiftBack = Kernel.create(new double[][] {{1, 0, 0}});
		assertArrayEquals(new int[] {20, 10, 20, 30}, Convolution.convolve(buffer, shiftBack, ChannelMode.RGB, false).getPlane(0));
	}
	
	@Test
	public void test_reflect101() {
		assertEquals(1, ChannelTools.reflect101(-1, 5));
		assertEquals(2, ChannelTools.reflect101(-2, 5));
		assertEquals(3, ChannelTools.reflect101(5, 5));
		assertEquals(2, ChannelTools.reflect101(6, 5));
		assertEquals(4, ChannelTools.reflect101(4, 5));
		assertEquals(0, ChannelTools.reflect101(-3, 1));
		assertEquals(0, ChannelTools.reflect101(7, 1));
		assertEquals(1, ChannelTools.reflect101(-1, 2));
	}
	
	@Test
	public void test_clipRound() {
		assertEquals(0, Convolution.clipRound(-3.2));
		assertEquals(0, Convolution.clipRound(Double.NaN));
		assertEquals(255, Convolution.clipRound(300));
		assertEquals(3, Convolution.clipRound(2.5));
		assertEquals(2, Convolution.clipRound(2.49));
	}
	
	@Test
	public void test_luminanceMode() {
		var buffer = PixelBuffer.filled(4, 4, ColorMode.RGBA, 255, 0, 0, 90);
		var output = Convolution.convolve(buffer, Kernels.boxBlur(3, 3), ChannelMode.LUMINANCE, true);
		assertEquals(ColorMode.RGBA, output.getColorMode());
		assertArrayEquals(new int[] {76, 76, 76, 90}, output.getPixel(2, 2));
	}
	
	@Test
	public void test_rgbMode() {
		var buffer = PixelBuffer.filled(4, 4, ColorMode.RGBA, 255, 0, 0, 90);
		var output = Convolution.convolve(buffer, Kernels.boxBlur(3, 3), ChannelMode.RGB, true);
		assertEquals(buffer, output);
	}
	
	@Test
	public void test_evenKernelIsPadded() {
		var kernel = Kernel.create(new double[][] {{1, 1}, {1, 1}});
		assertEquals(3, kernel.getRows());
		assertEquals(3, kernel.getCols());
		var buffer = PixelBuffer.filled(6, 6, ColorMode.GRAY, 50);
		assertEquals(buffer, Convolution.convolve(buffer, kernel, ChannelMode.LUMINANCE, true));
	}

}
