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

import org.junit.jupiter.api.Test;

import pixedit.lib.images.ColorMode;
import pixedit.lib.images.PixelBuffer;

@SuppressWarnings("javadoc")
public class TestMedianFilter {
	
	@Test
	public void test_removesOutlier() {
		int[] plane = new int[25];
		plane[12] = 255;
		var buffer = PixelBuffer.fromPlanes(5, 5, ColorMode.GRAY, plane);
		var output = MedianFilter.medianFilter(buffer, 3, ChannelMode.LUMINANCE);
		assertEquals(PixelBuffer.create(5, 5, ColorMode.GRAY), output);
	}
	
	@Test
	public void test_sizeOneIsIdentity() {
		var buffer = PixelBuffer.fromPlanes(3, 1, ColorMode.GRAY, new int[] {5, 100, 7});
		assertEquals(buffer, MedianFilter.medianFilter(buffer, 1, ChannelMode.RGB));
		assertEquals(buffer, MedianFilter.medianFilter(buffer, 0, ChannelMode.RGB));
	}
	
	@Test
	public void test_evenSizeIsIncreased() {
		var buffer = PixelBuffer.fromPlanes(5, 1, ColorMode.GRAY, new int[] {0, 0, 9, 0, 0});
		assertEquals(MedianFilter.medianFilter(buffer, 3, ChannelMode.RGB), 
				MedianFilter.medianFilter(buffer, 2, ChannelMode.RGB));
	}
	
	@Test
	public void test_median() {
		// Reflected rows make each 3x3 window contain the row 3 times
		int[] plane = {1, 9, 5, 3};
		assertArrayEquals(new int[] {9, 5, 5, 5}, MedianFilter.median(plane, 4, 1, 3));
	}
	
	@Test
	public void test_channelsFilteredSeparately() {
		var rgb = PixelBuffer.filled(3, 3, ColorMode.RGB, 10, 20, 30);
		assertEquals(rgb, MedianFilter.medianFilter(rgb, 3, ChannelMode.RGB));
	}

}
