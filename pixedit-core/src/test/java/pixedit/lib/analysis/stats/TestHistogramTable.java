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

package pixedit.lib.analysis.stats;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.Test;

import pixedit.lib.common.GeneralTools;
import pixedit.lib.images.ColorMode;
import pixedit.lib.images.PixelBuffer;

@SuppressWarnings("javadoc")
public class TestHistogramTable {
	
	@Test
	public void test_blackLuminance() {
		var buffer = PixelBuffer.create(10, 10, ColorMode.GRAY);
		var table = HistogramTable.compute(buffer);
		assertTrue(table.isLuminance());
		assertEquals(List.of("L"), table.getChannelNames());
		assertEquals(100, table.getCount("L", 0));
		for (int i = 1; i < 256; i++)
			assertEquals(0, table.getCount("L", i));
		assertEquals(0.0, table.getMean("L"));
	}
	
	@Test
	public void test_countsSumToPixels() {
		var random = new Random(42);
		byte[] samples = new byte[17 * 13 * 4];
		random.nextBytes(samples);
		var buffer = PixelBuffer.createInstance(17, 13, ColorMode.RGBA, samples);
		var table = HistogramTable.compute(buffer);
		assertFalse(table.isLuminance());
		assertEquals(List.of("R", "G", "B"), table.getChannelNames());
		for (String channel : table.getChannelNames()) {
			long[] counts = table.getCounts(channel);
			assertEquals(256, counts.length);
			assertEquals(17 * 13, GeneralTools.sum(counts));
		}
		assertThrows(IllegalArgumentException.class, () -> table.getCounts("A"));
	}
	
	@Test
	public void test_rgbChannels() {
		var buffer = PixelBuffer.filled(2, 3, ColorMode.RGB, 10, 20, 30);
		var table = HistogramTable.compute(buffer);
		assertEquals(6, table.getCount("R", 10));
		assertEquals(6, table.getCount("G", 20));
		assertEquals(6, table.getCount("B", 30));
		assertEquals(6, table.getMaxCount());
		assertEquals(20.0, table.getMean("G"), 1e-12);
	}
	
	@Test
	public void test_rebin() {
		// 512 levels, each pair collapses into one bin
		long[] counts = new long[512];
		for (int i = 0; i < counts.length; i++)
			counts[i] = i % 2 == 0 ? 1 : 3;
		long[] rebinned = HistogramTable.rebin(counts, 256);
		assertEquals(256, rebinned.length);
		for (long v : rebinned)
			assertEquals(4, v);
		
		// 2 levels spread across 4 bins
		assertArrayEquals(new long[] {5, 5, 10, 10}, HistogramTable.rebin(new long[] {10, 20}, 4));
		
		// Total is always preserved
		long[] odd = {7, 0, 3, 11, 1};
		assertEquals(22, GeneralTools.sum(HistogramTable.rebin(odd, 256)));
	}
	
	@Test
	public void test_fromCounts() {
		long[] counts = new long[65536];
		counts[0] = 5;
		counts[65535] = 7;
		var table = HistogramTable.fromCounts(Map.of("L", counts));
		assertEquals(12, table.nValues());
		assertEquals(5, table.getCount("L", 0));
		assertEquals(7, table.getCount("L", 255));
		assertThrows(IllegalArgumentException.class, 
				() -> HistogramTable.fromCounts(Map.of("R", new long[] {1}, "G", new long[] {2})));
	}

}
