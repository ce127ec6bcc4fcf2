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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import pixedit.lib.common.GeneralTools;
import pixedit.lib.images.ColorMode;
import pixedit.lib.images.PixelBuffer;

/**
 * Frequency table with 256 bins per channel.
 * <p>
 * Grayscale images have a single channel named "L". All other images are treated as RGB, 
 * with channels "R", "G" and "B"; any alpha channel is ignored.
 * For every channel the counts sum to the number of pixels in the image.
 * 
 * @author PixEdit developers
 */
public class HistogramTable {
	
	/**
	 * Number of bins used for every channel.
	 */
	public static final int N_BINS = 256;
	
	private final Map<String, long[]> counts;
	private final long nValues;
	
	private HistogramTable(Map<String, long[]> counts, long nValues) {
		this.counts = counts;
		this.nValues = nValues;
	}
	
	/**
	 * Compute a histogram for an image.
	 * @param buffer
	 * @return
	 */
	public static HistogramTable compute(PixelBuffer buffer) {
		Objects.requireNonNull(buffer);
		var map = new LinkedHashMap<String, long[]>();
		byte[] samples = buffer.getSamples();
		int nChannels = buffer.nChannels();
		if (buffer.getColorMode() == ColorMode.GRAY) {
			long[] l = new long[N_BINS];
			for (byte b : samples)
				l[b & 0xFF]++;
			map.put("L", l);
		} else {
			long[] r = new long[N_BINS];
			long[] g = new long[N_BINS];
			long[] b = new long[N_BINS];
			for (int i = 0; i < samples.length; i += nChannels) {
				r[samples[i] & 0xFF]++;
				g[samples[i+1] & 0xFF]++;
				b[samples[i+2] & 0xFF]++;
			}
			map.put("R", r);
			map.put("G", g);
			map.put("B", b);
		}
		return new HistogramTable(map, buffer.nPixels());
	}
	
	/**
	 * Create a table from counts that may have any number of levels, e.g. from a 16-bit image.
	 * Counts are rebinned to {@link #N_BINS} bins if necessary.
	 * @param channelCounts map of channel names to counts; all channels must have the same total
	 * @return
	 * @throws IllegalArgumentException if the map is empty, or the channel totals differ
	 * @see #rebin(long[], int)
	 */
	public static HistogramTable fromCounts(Map<String, long[]> channelCounts) {
		if (channelCounts.isEmpty())
			throw new IllegalArgumentException("At least one channel is required");
		var map = new LinkedHashMap<String, long[]>();
		long total = -1;
		for (var entry : channelCounts.entrySet()) {
			long[] values = entry.getValue();
			long sum = GeneralTools.sum(values);
			if (total >= 0 && sum != total)
				throw new IllegalArgumentException("Channel " + entry.getKey() + " has " + sum + " values, expected " + total);
			total = sum;
			map.put(entry.getKey(), values.length == N_BINS ? values.clone() : rebin(values, N_BINS));
		}
		return new HistogramTable(map, total);
	}
	
	/**
	 * Map a histogram with any number of levels onto {@code nBins} bins.
	 * <p>
	 * Each input level is treated as covering an equal-width interval of the value range, and its count 
	 * is shared between the output bins overlapping that interval in proportion to the overlap.
	 * Cumulative counts are rounded, so the total is always preserved exactly.
	 * 
	 * @param counts
	 * @param nBins
	 * @return
	 */
	public static long[] rebin(long[] counts, int nBins) {
		if (nBins <= 0)
			throw new IllegalArgumentException("Number of bins must be > 0");
		int nLevels = counts.length;
		if (nLevels == nBins)
			return counts.clone();
		long[] output = new long[nBins];
		if (nLevels == 0)
			return output;
		long[] cumulative = new long[nLevels + 1];
		for (int i = 0; i < nLevels; i++)
			cumulative[i+1] = cumulative[i] + counts[i];
		long previous = 0;
		for (int j = 0; j < nBins; j++) {
			double pos = (j + 1.0) * nLevels / nBins;
			long next;
			if (j == nBins - 1)
				next = cumulative[nLevels];
			else {
				int ind = (int)Math.floor(pos);
				double frac = pos - ind;
				double value = cumulative[ind] + (ind < nLevels ? frac * counts[ind] : 0);
				next = Math.round(value);
			}
			output[j] = next - previous;
			previous = next;
		}
		return output;
	}
	
	/**
	 * Names of the channels, in order.
	 * @return
	 */
	public List<String> getChannelNames() {
		return List.copyOf(counts.keySet());
	}
	
	/**
	 * Number of channels.
	 * @return
	 */
	public int nChannels() {
		return counts.size();
	}
	
	/**
	 * Returns true if this table describes a single luminance channel.
	 * @return
	 */
	public boolean isLuminance() {
		return counts.size() == 1 && counts.containsKey("L");
	}
	
	/**
	 * Number of values counted per channel (i.e. the number of pixels).
	 * @return
	 */
	public long nValues() {
		return nValues;
	}
	
	/**
	 * Get a copy of the counts for a channel.
	 * @param channel channel name, e.g. "L" or "R"
	 * @return
	 * @throws IllegalArgumentException if the channel is not found
	 */
	public long[] getCounts(String channel) {
		return getCountsDirect(channel).clone();
	}
	
	/**
	 * Get the count for a single bin.
	 * @param channel
	 * @param bin
	 * @return
	 */
	public long getCount(String channel, int bin) {
		return getCountsDirect(channel)[bin];
	}
	
	private long[] getCountsDirect(String channel) {
		long[] values = counts.get(channel);
		if (values == null)
			throw new IllegalArgumentException("Unknown channel " + channel + ", available channels are " + counts.keySet());
		return values;
	}
	
	/**
	 * Maximum count in any bin of any channel. Useful for scaling a plot.
	 * @return
	 */
	public long getMaxCount() {
		long max = 0;
		for (long[] values : counts.values()) {
			for (long v : values)
				max = Math.max(max, v);
		}
		return max;
	}
	
	/**
	 * Mean value for a channel, or NaN if there are no values.
	 * @param channel
	 * @return
	 */
	public double getMean(String channel) {
		long[] values = getCountsDirect(channel);
		long n = GeneralTools.sum(values);
		if (n == 0)
			return Double.NaN;
		double sum = 0;
		for (int i = 0; i < values.length; i++)
			sum += (double)i * values[i];
		return sum / n;
	}
	
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof HistogramTable))
			return false;
		HistogramTable other = (HistogramTable)obj;
		if (nValues != other.nValues || !counts.keySet().equals(other.counts.keySet()))
			return false;
		for (var entry : counts.entrySet()) {
			if (!Arrays.equals(entry.getValue(), other.counts.get(entry.getKey())))
				return false;
		}
		return true;
	}
	
	@Override
	public int hashCode() {
		int hash = Long.hashCode(nValues);
		for (var entry : counts.entrySet())
			hash = 31 * hash + entry.getKey().hashCode() * 17 + Arrays.hashCode(entry.getValue());
		return hash;
	}
	
	@Override
	public String toString() {
		return "HistogramTable " + counts.keySet() + " (n=" + nValues + ")";
	}

}
