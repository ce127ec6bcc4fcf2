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

package pixedit;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import pixedit.lib.analysis.stats.HistogramTable;
import pixedit.lib.images.io.ImageIoTools;
import pixedit.lib.io.GsonTools;

@Command(name = "histogram", description = {
		"Print the histogram of an image file.",
		"Grayscale images have a single luminance channel (L), color images have R, G and B channels."})
class HistogramCommand implements Callable<Integer> {
	
	@Spec
	private CommandSpec spec;
	
	@Parameters(index = "0", description = "Path to the image.", paramLabel = "image")
	private Path path;
	
	@Option(names = {"-j", "--json"}, description = "Print all counts as JSON.")
	private boolean json;

	@Override
	public Integer call() throws Exception {
		var histogram = HistogramTable.compute(ImageIoTools.read(path).getBuffer());
		var out = spec.commandLine().getOut();
		if (json) {
			var map = new LinkedHashMap<String, long[]>();
			for (var channel : histogram.getChannelNames())
				map.put(channel, histogram.getCounts(channel));
			out.println(GsonTools.getInstance().toJson(map));
			return 0;
		}
		out.println("Values: " + histogram.nValues());
		for (var channel : histogram.getChannelNames()) {
			long[] counts = histogram.getCounts(channel);
			int peak = 0;
			for (int i = 1; i < counts.length; i++) {
				if (counts[i] > counts[peak])
					peak = i;
			}
			out.println(String.format(Locale.ROOT, "%s: mean %.2f, peak %d (%d values)", 
					channel, histogram.getMean(channel), peak, counts[peak]));
		}
		return 0;
	}

}
