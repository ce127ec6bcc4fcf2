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

package pixedit.lib.common;

import java.io.File;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A collection of generally-useful static methods.
 *
 * @author PixEdit developers
 */
public class GeneralTools {

	// Suppress default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}

	/**
	 * Clip a value to be within a specific range.
	 *
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static int clipValue(final int value, final int min, final int max) {
		return value < min ? min : (value > max ? max : value);
	}

	/**
	 * Clip a value to be within a specific range.
	 *
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static double clipValue(final double value, final double min, final double max) {
		return value < min ? min : (value > max ? max : value);
	}

	/**
	 * Get the smallest odd integer that is &ge; the input, and at least 1.
	 * <p>
	 * Kernel sizes, median windows and structuring elements all rely on this to have a well-defined center.
	 * @param value
	 * @return
	 */
	public static int forceOdd(final int value) {
		int v = Math.max(1, value);
		return v % 2 == 1 ? v : v + 1;
	}

	/**
	 * Compute the sum of elements in a long array (possibly representing a histogram).
	 * @param values
	 * @return
	 */
	public static long sum(long[] values) {
		long total = 0L;
		for (long v : values)
			total += v;
		return total;
	}

	/**
	 * Get the extension of a file name, lower case and including the dot.
	 * @param name
	 * @return the extension, or empty if none could be found
	 */
	public static Optional<String> getExtension(String name) {
		Objects.requireNonNull(name);
		int ind = name.lastIndexOf(".");
		if (ind < 0 || ind == name.length() - 1)
			return Optional.empty();
		String ext = name.substring(ind);
		if (!ext.matches("\\.\\w*"))
			return Optional.empty();
		return Optional.of(ext.toLowerCase(Locale.ROOT));
	}

	/**
	 * Get the extension of a file, lower case and including the dot.
	 * @param file
	 * @return
	 * @see #getExtension(String)
	 */
	public static Optional<String> getExtension(File file) {
		Objects.requireNonNull(file);
		return getExtension(file.getName());
	}

	/**
	 * Format a number of bytes as a human-readable String using binary units (e.g. "1.50 KB").
	 * @param nBytes
	 * @return
	 */
	public static String formatBytes(long nBytes) {
		String[] units = {"B", "KB", "MB", "GB", "TB"};
		double value = nBytes;
		int i = 0;
		while (value >= 1024 && i < units.length - 1) {
			value /= 1024;
			i++;
		}
		return String.format(Locale.ROOT, "%.2f %s", value, units[i]);
	}

}
