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

import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Core PixEdit preferences. These are not persistent, but defaults can be overridden 
 * using system properties at startup.
 * 
 * @author PixEdit developers
 */
public class Prefs {
	
	private final static Logger logger = LoggerFactory.getLogger(Prefs.class);
	
	/**
	 * System property used to override the default history capacity.
	 */
	public static final String PROP_HISTORY_CAPACITY = "pixedit.history.capacity";

	/**
	 * System property used to override the minimum number of pixels before processing is parallelized.
	 */
	public static final String PROP_PARALLEL_THRESHOLD = "pixedit.parallel.threshold";
	
	/**
	 * Default number of history entries retained for undo.
	 */
	public static final int DEFAULT_HISTORY_CAPACITY = 100;
	
	/**
	 * Default minimum number of pixels before rows are processed in parallel.
	 */
	public static final int DEFAULT_PARALLEL_THRESHOLD = 512 * 512;
	
	private static int historyCapacity = readInt(PROP_HISTORY_CAPACITY, DEFAULT_HISTORY_CAPACITY, 1);
	private static int parallelThreshold = readInt(PROP_PARALLEL_THRESHOLD, DEFAULT_PARALLEL_THRESHOLD, 0);
	private static int nThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
	private static Path presetDirectory = Paths.get(System.getProperty("user.home"), ".pixedit");
	
	// Suppress default constructor for non-instantiability
	private Prefs() {
		throw new AssertionError();
	}
	
	private static int readInt(String key, int defaultValue, int minValue) {
		String value = System.getProperty(key);
		if (value == null || value.isBlank())
			return defaultValue;
		try {
			return Math.max(minValue, Integer.parseInt(value.strip()));
		} catch (NumberFormatException e) {
			logger.warn("Invalid value for {}: {} (using default {})", key, value, defaultValue);
			return defaultValue;
		}
	}
	
	/**
	 * Get the maximum number of entries retained by a new edit history.
	 * @return
	 */
	public static int getHistoryCapacity() {
		return historyCapacity;
	}

	/**
	 * Set the maximum number of entries retained by a new edit history. This will be clipped to be at least 1.
	 * @param n
	 */
	public static void setHistoryCapacity(int n) {
		historyCapacity = Math.max(1, n);
	}
	
	/**
	 * Get the minimum number of pixels an image must have before processing is split across threads.
	 * @return
	 */
	public static int getParallelThreshold() {
		return parallelThreshold;
	}

	/**
	 * Set the minimum number of pixels an image must have before processing is split across threads.
	 * Use 0 to always parallelize, or {@link Integer#MAX_VALUE} to never do so.
	 * @param n
	 */
	public static void setParallelThreshold(int n) {
		parallelThreshold = Math.max(0, n);
	}
	
	/**
	 * Get the requested number of threads to use for parallelization.
	 * @return
	 */
	public static int getNumThreads() {
		return nThreads;
	}

	/**
	 * Set the requested number of threads. This will be clipped to be at least 1.
	 * @param n
	 */
	public static void setNumThreads(int n) {
		nThreads = Math.max(1, n);
	}
	
	/**
	 * Get the directory used to store user presets.
	 * @return
	 */
	public static Path getPresetDirectory() {
		return presetDirectory;
	}
	
	/**
	 * Set the directory used to store user presets.
	 * @param path
	 */
	public static void setPresetDirectory(Path path) {
		presetDirectory = path;
	}

}
