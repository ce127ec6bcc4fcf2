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

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.function.IntConsumer;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixedit.lib.common.Prefs;

/**
 * Helper methods for row-parallel processing.
 * <p>
 * Each row must write only to its own part of the output, and read only from inputs that are not 
 * modified during processing. This ensures that results are identical whether or not rows are 
 * processed in parallel.
 * 
 * @author PixEdit developers
 */
public class ParallelTools {
	
	private final static Logger logger = LoggerFactory.getLogger(ParallelTools.class);
	
	private static ForkJoinPool pool;
	
	// Suppress default constructor for non-instantiability
	private ParallelTools() {
		throw new AssertionError();
	}
	
	private static synchronized ForkJoinPool getPool(int nThreads) {
		if (pool == null || pool.getParallelism() != nThreads) {
			if (pool != null)
				pool.shutdown();
			logger.debug("Creating processing pool with {} threads", nThreads);
			pool = new ForkJoinPool(nThreads);
		}
		return pool;
	}
	
	/**
	 * Returns true if an image with the specified number of pixels should be processed in parallel.
	 * @param nPixels
	 * @return
	 * @see Prefs#getParallelThreshold()
	 * @see Prefs#getNumThreads()
	 */
	public static boolean useParallel(long nPixels) {
		return Prefs.getNumThreads() > 1 && nPixels >= Prefs.getParallelThreshold();
	}
	
	/**
	 * Call a function for every row index from 0 (inclusive) to height (exclusive).
	 * @param width image width, used with the height to decide whether to parallelize
	 * @param height image height
	 * @param rowFunction function accepting a row index
	 */
	public static void forEachRow(int width, int height, IntConsumer rowFunction) {
		if (!useParallel((long)width * height)) {
			for (int y = 0; y < height; y++)
				rowFunction.accept(y);
			return;
		}
		var task = getPool(Prefs.getNumThreads()).submit(() -> IntStream.range(0, height).parallel().forEach(rowFunction));
		try {
			task.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Processing interrupted", e);
		} catch (ExecutionException e) {
			var cause = e.getCause();
			if (cause instanceof RuntimeException)
				throw (RuntimeException)cause;
			if (cause instanceof Error)
				throw (Error)cause;
			throw new IllegalStateException(cause);
		}
	}

}
