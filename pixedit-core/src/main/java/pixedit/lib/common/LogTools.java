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

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;

/**
 * Helper for warnings that should only be shown once, e.g. because the same image 
 * may be saved many times in a batch.
 * 
 * @author PixEdit developers
 */
public class LogTools {
	
	private static final Set<String> warned = ConcurrentHashMap.newKeySet();

	// Suppress default constructor for non-instantiability
	private LogTools() {
		throw new AssertionError();
	}

	/**
	 * Log a warning, unless the same logger has already logged the same message through this method.
	 * @param logger
	 * @param message
	 * @return true if the warning was logged
	 */
	public static boolean warnOnce(Logger logger, String message) {
		if (!warned.add(logger.getName() + "\n" + message))
			return false;
		logger.warn(message);
		return true;
	}

}
