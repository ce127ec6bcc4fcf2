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

package pixedit.lib.editing;

/**
 * The image that should be used to compute a histogram within an {@link EditSession}.
 */
public enum HistogramSource {
	
	/**
	 * The current image, after all committed edits.
	 */
	CURRENT,
	
	/**
	 * The image as it was originally opened.
	 */
	ORIGINAL,
	
	/**
	 * The image before the last committed edit, or the current image if there is nothing to undo.
	 */
	PREVIOUS;
	
	/**
	 * Parse a source from a String (case-insensitive).
	 * Unrecognized values give {@link #CURRENT}.
	 * @param text
	 * @return
	 */
	public static HistogramSource fromString(String text) {
		if (text != null) {
			for (var source : values()) {
				if (source.name().equalsIgnoreCase(text.strip()))
					return source;
			}
		}
		return CURRENT;
	}

}
