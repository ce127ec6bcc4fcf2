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

import java.util.List;
import java.util.Locale;

/**
 * Morphological operations supported by {@link Morphology}.
 * 
 * @author PixEdit developers
 */
public enum MorphOperation {
	
	/**
	 * Minimum filter.
	 */
	ERODE("erode", "erosion"),
	/**
	 * Maximum filter.
	 */
	DILATE("dilate", "dilation"),
	/**
	 * Erosion followed by dilation.
	 */
	OPEN("open", "opening"),
	/**
	 * Dilation followed by erosion.
	 */
	CLOSE("close", "closing"),
	/**
	 * Dilation minus erosion.
	 */
	GRADIENT("gradient"),
	/**
	 * Input minus opening.
	 */
	TOP_HAT("tophat", "top-hat"),
	/**
	 * Closing minus input.
	 */
	BLACK_HAT("blackhat", "black-hat");
	
	private final List<String> labels;
	
	private MorphOperation(String... labels) {
		this.labels = List.of(labels);
	}
	
	/**
	 * Get the primary label for the operation, e.g. "erode" or "tophat".
	 * @return
	 */
	public String getLabel() {
		return labels.get(0);
	}
	
	/**
	 * Parse an operation from its name or any recognized label (case-insensitive).
	 * @param text
	 * @return
	 * @throws IllegalArgumentException if the operation is not recognized
	 */
	public static MorphOperation fromString(String text) {
		if (text != null) {
			String lower = text.strip().toLowerCase(Locale.ROOT);
			for (var op : values()) {
				if (op.labels.contains(lower) || op.name().equalsIgnoreCase(lower))
					return op;
			}
		}
		throw new IllegalArgumentException("Unknown morphological operation: " + text);
	}

}
