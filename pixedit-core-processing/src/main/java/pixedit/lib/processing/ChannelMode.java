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

/**
 * Determines how neighborhood filters treat the channels of a color image.
 * 
 * @author PixEdit developers
 */
public enum ChannelMode {
	
	/**
	 * Convert to luminance, filter the single channel, then convert back to the original mode.
	 * Any alpha channel is retained.
	 */
	LUMINANCE("L"),
	
	/**
	 * Filter each color channel independently. Any alpha channel is retained.
	 */
	RGB("RGB");
	
	private final String label;
	
	private ChannelMode(String label) {
		this.label = label;
	}
	
	/**
	 * Short label, either "L" or "RGB".
	 * @return
	 */
	public String getLabel() {
		return label;
	}
	
	/**
	 * Parse a channel mode from its label or name (case-insensitive).
	 * @param text
	 * @return
	 * @throws IllegalArgumentException if the text does not match any mode
	 */
	public static ChannelMode fromString(String text) {
		for (var mode : values()) {
			if (mode.label.equalsIgnoreCase(text) || mode.name().equalsIgnoreCase(text))
				return mode;
		}
		throw new IllegalArgumentException("Unknown channel mode: " + text);
	}

}
