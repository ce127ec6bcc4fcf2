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

package pixedit.lib.images;

/**
 * Color modes supported by a {@link PixelBuffer}.
 * All modes store 8-bit unsigned samples; the mode determines the number of channels.
 *
 * @author PixEdit developers
 */
public enum ColorMode {

	/**
	 * Single-channel luminance
	 */
	GRAY("L", 1, false),
	/**
	 * Red, green and blue
	 */
	RGB("RGB", 3, false),
	/**
	 * Red, green, blue and alpha (not premultiplied)
	 */
	RGBA("RGBA", 4, true);

	private final String label;
	private final int nChannels;
	private final boolean hasAlpha;

	private ColorMode(String label, int nChannels, boolean hasAlpha) {
		this.label = label;
		this.nChannels = nChannels;
		this.hasAlpha = hasAlpha;
	}

	/**
	 * Total number of channels, including any alpha channel.
	 * @return
	 */
	public int nChannels() {
		return nChannels;
	}

	/**
	 * Number of channels that carry color or luminance information (i.e. excluding alpha).
	 * @return
	 */
	public int nColorChannels() {
		return hasAlpha ? nChannels - 1 : nChannels;
	}

	/**
	 * Returns true if the last channel is an alpha channel.
	 * @return
	 */
	public boolean hasAlpha() {
		return hasAlpha;
	}

	/**
	 * Index of the alpha channel, or -1 if there is none.
	 * @return
	 */
	public int getAlphaChannel() {
		return hasAlpha ? nChannels - 1 : -1;
	}

	/**
	 * Total number of bits used to store one pixel.
	 * @return
	 */
	public int getBitsPerPixel() {
		return nChannels * 8;
	}

	/**
	 * Short label, e.g. "L", "RGB" or "RGBA".
	 * @return
	 */
	public String getLabel() {
		return label;
	}

	/**
	 * Names of the individual channels, e.g. {@code ["R", "G", "B"]}.
	 * @return
	 */
	public String[] getChannelNames() {
		return switch (this) {
			case GRAY -> new String[] {"L"};
			case RGB -> new String[] {"R", "G", "B"};
			case RGBA -> new String[] {"R", "G", "B", "A"};
		};
	}

	/**
	 * Get the mode corresponding to a label (case-insensitive).
	 * @param label
	 * @return
	 * @throws IllegalArgumentException if the label is not recognized
	 */
	public static ColorMode fromLabel(String label) {
		for (var mode : values()) {
			if (mode.label.equalsIgnoreCase(label) || mode.name().equalsIgnoreCase(label))
				return mode;
		}
		throw new IllegalArgumentException("Unknown color mode: " + label);
	}

}
