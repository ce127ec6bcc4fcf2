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

package pixedit.lib.images.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixedit.lib.common.GeneralTools;
import pixedit.lib.images.ColorMode;
import pixedit.lib.images.PixelBuffer;

/**
 * Create human-readable summaries of images.
 * 
 * @author PixEdit developers
 */
public final class ImageDescription {
	
	private final static Logger logger = LoggerFactory.getLogger(ImageDescription.class);
	
	// Suppress default constructor for non-instantiability
	private ImageDescription() {
		throw new AssertionError();
	}
	
	/**
	 * Describe an image that was read from a file, including the size of any EXIF data.
	 * @param image
	 * @return
	 */
	public static String describe(LoadedImage image) {
		Objects.requireNonNull(image);
		var exif = image.getExif();
		return describe(image.getBuffer(), image.getPath(), image.getFormatName(), image.getIccProfile()) + 
				System.lineSeparator() + "EXIF: " + (exif == null ? "not found" : "present (" + exif.length + " bytes)");
	}
	
	/**
	 * Describe an image, with the file format determined from the path extension.
	 * @param buffer the image
	 * @param path path to the image file (may be null)
	 * @param icc ICC profile bytes (may be null)
	 * @return a multi-line description
	 */
	public static String describe(PixelBuffer buffer, Path path, byte[] icc) {
		return describe(buffer, path, null, icc);
	}
	
	/**
	 * Describe an image.
	 * @param buffer the image
	 * @param path path to the image file (may be null)
	 * @param formatName the file format name; if null, this is determined from the path extension
	 * @param icc ICC profile bytes (may be null)
	 * @return a multi-line description
	 */
	public static String describe(PixelBuffer buffer, Path path, String formatName, byte[] icc) {
		Objects.requireNonNull(buffer);
		long fileSize = 0L;
		if (path != null && Files.isRegularFile(path)) {
			try {
				fileSize = Files.size(path);
			} catch (IOException e) {
				logger.warn("Unable to get size of {}: {}", path, e.getLocalizedMessage());
			}
		}
		String format = formatName;
		if (format == null) {
			format = path == null ? "N/A" : GeneralTools.getExtension(path.getFileName().toString())
					.map(ext -> ext.substring(1).toUpperCase(Locale.ROOT))
					.orElse("N/A");
		}
		var mode = buffer.getColorMode();
		long memory = (long)buffer.getWidth() * buffer.getHeight() * mode.getBitsPerPixel() / 8;
		
		var lines = new ArrayList<String>();
		lines.add("Path: " + (path == null ? "N/A" : path.toString()));
		lines.add("File size: " + GeneralTools.formatBytes(fileSize) + " (" + fileSize + " bytes)");
		lines.add("Dimensions: " + buffer.getWidth() + " × " + buffer.getHeight() + " pixels");
		lines.add("Format: " + format);
		lines.add("Color mode: " + mode.getLabel() + " (" + describeMode(mode) + ")");
		lines.add("Bits per pixel: " + mode.getBitsPerPixel());
		lines.add("Channels: " + String.join(",", mode.getChannelNames()));
		lines.add("Estimated memory: " + GeneralTools.formatBytes(memory));
		lines.add("Alpha channel: " + (mode.hasAlpha() ? "yes" : "no"));
		lines.add("ICC profile: " + (icc == null || icc.length == 0 ? "none" : "present (" + icc.length + " bytes)"));
		return String.join(System.lineSeparator(), lines);
	}
	
	private static String describeMode(ColorMode mode) {
		return switch (mode) {
			case GRAY -> "grayscale, 8-bit";
			case RGB -> "color";
			case RGBA -> "color with alpha";
		};
	}

}
