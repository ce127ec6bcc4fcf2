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

import java.nio.file.Path;
import java.util.Objects;

import pixedit.lib.images.PixelBuffer;

/**
 * An image read from a file, along with any metadata blobs that should be preserved when it is saved again.
 * <p>
 * EXIF and ICC data are kept as opaque bytes; they are never parsed.
 * 
 * @author PixEdit developers
 */
public final class LoadedImage {
	
	private final Path path;
	private final PixelBuffer buffer;
	private final String formatName;
	private final long fileSize;
	private final byte[] exif;
	private final byte[] icc;
	
	LoadedImage(Path path, PixelBuffer buffer, String formatName, long fileSize, byte[] exif, byte[] icc) {
		this.path = path;
		this.buffer = Objects.requireNonNull(buffer);
		this.formatName = formatName;
		this.fileSize = fileSize;
		this.exif = exif;
		this.icc = icc;
	}
	
	/**
	 * Path of the file that was read.
	 * @return
	 */
	public Path getPath() {
		return path;
	}
	
	/**
	 * The decoded pixels.
	 * @return
	 */
	public PixelBuffer getBuffer() {
		return buffer;
	}
	
	/**
	 * Upper-case name of the file format, e.g. "JPEG" or "PNG".
	 * @return
	 */
	public String getFormatName() {
		return formatName;
	}
	
	/**
	 * Size of the file in bytes.
	 * @return
	 */
	public long getFileSize() {
		return fileSize;
	}
	
	/**
	 * Raw EXIF payload (the content of the JPEG APP1 segment).
	 * @return a copy of the EXIF bytes, or null if there are none
	 */
	public byte[] getExif() {
		return exif == null ? null : exif.clone();
	}
	
	/**
	 * Embedded ICC profile data.
	 * @return a copy of the profile bytes, or null if there is no profile
	 */
	public byte[] getIccProfile() {
		return icc == null ? null : icc.clone();
	}
	
	@Override
	public String toString() {
		return "LoadedImage [" + path + ", " + buffer + ", " + formatName + "]";
	}

}
