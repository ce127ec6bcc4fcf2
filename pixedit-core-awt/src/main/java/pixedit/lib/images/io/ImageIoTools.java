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

import java.awt.color.ColorSpace;
import java.awt.color.ICC_ColorSpace;
import java.awt.color.ICC_Profile;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Node;

import pixedit.lib.awt.common.BufferedImageTools;
import pixedit.lib.common.GeneralTools;
import pixedit.lib.common.LogTools;
import pixedit.lib.images.ColorMode;
import pixedit.lib.images.PixelBuffer;

/**
 * Read and write images using Java's ImageIO, keeping EXIF and ICC data where the format allows.
 * <p>
 * EXIF is read from and written to the APP1 segment of JPEG files. 
 * ICC profiles are read from JPEG APP2 segments, or from the color space of other images, 
 * and are written to JPEG files only.
 * 
 * @author PixEdit developers
 */
public final class ImageIoTools {
	
	private final static Logger logger = LoggerFactory.getLogger(ImageIoTools.class);
	
	private static final String JPEG_METADATA_FORMAT = "javax_imageio_jpeg_image_1.0";
	
	private static final int APP1_MARKER = 0xE1;
	
	// Suppress default constructor for non-instantiability
	private ImageIoTools() {
		throw new AssertionError();
	}
	
	/**
	 * Read the first image from a file.
	 * @param path
	 * @return
	 * @throws IOException if the file cannot be read, or no reader supports it
	 */
	public static LoadedImage read(Path path) throws IOException {
		Objects.requireNonNull(path);
		long fileSize = Files.size(path);
		try (var stream = ImageIO.createImageInputStream(path.toFile())) {
			if (stream == null)
				throw new IOException("Unable to open " + path);
			var readers = ImageIO.getImageReaders(stream);
			if (!readers.hasNext())
				throw new IOException("No ImageIO reader found for " + path);
			ImageReader reader = readers.next();
			try {
				reader.setInput(stream, true, false);
				BufferedImage img = reader.read(0);
				IIOMetadata metadata = null;
				try {
					metadata = reader.getImageMetadata(0);
				} catch (IOException e) {
					logger.warn("Unable to read metadata from {}: {}", path, e.getLocalizedMessage());
					logger.debug(e.getLocalizedMessage(), e);
				}
				String format = reader.getFormatName().toUpperCase(Locale.ROOT);
				byte[] exif = readExif(metadata);
				byte[] icc = readIcc(metadata, img);
				var buffer = BufferedImageTools.fromBufferedImage(img);
				logger.debug("Read {} ({}, EXIF {} bytes, ICC {} bytes)", path, buffer, 
						exif == null ? 0 : exif.length, icc == null ? 0 : icc.length);
				return new LoadedImage(path, buffer, format, fileSize, exif, icc);
			} finally {
				reader.dispose();
			}
		}
	}
	
	/**
	 * Write an image, choosing the format from the file extension.
	 * @param path
	 * @param buffer
	 * @return the format name that was used
	 * @throws IOException
	 * @see #write(Path, PixelBuffer, byte[], byte[])
	 */
	public static String write(Path path, PixelBuffer buffer) throws IOException {
		return write(path, buffer, null, null);
	}
	
	/**
	 * Write an image, choosing the format from the file extension.
	 * <p>
	 * JPEG files cannot store alpha, so any alpha channel is dropped. 
	 * The EXIF and ICC data are included for JPEG files, and ignored for other formats.
	 * 
	 * @param path the output file
	 * @param buffer the image to write
	 * @param exif EXIF bytes to write (may be null)
	 * @param icc ICC profile bytes to write (may be null)
	 * @return the format name that was used
	 * @throws IOException if the extension is not supported, or writing fails
	 */
	public static String write(Path path, PixelBuffer buffer, byte[] exif, byte[] icc) throws IOException {
		Objects.requireNonNull(path);
		Objects.requireNonNull(buffer);
		String ext = GeneralTools.getExtension(path.getFileName().toString())
				.orElseThrow(() -> new IOException("No file extension found for " + path));
		String suffix = ext.substring(1);
		var writers = ImageIO.getImageWritersBySuffix(suffix);
		if (!writers.hasNext())
			throw new IOException("No ImageIO writer found for extension " + ext);
		ImageWriter writer = writers.next();
		try {
			boolean isJpeg = isJpeg(writer);
			var output = buffer;
			if (isJpeg && output.getColorMode().hasAlpha()) {
				logger.debug("Dropping alpha channel to write JPEG");
				output = output.convert(ColorMode.RGB);
			}
			BufferedImage img = BufferedImageTools.toBufferedImage(output);
			var provider = writer.getOriginatingProvider();
			if (provider != null && !provider.canEncodeImage(img) && output.getColorMode().hasAlpha()) {
				LogTools.warnOnce(logger, suffix + " writer cannot encode alpha, images will be written as RGB");
				output = output.convert(ColorMode.RGB);
				img = BufferedImageTools.toBufferedImage(output);
			}
			if (provider != null && !provider.canEncodeImage(img))
				throw new IOException("Unable to write " + output.getColorMode() + " image with extension " + ext);
			
			var param = writer.getDefaultWriteParam();
			IIOMetadata metadata = null;
			if (isJpeg && (exif != null || icc != null)) {
				metadata = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(img), param);
				addJpegMetadata(metadata, exif, icc);
			} else if (exif != null || icc != null) {
				logger.debug("EXIF and ICC data are not written for {} files", suffix);
			}
			
			Files.deleteIfExists(path);
			try (var stream = ImageIO.createImageOutputStream(path.toFile())) {
				if (stream == null)
					throw new IOException("Unable to create output stream for " + path);
				writer.setOutput(stream);
				writer.write(null, new IIOImage(img, null, metadata), param);
			}
			String format = writer.getOriginatingProvider() == null ? suffix : writer.getOriginatingProvider().getFormatNames()[0];
			logger.debug("Written {} to {}", buffer, path);
			return format.toUpperCase(Locale.ROOT);
		} finally {
			writer.dispose();
		}
	}
	
	private static boolean isJpeg(ImageWriter writer) {
		var provider = writer.getOriginatingProvider();
		if (provider == null)
			return false;
		for (var name : provider.getFormatNames()) {
			if ("jpeg".equalsIgnoreCase(name) || "jpg".equalsIgnoreCase(name))
				return true;
		}
		return false;
	}
	
	private static boolean isJpegMetadata(IIOMetadata metadata) {
		return metadata != null && JPEG_METADATA_FORMAT.equals(metadata.getNativeMetadataFormatName());
	}
	
	/**
	 * Extract the payload of the first APP1 segment of a JPEG image.
	 */
	private static byte[] readExif(IIOMetadata metadata) {
		if (!isJpegMetadata(metadata))
			return null;
		var root = metadata.getAsTree(JPEG_METADATA_FORMAT);
		var markers = findChild(root, "markerSequence");
		if (markers == null)
			return null;
		for (var node = markers.getFirstChild(); node != null; node = node.getNextSibling()) {
			if (!"unknown".equals(node.getNodeName()) || !(node instanceof IIOMetadataNode))
				continue;
			var tag = ((IIOMetadataNode)node).getAttribute("MarkerTag");
			if (Integer.toString(APP1_MARKER).equals(tag)) {
				var data = ((IIOMetadataNode)node).getUserObject();
				if (data instanceof byte[])
					return ((byte[])data).clone();
			}
		}
		return null;
	}
	
	/**
	 * Get an embedded ICC profile, either from JPEG metadata or from the color space of the image 
	 * (if this is not sRGB).
	 */
	private static byte[] readIcc(IIOMetadata metadata, BufferedImage img) {
		if (isJpegMetadata(metadata)) {
			var root = metadata.getAsTree(JPEG_METADATA_FORMAT);
			var variety = findChild(root, "JPEGvariety");
			var jfif = variety == null ? null : findChild(variety, "app0JFIF");
			var app2 = jfif == null ? null : findChild(jfif, "app2ICC");
			if (app2 instanceof IIOMetadataNode) {
				var profile = ((IIOMetadataNode)app2).getUserObject();
				if (profile instanceof ICC_Profile)
					return ((ICC_Profile)profile).getData();
			}
		}
		var colorSpace = img.getColorModel().getColorSpace();
		if (colorSpace instanceof ICC_ColorSpace && !colorSpace.isCS_sRGB() && colorSpace.getType() != ColorSpace.TYPE_GRAY)
			return ((ICC_ColorSpace)colorSpace).getProfile().getData();
		return null;
	}
	
	private static void addJpegMetadata(IIOMetadata metadata, byte[] exif, byte[] icc) throws IOException {
		var root = (IIOMetadataNode)metadata.getAsTree(JPEG_METADATA_FORMAT);
		if (icc != null) {
			var variety = findChild(root, "JPEGvariety");
			var jfif = variety == null ? null : findChild(variety, "app0JFIF");
			if (jfif == null) {
				logger.warn("Unable to write ICC profile - no JFIF segment available");
			} else {
				try {
					var node = new IIOMetadataNode("app2ICC");
					node.setUserObject(ICC_Profile.getInstance(icc));
					jfif.appendChild(node);
				} catch (IllegalArgumentException e) {
					logger.warn("Invalid ICC profile will not be written: {}", e.getLocalizedMessage());
				}
			}
		}
		if (exif != null) {
			var markers = findChild(root, "markerSequence");
			if (markers == null) {
				markers = new IIOMetadataNode("markerSequence");
				root.appendChild(markers);
			}
			var node = new IIOMetadataNode("unknown");
			node.setAttribute("MarkerTag", Integer.toString(APP1_MARKER));
			node.setUserObject(exif.clone());
			markers.insertBefore(node, markers.getFirstChild());
		}
		metadata.setFromTree(JPEG_METADATA_FORMAT, root);
	}
	
	private static Node findChild(Node parent, String name) {
		for (var node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
			if (name.equals(node.getNodeName()))
				return node;
		}
		return null;
	}

}
