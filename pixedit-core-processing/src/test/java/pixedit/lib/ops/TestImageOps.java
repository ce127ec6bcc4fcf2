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

package pixedit.lib.ops;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonParseException;

import pixedit.lib.images.ColorMode;
import pixedit.lib.images.PixelBuffer;
import pixedit.lib.kernels.Kernel;
import pixedit.lib.kernels.StructuringElement;
import pixedit.lib.processing.ChannelMode;
import pixedit.lib.processing.Convolution;
import pixedit.lib.processing.GeometricTransforms;
import pixedit.lib.processing.Kernels;
import pixedit.lib.processing.MorphOperation;
import pixedit.lib.processing.StructuringElements;
import pixedit.lib.processing.TonalAdjustments;

@SuppressWarnings("javadoc")
public class TestImageOps {
	
	private static PixelBuffer createRandom() {
		byte[] samples = new byte[13 * 9 * 4];
		new Random(7L).nextBytes(samples);
		return PixelBuffer.createInstance(13, 9, ColorMode.RGBA, samples);
	}
	
	private static List<ImageOp> createOps() {
		return List.of(
				ImageOps.Tonal.grayscale(),
				ImageOps.Tonal.bsc(1.2, 0.8, 1.5),
				ImageOps.Tonal.levels(20, 230, 0.7),
				ImageOps.Tonal.invert(),
				ImageOps.Tonal.lut(TonalAdjustments.levelsLut(10, 100, 1.0)),
				ImageOps.Geometry.flipH(),
				ImageOps.Geometry.flipV(),
				ImageOps.Geometry.rotate90CW(),
				ImageOps.Geometry.rotate90CCW(),
				ImageOps.Geometry.rotate180(),
				ImageOps.Geometry.rotate(33),
				ImageOps.Filters.sharpen(ChannelMode.RGB),
				ImageOps.Filters.emboss(ChannelMode.LUMINANCE),
				ImageOps.Filters.motionBlur(5, 45, ChannelMode.RGB),
				ImageOps.Filters.median(3, ChannelMode.RGB),
				ImageOps.Filters.convolve(Kernel.create(new double[][] {{0.5, 1, 0.5}}), ChannelMode.RGB, true),
				ImageOps.Morphology.apply(MorphOperation.TOP_HAT, StructuringElements.ellipse(5, 5), 2, ChannelMode.LUMINANCE),
				ImageOps.Morphology.erode(StructuringElements.cross(3, 3), 1, ChannelMode.RGB),
				ImageOps.Core.sequential(ImageOps.Tonal.invert(), ImageOps.Geometry.flipH()),
				ImageOps.Core.identity()
				);
	}
	
	@Test
	public void test_opsMatchEngines() {
		var buffer = createRandom();
		assertEquals(TonalAdjustments.bwLevels(buffer, 20, 230, 0.7), ImageOps.Tonal.levels(20, 230, 0.7).apply(buffer));
		assertEquals(GeometricTransforms.rotate(buffer, 33), ImageOps.Geometry.rotate(33).apply(buffer));
		assertEquals(Convolution.convolve(buffer, Kernels.sharpen(), ChannelMode.RGB, false), 
				ImageOps.Filters.sharpen(ChannelMode.RGB).apply(buffer));
		assertEquals(GeometricTransforms.rotate90CCW(buffer), ImageOps.Geometry.rotate90CCW().apply(buffer));
		assertEquals(buffer, ImageOps.Core.identity().apply(buffer));
	}
	
	@Test
	public void test_jsonRoundTrip() {
		var buffer = createRandom();
		for (var op : createOps()) {
			var json = ImageOps.toJson(op, false);
			var op2 = ImageOps.fromJson(json);
			assertEquals(op.getClass(), op2.getClass(), json);
			assertEquals(op.apply(buffer), op2.apply(buffer), json);
			assertEquals(json, ImageOps.toJson(op2, false));
		}
	}
	
	@Test
	public void test_labels() {
		assertEquals("op.tonal.levels", ImageOps.getLabel(ImageOps.Tonal.levels(0, 255, 1)));
		assertEquals("op.filters.convolve", ImageOps.getLabel(ImageOps.Filters.sharpen(ChannelMode.RGB)));
		assertEquals("op.morphology.apply", ImageOps.getLabel(ImageOps.Morphology.dilate(StructuringElements.square(3, 3), 1, ChannelMode.RGB)));
		assertEquals("op.core.sequential", ImageOps.getLabel(ImageOps.Core.identity()));
		
		var json = ImageOps.toJson(ImageOps.Tonal.invert(), false);
		assertTrue(json.contains("\"type\":\"op.tonal.invert\""), json);
	}
	
	@Test
	public void test_readJson() {
		var op = ImageOps.fromJson("{\"type\": \"op.filters.convolve\", \"kernel\": [[0, -1, 0], [-1, 5, -1], [0, -1, 0]], \"mode\": \"RGB\", \"normalize\": false}");
		var buffer = createRandom();
		assertEquals(ImageOps.Filters.sharpen(ChannelMode.RGB).apply(buffer), op.apply(buffer));
		
		assertThrows(JsonParseException.class, () -> ImageOps.fromJson("{\"type\": \"op.tonal.unknown\"}"));
		assertThrows(JsonParseException.class, () -> ImageOps.fromJson("{\"black\": 10}"));
		assertThrows(JsonParseException.class, () -> ImageOps.fromJson("null"));
	}
	
	@Test
	public void test_warnings() {
		var zero = ImageOps.Filters.convolve(Kernel.create(new double[3][3]), ChannelMode.RGB, true);
		assertEquals(1, zero.getWarnings().size());
		assertTrue(ImageOps.Filters.sharpen(ChannelMode.RGB).getWarnings().isEmpty());
		
		var emptyElement = ImageOps.Morphology.erode(StructuringElement.create(new int[3][3]), 1, ChannelMode.RGB);
		assertEquals(1, emptyElement.getWarnings().size());
		
		var sequential = ImageOps.Core.sequential(zero, ImageOps.Tonal.invert(), emptyElement);
		assertEquals(2, sequential.getWarnings().size());
		assertTrue(ImageOps.Tonal.grayscale().getWarnings().isEmpty());
	}
	
	@Test
	public void test_sequentialOrder() {
		var buffer = createRandom();
		var op = ImageOps.Core.sequential(ImageOps.Geometry.rotate90CW(), ImageOps.Tonal.grayscale());
		assertEquals(TonalAdjustments.toGrayscale(GeometricTransforms.rotate90CW(buffer)), op.apply(buffer));
		// A single op is returned directly
		var invert = ImageOps.Tonal.invert();
		assertEquals(invert, ImageOps.Core.sequential(invert));
	}
	
	@Test
	public void test_invalidParameters() {
		assertThrows(IllegalArgumentException.class, () -> ImageOps.Tonal.lut(new int[10]));
		assertThrows(IllegalArgumentException.class, () -> ImageOps.Geometry.rotate(Double.NaN));
		assertThrows(IllegalArgumentException.class, () -> ImageOps.Morphology.apply("thin", StructuringElements.square(3, 3), 1, ChannelMode.RGB));
		assertThrows(NullPointerException.class, () -> ImageOps.Filters.convolve(null, ChannelMode.RGB, true));
	}

}
