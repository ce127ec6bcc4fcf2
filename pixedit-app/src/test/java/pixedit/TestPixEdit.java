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

package pixedit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonParser;

import picocli.CommandLine;
import pixedit.lib.common.Prefs;
import pixedit.lib.images.ColorMode;
import pixedit.lib.images.PixelBuffer;
import pixedit.lib.images.io.ImageIoTools;
import pixedit.lib.io.JsonPresetStore;
import pixedit.lib.processing.Kernels;
import pixedit.lib.processing.StructuringElements;

@SuppressWarnings("javadoc")
public class TestPixEdit {
	
	@TempDir
	Path tempDir;
	
	private Path previousPresetDirectory;
	
	private StringWriter out;
	private StringWriter err;
	
	@BeforeEach
	public void setUp() {
		previousPresetDirectory = Prefs.getPresetDirectory();
		Prefs.setPresetDirectory(tempDir.resolve("presets"));
	}
	
	@AfterEach
	public void tearDown() {
		Prefs.setPresetDirectory(previousPresetDirectory);
	}
	
	private int run(String... args) {
		CommandLine cmd = PixEdit.createCommandLine(new PixEdit());
		out = new StringWriter();
		err = new StringWriter();
		cmd.setOut(new PrintWriter(out));
		cmd.setErr(new PrintWriter(err));
		return cmd.execute(args);
	}
	
	private Path writeGray(String name, int value) throws IOException {
		var path = tempDir.resolve(name);
		ImageIoTools.write(path, PixelBuffer.filled(3, 2, ColorMode.GRAY, value));
		return path;
	}
	
	@Test
	public void test_info() throws IOException {
		var path = writeGray("gray.png", 100);
		assertEquals(0, run("info", path.toString()));
		var text = out.toString();
		assertTrue(text.contains("Dimensions: 3 × 2 pixels"));
		assertTrue(text.contains("Format: PNG"));
		assertTrue(text.contains("Alpha channel: no"));
		assertTrue(text.contains("EXIF: not found"));
	}
	
	@Test
	public void test_infoMissingFile() {
		assertNotEquals(0, run("info", tempDir.resolve("missing.png").toString()));
	}
	
	@Test
	public void test_histogram() throws IOException {
		var path = writeGray("gray.png", 100);
		assertEquals(0, run("histogram", path.toString()));
		var text = out.toString();
		assertTrue(text.contains("Values: 6"));
		assertTrue(text.contains("L: mean 100.00, peak 100 (6 values)"));
		
		assertEquals(0, run("histogram", "--json", path.toString()));
		var json = JsonParser.parseString(out.toString()).getAsJsonObject();
		assertEquals(1, json.size());
		var counts = json.getAsJsonArray("L");
		assertEquals(256, counts.size());
		assertEquals(6, counts.get(100).getAsInt());
		assertEquals(0, counts.get(0).getAsInt());
	}
	
	@Test
	public void test_applyInvert() throws IOException {
		var input = writeGray("gray.png", 100);
		var output = tempDir.resolve("inverted.png");
		assertEquals(0, run("apply", input.toString(), output.toString(), "--invert"));
		assertEquals(PixelBuffer.filled(3, 2, ColorMode.GRAY, 155), ImageIoTools.read(output).getBuffer());
	}
	
	@Test
	public void test_applyOrder() throws IOException {
		var input = tempDir.resolve("ramp.png");
		ImageIoTools.write(input, PixelBuffer.fromPlanes(3, 2, ColorMode.GRAY, new int[] {0, 1, 2, 3, 4, 5}));
		var output = tempDir.resolve("rotated.png");
		assertEquals(0, run("apply", input.toString(), output.toString(), "--flip-h", "--rotate", "90"));
		// Flip gives [2,1,0,5,4,3], then rotating clockwise gives a 2x3 image
		var expected = PixelBuffer.fromPlanes(2, 3, ColorMode.GRAY, new int[] {5, 2, 4, 1, 3, 0});
		assertEquals(expected, ImageIoTools.read(output).getBuffer());
	}
	
	@Test
	public void test_applyJsonOps() throws IOException {
		var input = writeGray("gray.png", 100);
		var pipeline = tempDir.resolve("pipeline.json");
		Files.writeString(pipeline, "[{\"type\": \"op.tonal.invert\"}, {\"type\": \"op.tonal.invert\"}]", StandardCharsets.UTF_8);
		var output = tempDir.resolve("output.png");
		assertEquals(0, run("apply", input.toString(), output.toString(), "--pipeline", pipeline.toString(), "--op", "{\"type\": \"op.tonal.invert\"}"));
		assertEquals(PixelBuffer.filled(3, 2, ColorMode.GRAY, 155), ImageIoTools.read(output).getBuffer());
	}
	
	@Test
	public void test_applyInvalid() throws IOException {
		var input = writeGray("gray.png", 100);
		var output = tempDir.resolve("output.png");
		assertNotEquals(0, run("apply", input.toString(), output.toString(), "--bsc", "1,1"));
		assertNotEquals(0, run("apply", input.toString(), output.toString(), "--op", "{\"type\": \"op.unknown\"}"));
		assertNotEquals(0, run("apply", input.toString(), output.toString(), "--kernel", "No such kernel"));
		assertNotEquals(0, run("apply", input.toString(), output.toString(), "--morph", "shrink"));
		assertFalse(Files.exists(output));
	}
	
	@Test
	public void test_applyFilters() throws IOException {
		var input = writeGray("gray.png", 100);
		var output = tempDir.resolve("output.png");
		var expected = PixelBuffer.filled(3, 2, ColorMode.GRAY, 100);
		assertEquals(0, run("apply", input.toString(), output.toString(), "--median", "3", "--mode", "L"));
		assertEquals(expected, ImageIoTools.read(output).getBuffer());
		assertEquals(0, run("apply", input.toString(), output.toString(), "--kernel", Kernels.BOX_BLUR));
		assertEquals(expected, ImageIoTools.read(output).getBuffer());
		assertEquals(0, run("apply", input.toString(), output.toString(), "--morph", "open", "--element", "Cross", "--iterations", "2"));
		assertEquals(expected, ImageIoTools.read(output).getBuffer());
	}
	
	@Test
	public void test_presets() throws IOException {
		assertEquals(0, run("presets", "save", "Plus", "[[0,1,0],[1,1,1],[0,1,0]]"));
		assertEquals(0, run("presets", "list"));
		var text = out.toString();
		assertTrue(text.contains(Kernels.SHARPEN + " (built-in)"));
		assertTrue(text.contains("Plus: [[0,1,0],[1,1,1],[0,1,0]]"));
		
		// Custom presets can be used when applying a kernel
		var input = writeGray("gray.png", 100);
		var output = tempDir.resolve("output.png");
		assertEquals(0, run("apply", input.toString(), output.toString(), "--kernel", "Plus"));
		assertEquals(PixelBuffer.filled(3, 2, ColorMode.GRAY, 100), ImageIoTools.read(output).getBuffer());
		
		assertEquals(0, run("presets", "rename", "Plus", "Cross kernel"));
		assertEquals(1, run("presets", "rename", "Plus", "Other"));
		assertNotEquals(0, run("presets", "save", Kernels.SHARPEN, "[[1]]"));
		
		var store = JsonPresetStore.forKernels(Kernels.getPresetNames());
		assertEquals(1, store.list().size());
		assertTrue(store.get("Cross kernel").isPresent());
		
		assertEquals(0, run("presets", "delete", "Cross kernel"));
		assertEquals(1, run("presets", "delete", "Cross kernel"));
		assertTrue(JsonPresetStore.forKernels(Kernels.getPresetNames()).list().isEmpty());
	}
	
	@Test
	public void test_elementPresets() throws IOException {
		assertEquals(0, run("presets", "--type", "element", "save", "Line", "[[1,1,1]]"));
		var store = JsonPresetStore.forStructuringElements(StructuringElements.getPresetNames());
		assertTrue(store.get("Line").isPresent());
		assertTrue(JsonPresetStore.forKernels(Kernels.getPresetNames()).list().isEmpty());
		
		var input = writeGray("gray.png", 100);
		var output = tempDir.resolve("output.png");
		assertEquals(0, run("apply", input.toString(), output.toString(), "--morph", "dilate", "--element", "Line"));
		assertEquals(PixelBuffer.filled(3, 2, ColorMode.GRAY, 100), ImageIoTools.read(output).getBuffer());
	}
	
	@Test
	public void test_noArgs() {
		assertNotEquals(0, run("apply"));
		assertNotEquals(0, run("unknown"));
	}

}
