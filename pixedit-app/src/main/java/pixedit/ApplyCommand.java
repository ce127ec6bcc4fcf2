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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import pixedit.lib.editing.EditSession;
import pixedit.lib.images.io.ImageIoTools;
import pixedit.lib.io.GsonTools;
import pixedit.lib.io.JsonPresetStore;
import pixedit.lib.kernels.Kernel;
import pixedit.lib.kernels.StructuringElement;
import pixedit.lib.ops.ImageOp;
import pixedit.lib.ops.ImageOps;
import pixedit.lib.processing.ChannelMode;
import pixedit.lib.processing.Kernels;
import pixedit.lib.processing.MorphOperation;
import pixedit.lib.processing.StructuringElements;

/**
 * Apply one or more operations to an image and save the result.
 * <p>
 * Ops given as JSON (with --pipeline or --op) are applied first, in the order given. 
 * Other options are then applied in the order they are listed in the help text.
 */
@Command(name = "apply", description = {
		"Apply operations to an image and save the result.",
		"EXIF and ICC data are kept when writing JPEG files, unless --strip-metadata is used."})
class ApplyCommand implements Callable<Integer> {
	
	private final static Logger logger = LoggerFactory.getLogger(ApplyCommand.class);
	
	@Spec
	private CommandSpec spec;
	
	@Parameters(index = "0", description = "Path to the input image.", paramLabel = "input")
	private Path input;
	
	@Parameters(index = "1", description = "Path to the output image; the format is determined by the extension.", paramLabel = "output")
	private Path output;
	
	@Option(names = {"-p", "--pipeline"}, description = "JSON file containing an op, or an array of ops.", paramLabel = "file")
	private Path pipeline;
	
	@Option(names = {"--op"}, description = "Op as a JSON string. Can be used multiple times.", paramLabel = "json")
	private List<String> opsJson = new ArrayList<>();
	
	@Option(names = {"--grayscale"}, description = "Convert to grayscale.")
	private boolean grayscale;
	
	@Option(names = {"--bsc"}, split = ",", description = "Brightness, saturation and contrast factors (1 = unchanged).", 
			paramLabel = "b,s,c")
	private double[] bsc;
	
	@Option(names = {"--levels"}, split = ",", description = "Black point, white point and gamma; the output is grayscale.", 
			paramLabel = "black,white,gamma")
	private double[] levels;
	
	@Option(names = {"--invert"}, description = "Invert the color channels.")
	private boolean invert;
	
	@Option(names = {"--flip-h"}, description = "Flip horizontally.")
	private boolean flipH;
	
	@Option(names = {"--flip-v"}, description = "Flip vertically.")
	private boolean flipV;
	
	@Option(names = {"--rotate"}, description = "Rotate clockwise by the specified angle in degrees.", paramLabel = "degrees")
	private Double rotate;
	
	@Option(names = {"--kernel"}, description = {"Filter with a kernel.", 
			"This can be the name of a built-in or custom preset, or a JSON array, e.g. [[0,-1,0],[-1,5,-1],[0,-1,0]]."}, 
			paramLabel = "kernel")
	private String kernel;
	
	@Option(names = {"--kernel-size"}, split = ",", description = "Rows and columns for a kernel preset (default = 3,3).", 
			paramLabel = "rows,cols")
	private int[] kernelSize = {3, 3};
	
	@Option(names = {"--normalize"}, negatable = true, defaultValue = "true", fallbackValue = "true",
			description = "Divide the kernel by its sum, if this is not zero (default = true).")
	private boolean normalize = true;
	
	@Option(names = {"--sharpen"}, description = "Sharpen with a 3x3 kernel.")
	private boolean sharpen;
	
	@Option(names = {"--emboss"}, description = "Emboss with a 3x3 kernel.")
	private boolean emboss;
	
	@Option(names = {"--motion"}, split = ",", description = "Motion blur with the specified length and angle.", 
			paramLabel = "length,degrees")
	private double[] motion;
	
	@Option(names = {"--median"}, description = "Median filter with the specified window size.", paramLabel = "size")
	private Integer median;
	
	@Option(names = {"--morph"}, description = "Morphological operation (erode, dilate, open, close, gradient, tophat, blackhat).", 
			paramLabel = "operation")
	private MorphOperation morph;
	
	@Option(names = {"--element"}, description = {"Structuring element for morphology (default = Square).", 
			"This can be the name of a built-in or custom preset, or a JSON array of 0 and 1 values."}, 
			paramLabel = "element")
	private String element = StructuringElements.SQUARE;
	
	@Option(names = {"--element-size"}, split = ",", description = "Rows and columns for a structuring element preset (default = 3,3).", 
			paramLabel = "rows,cols")
	private int[] elementSize = {3, 3};
	
	@Option(names = {"--iterations"}, description = "Iterations for morphology (default = 1).", paramLabel = "n")
	private int iterations = 1;
	
	@Option(names = {"-m", "--mode"}, description = "Channel mode for filters and morphology: L or RGB (default = RGB).", paramLabel = "mode")
	private ChannelMode mode = ChannelMode.RGB;
	
	@Option(names = {"--strip-metadata"}, description = "Do not write EXIF or ICC data.")
	private boolean stripMetadata;

	@Override
	public Integer call() throws Exception {
		var ops = buildOps();
		if (ops.isEmpty())
			logger.warn("No operations specified, image will be written unchanged");
		
		var image = ImageIoTools.read(input);
		var session = new EditSession();
		session.open(image.getBuffer());
		for (var op : ops) {
			logger.info("Applying {}", op);
			session.commit(op);
			for (var warning : session.getLastWarnings())
				logger.warn(warning);
		}
		
		byte[] exif = stripMetadata ? null : image.getExif();
		byte[] icc = stripMetadata ? null : image.getIccProfile();
		var format = ImageIoTools.write(output, session.getCurrent(), exif, icc);
		logger.info("Written {} ({}) to {}", session.getCurrent(), format, output);
		spec.commandLine().getOut().println(output);
		return 0;
	}
	
	List<ImageOp> buildOps() throws IOException {
		var ops = new ArrayList<ImageOp>();
		try {
			if (pipeline != null)
				ops.addAll(readOps(Files.readString(pipeline, StandardCharsets.UTF_8)));
			for (var json : opsJson)
				ops.addAll(readOps(json));
		} catch (JsonParseException e) {
			throw new ParameterException(spec.commandLine(), "Unable to parse op: " + e.getLocalizedMessage(), e);
		}
		
		if (grayscale)
			ops.add(ImageOps.Tonal.grayscale());
		if (bsc != null) {
			checkLength("--bsc", bsc, 3);
			ops.add(ImageOps.Tonal.bsc(bsc[0], bsc[1], bsc[2]));
		}
		if (levels != null) {
			checkLength("--levels", levels, 3);
			ops.add(ImageOps.Tonal.levels((int)Math.round(levels[0]), (int)Math.round(levels[1]), levels[2]));
		}
		if (invert)
			ops.add(ImageOps.Tonal.invert());
		if (flipH)
			ops.add(ImageOps.Geometry.flipH());
		if (flipV)
			ops.add(ImageOps.Geometry.flipV());
		if (rotate != null) {
			if (!Double.isFinite(rotate))
				throw new ParameterException(spec.commandLine(), "Rotation angle must be finite");
			ops.add(ImageOps.Geometry.rotate(rotate));
		}
		if (kernel != null)
			ops.add(ImageOps.Filters.convolve(resolveKernel(kernel), mode, normalize));
		if (sharpen)
			ops.add(ImageOps.Filters.sharpen(mode));
		if (emboss)
			ops.add(ImageOps.Filters.emboss(mode));
		if (motion != null) {
			checkLength("--motion", motion, 2);
			ops.add(ImageOps.Filters.motionBlur((int)Math.round(motion[0]), motion[1], mode));
		}
		if (median != null)
			ops.add(ImageOps.Filters.median(median, mode));
		if (morph != null)
			ops.add(ImageOps.Morphology.apply(morph, resolveElement(element), iterations, mode));
		return ops;
	}
	
	private void checkLength(String name, double[] values, int n) {
		if (values.length != n)
			throw new ParameterException(spec.commandLine(), name + " requires " + n + " comma-separated values, but got " + values.length);
	}
	
	private static List<ImageOp> readOps(String json) {
		var element = GsonTools.getInstance().fromJson(json, JsonElement.class);
		if (element == null)
			throw new JsonParseException("No JSON found");
		var ops = new ArrayList<ImageOp>();
		if (element.isJsonArray()) {
			for (var item : element.getAsJsonArray())
				ops.add(ImageOps.fromJson(item.toString()));
		} else
			ops.add(ImageOps.fromJson(element.toString()));
		return ops;
	}
	
	private Kernel resolveKernel(String text) {
		int rows = kernelSize.length > 0 ? kernelSize[0] : 3;
		int cols = kernelSize.length > 1 ? kernelSize[1] : rows;
		if (text.strip().startsWith("[")) {
			try {
				return GsonTools.getInstance().fromJson(text, Kernel.class);
			} catch (JsonParseException e) {
				throw new ParameterException(spec.commandLine(), "Invalid kernel: " + e.getLocalizedMessage(), e);
			}
		}
		var builtIn = Kernels.preset(text, rows, cols);
		if (builtIn.isPresent())
			return builtIn.get();
		var store = JsonPresetStore.forKernels(Kernels.getPresetNames());
		return store.get(text)
				.orElseThrow(() -> new ParameterException(spec.commandLine(), "Unknown kernel preset: " + text));
	}
	
	private StructuringElement resolveElement(String text) {
		int rows = elementSize.length > 0 ? elementSize[0] : 3;
		int cols = elementSize.length > 1 ? elementSize[1] : rows;
		if (text.strip().startsWith("[")) {
			try {
				return GsonTools.getInstance().fromJson(text, StructuringElement.class);
			} catch (JsonParseException e) {
				throw new ParameterException(spec.commandLine(), "Invalid structuring element: " + e.getLocalizedMessage(), e);
			}
		}
		var builtIn = StructuringElements.preset(text, rows, cols);
		if (builtIn.isPresent())
			return builtIn.get();
		var store = JsonPresetStore.forStructuringElements(StructuringElements.getPresetNames());
		return store.get(text)
				.orElseThrow(() -> new ParameterException(spec.commandLine(), "Unknown structuring element preset: " + text));
	}

}
