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

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonParseException;

import pixedit.lib.images.PixelBuffer;
import pixedit.lib.io.GsonTools;
import pixedit.lib.io.GsonTools.SubTypeAdapterFactory;
import pixedit.lib.kernels.Kernel;
import pixedit.lib.kernels.StructuringElement;
import pixedit.lib.processing.ChannelMode;
import pixedit.lib.processing.Convolution;
import pixedit.lib.processing.GeometricTransforms;
import pixedit.lib.processing.Kernels;
import pixedit.lib.processing.LevelsParams;
import pixedit.lib.processing.MedianFilter;
import pixedit.lib.processing.MorphOperation;
import pixedit.lib.processing.TonalAdjustments;

/**
 * Create and use {@link ImageOp} objects.
 * <p>
 * All ops created here are registered with {@link GsonTools#getDefaultBuilder()}, using a "type" field 
 * with labels such as {@code "op.tonal.levels"} or {@code "op.filters.convolve"}.
 * 
 * @author PixEdit developers
 */
public class ImageOps {
	
	@Target(ElementType.TYPE)
	@Retention(RetentionPolicy.RUNTIME)
	private @interface OpType {
		String value();
	}
	
	@SuppressWarnings("unchecked")
	private static <T> void registerTypes(SubTypeAdapterFactory<T> factory, Class<T> factoryType, Class<?> cls, String base) {
		var annotation = cls.getAnnotation(OpType.class);
		if (annotation != null) {
			base = base + "." + annotation.value();
			if (factoryType.isAssignableFrom(cls)) {
				factory.registerSubtype((Class<? extends T>)cls, base);
			}
		}
		for (var c : cls.getDeclaredClasses()) {
			registerTypes(factory, factoryType, c, base);
		}
	}
	
	private static final SubTypeAdapterFactory<ImageOp> factoryOps = GsonTools.createSubTypeAdapterFactory(ImageOp.class, "type");

	static {
		registerTypes(factoryOps, ImageOp.class, ImageOps.class, "op");
		GsonTools.getDefaultBuilder().registerTypeAdapterFactory(factoryOps);
	}
	
	// Suppress default constructor for non-instantiability
	private ImageOps() {
		throw new AssertionError();
	}
	
	/**
	 * Get the JSON type label for an op class.
	 * @param op
	 * @return the label, or null if the op class was not created by this class
	 */
	public static String getLabel(ImageOp op) {
		return factoryOps.getLabel(op.getClass());
	}
	
	/**
	 * Serialize an op to JSON.
	 * @param op
	 * @param pretty
	 * @return
	 */
	public static String toJson(ImageOp op, boolean pretty) {
		return GsonTools.getInstance(pretty).toJson(op, ImageOp.class);
	}
	
	/**
	 * Deserialize an op from JSON.
	 * @param json
	 * @return
	 * @throws JsonParseException if the JSON does not describe a known op
	 */
	public static ImageOp fromJson(String json) {
		var op = GsonTools.getInstance().fromJson(json, ImageOp.class);
		if (op == null)
			throw new JsonParseException("No op found in JSON");
		return op;
	}
	
	
	/**
	 * Tonal adjustments.
	 */
	@OpType("tonal")
	public static class Tonal {
		
		/**
		 * Convert to grayscale.
		 * @return
		 * @see TonalAdjustments#toGrayscale(PixelBuffer)
		 */
		public static ImageOp grayscale() {
			return new GrayscaleOp();
		}
		
		/**
		 * Adjust brightness, saturation and contrast.
		 * @param brightness
		 * @param saturation
		 * @param contrast
		 * @return
		 * @see TonalAdjustments#adjustBSC(PixelBuffer, double, double, double)
		 */
		public static ImageOp bsc(double brightness, double saturation, double contrast) {
			return new BSCOp(brightness, saturation, contrast);
		}
		
		/**
		 * Apply levels, converting to grayscale if necessary.
		 * @param black
		 * @param white
		 * @param gamma
		 * @return
		 * @see TonalAdjustments#bwLevels(PixelBuffer, int, int, double)
		 */
		public static ImageOp levels(int black, int white, double gamma) {
			return new LevelsOp(black, white, gamma);
		}
		
		/**
		 * Invert color channels.
		 * @return
		 */
		public static ImageOp invert() {
			return new InvertOp();
		}
		
		/**
		 * Apply a 256-entry lookup table to the color channels.
		 * @param lut
		 * @return
		 */
		public static ImageOp lut(int... lut) {
			if (lut.length != 256)
				throw new IllegalArgumentException("Lookup table must have 256 entries, but has " + lut.length);
			return new LutOp(lut);
		}
		
		@OpType("grayscale")
		static class GrayscaleOp implements ImageOp {

			@Override
			public PixelBuffer apply(PixelBuffer input) {
				return TonalAdjustments.toGrayscale(input);
			}
			
			@Override
			public String toString() {
				return "Grayscale";
			}
			
		}
		
		@OpType("bsc")
		static class BSCOp implements ImageOp {
			
			private double brightness;
			private double saturation;
			private double contrast;
			
			BSCOp(double brightness, double saturation, double contrast) {
				this.brightness = brightness;
				this.saturation = saturation;
				this.contrast = contrast;
			}

			@Override
			public PixelBuffer apply(PixelBuffer input) {
				return TonalAdjustments.adjustBSC(input, brightness, saturation, contrast);
			}
			
			@Override
			public String toString() {
				return String.format("Brightness/saturation/contrast (%s, %s, %s)", brightness, saturation, contrast);
			}
			
		}
		
		@OpType("levels")
		static class LevelsOp implements ImageOp {
			
			private int black;
			private int white;
			private double gamma;
			
			LevelsOp(int black, int white, double gamma) {
				this.black = black;
				this.white = white;
				this.gamma = gamma;
			}

			@Override
			public PixelBuffer apply(PixelBuffer input) {
				return TonalAdjustments.bwLevels(input, LevelsParams.of(black, white, gamma));
			}
			
			@Override
			public String toString() {
				return String.format("Levels (%d, %d, %s)", black, white, gamma);
			}
			
		}
		
		@OpType("invert")
		static class InvertOp implements ImageOp {

			@Override
			public PixelBuffer apply(PixelBuffer input) {
				return TonalAdjustments.invert(input);
			}
			
			@Override
			public String toString() {
				return "Invert";
			}
			
		}
		
		@OpType("lut")
		static class LutOp implements ImageOp {
			
			private int[] lut;
			
			LutOp(int[] lut) {
				this.lut = lut.clone();
			}

			@Override
			public PixelBuffer apply(PixelBuffer input) {
				return TonalAdjustments.applyLut(input, lut);
			}
			
			@Override
			public String toString() {
				return "Lookup table";
			}
			
		}
		
	}
	
	
	/**
	 * Flips and rotations.
	 */
	@OpType("geometry")
	public static class Geometry {
		
		/**
		 * Flip horizontally.
		 * @return
		 */
		public static ImageOp flipH() {
			return new FlipOp(true);
		}
		
		/**
		 * Flip vertically.
		 * @return
		 */
		public static ImageOp flipV() {
			return new FlipOp(false);
		}
		
		/**
		 * Rotate 90 degrees clockwise.
		 * @return
		 */
		public static ImageOp rotate90CW() {
			return new RotateOp(90);
		}
		
		/**
		 * Rotate 90 degrees counter-clockwise.
		 * @return
		 */
		public static ImageOp rotate90CCW() {
			return new RotateOp(-90);
		}
		
		/**
		 * Rotate 180 degrees.
		 * @return
		 */
		public static ImageOp rotate180() {
			return new RotateOp(180);
		}
		
		/**
		 * Rotate clockwise by an arbitrary angle, expanding the canvas.
		 * @param angleDegrees
		 * @return
		 * @see GeometricTransforms#rotate(PixelBuffer, double)
		 */
		public static ImageOp rotate(double angleDegrees) {
			if (!Double.isFinite(angleDegrees))
				throw new IllegalArgumentException("Rotation angle must be finite, but was " + angleDegrees);
			return new RotateOp(angleDegrees);
		}
		
		@OpType("flip")
		static class FlipOp implements ImageOp {
			
			private boolean horizontal;
			
			FlipOp(boolean horizontal) {
				this.horizontal = horizontal;
			}

			@Override
			public PixelBuffer apply(PixelBuffer input) {
				return horizontal ? GeometricTransforms.flipH(input) : GeometricTransforms.flipV(input);
			}
			
			@Override
			public String toString() {
				return horizontal ? "Flip horizontal" : "Flip vertical";
			}
			
		}
		
		@OpType("rotate")
		static class RotateOp implements ImageOp {
			
			private double angle;
			
			RotateOp(double angle) {
				this.angle = angle;
			}

			@Override
			public PixelBuffer apply(PixelBuffer input) {
				return GeometricTransforms.rotate(input, angle);
			}
			
			@Override
			public String toString() {
				return "Rotate " + angle + "°";
			}
			
		}
		
	}
	
	
	/**
	 * Neighborhood filters.
	 */
	@OpType("filters")
	public static class Filters {
		
		/**
		 * Filter with an arbitrary kernel.
		 * @param kernel
		 * @param mode
		 * @param normalize
		 * @return
		 * @see Convolution#convolve(PixelBuffer, Kernel, ChannelMode, boolean)
		 */
		public static ImageOp convolve(Kernel kernel, ChannelMode mode, boolean normalize) {
			Objects.requireNonNull(kernel);
			Objects.requireNonNull(mode);
			return new ConvolveOp(kernel, mode, normalize);
		}
		
		/**
		 * Sharpen with a 3x3 kernel (not normalized).
		 * @param mode
		 * @return
		 * @see Kernels#sharpen()
		 */
		public static ImageOp sharpen(ChannelMode mode) {
			return convolve(Kernels.sharpen(), mode, false);
		}
		
		/**
		 * Emboss with a 3x3 kernel (not normalized).
		 * @param mode
		 * @return
		 * @see Kernels#emboss()
		 */
		public static ImageOp emboss(ChannelMode mode) {
			return convolve(Kernels.emboss(), mode, false);
		}
		
		/**
		 * Blur along a straight line.
		 * @param length
		 * @param angleDegrees
		 * @param mode
		 * @return
		 * @see Kernels#motion(int, double)
		 */
		public static ImageOp motionBlur(int length, double angleDegrees, ChannelMode mode) {
			return convolve(Kernels.motion(length, angleDegrees), mode, true);
		}
		
		/**
		 * Median filter.
		 * @param windowSize
		 * @param mode
		 * @return
		 * @see MedianFilter#medianFilter(PixelBuffer, int, ChannelMode)
		 */
		public static ImageOp median(int windowSize, ChannelMode mode) {
			Objects.requireNonNull(mode);
			return new MedianOp(windowSize, mode);
		}
		
		@OpType("convolve")
		static class ConvolveOp implements ImageOp {
			
			private Kernel kernel;
			private ChannelMode mode;
			private boolean normalize;
			
			ConvolveOp(Kernel kernel, ChannelMode mode, boolean normalize) {
				this.kernel = kernel;
				this.mode = mode;
				this.normalize = normalize;
			}

			@Override
			public PixelBuffer apply(PixelBuffer input) {
				return Convolution.convolve(input, kernel, mode, normalize);
			}
			
			@Override
			public List<String> getWarnings() {
				if (kernel.isZero())
					return List.of("Kernel contains only zeros, the center value was set to 1");
				return List.of();
			}
			
			@Override
			public String toString() {
				return "Convolve " + kernel.getRows() + "x" + kernel.getCols() + " (" + mode + (normalize ? ", normalized)" : ")");
			}
			
		}
		
		@OpType("median")
		static class MedianOp implements ImageOp {
			
			private int size;
			private ChannelMode mode;
			
			MedianOp(int size, ChannelMode mode) {
				this.size = size;
				this.mode = mode;
			}

			@Override
			public PixelBuffer apply(PixelBuffer input) {
				return MedianFilter.medianFilter(input, size, mode);
			}
			
			@Override
			public String toString() {
				return "Median " + size + "x" + size + " (" + mode + ")";
			}
			
		}
		
	}
	
	
	/**
	 * Morphological operations.
	 */
	@OpType("morphology")
	public static class Morphology {
		
		/**
		 * Apply a morphological operation.
		 * @param operation
		 * @param element
		 * @param iterations
		 * @param mode
		 * @return
		 * @see pixedit.lib.processing.Morphology#apply(PixelBuffer, MorphOperation, StructuringElement, int, ChannelMode)
		 */
		public static ImageOp apply(MorphOperation operation, StructuringElement element, int iterations, ChannelMode mode) {
			Objects.requireNonNull(operation);
			Objects.requireNonNull(element);
			Objects.requireNonNull(mode);
			return new MorphOp(operation, element, iterations, mode);
		}
		
		/**
		 * Apply a morphological operation, parsing the operation name.
		 * @param operation
		 * @param element
		 * @param iterations
		 * @param mode
		 * @return
		 * @throws IllegalArgumentException if the operation is not recognized
		 * @see MorphOperation#fromString(String)
		 */
		public static ImageOp apply(String operation, StructuringElement element, int iterations, ChannelMode mode) {
			return apply(MorphOperation.fromString(operation), element, iterations, mode);
		}
		
		/**
		 * Erosion.
		 * @param element
		 * @param iterations
		 * @param mode
		 * @return
		 */
		public static ImageOp erode(StructuringElement element, int iterations, ChannelMode mode) {
			return apply(MorphOperation.ERODE, element, iterations, mode);
		}
		
		/**
		 * Dilation.
		 * @param element
		 * @param iterations
		 * @param mode
		 * @return
		 */
		public static ImageOp dilate(StructuringElement element, int iterations, ChannelMode mode) {
			return apply(MorphOperation.DILATE, element, iterations, mode);
		}
		
		@OpType("apply")
		static class MorphOp implements ImageOp {
			
			private MorphOperation operation;
			private StructuringElement element;
			private int iterations;
			private ChannelMode mode;
			
			MorphOp(MorphOperation operation, StructuringElement element, int iterations, ChannelMode mode) {
				this.operation = operation;
				this.element = element;
				this.iterations = iterations;
				this.mode = mode;
			}

			@Override
			public PixelBuffer apply(PixelBuffer input) {
				return pixedit.lib.processing.Morphology.apply(input, operation, element, iterations, mode);
			}
			
			@Override
			public List<String> getWarnings() {
				if (element.isEmpty())
					return List.of("Structuring element is empty, the center cell was used");
				return List.of();
			}
			
			@Override
			public String toString() {
				return "Morphology " + operation.getLabel() + " (" + element.getRows() + "x" + element.getCols() + ", " + iterations + ", " + mode + ")";
			}
			
		}
		
	}
	
	
	/**
	 * Ops for combining other ops.
	 */
	@OpType("core")
	public static class Core {
		
		/**
		 * Apply a sequence of ops, in order.
		 * @param ops
		 * @return
		 */
		public static ImageOp sequential(ImageOp... ops) {
			return sequential(Arrays.asList(ops));
		}
		
		/**
		 * Apply a sequence of ops, in order.
		 * @param ops
		 * @return
		 */
		public static ImageOp sequential(Collection<? extends ImageOp> ops) {
			for (var op : ops)
				Objects.requireNonNull(op, "Ops must not be null!");
			if (ops.size() == 1)
				return ops.iterator().next();
			return new SequentialOp(ops);
		}
		
		/**
		 * Op that returns a copy of the input.
		 * @return
		 */
		public static ImageOp identity() {
			return new SequentialOp(List.of());
		}
		
		@OpType("sequential")
		static class SequentialOp implements ImageOp {
			
			private final static Logger logger = LoggerFactory.getLogger(SequentialOp.class);
			
			private List<ImageOp> ops;
			
			SequentialOp(Collection<? extends ImageOp> ops) {
				this.ops = new ArrayList<>(ops);
			}

			@Override
			public PixelBuffer apply(PixelBuffer input) {
				if (ops.isEmpty())
					return PixelBuffer.createInstance(input.getWidth(), input.getHeight(), input.getColorMode(), input.getSamples());
				for (var t : ops) {
					logger.trace("Applying {}", t);
					input = t.apply(input);
				}
				return input;
			}
			
			@Override
			public List<String> getWarnings() {
				var warnings = new ArrayList<String>();
				for (var t : ops)
					warnings.addAll(t.getWarnings());
				return warnings;
			}
			
			@Override
			public String toString() {
				return "Sequential " + ops;
			}
			
		}
		
	}

}
