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

package pixedit.lib.io;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import pixedit.lib.kernels.Kernel;
import pixedit.lib.kernels.StructuringElement;

/**
 * Helper class providing Gson instances with type adapters registered to serialize 
 * several key classes.
 * <p>
 * These include:
 * <ul>
 * <li>{@link Kernel}, written as a 2D array of numbers</li>
 * <li>{@link StructuringElement}, written as a 2D array of 0 and 1 values</li>
 * </ul>
 * Class hierarchies (e.g. image operations) can be supported by registering a {@link SubTypeAdapterFactory} 
 * with {@link #getDefaultBuilder()}.
 * 
 * @author PixEdit developers
 *
 */
public class GsonTools {
	
	private final static Logger logger = LoggerFactory.getLogger(GsonTools.class);
	
	private static GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient()
			.registerTypeAdapter(Kernel.class, KernelTypeAdapter.INSTANCE.nullSafe())
			.registerTypeAdapter(StructuringElement.class, StructuringElementTypeAdapter.INSTANCE.nullSafe());
	
	// Suppress default constructor for non-instantiability
	private GsonTools() {
		throw new AssertionError();
	}
	
	/**
	 * Access the builder used with {@link #getInstance()}.
	 * This makes it possible to register new type adapters if required, which will be used by future Gson instances 
	 * returned by this class.
	 * <p>
	 * <b>Use this with caution!</b> Changes made here impact JSON serialization/deserialization throughout 
	 * the software.
	 * 
	 * @return
	 */
	public static GsonBuilder getDefaultBuilder() {
		logger.trace("Requesting GsonBuilder from {}", Thread.currentThread().getStackTrace()[0]);
		return builder;
	}
	
	/**
	 * Create a {@link TypeAdapterFactory} that is suitable for handling class hierarchies.
	 * 
	 * @param <T>
	 * @param baseType the base type, i.e. the class or interface that all types descend from
	 * @param typeFieldName name of the JSON field used to store the type label
	 * @return
	 */
	public static <T> SubTypeAdapterFactory<T> createSubTypeAdapterFactory(Class<T> baseType, String typeFieldName) {
		return new SubTypeAdapterFactory<>(baseType, typeFieldName);
	}
	
	/**
	 * A {@link TypeAdapterFactory} that is suitable for handling class hierarchies.
	 * This can be used to construct the appropriate subtype when parsing the JSON.
	 * <p>
	 * The label is written as an extra field of the JSON object, and removed again before the 
	 * object is passed to the delegate adapter of the subtype.
	 * Alias labels can be registered to read older names.
	 *
	 * @param <T>
	 */
	public static class SubTypeAdapterFactory<T> implements TypeAdapterFactory {
		
		private final static Logger logger = LoggerFactory.getLogger(SubTypeAdapterFactory.class);
		
		private final Class<?> baseType;
		private final String typeFieldName;
		private final Map<String, Class<?>> labelToSubtype = new LinkedHashMap<>();
		private final Map<Class<?>, String> subtypeToLabel = new LinkedHashMap<>();
		private final Map<String, Class<?>> aliasToSubtype = new LinkedHashMap<>();
		
		private SubTypeAdapterFactory(Class<T> baseType, String typeFieldName) {
			Objects.requireNonNull(baseType, "baseType must not be null!");
			Objects.requireNonNull(typeFieldName, "typeFieldName must not be null!");
			this.typeFieldName = typeFieldName;
			this.baseType = baseType;
		}
		
		@SuppressWarnings("unchecked")
		@Override
		public synchronized <R> TypeAdapter<R> create(Gson gson, TypeToken<R> type) {
			if (!Objects.equals(type.getRawType(), baseType)) {
				return null;
			}
			return (TypeAdapter<R>)new SubTypeAdapter(gson).nullSafe();
		}
		
		private class SubTypeAdapter extends TypeAdapter<T> {
			
			private final Gson gson;
			private final Map<Class<?>, TypeAdapter<?>> subtypeToDelegate = new LinkedHashMap<>();
			
			private SubTypeAdapter(final Gson gson) {
				this.gson = gson;
				for (Map.Entry<String, Class<?>> entry : labelToSubtype.entrySet()) {
					TypeAdapter<?> delegate = gson.getDelegateAdapter(SubTypeAdapterFactory.this, TypeToken.get(entry.getValue()));
					subtypeToDelegate.put(entry.getValue(), delegate);
				}
			}

			@SuppressWarnings("unchecked")
			@Override
			public void write(JsonWriter out, T value) throws IOException {
				Class<?> srcType = value.getClass();
				String label = subtypeToLabel.get(srcType);
				TypeAdapter<T> delegate = (TypeAdapter<T>)subtypeToDelegate.get(srcType);
				if (delegate == null)
					throw new JsonParseException("Cannot serialize " + baseType + " subtype named " + srcType.getName() +
							"; did you forget to register a subtype?");
				JsonObject jsonObject = delegate.toJsonTree(value).getAsJsonObject();
				if (jsonObject.has(typeFieldName))
					throw new JsonParseException("Cannot serialize " + srcType.getName() + 
							" because it already defines a field named " + typeFieldName);
				JsonObject clone = new JsonObject();
				clone.add(typeFieldName, new JsonPrimitive(label));
				for (Map.Entry<String, JsonElement> entry : jsonObject.entrySet()) {
					clone.add(entry.getKey(), entry.getValue());
				}
				logger.trace("Writing {} for {} ", label, value);
				gson.toJson(clone, out);
			}

			@SuppressWarnings("unchecked")
			@Override
			public T read(JsonReader in) throws IOException {
				JsonElement jsonElement = gson.fromJson(in, JsonElement.class);
				if (!jsonElement.isJsonObject())
					throw new JsonParseException("Cannot deserialize " + baseType + " from " + jsonElement);
				JsonElement labelElement = jsonElement.getAsJsonObject().remove(typeFieldName);
				if (labelElement == null)
					throw new JsonParseException("Cannot deserialize " + baseType + " because there is no field named " + typeFieldName);
				String label = labelElement.getAsString();
				Class<?> subtype = labelToSubtype.get(label);
				if (subtype == null)
					subtype = aliasToSubtype.get(label);
				TypeAdapter<T> delegate = (TypeAdapter<T>)subtypeToDelegate.get(subtype);
				if (delegate == null)
					throw new JsonParseException("Cannot deserialize " + baseType + " subtype named " + label);
				logger.trace("Reading {} for {} ", label, baseType);
				return delegate.fromJsonTree(jsonElement);
			}
			
		}
		
		/**
		 * Register a subtype using a custom label.
		 * 
		 * @param subtype the subtype to register
		 * @param label the label used to identify objects of this subtype; this must be unique
		 * @return this {@link SubTypeAdapterFactory}
		 * @throws IllegalArgumentException if the label is already in use
		 */
		public synchronized SubTypeAdapterFactory<T> registerSubtype(Class<? extends T> subtype, String label) {
			Objects.requireNonNull(subtype, "subtype must not be null!");
			Objects.requireNonNull(label, "label must not be null!");
			if (labelToSubtype.containsKey(label))
				throw new IllegalArgumentException("Label " + label + " is already assigned! Did you want to register an alias instead?");
			labelToSubtype.put(label, subtype);
			subtypeToLabel.put(subtype, label);
			return this;
		}
		
		/**
		 * Register an alias label for a specified subtype.
		 * This is used during deserialization only.
		 * 
		 * @param subtype the subtype to register
		 * @param alias the alias used as an alternative label to identify objects of this subtype
		 * @return this {@link SubTypeAdapterFactory}
		 */
		public synchronized SubTypeAdapterFactory<T> registerAlias(Class<? extends T> subtype, String alias) {
			Objects.requireNonNull(subtype, "subtype must not be null!");
			Objects.requireNonNull(alias, "alias must not be null!");
			if (aliasToSubtype.containsKey(alias)) {
				if (Objects.equals(aliasToSubtype.get(alias), subtype))
					return this;
				logger.warn("Alias {} is already assigned to subtype {}, request will be ignored", alias, aliasToSubtype.get(alias));
				return this;
			}
			aliasToSubtype.put(alias, subtype);
			return this;
		}
		
		/**
		 * Register a subtype using the default label (the simple name of the class).
		 * 
		 * @param subtype the subtype to register
		 * @return this {@link SubTypeAdapterFactory}
		 * @see #registerSubtype(Class, String)
		 */
		public synchronized SubTypeAdapterFactory<T> registerSubtype(Class<? extends T> subtype) {
			return registerSubtype(subtype, subtype.getSimpleName());
		}
		
		/**
		 * Get the label registered for a subtype.
		 * @param subtype
		 * @return the label, or null if the subtype has not been registered
		 */
		public synchronized String getLabel(Class<?> subtype) {
			return subtypeToLabel.get(subtype);
		}
		
	}
	
	/**
	 * Get default Gson, capable of serializing/deserializing some key PixEdit classes.
	 * @return
	 * 
	 * @see #getInstance(boolean)
	 */
	public static Gson getInstance() {
		return builder.create();
	}
	
	/**
	 * Get default Gson, optionally with pretty printing enabled.
	 * 
	 * @param pretty if true, write using pretty-printing (i.e. more whitespace for formatting)
	 * @return
	 * 
	 * @see #getInstance()
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}
	
	/**
	 * Read a 2D array of numbers, allowing rows of different lengths.
	 */
	private static double[][] readMatrix(JsonReader in) throws IOException {
		var rows = new ArrayList<double[]>();
		in.beginArray();
		while (in.hasNext()) {
			var row = new ArrayList<Double>();
			if (in.peek() == JsonToken.BEGIN_ARRAY) {
				in.beginArray();
				while (in.hasNext())
					row.add(in.nextDouble());
				in.endArray();
			} else {
				// A flat array is treated as a single row
				row.add(in.nextDouble());
			}
			rows.add(row.stream().mapToDouble(Double::doubleValue).toArray());
		}
		in.endArray();
		return rows.toArray(double[][]::new);
	}
	
	/**
	 * TypeAdapter for {@link Kernel}, using a 2D array of weights.
	 */
	static class KernelTypeAdapter extends TypeAdapter<Kernel> {
		
		static KernelTypeAdapter INSTANCE = new KernelTypeAdapter();

		@Override
		public void write(JsonWriter out, Kernel value) throws IOException {
			out.beginArray();
			for (double[] row : value.toArray()) {
				out.beginArray();
				for (double v : row) {
					if (v == Math.rint(v) && Math.abs(v) < 1e15)
						out.value((long)v);
					else
						out.value(v);
				}
				out.endArray();
			}
			out.endArray();
		}

		@Override
		public Kernel read(JsonReader in) throws IOException {
			try {
				return Kernel.create(readMatrix(in));
			} catch (IllegalArgumentException e) {
				throw new JsonParseException("Invalid kernel: " + e.getLocalizedMessage(), e);
			}
		}
		
	}
	
	/**
	 * TypeAdapter for {@link StructuringElement}, using a 2D array of 0 and 1 values.
	 */
	static class StructuringElementTypeAdapter extends TypeAdapter<StructuringElement> {
		
		static StructuringElementTypeAdapter INSTANCE = new StructuringElementTypeAdapter();

		@Override
		public void write(JsonWriter out, StructuringElement value) throws IOException {
			out.beginArray();
			for (int[] row : value.toArray()) {
				out.beginArray();
				for (int v : row)
					out.value(v);
				out.endArray();
			}
			out.endArray();
		}

		@Override
		public StructuringElement read(JsonReader in) throws IOException {
			double[][] values = readMatrix(in);
			boolean[][] mask = new boolean[values.length][];
			for (int y = 0; y < values.length; y++) {
				mask[y] = new boolean[values[y].length];
				for (int x = 0; x < values[y].length; x++)
					mask[y][x] = values[y][x] != 0;
			}
			try {
				return StructuringElement.create(mask);
			} catch (IllegalArgumentException e) {
				throw new JsonParseException("Invalid structuring element: " + e.getLocalizedMessage(), e);
			}
		}
		
	}

}
