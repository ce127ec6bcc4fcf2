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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import pixedit.lib.common.Prefs;
import pixedit.lib.kernels.Kernel;
import pixedit.lib.kernels.StructuringElement;

/**
 * A {@link PresetStore} backed by a JSON file, containing a single object that maps preset names 
 * to 2D arrays of numbers.
 * <p>
 * The file is read lazily on first access and rewritten after every change.
 * A missing file is treated as an empty store; so is a file that cannot be parsed, in which case 
 * a warning is logged and the file will be replaced on the next change.
 * Individual entries that cannot be parsed are skipped.
 * 
 * @author PixEdit developers
 *
 * @param <T>
 */
public class JsonPresetStore<T> implements PresetStore<T> {
	
	private final static Logger logger = LoggerFactory.getLogger(JsonPresetStore.class);
	
	/**
	 * Default file name for custom convolution kernels.
	 */
	public static final String KERNEL_FILE_NAME = "filter_custom_kernels.json";

	/**
	 * Default file name for custom structuring elements.
	 */
	public static final String STRUCTURING_ELEMENT_FILE_NAME = "morph_custom_presets.json";
	
	private final Path path;
	private final Class<T> type;
	private final Set<String> reservedNames;
	private final Gson gson;
	
	private Map<String, T> presets;
	
	/**
	 * Constructor.
	 * @param path path to the JSON file
	 * @param type the preset class; this must be serializable with {@link GsonTools#getInstance()}
	 * @param reservedNames names of built-in presets
	 */
	public JsonPresetStore(Path path, Class<T> type, Collection<String> reservedNames) {
		Objects.requireNonNull(path, "Path must not be null!");
		Objects.requireNonNull(type, "Type must not be null!");
		this.path = path;
		this.type = type;
		this.reservedNames = Set.copyOf(reservedNames);
		this.gson = GsonTools.getInstance(true);
	}
	
	/**
	 * Create a store for convolution kernels in the default preset directory.
	 * @param reservedNames names of built-in presets
	 * @return
	 * @see Prefs#getPresetDirectory()
	 */
	public static JsonPresetStore<Kernel> forKernels(Collection<String> reservedNames) {
		return new JsonPresetStore<>(Prefs.getPresetDirectory().resolve(KERNEL_FILE_NAME), Kernel.class, reservedNames);
	}
	
	/**
	 * Create a store for structuring elements in the default preset directory.
	 * @param reservedNames names of built-in presets
	 * @return
	 * @see Prefs#getPresetDirectory()
	 */
	public static JsonPresetStore<StructuringElement> forStructuringElements(Collection<String> reservedNames) {
		return new JsonPresetStore<>(Prefs.getPresetDirectory().resolve(STRUCTURING_ELEMENT_FILE_NAME), StructuringElement.class, reservedNames);
	}
	
	/**
	 * Get the path to the backing file.
	 * @return
	 */
	public Path getPath() {
		return path;
	}
	
	private synchronized Map<String, T> getPresets() {
		if (presets == null)
			presets = read();
		return presets;
	}
	
	private Map<String, T> read() {
		var map = new LinkedHashMap<String, T>();
		if (!Files.isRegularFile(path)) {
			logger.debug("No preset file found at {}", path);
			return map;
		}
		JsonObject json;
		try {
			String text = Files.readString(path, StandardCharsets.UTF_8);
			JsonElement element = gson.fromJson(text, JsonElement.class);
			if (element == null || !element.isJsonObject()) {
				logger.warn("Presets in {} are not a JSON object and will be ignored", path);
				return map;
			}
			json = element.getAsJsonObject();
		} catch (IOException | JsonParseException e) {
			logger.warn("Unable to read presets from {}: {}", path, e.getLocalizedMessage());
			logger.debug(e.getLocalizedMessage(), e);
			return map;
		}
		for (var entry : json.entrySet()) {
			try {
				T value = gson.fromJson(entry.getValue(), type);
				if (value != null)
					map.put(entry.getKey(), value);
			} catch (JsonParseException | IllegalStateException e) {
				logger.warn("Skipping invalid preset '{}': {}", entry.getKey(), e.getLocalizedMessage());
			}
		}
		logger.debug("Read {} preset(s) from {}", map.size(), path);
		return map;
	}
	
	private void write() throws IOException {
		var parent = path.toAbsolutePath().getParent();
		if (parent != null)
			Files.createDirectories(parent);
		var json = new JsonObject();
		for (var entry : presets.entrySet())
			json.add(entry.getKey(), gson.toJsonTree(entry.getValue(), type));
		Files.writeString(path, gson.toJson(json), StandardCharsets.UTF_8);
		logger.debug("Wrote {} preset(s) to {}", presets.size(), path);
	}
	
	private String checkName(String name) {
		Objects.requireNonNull(name, "Preset name must not be null!");
		String trimmed = name.strip();
		if (trimmed.isEmpty())
			throw new IllegalArgumentException("Preset name must not be empty");
		if (isReserved(trimmed))
			throw new IllegalArgumentException("Preset name '" + trimmed + "' is reserved for a built-in preset");
		return trimmed;
	}

	@Override
	public synchronized List<String> list() {
		return new ArrayList<>(getPresets().keySet());
	}

	@Override
	public synchronized Optional<T> get(String name) {
		if (name == null)
			return Optional.empty();
		return Optional.ofNullable(getPresets().get(name.strip()));
	}

	@Override
	public boolean isReserved(String name) {
		return name != null && reservedNames.contains(name.strip());
	}

	@Override
	public synchronized void put(String name, T preset) throws IOException {
		Objects.requireNonNull(preset, "Preset must not be null!");
		String key = checkName(name);
		getPresets().put(key, preset);
		write();
	}

	@Override
	public synchronized boolean rename(String oldName, String newName) throws IOException {
		var map = getPresets();
		if (oldName == null || !map.containsKey(oldName.strip()))
			return false;
		String oldKey = oldName.strip();
		String newKey = checkName(newName);
		if (newKey.equals(oldKey))
			return true;
		if (map.containsKey(newKey))
			throw new IllegalArgumentException("A preset named '" + newKey + "' already exists");
		// Rebuild to keep the position of the renamed entry
		var renamed = new LinkedHashMap<String, T>();
		for (var entry : map.entrySet())
			renamed.put(entry.getKey().equals(oldKey) ? newKey : entry.getKey(), entry.getValue());
		presets = renamed;
		write();
		return true;
	}

	@Override
	public synchronized boolean delete(String name) throws IOException {
		if (name == null || getPresets().remove(name.strip()) == null)
			return false;
		write();
		return true;
	}
	
	@Override
	public String toString() {
		return "JsonPresetStore [" + path + ", " + type.getSimpleName() + "]";
	}

	/**
	 * Get the names reserved for built-in presets.
	 * @return
	 */
	public Set<String> getReservedNames() {
		return new LinkedHashSet<>(reservedNames);
	}

}
