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
import java.util.List;
import java.util.Optional;

/**
 * A collection of named, user-defined presets (e.g. convolution kernels or structuring elements).
 * <p>
 * Names used by built-in presets are reserved and cannot be assigned to user presets.
 * 
 * @author PixEdit developers
 *
 * @param <T> the preset type
 */
public interface PresetStore<T> {
	
	/**
	 * Names of all user presets, in insertion order.
	 * @return
	 */
	List<String> list();
	
	/**
	 * Get a user preset by name.
	 * @param name
	 * @return the preset, or empty if no preset exists with the name
	 */
	Optional<T> get(String name);
	
	/**
	 * Returns true if the name belongs to a built-in preset, and so cannot be used.
	 * @param name
	 * @return
	 */
	boolean isReserved(String name);
	
	/**
	 * Add or replace a user preset.
	 * @param name the preset name; leading and trailing whitespace is removed
	 * @param preset
	 * @throws IOException if the presets could not be saved
	 * @throws IllegalArgumentException if the name is empty or reserved
	 */
	void put(String name, T preset) throws IOException;
	
	/**
	 * Rename a user preset.
	 * @param oldName
	 * @param newName
	 * @return true if the preset was renamed, false if no preset exists called {@code oldName}
	 * @throws IOException if the presets could not be saved
	 * @throws IllegalArgumentException if the new name is empty, reserved or already in use
	 */
	boolean rename(String oldName, String newName) throws IOException;
	
	/**
	 * Delete a user preset.
	 * @param name
	 * @return true if a preset was removed, false otherwise
	 * @throws IOException if the presets could not be saved
	 */
	boolean delete(String name) throws IOException;

}
