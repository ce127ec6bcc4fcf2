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

import java.util.Collections;
import java.util.List;

import pixedit.lib.images.PixelBuffer;

/**
 * An operation that may be applied to a {@link PixelBuffer}.
 * <p>
 * Operations are immutable and must not modify their input. 
 * Applying the same operation to the same input always gives the same output, 
 * so operations can be used for repeated previews before being committed once.
 * <p>
 * Operations created by {@link ImageOps} can be serialized to and from JSON.
 * 
 * @author PixEdit developers
 */
public interface ImageOp {
	
	/**
	 * Apply operation to the image.
	 * 
	 * @param input input image, which will not be modified
	 * @return output image
	 */
	public PixelBuffer apply(PixelBuffer input);
	
	/**
	 * Get any warnings about parameters that had to be corrected before the operation could be applied, 
	 * e.g. because a kernel contained only zeros.
	 * <p>
	 * The default is to return an empty list.
	 * 
	 * @return a list of warnings, which may be shown to the user
	 */
	public default List<String> getWarnings() {
		return Collections.emptyList();
	}

}
