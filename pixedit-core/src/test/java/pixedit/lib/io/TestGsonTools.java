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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonParseException;

import pixedit.lib.kernels.Kernel;
import pixedit.lib.kernels.StructuringElement;

@SuppressWarnings("javadoc")
public class TestGsonTools {
	
	@Test
	public void test_kernelAsArray() {
		var gson = GsonTools.getInstance();
		var kernel = Kernel.create(new double[][] {{0, -1, 0}, {-1, 5, -1}, {0, -1, 0}});
		String json = gson.toJson(kernel);
		assertEquals("[[0,-1,0],[-1,5,-1],[0,-1,0]]", json);
		assertEquals(kernel, gson.fromJson(json, Kernel.class));
		
		var fractional = Kernel.create(new double[][] {{0.25}});
		assertEquals("[[0.25]]", gson.toJson(fractional));
	}
	
	@Test
	public void test_evenKernelFromJson() {
		var kernel = GsonTools.getInstance().fromJson("[[1, 1], [1, 1]]", Kernel.class);
		assertEquals(3, kernel.getRows());
		assertEquals(4.0, kernel.sum());
	}
	
	@Test
	public void test_structuringElement() {
		var gson = GsonTools.getInstance();
		var element = gson.fromJson("[[0, 1, 0], [1, 1, 1], [0, 1, 0]]", StructuringElement.class);
		assertEquals(5, element.countOn());
		assertEquals("[[0,1,0],[1,1,1],[0,1,0]]", gson.toJson(element));
	}
	
	@Test
	public void test_invalid() {
		assertThrows(JsonParseException.class, () -> GsonTools.getInstance().fromJson("[]", Kernel.class));
	}

}
