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

package pixedit.lib.processing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestKernels {
	
	private static final double EPSILON = 1e-9;
	
	@Test
	public void test_motionHorizontal() {
		var kernel = Kernels.motion(5, 0);
		assertEquals(5, kernel.getRows());
		assertEquals(5, kernel.getCols());
		for (int r = 0; r < 5; r++) {
			for (int c = 0; c < 5; c++)
				assertEquals(r == 2 ? 0.2 : 0.0, kernel.get(r, c), EPSILON);
		}
		assertEquals(1.0, kernel.sum(), EPSILON);
	}
	
	@Test
	public void test_motionVertical() {
		var kernel = Kernels.motion(5, 90);
		for (int r = 0; r < 5; r++) {
			for (int c = 0; c < 5; c++)
				assertEquals(c == 2 ? 0.2 : 0.0, kernel.get(r, c), EPSILON);
		}
	}
	
	@Test
	public void test_motionDiagonal() {
		var kernel = Kernels.motion(3, 45);
		assertEquals(1.0, kernel.sum(), EPSILON);
		assertEquals(1.0/3.0, kernel.get(1, 1), EPSILON);
		// Positive angles slope up to the right as displayed
		assertEquals(1.0/3.0, kernel.get(0, 2), EPSILON);
		assertEquals(1.0/3.0, kernel.get(2, 0), EPSILON);
		
		var down = Kernels.motion(3, -45);
		assertEquals(1.0/3.0, down.get(0, 0), EPSILON);
		assertEquals(1.0/3.0, down.get(2, 2), EPSILON);
		assertEquals(0.0, down.get(0, 2), EPSILON);
	}
	
	@Test
	public void test_motionEvenLength() {
		assertEquals(5, Kernels.motion(4, 0).getRows());
		assertEquals(1, Kernels.motion(0, 30).getRows());
		assertEquals(1.0, Kernels.motion(0, 30).get(0, 0), EPSILON);
	}
	
	@Test
	public void test_presets() {
		assertEquals(6, Kernels.getPresetNames().size());
		for (var name : Kernels.getPresetNames())
			assertTrue(Kernels.preset(name, 3, 3).isPresent(), name);
		assertFalse(Kernels.preset("Not a kernel", 3, 3).isPresent());
		assertFalse(Kernels.preset(null, 3, 3).isPresent());
		
		assertEquals(Kernels.sharpen(), Kernels.preset(Kernels.SHARPEN, 3, 3).get());
		assertEquals(Kernels.identity(5, 5), Kernels.preset(Kernels.IDENTITY, 5, 5).get());
	}
	
	@Test
	public void test_fit3x3() {
		var kernel = Kernels.preset(Kernels.SHARPEN, 5, 7).get();
		assertEquals(5, kernel.getRows());
		assertEquals(7, kernel.getCols());
		assertEquals(5.0, kernel.get(2, 3), EPSILON);
		assertEquals(-1.0, kernel.get(1, 3), EPSILON);
		assertEquals(0.0, kernel.get(0, 0), EPSILON);
		assertEquals(1.0, kernel.sum(), EPSILON);
		
		var small = Kernels.fit3x3(Kernels.sharpen(), 1, 1);
		assertEquals(1, small.getRows());
		assertEquals(0.0, small.get(0, 0), EPSILON);
	}
	
	@Test
	public void test_boxBlur() {
		var kernel = Kernels.boxBlur(2, 4);
		assertEquals(3, kernel.getRows());
		assertEquals(5, kernel.getCols());
		assertEquals(15.0, kernel.sum(), EPSILON);
	}

}
