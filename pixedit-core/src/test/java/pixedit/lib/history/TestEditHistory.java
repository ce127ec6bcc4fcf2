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

package pixedit.lib.history;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import pixedit.lib.common.Prefs;
import pixedit.lib.images.ColorMode;
import pixedit.lib.images.PixelBuffer;

@SuppressWarnings("javadoc")
public class TestEditHistory {
	
	@Test
	public void test_emptyHistory() {
		var history = new EditHistory<String>(5);
		assertFalse(history.canUndo());
		assertFalse(history.canRedo());
		assertNull(history.undo("current"));
		assertNull(history.redo("current"));
		assertEquals(0, history.redoSize());
	}
	
	@Test
	public void test_defaultCapacity() {
		assertEquals(Prefs.getHistoryCapacity(), new EditHistory<>().getCapacity());
		assertEquals(1, new EditHistory<>(0).getCapacity());
	}
	
	@Test
	public void test_capacityDropsOldest() {
		var history = new EditHistory<Integer>(3);
		for (int i = 0; i < 10; i++)
			history.push(i);
		assertEquals(3, history.undoSize());
		assertEquals(9, history.undo(10));
		assertEquals(8, history.undo(9));
		assertEquals(7, history.undo(8));
		assertNull(history.undo(7));
	}
	
	@Test
	public void test_pushClearsRedo() {
		var history = new EditHistory<String>(10);
		history.push("a");
		history.push("b");
		assertEquals("b", history.undo("c"));
		assertTrue(history.canRedo());
		history.push("b2");
		assertFalse(history.canRedo());
		assertNull(history.redo("d"));
	}
	
	@Test
	public void test_undoRedoRestoresExactBuffer() {
		var history = new EditHistory<PixelBuffer>(10);
		var original = PixelBuffer.filled(4, 4, ColorMode.GRAY, 10);
		var edited = PixelBuffer.filled(4, 4, ColorMode.GRAY, 20);
		history.push(original);
		
		var undone = history.undo(edited);
		assertSame(original, undone);
		assertSame(edited, history.peekRedo());
		
		var redone = history.redo(undone);
		assertSame(edited, redone);
		assertSame(original, history.peekUndo());
		assertFalse(history.canRedo());
	}
	
	@Test
	public void test_clear() {
		var history = new EditHistory<String>(10);
		history.push("a");
		history.undo("b");
		history.clear();
		assertFalse(history.canUndo());
		assertFalse(history.canRedo());
	}

	@Test
	public void test_snapshotsCannotBeModified() {
		var history = new EditHistory<PixelBuffer>(5);
		var snapshot = PixelBuffer.filled(2, 2, ColorMode.GRAY, 10);
		history.push(snapshot);
		snapshot.getSamples()[0] = (byte)200;
		history.peekUndo().getSamples()[0] = (byte)200;
		
		var restored = history.undo(PixelBuffer.filled(2, 2, ColorMode.GRAY, 50));
		assertEquals(10, restored.getSample(0, 0, 0));
		assertEquals(PixelBuffer.filled(2, 2, ColorMode.GRAY, 10), restored);
	}

}
