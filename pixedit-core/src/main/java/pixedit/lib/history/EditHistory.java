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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixedit.lib.common.Prefs;

/**
 * A bounded pair of undo and redo stacks.
 * <p>
 * The history never stores the current state itself: callers push the <i>previous</i> state whenever 
 * they commit a change, and hand over the current state when requesting an undo or redo.
 * Any new push invalidates the redo stack.
 * When the capacity is exceeded, the oldest entries are dropped first.
 * 
 * @author PixEdit developers
 *
 * @param <T> the type of state stored, typically an immutable image
 */
public class EditHistory<T> {
	
	private final static Logger logger = LoggerFactory.getLogger(EditHistory.class);
	
	private final int capacity;
	private final Deque<T> undoStack = new ArrayDeque<>();
	private final Deque<T> redoStack = new ArrayDeque<>();
	
	/**
	 * Create a history with the default capacity from {@link Prefs#getHistoryCapacity()}.
	 */
	public EditHistory() {
		this(Prefs.getHistoryCapacity());
	}
	
	/**
	 * Create a history with a specified capacity.
	 * @param capacity maximum number of entries in each stack; values &lt; 1 are treated as 1
	 */
	public EditHistory(int capacity) {
		if (capacity < 1)
			logger.debug("History capacity {} is too small, will use 1", capacity);
		this.capacity = Math.max(1, capacity);
	}
	
	/**
	 * Maximum number of entries retained in each stack.
	 * @return
	 */
	public int getCapacity() {
		return capacity;
	}
	
	/**
	 * Record a new state, which will be returned by the next call to {@link #undo(Object)}.
	 * This will clear any redo status, on the assumption that redo is no longer possible.
	 * @param previous the state before the change being committed
	 */
	public synchronized void push(T previous) {
		Objects.requireNonNull(previous, "Cannot push a null state to history!");
		undoStack.push(previous);
		trim(undoStack);
		redoStack.clear();
	}
	
	/**
	 * Request undo once.
	 * @param current the state that is being replaced; this will be returned by the next {@link #redo(Object)}
	 * @return the state that should become current, or null if there is nothing to undo
	 */
	public synchronized T undo(T current) {
		if (undoStack.isEmpty()) {
			logger.debug("Cannot undo! Stack is empty.");
			return null;
		}
		Objects.requireNonNull(current, "Current state must not be null!");
		redoStack.push(current);
		trim(redoStack);
		return undoStack.pop();
	}
	
	/**
	 * Request redo once.
	 * @param current the state that is being replaced; this will be returned by the next {@link #undo(Object)}
	 * @return the state that should become current, or null if there is nothing to redo
	 */
	public synchronized T redo(T current) {
		if (redoStack.isEmpty()) {
			logger.debug("Cannot redo! Stack is empty.");
			return null;
		}
		Objects.requireNonNull(current, "Current state must not be null!");
		undoStack.push(current);
		trim(undoStack);
		return redoStack.pop();
	}
	
	private void trim(Deque<T> stack) {
		while (stack.size() > capacity)
			stack.pollLast();
	}
	
	/**
	 * Get the state that would be returned by {@link #undo(Object)}, without changing the history.
	 * @return the most recent undo entry, or null if there is none
	 */
	public synchronized T peekUndo() {
		return undoStack.peek();
	}
	
	/**
	 * Get the state that would be returned by {@link #redo(Object)}, without changing the history.
	 * @return the most recent redo entry, or null if there is none
	 */
	public synchronized T peekRedo() {
		return redoStack.peek();
	}
	
	/**
	 * Returns true if the undo stack is not empty.
	 * @return
	 */
	public synchronized boolean canUndo() {
		return !undoStack.isEmpty();
	}
	
	/**
	 * Returns true if the redo stack is not empty.
	 * @return
	 */
	public synchronized boolean canRedo() {
		return !redoStack.isEmpty();
	}
	
	/**
	 * Number of entries available to undo.
	 * @return
	 */
	public synchronized int undoSize() {
		return undoStack.size();
	}
	
	/**
	 * Number of entries available to redo.
	 * @return
	 */
	public synchronized int redoSize() {
		return redoStack.size();
	}
	
	/**
	 * Clear the undo and redo stacks.
	 */
	public synchronized void clear() {
		undoStack.clear();
		redoStack.clear();
	}
	
	@Override
	public synchronized String toString() {
		return "EditHistory [undo=" + undoStack.size() + ", redo=" + redoStack.size() + ", capacity=" + capacity + "]";
	}

}
