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

package pixedit.lib.editing;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixedit.lib.analysis.stats.HistogramTable;
import pixedit.lib.history.EditHistory;
import pixedit.lib.images.PixelBuffer;
import pixedit.lib.ops.ImageOp;

/**
 * Holds the state of a single image being edited.
 * <p>
 * A session tracks the original image, the current image and an {@link EditHistory} of previous versions.
 * Operations can be previewed any number of times without side effects, and committed once they should 
 * become part of the history.
 * <p>
 * A session is intended to be modified from a single thread.
 * 
 * @author PixEdit developers
 */
public class EditSession {
	
	private final static Logger logger = LoggerFactory.getLogger(EditSession.class);
	
	private final EditHistory<PixelBuffer> history;
	
	private PixelBuffer original;
	private PixelBuffer current;
	private boolean showingOriginal = false;
	
	private List<String> lastWarnings = Collections.emptyList();
	
	/**
	 * Create a session with a history using the default capacity.
	 */
	public EditSession() {
		this(new EditHistory<>());
	}
	
	/**
	 * Create a session using the specified history.
	 * @param history
	 */
	public EditSession(EditHistory<PixelBuffer> history) {
		this.history = Objects.requireNonNull(history);
	}
	
	/**
	 * Start editing a new image, discarding any existing history.
	 * @param image
	 */
	public void open(PixelBuffer image) {
		Objects.requireNonNull(image, "Image must not be null!");
		logger.debug("Opening {}", image);
		history.clear();
		original = image;
		current = image;
		showingOriginal = false;
		lastWarnings = Collections.emptyList();
	}
	
	/**
	 * Returns true if an image has been opened.
	 * @return
	 */
	public boolean hasImage() {
		return current != null;
	}
	
	/**
	 * Get the image as it was opened.
	 * @return the original image, or null if no image has been opened
	 */
	public PixelBuffer getOriginal() {
		return original;
	}
	
	/**
	 * Get the current image, after all committed edits.
	 * @return the current image, or null if no image has been opened
	 */
	public PixelBuffer getCurrent() {
		return current;
	}
	
	/**
	 * Get the history used by this session.
	 * @return
	 */
	public EditHistory<PixelBuffer> getHistory() {
		return history;
	}
	
	/**
	 * Apply an operation to the current image, without changing the session.
	 * @param op
	 * @return the result of applying the op
	 * @throws IllegalStateException if no image has been opened
	 */
	public PixelBuffer preview(ImageOp op) {
		Objects.requireNonNull(op);
		if (current == null)
			throw new IllegalStateException("Cannot preview " + op + " - no image open");
		var result = op.apply(current);
		lastWarnings = List.copyOf(op.getWarnings());
		return result;
	}
	
	/**
	 * Apply an operation to the current image, adding the previous image to the history.
	 * @param op
	 * @return true if the op was applied, false if there is no image
	 */
	public boolean commit(ImageOp op) {
		Objects.requireNonNull(op);
		if (current == null) {
			logger.debug("Cannot commit {} - no image open", op);
			return false;
		}
		var result = op.apply(current);
		lastWarnings = List.copyOf(op.getWarnings());
		return commit(result);
	}
	
	/**
	 * Adopt a new image as the current image, adding the previous image to the history.
	 * This can be used to commit a result returned by {@link #preview(ImageOp)}.
	 * @param result
	 * @return true if the image was adopted, false if there is no image
	 */
	public boolean commit(PixelBuffer result) {
		Objects.requireNonNull(result);
		if (current == null)
			return false;
		history.push(current);
		current = result;
		logger.debug("Committed edit, history size {}", history.undoSize());
		return true;
	}
	
	/**
	 * Returns true if an edit can be undone.
	 * @return
	 */
	public boolean canUndo() {
		return current != null && history.canUndo();
	}
	
	/**
	 * Returns true if an edit can be redone.
	 * @return
	 */
	public boolean canRedo() {
		return current != null && history.canRedo();
	}
	
	/**
	 * Revert to the image before the last commit.
	 * @return true if the current image changed
	 */
	public boolean undo() {
		if (current == null)
			return false;
		var previous = history.undo(current);
		if (previous == null)
			return false;
		current = previous;
		return true;
	}
	
	/**
	 * Reapply the last undone edit.
	 * @return true if the current image changed
	 */
	public boolean redo() {
		if (current == null)
			return false;
		var next = history.redo(current);
		if (next == null)
			return false;
		current = next;
		return true;
	}
	
	/**
	 * Restore the original image and clear the history.
	 * @return true if the session was reset, false if there is no image
	 */
	public boolean reset() {
		if (original == null)
			return false;
		history.clear();
		current = original;
		showingOriginal = false;
		lastWarnings = Collections.emptyList();
		return true;
	}
	
	/**
	 * Start showing the original image in place of the current image.
	 * The history and current image are not affected.
	 * @return true if the display changed, false if there is no image or the original is already shown
	 * @see #getDisplayed()
	 */
	public boolean showOriginalStart() {
		if (original == null || showingOriginal)
			return false;
		showingOriginal = true;
		return true;
	}
	
	/**
	 * Stop showing the original image.
	 * @return true if the display changed, false if the original was not being shown
	 */
	public boolean showOriginalEnd() {
		if (!showingOriginal)
			return false;
		showingOriginal = false;
		return true;
	}
	
	/**
	 * Returns true between calls to {@link #showOriginalStart()} and {@link #showOriginalEnd()}.
	 * @return
	 */
	public boolean isShowingOriginal() {
		return showingOriginal;
	}
	
	/**
	 * Get the image that should currently be displayed.
	 * @return the original while it is being shown, otherwise the current image
	 */
	public PixelBuffer getDisplayed() {
		return showingOriginal ? original : current;
	}
	
	/**
	 * Get the image to use for a histogram.
	 * @param source
	 * @return the requested image, or null if no image has been opened
	 */
	public PixelBuffer histogramSource(HistogramSource source) {
		if (current == null)
			return null;
		return switch (source) {
			case ORIGINAL -> original;
			case PREVIOUS -> history.canUndo() ? history.peekUndo() : current;
			default -> current;
		};
	}
	
	/**
	 * Compute a histogram for the requested image.
	 * @param source
	 * @return the histogram, or null if no image has been opened
	 */
	public HistogramTable histogram(HistogramSource source) {
		var image = histogramSource(source);
		return image == null ? null : HistogramTable.compute(image);
	}
	
	/**
	 * Get any warnings produced by the last previewed or committed op.
	 * @return
	 */
	public List<String> getLastWarnings() {
		return lastWarnings;
	}

}
