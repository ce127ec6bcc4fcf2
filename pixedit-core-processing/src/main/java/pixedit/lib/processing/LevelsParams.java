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

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixedit.lib.common.GeneralTools;

/**
 * Black point, white point and gamma for a levels adjustment.
 * <p>
 * Values are corrected on construction: black and white are clipped to 0-255, 
 * white is set to black + 1 if it would otherwise not exceed black, 
 * and gamma is set to at least {@link #MIN_GAMMA}.
 * 
 * @author PixEdit developers
 */
public final class LevelsParams {
	
	private final static Logger logger = LoggerFactory.getLogger(LevelsParams.class);
	
	/**
	 * Smallest gamma value permitted.
	 */
	public static final double MIN_GAMMA = 0.01;
	
	private final int black;
	private final int white;
	private final double gamma;
	
	private LevelsParams(int black, int white, double gamma) {
		this.black = black;
		this.white = white;
		this.gamma = gamma;
	}
	
	/**
	 * Create levels parameters, correcting invalid values.
	 * @param black
	 * @param white
	 * @param gamma
	 * @return
	 */
	public static LevelsParams of(int black, int white, double gamma) {
		int b = GeneralTools.clipValue(black, 0, 255);
		int w = GeneralTools.clipValue(white, 0, 255);
		if (w <= b)
			w = b + 1;
		double g = Double.isNaN(gamma) ? MIN_GAMMA : Math.max(MIN_GAMMA, gamma);
		if (b != black || w != white || g != gamma)
			logger.debug("Levels corrected from ({}, {}, {}) to ({}, {}, {})", black, white, gamma, b, w, g);
		return new LevelsParams(b, w, g);
	}
	
	/**
	 * Parameters that leave values unchanged.
	 * @return
	 */
	public static LevelsParams identity() {
		return new LevelsParams(0, 255, 1.0);
	}
	
	/**
	 * Black point, in the range 0-255.
	 * @return
	 */
	public int getBlack() {
		return black;
	}
	
	/**
	 * White point; always greater than the black point, and at most 256.
	 * @return
	 */
	public int getWhite() {
		return white;
	}
	
	/**
	 * Gamma exponent applied in normalized space.
	 * @return
	 */
	public double getGamma() {
		return gamma;
	}

	@Override
	public int hashCode() {
		return Objects.hash(black, white, gamma);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof LevelsParams))
			return false;
		LevelsParams other = (LevelsParams) obj;
		return black == other.black && white == other.white
				&& Double.doubleToLongBits(gamma) == Double.doubleToLongBits(other.gamma);
	}

	@Override
	public String toString() {
		return "LevelsParams [black=" + black + ", white=" + white + ", gamma=" + gamma + "]";
	}

}
