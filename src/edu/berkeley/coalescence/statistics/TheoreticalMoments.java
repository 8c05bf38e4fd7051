 /*
    This file is part of coalescence.

    coalescence is free software: you can redistribute it and/or modify
    it under the terms of the GNU General Public License as published by
    the Free Software Foundation, either version 3 of the License, or
    (at your option) any later version.

    coalescence is distributed in the hope that it will be useful,
    but WITHOUT ANY WARRANTY; without even the implied warranty of
    MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
    GNU General Public License for more details.

    You should have received a copy of the GNU General Public License
    along with coalescence.  If not, see <http://www.gnu.org/licenses/>.
  */


package edu.berkeley.coalescence.statistics;

import org.apache.commons.math3.exception.NumberIsTooSmallException;

/**
 * Expected values of genealogy statistics under the n-coalescent, to compare simulations against.
 */
public class TheoreticalMoments {

	// truncated, as used for the length approximation
	public static final double EULER_MASCHERONI = 0.57721;

	/**
	 * Expected time to the most recent common ancestor, 2 (1 - 1/n).
	 */
	public static double expectedDepth (int groupSize) {
		checkGroupSize (groupSize, 1);
		return 2d * (1d - 1d / groupSize);
	}

	/**
	 * Expected total branch length, 2 times the harmonic number of n-1.
	 */
	public static double expectedLength (int groupSize) {
		checkGroupSize (groupSize, 1);
		double harmonic = 0d;
		for (int i = 1; i < groupSize; i++) harmonic += 1d / i;
		return 2d * harmonic;
	}

	/**
	 * Asymptotic expansion of {@link #expectedLength(int)}, 2 (ln(n-1) + gamma + 1/(2(n-1))).
	 */
	public static double approximateExpectedLength (int groupSize) {
		checkGroupSize (groupSize, 2);
		return 2d * (Math.log (groupSize - 1d) + EULER_MASCHERONI + 1d / (2d * (groupSize - 1)));
	}

	/**
	 * Expected mean pairwise divergence, built up by adding one lineage at a time: with k lineages,
	 * the first event merges a given pair with probability p = 2/(k(k-1)).
	 */
	public static double expectedMeanPairwiseDivergence (int groupSize) {
		checkGroupSize (groupSize, 2);
		double expected = 2d;
		for (int counter = 2; counter < groupSize; counter++) {
			double p = 2d / (counter * (counter - 1d));
			expected = p * (2d * p) + (1d - p) * (2d * p + expected);
		}
		return expected;
	}

	private static void checkGroupSize (int groupSize, int minimum) {
		if (groupSize < minimum) throw new NumberIsTooSmallException (groupSize, minimum, true);
	}
}
