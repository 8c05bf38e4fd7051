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

package edu.berkeley.coalescence.utility;

public class SumArray {

	public static double getSum(double[] array) {
		double total = 0d;
		for (double d : array) total += d;
		return total;
	}

	// entry i is the sum of the first i entries, so the result is one longer than the array
	public static double[] getPrefixSums(double[] array) {
		double[] prefixSums = new double[array.length + 1];
		for (int i = 0; i < array.length; i++) {
			prefixSums[i + 1] = prefixSums[i] + array[i];
		}
		return prefixSums;
	}

	// sum of (offset - i) * array[i]
	public static double getDecreasingWeightedSum(double[] array, int offset) {
		double total = 0d;
		for (int i = 0; i < array.length; i++) total += (offset - i) * array[i];
		return total;
	}

}
