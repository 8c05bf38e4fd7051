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

import edu.berkeley.coalescence.genealogy.Genealogy;

/**
 * The statistics of a genealogy that can be compared against their expectation.
 */
public enum GenealogyStatistic {

	DEPTH ("Depth") {
		public double evaluate (Genealogy genealogy) {
			return genealogy.depth();
		}

		public double expectation (int groupSize) {
			return TheoreticalMoments.expectedDepth (groupSize);
		}
	},

	LENGTH ("Length") {
		public double evaluate (Genealogy genealogy) {
			return genealogy.length();
		}

		public double expectation (int groupSize) {
			return TheoreticalMoments.approximateExpectedLength (groupSize);
		}
	},

	DIVERGENCE ("Pairwise divergence") {
		public double evaluate (Genealogy genealogy) {
			return genealogy.meanPairwiseDivergence();
		}

		public double expectation (int groupSize) {
			return TheoreticalMoments.expectedMeanPairwiseDivergence (groupSize);
		}
	};

	private final String title;

	private GenealogyStatistic (String title) {
		this.title = title;
	}

	public String getTitle() {
		return this.title;
	}

	public abstract double evaluate (Genealogy genealogy);

	public abstract double expectation (int groupSize);

	// lenient, for the command line
	public static GenealogyStatistic parse (String name) {
		for (GenealogyStatistic statistic : values()) {
			if (statistic.name().equalsIgnoreCase (name.trim())) return statistic;
		}
		throw new IllegalArgumentException ("Unknown statistic: " + name + ". Use one of depth, length, divergence.");
	}
}
