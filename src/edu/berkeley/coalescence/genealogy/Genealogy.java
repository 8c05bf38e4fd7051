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


package edu.berkeley.coalescence.genealogy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.NoDataException;
import org.apache.commons.math3.exception.OutOfRangeException;
import org.apache.commons.math3.exception.util.LocalizedFormats;

import gnu.trove.map.hash.TIntIntHashMap;

import edu.berkeley.coalescence.utility.Partition;
import edu.berkeley.coalescence.utility.SumArray;

/**
 * Genealogy of a group of individuals back to their most recent common ancestor, as realized by
 * one run of the coalescent.
 *
 * <p>Holds the states of the run (starting with all singletons), the pair of representatives
 * merged at each event, and the waiting time before each event. Immutable, apart from the
 * ancestry graph, which is built on first request and then kept.
 */
public class Genealogy {

	// including initial state
	private final List<Partition> path;
	private final int[][] steps;
	// all positive
	private final double[] timeSteps;
	// entry i is the time of event i-1, entry 0 is zero
	private final double[] cumulativeTimes;

	private AncestryGraph graph = null;

	public Genealogy (List<Partition> path, List<int[]> steps, double[] timeSteps) {
		if (path.isEmpty()) throw new NoDataException();
		if (path.size() != steps.size() + 1) throw new DimensionMismatchException (path.size(), steps.size() + 1);
		if (steps.size() != timeSteps.length) throw new DimensionMismatchException (timeSteps.length, steps.size());

		// own copies of everything
		this.path = new ArrayList<Partition>(path.size());
		for (Partition state : path) this.path.add (state.copy());
		this.steps = new int[steps.size()][];
		for (int i = 0; i < steps.size(); i++) {
			assert (steps.get(i).length == 2);
			this.steps[i] = Arrays.copyOf (steps.get(i), 2);
		}
		this.timeSteps = Arrays.copyOf (timeSteps, timeSteps.length);
		this.cumulativeTimes = SumArray.getPrefixSums (this.timeSteps);

		// each state has to be the previous one with the recorded pair merged
		for (int event = 0; event < this.steps.length; event++) {
			Partition before = this.path.get (event);
			int first = this.steps[event][0];
			int second = this.steps[event][1];
			if (first < 0 || first >= before.size() || second < 0 || second >= before.size() || before.sameSet (first, second)) {
				throw new MathIllegalArgumentException (LocalizedFormats.SIMPLE_MESSAGE, "Event " + event + " does not merge two different sets: " + Arrays.toString (this.steps[event]));
			}
			Partition merged = before.copy();
			merged.union (first, second);
			if (!merged.equals (this.path.get (event + 1))) {
				throw new MathIllegalArgumentException (LocalizedFormats.SIMPLE_MESSAGE, "State " + (event + 1) + " is not state " + event + " with " + Arrays.toString (this.steps[event]) + " merged.");
			}
		}

		assert (this.isConsistent());
	}

	private boolean isConsistent() {
		int groupSize = this.getGroupSize();
		for (int i = 0; i < this.path.size(); i++) {
			if (this.path.get(i).size() != groupSize) return false;
			if (this.path.get(i).numberOfSets() != this.path.get(0).numberOfSets() - i) return false;
		}
		for (double timeStep : this.timeSteps) {
			if (!(timeStep >= 0d)) return false;
		}
		return true;
	}

	public int getGroupSize() {
		return this.path.get(0).size();
	}

	public int getNumberOfEvents() {
		return this.steps.length;
	}

	public int getPathLength() {
		return this.path.size();
	}

	public Partition getState (int generation) {
		return this.path.get (generation).copy();
	}

	public int[] getStep (int event) {
		return Arrays.copyOf (this.steps[event], 2);
	}

	public double getTimeStep (int event) {
		return this.timeSteps[event];
	}

	public double[] getTimeSteps() {
		return Arrays.copyOf (this.timeSteps, this.timeSteps.length);
	}

	// time of each event since the start, led by a zero for the initial state
	public double[] getCumulativeTimes() {
		return Arrays.copyOf (this.cumulativeTimes, this.cumulativeTimes.length);
	}

	/**
	 * Time from the start back to the most recent common ancestor of the whole group.
	 */
	public double depth() {
		return SumArray.getSum (this.timeSteps);
	}

	/**
	 * Sum of the lengths of all branches. Before event i there are groupSize - i lineages.
	 */
	public double length() {
		return SumArray.getDecreasingWeightedSum (this.timeSteps, this.getGroupSize());
	}

	/**
	 * Distance between two individuals through their most recent common ancestor.
	 *
	 * To get the mean over all pairs, use {@link #meanPairwiseDivergence()}, which is much faster.
	 */
	public double divergence (int index1, int index2) {
		int groupSize = this.getGroupSize();
		if (index1 < 0 || index1 >= groupSize) throw new OutOfRangeException (index1, 0, groupSize - 1);
		if (index2 < 0 || index2 >= groupSize) throw new OutOfRangeException (index2, 0, groupSize - 1);

		// the path only gets coarser, so search for the first state where they are together
		int low = 0;
		int high = this.path.size() - 1;
		assert (this.path.get (high).sameSet (index1, index2));
		while (low < high) {
			int mid = (low + high) >>> 1;
			if (this.path.get (mid).sameSet (index1, index2)) {
				high = mid;
			}
			else {
				low = mid + 1;
			}
		}

		return 2d * this.cumulativeTimes[low];
	}

	/**
	 * Mean divergence over all pairs of individuals, in one sweep over the events.
	 * NaN if there are fewer than two individuals.
	 */
	public double meanPairwiseDivergence() {
		int groupSize = this.getGroupSize();
		if (groupSize < 2) return Double.NaN;

		double cumulativeTime = 0d;
		double cumulativeDivergence = 0d;

		for (int event = 0; event < this.steps.length; event++) {
			Partition state = this.path.get (event);
			cumulativeTime += this.timeSteps[event];

			// every pair across the two merging sets meets here
			long setSize1 = state.sizeOfSet (this.steps[event][0]);
			long setSize2 = state.sizeOfSet (this.steps[event][1]);
			long numberOfPairs = setSize1 * setSize2;

			cumulativeDivergence += (2d * cumulativeTime) * numberOfPairs;
		}

		return cumulativeDivergence * 2d / ((double) groupSize * (groupSize - 1));
	}

	public synchronized boolean isGraphComputed() {
		return this.graph != null;
	}

	/**
	 * The ancestry graph. Built on the first call, the same instance is returned afterwards.
	 * A single individual gives the lone node (0, 0); an empty group gives an empty graph.
	 */
	public synchronized AncestryGraph getGraph() {
		if (this.graph == null) {
			this.graph = this.computeGraph();
		}
		return this.graph;
	}

	private AncestryGraph computeGraph() {
		int groupSize = this.getGroupSize();
		AncestryGraph newGraph = new AncestryGraph();

		if (this.steps.length == 0) {
			// a single individual is its own ancestor
			if (groupSize > 0) newGraph.addNode (0, 0);
			return newGraph;
		}

		// the leaves
		TIntIntHashMap representativeGeneration = new TIntIntHashMap (groupSize);
		for (int index = 0; index < groupSize; index++) {
			newGraph.addNode (0, index);
			representativeGeneration.put (index, 0);
		}

		// replay the merges
		Partition replayState = new Partition (groupSize);
		for (int generation = 0; generation < this.steps.length; generation++) {
			double timeStep = this.timeSteps[generation];
			int representative1 = replayState.find (this.steps[generation][0]);
			int representative2 = replayState.find (this.steps[generation][1]);
			assert (representative1 != representative2);

			// parent node
			int newRepresentative = Math.min (representative1, representative2);
			int parentNode = newGraph.addNode (generation + 1, newRepresentative);

			// and the two children
			int childNode1 = newGraph.indexOf (representativeGeneration.get (representative1), representative1);
			int childNode2 = newGraph.indexOf (representativeGeneration.get (representative2), representative2);
			assert (childNode1 >= 0 && childNode2 >= 0);
			newGraph.addEdge (parentNode, childNode1, timeStep);
			newGraph.addEdge (parentNode, childNode2, timeStep);

			representativeGeneration.put (newRepresentative, generation + 1);
			replayState.union (representative1, representative2);
		}

		assert (newGraph.getNodeCount() == 2 * groupSize - 1);
		assert (newGraph.getEdgeCount() == 2 * (groupSize - 1));
		return newGraph;
	}

	public String toString () {
		return "Genealogy[groupSize=" + this.getGroupSize() + ", steps=" + Arrays.deepToString (this.steps) + ", timeSteps=" + Arrays.toString (this.timeSteps) + "]";
	}
}
