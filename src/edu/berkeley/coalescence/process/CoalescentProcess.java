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


package edu.berkeley.coalescence.process;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.exception.NotPositiveException;

import edu.berkeley.coalescence.genealogy.Genealogy;
import edu.berkeley.coalescence.utility.Partition;
import edu.berkeley.coalescence.utility.RandomSource;

/**
 * The n-coalescent on partitions of {0,...,n-1}. Starts with all singletons, every pair of
 * sets merges at rate one, and the process ends when a single set is left.
 *
 * Not safe for concurrent use; independent instances share nothing.
 */
public class CoalescentProcess {

	private final int groupSize;
	private Partition state;
	private RandomSource random;

	public CoalescentProcess (int groupSize, RandomSource random) {
		if (groupSize < 0) throw new NotPositiveException (groupSize);
		this.groupSize = groupSize;
		this.state = new Partition (groupSize);
		this.random = random;
	}

	// deep-copy constructor, the copy continues with the same randomness independently
	public CoalescentProcess (CoalescentProcess other) {
		this.groupSize = other.groupSize;
		this.state = other.state.copy();
		this.random = other.random.snapshot();
	}

	public int getGroupSize() {
		return this.groupSize;
	}

	public Partition getState() {
		return this.state.copy();
	}

	public void setState (Partition state) {
		assert (state.size() == this.groupSize);
		this.state = state.copy();
	}

	public RandomSource getRandom() {
		return this.random;
	}

	public void setRandom (RandomSource random) {
		this.random = random;
	}

	public boolean isTerminal() {
		return this.state.numberOfSets() <= 1;
	}

	/**
	 * Draw the next transition without applying it. Only the random source advances.
	 *
	 * @return the event, or null if only one set is left
	 */
	public MergeEvent peekNextStep() {
		int numSets = this.state.numberOfSets();
		if (numSets <= 1) return null;

		// time until the first of all pairs merges
		double rate = numSets * (numSets - 1) / 2d;
		double waitingTime = this.random.nextExponential (rate);

		// which pair
		int[] setIndices = this.random.chooseTwo (numSets);
		int firstRepresentative = this.state.representativeOfSet (setIndices[0]);
		int secondRepresentative = this.state.representativeOfSet (setIndices[1]);

		return new MergeEvent (waitingTime, firstRepresentative, secondRepresentative);
	}

	/**
	 * Draw the next transition and apply it.
	 *
	 * @return the event, or null if only one set is left
	 */
	public MergeEvent nextStep() {
		MergeEvent event = this.peekNextStep();
		if (event == null) return null;

		this.state.union (event.getFirstRepresentative(), event.getSecondRepresentative());
		return event;
	}

	/**
	 * Full sample path of a fresh process with this group size, driven by a snapshot of the given
	 * source. The state of this process is not touched; the given source is advanced by exactly
	 * the draws that were used.
	 */
	public List<PathPoint> samplePath (RandomSource externalRandom) {
		CoalescentProcess independent = new CoalescentProcess (this.groupSize, externalRandom.snapshot());
		List<PathPoint> path = independent.runToCompletion();
		externalRandom.commit (independent.random);
		return path;
	}

	/**
	 * Like {@link #samplePath(RandomSource)}, but collected into a genealogy.
	 */
	public Genealogy sampleGenealogy (RandomSource externalRandom) {
		CoalescentProcess independent = new CoalescentProcess (this.groupSize, externalRandom.snapshot());

		List<Partition> path = new ArrayList<Partition>(Math.max (this.groupSize, 1));
		List<int[]> steps = new ArrayList<int[]>(Math.max (this.groupSize - 1, 0));
		double[] timeSteps = new double[Math.max (this.groupSize - 1, 0)];

		path.add (independent.state.copy());
		MergeEvent event;
		while ((event = independent.nextStep()) != null) {
			timeSteps[steps.size()] = event.getWaitingTime();
			steps.add (event.getRepresentatives());
			path.add (independent.state.copy());
		}
		assert (steps.size() == timeSteps.length);

		externalRandom.commit (independent.random);
		return new Genealogy (path, steps, timeSteps);
	}

	/**
	 * Sample path from the current state until one set is left, using the own random source.
	 * The state is restored afterwards, only the random source advances.
	 */
	public List<PathPoint> generateRealization() {
		Partition initialState = this.state.copy();
		List<PathPoint> path = this.runToCompletion();
		this.state = initialState;
		return path;
	}

	private List<PathPoint> runToCompletion() {
		List<PathPoint> path = new ArrayList<PathPoint>();
		path.add (new PathPoint (0d, this.state.copy()));
		MergeEvent event;
		while ((event = this.nextStep()) != null) {
			path.add (new PathPoint (event.getWaitingTime(), this.state.copy()));
		}
		return path;
	}
}
