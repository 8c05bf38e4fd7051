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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.OutOfRangeException;
import org.junit.jupiter.api.Test;

import edu.berkeley.coalescence.process.CoalescentProcess;
import edu.berkeley.coalescence.utility.Partition;
import edu.berkeley.coalescence.utility.RandomSource;

public class GenealogyTest {

	private static Genealogy sample (int groupSize, long seed) {
		CoalescentProcess coalescent = new CoalescentProcess (groupSize, new RandomSource (seed));
		return coalescent.sampleGenealogy (new RandomSource (seed + 1000L));
	}

	// {0,2} merge after 0.5, then {1} joins after another 1.5
	private static Genealogy threeIndividuals() {
		List<Partition> path = new ArrayList<Partition>();
		Partition state = new Partition (3);
		path.add (state.copy());
		state.union (0, 2);
		path.add (state.copy());
		state.union (0, 1);
		path.add (state.copy());

		List<int[]> steps = Arrays.asList (new int[] {0, 2}, new int[] {0, 1});
		return new Genealogy (path, steps, new double[] {0.5, 1.5});
	}

	@Test
	public void statisticsOfKnownGenealogy() {
		Genealogy genealogy = threeIndividuals();

		assertThat (genealogy.getGroupSize()).isEqualTo (3);
		assertThat (genealogy.depth()).isEqualTo (2d);
		assertThat (genealogy.length()).isEqualTo (4.5);
		assertThat (genealogy.divergence (0, 2)).isEqualTo (1d);
		assertThat (genealogy.divergence (0, 1)).isEqualTo (4d);
		assertThat (genealogy.divergence (2, 1)).isEqualTo (4d);
		assertThat (genealogy.divergence (1, 1)).isZero();
		assertThat (genealogy.meanPairwiseDivergence()).isEqualTo (3d);
		assertThat (genealogy.getCumulativeTimes()).containsExactly (0d, 0.5, 2d);
	}

	@Test
	public void graphOfKnownGenealogy() {
		AncestryGraph graph = threeIndividuals().getGraph();

		assertThat (graph.getNodeCount()).isEqualTo (5);
		assertThat (graph.getEdgeCount()).isEqualTo (4);

		int firstParent = graph.indexOf (1, 0);
		int root = graph.indexOf (2, 0);
		assertThat (firstParent).isNotNegative();
		assertThat (root).isNotNegative();
		assertThat (graph.getNeighbors (firstParent)).containsExactlyInAnyOrder (graph.indexOf (0, 0), graph.indexOf (0, 2), root);
		assertThat (graph.getNeighbors (root)).containsExactlyInAnyOrder (firstParent, graph.indexOf (0, 1));
		assertThat (graph.getEdge (0).weight).isEqualTo (0.5);
		assertThat (graph.getEdge (3).weight).isEqualTo (1.5);
		assertThat (graph.getTotalWeight()).isEqualTo (4d);
	}

	@Test
	public void sampledGenealogyHasWellFormedPath() {
		for (int groupSize = 2; groupSize <= 40; groupSize++) {
			Genealogy genealogy = sample (groupSize, groupSize);

			assertThat (genealogy.getPathLength()).isEqualTo (groupSize);
			assertThat (genealogy.getNumberOfEvents()).isEqualTo (groupSize - 1);
			assertThat (genealogy.getTimeSteps()).hasSize (groupSize - 1);
			for (double timeStep : genealogy.getTimeSteps()) assertThat (timeStep).isPositive();

			for (int i = 0; i < groupSize; i++) {
				assertThat (genealogy.getState (i).numberOfSets()).isEqualTo (groupSize - i);
			}
			Partition first = genealogy.getState (0);
			for (int i = 0; i < groupSize; i++) assertThat (first.sizeOfSet (i)).isEqualTo (1);
			assertThat (genealogy.getState (groupSize - 1).sizeOfSet (0)).isEqualTo (groupSize);
		}
	}

	@Test
	public void depthAndLengthAreSumsOverEvents() {
		Genealogy genealogy = sample (25, 3L);
		double[] timeSteps = genealogy.getTimeSteps();

		double depth = 0d;
		double length = 0d;
		for (int i = 0; i < timeSteps.length; i++) {
			depth += timeSteps[i];
			length += (25 - i) * timeSteps[i];
		}

		assertThat (genealogy.depth()).isEqualTo (depth);
		assertThat (genealogy.length()).isEqualTo (length);
	}

	@Test
	public void divergenceIsSymmetricAndZeroOnDiagonal() {
		Genealogy genealogy = sample (15, 9L);

		for (int a = 0; a < 15; a++) {
			assertThat (genealogy.divergence (a, a)).isZero();
			for (int b = 0; b < 15; b++) {
				assertThat (genealogy.divergence (a, b)).isEqualTo (genealogy.divergence (b, a));
			}
		}
	}

	@Test
	public void divergenceIsTwiceTheTimeUntilTheyMeet() {
		Genealogy genealogy = sample (10, 4L);
		double[] timeSteps = genealogy.getTimeSteps();

		for (int a = 0; a < 10; a++) {
			for (int b = a + 1; b < 10; b++) {
				// linear scan
				double time = 0d;
				int generation = 0;
				while (!genealogy.getState (generation).sameSet (a, b)) {
					time += timeSteps[generation];
					generation++;
				}
				assertThat (genealogy.divergence (a, b)).isEqualTo (2d * time);
				assertThat (genealogy.divergence (a, b)).isLessThanOrEqualTo (2d * genealogy.depth());
			}
		}
	}

	@Test
	public void meanPairwiseDivergenceMatchesBruteForce() {
		for (int groupSize = 2; groupSize <= 8; groupSize++) {
			for (long seed = 0; seed < 5; seed++) {
				Genealogy genealogy = sample (groupSize, 100L * groupSize + seed);

				double total = 0d;
				int numPairs = 0;
				for (int a = 0; a < groupSize; a++) {
					for (int b = a + 1; b < groupSize; b++) {
						total += genealogy.divergence (a, b);
						numPairs++;
					}
				}

				assertThat (genealogy.meanPairwiseDivergence()).isCloseTo (total / numPairs, within (1e-9 * Math.max (1d, total)));
			}
		}
	}

	@Test
	public void twoIndividuals() {
		Genealogy genealogy = sample (2, 55L);

		assertThat (genealogy.getNumberOfEvents()).isEqualTo (1);
		double timeStep = genealogy.getTimeStep (0);
		assertThat (timeStep).isPositive();
		assertThat (genealogy.getState (1).numberOfSets()).isEqualTo (1);
		assertThat (genealogy.getState (1).sameSet (0, 1)).isTrue();
		assertThat (genealogy.divergence (0, 1)).isEqualTo (2d * timeStep);
		assertThat (genealogy.meanPairwiseDivergence()).isEqualTo (genealogy.divergence (0, 1));
	}

	@Test
	public void singleIndividual() {
		Genealogy genealogy = sample (1, 2L);

		assertThat (genealogy.getNumberOfEvents()).isZero();
		assertThat (genealogy.depth()).isZero();
		assertThat (genealogy.length()).isZero();
		assertThat (genealogy.divergence (0, 0)).isZero();
		assertThat (genealogy.meanPairwiseDivergence()).isNaN();

		AncestryGraph graph = genealogy.getGraph();
		assertThat (graph.getNodeCount()).isEqualTo (1);
		assertThat (graph.getEdgeCount()).isZero();
		assertThat (graph.getNode (0)).isEqualTo (new AncestryGraph.Node (0, 0));
	}

	@Test
	public void emptyGroup() {
		Genealogy genealogy = sample (0, 2L);

		assertThat (genealogy.getGroupSize()).isZero();
		assertThat (genealogy.depth()).isZero();
		assertThat (genealogy.getGraph().getNodeCount()).isZero();
	}

	@Test
	public void graphHasOneNodePerLeafAndEvent() {
		for (int groupSize = 2; groupSize <= 30; groupSize++) {
			Genealogy genealogy = sample (groupSize, 7L * groupSize);
			AncestryGraph graph = genealogy.getGraph();

			assertThat (graph.getNodeCount()).isEqualTo (2 * groupSize - 1);
			assertThat (graph.getEdgeCount()).isEqualTo (2 * (groupSize - 1));
			assertThat (graph.getTotalWeight()).isCloseTo (2d * genealogy.depth(), within (1e-9));

			// leaves hang below exactly one node, the root has two children
			for (int index = 0; index < groupSize; index++) {
				assertThat (graph.getDegree (graph.indexOf (0, index))).isEqualTo (1);
			}
			int root = graph.indexOf (groupSize - 1, 0);
			assertThat (root).isNotNegative();
			assertThat (graph.getDegree (root)).isEqualTo (2);
		}
	}

	@Test
	public void graphIsComputedOnceOnDemand() {
		Genealogy genealogy = sample (6, 1L);

		assertThat (genealogy.isGraphComputed()).isFalse();
		AncestryGraph graph = genealogy.getGraph();
		assertThat (genealogy.isGraphComputed()).isTrue();
		assertThat (genealogy.getGraph()).isSameAs (graph);
	}

	@Test
	public void cachedGraphCannotBeChangedFromOutside() {
		Genealogy genealogy = sample (4, 3L);
		AncestryGraph graph = genealogy.getGraph();

		for (Method method : AncestryGraph.class.getDeclaredMethods()) {
			if (method.getName().equals ("addNode") || method.getName().equals ("addEdge")) {
				assertThat (Modifier.isPublic (method.getModifiers())).isFalse();
			}
		}
		assertThatThrownBy (() -> graph.getNodes().add (new AncestryGraph.Node (99, 99))).isInstanceOf (UnsupportedOperationException.class);
		assertThatThrownBy (() -> graph.getEdges().clear()).isInstanceOf (UnsupportedOperationException.class);

		assertThat (genealogy.getGraph().getNodeCount()).isEqualTo (7);
		assertThat (genealogy.getGraph().getEdgeCount()).isEqualTo (6);
	}

	@Test
	public void sameSeedsGiveSameGenealogy() {
		Genealogy first = new CoalescentProcess (20, new RandomSource (1L)).sampleGenealogy (new RandomSource (42L));
		Genealogy second = new CoalescentProcess (20, new RandomSource (2L)).sampleGenealogy (new RandomSource (42L));

		assertThat (second.getTimeSteps()).isEqualTo (first.getTimeSteps());
		for (int i = 0; i < 19; i++) {
			assertThat (second.getStep (i)).isEqualTo (first.getStep (i));
		}
		for (int i = 0; i < 20; i++) {
			assertThat (second.getState (i)).isEqualTo (first.getState (i));
		}
	}

	@Test
	public void differentSeedsGiveDifferentGenealogies() {
		Genealogy first = sample (5, 1L);
		Genealogy second = sample (5, 2L);

		assertThat (second.getTimeSteps()).isNotEqualTo (first.getTimeSteps());
	}

	@Test
	public void accessorsReturnCopies() {
		Genealogy genealogy = threeIndividuals();

		genealogy.getTimeSteps()[0] = 100d;
		genealogy.getStep (0)[0] = 1;
		genealogy.getState (0).union (0, 1);

		assertThat (genealogy.getTimeStep (0)).isEqualTo (0.5);
		assertThat (genealogy.getStep (0)).containsExactly (0, 2);
		assertThat (genealogy.getState (0).numberOfSets()).isEqualTo (3);
	}

	@Test
	public void rejectsInconsistentInput() {
		List<Partition> path = Arrays.asList (new Partition (2), new Partition (2));
		List<int[]> steps = Arrays.asList (new int[] {0, 1}, new int[] {0, 1});

		assertThatThrownBy (() -> new Genealogy (path, steps, new double[] {1d, 1d})).isInstanceOf (DimensionMismatchException.class);
		assertThatThrownBy (() -> new Genealogy (path, steps.subList (0, 1), new double[] {1d, 1d})).isInstanceOf (DimensionMismatchException.class);
	}

	@Test
	public void rejectsStepsThatDisagreeWithPath() {
		List<Partition> path = new ArrayList<Partition>();
		Partition state = new Partition (3);
		path.add (state.copy());
		state.union (0, 2);
		path.add (state.copy());
		state.union (0, 1);
		path.add (state.copy());
		double[] timeSteps = new double[] {0.5, 1.5};

		// the path merges {0} and {2} first, not {0} and {1}
		List<int[]> wrongPair = Arrays.asList (new int[] {0, 1}, new int[] {0, 1});
		assertThatThrownBy (() -> new Genealogy (path, wrongPair, timeSteps)).isInstanceOf (MathIllegalArgumentException.class);

		// 0 and 2 are already together before the second event
		List<int[]> alreadyMerged = Arrays.asList (new int[] {0, 2}, new int[] {2, 0});
		assertThatThrownBy (() -> new Genealogy (path, alreadyMerged, timeSteps)).isInstanceOf (MathIllegalArgumentException.class);

		List<int[]> outsideGroup = Arrays.asList (new int[] {0, 2}, new int[] {0, 3});
		assertThatThrownBy (() -> new Genealogy (path, outsideGroup, timeSteps)).isInstanceOf (MathIllegalArgumentException.class);
	}

	@Test
	public void rejectsIndicesOutsideGroup() {
		Genealogy genealogy = threeIndividuals();

		assertThatThrownBy (() -> genealogy.divergence (0, 3)).isInstanceOf (OutOfRangeException.class);
		assertThatThrownBy (() -> genealogy.divergence (-1, 0)).isInstanceOf (OutOfRangeException.class);
	}
}
