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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.exception.NotPositiveException;
import org.apache.commons.math3.exception.OutOfRangeException;

import gnu.trove.list.array.TIntArrayList;

/**
 * Partition of {0,...,n-1} into disjoint sets, which can only get coarser.
 *
 * Union-find with union by size and path compression. In addition, the members of each set
 * are kept in a circular list, and the smallest members of all sets are kept in a sorted list,
 * so that sets can be enumerated. Sets are enumerated in increasing order of their smallest
 * member, and the smallest member is what {@link #find(int)} reports as the representative.
 */
public class Partition {

	// union-find forest
	private final int[] parent;
	// only valid at roots
	private final int[] setSize;
	private final int[] setMinimum;
	// circular list through the members of each set
	private final int[] nextMember;
	// smallest member of each set, ascending
	private final TIntArrayList setMinima;

	/**
	 * All singletons.
	 */
	public Partition (int numElements) {
		if (numElements < 0) throw new NotPositiveException (numElements);

		this.parent = new int[numElements];
		this.setSize = new int[numElements];
		this.setMinimum = new int[numElements];
		this.nextMember = new int[numElements];
		this.setMinima = new TIntArrayList (numElements);

		for (int i = 0; i < numElements; i++) {
			this.parent[i] = i;
			this.setSize[i] = 1;
			this.setMinimum[i] = i;
			this.nextMember[i] = i;
			this.setMinima.add (i);
		}
	}

	// deep-copy constructor, the copy comes out fully path-compressed
	public Partition (Partition other) {
		int numElements = other.size();
		this.parent = new int[numElements];
		for (int i = 0; i < numElements; i++) this.parent[i] = other.findRoot (i);
		this.setSize = Arrays.copyOf (other.setSize, numElements);
		this.setMinimum = Arrays.copyOf (other.setMinimum, numElements);
		this.nextMember = Arrays.copyOf (other.nextMember, numElements);
		this.setMinima = new TIntArrayList (other.setMinima);
	}

	public Partition copy() {
		return new Partition (this);
	}

	/**
	 * Number of elements, not sets.
	 */
	public int size() {
		return this.parent.length;
	}

	public int numberOfSets() {
		return this.setMinima.size();
	}

	/**
	 * The representative of the set containing the element, which is its smallest member.
	 */
	public int find (int element) {
		return this.setMinimum[this.findRoot (element)];
	}

	public boolean sameSet (int first, int second) {
		return this.findRoot (first) == this.findRoot (second);
	}

	public int sizeOfSet (int element) {
		return this.setSize[this.findRoot (element)];
	}

	/**
	 * Merge the sets containing the two elements. Returns the representative of the merged set.
	 */
	public int union (int first, int second) {
		int firstRoot = this.findRoot (first);
		int secondRoot = this.findRoot (second);
		if (firstRoot == secondRoot) return this.setMinimum[firstRoot];

		// hang smaller below larger
		if (this.setSize[firstRoot] < this.setSize[secondRoot]) {
			int tmp = firstRoot;
			firstRoot = secondRoot;
			secondRoot = tmp;
		}
		this.parent[secondRoot] = firstRoot;
		this.setSize[firstRoot] += this.setSize[secondRoot];

		// splice the two circular member lists
		int tmpNext = this.nextMember[firstRoot];
		this.nextMember[firstRoot] = this.nextMember[secondRoot];
		this.nextMember[secondRoot] = tmpNext;

		// the larger minimum no longer names a set
		int keptMinimum = Math.min (this.setMinimum[firstRoot], this.setMinimum[secondRoot]);
		int droppedMinimum = Math.max (this.setMinimum[firstRoot], this.setMinimum[secondRoot]);
		this.setMinimum[firstRoot] = keptMinimum;
		int droppedIdx = this.setMinima.binarySearch (droppedMinimum);
		assert (droppedIdx >= 0);
		this.setMinima.removeAt (droppedIdx);

		return keptMinimum;
	}

	/**
	 * Representative of the set at the given position in the enumeration of all sets.
	 */
	public int representativeOfSet (int setIndex) {
		if (setIndex < 0 || setIndex >= this.numberOfSets()) throw new OutOfRangeException (setIndex, 0, this.numberOfSets() - 1);
		return this.setMinima.get (setIndex);
	}

	/**
	 * Members of the set containing the element, starting with the representative.
	 */
	public int[] membersOfSet (int element) {
		int root = this.findRoot (element);
		int[] members = new int[this.setSize[root]];
		int start = this.setMinimum[root];
		int current = start;
		int idx = 0;
		do {
			members[idx++] = current;
			current = this.nextMember[current];
		} while (current != start);
		assert (idx == members.length);
		return members;
	}

	/**
	 * All sets, in increasing order of their representative.
	 */
	public List<int[]> allSets() {
		List<int[]> sets = new ArrayList<int[]>(this.numberOfSets());
		for (int s = 0; s < this.setMinima.size(); s++) {
			sets.add (this.membersOfSet (this.setMinima.get (s)));
		}
		return sets;
	}

	private int findRoot (int element) {
		if (element < 0 || element >= this.parent.length) throw new OutOfRangeException (element, 0, this.parent.length - 1);
		int root = element;
		while (this.parent[root] != root) root = this.parent[root];
		// compress
		while (this.parent[element] != root) {
			int next = this.parent[element];
			this.parent[element] = root;
			element = next;
		}
		return root;
	}

	// two partitions are equal if they have the same sets, regardless of the internal forest
	public boolean equals (Object o) {
		if (o == null || this.getClass() != o.getClass()) return false;
		Partition other = (Partition) o;
		if (this.size() != other.size() || this.numberOfSets() != other.numberOfSets()) return false;
		for (int i = 0; i < this.size(); i++) {
			if (this.find (i) != other.find (i)) return false;
		}
		return true;
	}

	public int hashCode() {
		int hash = this.size();
		for (int i = 0; i < this.size(); i++) hash = 31 * hash + this.find (i);
		return hash;
	}

	public String toString () {
		StringBuilder builder = new StringBuilder ("[");
		List<int[]> sets = this.allSets();
		for (int s = 0; s < sets.size(); s++) {
			if (s > 0) builder.append (", ");
			int[] sorted = Arrays.copyOf (sets.get(s), sets.get(s).length);
			Arrays.sort (sorted);
			builder.append (Arrays.toString (sorted));
		}
		builder.append ("]");
		return builder.toString();
	}
}
