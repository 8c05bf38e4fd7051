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

/**
 * One transition of the coalescent: after the waiting time, the sets represented by the two
 * elements merge.
 */
public class MergeEvent {

	private final double waitingTime;
	private final int firstRepresentative;
	private final int secondRepresentative;

	public MergeEvent (double waitingTime, int firstRepresentative, int secondRepresentative) {
		assert (waitingTime >= 0d);
		assert (firstRepresentative != secondRepresentative);
		this.waitingTime = waitingTime;
		this.firstRepresentative = firstRepresentative;
		this.secondRepresentative = secondRepresentative;
	}

	public double getWaitingTime() {
		return this.waitingTime;
	}

	public int getFirstRepresentative() {
		return this.firstRepresentative;
	}

	public int getSecondRepresentative() {
		return this.secondRepresentative;
	}

	public int[] getRepresentatives() {
		return new int[] {this.firstRepresentative, this.secondRepresentative};
	}

	public boolean equals (Object o) {
		if (o == null || this.getClass() != o.getClass()) return false;
		MergeEvent other = (MergeEvent) o;
		return Double.compare (this.waitingTime, other.waitingTime) == 0
				&& this.firstRepresentative == other.firstRepresentative
				&& this.secondRepresentative == other.secondRepresentative;
	}

	public int hashCode() {
		return (Double.hashCode (this.waitingTime) * 0x1f1f1f1f) ^ (31 * this.firstRepresentative + this.secondRepresentative);
	}

	public String toString () {
		return "(" + this.waitingTime + ", [" + this.firstRepresentative + ", " + this.secondRepresentative + "])";
	}
}
