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

import edu.berkeley.coalescence.utility.Partition;

/// a state on a sample path, with the time waited since the previous one
public class PathPoint {

	public final double waitingTime;
	public final Partition state;

	public PathPoint (double waitingTime, Partition state) {
		this.waitingTime = waitingTime;
		this.state = state;
	}

	public String toString () {
		return "(" + this.waitingTime + ", " + this.state + ")";
	}
}
