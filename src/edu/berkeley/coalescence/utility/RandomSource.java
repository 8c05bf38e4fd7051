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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;

import org.apache.commons.math3.distribution.ExponentialDistribution;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.apache.commons.math3.random.BitsStreamGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Source of randomness for the coalescent. Wraps a commons-math generator, and can be
 * snapshot (copied with its full internal state) so that an independent copy can be
 * advanced and later committed back.
 *
 * A source constructed without a seed is improper: it can be passed around, but any
 * attempt to draw from it fails.
 */
public class RandomSource {

	private BitsStreamGenerator myGenerator;

	public RandomSource (Long seed) {
		if (seed == null) {
			// no seed, so nothing can be drawn from this one
			this.myGenerator = null;
		}
		else {
			this.myGenerator = new Well19937c (seed.longValue());
		}
	}

	public RandomSource (BitsStreamGenerator generator) {
		this.myGenerator = generator;
	}

	public boolean isProper () {
		return (this.myGenerator != null);
	}

	public BitsStreamGenerator getInternalGenerator () {
		if (!this.isProper()) this.fail();
		return this.myGenerator;
	}

	private void fail() {
		throw new IllegalStateException ("The requested sampling involves randomness. Please specify a seed with --seed.");
	}

	/**
	 * An independent source, seeded by a draw from this one. An improper source spawns improper offspring.
	 */
	public RandomSource spawnOffspring() {
		if (this.isProper()) {
			return new RandomSource (Long.valueOf (this.myGenerator.nextLong()));
		}
		else {
			return new RandomSource ((Long) null);
		}
	}

	/**
	 * A copy carrying the exact current state of this source. Drawing from the copy does not advance this source.
	 */
	public RandomSource snapshot() {
		if (!this.isProper()) return new RandomSource ((Long) null);
		return new RandomSource (copyGenerator (this.myGenerator));
	}

	/**
	 * Take over the state of a source that was advanced in place of this one.
	 */
	public void commit (RandomSource advanced) {
		this.myGenerator = advanced.isProper() ? copyGenerator (advanced.myGenerator) : null;
	}

	public double nextDouble() {
		return this.getInternalGenerator().nextDouble();
	}

	public int nextInt(int upper) {
		return this.getInternalGenerator().nextInt(upper);
	}

	public long nextLong() {
		return this.getInternalGenerator().nextLong();
	}

	/**
	 * Exponentially distributed waiting time with the given rate (mean 1/rate).
	 */
	public double nextExponential (double rate) {
		if (!(rate > 0d)) throw new NotStrictlyPositiveException (rate);
		ExponentialDistribution expDist = new ExponentialDistribution (this.getInternalGenerator(), 1d / rate);
		return expDist.sample();
	}

	/**
	 * Two distinct indices out of {0,...,numItems-1}, chosen uniformly without replacement.
	 */
	public int[] chooseTwo (int numItems) {
		if (numItems < 2) throw new NumberIsTooSmallException (numItems, 2, true);
		int first = this.nextInt (numItems);
		int second = this.nextInt (numItems - 1);
		// skip over the first one
		if (second >= first) second++;
		return new int[] {first, second};
	}

	private static BitsStreamGenerator copyGenerator (BitsStreamGenerator generator) {
		try {
			ByteArrayOutputStream byteStream = new ByteArrayOutputStream();
			ObjectOutputStream outStream = new ObjectOutputStream (byteStream);
			outStream.writeObject (generator);
			outStream.close();

			ObjectInputStream inStream = new ObjectInputStream (new ByteArrayInputStream (byteStream.toByteArray()));
			BitsStreamGenerator copy = (BitsStreamGenerator) inStream.readObject();
			inStream.close();
			return copy;
		} catch (IOException e) {
			throw new RuntimeException ("Could not copy the state of the random generator.", e);
		} catch (ClassNotFoundException e) {
			throw new RuntimeException ("Could not copy the state of the random generator.", e);
		}
	}
}
