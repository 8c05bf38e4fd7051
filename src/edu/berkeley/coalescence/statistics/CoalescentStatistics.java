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

import java.io.PrintStream;
import java.util.List;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Parameter;
import com.martiansoftware.jsap.SimpleJSAP;

import edu.berkeley.coalescence.process.CoalescentProcess;
import edu.berkeley.coalescence.process.PathPoint;
import edu.berkeley.coalescence.utility.RandomSource;

/**
 * Compares simulated genealogy statistics against their expectation, for group sizes 2, 4, ..., 2^maxPower.
 * Alternatively prints the number of lineages over time along one sample path.
 */
public class CoalescentStatistics {

	public static void main (String[] args) throws JSAPException {

		// print out the command line arguments
		PrintStream outStream = System.out;
		outStream.print("# Command-line arguments: ");
		for (String arg: args)	{
			outStream.print(arg + " ");
		}
		outStream.print("\n");

		Parameter[] params = new Parameter[] {
				new FlaggedOption ("seed", JSAP.LONG_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "seed",
						"The seed to initialize the randomness."),
				new FlaggedOption ("statistic", JSAP.STRING_PARSER, "divergence", JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "statistic",
						"Which statistic to compare: depth, length or divergence."),
				new FlaggedOption ("maxPower", JSAP.INTEGER_PARSER, "10", JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "maxPower",
						"Group sizes are the powers of two up to 2^maxPower."),
				new FlaggedOption ("samples", JSAP.INTEGER_PARSER, "1000", JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "samples",
						"Number of independent genealogies for each group size."),
				new FlaggedOption ("parallel", JSAP.INTEGER_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "parallel",
						"Specifies number of parallel threads."),
				new FlaggedOption ("trajectory", JSAP.INTEGER_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "trajectory",
						"Instead of comparing, print the number of lineages over time for one path of the given group size.")
		};

		SimpleJSAP jsap = new SimpleJSAP (
				"CoalescentStatistics",
				"Compares statistics of simulated coalescent genealogies with their expectation",
				params);

		JSAPResult jsapParams = jsap.parse (args);
		if (jsap.messagePrinted()) { System.exit(1); }

		// the randomness
		Long seed = null;
		if (jsapParams.contains ("seed")) {
			seed = Long.valueOf (jsapParams.getLong ("seed"));
		}
		RandomSource random = new RandomSource (seed);
		if (!random.isProper()) {
			System.err.println ("Sampling genealogies involves randomness. Please specify a seed with --seed.");
			System.exit(1);
		}

		if (jsapParams.contains ("trajectory")) {
			int groupSize = jsapParams.getInt ("trajectory");
			if (groupSize < 1) {
				System.err.println ("Need a positive group size for the trajectory (Not " + groupSize + ").");
				System.exit(-1);
			}
			printTrajectory (groupSize, random, outStream);
			return;
		}

		GenealogyStatistic statistic = null;
		try {
			statistic = GenealogyStatistic.parse (jsapParams.getString ("statistic"));
		} catch (IllegalArgumentException e) {
			System.err.println (e.getMessage());
			System.exit(-1);
		}

		int maxPower = jsapParams.getInt ("maxPower");
		int samples = jsapParams.getInt ("samples");
		if (maxPower < 1 || maxPower > 30 || samples < 1) {
			System.err.println ("Need 1 <= maxPower <= 30 and a positive number of samples.");
			System.exit(-1);
		}

		// default is no parallel
		Integer parallelThreads = null;
		if (jsapParams.contains ("parallel")) {
			parallelThreads = jsapParams.getInt ("parallel");
			if (parallelThreads < 1) {
				System.err.println ("Need a positive number of parallel threads (Not " + parallelThreads + ").");
				System.exit(-1);
			}
		}

		outStream.println ("# seed = " + seed);
		outStream.println ("# parallel threads = " + parallelThreads);

		try {
			compare (statistic, maxPower, samples, parallelThreads, random, outStream);
		} catch (RuntimeException e) {
			System.err.println ("Exception while sampling genealogies:");
			e.printStackTrace (System.err);
			System.exit(-1);
		}
	}

	public static void compare (GenealogyStatistic statistic, int maxPower, int samples, Integer parallelThreads, RandomSource random, PrintStream outStream) {
		outStream.println ("# " + statistic.getTitle() + ": empirical mean vs expectation");
		outStream.println ("groupSize\tempirical\ttheoretical\tstandardError");

		ReplicateSampler sampler = new ReplicateSampler (random, parallelThreads);
		for (int power = 1; power <= maxPower; power++) {
			int groupSize = 1 << power;
			SummaryStatistics summary = sampler.sample (groupSize, samples, statistic);
			double standardError = summary.getStandardDeviation() / Math.sqrt (summary.getN());
			outStream.println (groupSize + "\t" + summary.getMean() + "\t" + statistic.expectation (groupSize) + "\t" + standardError);
		}
	}

	// one line per state: time since the start and number of lineages
	public static void printTrajectory (int groupSize, RandomSource random, PrintStream outStream) {
		CoalescentProcess coalescent = new CoalescentProcess (groupSize, random.spawnOffspring());
		List<PathPoint> path = coalescent.samplePath (random);

		outStream.println ("# Group size of coalescent process");
		outStream.println ("time\tsize");
		double time = 0d;
		for (PathPoint point : path) {
			time += point.waitingTime;
			outStream.println (time + "\t" + point.state.numberOfSets());
		}
	}
}
