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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;

import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import edu.berkeley.coalescence.genealogy.Genealogy;
import edu.berkeley.coalescence.process.CoalescentProcess;
import edu.berkeley.coalescence.utility.RandomSource;

/**
 * Runs independent replicates of the coalescent and summarizes a statistic of their genealogies.
 *
 * Each replicate gets its own randomness, spawned from the master source before any replicate
 * runs, so the summary only depends on the seed and not on the number of threads.
 */
public class ReplicateSampler {

	private final RandomSource masterRandom;
	// null means everything runs in the calling thread
	private final Integer parallelThreads;

	public ReplicateSampler (RandomSource masterRandom, Integer parallelThreads) {
		if (parallelThreads != null && parallelThreads < 1) throw new NotStrictlyPositiveException (parallelThreads);
		this.masterRandom = masterRandom;
		this.parallelThreads = parallelThreads;
	}

	public static class ReplicateTask implements Callable<Double> {
		private final int groupSize;
		private final GenealogyStatistic statistic;
		private final RandomSource replicateRandom;

		public ReplicateTask (int groupSize, GenealogyStatistic statistic, RandomSource replicateRandom) {
			this.groupSize = groupSize;
			this.statistic = statistic;
			this.replicateRandom = replicateRandom;
		}

		public Double call() {
			CoalescentProcess coalescent = new CoalescentProcess (this.groupSize, this.replicateRandom.spawnOffspring());
			Genealogy genealogy = coalescent.sampleGenealogy (this.replicateRandom);
			return this.statistic.evaluate (genealogy);
		}
	}

	public SummaryStatistics sample (int groupSize, int numReplicates, GenealogyStatistic statistic) {
		if (numReplicates < 1) throw new NotStrictlyPositiveException (numReplicates);

		ExecutorService taskExecutor = null;
		if (this.parallelThreads != null) {
			taskExecutor = new ForkJoinPool (this.parallelThreads);
		}

		try {
			List<Future<Double>> replicates = new ArrayList<Future<Double>>(numReplicates);
			for (int r = 0; r < numReplicates; r++) {
				ReplicateTask task = new ReplicateTask (groupSize, statistic, this.masterRandom.spawnOffspring());

				Future<Double> theFuture = null;
				if (taskExecutor != null) {
					theFuture = taskExecutor.submit (task);
				}
				else {
					FutureTask<Double> futureTask = new FutureTask<Double> (task);
					futureTask.run();
					theFuture = futureTask;
				}
				replicates.add (theFuture);
			}

			// collect in submission order
			SummaryStatistics summary = new SummaryStatistics();
			for (Future<Double> f : replicates) {
				try {
					summary.addValue (f.get());
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new RuntimeException ("Interrupted while waiting for a replicate.", e);
				} catch (ExecutionException e) {
					throw new RuntimeException ("A replicate failed.", e.getCause());
				}
			}
			return summary;
		}
		finally {
			if (taskExecutor != null) taskExecutor.shutdownNow();
		}
	}
}
