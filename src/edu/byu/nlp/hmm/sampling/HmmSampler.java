/**
 * Copyright 2015 Brigham Young University
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package edu.byu.nlp.hmm.sampling;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

import com.google.common.base.Preconditions;

import edu.byu.nlp.hmm.HmmParameters;

/**
 * Draws synthetic observation sequences (and the hidden states behind them) from the current
 * parameters.
 * <p>
 * Each sequence gets its own generator, seeded from the corpus seed and the index of the
 * sequence, so sequence n of a corpus is the same no matter how many sequences are drawn.
 */
public class HmmSampler {

  private final HmmParameters params;

  public HmmSampler(HmmParameters params) {
    this.params = Preconditions.checkNotNull(params);
  }

  public SampledCorpus sample(int numSequences, int length, long seed) {
    Preconditions.checkArgument(numSequences > 0, "at least one sequence must be sampled: %s", numSequences);
    Preconditions.checkArgument(length > 0, "sequences must have at least one observation: %s", length);

    int[][] observations = new int[numSequences][length];
    int[][] states = new int[numSequences][length];
    for (int n = 0; n < numSequences; n++) {
      sampleSequence(generatorFor(seed, n), observations[n], states[n]);
    }
    return new SampledCorpus(observations, states);
  }

  /**
   * Fills {@code observations} and {@code states} (same length): the first state is drawn from
   * pi, then each step emits a symbol from B[state] and moves to a state drawn from A[state].
   */
  public void sampleSequence(RandomGenerator rnd, int[] observations, int[] states) {
    Preconditions.checkArgument(observations.length == states.length,
        "observations and states must have the same length");
    double[] initialProbs = params.getInitialProbs();
    double[][] transitions = params.getTransitions();
    double[][] emissions = params.getEmissions();

    int state = categorical(rnd, initialProbs);
    for (int t = 0; t < observations.length; t++) {
      states[t] = state;
      observations[t] = categorical(rnd, emissions[state]);
      state = categorical(rnd, transitions[state]);
    }
  }

  static RandomGenerator generatorFor(long seed, int sequenceIndex) {
    return new MersenneTwister(new int[] {(int) seed, (int) (seed >>> 32), sequenceIndex});
  }

  /**
   * Inverse-cdf draw: the first index whose cumulative probability exceeds a uniform draw from
   * [0, 1). Zero-probability indices are never returned, even when the draw lands exactly on a
   * cumulative boundary or rounding leaves it past the final sum.
   */
  static int categorical(RandomGenerator rnd, double[] probabilities) {
    double u = rnd.nextDouble();
    double cumulative = 0;
    int lastPossible = -1;
    for (int i = 0; i < probabilities.length; i++) {
      if (probabilities[i] <= 0) {
        continue;
      }
      cumulative += probabilities[i];
      lastPossible = i;
      if (u < cumulative) {
        return i;
      }
    }
    Preconditions.checkState(lastPossible >= 0, "distribution has no positive entries");
    return lastPossible;
  }

}
