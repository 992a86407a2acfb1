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
package edu.byu.nlp.hmm.inference;

import com.google.common.base.Preconditions;

import edu.byu.nlp.hmm.Corpora;
import edu.byu.nlp.hmm.HmmParameters;
import edu.byu.nlp.hmm.math.LogMath;

/**
 * Most probable hidden state path (Viterbi path) of an observation sequence.
 * <p>
 * logV[s][t] is the log-probability of the best state path that ends in s at time t and
 * explains o_0..o_t; backPointers[s][t] is the state at t-1 on that path. Ties are broken in
 * favor of the lowest state index.
 */
public class ViterbiDecoder {

  private final HmmParameters params;

  public ViterbiDecoder(HmmParameters params) {
    this.params = Preconditions.checkNotNull(params);
  }

  /**
   * Fills {@code logV} and {@code backPointers} (both S x T, overwritten in place).
   *
   * @return the joint log-probability of the sequence and its best path
   */
  public double fill(int[] sequence, double[][] logV, int[][] backPointers) {
    int numStates = params.getNumStates();
    Corpora.checkSequence(sequence, params.getNumSymbols());
    Lattices.checkShape(logV, numStates, sequence.length, "viterbi lattice");
    Lattices.checkShape(backPointers, numStates, sequence.length, "back pointers");

    double[] logPi = params.logInitialProbs();
    double[][] logA = params.logTransitions();
    double[][] logB = params.logEmissions();
    double[] work = new double[numStates];

    for (int s = 0; s < numStates; s++) {
      logV[s][0] = logPi[s] + logB[s][sequence[0]];
      backPointers[s][0] = 0;
    }
    for (int t = 1; t < sequence.length; t++) {
      for (int s = 0; s < numStates; s++) {
        for (int j = 0; j < numStates; j++) {
          work[j] = logV[j][t - 1] + logA[j][s];
        }
        int best = LogMath.argMax(work);
        backPointers[s][t] = best;
        logV[s][t] = work[best] + logB[s][sequence[t]];
      }
    }
    return logV[LogMath.argMaxColumn(logV, sequence.length - 1)][sequence.length - 1];
  }

  /**
   * Walks the back pointers from the best final state and writes the path into {@code path}.
   */
  public static void bestPath(double[][] logV, int[][] backPointers, int[] path) {
    int length = path.length;
    Preconditions.checkArgument(length > 0, "path must have at least one position");
    Lattices.checkShape(logV, logV.length, length, "viterbi lattice");
    Lattices.checkShape(backPointers, logV.length, length, "back pointers");
    int state = LogMath.argMaxColumn(logV, length - 1);
    for (int t = length - 1; t >= 0; t--) {
      path[t] = state;
      state = backPointers[state][t];
    }
  }

  public static int[] bestPath(double[][] logV, int[][] backPointers) {
    int[] path = new int[logV[0].length];
    bestPath(logV, backPointers, path);
    return path;
  }

  public int[] decode(int[] sequence) {
    int numStates = params.getNumStates();
    double[][] logV = new double[numStates][sequence.length];
    int[][] backPointers = new int[numStates][sequence.length];
    fill(sequence, logV, backPointers);
    return bestPath(logV, backPointers);
  }

  /** One best path per sequence; the lattices are shared across sequences. */
  public int[][] decode(int[][] corpus) {
    int length = Corpora.checkCorpus(corpus, params.getNumSymbols());
    int numStates = params.getNumStates();
    double[][] logV = new double[numStates][length];
    int[][] backPointers = new int[numStates][length];

    int[][] paths = new int[corpus.length][length];
    for (int n = 0; n < corpus.length; n++) {
      fill(corpus[n], logV, backPointers);
      bestPath(logV, backPointers, paths[n]);
    }
    return paths;
  }

}
