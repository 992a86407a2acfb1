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
package edu.byu.nlp.hmm;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Shared fixtures: the two-state, three-symbol toy model and brute-force references that
 * enumerate every hidden state path.
 */
public class TestUtil {

  public static final double[] TOY_PI = new double[] {0.6, 0.4};
  public static final double[][] TOY_A = new double[][] {{0.7, 0.3}, {0.4, 0.6}};
  public static final double[][] TOY_B = new double[][] {{0.1, 0.4, 0.5}, {0.6, 0.3, 0.1}};
  public static final int[] TOY_SEQUENCE = new int[] {0, 1, 2, 0, 1, 2, 0, 1};

  public static HmmParameters toyParameters() {
    return HmmParameters.of(TOY_PI, TOY_A, TOY_B);
  }

  /**
   * Pseudo-random corpus from the linear congruential generator
   * x = (1103515245 x + 12345) mod 2^31, symbol = (x >> 16) mod numSymbols, so that reference
   * values computed elsewhere can use exactly the same data.
   */
  public static int[][] lcgCorpus(long seed, int numSequences, int length, int numSymbols) {
    long x = seed;
    int[][] corpus = new int[numSequences][length];
    for (int n = 0; n < numSequences; n++) {
      for (int t = 0; t < length; t++) {
        x = (x * 1103515245L + 12345L) & 0x7fffffffL;
        corpus[n][t] = (int) ((x >> 16) % numSymbols);
      }
    }
    return corpus;
  }

  /** Random strictly positive distribution rows. */
  public static double[][] randomStochasticMatrix(RandomGenerator rnd, int rows, int cols) {
    double[][] matrix = new double[rows][];
    for (int i = 0; i < rows; i++) {
      matrix[i] = randomDistribution(rnd, cols);
    }
    return matrix;
  }

  public static double[] randomDistribution(RandomGenerator rnd, int size) {
    double[] values = new double[size];
    double sum = 0;
    for (int i = 0; i < size; i++) {
      values[i] = 0.05 + rnd.nextDouble();
      sum += values[i];
    }
    for (int i = 0; i < size; i++) {
      values[i] /= sum;
    }
    return values;
  }

  public static HmmParameters randomParameters(RandomGenerator rnd, int numStates, int numSymbols) {
    return HmmParameters.of(randomDistribution(rnd, numStates),
        randomStochasticMatrix(rnd, numStates, numStates),
        randomStochasticMatrix(rnd, numStates, numSymbols));
  }

  /** p(path, sequence) for one explicit path, in probability space. */
  public static double jointProbability(HmmParameters params, int[] path, int[] sequence) {
    double[] pi = params.getInitialProbs();
    double[][] a = params.getTransitions();
    double[][] b = params.getEmissions();
    double p = pi[path[0]] * b[path[0]][sequence[0]];
    for (int t = 1; t < sequence.length; t++) {
      p *= a[path[t - 1]][path[t]] * b[path[t]][sequence[t]];
    }
    return p;
  }

  /** log sum over all S^T paths of p(path, sequence). */
  public static double bruteForceLogLikelihood(HmmParameters params, int[] sequence) {
    double total = 0;
    int[] path = new int[sequence.length];
    do {
      total += jointProbability(params, path, sequence);
    } while (nextPath(path, params.getNumStates()));
    return Math.log(total);
  }

  /** argmax over all S^T paths of p(path, sequence); the first path found wins ties. */
  public static int[] bruteForceBestPath(HmmParameters params, int[] sequence) {
    int[] path = new int[sequence.length];
    int[] best = path.clone();
    double bestProbability = -1;
    do {
      double p = jointProbability(params, path, sequence);
      if (p > bestProbability) {
        bestProbability = p;
        best = path.clone();
      }
    } while (nextPath(path, params.getNumStates()));
    return best;
  }

  /** Odometer-style increment; returns false once every path has been visited. */
  private static boolean nextPath(int[] path, int numStates) {
    for (int t = path.length - 1; t >= 0; t--) {
      path[t]++;
      if (path[t] < numStates) {
        return true;
      }
      path[t] = 0;
    }
    return false;
  }

}
