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
package edu.byu.nlp.hmm.em;

import java.util.Arrays;

import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.MathArrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import edu.byu.nlp.hmm.Corpora;
import edu.byu.nlp.hmm.DistributionValidator;
import edu.byu.nlp.hmm.HmmParameters;
import edu.byu.nlp.hmm.inference.BackwardAlgorithm;
import edu.byu.nlp.hmm.inference.ForwardAlgorithm;
import edu.byu.nlp.hmm.inference.Lattices;

/**
 * Baum-Welch (EM) re-estimation of pi, A and B from a corpus of equal-length sequences.
 * <p>
 * Each iteration resets the expected-count accumulators, runs forward/backward on every
 * sequence to get the posteriors
 * <pre>
 *   logXi[i][j][t]  = log p(state_t = i, state_t+1 = j | o)
 *   logGamma[i][t]  = log p(state_t = i | o)
 * </pre>
 * adds them (as probabilities) to the accumulators, and finally normalizes the accumulators
 * into new parameters, which replace all three tables at once. The number of iterations is
 * fixed; the trainer never stops early, not even when the likelihood stops improving.
 * <p>
 * Instances reuse their lattices between sequences and are not thread-safe.
 */
public class BaumWelchTrainer {

  private static final Logger logger = LoggerFactory.getLogger(BaumWelchTrainer.class);

  private final HmmParameters params;
  private final TrainingSpecification spec;
  private final ForwardAlgorithm forward;
  private final BackwardAlgorithm backward;

  public BaumWelchTrainer(HmmParameters params, TrainingSpecification spec) {
    this.params = Preconditions.checkNotNull(params);
    this.spec = Preconditions.checkNotNull(spec);
    this.forward = new ForwardAlgorithm(params);
    this.backward = new BackwardAlgorithm(params);
  }

  /**
   * Runs {@code spec.getNumIterations()} iterations, updating the parameters in place.
   */
  public void train(int[][] corpus) {
    int length = Corpora.checkCorpus(corpus, params.getNumSymbols());
    logger.info("Running Baum-Welch " + spec + " on " + corpus.length + " sequences of length " + length);
    Workspace workspace = new Workspace(params.getNumStates(), params.getNumSymbols(), length);

    double previousValue = Double.NEGATIVE_INFINITY;
    for (int iteration = 0; iteration < spec.getNumIterations(); iteration++) {
      double value = iterate(corpus, workspace);
      logger.info(iteration + " log-likelihood " + value + " (improvement of " + (value - previousValue) + ")");
      if (value < previousValue - spec.getTolerance() * Math.max(1.0, Math.abs(previousValue))) {
        logger.warn(iteration + " log-likelihood decreased from " + previousValue + " to " + value);
      }
      previousValue = value;
    }
    if (spec.getNumIterations() > 0) {
      logger.info("Finished Baum-Welch; corpus log-likelihood " + forward.logLikelihood(corpus));
    }
  }

  /**
   * One E-step and M-step over the corpus.
   *
   * @return the corpus log-likelihood under the parameters in place before the update
   */
  public double iterate(int[][] corpus) {
    int length = Corpora.checkCorpus(corpus, params.getNumSymbols());
    return iterate(corpus, new Workspace(params.getNumStates(), params.getNumSymbols(), length));
  }

  private double iterate(int[][] corpus, Workspace workspace) {
    workspace.reset();

    double logLikelihood = 0;
    for (int n = 0; n < corpus.length; n++) {
      double sequenceLogLikelihood = computePosteriors(corpus[n], workspace.logAlpha, workspace.logBeta,
          workspace.logXi, workspace.logGamma);
      if (spec.getEnableSanityChecks()) {
        checkPosteriors(workspace.logXi, workspace.logGamma, spec.getTolerance());
      }
      accumulate(corpus[n], workspace);
      logLikelihood += sequenceLogLikelihood;
      logger.debug("sequence " + n + " log-likelihood " + sequenceLogLikelihood);
    }

    maximize(workspace);
    if (spec.getEnableSanityChecks()) {
      params.validate();
    }
    return logLikelihood;
  }

  /**
   * Runs forward/backward on one sequence and fills the posterior tables.
   *
   * @param logAlpha S x T forward lattice (overwritten)
   * @param logBeta S x T backward lattice (overwritten)
   * @param logXi S x S x (T-1) transition posteriors (overwritten)
   * @param logGamma S x T state posteriors (overwritten)
   * @return the log-likelihood of the sequence
   */
  public double computePosteriors(int[] sequence, double[][] logAlpha, double[][] logBeta,
      double[][][] logXi, double[][] logGamma) {
    int numStates = params.getNumStates();
    int length = sequence.length;
    Lattices.checkShape(logGamma, numStates, length, "state posteriors");
    Preconditions.checkArgument(logXi.length == numStates, "transition posteriors must have %s rows", numStates);
    for (int i = 0; i < numStates; i++) {
      Lattices.checkShape(logXi[i], numStates, length - 1, "transition posteriors from state " + i);
    }

    double logLikelihood = forward.logLikelihood(sequence, logAlpha);
    backward.fill(sequence, logBeta);

    double[][] logA = params.logTransitions();
    double[][] logB = params.logEmissions();
    for (int t = 0; t < length - 1; t++) {
      int next = sequence[t + 1];
      for (int i = 0; i < numStates; i++) {
        for (int j = 0; j < numStates; j++) {
          logXi[i][j][t] = logAlpha[i][t] + logA[i][j] + logB[j][next] + logBeta[j][t + 1] - logLikelihood;
        }
      }
    }
    for (int s = 0; s < numStates; s++) {
      for (int t = 0; t < length; t++) {
        logGamma[s][t] = logAlpha[s][t] + logBeta[s][t] - logLikelihood;
      }
    }
    return logLikelihood;
  }

  /**
   * Verifies that the transition posteriors sum to one at every t, that the state posteriors
   * sum to one at every t, and that summing the transition posteriors over the next state gives
   * the state posteriors.
   */
  static void checkPosteriors(double[][][] logXi, double[][] logGamma, double tolerance) {
    int numStates = logGamma.length;
    int length = logGamma[0].length;

    double[] xi = new double[numStates * numStates];
    double[] gamma = new double[numStates];
    for (int t = 0; t < length - 1; t++) {
      for (int i = 0; i < numStates; i++) {
        double rowSum = 0;
        for (int j = 0; j < numStates; j++) {
          xi[i * numStates + j] = FastMath.exp(logXi[i][j][t]);
          rowSum += xi[i * numStates + j];
        }
        double expected = FastMath.exp(logGamma[i][t]);
        if (!(Math.abs(rowSum - expected) <= tolerance)) {
          throw new IllegalStateException("transition posteriors from state " + i + " at t=" + t + " sum to "
              + rowSum + " but the state posterior is " + expected);
        }
      }
      DistributionValidator.checkSumsToOne(xi, "transition posteriors at t=" + t, tolerance);
    }
    for (int t = 0; t < length; t++) {
      for (int s = 0; s < numStates; s++) {
        gamma[s] = FastMath.exp(logGamma[s][t]);
      }
      DistributionValidator.checkSumsToOne(gamma, "state posteriors at t=" + t, tolerance);
    }
  }

  private static void accumulate(int[] sequence, Workspace workspace) {
    int numStates = workspace.initialCounts.length;
    for (int s = 0; s < numStates; s++) {
      workspace.initialCounts[s] += FastMath.exp(workspace.logGamma[s][0]);
    }
    for (int i = 0; i < numStates; i++) {
      for (int j = 0; j < numStates; j++) {
        double[] logXiIJ = workspace.logXi[i][j];
        for (int t = 0; t < logXiIJ.length; t++) {
          workspace.transitionCounts[i][j] += FastMath.exp(logXiIJ[t]);
        }
      }
    }
    for (int t = 0; t < sequence.length; t++) {
      for (int s = 0; s < numStates; s++) {
        workspace.emissionCounts[s][sequence[t]] += FastMath.exp(workspace.logGamma[s][t]);
      }
    }
  }

  /**
   * Normalizes the accumulators and swaps them in. Nothing is replaced if any row is degenerate.
   */
  private void maximize(Workspace workspace) {
    double[] initialProbs = normalize(workspace.initialCounts, "initial state", 0);
    double[][] transitions = new double[workspace.transitionCounts.length][];
    for (int i = 0; i < transitions.length; i++) {
      transitions[i] = normalize(workspace.transitionCounts[i], "transition", i);
    }
    double[][] emissions = new double[workspace.emissionCounts.length][];
    for (int s = 0; s < emissions.length; s++) {
      emissions[s] = normalize(workspace.emissionCounts[s], "emission", s);
    }
    params.replaceAll(initialProbs, transitions, emissions);
  }

  private static double[] normalize(double[] counts, String tableName, int row) {
    double sum = 0;
    for (double count : counts) {
      sum += count;
    }
    if (sum == 0 || Double.isNaN(sum) || Double.isInfinite(sum)) {
      throw new DegenerateStatisticsException(tableName, row, sum);
    }
    return MathArrays.normalizeArray(counts, 1.0);
  }

  /** Buffers shared by all sequences (and iterations) of one training run. */
  private static class Workspace {
    private final double[][] logAlpha;
    private final double[][] logBeta;
    private final double[][][] logXi;
    private final double[][] logGamma;
    private final double[] initialCounts;
    private final double[][] transitionCounts;
    private final double[][] emissionCounts;

    private Workspace(int numStates, int numSymbols, int length) {
      logAlpha = new double[numStates][length];
      logBeta = new double[numStates][length];
      logXi = new double[numStates][numStates][length - 1];
      logGamma = new double[numStates][length];
      initialCounts = new double[numStates];
      transitionCounts = new double[numStates][numStates];
      emissionCounts = new double[numStates][numSymbols];
    }

    private void reset() {
      Arrays.fill(initialCounts, 0);
      for (double[] row : transitionCounts) {
        Arrays.fill(row, 0);
      }
      for (double[] row : emissionCounts) {
        Arrays.fill(row, 0);
      }
    }
  }

}
