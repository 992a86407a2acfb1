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
 * The forward algorithm in log space.
 * <p>
 * logAlpha[s][t] = log p(o_0, ..., o_t, state_t = s), so that
 * <pre>
 *   logAlpha[s][0] = log pi[s] + log B[s][o_0]
 *   logAlpha[s][t] = logsumexp_j(logAlpha[j][t-1] + log A[j][s]) + log B[s][o_t]
 * </pre>
 * and the log-likelihood of the sequence is logsumexp_s(logAlpha[s][T-1]).
 * <p>
 * The current log tables are read from the parameters on every call, so an instance stays
 * valid while a trainer replaces the parameters.
 */
public class ForwardAlgorithm {

  private final HmmParameters params;

  public ForwardAlgorithm(HmmParameters params) {
    this.params = Preconditions.checkNotNull(params);
  }

  /**
   * Fills {@code logAlpha} (S x T, overwritten in place) and returns the log-likelihood of the
   * sequence.
   */
  public double logLikelihood(int[] sequence, double[][] logAlpha) {
    int numStates = params.getNumStates();
    Corpora.checkSequence(sequence, params.getNumSymbols());
    Lattices.checkShape(logAlpha, numStates, sequence.length, "forward lattice");

    double[] logPi = params.logInitialProbs();
    double[][] logA = params.logTransitions();
    double[][] logB = params.logEmissions();
    double[] work = new double[numStates];

    for (int s = 0; s < numStates; s++) {
      logAlpha[s][0] = logPi[s] + logB[s][sequence[0]];
    }
    for (int t = 1; t < sequence.length; t++) {
      for (int s = 0; s < numStates; s++) {
        for (int j = 0; j < numStates; j++) {
          work[j] = logAlpha[j][t - 1] + logA[j][s];
        }
        logAlpha[s][t] = LogMath.logSumExp(work) + logB[s][sequence[t]];
      }
    }
    return LogMath.logSumExpColumn(logAlpha, sequence.length - 1);
  }

  public double logLikelihood(int[] sequence) {
    return logLikelihood(sequence, new double[params.getNumStates()][sequence.length]);
  }

  /**
   * Sum of the per-sequence log-likelihoods (sequences are independent). One lattice is shared
   * by all sequences.
   */
  public double logLikelihood(int[][] corpus) {
    int length = Corpora.checkCorpus(corpus, params.getNumSymbols());
    double[][] logAlpha = new double[params.getNumStates()][length];
    double total = 0;
    for (int[] sequence : corpus) {
      total += logLikelihood(sequence, logAlpha);
    }
    return total;
  }

}
