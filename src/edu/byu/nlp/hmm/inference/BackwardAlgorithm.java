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
 * The backward algorithm in log space: logBeta[s][t] = log p(o_t+1, ..., o_T-1 | state_t = s).
 * <pre>
 *   logBeta[s][T-1] = 0
 *   logBeta[s][t]   = logsumexp_j(log A[s][j] + log B[j][o_t+1] + logBeta[j][t+1])
 * </pre>
 */
public class BackwardAlgorithm {

  private final HmmParameters params;

  public BackwardAlgorithm(HmmParameters params) {
    this.params = Preconditions.checkNotNull(params);
  }

  /** Fills {@code logBeta} (S x T, overwritten in place). */
  public void fill(int[] sequence, double[][] logBeta) {
    int numStates = params.getNumStates();
    Corpora.checkSequence(sequence, params.getNumSymbols());
    Lattices.checkShape(logBeta, numStates, sequence.length, "backward lattice");

    double[][] logA = params.logTransitions();
    double[][] logB = params.logEmissions();
    double[] work = new double[numStates];

    int last = sequence.length - 1;
    for (int s = 0; s < numStates; s++) {
      logBeta[s][last] = 0;
    }
    for (int t = last - 1; t >= 0; t--) {
      int next = sequence[t + 1];
      for (int s = 0; s < numStates; s++) {
        for (int j = 0; j < numStates; j++) {
          work[j] = logA[s][j] + logB[j][next] + logBeta[j][t + 1];
        }
        logBeta[s][t] = LogMath.logSumExp(work);
      }
    }
  }

}
