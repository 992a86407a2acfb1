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

import com.google.common.base.Preconditions;

/**
 * Checks on observation sequences and corpora. A corpus is a non-empty rectangular
 * {@code int[numSequences][length]} array of symbol indices.
 */
public class Corpora {

  private Corpora() {}

  /**
   * @throws IllegalArgumentException if the sequence is empty or contains a symbol outside
   *     [0, numSymbols)
   */
  public static void checkSequence(int[] sequence, int numSymbols) {
    Preconditions.checkNotNull(sequence, "sequence is null");
    Preconditions.checkArgument(sequence.length > 0, "sequences must contain at least one observation");
    for (int t = 0; t < sequence.length; t++) {
      Preconditions.checkArgument(sequence[t] >= 0 && sequence[t] < numSymbols,
          "symbol %s at position %s is outside [0, %s)", sequence[t], t, numSymbols);
    }
  }

  /**
   * @return the common sequence length
   * @throws IllegalArgumentException if the corpus is empty, ragged or contains an invalid symbol
   */
  public static int checkCorpus(int[][] corpus, int numSymbols) {
    Preconditions.checkNotNull(corpus, "corpus is null");
    Preconditions.checkArgument(corpus.length > 0, "corpus must contain at least one sequence");
    Preconditions.checkNotNull(corpus[0], "sequence 0 is null");
    int length = corpus[0].length;
    for (int n = 0; n < corpus.length; n++) {
      Preconditions.checkNotNull(corpus[n], "sequence %s is null", n);
      Preconditions.checkArgument(corpus[n].length == length,
          "all sequences must have the same length (sequence %s has length %s, expected %s)",
          n, corpus[n].length, length);
      checkSequence(corpus[n], numSymbols);
    }
    return length;
  }

}
