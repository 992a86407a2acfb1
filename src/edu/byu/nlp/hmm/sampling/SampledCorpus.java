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

import com.google.common.base.Preconditions;

/**
 * Observation sequences drawn from an HMM together with the hidden states that produced them.
 * Both arrays are {@code [numSequences][length]}.
 */
public class SampledCorpus {

  private final int[][] observations;
  private final int[][] states;

  public SampledCorpus(int[][] observations, int[][] states) {
    Preconditions.checkNotNull(observations);
    Preconditions.checkNotNull(states);
    Preconditions.checkArgument(observations.length == states.length,
        "observations and states must describe the same number of sequences");
    this.observations = observations;
    this.states = states;
  }

  public int[][] getObservations() {
    return observations;
  }

  public int[][] getStates() {
    return states;
  }

  public int getNumSequences() {
    return observations.length;
  }

}
