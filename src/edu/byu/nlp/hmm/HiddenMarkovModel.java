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

import edu.byu.nlp.hmm.em.BaumWelchTrainer;
import edu.byu.nlp.hmm.em.TrainingSpecification;
import edu.byu.nlp.hmm.inference.ForwardAlgorithm;
import edu.byu.nlp.hmm.inference.ViterbiDecoder;
import edu.byu.nlp.hmm.sampling.HmmSampler;
import edu.byu.nlp.hmm.sampling.SampledCorpus;

/**
 * A discrete-output hidden Markov model with S hidden states and K observable symbols.
 * <p>
 * Corpora are rectangular {@code int[numSequences][length]} arrays of symbols in [0, K).
 * Likelihoods over a corpus are products over its (independent) sequences.
 */
public class HiddenMarkovModel {

  public static final int DEFAULT_NUM_ITERATIONS = 10;

  private final HmmParameters params;
  private final int numIterations;
  private final ForwardAlgorithm forward;
  private final ViterbiDecoder decoder;
  private final HmmSampler sampler;

  public HiddenMarkovModel(double[] initialProbs, double[][] transitions, double[][] emissions) {
    this(initialProbs, transitions, emissions, DEFAULT_NUM_ITERATIONS);
  }

  /**
   * @param numIterations the number of Baum-Welch iterations run by {@link #em(int[][])}
   * @throws IllegalArgumentException if the tables disagree on the number of hidden states
   * @throws InvalidDistributionException if a row of the tables is not a distribution
   */
  public HiddenMarkovModel(double[] initialProbs, double[][] transitions, double[][] emissions, int numIterations) {
    this(HmmParameters.of(initialProbs, transitions, emissions), numIterations);
  }

  public HiddenMarkovModel(HmmParameters params, int numIterations) {
    Preconditions.checkArgument(numIterations >= 0, "the number of iterations must be non-negative: %s", numIterations);
    this.params = Preconditions.checkNotNull(params);
    this.numIterations = numIterations;
    this.forward = new ForwardAlgorithm(params);
    this.decoder = new ViterbiDecoder(params);
    this.sampler = new HmmSampler(params);
  }

  public HmmParameters getParameters() {
    return params;
  }

  public int getNumIterations() {
    return numIterations;
  }

  public int getNumStates() {
    return params.getNumStates();
  }

  public int getNumSymbols() {
    return params.getNumSymbols();
  }

  /** p(corpus); underflows to 0 for all but tiny corpora, prefer {@link #logLikelihood}. */
  public double likelihood(int[][] corpus) {
    return Math.exp(logLikelihood(corpus));
  }

  public double logLikelihood(int[][] corpus) {
    return forward.logLikelihood(corpus);
  }

  /** The Viterbi path of every sequence. */
  public int[][] decode(int[][] corpus) {
    return decoder.decode(corpus);
  }

  /** Runs Baum-Welch for the number of iterations given at construction. */
  public void em(int[][] corpus) {
    em(corpus, numIterations);
  }

  public void em(int[][] corpus, int numIterations) {
    em(corpus, new TrainingSpecification(numIterations, false));
  }

  /** Re-estimates pi, A and B in place. */
  public void em(int[][] corpus, TrainingSpecification spec) {
    new BaumWelchTrainer(params, spec).train(corpus);
  }

  public SampledCorpus sample(int numSequences, int length, long seed) {
    return sampler.sample(numSequences, length, seed);
  }

}
