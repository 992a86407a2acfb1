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

import edu.byu.nlp.hmm.math.LogMath;

/**
 * The three probability tables of a discrete HMM (initial-state distribution pi, transition
 * matrix A and emission matrix B), each paired with its elementwise natural log.
 * <p>
 * The number of states S and symbols K are fixed when the parameters are created. Tables are
 * only ever swapped as a whole through the {@code replace*} methods, which validate the new
 * table against S and K and recompute the matching log table before returning. The log
 * accessors hand out the internal arrays for the inner loops of the dynamic programs; callers
 * must treat them as read-only.
 */
public class HmmParameters {

  private final int numStates;
  private final int numSymbols;
  private final double tolerance;

  private double[] initialProbs;
  private double[] logInitialProbs;
  private double[][] transitions;
  private double[][] logTransitions;
  private double[][] emissions;
  private double[][] logEmissions;

  private HmmParameters(int numStates, int numSymbols, double tolerance) {
    this.numStates = numStates;
    this.numSymbols = numSymbols;
    this.tolerance = tolerance;
  }

  public static HmmParameters of(double[] initialProbs, double[][] transitions, double[][] emissions) {
    return of(initialProbs, transitions, emissions, DistributionValidator.DEFAULT_TOLERANCE);
  }

  /**
   * Copies and validates the given tables.
   *
   * @throws IllegalArgumentException if the tables disagree on the number of hidden states or
   *     a matrix is ragged or empty
   * @throws InvalidDistributionException if a row is not a probability distribution
   */
  public static HmmParameters of(double[] initialProbs, double[][] transitions, double[][] emissions,
      double tolerance) {
    Preconditions.checkNotNull(initialProbs, "initial probabilities are required");
    Preconditions.checkNotNull(transitions, "transitions are required");
    Preconditions.checkNotNull(emissions, "emissions are required");
    Preconditions.checkArgument(initialProbs.length > 0, "at least one hidden state is required");
    Preconditions.checkArgument(
        initialProbs.length == transitions.length && transitions.length == emissions.length,
        "inconsistent number of hidden states (initial=%s, transitions=%s, emissions=%s)",
        initialProbs.length, transitions.length, emissions.length);
    Preconditions.checkArgument(emissions[0] != null && emissions[0].length > 0,
        "at least one observable symbol is required");

    HmmParameters params = new HmmParameters(initialProbs.length, emissions[0].length, tolerance);
    params.replaceAll(initialProbs, transitions, emissions);
    return params;
  }

  public int getNumStates() {
    return numStates;
  }

  public int getNumSymbols() {
    return numSymbols;
  }

  /** A copy of pi. */
  public double[] getInitialProbs() {
    return initialProbs.clone();
  }

  /** A copy of A. */
  public double[][] getTransitions() {
    return copyOf(transitions);
  }

  /** A copy of B. */
  public double[][] getEmissions() {
    return copyOf(emissions);
  }

  /** A copy of log(pi); entries with probability 0 are {@code -Infinity}. */
  public double[] logInitialProbs() {
    return logInitialProbs.clone();
  }

  /** A copy of log(A). */
  public double[][] logTransitions() {
    return copyOf(logTransitions);
  }

  /** A copy of log(B). */
  public double[][] logEmissions() {
    return copyOf(logEmissions);
  }

  public void replaceInitialProbs(double[] initialProbs) {
    checkInitialProbs(initialProbs);
    swapInitialProbs(initialProbs.clone());
  }

  public void replaceTransitions(double[][] transitions) {
    checkTransitions(transitions);
    swapTransitions(copyOf(transitions));
  }

  public void replaceEmissions(double[][] emissions) {
    checkEmissions(emissions);
    swapEmissions(copyOf(emissions));
  }

  /**
   * Validates all three tables before touching any of them, so a failure leaves the current
   * parameters intact.
   */
  public void replaceAll(double[] initialProbs, double[][] transitions, double[][] emissions) {
    checkInitialProbs(initialProbs);
    checkTransitions(transitions);
    checkEmissions(emissions);
    swapInitialProbs(initialProbs.clone());
    swapTransitions(copyOf(transitions));
    swapEmissions(copyOf(emissions));
  }

  /** Re-runs distribution validation on the tables currently held. */
  public void validate() {
    DistributionValidator.checkSumsToOne(initialProbs, "initial probabilities", tolerance);
    DistributionValidator.checkRowsSumToOne(transitions, "transitions", tolerance);
    DistributionValidator.checkRowsSumToOne(emissions, "emissions", tolerance);
  }

  public HmmParameters copy() {
    return of(initialProbs, transitions, emissions, tolerance);
  }

  private void swapInitialProbs(double[] newInitialProbs) {
    initialProbs = newInitialProbs;
    logInitialProbs = LogMath.log(newInitialProbs);
  }

  private void swapTransitions(double[][] newTransitions) {
    transitions = newTransitions;
    logTransitions = LogMath.log(newTransitions);
  }

  private void swapEmissions(double[][] newEmissions) {
    emissions = newEmissions;
    logEmissions = LogMath.log(newEmissions);
  }

  private void checkInitialProbs(double[] values) {
    Preconditions.checkNotNull(values, "initial probabilities are required");
    Preconditions.checkArgument(values.length == numStates,
        "expected %s initial probabilities but got %s", numStates, values.length);
    DistributionValidator.checkSumsToOne(values, "initial probabilities", tolerance);
  }

  private void checkTransitions(double[][] values) {
    checkShape(values, numStates, numStates, "transitions");
    DistributionValidator.checkRowsSumToOne(values, "transitions", tolerance);
  }

  private void checkEmissions(double[][] values) {
    checkShape(values, numStates, numSymbols, "emissions");
    DistributionValidator.checkRowsSumToOne(values, "emissions", tolerance);
  }

  private static void checkShape(double[][] matrix, int rows, int cols, String name) {
    Preconditions.checkNotNull(matrix, "%s are required", name);
    Preconditions.checkArgument(matrix.length == rows, "expected %s rows of %s but got %s", rows, name, matrix.length);
    for (int i = 0; i < matrix.length; i++) {
      Preconditions.checkArgument(matrix[i] != null && matrix[i].length == cols,
          "expected row %s of %s to have %s columns", i, name, cols);
    }
  }

  private static double[][] copyOf(double[][] matrix) {
    double[][] copy = new double[matrix.length][];
    for (int i = 0; i < matrix.length; i++) {
      copy[i] = matrix[i].clone();
    }
    return copy;
  }

}
