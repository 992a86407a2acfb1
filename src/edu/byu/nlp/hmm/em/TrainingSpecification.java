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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import edu.byu.nlp.hmm.DistributionValidator;

/**
 * Settings for a Baum-Welch run.
 * <p>
 * Training always runs exactly {@code numIterations} iterations; there is no convergence test.
 * {@code enableSanityChecks} turns on the (slow) per-sequence posterior consistency checks,
 * which are meant for debugging and tests.
 */
public class TrainingSpecification {

  private final int numIterations;
  private final boolean enableSanityChecks;
  private final double tolerance;

  public TrainingSpecification(int numIterations, boolean enableSanityChecks) {
    this(numIterations, enableSanityChecks, DistributionValidator.DEFAULT_TOLERANCE);
  }

  public TrainingSpecification(int numIterations, boolean enableSanityChecks, double tolerance) {
    Preconditions.checkArgument(numIterations >= 0, "the number of iterations must be non-negative: %s", numIterations);
    Preconditions.checkArgument(tolerance > 0.0, "tolerance must be positive: %s", tolerance);
    this.numIterations = numIterations;
    this.enableSanityChecks = enableSanityChecks;
    this.tolerance = tolerance;
  }

  public int getNumIterations() {
    return numIterations;
  }

  public boolean getEnableSanityChecks() {
    return enableSanityChecks;
  }

  public double getTolerance() {
    return tolerance;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("numIterations", numIterations)
        .add("enableSanityChecks", enableSanityChecks)
        .add("tolerance", tolerance)
        .toString();
  }

}
