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

/**
 * Thrown when a vector (or a row of a matrix) that should hold a probability distribution does
 * not: an entry is negative or NaN, or the entries do not sum to one within tolerance.
 */
public class InvalidDistributionException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  private final String distributionName;
  private final double observedSum;

  public InvalidDistributionException(String distributionName, double observedSum, String message) {
    super(message);
    this.distributionName = distributionName;
    this.observedSum = observedSum;
  }

  /** e.g. "Row 1 of transitions" */
  public String getDistributionName() {
    return distributionName;
  }

  public double getObservedSum() {
    return observedSum;
  }

}
