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
 * Checks that vectors and matrix rows are probability distributions.
 */
public class DistributionValidator {

  public static final double DEFAULT_TOLERANCE = 1e-8;

  private DistributionValidator() {}

  /**
   * @throws InvalidDistributionException if an entry is negative or NaN, or if
   *     |sum(values) - 1| > tolerance
   */
  public static void checkSumsToOne(double[] values, String name, double tolerance) {
    Preconditions.checkNotNull(values, "%s is null", name);
    Preconditions.checkArgument(tolerance >= 0, "tolerance must be non-negative: %s", tolerance);
    double sum = 0;
    int invalidIndex = -1;
    for (int i = 0; i < values.length; i++) {
      if (invalidIndex < 0 && (Double.isNaN(values[i]) || values[i] < 0)) {
        invalidIndex = i;
      }
      sum += values[i];
    }
    if (invalidIndex >= 0) {
      throw new InvalidDistributionException(name, sum,
          name + " has an invalid probability " + values[invalidIndex] + " at index " + invalidIndex
          + " (sum=" + sum + ", deviation=" + (sum - 1.0) + ")");
    }
    if (!(Math.abs(sum - 1.0) <= tolerance)) {
      throw new InvalidDistributionException(name, sum,
          name + " does not sum to 1 (sum=" + sum + ", deviation=" + (sum - 1.0) + ")");
    }
  }

  public static void checkSumsToOne(double[] values, String name) {
    checkSumsToOne(values, name, DEFAULT_TOLERANCE);
  }

  /** Checks every row; the failing row is named "Row i of {name}". */
  public static void checkRowsSumToOne(double[][] rows, String name, double tolerance) {
    Preconditions.checkNotNull(rows, "%s is null", name);
    for (int i = 0; i < rows.length; i++) {
      checkSumsToOne(rows[i], "Row " + i + " of " + name, tolerance);
    }
  }

  public static void checkRowsSumToOne(double[][] rows, String name) {
    checkRowsSumToOne(rows, name, DEFAULT_TOLERANCE);
  }

}
