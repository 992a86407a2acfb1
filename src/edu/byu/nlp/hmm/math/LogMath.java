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
package edu.byu.nlp.hmm.math;

import org.apache.commons.math3.util.FastMath;

import com.google.common.base.Preconditions;

/**
 * Dense array helpers for quantities stored as natural logarithms.
 * <p>
 * Every method treats {@code Double.NEGATIVE_INFINITY} as log(0): it contributes nothing to a
 * sum and never turns a result into NaN.
 */
public class LogMath {

  private LogMath() {}

  /**
   * log(sum_i exp(values[i])), computed by subtracting the maximum first. Returns
   * {@code -Infinity} when every entry is {@code -Infinity} (or the array is empty).
   */
  public static double logSumExp(double[] values) {
    double max = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < values.length; i++) {
      if (values[i] > max) {
        max = values[i];
      }
    }
    if (max == Double.NEGATIVE_INFINITY || max == Double.POSITIVE_INFINITY) {
      return max;
    }
    double sum = 0;
    for (int i = 0; i < values.length; i++) {
      sum += FastMath.exp(values[i] - max);
    }
    return max + FastMath.log(sum);
  }

  /**
   * logSumExp over column {@code col} of a row-major matrix (e.g., over the states of a lattice
   * at one time step).
   */
  public static double logSumExpColumn(double[][] matrix, int col) {
    double max = Double.NEGATIVE_INFINITY;
    for (int row = 0; row < matrix.length; row++) {
      if (matrix[row][col] > max) {
        max = matrix[row][col];
      }
    }
    if (max == Double.NEGATIVE_INFINITY || max == Double.POSITIVE_INFINITY) {
      return max;
    }
    double sum = 0;
    for (int row = 0; row < matrix.length; row++) {
      sum += FastMath.exp(matrix[row][col] - max);
    }
    return max + FastMath.log(sum);
  }

  /** Index of the first maximal entry (ties go to the lowest index). */
  public static int argMax(double[] values) {
    Preconditions.checkArgument(values.length > 0, "cannot take the argmax of an empty array");
    int best = 0;
    for (int i = 1; i < values.length; i++) {
      if (values[i] > values[best]) {
        best = i;
      }
    }
    return best;
  }

  /** Row index of the first maximal entry in column {@code col}. */
  public static int argMaxColumn(double[][] matrix, int col) {
    Preconditions.checkArgument(matrix.length > 0, "cannot take the argmax of an empty matrix");
    int best = 0;
    for (int row = 1; row < matrix.length; row++) {
      if (matrix[row][col] > matrix[best][col]) {
        best = row;
      }
    }
    return best;
  }

  /** Elementwise natural log into a new array; log(0) is {@code -Infinity}. */
  public static double[] log(double[] values) {
    double[] logs = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      logs[i] = Math.log(values[i]);
    }
    return logs;
  }

  public static double[][] log(double[][] matrix) {
    double[][] logs = new double[matrix.length][];
    for (int i = 0; i < matrix.length; i++) {
      logs[i] = log(matrix[i]);
    }
    return logs;
  }

}
