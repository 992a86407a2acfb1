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

/**
 * Thrown by the M-step when a row of expected counts cannot be normalized because it sums to
 * zero (a state that has no posterior mass anywhere in the corpus) or is not finite.
 */
public class DegenerateStatisticsException extends ArithmeticException {

  private static final long serialVersionUID = 1L;

  private final String tableName;
  private final int row;

  public DegenerateStatisticsException(String tableName, int row, double rowSum) {
    super("cannot normalize row " + row + " of the " + tableName + " expected counts (sum=" + rowSum + ")");
    this.tableName = tableName;
    this.row = row;
  }

  public String getTableName() {
    return tableName;
  }

  public int getRow() {
    return row;
  }

}
