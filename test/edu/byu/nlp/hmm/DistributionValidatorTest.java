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

import static org.fest.assertions.Assertions.assertThat;
import static org.junit.Assert.fail;

import org.fest.assertions.Delta;
import org.junit.Test;

public class DistributionValidatorTest {

  @Test
  public void testAcceptsDistributionsWithinTolerance() {
    DistributionValidator.checkSumsToOne(new double[] {0.25, 0.25, 0.5 + 1e-10}, "pi");
    DistributionValidator.checkRowsSumToOne(new double[][] {{1.0}, {0.3, 0.7}, {0, 0, 1}}, "rows");
    DistributionValidator.checkSumsToOne(new double[] {0.5, 0.49}, "loose", 0.1);
  }

  @Test
  public void testReportsRowAndSum() {
    try {
      DistributionValidator.checkRowsSumToOne(new double[][] {{0.5, 0.5}, {0.5, 0.5}, {0.6, 0.6}}, "A");
      fail("expected an InvalidDistributionException");
    }
    catch (InvalidDistributionException e) {
      assertThat(e.getDistributionName()).isEqualTo("Row 2 of A");
      assertThat(e.getObservedSum()).isEqualTo(1.2);
      assertThat(e.getMessage()).contains("Row 2 of A").contains("1.2");
    }
  }

  @Test
  public void testRejectsNegativeEntries() {
    try {
      DistributionValidator.checkSumsToOne(new double[] {1.5, -0.5, 0.25}, "pi");
      fail("expected an InvalidDistributionException");
    }
    catch (InvalidDistributionException e) {
      assertThat(e.getDistributionName()).isEqualTo("pi");
      assertThat(e.getObservedSum()).isEqualTo(1.25, Delta.delta(1e-15));
      assertThat(e.getMessage()).contains("index 1");
    }
  }

  @Test(expected = InvalidDistributionException.class)
  public void testRejectsNaN() {
    DistributionValidator.checkSumsToOne(new double[] {Double.NaN, 1.0}, "pi");
  }

  @Test(expected = InvalidDistributionException.class)
  public void testRejectsEmptyVector() {
    DistributionValidator.checkSumsToOne(new double[0], "pi");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidDistributionIsAnIllegalArgument() {
    DistributionValidator.checkSumsToOne(new double[] {0.5, 0.4}, "pi");
  }

}
