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
package edu.byu.nlp.hmm.inference;

import static org.fest.assertions.Assertions.assertThat;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.fest.assertions.Delta;
import org.junit.Test;

import edu.byu.nlp.hmm.HmmParameters;
import edu.byu.nlp.hmm.TestUtil;

public class ViterbiDecoderTest {

  @Test
  public void testToySequence() {
    HmmParameters params = TestUtil.toyParameters();
    int length = TestUtil.TOY_SEQUENCE.length;
    double[][] logV = new double[2][length];
    int[][] backPointers = new int[2][length];

    double score = new ViterbiDecoder(params).fill(TestUtil.TOY_SEQUENCE, logV, backPointers);
    int[] path = ViterbiDecoder.bestPath(logV, backPointers);

    assertThat(path).isEqualTo(new int[] {1, 0, 0, 1, 0, 0, 1, 1});
    assertThat(score).isEqualTo(-12.336318816409902, Delta.delta(1e-10));
    assertThat(score).isEqualTo(Math.log(TestUtil.jointProbability(params, path, TestUtil.TOY_SEQUENCE)),
        Delta.delta(1e-10));
  }

  @Test
  public void testMatchesBruteForce() {
    for (int seed = 0; seed < 50; seed++) {
      RandomGenerator rnd = new MersenneTwister(seed);
      int numStates = 1 + rnd.nextInt(3);
      int numSymbols = 1 + rnd.nextInt(4);
      HmmParameters params = TestUtil.randomParameters(rnd, numStates, numSymbols);
      int[] sequence = new int[1 + rnd.nextInt(6)];
      for (int t = 0; t < sequence.length; t++) {
        sequence[t] = rnd.nextInt(numSymbols);
      }

      int[] expected = TestUtil.bruteForceBestPath(params, sequence);
      assertThat(new ViterbiDecoder(params).decode(sequence)).isEqualTo(expected);
    }
  }

  @Test
  public void testTiesGoToLowestState() {
    HmmParameters params = HmmParameters.of(
        new double[] {0.5, 0.5},
        new double[][] {{0.5, 0.5}, {0.5, 0.5}},
        new double[][] {{0.5, 0.5}, {0.5, 0.5}});

    assertThat(new ViterbiDecoder(params).decode(new int[] {0, 1, 1, 0})).isEqualTo(new int[] {0, 0, 0, 0});
  }

  @Test
  public void testAvoidsImpossiblePaths() {
    // state 1 can only follow state 0 and must emit symbol 1
    HmmParameters params = HmmParameters.of(
        new double[] {1, 0},
        new double[][] {{0.9, 0.1}, {1, 0}},
        new double[][] {{0.5, 0.5}, {0, 1}});

    assertThat(new ViterbiDecoder(params).decode(new int[] {0, 1, 0, 1})).isEqualTo(new int[] {0, 0, 0, 0});
    assertThat(new ViterbiDecoder(params).decode(new int[] {1})).isEqualTo(new int[] {0});
  }

  @Test
  public void testCorpusDecodingReusesBuffers() {
    HmmParameters params = TestUtil.toyParameters();
    ViterbiDecoder decoder = new ViterbiDecoder(params);
    int[][] corpus = TestUtil.lcgCorpus(3, 5, 40, 3);

    int[][] paths = decoder.decode(corpus);

    assertThat(paths.length).isEqualTo(5);
    for (int n = 0; n < corpus.length; n++) {
      assertThat(paths[n]).isEqualTo(decoder.decode(corpus[n]));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPathLongerThanLattice() {
    ViterbiDecoder decoder = new ViterbiDecoder(TestUtil.toyParameters());
    double[][] logV = new double[2][3];
    int[][] backPointers = new int[2][3];
    decoder.fill(new int[] {0, 1, 2}, logV, backPointers);

    ViterbiDecoder.bestPath(logV, backPointers, new int[2]);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBackPointersShorterThanLattice() {
    ViterbiDecoder.bestPath(new double[2][3], new int[2][2], new int[3]);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWrongBackPointerShape() {
    new ViterbiDecoder(TestUtil.toyParameters()).fill(new int[] {0, 1}, new double[2][2], new int[2][3]);
  }

}
