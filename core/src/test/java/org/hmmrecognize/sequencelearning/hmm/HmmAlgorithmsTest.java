/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.hmmrecognize.sequencelearning.hmm;

import com.google.common.collect.ImmutableList;
import org.apache.mahout.common.RandomUtils;
import org.apache.mahout.math.Matrix;
import org.hmmrecognize.common.HmmTestCase;
import org.junit.Test;

import java.util.Random;

public class HmmAlgorithmsTest extends HmmTestCase {
  private static final double EPSILON = 1.0e-12;

  private HmmModel model;
  private int[] observations;

  @Override
  public void setUp() throws Exception {
    super.setUp();
    model = weatherModel();
    // A A
    observations = new int[] {0, 0};
  }

  @Test
  public void testForwardTrellis() {
    Matrix alpha = HmmAlgorithms.forwardAlgorithm(model, observations);
    assertEquals(2, alpha.numRows());
    assertEquals(2, alpha.numCols());
    assertEquals(0.54, Math.exp(alpha.get(0, 0)), EPSILON);
    assertEquals(0.08, Math.exp(alpha.get(0, 1)), EPSILON);
    assertEquals(0.369, Math.exp(alpha.get(1, 0)), EPSILON);
    assertEquals(0.042, Math.exp(alpha.get(1, 1)), EPSILON);
    assertEquals(0.411, Math.exp(HmmAlgorithms.forwardLogLikelihood(alpha)), EPSILON);
  }

  @Test
  public void testBackwardTrellis() {
    Matrix beta = HmmAlgorithms.backwardAlgorithm(model, observations);
    assertEquals(0.0, beta.get(1, 0), 0.0);
    assertEquals(0.0, beta.get(1, 1), 0.0);
    assertEquals(0.69, Math.exp(beta.get(0, 0)), EPSILON);
    assertEquals(0.48, Math.exp(beta.get(0, 1)), EPSILON);
    assertEquals(0.411, Math.exp(HmmAlgorithms.backwardLogLikelihood(model, beta, observations)), EPSILON);
  }

  @Test
  public void testViterbi() {
    int[] decoded = new int[2];
    double[][] delta = new double[2][2];
    int[][] phi = new int[1][2];
    double logProbability = HmmAlgorithms.viterbiAlgorithm(decoded, delta, phi, model, observations);

    assertEquals(0.3402, Math.exp(logProbability), EPSILON);
    assertArrayEquals(new int[] {0, 0}, decoded);
    assertEquals(0.54, Math.exp(delta[0][0]), EPSILON);
    assertEquals(0.0324, Math.exp(delta[1][1]), EPSILON);
    assertArrayEquals(new int[] {0, 0}, phi[0]);
  }

  @Test
  public void testForwardAndBackwardAgree() {
    Random random = RandomUtils.getRandom();
    for (int n = 1; n <= 4; ++n) {
      HmmModel randomModel = randomModel(random, n, 3);
      for (int length = 1; length <= 40; length += 13) {
        int[] sequence = HmmEvaluator.predict(randomModel, length, random.nextLong());
        double forward = HmmAlgorithms.forwardLogLikelihood(HmmAlgorithms.forwardAlgorithm(randomModel, sequence));
        double backward = HmmAlgorithms.backwardLogLikelihood(randomModel,
          HmmAlgorithms.backwardAlgorithm(randomModel, sequence), sequence);
        assertEquals(1.0, Math.exp(forward - backward), 1.0e-9);
      }
    }
  }

  @Test
  public void testViterbiFindsTheMostProbablePath() {
    Random random = RandomUtils.getRandom();
    for (int n = 1; n <= 3; ++n) {
      HmmModel randomModel = randomModel(random, n, 2);
      for (int length = 1; length <= 5; ++length) {
        int[] sequence = new int[length];
        for (int t = 0; t < length; ++t)
          sequence[t] = random.nextInt(2);

        DecodedSequence decoded = HmmEvaluator.decode(randomModel, sequence);
        assertEquals(length, decoded.length());
        assertEquals(bruteForceMaximum(randomModel, sequence), decoded.getLogProbability(), EPSILON);
        assertEquals(HmmEvaluator.pathLogProbability(randomModel, decoded.getStates(), sequence),
          decoded.getLogProbability(), EPSILON);
      }
    }
  }

  @Test
  public void testRepeatedCallsGiveIdenticalResults() {
    int[] sequence = HmmEvaluator.predict(model, 50, 42L);
    DecodedSequence first = HmmEvaluator.decode(model, sequence);
    double forward = HmmAlgorithms.forwardLogLikelihood(HmmAlgorithms.forwardAlgorithm(model, sequence));
    for (int i = 0; i < 3; ++i) {
      assertEquals(first, HmmEvaluator.decode(model, sequence));
      assertEquals(forward, HmmAlgorithms.forwardLogLikelihood(HmmAlgorithms.forwardAlgorithm(model, sequence)), 0.0);
    }
  }

  @Test
  public void testTiedPredecessorsResolveToLowestState() {
    // both states reach the same delta at t = 0 and move with equal probability,
    // so every predecessor choice is a tie
    HmmModel tied = HmmModel.load(ImmutableList.of("S0", "S1"), ImmutableList.of("A", "B"),
      new double[][] {{0.5, 0.5}, {0.5, 0.5}},
      new double[][] {{0.8, 0.2}, {0.2, 0.8}},
      new double[] {0.2, 0.8});

    for (int run = 0; run < 5; ++run) {
      DecodedSequence decoded = HmmEvaluator.decode(tied, new int[] {0, 0});
      assertArrayEquals(new int[] {0, 0}, decoded.getStates());
      assertEquals(ImmutableList.of("S0", "S0"), decoded.getStateNames());

      decoded = HmmEvaluator.decode(tied, new int[] {0, 1});
      assertArrayEquals(new int[] {0, 1}, decoded.getStates());
    }
  }

  @Test
  public void testTiedFinalStatesResolveToLowestState() {
    HmmModel symmetric = HmmModel.load(ImmutableList.of("S0", "S1", "S2"), ImmutableList.of("A", "B"),
      new double[][] {{0.5, 0.25, 0.25}, {0.25, 0.5, 0.25}, {0.25, 0.25, 0.5}},
      new double[][] {{0.5, 0.5}, {0.5, 0.5}, {0.5, 0.5}},
      new double[] {0.4, 0.4, 0.2});

    DecodedSequence decoded = HmmEvaluator.decode(symmetric, new int[] {0});
    assertArrayEquals(new int[] {0}, decoded.getStates());
    assertEquals(0.2, decoded.getProbability(), EPSILON);

    // staying in S0 and staying in S1 are equally likely
    decoded = HmmEvaluator.decode(symmetric, new int[] {0, 1});
    assertArrayEquals(new int[] {0, 0}, decoded.getStates());
    assertEquals(0.05, decoded.getProbability(), EPSILON);
  }

  @Test
  public void testImpossibleFirstObservation() {
    HmmModel mute = HmmModel.load(ImmutableList.of("S0", "S1"), ImmutableList.of("A", "B", "C"),
      new double[][] {{0.9, 0.1}, {0.1, 0.9}},
      new double[][] {{0.5, 0.5, 0.0}, {0.3, 0.7, 0.0}},
      new double[] {0.5, 0.5});
    int[] sequence = {2, 0, 1};

    DecodedSequence decoded = HmmEvaluator.decode(mute, sequence);
    assertEquals(Double.NEGATIVE_INFINITY, decoded.getLogProbability(), 0.0);
    assertEquals(0.0, decoded.getProbability(), 0.0);
    assertArrayEquals(new int[] {0, 0, 0}, decoded.getStates());

    double forward = HmmAlgorithms.forwardLogLikelihood(HmmAlgorithms.forwardAlgorithm(mute, sequence));
    assertEquals(Double.NEGATIVE_INFINITY, forward, 0.0);
    assertEquals(0.0, HmmEvaluator.modelLikelihood(mute, sequence, false), 0.0);
  }

  @Test
  public void testLongSequenceDoesNotUnderflow() {
    int[] sequence = HmmEvaluator.predict(model, 5000, 7L);
    double forward = HmmAlgorithms.forwardLogLikelihood(HmmAlgorithms.forwardAlgorithm(model, sequence));
    double backward = HmmAlgorithms.backwardLogLikelihood(model,
      HmmAlgorithms.backwardAlgorithm(model, sequence), sequence);
    DecodedSequence decoded = HmmEvaluator.decode(model, sequence);

    assertTrue(forward < -1000);
    assertFalse(Double.isInfinite(forward));
    assertEquals(forward, backward, Math.abs(forward) * 1.0e-9);
    assertEquals(0.0, HmmEvaluator.modelLikelihood(model, sequence, true), 0.0);
    assertTrue(decoded.getLogProbability() <= forward);
    assertEquals(HmmEvaluator.pathLogProbability(model, decoded.getStates(), sequence),
      decoded.getLogProbability(), Math.abs(forward) * 1.0e-9);
  }

  @Test(expected = EmptySequenceException.class)
  public void testEmptySequence() {
    HmmAlgorithms.forwardAlgorithm(model, new int[0]);
  }

  @Test(expected = UnknownSymbolException.class)
  public void testSymbolOutOfRange() {
    HmmAlgorithms.backwardAlgorithm(model, new int[] {0, 2});
  }

  private static double bruteForceMaximum(HmmModel model, int[] sequence) {
    int n = model.getNrOfHiddenStates();
    int[] path = new int[sequence.length];
    double best = Double.NEGATIVE_INFINITY;
    while (true) {
      best = Math.max(best, HmmEvaluator.pathLogProbability(model, path, sequence));
      int t = 0;
      while (t < path.length && ++path[t] == n) {
        path[t] = 0;
        ++t;
      }
      if (t == path.length)
        return best;
    }
  }
}
