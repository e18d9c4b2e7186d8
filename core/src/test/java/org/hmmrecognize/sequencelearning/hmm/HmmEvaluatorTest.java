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
import org.hmmrecognize.common.HmmTestCase;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

public class HmmEvaluatorTest extends HmmTestCase {
  private static final double EPSILON = 1.0e-12;

  private HmmModel model;

  @Override
  public void setUp() throws Exception {
    super.setUp();
    model = weatherModel();
  }

  @Test
  public void testScenario() {
    List<String> sequence = ImmutableList.of("A", "A");
    assertEquals(Math.log(0.411), HmmEvaluator.forwardLogLikelihood(model, sequence), EPSILON);
    assertEquals(Math.log(0.411), HmmEvaluator.backwardLogLikelihood(model, sequence), EPSILON);
    assertEquals(0.411, HmmEvaluator.modelLikelihood(model, sequence, true), EPSILON);
    assertEquals(0.411, HmmEvaluator.modelLikelihood(model, sequence, false), EPSILON);

    DecodedSequence decoded = HmmEvaluator.decode(model, sequence);
    assertEquals(ImmutableList.of("S0", "S0"), decoded.getStateNames());
    assertEquals(0.3402, decoded.getProbability(), EPSILON);
  }

  @Test
  public void testDecodedPathIsConsistentWithTheModel() {
    List<String> sequence = ImmutableList.of("B", "B", "A", "B", "A", "A", "B");
    DecodedSequence decoded = HmmEvaluator.decode(model, sequence);
    assertEquals(sequence.size(), decoded.length());
    assertEquals(HmmEvaluator.pathLogProbability(model, decoded.getStateNames(), sequence),
      decoded.getLogProbability(), EPSILON);
    assertTrue(decoded.getLogProbability() <= HmmEvaluator.forwardLogLikelihood(model, sequence));
  }

  @Test
  public void testPathLogProbability() {
    // 0.6 * 0.9 * 0.3 * 0.8
    assertEquals(Math.log(0.1296),
      HmmEvaluator.pathLogProbability(model, ImmutableList.of("S0", "S1"), ImmutableList.of("A", "B")), EPSILON);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPathLengthMustMatch() {
    HmmEvaluator.pathLogProbability(model, ImmutableList.of("S0"), ImmutableList.of("A", "B"));
  }

  @Test(expected = UnknownStateException.class)
  public void testPathWithUnknownState() {
    HmmEvaluator.pathLogProbability(model, ImmutableList.of("S0", "S7"), ImmutableList.of("A", "B"));
  }

  @Test(expected = EmptySequenceException.class)
  public void testEmptySequence() {
    HmmEvaluator.forwardLogLikelihood(model, ImmutableList.<String>of());
  }

  @Test(expected = EmptySequenceException.class)
  public void testEmptySequenceIsCheckedBeforeDecoding() {
    HmmEvaluator.decode(model, ImmutableList.<String>of());
  }

  @Test
  public void testUnknownSymbol() {
    try {
      HmmEvaluator.backwardLogLikelihood(model, Arrays.asList("A", "B", "C", "A"));
      fail("C is not a symbol of the model");
    } catch (UnknownSymbolException e) {
      assertEquals("C", e.getSymbolName());
      assertEquals(2, e.getPosition());
    }
  }

  @Test
  public void testSequenceTooLarge() {
    List<String> sequence = ImmutableList.of("A", "B", "A");
    // 2 states * 3 observations
    assertEquals(HmmEvaluator.forwardLogLikelihood(model, sequence),
      HmmEvaluator.forwardLogLikelihood(model, sequence, 6), 0.0);
    try {
      HmmEvaluator.decode(model, sequence, 5);
      fail("trellis has 6 cells");
    } catch (SequenceTooLargeException e) {
      assertEquals(6, e.getCells());
      assertEquals(5, e.getLimit());
    }
  }

  @Test
  public void testPredictIsReproducible() {
    int[] first = HmmEvaluator.predict(model, 100, 1234L);
    assertArrayEquals(first, HmmEvaluator.predict(model, 100, 1234L));
    assertEquals(100, first.length);
    for (int observation : first)
      assertTrue(observation == 0 || observation == 1);
  }

  @Test
  public void testPredictFollowsTheModel() {
    // S0 always emits A and stays, so every sample is all A
    HmmModel absorbing = HmmModel.load(ImmutableList.of("S0", "S1"), ImmutableList.of("A", "B"),
      new double[][] {{1, 0}, {0.5, 0.5}},
      new double[][] {{1, 0}, {0, 1}},
      new double[] {1, 0});
    assertArrayEquals(new int[] {0, 0, 0, 0, 0}, HmmEvaluator.predict(absorbing, 5));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPredictRequiresPositiveLength() {
    HmmEvaluator.predict(model, 0);
  }
}
