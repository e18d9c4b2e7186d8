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

package org.hmmrecognize.common;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;
import org.apache.mahout.common.RandomUtils;
import org.hmmrecognize.sequencelearning.hmm.HmmModel;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Random;

/**
 * Base class for tests: fixed random seed and a few shared models
 */
public abstract class HmmTestCase extends Assert {
  @Rule
  public TemporaryFolder temporaryFolder = new TemporaryFolder();

  @Before
  public void setUp() throws Exception {
    RandomUtils.useTestSeed();
  }

  /**
   * Two hidden states S0, S1 emitting A or B
   */
  protected static HmmModel weatherModel() {
    return HmmModel.load(ImmutableList.of("S0", "S1"), ImmutableList.of("A", "B"),
      new double[][] {{0.7, 0.3}, {0.4, 0.6}},
      new double[][] {{0.9, 0.1}, {0.2, 0.8}},
      new double[] {0.6, 0.4});
  }

  /**
   * Builds a model with random tables over the given numbers of states and symbols. Roughly a
   * fifth of the entries are zero.
   */
  protected static HmmModel randomModel(Random random, int nrOfHiddenStates, int nrOfOutputStates) {
    return HmmModel.load(names("H", nrOfHiddenStates), names("O", nrOfOutputStates),
      randomRows(random, nrOfHiddenStates, nrOfHiddenStates),
      randomRows(random, nrOfHiddenStates, nrOfOutputStates),
      randomRows(random, 1, nrOfHiddenStates)[0]);
  }

  protected static List<String> names(String prefix, int count) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (int i = 0; i < count; ++i)
      names.add(prefix + i);
    return names.build();
  }

  private static double[][] randomRows(Random random, int rows, int columns) {
    double[][] values = new double[rows][columns];
    for (int i = 0; i < rows; ++i) {
      double sum = 0;
      for (int j = 0; j < columns; ++j) {
        values[i][j] = random.nextDouble() < 0.2 ? 0 : random.nextDouble();
        sum += values[i][j];
      }
      if (sum == 0) {
        values[i][0] = 1;
        sum = 1;
      }
      for (int j = 0; j < columns; ++j)
        values[i][j] /= sum;
    }
    return values;
  }

  protected static File getResourceFile(String name) throws URISyntaxException {
    return new File(Resources.getResource(name).toURI());
  }
}
