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

import com.google.common.collect.ImmutableBiMap;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang.NullArgumentException;
import org.apache.mahout.math.Matrix;
import org.apache.mahout.math.Vector;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A collection of utilities for validating models and for converting between state/symbol names
 * and the integer ids used by {@link HmmAlgorithms}
 */
public final class HmmUtils {
  /**
   * No limit on the size of a trellis
   */
  public static final long UNLIMITED_TRELLIS_CELLS = Long.MAX_VALUE;

  private HmmUtils() {
  }

  /**
   * Assigns ids to names in list order
   *
   * @throws MalformedModelException for null, empty or duplicated names
   */
  static ImmutableBiMap<String, Integer> indexNames(String kind, List<String> names) {
    ImmutableBiMap.Builder<String, Integer> builder = ImmutableBiMap.builder();
    Set<String> seen = new HashSet<String>();
    int id = 0;
    for (String name : names) {
      if (name == null || name.isEmpty())
        throw new MalformedModelException("Empty " + kind + " name at index " + id);
      if (!seen.add(name))
        throw new MalformedModelException("Duplicate " + kind + " name: " + name);
      builder.put(name, id++);
    }
    return builder.build();
  }

  static void checkRectangular(String table, double[][] values, int rows, int columns) {
    if (values.length != rows)
      throw new MalformedModelException("The " + table + " table has " + values.length + " rows, expected " + rows);
    for (int i = 0; i < rows; ++i) {
      if (values[i] == null || values[i].length != columns)
        throw new MalformedModelException("Row " + i + " of the " + table + " table has "
          + (values[i] == null ? 0 : values[i].length) + " columns, expected " + columns);
    }
  }

  /**
   * Validates dimensions, ranges and normalization of the model tables.
   *
   * @param nrOfHiddenStates number of hidden states (N)
   * @param nrOfOutputStates number of output states (M)
   * @param transitionMatrix N x N matrix
   * @param emissionMatrix N x M matrix
   * @param initialProbabilities vector of length N
   * @param tolerance allowed deviation of every row sum from 1
   * @throws MalformedModelException if any check fails
   */
  public static void validate(int nrOfHiddenStates, int nrOfOutputStates, Matrix transitionMatrix,
                              Matrix emissionMatrix, Vector initialProbabilities, double tolerance) {
    if (Double.isNaN(tolerance) || tolerance < 0)
      throw new MalformedModelException("Tolerance must be a non-negative number, got " + tolerance);
    if (nrOfHiddenStates == 0)
      throw new MalformedModelException("Model must have at least one hidden state");
    if (nrOfOutputStates == 0)
      throw new MalformedModelException("Model must have at least one output state");

    if (transitionMatrix.numRows() != nrOfHiddenStates || transitionMatrix.numCols() != nrOfHiddenStates)
      throw new MalformedModelException("Transition matrix is " + transitionMatrix.numRows() + 'x'
        + transitionMatrix.numCols() + ", expected " + nrOfHiddenStates + 'x' + nrOfHiddenStates);
    if (emissionMatrix.numRows() != nrOfHiddenStates || emissionMatrix.numCols() != nrOfOutputStates)
      throw new MalformedModelException("Emission matrix is " + emissionMatrix.numRows() + 'x'
        + emissionMatrix.numCols() + ", expected " + nrOfHiddenStates + 'x' + nrOfOutputStates);
    if (initialProbabilities.size() != nrOfHiddenStates)
      throw new MalformedModelException("Initial probabilities have length " + initialProbabilities.size()
        + ", expected " + nrOfHiddenStates);

    checkRows("transition", transitionMatrix, tolerance);
    checkRows("emission", emissionMatrix, tolerance);

    double sum = 0;
    for (int i = 0; i < nrOfHiddenStates; ++i) {
      double value = initialProbabilities.getQuick(i);
      checkProbability("initial probability", i, -1, value);
      sum += value;
    }
    checkSum("Initial probabilities", sum, tolerance);
  }

  private static void checkRows(String table, Matrix matrix, double tolerance) {
    for (int i = 0; i < matrix.numRows(); ++i) {
      double sum = 0;
      for (int j = 0; j < matrix.numCols(); ++j) {
        double value = matrix.getQuick(i, j);
        checkProbability(table + " probability", i, j, value);
        sum += value;
      }
      checkSum("Row " + i + " of the " + table + " matrix", sum, tolerance);
    }
  }

  private static void checkProbability(String what, int row, int column, double value) {
    if (Double.isNaN(value) || value < 0 || value > 1) {
      String position = column < 0 ? "[" + row + ']' : "[" + row + "][" + column + ']';
      throw new MalformedModelException("The " + what + position + " = " + value + " is not in [0, 1]");
    }
  }

  private static void checkSum(String what, double sum, double tolerance) {
    if (Math.abs(sum - 1.0) > tolerance)
      throw new MalformedModelException(what + " sums to " + sum + " instead of 1");
  }

  /**
   * Converts observed symbol names to output state ids
   *
   * @throws UnknownSymbolException for the first name the model does not know
   */
  public static int[] encodeObservations(HmmModel model, List<String> observations) {
    int[] encoded = new int[observations.size()];
    int position = 0;
    for (String symbol : observations) {
      if (!model.hasOutputState(symbol))
        throw new UnknownSymbolException(symbol, position);
      encoded[position++] = model.getOutputStateID(symbol);
    }
    return encoded;
  }

  /**
   * Converts hidden state names to ids
   *
   * @throws UnknownStateException for the first name the model does not know
   */
  public static int[] encodeStates(HmmModel model, List<String> states) {
    int[] encoded = new int[states.size()];
    int position = 0;
    for (String state : states)
      encoded[position++] = model.getHiddenStateID(state);
    return encoded;
  }

  public static ImmutableList<String> decodeStates(HmmModel model, int[] states) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (int state : states)
      builder.add(model.getHiddenStateName(state));
    return builder.build();
  }

  public static ImmutableList<String> decodeObservations(HmmModel model, int[] observations) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (int observation : observations)
      builder.add(model.getOutputStateName(observation));
    return builder.build();
  }

  /**
   * Performs every check that has to pass before a trellis is allocated for the sequence and
   * returns the encoded sequence.
   *
   * @param maxTrellisCells upper bound on N * T, {@link #UNLIMITED_TRELLIS_CELLS} for none
   * @throws EmptySequenceException if the sequence has no observations
   * @throws UnknownSymbolException if a symbol is not emitted by the model
   * @throws SequenceTooLargeException if N * T exceeds the limit
   */
  public static int[] checkSequence(HmmModel model, List<String> observations, long maxTrellisCells) {
    if (model == null)
      throw new NullArgumentException("model");
    if (observations == null)
      throw new NullArgumentException("observations");
    if (observations.isEmpty())
      throw new EmptySequenceException();
    int[] encoded = encodeObservations(model, observations);
    checkTrellisSize(model, encoded.length, maxTrellisCells);
    return encoded;
  }

  static void checkTrellisSize(HmmModel model, int length, long maxTrellisCells) {
    long cells = (long) model.getNrOfHiddenStates() * length;
    if (cells > maxTrellisCells)
      throw new SequenceTooLargeException(cells, maxTrellisCells);
  }

  /**
   * Checks an already encoded sequence
   */
  static void checkEncodedSequence(HmmModel model, int[] observations) {
    if (observations == null)
      throw new NullArgumentException("observations");
    if (observations.length == 0)
      throw new EmptySequenceException();
    for (int i = 0; i < observations.length; ++i) {
      if (observations[i] < 0 || observations[i] >= model.getNrOfOutputStates())
        throw new UnknownSymbolException(Integer.toString(observations[i]), i);
    }
  }
}
