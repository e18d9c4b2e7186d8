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
import org.apache.mahout.math.DenseMatrix;
import org.apache.mahout.math.DenseVector;
import org.apache.mahout.math.Matrix;
import org.apache.mahout.math.Vector;

import java.util.List;

/**
 * Immutable discrete Hidden Markov Model.
 *
 * <p>The model consists of N named hidden states and M named output states (observed symbols)
 * together with
 * <ul>
 *   <li>the N x N transition matrix, where entry (i, j) is the probability of moving from hidden
 *   state i to hidden state j,</li>
 *   <li>the N x M emission matrix, where entry (i, k) is the probability of hidden state i emitting
 *   output state k,</li>
 *   <li>the initial probability vector of length N.</li>
 * </ul>
 * The order of the names defines the integer ids used by all algorithms. All tables are copied
 * and validated on construction, and natural-log copies are kept for the dynamic programming
 * loops in {@link HmmAlgorithms}.</p>
 *
 * <p>Instances are safe to share between threads.</p>
 */
public final class HmmModel {
  public static final double DEFAULT_TOLERANCE = 1.0e-6;

  private final ImmutableBiMap<String, Integer> hiddenStateNames;
  private final ImmutableBiMap<String, Integer> outputStateNames;

  private final Matrix transitionMatrix;
  private final Matrix emissionMatrix;
  private final Vector initialProbabilities;

  private final double[][] logTransitions;
  private final double[][] logEmissions;
  private final double[] logInitialProbabilities;

  private final double tolerance;

  /**
   * Constructs a model validating every row against {@link #DEFAULT_TOLERANCE}
   *
   * @throws MalformedModelException if names or tables are inconsistent
   */
  public HmmModel(List<String> hiddenStateNames, List<String> outputStateNames,
                  Matrix transitionMatrix, Matrix emissionMatrix, Vector initialProbabilities) {
    this(hiddenStateNames, outputStateNames, transitionMatrix, emissionMatrix, initialProbabilities,
      DEFAULT_TOLERANCE);
  }

  /**
   * Constructs a model
   *
   * @param hiddenStateNames ordered, unique names of the hidden states
   * @param outputStateNames ordered, unique names of the observed symbols
   * @param transitionMatrix N x N transition probabilities
   * @param emissionMatrix N x M emission probabilities
   * @param initialProbabilities N initial probabilities
   * @param tolerance maximal allowed deviation of each row sum from 1
   * @throws MalformedModelException if names or tables are inconsistent
   */
  public HmmModel(List<String> hiddenStateNames, List<String> outputStateNames,
                  Matrix transitionMatrix, Matrix emissionMatrix, Vector initialProbabilities,
                  double tolerance) {
    if (hiddenStateNames == null)
      throw new NullArgumentException("hiddenStateNames");
    if (outputStateNames == null)
      throw new NullArgumentException("outputStateNames");
    if (transitionMatrix == null)
      throw new NullArgumentException("transitionMatrix");
    if (emissionMatrix == null)
      throw new NullArgumentException("emissionMatrix");
    if (initialProbabilities == null)
      throw new NullArgumentException("initialProbabilities");

    this.hiddenStateNames = HmmUtils.indexNames("hidden state", hiddenStateNames);
    this.outputStateNames = HmmUtils.indexNames("output state", outputStateNames);
    HmmUtils.validate(this.hiddenStateNames.size(), this.outputStateNames.size(),
      transitionMatrix, emissionMatrix, initialProbabilities, tolerance);

    this.transitionMatrix = transitionMatrix.clone();
    this.emissionMatrix = emissionMatrix.clone();
    this.initialProbabilities = initialProbabilities.clone();
    this.tolerance = tolerance;

    int nrOfHiddenStates = this.hiddenStateNames.size();
    int nrOfOutputStates = this.outputStateNames.size();
    logTransitions = new double[nrOfHiddenStates][nrOfHiddenStates];
    logEmissions = new double[nrOfHiddenStates][nrOfOutputStates];
    logInitialProbabilities = new double[nrOfHiddenStates];
    for (int i = 0; i < nrOfHiddenStates; ++i) {
      logInitialProbabilities[i] = LogMath.log(initialProbabilities.getQuick(i));
      for (int j = 0; j < nrOfHiddenStates; ++j)
        logTransitions[i][j] = LogMath.log(transitionMatrix.getQuick(i, j));
      for (int k = 0; k < nrOfOutputStates; ++k)
        logEmissions[i][k] = LogMath.log(emissionMatrix.getQuick(i, k));
    }
  }

  /**
   * Builds a model from plain arrays, checking that they are rectangular before they are
   * turned into matrices.
   *
   * @throws MalformedModelException if names or tables are inconsistent
   */
  public static HmmModel load(List<String> hiddenStateNames, List<String> outputStateNames,
                              double[][] transitions, double[][] emissions, double[] initialProbabilities,
                              double tolerance) {
    if (hiddenStateNames == null)
      throw new NullArgumentException("hiddenStateNames");
    if (outputStateNames == null)
      throw new NullArgumentException("outputStateNames");
    if (transitions == null)
      throw new NullArgumentException("transitions");
    if (emissions == null)
      throw new NullArgumentException("emissions");
    if (initialProbabilities == null)
      throw new NullArgumentException("initialProbabilities");

    int n = hiddenStateNames.size();
    int m = outputStateNames.size();
    if (n == 0)
      throw new MalformedModelException("Model must have at least one hidden state");
    if (m == 0)
      throw new MalformedModelException("Model must have at least one output state");
    HmmUtils.checkRectangular("transition", transitions, n, n);
    HmmUtils.checkRectangular("emission", emissions, n, m);
    if (initialProbabilities.length != n)
      throw new MalformedModelException("Initial probabilities have length " + initialProbabilities.length
        + ", expected " + n);

    return new HmmModel(hiddenStateNames, outputStateNames, new DenseMatrix(transitions),
      new DenseMatrix(emissions), new DenseVector(initialProbabilities), tolerance);
  }

  public static HmmModel load(List<String> hiddenStateNames, List<String> outputStateNames,
                              double[][] transitions, double[][] emissions, double[] initialProbabilities) {
    return load(hiddenStateNames, outputStateNames, transitions, emissions, initialProbabilities,
      DEFAULT_TOLERANCE);
  }

  public int getNrOfHiddenStates() {
    return hiddenStateNames.size();
  }

  public int getNrOfOutputStates() {
    return outputStateNames.size();
  }

  /**
   * @throws UnknownStateException if the model has no hidden state with this name
   */
  public int getHiddenStateID(String name) {
    Integer id = hiddenStateNames.get(name);
    if (id == null)
      throw new UnknownStateException(name);
    return id;
  }

  /**
   * @throws UnknownSymbolException if the model has no output state with this name
   */
  public int getOutputStateID(String name) {
    Integer id = outputStateNames.get(name);
    if (id == null)
      throw new UnknownSymbolException(name);
    return id;
  }

  public boolean hasOutputState(String name) {
    return outputStateNames.containsKey(name);
  }

  public String getHiddenStateName(int id) {
    String name = hiddenStateNames.inverse().get(id);
    if (name == null)
      throw new IndexOutOfBoundsException("Hidden state id " + id + " is out of range");
    return name;
  }

  public String getOutputStateName(int id) {
    String name = outputStateNames.inverse().get(id);
    if (name == null)
      throw new IndexOutOfBoundsException("Output state id " + id + " is out of range");
    return name;
  }

  /**
   * @return hidden state names in id order
   */
  public ImmutableList<String> getHiddenStateNames() {
    return hiddenStateNames.keySet().asList();
  }

  /**
   * @return output state names in id order
   */
  public ImmutableList<String> getOutputStateNames() {
    return outputStateNames.keySet().asList();
  }

  public double getTransitionProbability(int from, int to) {
    return transitionMatrix.getQuick(from, to);
  }

  public double getEmissionProbability(int hiddenState, int outputState) {
    return emissionMatrix.getQuick(hiddenState, outputState);
  }

  public double getInitialProbability(int hiddenState) {
    return initialProbabilities.getQuick(hiddenState);
  }

  public double getLogTransitionProbability(int from, int to) {
    return logTransitions[from][to];
  }

  public double getLogEmissionProbability(int hiddenState, int outputState) {
    return logEmissions[hiddenState][outputState];
  }

  public double getLogInitialProbability(int hiddenState) {
    return logInitialProbabilities[hiddenState];
  }

  /**
   * @return a copy of the transition matrix
   */
  public Matrix getTransitionMatrix() {
    return transitionMatrix.clone();
  }

  /**
   * @return a copy of the emission matrix
   */
  public Matrix getEmissionMatrix() {
    return emissionMatrix.clone();
  }

  /**
   * @return a copy of the initial probabilities
   */
  public Vector getInitialProbabilities() {
    return initialProbabilities.clone();
  }

  public double getTolerance() {
    return tolerance;
  }

  @Override
  public String toString() {
    return "HmmModel{hiddenStates=" + getHiddenStateNames() + ", outputStates=" + getOutputStateNames() + '}';
  }
}
