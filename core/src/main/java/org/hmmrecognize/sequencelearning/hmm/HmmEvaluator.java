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

import com.google.common.base.Preconditions;
import org.apache.mahout.common.RandomUtils;
import org.apache.mahout.math.Matrix;

import java.util.List;
import java.util.Random;

/**
 * The HMM evaluator class offers the main functionality to work with a trained model: computing
 * the likelihood of observed sequences, decoding the most likely hidden state path and sampling
 * observed sequences from the model.
 *
 * <p>Methods named {@code ...LogLikelihood} and {@code ...LogProbability} return natural-log
 * values; {@code modelLikelihood} returns linear-scale probabilities. Every method taking symbol
 * names checks the whole sequence before a trellis is allocated and throws
 * {@link EmptySequenceException}, {@link UnknownSymbolException} or
 * {@link SequenceTooLargeException}.</p>
 */
public final class HmmEvaluator {
  private HmmEvaluator() {
  }

  /**
   * @return log P(observations | model) computed with the forward algorithm
   */
  public static double forwardLogLikelihood(HmmModel model, List<String> observations) {
    return forwardLogLikelihood(model, observations, HmmUtils.UNLIMITED_TRELLIS_CELLS);
  }

  public static double forwardLogLikelihood(HmmModel model, List<String> observations, long maxTrellisCells) {
    int[] encoded = HmmUtils.checkSequence(model, observations, maxTrellisCells);
    return HmmAlgorithms.forwardLogLikelihood(HmmAlgorithms.forwardAlgorithm(model, encoded));
  }

  /**
   * @return log P(observations | model) computed with the backward algorithm
   */
  public static double backwardLogLikelihood(HmmModel model, List<String> observations) {
    return backwardLogLikelihood(model, observations, HmmUtils.UNLIMITED_TRELLIS_CELLS);
  }

  public static double backwardLogLikelihood(HmmModel model, List<String> observations, long maxTrellisCells) {
    int[] encoded = HmmUtils.checkSequence(model, observations, maxTrellisCells);
    Matrix beta = HmmAlgorithms.backwardAlgorithm(model, encoded);
    return HmmAlgorithms.backwardLogLikelihood(model, beta, encoded);
  }

  /**
   * Returns the linear-scale likelihood that the given model generated the observations
   *
   * @param forward use the forward algorithm if true, the backward one otherwise
   */
  public static double modelLikelihood(HmmModel model, List<String> observations, boolean forward) {
    double logLikelihood = forward ? forwardLogLikelihood(model, observations)
      : backwardLogLikelihood(model, observations);
    return Math.exp(logLikelihood);
  }

  /**
   * Same as {@link #modelLikelihood(HmmModel, List, boolean)} for an encoded sequence
   */
  public static double modelLikelihood(HmmModel model, int[] observations, boolean forward) {
    if (forward)
      return Math.exp(HmmAlgorithms.forwardLogLikelihood(HmmAlgorithms.forwardAlgorithm(model, observations)));
    Matrix beta = HmmAlgorithms.backwardAlgorithm(model, observations);
    return Math.exp(HmmAlgorithms.backwardLogLikelihood(model, beta, observations));
  }

  /**
   * Decodes the most likely hidden state path with the Viterbi algorithm
   */
  public static DecodedSequence decode(HmmModel model, List<String> observations) {
    return decode(model, observations, HmmUtils.UNLIMITED_TRELLIS_CELLS);
  }

  public static DecodedSequence decode(HmmModel model, List<String> observations, long maxTrellisCells) {
    return decode(model, HmmUtils.checkSequence(model, observations, maxTrellisCells));
  }

  public static DecodedSequence decode(HmmModel model, int[] observations) {
    HmmUtils.checkEncodedSequence(model, observations);
    int[] sequence = new int[observations.length];
    double[][] delta = new double[observations.length][model.getNrOfHiddenStates()];
    int[][] phi = new int[observations.length - 1][model.getNrOfHiddenStates()];
    double logProbability = HmmAlgorithms.viterbiAlgorithm(sequence, delta, phi, model, observations);
    return new DecodedSequence(sequence, HmmUtils.decodeStates(model, sequence), logProbability);
  }

  /**
   * Computes log P(states, observations | model) for a given hidden state path
   *
   * @throws IllegalArgumentException if the path and the observations differ in length
   */
  public static double pathLogProbability(HmmModel model, List<String> states, List<String> observations) {
    Preconditions.checkArgument(states.size() == observations.size(),
      "state path has length %s but the observed sequence has length %s", states.size(), observations.size());
    if (observations.isEmpty())
      throw new EmptySequenceException();
    return pathLogProbability(model, HmmUtils.encodeStates(model, states),
      HmmUtils.encodeObservations(model, observations));
  }

  public static double pathLogProbability(HmmModel model, int[] states, int[] observations) {
    HmmUtils.checkEncodedSequence(model, observations);
    Preconditions.checkArgument(states.length == observations.length,
      "state path has length %s but the observed sequence has length %s", states.length, observations.length);
    double logProbability = model.getLogInitialProbability(states[0])
      + model.getLogEmissionProbability(states[0], observations[0]);
    for (int t = 1; t < observations.length; ++t) {
      logProbability += model.getLogTransitionProbability(states[t - 1], states[t])
        + model.getLogEmissionProbability(states[t], observations[t]);
    }
    return logProbability;
  }

  /**
   * Samples an observed sequence of the given length from the model
   */
  public static int[] predict(HmmModel model, int length) {
    return predict(model, length, RandomUtils.getRandom());
  }

  /**
   * Samples an observed sequence of the given length from the model using a seeded generator, so
   * the same seed always yields the same sequence
   */
  public static int[] predict(HmmModel model, int length, long seed) {
    return predict(model, length, RandomUtils.getRandom(seed));
  }

  private static int[] predict(HmmModel model, int length, Random random) {
    Preconditions.checkArgument(length > 0, "length must be positive, got %s", length);
    int nrOfHiddenStates = model.getNrOfHiddenStates();
    int nrOfOutputStates = model.getNrOfOutputStates();
    double[] initial = new double[nrOfHiddenStates];
    for (int i = 0; i < nrOfHiddenStates; ++i)
      initial[i] = model.getInitialProbability(i);

    int[] output = new int[length];
    int hiddenState = sample(initial, random);
    double[] weights = new double[Math.max(nrOfHiddenStates, nrOfOutputStates)];
    for (int t = 0; t < length; ++t) {
      if (t > 0) {
        for (int j = 0; j < nrOfHiddenStates; ++j)
          weights[j] = model.getTransitionProbability(hiddenState, j);
        hiddenState = sample(weights, nrOfHiddenStates, random);
      }
      for (int k = 0; k < nrOfOutputStates; ++k)
        weights[k] = model.getEmissionProbability(hiddenState, k);
      output[t] = sample(weights, nrOfOutputStates, random);
    }
    return output;
  }

  private static int sample(double[] probabilities, Random random) {
    return sample(probabilities, probabilities.length, random);
  }

  /**
   * Draws an index from the first {@code size} weights. Rows only sum to one within the model
   * tolerance, so a draw past the cumulative sum falls back to the last positive weight.
   */
  private static int sample(double[] probabilities, int size, Random random) {
    double draw = random.nextDouble();
    double cumulative = 0;
    int lastPositive = 0;
    for (int i = 0; i < size; ++i) {
      if (probabilities[i] > 0) {
        cumulative += probabilities[i];
        lastPositive = i;
        if (draw < cumulative)
          return i;
      }
    }
    return lastPositive;
  }
}
