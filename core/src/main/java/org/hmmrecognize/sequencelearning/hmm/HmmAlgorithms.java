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
import org.apache.mahout.math.DenseMatrix;
import org.apache.mahout.math.Matrix;

/**
 * Trellis implementations of the forward, backward and Viterbi algorithms over encoded
 * observation sequences. Every algorithm works on natural-log probabilities, fills its table in
 * time order (backward: reverse time order) and never mutates the model.
 *
 * <p>Row t of every trellis corresponds to observation t, column i to hidden state i.</p>
 */
public final class HmmAlgorithms {
  private HmmAlgorithms() {
  }

  /**
   * Computes the forward trellis: entry (t, i) is log P(o_0 .. o_t, q_t = i | model).
   *
   * @param model HMM to evaluate
   * @param observations encoded, non-empty observation sequence
   * @return T x N matrix of log-probabilities
   */
  public static Matrix forwardAlgorithm(HmmModel model, int[] observations) {
    HmmUtils.checkEncodedSequence(model, observations);
    int nrOfHiddenStates = model.getNrOfHiddenStates();
    Matrix alpha = new DenseMatrix(observations.length, nrOfHiddenStates);

    for (int i = 0; i < nrOfHiddenStates; ++i)
      alpha.setQuick(0, i, model.getLogInitialProbability(i) + model.getLogEmissionProbability(i, observations[0]));

    double[] terms = new double[nrOfHiddenStates];
    for (int t = 1; t < observations.length; ++t) {
      for (int i = 0; i < nrOfHiddenStates; ++i) {
        for (int j = 0; j < nrOfHiddenStates; ++j)
          terms[j] = alpha.getQuick(t - 1, j) + model.getLogTransitionProbability(j, i);
        alpha.setQuick(t, i, model.getLogEmissionProbability(i, observations[t]) + LogMath.logSumExp(terms));
      }
    }
    return alpha;
  }

  /**
   * Computes the backward trellis: entry (t, i) is log P(o_t+1 .. o_T-1 | q_t = i, model).
   *
   * @param model HMM to evaluate
   * @param observations encoded, non-empty observation sequence
   * @return T x N matrix of log-probabilities, the last row is all zeros
   */
  public static Matrix backwardAlgorithm(HmmModel model, int[] observations) {
    HmmUtils.checkEncodedSequence(model, observations);
    int nrOfHiddenStates = model.getNrOfHiddenStates();
    int last = observations.length - 1;
    Matrix beta = new DenseMatrix(observations.length, nrOfHiddenStates);

    for (int i = 0; i < nrOfHiddenStates; ++i)
      beta.setQuick(last, i, 0.0);

    double[] terms = new double[nrOfHiddenStates];
    for (int t = last - 1; t >= 0; --t) {
      for (int i = 0; i < nrOfHiddenStates; ++i) {
        for (int j = 0; j < nrOfHiddenStates; ++j) {
          terms[j] = model.getLogTransitionProbability(i, j)
            + model.getLogEmissionProbability(j, observations[t + 1]) + beta.getQuick(t + 1, j);
        }
        beta.setQuick(t, i, LogMath.logSumExp(terms));
      }
    }
    return beta;
  }

  /**
   * @param alpha trellis produced by {@link #forwardAlgorithm}
   * @return log P(observations | model)
   */
  public static double forwardLogLikelihood(Matrix alpha) {
    int last = alpha.numRows() - 1;
    double[] terms = new double[alpha.numCols()];
    for (int i = 0; i < terms.length; ++i)
      terms[i] = alpha.getQuick(last, i);
    return LogMath.logSumExp(terms);
  }

  /**
   * @param model the model the trellis was computed with
   * @param beta trellis produced by {@link #backwardAlgorithm}
   * @param observations the observations the trellis was computed for
   * @return log P(observations | model)
   */
  public static double backwardLogLikelihood(HmmModel model, Matrix beta, int[] observations) {
    double[] terms = new double[model.getNrOfHiddenStates()];
    for (int i = 0; i < terms.length; ++i) {
      terms[i] = model.getLogInitialProbability(i) + model.getLogEmissionProbability(i, observations[0])
        + beta.getQuick(0, i);
    }
    return LogMath.logSumExp(terms);
  }

  /**
   * Viterbi algorithm for the most likely hidden state sequence. Whenever several predecessors
   * (or final states) reach the same maximal log-probability the one with the lowest id is
   * chosen.
   *
   * @param sequence receives the decoded hidden states, must have length T
   * @param delta receives the log-probability of the best path ending in each state, T x N
   * @param phi receives the backpointers, (T - 1) x N; phi[t - 1][i] is the predecessor of
   *            state i at time t
   * @param model HMM to decode with
   * @param observations encoded, non-empty observation sequence
   * @return log-probability of the decoded path together with the observations
   */
  public static double viterbiAlgorithm(int[] sequence, double[][] delta, int[][] phi,
                                        HmmModel model, int[] observations) {
    HmmUtils.checkEncodedSequence(model, observations);
    int nrOfHiddenStates = model.getNrOfHiddenStates();
    int length = observations.length;
    Preconditions.checkArgument(sequence.length == length, "sequence must have length %s", length);
    Preconditions.checkArgument(delta.length == length, "delta must have %s rows", length);
    Preconditions.checkArgument(phi.length == length - 1, "phi must have %s rows", length - 1);

    for (int i = 0; i < nrOfHiddenStates; ++i)
      delta[0][i] = model.getLogInitialProbability(i) + model.getLogEmissionProbability(i, observations[0]);

    for (int t = 1; t < length; ++t) {
      for (int i = 0; i < nrOfHiddenStates; ++i) {
        int maxState = 0;
        double maxProb = delta[t - 1][0] + model.getLogTransitionProbability(0, i);
        for (int j = 1; j < nrOfHiddenStates; ++j) {
          double currentProb = delta[t - 1][j] + model.getLogTransitionProbability(j, i);
          if (currentProb > maxProb) {
            maxProb = currentProb;
            maxState = j;
          }
        }
        delta[t][i] = maxProb + model.getLogEmissionProbability(i, observations[t]);
        phi[t - 1][i] = maxState;
      }
    }

    // traceback from the best final state
    sequence[length - 1] = LogMath.argMax(delta[length - 1]);
    for (int t = length - 2; t >= 0; --t)
      sequence[t] = phi[t][sequence[t + 1]];

    return delta[length - 1][sequence[length - 1]];
  }
}
