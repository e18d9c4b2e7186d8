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

package org.hmmrecognize.sequencelearning.hmm.batch;

import com.google.common.base.Preconditions;
import org.hmmrecognize.sequencelearning.hmm.DecodedSequence;

/**
 * Likelihood of one observed sequence, and for {@link EvaluationAlgorithm#VITERBI} the decoded
 * hidden state path. For Viterbi the likelihood is the one of the best path, not of the sequence.
 */
public final class EvaluationResult {
  private final EvaluationAlgorithm algorithm;
  private final double logLikelihood;
  private final DecodedSequence decodedSequence;

  EvaluationResult(EvaluationAlgorithm algorithm, double logLikelihood) {
    this.algorithm = algorithm;
    this.logLikelihood = logLikelihood;
    this.decodedSequence = null;
  }

  EvaluationResult(DecodedSequence decodedSequence) {
    this.algorithm = EvaluationAlgorithm.VITERBI;
    this.logLikelihood = decodedSequence.getLogProbability();
    this.decodedSequence = decodedSequence;
  }

  public EvaluationAlgorithm getAlgorithm() {
    return algorithm;
  }

  /**
   * @return natural-log likelihood
   */
  public double getLogLikelihood() {
    return logLikelihood;
  }

  /**
   * @return linear-scale likelihood, may underflow to 0
   */
  public double getLikelihood() {
    return Math.exp(logLikelihood);
  }

  public boolean hasPath() {
    return decodedSequence != null;
  }

  /**
   * @throws IllegalStateException if the result was not produced by the Viterbi algorithm
   */
  public DecodedSequence getDecodedSequence() {
    Preconditions.checkState(decodedSequence != null, "%s does not decode hidden states", algorithm);
    return decodedSequence;
  }

  @Override
  public String toString() {
    return algorithm + ": " + logLikelihood + (hasPath() ? " " + decodedSequence.getStateNames() : "");
  }
}
