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

import java.util.Arrays;

/**
 * Result of the Viterbi algorithm: the most likely hidden state path and its log-probability
 * log P(path, observations | model).
 */
public final class DecodedSequence {
  private final int[] states;
  private final ImmutableList<String> stateNames;
  private final double logProbability;

  public DecodedSequence(int[] states, ImmutableList<String> stateNames, double logProbability) {
    this.states = states.clone();
    this.stateNames = stateNames;
    this.logProbability = logProbability;
  }

  /**
   * @return hidden state ids, one per observation
   */
  public int[] getStates() {
    return states.clone();
  }

  public ImmutableList<String> getStateNames() {
    return stateNames;
  }

  /**
   * @return natural-log probability of the path, {@link Double#NEGATIVE_INFINITY} if impossible
   */
  public double getLogProbability() {
    return logProbability;
  }

  /**
   * @return linear-scale probability of the path, may underflow to 0 for long sequences
   */
  public double getProbability() {
    return Math.exp(logProbability);
  }

  public int length() {
    return states.length;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof DecodedSequence))
      return false;
    DecodedSequence other = (DecodedSequence) obj;
    return Arrays.equals(states, other.states) && stateNames.equals(other.stateNames)
      && Double.compare(logProbability, other.logProbability) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(states) + Double.valueOf(logProbability).hashCode();
  }

  @Override
  public String toString() {
    return stateNames + " (log-probability " + logProbability + ')';
  }
}
