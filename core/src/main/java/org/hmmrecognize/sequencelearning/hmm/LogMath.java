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

/**
 * Arithmetic on natural-log probabilities. Zero probability is represented by
 * {@link Double#NEGATIVE_INFINITY}; none of the methods below ever produce NaN from valid
 * log-probabilities.
 */
public final class LogMath {
  public static final double LOG_ZERO = Double.NEGATIVE_INFINITY;

  private LogMath() {
  }

  /**
   * @return natural logarithm of the probability, {@link #LOG_ZERO} for 0
   */
  public static double log(double probability) {
    return probability == 0.0 ? LOG_ZERO : Math.log(probability);
  }

  /**
   * Computes log(sum(exp(values[i]))) using the maximum as the pivot
   */
  public static double logSumExp(double[] values) {
    double max = LOG_ZERO;
    for (double value : values) {
      if (value > max)
        max = value;
    }
    if (max == LOG_ZERO)
      return LOG_ZERO;

    double sum = 0.0;
    for (double value : values)
      sum += Math.exp(value - max);
    return max + Math.log(sum);
  }

  /**
   * Index of the maximal value. Ties, including all values being {@link #LOG_ZERO}, resolve to
   * the lowest index.
   */
  public static int argMax(double[] values) {
    int maxIndex = 0;
    for (int i = 1; i < values.length; ++i) {
      if (values[i] > values[maxIndex])
        maxIndex = i;
    }
    return maxIndex;
  }
}
