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

import org.hmmrecognize.sequencelearning.hmm.DecodedSequence;
import org.hmmrecognize.sequencelearning.hmm.HmmEvaluator;
import org.hmmrecognize.sequencelearning.hmm.HmmModel;

import java.util.List;
import java.util.Locale;

/**
 * Algorithms a {@link BatchEvaluator} can apply to each observed sequence
 */
public enum EvaluationAlgorithm {
  FORWARD {
    @Override
    EvaluationResult evaluate(HmmModel model, List<String> observations, long maxTrellisCells) {
      return new EvaluationResult(this, HmmEvaluator.forwardLogLikelihood(model, observations, maxTrellisCells));
    }
  },
  BACKWARD {
    @Override
    EvaluationResult evaluate(HmmModel model, List<String> observations, long maxTrellisCells) {
      return new EvaluationResult(this, HmmEvaluator.backwardLogLikelihood(model, observations, maxTrellisCells));
    }
  },
  VITERBI {
    @Override
    EvaluationResult evaluate(HmmModel model, List<String> observations, long maxTrellisCells) {
      DecodedSequence decoded = HmmEvaluator.decode(model, observations, maxTrellisCells);
      return new EvaluationResult(decoded);
    }
  };

  abstract EvaluationResult evaluate(HmmModel model, List<String> observations, long maxTrellisCells);

  /**
   * Case-insensitive lookup by name, e.g. {@code "viterbi"}
   *
   * @throws IllegalArgumentException for unknown names
   */
  public static EvaluationAlgorithm fromName(String name) {
    try {
      return valueOf(name.trim().toUpperCase(Locale.ENGLISH));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown algorithm: " + name, e);
    }
  }
}
