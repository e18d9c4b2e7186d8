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
import org.hmmrecognize.sequencelearning.hmm.HmmException;

import java.util.List;

/**
 * Outcome of evaluating one sequence of a batch: either a result or the error that stopped the
 * evaluation of this sequence
 */
public final class SequenceOutcome {
  private final int index;
  private final List<String> observations;
  private final EvaluationResult result;
  private final HmmException error;

  private SequenceOutcome(int index, List<String> observations, EvaluationResult result, HmmException error) {
    this.index = index;
    this.observations = observations;
    this.result = result;
    this.error = error;
  }

  static SequenceOutcome success(int index, List<String> observations, EvaluationResult result) {
    return new SequenceOutcome(index, observations, result, null);
  }

  static SequenceOutcome failure(int index, List<String> observations, HmmException error) {
    return new SequenceOutcome(index, observations, null, error);
  }

  /**
   * @return position of the sequence in the batch input
   */
  public int getIndex() {
    return index;
  }

  public List<String> getObservations() {
    return observations;
  }

  public boolean isSuccess() {
    return error == null;
  }

  public EvaluationResult getResult() {
    Preconditions.checkState(isSuccess(), "sequence %s failed: %s", index, error);
    return result;
  }

  public HmmException getError() {
    Preconditions.checkState(!isSuccess(), "sequence %s did not fail", index);
    return error;
  }

  @Override
  public String toString() {
    return "#" + index + ' ' + (isSuccess() ? result : "ERROR: " + error.getMessage());
  }
}
