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
 * Thrown when the trellis for a sequence (number of hidden states times sequence length)
 * would exceed the configured number of cells.
 */
public class SequenceTooLargeException extends HmmException {
  private final long cells;
  private final long limit;

  public SequenceTooLargeException(long cells, long limit) {
    super("Trellis of " + cells + " cells exceeds the limit of " + limit);
    this.cells = cells;
    this.limit = limit;
  }

  public long getCells() {
    return cells;
  }

  public long getLimit() {
    return limit;
  }
}
