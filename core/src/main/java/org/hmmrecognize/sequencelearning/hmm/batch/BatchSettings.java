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
import org.hmmrecognize.sequencelearning.hmm.HmmUtils;

/**
 * Immutable settings of a {@link BatchEvaluator}
 */
public final class BatchSettings {
  public static final BatchSettings DEFAULT = new BatchSettings(1, HmmUtils.UNLIMITED_TRELLIS_CELLS);

  private final int threads;
  private final long maxTrellisCells;

  /**
   * @param threads number of worker threads, 1 evaluates in the calling thread
   * @param maxTrellisCells maximal number of hidden states times sequence length per sequence
   */
  public BatchSettings(int threads, long maxTrellisCells) {
    Preconditions.checkArgument(threads > 0, "threads must be positive, got %s", threads);
    Preconditions.checkArgument(maxTrellisCells > 0, "maxTrellisCells must be positive, got %s", maxTrellisCells);
    this.threads = threads;
    this.maxTrellisCells = maxTrellisCells;
  }

  public int getThreads() {
    return threads;
  }

  public long getMaxTrellisCells() {
    return maxTrellisCells;
  }

  public BatchSettings withThreads(int threads) {
    return new BatchSettings(threads, maxTrellisCells);
  }

  public BatchSettings withMaxTrellisCells(long maxTrellisCells) {
    return new BatchSettings(threads, maxTrellisCells);
  }
}
