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
 * Base class of all errors raised while building a {@link HmmModel} or evaluating an observed
 * sequence against it. Errors of this type are tied to the input that caused them, so a batch
 * of sequences may report them per sequence and continue.
 */
public class HmmException extends RuntimeException {
  public HmmException(String msg) {
    super(msg);
  }

  public HmmException(String msg, Throwable e) {
    super(msg, e);
  }
}
