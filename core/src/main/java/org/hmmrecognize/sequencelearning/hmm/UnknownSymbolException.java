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
 * Thrown when an observed sequence references a symbol the model does not emit.
 */
public class UnknownSymbolException extends HmmException {
  private final String symbolName;
  private final int position;

  public UnknownSymbolException(String symbolName) {
    super("No such output: " + symbolName);
    this.symbolName = symbolName;
    this.position = -1;
  }

  public UnknownSymbolException(String symbolName, int position) {
    super("No such output: " + symbolName + " at position " + position);
    this.symbolName = symbolName;
    this.position = position;
  }

  public String getSymbolName() {
    return symbolName;
  }

  /**
   * @return index of the symbol in the observed sequence or -1 if it was looked up directly
   */
  public int getPosition() {
    return position;
  }
}
