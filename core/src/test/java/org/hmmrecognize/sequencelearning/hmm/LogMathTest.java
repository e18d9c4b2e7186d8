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

import org.hmmrecognize.common.HmmTestCase;
import org.junit.Test;

public class LogMathTest extends HmmTestCase {
  private static final double EPSILON = 1.0e-12;

  @Test
  public void testLog() {
    assertEquals(Double.NEGATIVE_INFINITY, LogMath.log(0.0), 0.0);
    assertEquals(0.0, LogMath.log(1.0), 0.0);
    assertEquals(Math.log(0.25), LogMath.log(0.25), 0.0);
  }

  @Test
  public void testLogSumExp() {
    double[] values = {Math.log(0.1), Math.log(0.2), Math.log(0.3), LogMath.LOG_ZERO};
    assertEquals(Math.log(0.6), LogMath.logSumExp(values), EPSILON);
    assertEquals(LogMath.LOG_ZERO, LogMath.logSumExp(new double[] {LogMath.LOG_ZERO, LogMath.LOG_ZERO}), 0.0);

    // terms far below Double.MIN_VALUE in linear scale
    double[] tiny = {-2000, -2000};
    assertEquals(-2000 + Math.log(2), LogMath.logSumExp(tiny), EPSILON);
  }

  @Test
  public void testArgMaxPrefersLowestIndex() {
    assertEquals(1, LogMath.argMax(new double[] {-3, -1, -2}));
    assertEquals(0, LogMath.argMax(new double[] {-1, -1, -1}));
    assertEquals(1, LogMath.argMax(new double[] {-5, -1, -1}));
    assertEquals(0, LogMath.argMax(new double[] {LogMath.LOG_ZERO, LogMath.LOG_ZERO}));
  }
}
