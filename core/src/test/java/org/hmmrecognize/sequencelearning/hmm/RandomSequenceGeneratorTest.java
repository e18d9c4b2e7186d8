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

import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;

public class RandomSequenceGeneratorTest extends HmmTestCase {

  @Test
  public void testGeneratedSequencesCanBeReadBack() throws Exception {
    HmmModel model = weatherModel();
    StringWriter output = new StringWriter();
    RandomSequenceGenerator.write(model, 12, 4, 99L, output);

    List<List<String>> sequences = new ObservationSequenceReader().read(new StringReader(output.toString()));
    assertEquals(4, sequences.size());
    for (int i = 0; i < sequences.size(); ++i) {
      List<String> sequence = sequences.get(i);
      assertEquals(12, sequence.size());
      assertArrayEquals(HmmEvaluator.predict(model, 12, 99L + i), HmmUtils.encodeObservations(model, sequence));
    }
  }
}
