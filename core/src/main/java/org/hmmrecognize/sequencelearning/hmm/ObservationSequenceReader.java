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

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.io.Files;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.List;

/**
 * Reads observed sequences from the plain-text observation format:
 * <pre>
 * &lt;number of sequences&gt;
 * &lt;length of sequence 1&gt;
 * &lt;symbols of sequence 1&gt;
 * ...
 * </pre>
 * The length lines are informational and skipped. A blank symbol line yields an empty sequence,
 * which is reported when the sequence is evaluated.
 */
public final class ObservationSequenceReader {
  private static final Logger log = LoggerFactory.getLogger(ObservationSequenceReader.class);

  public List<List<String>> read(File file) throws IOException {
    BufferedReader reader = Files.newReader(file, Charsets.UTF_8);
    try {
      List<List<String>> sequences = read(reader);
      log.info("Read " + sequences.size() + " observed sequences from " + file);
      return sequences;
    } finally {
      reader.close();
    }
  }

  /**
   * @throws IOException if the input could not be read or does not contain the declared number of
   *                     sequences
   */
  public List<List<String>> read(Reader input) throws IOException {
    BufferedReader reader = input instanceof BufferedReader ? (BufferedReader) input : new BufferedReader(input);

    String header = reader.readLine();
    while (header != null && header.trim().isEmpty())
      header = reader.readLine();
    if (header == null)
      throw new IOException("Observation input is empty, expected the number of sequences");

    int count;
    try {
      count = Integer.parseInt(header.trim());
    } catch (NumberFormatException e) {
      throw new IOException("Expected the number of sequences, got '" + header.trim() + '\'', e);
    }
    if (count < 0)
      throw new IOException("Number of sequences must not be negative, got " + count);

    List<List<String>> sequences = Lists.newArrayList();
    for (int i = 0; i < count; ++i) {
      // length line, not used
      if (reader.readLine() == null)
        throw new IOException("Expected " + count + " sequences, found " + i);
      String line = reader.readLine();
      if (line == null)
        throw new IOException("Expected " + count + " sequences, found " + i);
      sequences.add(ImmutableList.copyOf(HmmModelReader.TOKENS.split(line)));
    }
    return sequences;
  }
}
