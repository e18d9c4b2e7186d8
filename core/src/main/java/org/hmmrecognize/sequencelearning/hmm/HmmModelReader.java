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

import com.google.common.base.CharMatcher;
import com.google.common.base.Charsets;
import com.google.common.base.Splitter;
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
 * Reads a {@link HmmModel} from the plain-text model format:
 * <pre>
 * N M [T]
 * &lt;N hidden state names&gt;
 * &lt;M output state names&gt;
 * a:
 * &lt;N rows of N transition probabilities&gt;
 * b:
 * &lt;N rows of M emission probabilities&gt;
 * pi:
 * &lt;N initial probabilities&gt;
 * </pre>
 * Tokens are separated by whitespace. The optional T on the first line is the expected
 * observation length and is not used.
 */
public final class HmmModelReader {
  private static final Logger log = LoggerFactory.getLogger(HmmModelReader.class);

  static final Splitter TOKENS = Splitter.on(CharMatcher.WHITESPACE).omitEmptyStrings();

  private final double tolerance;

  public HmmModelReader() {
    this(HmmModel.DEFAULT_TOLERANCE);
  }

  public HmmModelReader(double tolerance) {
    this.tolerance = tolerance;
  }

  public HmmModel read(File file) throws IOException {
    log.info("Reading HMM from " + file);
    BufferedReader reader = Files.newReader(file, Charsets.UTF_8);
    try {
      HmmModel model = read(reader);
      log.info("Model loaded: " + model.getNrOfHiddenStates() + " hidden states, "
        + model.getNrOfOutputStates() + " output states");
      return model;
    } finally {
      reader.close();
    }
  }

  /**
   * @throws MalformedModelException if the content does not describe a valid model
   * @throws IOException if the input could not be read
   */
  public HmmModel read(Reader input) throws IOException {
    LineSource lines = new LineSource(input instanceof BufferedReader
      ? (BufferedReader) input : new BufferedReader(input));

    List<String> sizes = lines.nextTokens("sizes");
    if (sizes.size() < 2)
      throw lines.error("expected the number of hidden and output states, got " + sizes);
    int nrOfHiddenStates = lines.parseCount(sizes.get(0));
    int nrOfOutputStates = lines.parseCount(sizes.get(1));

    List<String> hiddenStateNames = lines.nextTokens("hidden state names");
    lines.checkCount("hidden state names", hiddenStateNames.size(), nrOfHiddenStates);
    List<String> outputStateNames = lines.nextTokens("output state names");
    lines.checkCount("output state names", outputStateNames.size(), nrOfOutputStates);

    lines.expectHeader("a:");
    double[][] transitions = new double[nrOfHiddenStates][];
    for (int i = 0; i < nrOfHiddenStates; ++i)
      transitions[i] = lines.nextRow("transition", nrOfHiddenStates);

    lines.expectHeader("b:");
    double[][] emissions = new double[nrOfHiddenStates][];
    for (int i = 0; i < nrOfHiddenStates; ++i)
      emissions[i] = lines.nextRow("emission", nrOfOutputStates);

    lines.expectHeader("pi:");
    double[] initialProbabilities = lines.nextRow("initial probabilities", nrOfHiddenStates);

    return HmmModel.load(hiddenStateNames, outputStateNames, transitions, emissions, initialProbabilities,
      tolerance);
  }

  /**
   * Reads non-blank lines and keeps track of the line number for error messages
   */
  private static final class LineSource {
    private final BufferedReader reader;
    private int lineNumber;

    LineSource(BufferedReader reader) {
      this.reader = reader;
    }

    String nextLine(String expected) throws IOException {
      String line;
      do {
        line = reader.readLine();
        ++lineNumber;
        if (line == null)
          throw error("unexpected end of input, expected " + expected);
      } while (line.trim().isEmpty());
      return line;
    }

    List<String> nextTokens(String expected) throws IOException {
      return Lists.newArrayList(TOKENS.split(nextLine(expected)));
    }

    void expectHeader(String header) throws IOException {
      String line = nextLine(header).trim();
      if (!line.equals(header))
        throw error("expected '" + header + "', got '" + line + '\'');
    }

    double[] nextRow(String table, int expectedLength) throws IOException {
      List<String> tokens = nextTokens(table + " row");
      checkCount(table + " values", tokens.size(), expectedLength);
      double[] row = new double[tokens.size()];
      for (int i = 0; i < row.length; ++i) {
        try {
          row[i] = Double.parseDouble(tokens.get(i));
        } catch (NumberFormatException e) {
          throw error("'" + tokens.get(i) + "' is not a number", e);
        }
      }
      return row;
    }

    int parseCount(String token) {
      int count;
      try {
        count = Integer.parseInt(token);
      } catch (NumberFormatException e) {
        throw error("'" + token + "' is not an integer", e);
      }
      if (count <= 0)
        throw error("count must be positive, got " + count);
      return count;
    }

    void checkCount(String what, int actual, int expected) {
      if (actual != expected)
        throw error("expected " + expected + ' ' + what + ", got " + actual);
    }

    MalformedModelException error(String message) {
      return new MalformedModelException("Line " + lineNumber + ": " + message);
    }

    MalformedModelException error(String message, Throwable cause) {
      return new MalformedModelException("Line " + lineNumber + ": " + message, cause);
    }
  }
}
