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
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Closeables;
import com.google.common.io.Files;
import org.hmmrecognize.sequencelearning.hmm.batch.BatchSettings;
import org.hmmrecognize.sequencelearning.hmm.batch.EvaluationAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.List;
import java.util.Properties;

/**
 * Settings of the recognizer tools, kept as string properties.
 *
 * <p>Values are looked up in increasing precedence from the classpath resource
 * {@value #DEFAULT_RESOURCE}, an optional properties file and explicit {@link #set} calls (used for
 * command-line options).</p>
 */
public final class RecognizerConfiguration {
  private static final Logger log = LoggerFactory.getLogger(RecognizerConfiguration.class);

  public static final String DEFAULT_RESOURCE = "hmm-recognize.properties";

  public static final String TOLERANCE = "hmm.tolerance";
  public static final String THREADS = "hmm.threads";
  public static final String MAX_TRELLIS_CELLS = "hmm.maxTrellisCells";
  public static final String ALGORITHM = "hmm.algorithm";

  static final String ALL_ALGORITHMS = "all";

  private final Properties properties = new Properties();

  /**
   * Creates a configuration with the classpath defaults
   */
  public RecognizerConfiguration() {
    InputStream defaults = RecognizerConfiguration.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
    if (defaults != null) {
      try {
        try {
          properties.load(defaults);
        } finally {
          Closeables.close(defaults, true);
        }
      } catch (IOException e) {
        throw new IllegalStateException("Could not read " + DEFAULT_RESOURCE, e);
      }
    }
  }

  /**
   * Overlays the properties of the given file
   */
  public void addResource(File file) throws IOException {
    log.info("Loading configuration from " + file);
    Reader reader = Files.newReader(file, Charsets.UTF_8);
    try {
      properties.load(reader);
    } finally {
      reader.close();
    }
  }

  public void set(String key, String value) {
    properties.setProperty(key, value);
  }

  public String get(String key) {
    return properties.getProperty(key);
  }

  public double getTolerance() {
    String value = get(TOLERANCE);
    if (value == null)
      return HmmModel.DEFAULT_TOLERANCE;
    try {
      double tolerance = Double.parseDouble(value.trim());
      if (Double.isNaN(tolerance) || tolerance < 0)
        throw new IllegalArgumentException(TOLERANCE + " must be a non-negative number, got " + value);
      return tolerance;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(TOLERANCE + " must be a number, got " + value, e);
    }
  }

  public int getThreads() {
    String value = get(THREADS);
    if (value == null)
      return 1;
    long threads = parseLong(THREADS, value);
    if (threads > Integer.MAX_VALUE)
      throw new IllegalArgumentException(THREADS + " is too large: " + value);
    return (int) threads;
  }

  public long getMaxTrellisCells() {
    String value = get(MAX_TRELLIS_CELLS);
    if (value == null)
      return HmmUtils.UNLIMITED_TRELLIS_CELLS;
    return parseLong(MAX_TRELLIS_CELLS, value);
  }

  /**
   * @return the algorithms to run, in forward, backward, Viterbi order for {@code all}
   */
  public List<EvaluationAlgorithm> getAlgorithms() {
    String value = get(ALGORITHM);
    if (value == null || ALL_ALGORITHMS.equalsIgnoreCase(value.trim()))
      return ImmutableList.copyOf(EvaluationAlgorithm.values());
    ImmutableList.Builder<EvaluationAlgorithm> algorithms = ImmutableList.builder();
    for (String name : Splitter.on(',').trimResults().omitEmptyStrings().split(value))
      algorithms.add(EvaluationAlgorithm.fromName(name));
    return algorithms.build();
  }

  public BatchSettings getBatchSettings() {
    return BatchSettings.DEFAULT.withThreads(getThreads()).withMaxTrellisCells(getMaxTrellisCells());
  }

  private static long parseLong(String key, String value) {
    long parsed;
    try {
      parsed = Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " must be an integer, got " + value, e);
    }
    if (parsed <= 0)
      throw new IllegalArgumentException(key + " must be positive, got " + value);
    return parsed;
  }
}
