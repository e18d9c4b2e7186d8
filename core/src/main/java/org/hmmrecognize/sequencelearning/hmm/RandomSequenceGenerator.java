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
import com.google.common.base.Joiner;
import com.google.common.io.Files;
import org.apache.commons.cli2.CommandLine;
import org.apache.commons.cli2.Group;
import org.apache.commons.cli2.Option;
import org.apache.commons.cli2.OptionException;
import org.apache.commons.cli2.builder.ArgumentBuilder;
import org.apache.commons.cli2.builder.DefaultOptionBuilder;
import org.apache.commons.cli2.builder.GroupBuilder;
import org.apache.commons.cli2.commandline.Parser;
import org.hmmrecognize.common.CommandLineUtil;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.Date;

/**
 * Command-line tool for generating random observed sequences by given HMM. The output uses the
 * observation file format read by {@link ObservationSequenceReader}.
 */
public class RandomSequenceGenerator {
  private RandomSequenceGenerator() {
  }

  /**
   * Writes {@code count} sequences of the given length; sequence i is sampled with seed
   * {@code seed + i}
   */
  public static void write(HmmModel model, int length, int count, long seed, Writer output) {
    PrintWriter writer = new PrintWriter(output);
    writer.println(count);
    for (int i = 0; i < count; ++i) {
      int[] observations = HmmEvaluator.predict(model, length, seed + i);
      writer.println(length);
      writer.println(Joiner.on(' ').join(HmmUtils.decodeObservations(model, observations)));
    }
    writer.flush();
  }

  public static void main(String[] args) throws IOException {
    final DefaultOptionBuilder optionBuilder = new DefaultOptionBuilder();
    final ArgumentBuilder argumentBuilder = new ArgumentBuilder();

    final Option outputOption = optionBuilder.withLongName("output").
      withDescription("Output file with sequences of observed states, standard output if omitted").
      withShortName("o").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("path").create()).withRequired(false).create();

    final Option modelOption = optionBuilder.withLongName("model").
      withDescription("Path to the HMM definition").
      withShortName("m").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("path").create()).withRequired(true).create();

    final Option lengthOption = optionBuilder.withLongName("length").
      withDescription("Length of generated sequences").
      withShortName("l").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("number").create()).withRequired(true).create();

    final Option countOption = optionBuilder.withLongName("count").
      withDescription("Number of generated sequences").
      withShortName("n").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("number").withDefault("1").create()).withRequired(false).create();

    final Option seedOption = optionBuilder.withLongName("seed").
      withDescription("Seed of the random generator, current time if omitted").
      withShortName("s").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("number").create()).withRequired(false).create();

    final Group optionGroup = new GroupBuilder().
      withOption(outputOption).withOption(modelOption).withOption(lengthOption).
      withOption(countOption).withOption(seedOption).withName("Options").create();

    try {
      final Parser parser = new Parser();
      parser.setGroup(optionGroup);
      final CommandLine commandLine = parser.parse(args);

      final String modelPath = (String) commandLine.getValue(modelOption);
      final int length = Integer.parseInt((String) commandLine.getValue(lengthOption));
      final int count = Integer.parseInt((String) commandLine.getValue(countOption, "1"));
      final long seed = commandLine.hasOption(seedOption)
        ? Long.parseLong((String) commandLine.getValue(seedOption)) : new Date().getTime();

      final HmmModel model = new HmmModelReader().read(new File(modelPath));

      if (commandLine.hasOption(outputOption)) {
        final Writer writer = Files.newWriter(new File((String) commandLine.getValue(outputOption)), Charsets.UTF_8);
        try {
          write(model, length, count, seed, writer);
        } finally {
          writer.close();
        }
      } else {
        write(model, length, count, seed, new OutputStreamWriter(System.out, Charsets.UTF_8));
      }
    } catch (OptionException e) {
      CommandLineUtil.printHelp(optionGroup, e);
    }
  }
}
