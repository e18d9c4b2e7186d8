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

import com.google.common.base.Joiner;
import org.apache.commons.cli2.CommandLine;
import org.apache.commons.cli2.Group;
import org.apache.commons.cli2.Option;
import org.apache.commons.cli2.OptionException;
import org.apache.commons.cli2.builder.ArgumentBuilder;
import org.apache.commons.cli2.builder.DefaultOptionBuilder;
import org.apache.commons.cli2.builder.GroupBuilder;
import org.apache.commons.cli2.commandline.Parser;
import org.hmmrecognize.common.CommandLineUtil;
import org.hmmrecognize.sequencelearning.hmm.batch.BatchEvaluator;
import org.hmmrecognize.sequencelearning.hmm.batch.EvaluationAlgorithm;
import org.hmmrecognize.sequencelearning.hmm.batch.EvaluationResult;
import org.hmmrecognize.sequencelearning.hmm.batch.SequenceOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;

/**
 * Command-line tool evaluating observed sequences against a model: prints the forward and
 * backward likelihoods and the Viterbi path of every sequence of every given observation file.
 */
public class RecognizeTool {
  private static final Logger log = LoggerFactory.getLogger(RecognizeTool.class);

  private final PrintWriter out;

  public RecognizeTool(PrintWriter out) {
    this.out = out;
  }

  /**
   * @return 0 on success, 1 if the arguments, the model or an observation file could not be used.
   *         Sequences that fail individually are reported in the output and do not change the
   *         status.
   */
  public int run(String[] args) {
    final DefaultOptionBuilder optionBuilder = new DefaultOptionBuilder();
    final ArgumentBuilder argumentBuilder = new ArgumentBuilder();

    final Option modelOption = optionBuilder.withLongName("model").
      withDescription("Text file with the HMM definition").
      withShortName("m").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("path").create()).withRequired(true).create();

    final Option inputOption = optionBuilder.withLongName("input").
      withDescription("One or more text files with observed sequences").
      withShortName("i").withArgument(argumentBuilder.withMinimum(1).
      withName("path").create()).withRequired(true).create();

    final Option algorithmOption = optionBuilder.withLongName("algorithm").
      withDescription("forward, backward, viterbi or all (default)").
      withShortName("a").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("name").create()).withRequired(false).create();

    final Option threadsOption = optionBuilder.withLongName("threads").
      withDescription("Number of threads evaluating sequences").
      withShortName("t").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("number").create()).withRequired(false).create();

    final Option toleranceOption = optionBuilder.withLongName("tolerance").
      withDescription("Allowed deviation of probability rows from 1").
      withShortName("tol").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("number").create()).withRequired(false).create();

    final Option maxCellsOption = optionBuilder.withLongName("maxCells").
      withDescription("Maximal number of hidden states times sequence length").
      withShortName("mc").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("number").create()).withRequired(false).create();

    final Option confOption = optionBuilder.withLongName("conf").
      withDescription("Properties file with hmm.* settings").
      withShortName("c").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("path").create()).withRequired(false).create();

    final Option helpOption = optionBuilder.withLongName("help").
      withDescription("Print out help").withShortName("h").create();

    final Group optionGroup = new GroupBuilder().withOption(modelOption).
      withOption(inputOption).withOption(algorithmOption).withOption(threadsOption).
      withOption(toleranceOption).withOption(maxCellsOption).withOption(confOption).
      withOption(helpOption).withName("Options").create();

    final CommandLine commandLine;
    try {
      final Parser parser = new Parser();
      parser.setGroup(optionGroup);
      parser.setHelpOption(helpOption);
      commandLine = parser.parse(args);
    } catch (OptionException e) {
      log.error(e.getMessage());
      CommandLineUtil.printHelp(optionGroup, e);
      return 1;
    }

    if (commandLine.hasOption(helpOption)) {
      CommandLineUtil.printHelp(optionGroup);
      return 0;
    }

    final RecognizerConfiguration configuration = new RecognizerConfiguration();
    try {
      if (commandLine.hasOption(confOption))
        configuration.addResource(new File((String) commandLine.getValue(confOption)));
      overlay(configuration, commandLine, algorithmOption, RecognizerConfiguration.ALGORITHM);
      overlay(configuration, commandLine, threadsOption, RecognizerConfiguration.THREADS);
      overlay(configuration, commandLine, toleranceOption, RecognizerConfiguration.TOLERANCE);
      overlay(configuration, commandLine, maxCellsOption, RecognizerConfiguration.MAX_TRELLIS_CELLS);

      final String modelPath = (String) commandLine.getValue(modelOption);
      final HmmModel model = new HmmModelReader(configuration.getTolerance()).read(new File(modelPath));

      final List<EvaluationAlgorithm> algorithms = configuration.getAlgorithms();
      final BatchEvaluator evaluator = new BatchEvaluator(model, configuration.getBatchSettings());
      final ObservationSequenceReader sequenceReader = new ObservationSequenceReader();

      for (Object input : commandLine.getValues(inputOption)) {
        final String inputName = (String) input;
        final List<List<String>> sequences = sequenceReader.read(new File(inputName));
        for (final EvaluationAlgorithm algorithm : algorithms) {
          evaluator.evaluate(sequences, algorithm, new BatchEvaluator.ResultHandler() {
            @Override
            public void handle(SequenceOutcome outcome) {
              out.println(format(inputName, algorithm, outcome));
            }
          });
        }
      }
    } catch (MalformedModelException e) {
      log.error("Malformed model", e);
      out.println("ERROR: " + e.getMessage());
      return 1;
    } catch (IllegalArgumentException e) {
      log.error("Invalid setting", e);
      out.println("ERROR: " + e.getMessage());
      return 1;
    } catch (IOException e) {
      log.error("Could not read input", e);
      out.println("ERROR: " + e.getMessage());
      return 1;
    } finally {
      out.flush();
    }
    return 0;
  }

  private static void overlay(RecognizerConfiguration configuration, CommandLine commandLine,
                              Option option, String key) {
    if (commandLine.hasOption(option))
      configuration.set(key, (String) commandLine.getValue(option));
  }

  static String format(String input, EvaluationAlgorithm algorithm, SequenceOutcome outcome) {
    StringBuilder line = new StringBuilder();
    line.append(input).append('#').append(outcome.getIndex()).append(' ').append(algorithm).append(' ');
    if (!outcome.isSuccess())
      return line.append("ERROR: ").append(outcome.getError().getMessage()).toString();

    EvaluationResult result = outcome.getResult();
    line.append("log=").append(result.getLogLikelihood()).append(" p=").append(result.getLikelihood());
    if (result.hasPath())
      line.append(" path=").append(Joiner.on(' ').join(result.getDecodedSequence().getStateNames()));
    return line.toString();
  }

  public static void main(String[] args) {
    System.exit(new RecognizeTool(new PrintWriter(System.out, true)).run(args));
  }
}
