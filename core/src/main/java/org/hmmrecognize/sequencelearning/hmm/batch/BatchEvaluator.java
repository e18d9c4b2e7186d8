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

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.lang.NullArgumentException;
import org.hmmrecognize.sequencelearning.hmm.HmmException;
import org.hmmrecognize.sequencelearning.hmm.HmmModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Applies one of the {@link EvaluationAlgorithm}s to every sequence of a batch.
 *
 * <p>The evaluator produces exactly one {@link SequenceOutcome} per input sequence, in input order.
 * A sequence that cannot be evaluated (unknown symbol, empty, too large) yields a failed outcome
 * and does not affect the others. With more than one thread the sequences are evaluated on a
 * fixed pool; the model is immutable so no locking is involved.</p>
 */
public class BatchEvaluator {
  private static final Logger log = LoggerFactory.getLogger(BatchEvaluator.class);

  /**
   * Receives the outcomes of a batch in input order once all of them are computed
   */
  public interface ResultHandler {
    void handle(SequenceOutcome outcome);
  }

  private final HmmModel model;
  private final BatchSettings settings;

  public BatchEvaluator(HmmModel model) {
    this(model, BatchSettings.DEFAULT);
  }

  public BatchEvaluator(HmmModel model, BatchSettings settings) {
    if (model == null)
      throw new NullArgumentException("model");
    if (settings == null)
      throw new NullArgumentException("settings");
    this.model = model;
    this.settings = settings;
  }

  /**
   * Evaluates every sequence with the given algorithm
   *
   * @return one outcome per sequence, in the order of {@code sequences}
   */
  public List<SequenceOutcome> evaluate(List<? extends List<String>> sequences, EvaluationAlgorithm algorithm) {
    return evaluate(sequences, algorithm, null);
  }

  /**
   * Evaluates every sequence with the given algorithm and passes each outcome to the handler, in
   * input order, once the whole batch is done
   *
   * @param resultHandler may be null
   * @return one outcome per sequence, in the order of {@code sequences}
   */
  public List<SequenceOutcome> evaluate(List<? extends List<String>> sequences, EvaluationAlgorithm algorithm,
                                        ResultHandler resultHandler) {
    if (sequences == null)
      throw new NullArgumentException("sequences");
    if (algorithm == null)
      throw new NullArgumentException("algorithm");

    log.info("Evaluating " + sequences.size() + " sequences with " + algorithm + " on "
      + settings.getThreads() + " thread(s)");
    List<SequenceOutcome> outcomes = settings.getThreads() == 1 || sequences.size() < 2
      ? evaluateSequentially(sequences, algorithm)
      : evaluateInParallel(sequences, algorithm);

    int failed = 0;
    for (SequenceOutcome outcome : outcomes) {
      if (!outcome.isSuccess())
        ++failed;
      if (resultHandler != null)
        resultHandler.handle(outcome);
    }
    log.info(algorithm + " finished: " + (outcomes.size() - failed) + " succeeded, " + failed + " failed");
    return outcomes;
  }

  private List<SequenceOutcome> evaluateSequentially(List<? extends List<String>> sequences,
                                                     EvaluationAlgorithm algorithm) {
    ImmutableList.Builder<SequenceOutcome> outcomes = ImmutableList.builder();
    int index = 0;
    for (List<String> sequence : sequences)
      outcomes.add(evaluate(index++, sequence, algorithm));
    return outcomes.build();
  }

  private List<SequenceOutcome> evaluateInParallel(List<? extends List<String>> sequences,
                                                   final EvaluationAlgorithm algorithm) {
    ExecutorService executor = Executors.newFixedThreadPool(settings.getThreads(),
      new ThreadFactoryBuilder().setNameFormat("hmm-batch-%d").setDaemon(true).build());
    try {
      List<Future<SequenceOutcome>> futures = new ArrayList<Future<SequenceOutcome>>(sequences.size());
      int index = 0;
      for (final List<String> sequence : sequences) {
        final int sequenceIndex = index++;
        futures.add(executor.submit(new Callable<SequenceOutcome>() {
          @Override
          public SequenceOutcome call() {
            return evaluate(sequenceIndex, sequence, algorithm);
          }
        }));
      }

      ImmutableList.Builder<SequenceOutcome> outcomes = ImmutableList.builder();
      for (Future<SequenceOutcome> future : futures)
        outcomes.add(future.get());
      return outcomes.build();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while evaluating the batch", e);
    } catch (ExecutionException e) {
      throw Throwables.propagate(e.getCause());
    } finally {
      executor.shutdownNow();
    }
  }

  private SequenceOutcome evaluate(int index, List<String> sequence, EvaluationAlgorithm algorithm) {
    log.debug("Evaluating sequence #" + index);
    try {
      EvaluationResult result = algorithm.evaluate(model, sequence, settings.getMaxTrellisCells());
      return SequenceOutcome.success(index, sequence, result);
    } catch (HmmException e) {
      log.warn("Sequence #" + index + " failed: " + e.getMessage());
      return SequenceOutcome.failure(index, sequence, e);
    }
  }
}
