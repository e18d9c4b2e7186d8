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

package org.hmmrecognize.common;

import org.apache.commons.cli2.Group;
import org.apache.commons.cli2.OptionException;
import org.apache.commons.cli2.util.HelpFormatter;

import java.io.PrintWriter;

public final class CommandLineUtil {
  private CommandLineUtil() {
  }

  public static void printHelp(Group group) {
    HelpFormatter formatter = new HelpFormatter();
    formatter.setGroup(group);
    formatter.print();
  }

  /**
   * Prints the reason the arguments were rejected followed by the usage
   */
  public static void printHelp(Group group, OptionException e) {
    HelpFormatter formatter = new HelpFormatter();
    formatter.setGroup(group);
    formatter.setException(e);
    formatter.setPrintWriter(new PrintWriter(System.out, true));
    formatter.print();
  }
}
