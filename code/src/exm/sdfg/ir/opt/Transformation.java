/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.sdfg.ir.opt;

import java.util.List;

import org.apache.log4j.Logger;

import exm.sdfg.common.exceptions.PatternMismatchException;
import exm.sdfg.common.exceptions.UnsupportedConfigurationException;
import exm.sdfg.ir.tree.SDFG;

/**
 * A pattern-based rewrite of the IR.
 * @param <R> auxiliary result of applying the transformation
 */
public interface Transformation<R> {
  public abstract String getName();

  /**
   * @return Key indicating whether transformation is enabled.  If null,
   *         always enabled
   */
  public abstract String getConfigEnabledKey();

  /**
   * @return true if patterns are matched against the state machine,
   *         false if against the dataflow graph of each state
   */
  public abstract boolean isStateflow();

  public abstract List<Pattern> patterns();

  /**
   * Check a structural match for validity.  Must not modify anything.
   */
  public abstract boolean feasible(SDFG sdfg, Match match);

  /**
   * Rewrite the graph at the match.  Either completes and leaves the
   * graph well-formed, or throws and leaves the graph unmodified.
   * @param sdfg SDFG containing the match
   * @throws PatternMismatchException if match isn't feasible
   * @throws UnsupportedConfigurationException if the match is a case
   *         the rewrite doesn't handle
   */
  public abstract R apply(Logger logger, SDFG sdfg, Match match)
      throws PatternMismatchException, UnsupportedConfigurationException;
}
