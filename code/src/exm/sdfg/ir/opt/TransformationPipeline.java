package exm.sdfg.ir.opt;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.sdfg.common.Logging;
import exm.sdfg.common.Settings;
import exm.sdfg.common.exceptions.InvalidOptionException;
import exm.sdfg.common.exceptions.PatternMismatchException;
import exm.sdfg.common.exceptions.SDFGRuntimeError;
import exm.sdfg.common.exceptions.UnsupportedConfigurationException;
import exm.sdfg.ir.tree.SDFG;
import exm.sdfg.sourcemap.LineInfo;
import exm.sdfg.sourcemap.LineInfoSource;


public class TransformationPipeline {

  public TransformationPipeline(PrintStream sdfgOutput,
                                LineInfoSource lineInfo) {
    this.sdfgOutput = sdfgOutput;
    this.lineInfo = lineInfo;
  }

  private final List<Transformation<?>> transformations =
                                      new ArrayList<Transformation<?>>();
  private final PrintStream sdfgOutput;
  private final LineInfoSource lineInfo;

  public void addTransformation(Transformation<?> t) {
    transformations.add(t);
  }

  public void addAll(TransformationRegistry registry) {
    transformations.addAll(registry.transformations());
  }

  /**
   * Apply transformations until nothing more applies or the iteration
   * limit is reached.  Each iteration applies at most one candidate of
   * each enabled transformation, in the order they were added.
   * @return number of transformations applied
   */
  public int run(Logger logger, SDFG root) {
    long maxIterations = maxIterations();
    int applied = 0;
    for (long iteration = 0; iteration < maxIterations; iteration++) {
      boolean changed = false;
      for (Transformation<?> t: transformations) {
        if (transformationEnabled(t)) {
          if (applyFirst(logger, root, t, iteration)) {
            applied++;
            changed = true;
          }
        }
      }
      if (!changed) {
        logger.debug("Pipeline converged after " + iteration +
                     " iterations, " + applied + " applied");
        return applied;
      }
    }
    if (maxIterations > 0) {
      Logging.uniqueWarn("Stopped transforming " + root.getName() +
          " after reaching " + Settings.OPT_MAX_ITERATIONS + "=" +
          maxIterations);
    }
    return applied;
  }

  /**
   * Apply first candidate of t that succeeds
   * @return true if one was applied
   */
  private <R> boolean applyFirst(Logger logger, SDFG root,
              Transformation<R> t, long iteration) {
    for (Candidate<R> c: TransformationRegistry.candidates(root, t)) {
      SDFG target = c.match.sdfg;
      String name = target.getName();
      LineInfo info = lineInfo == null ? null : lineInfo.lookup(name);
      if (info == null) {
        logger.debug("No source lines recorded for " + name);
      }
      target.setLineInfo(info);
      boolean success;
      try {
        logger.debug("Iteration: " + iteration + " Transformation: " + c);
        c.apply(logger);
        success = true;
      } catch (UnsupportedConfigurationException e) {
        logger.warn("Skipping " + c + ": " + e.getMessage());
        success = false;
      } catch (PatternMismatchException e) {
        // Candidates are only produced for feasible matches
        throw new SDFGRuntimeError(e.getMessage());
      } finally {
        target.setLineInfo(null);
      }
      if (!success) {
        continue;
      }
      if (lineInfo != null) {
        lineInfo.clear(name);
      }

      root.resetSDFGIds();
      if (validateEnabled()) {
        Validate.validate(logger, root);
      }
      if (sdfgOutput != null) {
        root.log(sdfgOutput, "Iteration " + iteration + " SDFG after " +
                 t.getName());
      }
      // Graph changed under the candidate iterator
      return true;
    }
    return false;
  }

  public boolean transformationEnabled(Transformation<?> t) {
    try {
      String key = t.getConfigEnabledKey();
      return key == null || Settings.getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new SDFGRuntimeError("Expected config key " +
          t.getConfigEnabledKey() + " to exist");
    }
  }

  private static boolean validateEnabled() {
    try {
      return Settings.getBoolean(Settings.VALIDATE);
    } catch (InvalidOptionException e) {
      throw new SDFGRuntimeError("Expected config key " + Settings.VALIDATE
          + " to exist");
    }
  }

  private static long maxIterations() {
    try {
      return Settings.getLong(Settings.OPT_MAX_ITERATIONS);
    } catch (InvalidOptionException e) {
      throw new SDFGRuntimeError("Expected config key " +
          Settings.OPT_MAX_ITERATIONS + " to exist");
    }
  }
}
