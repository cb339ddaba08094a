package exm.sdfg.ir.opt;

import org.apache.log4j.Logger;

import exm.sdfg.common.exceptions.PatternMismatchException;
import exm.sdfg.common.exceptions.UnsupportedConfigurationException;

/**
 * A feasible match for a transformation, ready to apply
 */
public class Candidate<R> {
  public final Transformation<R> transformation;
  public final Match match;

  public Candidate(Transformation<R> transformation, Match match) {
    this.transformation = transformation;
    this.match = match;
  }

  public R apply(Logger logger)
      throws PatternMismatchException, UnsupportedConfigurationException {
    return transformation.apply(logger, match.sdfg, match);
  }

  @Override
  public String toString() {
    return transformation.getName() + " @ " + match;
  }
}
