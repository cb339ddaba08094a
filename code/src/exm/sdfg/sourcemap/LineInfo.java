package exm.sdfg.sourcemap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.sdfg.common.lang.DebugInfo;

/**
 * Source lines a pass is working on, recorded by the source-mapping
 * tooling for one SDFG
 */
public class LineInfo {
  public final int startLine;
  public final int endLine;
  public final String srcFile;
  /** Names of other SDFGs generated from the same lines */
  public final List<String> otherSdfgs;

  public LineInfo(int startLine, int endLine, String srcFile,
                  List<String> otherSdfgs) {
    this.startLine = startLine;
    this.endLine = endLine;
    this.srcFile = srcFile;
    this.otherSdfgs = Collections.unmodifiableList(
            new ArrayList<String>(otherSdfgs));
  }

  public DebugInfo toDebugInfo() {
    return new DebugInfo(srcFile, startLine, endLine);
  }

  @Override
  public String toString() {
    return srcFile + ":" + startLine + "-" + endLine + " " + otherSdfgs;
  }
}
