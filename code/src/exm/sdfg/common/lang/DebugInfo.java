package exm.sdfg.common.lang;

/**
 * Source provenance of an IR element: file and line/column span.
 */
public class DebugInfo {
  public final String filename;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  public DebugInfo(String filename, int startLine, int startColumn,
                   int endLine, int endColumn) {
    this.filename = filename;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  public DebugInfo(String filename, int startLine, int endLine) {
    this(filename, startLine, 0, endLine, 0);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((filename == null) ? 0 : filename.hashCode());
    result = prime * result + startLine;
    result = prime * result + startColumn;
    result = prime * result + endLine;
    result = prime * result + endColumn;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof DebugInfo))
      return false;
    DebugInfo other = (DebugInfo) obj;
    if (filename == null) {
      if (other.filename != null)
        return false;
    } else if (!filename.equals(other.filename))
      return false;
    return startLine == other.startLine && startColumn == other.startColumn
        && endLine == other.endLine && endColumn == other.endColumn;
  }

  @Override
  public String toString() {
    return filename + ":" + startLine + "-" + endLine;
  }
}
