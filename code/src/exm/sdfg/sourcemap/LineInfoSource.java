package exm.sdfg.sourcemap;

/**
 * Where line information for SDFGs comes from.  A missing record is
 * normal and just means no provenance is kept.
 */
public interface LineInfoSource {
  /**
   * @return record for the named SDFG, or null if there is none
   */
  public LineInfo lookup(String sdfgName);

  /**
   * Discard the record for the named SDFG, if any
   */
  public void clear(String sdfgName);
}
