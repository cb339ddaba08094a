package exm.sdfg.sourcemap;

import java.util.HashMap;
import java.util.Map;

public class InMemoryLineInfoSource implements LineInfoSource {
  private final Map<String, LineInfo> records =
                              new HashMap<String, LineInfo>();

  public void put(String sdfgName, LineInfo info) {
    records.put(sdfgName, info);
  }

  @Override
  public LineInfo lookup(String sdfgName) {
    return records.get(sdfgName);
  }

  @Override
  public void clear(String sdfgName) {
    records.remove(sdfgName);
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }
}
