package exm.sdfg.ir.tree;

/**
 * Non-owning handle from a nested SDFG to the node that owns it.
 * Resolved through the root SDFG by id, never by object reference.
 */
public class ParentRef {
  public final int sdfgId;
  public final int stateId;
  public final int nodeId;

  public ParentRef(int sdfgId, int stateId, int nodeId) {
    this.sdfgId = sdfgId;
    this.stateId = stateId;
    this.nodeId = nodeId;
  }

  public ParentRef withSDFGId(int newSDFGId) {
    return new ParentRef(newSDFGId, stateId, nodeId);
  }

  @Override
  public int hashCode() {
    return (sdfgId * 31 + stateId) * 31 + nodeId;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ParentRef)) {
      return false;
    }
    ParentRef other = (ParentRef)obj;
    return sdfgId == other.sdfgId && stateId == other.stateId &&
           nodeId == other.nodeId;
  }

  @Override
  public String toString() {
    return "sdfg " + sdfgId + " state " + stateId + " node " + nodeId;
  }
}
