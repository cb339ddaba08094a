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
package exm.sdfg.sourcemap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.sdfg.common.exceptions.SDFGRuntimeError;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.SDFGState;

/**
 * Location of generated code in the IR: SDFG id, state id and the ids of
 * the nodes the code came from.  Written as "sdfgId:stateId:n1,n2".
 */
public class NodeLocation {
  public final int sdfgId;
  public final int stateId;
  public final List<Integer> nodeIds;

  public NodeLocation(int sdfgId, int stateId, List<Integer> nodeIds) {
    this.sdfgId = sdfgId;
    this.stateId = stateId;
    this.nodeIds = Collections.unmodifiableList(
                        new ArrayList<Integer>(nodeIds));
  }

  public static NodeLocation of(SDFGState state, Node ... nodes) {
    List<Integer> ids = new ArrayList<Integer>(nodes.length);
    for (Node n: nodes) {
      if (!state.contains(n)) {
        throw new SDFGRuntimeError("Node " + n + " not in state "
                                   + state.getLabel());
      }
      ids.add(n.getId());
    }
    return new NodeLocation(state.getSDFG().getSDFGId(), state.getId(), ids);
  }

  public String format() {
    return sdfgId + ":" + stateId + ":" + StringUtils.join(nodeIds, ",");
  }

  /**
   * Inverse of {@link #format()}
   * @throws IllegalArgumentException if text is malformed
   */
  public static NodeLocation parse(String text) {
    String parts[] = text.trim().split(":", -1);
    if (parts.length != 3) {
      throw new IllegalArgumentException("Bad node location: " + text);
    }
    try {
      int sdfgId = Integer.parseInt(parts[0]);
      int stateId = Integer.parseInt(parts[1]);
      List<Integer> nodeIds = new ArrayList<Integer>();
      if (!parts[2].isEmpty()) {
        for (String id: parts[2].split(",")) {
          nodeIds.add(Integer.parseInt(id.trim()));
        }
      }
      return new NodeLocation(sdfgId, stateId, nodeIds);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Bad node location: " + text, e);
    }
  }

  @Override
  public int hashCode() {
    return (sdfgId * 31 + stateId) * 31 + nodeIds.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof NodeLocation)) {
      return false;
    }
    NodeLocation other = (NodeLocation)obj;
    return sdfgId == other.sdfgId && stateId == other.stateId &&
           nodeIds.equals(other.nodeIds);
  }

  @Override
  public String toString() {
    return "SDFG " + format();
  }
}
