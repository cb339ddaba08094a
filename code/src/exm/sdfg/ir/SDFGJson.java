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
package exm.sdfg.ir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.apache.commons.io.FileUtils;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import exm.sdfg.common.exceptions.SDFGRuntimeError;
import exm.sdfg.common.lang.ArrayDesc;
import exm.sdfg.common.lang.ArrayDesc.DataKind;
import exm.sdfg.common.lang.DataType;
import exm.sdfg.common.lang.DebugInfo;
import exm.sdfg.common.lang.Memlet;
import exm.sdfg.common.lang.ScheduleType;
import exm.sdfg.common.lang.StorageType;
import exm.sdfg.common.lang.Subset;
import exm.sdfg.common.lang.SymExpr;
import exm.sdfg.ir.tree.Edge;
import exm.sdfg.ir.tree.InterstateEdge;
import exm.sdfg.ir.tree.NodeKind;
import exm.sdfg.ir.tree.Nodes.AccessNode;
import exm.sdfg.ir.tree.Nodes.LibraryNode;
import exm.sdfg.ir.tree.Nodes.MapEntry;
import exm.sdfg.ir.tree.Nodes.MapExit;
import exm.sdfg.ir.tree.Nodes.MapScope;
import exm.sdfg.ir.tree.Nodes.NestedSDFGNode;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.Nodes.Tasklet;
import exm.sdfg.ir.tree.SDFG;
import exm.sdfg.ir.tree.SDFGState;

/**
 * Persisted JSON form of an SDFG and everything nested in it.
 *
 * Node and state ids survive a round trip, including freed slots, so
 * locations recorded against a saved SDFG stay valid after loading.
 * SDFG ids are renumbered in pre-order on load.
 */
public class SDFGJson {
  private static final Gson GSON = new GsonBuilder()
                                        .setPrettyPrinting()
                                        .serializeNulls()
                                        .create();

  public static String toJson(SDFG sdfg) {
    return GSON.toJson(write(sdfg));
  }

  public static SDFG fromJson(String json) {
    JsonObject obj;
    try {
      obj = GSON.fromJson(json, JsonObject.class);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Invalid SDFG JSON: " +
                                          e.getMessage(), e);
    }
    if (obj == null) {
      throw new IllegalArgumentException("Empty SDFG JSON");
    }
    SDFG sdfg = readSDFG(obj);
    sdfg.resetSDFGIds();
    return sdfg;
  }

  public static void save(SDFG sdfg, File file) throws IOException {
    FileUtils.writeStringToFile(file, toJson(sdfg), StandardCharsets.UTF_8);
  }

  public static SDFG load(File file) throws IOException {
    return fromJson(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
  }

  /*
   * Writing
   */

  public static JsonObject write(SDFG sdfg) {
    JsonObject obj = new JsonObject();
    obj.addProperty("name", sdfg.getName());

    JsonObject arrays = new JsonObject();
    for (Entry<String, ArrayDesc> e: sdfg.arrays().entrySet()) {
      arrays.add(e.getKey(), writeDesc(e.getValue()));
    }
    obj.add("arrays", arrays);

    JsonObject symbols = new JsonObject();
    for (Entry<String, DataType> e: sdfg.symbols().entrySet()) {
      symbols.addProperty(e.getKey(), e.getValue().name());
    }
    obj.add("symbols", symbols);

    JsonArray states = new JsonArray();
    int slots = 0;
    for (SDFGState s: sdfg.states()) {
      slots = Math.max(slots, s.getId() + 1);
    }
    for (int i = 0; i < slots; i++) {
      SDFGState s = sdfg.getState(i);
      states.add(s == null ? JsonNull.INSTANCE : writeState(s));
    }
    obj.add("states", states);

    JsonArray isEdges = new JsonArray();
    for (InterstateEdge e: sdfg.interstateEdges()) {
      JsonObject eo = new JsonObject();
      eo.addProperty("src", e.src.getId());
      eo.addProperty("dst", e.dst.getId());
      eo.addProperty("condition", e.getCondition());
      JsonObject assigns = new JsonObject();
      for (Entry<String, String> a: e.getAssignments().entrySet()) {
        assigns.addProperty(a.getKey(), a.getValue());
      }
      eo.add("assignments", assigns);
      isEdges.add(eo);
    }
    obj.add("interstate_edges", isEdges);

    SDFGState start = sdfg.getStartState();
    obj.addProperty("start_state", start == null ? -1 : start.getId());
    return obj;
  }

  private static JsonObject writeDesc(ArrayDesc desc) {
    JsonObject obj = new JsonObject();
    obj.addProperty("kind", desc.getKind().name());
    obj.addProperty("dtype", desc.getDtype().name());
    obj.add("shape", writeExprs(desc.getShape()));
    obj.add("strides", writeExprs(desc.getStrides()));
    obj.addProperty("storage", desc.getStorage().name());
    obj.addProperty("transient", desc.isTransient());
    return obj;
  }

  private static JsonArray writeExprs(List<SymExpr> exprs) {
    JsonArray arr = new JsonArray();
    for (SymExpr e: exprs) {
      arr.add(e.toString());
    }
    return arr;
  }

  private static JsonObject writeState(SDFGState state) {
    JsonObject obj = new JsonObject();
    obj.addProperty("label", state.getLabel());

    // Map scopes are shared by entry and exit, so write them once
    Map<MapScope, Integer> scopeIds = new IdentityHashMap<MapScope, Integer>();
    JsonArray scopes = new JsonArray();
    JsonArray nodes = new JsonArray();
    for (int i = 0; i < state.numSlots(); i++) {
      Node n = state.getNode(i);
      if (n == null) {
        nodes.add(JsonNull.INSTANCE);
        continue;
      }
      MapScope map = null;
      if (n.kind == NodeKind.MAP_ENTRY) {
        map = n.mapEntry().getMap();
      } else if (n.kind == NodeKind.MAP_EXIT) {
        map = n.mapExit().getMap();
      }
      Integer scopeId = null;
      if (map != null) {
        scopeId = scopeIds.get(map);
        if (scopeId == null) {
          scopeId = scopeIds.size();
          scopeIds.put(map, scopeId);
          scopes.add(writeScope(map));
        }
      }
      nodes.add(writeNode(n, scopeId));
    }
    obj.add("scopes", scopes);
    obj.add("nodes", nodes);

    JsonArray edges = new JsonArray();
    for (Edge e: state.edges()) {
      JsonObject eo = new JsonObject();
      eo.addProperty("src", e.src.getId());
      eo.addProperty("src_conn", e.srcConn);
      eo.addProperty("dst", e.dst.getId());
      eo.addProperty("dst_conn", e.dstConn);
      eo.add("memlet", writeMemlet(e.getMemlet()));
      edges.add(eo);
    }
    obj.add("edges", edges);
    return obj;
  }

  private static JsonObject writeScope(MapScope map) {
    JsonObject obj = new JsonObject();
    obj.addProperty("label", map.getLabel());
    JsonArray params = new JsonArray();
    for (String p: map.getParams()) {
      params.add(p);
    }
    obj.add("params", params);
    obj.addProperty("range", map.getRange().toString());
    obj.addProperty("schedule", map.getSchedule().name());
    return obj;
  }

  private static JsonObject writeNode(Node n, Integer scopeId) {
    JsonObject obj = new JsonObject();
    obj.addProperty("kind", n.kind.name());
    obj.addProperty("label", n.getLabel());
    obj.add("in_connectors", writeStrings(n.inConnectors()));
    obj.add("out_connectors", writeStrings(n.outConnectors()));
    DebugInfo di = n.getDebugInfo();
    if (di != null) {
      JsonObject dio = new JsonObject();
      dio.addProperty("filename", di.filename);
      dio.addProperty("start_line", di.startLine);
      dio.addProperty("start_column", di.startColumn);
      dio.addProperty("end_line", di.endLine);
      dio.addProperty("end_column", di.endColumn);
      obj.add("debuginfo", dio);
    }
    switch (n.kind) {
      case ACCESS:
        obj.addProperty("data", n.access().getData());
        break;
      case TASKLET:
        obj.addProperty("code", n.tasklet().getCode());
        break;
      case MAP_ENTRY:
      case MAP_EXIT:
        obj.addProperty("scope", scopeId);
        break;
      case NESTED_SDFG:
        obj.add("sdfg", write(n.nestedSDFG().getSDFG()));
        break;
      case LIBRARY:
        obj.addProperty("routine", n.library().getRoutine());
        break;
      default:
        throw new SDFGRuntimeError("Unknown node kind " + n.kind);
    }
    return obj;
  }

  private static JsonArray writeStrings(Iterable<String> strings) {
    JsonArray arr = new JsonArray();
    for (String s: strings) {
      arr.add(s);
    }
    return arr;
  }

  private static JsonObject writeMemlet(Memlet m) {
    JsonObject obj = new JsonObject();
    if (m.isEmpty()) {
      obj.add("data", JsonNull.INSTANCE);
      return obj;
    }
    obj.addProperty("data", m.getData());
    obj.addProperty("subset", m.getSubset().toString());
    obj.addProperty("other_subset", m.getOtherSubset() == null ? null
                                      : m.getOtherSubset().toString());
    obj.addProperty("volume", m.getVolume().toString());
    obj.addProperty("wcr", m.getWcr());
    obj.addProperty("dynamic", m.isDynamic());
    return obj;
  }

  /*
   * Reading
   */

  private static SDFG readSDFG(JsonObject obj) {
    SDFG sdfg = new SDFG(obj.get("name").getAsString());
    for (Entry<String, JsonElement> e:
                    obj.getAsJsonObject("arrays").entrySet()) {
      sdfg.addDatadesc(e.getKey(),
          readDesc(e.getKey(), e.getValue().getAsJsonObject()), false);
    }
    for (Entry<String, JsonElement> e:
                    obj.getAsJsonObject("symbols").entrySet()) {
      sdfg.addSymbol(e.getKey(), DataType.valueOf(e.getValue().getAsString()));
    }

    for (JsonElement se: obj.getAsJsonArray("states")) {
      if (se.isJsonNull()) {
        sdfg.reserveStateSlot();
      } else {
        JsonObject so = se.getAsJsonObject();
        readState(sdfg.addState(so.get("label").getAsString()), so);
      }
    }

    for (JsonElement ee: obj.getAsJsonArray("interstate_edges")) {
      JsonObject eo = ee.getAsJsonObject();
      Map<String, String> assigns = new LinkedHashMap<String, String>();
      for (Entry<String, JsonElement> a:
                  eo.getAsJsonObject("assignments").entrySet()) {
        assigns.put(a.getKey(), a.getValue().getAsString());
      }
      sdfg.addInterstateEdge(state(sdfg, eo.get("src").getAsInt()),
                             state(sdfg, eo.get("dst").getAsInt()),
                             optString(eo, "condition"), assigns);
    }

    int start = obj.get("start_state").getAsInt();
    if (start >= 0) {
      sdfg.setStartState(state(sdfg, start));
    }
    return sdfg;
  }

  private static SDFGState state(SDFG sdfg, int id) {
    SDFGState s = sdfg.getState(id);
    if (s == null) {
      throw new IllegalArgumentException("No state " + id + " in SDFG "
                                         + sdfg.getName());
    }
    return s;
  }

  private static ArrayDesc readDesc(String name, JsonObject obj) {
    return new ArrayDesc(name,
        DataKind.valueOf(obj.get("kind").getAsString()),
        DataType.valueOf(obj.get("dtype").getAsString()),
        readExprs(obj.getAsJsonArray("shape")),
        readExprs(obj.getAsJsonArray("strides")),
        StorageType.valueOf(obj.get("storage").getAsString()),
        obj.get("transient").getAsBoolean());
  }

  private static List<SymExpr> readExprs(JsonArray arr) {
    List<SymExpr> res = new ArrayList<SymExpr>(arr.size());
    for (JsonElement e: arr) {
      res.add(SymExpr.parse(e.getAsString()));
    }
    return res;
  }

  private static void readState(SDFGState state, JsonObject obj) {
    List<MapScope> scopes = new ArrayList<MapScope>();
    for (JsonElement se: obj.getAsJsonArray("scopes")) {
      JsonObject so = se.getAsJsonObject();
      scopes.add(new MapScope(so.get("label").getAsString(),
          readStrings(so.getAsJsonArray("params")),
          Subset.parse(so.get("range").getAsString()),
          ScheduleType.valueOf(so.get("schedule").getAsString())));
    }

    for (JsonElement ne: obj.getAsJsonArray("nodes")) {
      if (ne.isJsonNull()) {
        state.reserveSlot();
      } else {
        state.addNode(readNode(ne.getAsJsonObject(), scopes));
      }
    }

    for (JsonElement ee: obj.getAsJsonArray("edges")) {
      JsonObject eo = ee.getAsJsonObject();
      state.addEdge(node(state, eo.get("src").getAsInt()),
                    optString(eo, "src_conn"),
                    node(state, eo.get("dst").getAsInt()),
                    optString(eo, "dst_conn"),
                    readMemlet(eo.getAsJsonObject("memlet")));
    }
  }

  private static Node node(SDFGState state, int id) {
    Node n = state.getNode(id);
    if (n == null) {
      throw new IllegalArgumentException("No node " + id + " in state "
                                         + state.getLabel());
    }
    return n;
  }

  private static Node readNode(JsonObject obj, List<MapScope> scopes) {
    NodeKind kind = NodeKind.valueOf(obj.get("kind").getAsString());
    String label = obj.get("label").getAsString();
    List<String> ins = readStrings(obj.getAsJsonArray("in_connectors"));
    List<String> outs = readStrings(obj.getAsJsonArray("out_connectors"));
    Node n;
    switch (kind) {
      case ACCESS:
        n = new AccessNode(obj.get("data").getAsString());
        break;
      case TASKLET:
        n = new Tasklet(label, ins, outs, obj.get("code").getAsString());
        break;
      case MAP_ENTRY:
        n = new MapEntry(scopes.get(obj.get("scope").getAsInt()));
        addConnectors(n, ins, outs);
        break;
      case MAP_EXIT:
        n = new MapExit(scopes.get(obj.get("scope").getAsInt()));
        addConnectors(n, ins, outs);
        break;
      case NESTED_SDFG:
        n = new NestedSDFGNode(label, readSDFG(obj.getAsJsonObject("sdfg")),
                               ins, outs);
        break;
      case LIBRARY:
        n = new LibraryNode(label, obj.get("routine").getAsString(),
                            ins, outs);
        break;
      default:
        throw new SDFGRuntimeError("Unknown node kind " + kind);
    }
    n.setLabel(label);
    if (obj.has("debuginfo")) {
      JsonObject dio = obj.getAsJsonObject("debuginfo");
      n.setDebugInfo(new DebugInfo(optString(dio, "filename"),
          dio.get("start_line").getAsInt(), dio.get("start_column").getAsInt(),
          dio.get("end_line").getAsInt(), dio.get("end_column").getAsInt()));
    }
    return n;
  }

  private static void addConnectors(Node n, List<String> ins,
                                    List<String> outs) {
    for (String c: ins) {
      n.addInConnector(c);
    }
    for (String c: outs) {
      n.addOutConnector(c);
    }
  }

  private static List<String> readStrings(JsonArray arr) {
    List<String> res = new ArrayList<String>(arr.size());
    for (JsonElement e: arr) {
      res.add(e.getAsString());
    }
    return res;
  }

  private static Memlet readMemlet(JsonObject obj) {
    String data = optString(obj, "data");
    if (data == null) {
      return Memlet.empty();
    }
    String other = optString(obj, "other_subset");
    return new Memlet(data, Subset.parse(obj.get("subset").getAsString()),
        other == null ? null : Subset.parse(other),
        SymExpr.parse(obj.get("volume").getAsString()),
        optString(obj, "wcr"), obj.get("dynamic").getAsBoolean());
  }

  private static String optString(JsonObject obj, String key) {
    JsonElement e = obj.get(key);
    return e == null || e.isJsonNull() ? null : e.getAsString();
  }
}
