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
package exm.sdfg.ir.tree;

/**
 * Closed set of dataflow node kinds.  Every node carries one of these as a
 * tag, and code that dispatches on node type should switch over it.
 */
public enum NodeKind {
  /** Reference to a named data container */
  ACCESS,
  /** Atomic unit of computation */
  TASKLET,
  /** Start of a parallel map scope */
  MAP_ENTRY,
  /** End of a parallel map scope, paired with a MAP_ENTRY */
  MAP_EXIT,
  /** Node whose body is an entire child SDFG */
  NESTED_SDFG,
  /** Call to a library routine, expanded later */
  LIBRARY;

  public boolean isScope() {
    return this == MAP_ENTRY || this == MAP_EXIT;
  }
}
