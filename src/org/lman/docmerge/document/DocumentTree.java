// Copyright 2012 Benjamin Kalman
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.lman.docmerge.document;

/**
 * A document the merge engine rewrites in place. The engine never owns the tree; it only
 * reads and edits it through these operations and {@link DocumentNode}'s.
 */
public interface DocumentTree {

  /** Identifies the document, e.g. for keying caches. Stable for the tree's lifetime. */
  String getId();

  /** The root BODY node. */
  DocumentNode getBody();

  /** Creates a detached, empty node of |kind|. */
  DocumentNode createNode(DocumentNode.Kind kind);

  /** A detached deep copy of |node|, sharing its attributes and run styles. */
  DocumentNode copy(DocumentNode node);
}
