/*
 * Copyright (c) 2023, Boxwood Contributors
 *
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *     * Redistributions of source code must retain the above copyright
 *       notice, this list of conditions and the following disclaimer.
 *     * Redistributions in binary form must reproduce the above copyright
 *       notice, this list of conditions and the following disclaimer in the
 *       documentation and/or other materials provided with the distribution.
 *     * Neither the name of the <organization> nor the
 *       names of its contributors may be used to endorse or promote products
 *       derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
 * ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
 * WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
 * DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
 * DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
 * (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
 * LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
 * ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
 * SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.boxwood.node;

/**
 * Enumeration for different nodes. All nodes are determined by a unique id.
 *
 * @author Sebastian Graf, University of Konstanz
 * @author Johannes Lichtenberger, University of Konstanz
 */
public enum NodeKind {

  /**
   * Node kind is the document root.
   */
  DOCUMENT((byte) 9),

  /**
   * Node kind is element.
   */
  ELEMENT((byte) 1),

  /**
   * Node kind is a box synthesized by the engine: an anonymous block wrapper or a pseudo-element.
   * Shares the attribute shape of {@link #ELEMENT}.
   */
  ANONYMOUS_BLOCK((byte) 20),

  /**
   * Node kind is text.
   */
  TEXT((byte) 3),

  /**
   * Node kind is comment.
   */
  COMMENT((byte) 8);

  /** Identifier. */
  private final byte id;

  /**
   * Constructor.
   *
   * @param id unique identifier
   */
  NodeKind(final byte id) {
    this.id = id;
  }

  /**
   * Get the unique kind identifier.
   *
   * @return unique kind identifier
   */
  public byte getId() {
    return id;
  }

  /**
   * Determines if nodes of this kind carry {@link ElementData}.
   *
   * @return {@code true} for elements and anonymous blocks
   */
  public boolean hasElementData() {
    return this == ELEMENT || this == ANONYMOUS_BLOCK;
  }

  /**
   * Determines if nodes of this kind carry character data.
   *
   * @return {@code true} for text and comment nodes
   */
  public boolean hasValue() {
    return this == TEXT || this == COMMENT;
  }

  /**
   * Get the kind of the given identifier.
   *
   * @param id the identifier
   * @return the kind
   * @throws IllegalArgumentException if no kind has the identifier
   */
  public static NodeKind getKind(final byte id) {
    for (final NodeKind kind : values()) {
      if (kind.id == id) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown node kind id: " + id);
  }
}
