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

package io.boxwood.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exception thrown when an invariant of the box tree is found to be violated.
 *
 * <p>
 * This never signals malformed input. Malformed documents degrade silently during box-tree
 * synthesis, so a corruption always points to a bug in the synthesis code itself, for instance a
 * node flagged as table root which carries no table context.
 * </p>
 */
public final class BoxTreeCorruptionException extends BoxwoodRuntimeException {

  private static final Logger LOGGER = LoggerFactory.getLogger(BoxTreeCorruptionException.class);

  private static final long serialVersionUID = 1L;

  /**
   * The key of the node whose state is corrupt.
   */
  private final long nodeKey;

  /**
   * Create a new corruption exception.
   *
   * <p>
   * The constructor logs the error at ERROR level.
   * </p>
   *
   * @param nodeKey key of the corrupt node
   * @param message description of the violated invariant
   */
  public BoxTreeCorruptionException(final long nodeKey, final String message) {
    super(String.format("Box tree corruption at node %d: %s", nodeKey, message));
    this.nodeKey = nodeKey;

    LOGGER.error("BOX TREE CORRUPTION DETECTED: key={}, message={}", nodeKey, message);
  }

  /**
   * Get the key of the corrupt node.
   *
   * @return the node key
   */
  public long getNodeKey() {
    return nodeKey;
  }
}
