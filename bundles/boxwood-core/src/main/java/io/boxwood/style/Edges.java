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

package io.boxwood.style;

/**
 * Pixel widths of the four sides of a box (padding or border widths).
 *
 * @param top top side
 * @param right right side
 * @param bottom bottom side
 * @param left left side
 */
public record Edges(float top, float right, float bottom, float left) {

  public static final Edges ZERO = new Edges(0f, 0f, 0f, 0f);

  public static Edges all(final float width) {
    return new Edges(width, width, width, width);
  }

  /**
   * Edges with the same value on the left and right side, and on the top and bottom side.
   *
   * @param vertical top and bottom value
   * @param horizontal left and right value
   * @return the edges
   */
  public static Edges symmetric(final float vertical, final float horizontal) {
    return new Edges(vertical, horizontal, vertical, horizontal);
  }

  public float horizontal() {
    return left + right;
  }

  public float maxHorizontal() {
    return Math.max(left, right);
  }

  public float maxVertical() {
    return Math.max(top, bottom);
  }
}
