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

import java.util.List;

/**
 * Read-only view of the cascade output for one node or pseudo-element. Instances are owned by the
 * cascade engine and compared by identity: a restyle which changes anything hands out a new
 * instance.
 */
public interface ComputedStyle {

  Display getDisplay();

  FloatMode getFloat();

  Position getPosition();

  WhiteSpaceCollapse getWhiteSpaceCollapse();

  TableLayout getTableLayout();

  BorderCollapse getBorderCollapse();

  /**
   * Get {@code border-spacing}, horizontal then vertical.
   *
   * @return the border spacing in pixels
   */
  Size getBorderSpacing();

  /**
   * Get the specified {@code width}.
   *
   * @return the width
   */
  Dimension getWidth();

  Edges getPadding();

  Edges getBorderWidths();

  /**
   * Get the resolved {@code content} items. Only meaningful for pseudo-element styles.
   *
   * @return the content items, empty for {@code content: none}
   */
  List<ContentItem> getContent();
}
