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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A length-percentage-auto value such as a computed {@code width} or a column width hint.
 *
 * @param unit the unit of the value
 * @param value pixels for lengths, the fraction {@code [0, 1]} for percentages, zero for auto
 */
public record Dimension(Unit unit, float value) {

  /** The unit of a dimension. */
  public enum Unit {
    LENGTH,
    PERCENT,
    AUTO
  }

  public static final Dimension AUTO = new Dimension(Unit.AUTO, 0f);

  public Dimension {
    requireNonNull(unit);
    checkArgument(unit != Unit.AUTO || value == 0f, "auto has no value");
  }

  public static Dimension length(final float pixels) {
    return new Dimension(Unit.LENGTH, pixels);
  }

  public static Dimension percent(final float fraction) {
    return new Dimension(Unit.PERCENT, fraction);
  }

  public boolean isLength() {
    return unit == Unit.LENGTH;
  }

  public boolean isPercent() {
    return unit == Unit.PERCENT;
  }

  public boolean isAuto() {
    return unit == Unit.AUTO;
  }
}
