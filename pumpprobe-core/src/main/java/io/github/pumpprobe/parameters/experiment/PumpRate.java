/*
 * Copyright (c) 2024-2025 The pumpprobe Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.pumpprobe.parameters.experiment;

import org.jetbrains.annotations.NotNull;

/**
 * Laser pump repetition setting. {@link #ZERO} means the pump laser was off for the whole scan.
 */
public enum PumpRate {
  ZERO("0HZ"), HZ_10("10HZ"), HZ_15("15HZ"), HZ_20("20HZ"), HZ_30("30HZ"), HZ_60("60HZ");

  private final String label;

  PumpRate(String label) {
    this.label = label;
  }

  public @NotNull String getLabel() {
    return label;
  }

  public boolean isPumped() {
    return this != ZERO;
  }

  @Override
  public String toString() {
    return label;
  }
}
