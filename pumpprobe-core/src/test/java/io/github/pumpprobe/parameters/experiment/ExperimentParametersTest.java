/*
 * Copyright (c) 2024-2025 The pumpprobe Development Team
 */

package io.github.pumpprobe.parameters.experiment;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ExperimentParametersTest {

  @Test
  void testWavelength() {
    Assertions.assertEquals(1.23984, ExperimentParameters.wavelength(10d), 1e-5);
  }

  @Test
  void testDeltaQPerPixelDefaults() {
    final ExperimentParameters params = new ExperimentParameters();
    Assertions.assertEquals(5.847382e-4, ExperimentParameters.deltaQPerPixel(params), 1e-9);
  }

  @Test
  void testDeltaQScalesWithEnergy() {
    final double low = ExperimentParameters.deltaQPerPixel(5d, 7.5e-5, 1.3);
    final double high = ExperimentParameters.deltaQPerPixel(10d, 7.5e-5, 1.3);
    Assertions.assertEquals(2d, high / low, 1e-12);
  }

  @Test
  void testPumpRateColumn() {
    Assertions.assertEquals("timestamp_info.RATE_HX_15HZ",
        ExperimentParameters.pumpRateColumn(XrayMode.HX, PumpRate.HZ_15));
    Assertions.assertEquals("timestamp_info.RATE_SX_60HZ",
        ExperimentParameters.pumpRateColumn(XrayMode.SX, PumpRate.HZ_60));
  }
}
