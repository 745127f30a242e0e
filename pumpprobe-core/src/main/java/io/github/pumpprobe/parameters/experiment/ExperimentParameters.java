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

import io.github.pumpprobe.parameters.Parameter;
import io.github.pumpprobe.parameters.ParameterSet;
import io.github.pumpprobe.parameters.impl.SimpleParameterSet;
import io.github.pumpprobe.parameters.parametertypes.ComboParameter;
import io.github.pumpprobe.parameters.parametertypes.DoubleParameter;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import org.jetbrains.annotations.NotNull;

/**
 * Beamline and detector geometry of one experiment. Shared read-only by loader and analysis.
 */
public class ExperimentParameters extends SimpleParameterSet {

  /**
   * hc in keV * Angstrom.
   */
  public static final double HC_KEV_ANGSTROM = 12.398419843320025;

  private static final DecimalFormat SCIENTIFIC = new DecimalFormat("0.###E0",
      DecimalFormatSymbols.getInstance(Locale.US));

  public static final ComboParameter<Hutch> HUTCH = new ComboParameter<>("Hutch",
      "Experimental hutch the detector is installed in.", Hutch.values(), Hutch.EH1);

  public static final ComboParameter<Detector> DETECTOR = new ComboParameter<>("Detector",
      "Detector whose images are read.", Detector.values(), Detector.JUNGFRAU2);

  public static final ComboParameter<XrayMode> XRAY = new ComboParameter<>("X-ray line",
      "Soft (SX) or hard (HX) X-ray line, selects the timing-system rate column.",
      XrayMode.values(), XrayMode.HX);

  public static final ComboParameter<PumpRate> PUMP_RATE = new ComboParameter<>("Pump rate",
      "Pump laser repetition setting. 0HZ marks every shot as pump-off.", PumpRate.values(),
      PumpRate.HZ_15);

  public static final DoubleParameter SAMPLE_DETECTOR_DISTANCE = new DoubleParameter(
      "Sample detector distance (m)", "Distance between sample and detector in meters.",
      SCIENTIFIC, 1.3, 1e-6, null);

  public static final DoubleParameter PIXEL_SIZE = new DoubleParameter("Pixel size (m)",
      "Edge length of one detector pixel in meters.", SCIENTIFIC, 7.5e-5, 1e-9, null);

  public static final DoubleParameter BEAM_ENERGY = new DoubleParameter("Beam energy (keV)",
      "Photon energy of the X-ray beam.", SCIENTIFIC, 10.0, 1e-3, null);

  public ExperimentParameters() {
    super(new Parameter[]{HUTCH, DETECTOR, XRAY, PUMP_RATE, SAMPLE_DETECTOR_DISTANCE, PIXEL_SIZE,
        BEAM_ENERGY});
  }

  /**
   * @return wavelength in Angstrom
   */
  public static double wavelength(double beamEnergyKeV) {
    return HC_KEV_ANGSTROM / beamEnergyKeV;
  }

  /**
   * Momentum transfer change per pixel of centroid displacement:
   * {@code (4 pi / lambda) * atan2(pixelSize, distance)}.
   */
  public static double deltaQPerPixel(double beamEnergyKeV, double pixelSize,
      double sampleDetectorDistance) {
    return 4 * Math.PI / wavelength(beamEnergyKeV) * Math.atan2(pixelSize,
        sampleDetectorDistance);
  }

  public static double deltaQPerPixel(@NotNull ParameterSet experiment) {
    return deltaQPerPixel(experiment.getValue(BEAM_ENERGY), experiment.getValue(PIXEL_SIZE),
        experiment.getValue(SAMPLE_DETECTOR_DISTANCE));
  }

  /**
   * Timing-system column holding the pump flag, e.g. {@code timestamp_info.RATE_HX_15HZ}.
   */
  public static @NotNull String pumpRateColumn(@NotNull XrayMode xray, @NotNull PumpRate rate) {
    return "timestamp_info.RATE_" + xray.name() + "_" + rate.getLabel();
  }
}
