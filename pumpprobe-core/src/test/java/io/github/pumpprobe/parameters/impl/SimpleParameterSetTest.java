/*
 * Copyright (c) 2024-2025 The pumpprobe Development Team
 */

package io.github.pumpprobe.parameters.impl;

import io.github.pumpprobe.datamodel.RoiRectangle;
import io.github.pumpprobe.modules.dataprocessing.filter_ransac.RansacOutlierFilterParameters;
import io.github.pumpprobe.modules.dataprocessing.scan_aggregation.ScanAggregationParameters;
import io.github.pumpprobe.parameters.ParameterSet;
import io.github.pumpprobe.parameters.experiment.ExperimentParameters;
import io.github.pumpprobe.parameters.experiment.PumpRate;
import io.github.pumpprobe.parameters.parametertypes.DoubleParameter;
import io.github.pumpprobe.parameters.parametertypes.IntegerParameter;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import org.json.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SimpleParameterSetTest {

  @Test
  void testStaticTemplatesAreNotModified() {
    final RansacOutlierFilterParameters params = new RansacOutlierFilterParameters();
    params.setParameter(RansacOutlierFilterParameters.MAX_TRIALS, 7);
    Assertions.assertEquals(7, params.getValue(RansacOutlierFilterParameters.MAX_TRIALS));
    Assertions.assertEquals(100, RansacOutlierFilterParameters.MAX_TRIALS.getValue());
    Assertions.assertEquals(100,
        new RansacOutlierFilterParameters().getValue(RansacOutlierFilterParameters.MAX_TRIALS));
  }

  @Test
  void testCloneIsIndependent() {
    final RansacOutlierFilterParameters params = new RansacOutlierFilterParameters();
    params.setParameter(RansacOutlierFilterParameters.RANDOM_SEED, 42);
    final ParameterSet clone = params.cloneParameterSet();
    Assertions.assertInstanceOf(RansacOutlierFilterParameters.class, clone);
    Assertions.assertEquals(42, clone.getValue(RansacOutlierFilterParameters.RANDOM_SEED));

    clone.setParameter(RansacOutlierFilterParameters.RANDOM_SEED, 1);
    Assertions.assertEquals(42, params.getValue(RansacOutlierFilterParameters.RANDOM_SEED));
  }

  @Test
  void testOptionalParameterFromProperties() {
    final RansacOutlierFilterParameters params = new RansacOutlierFilterParameters();
    Assertions.assertNull(params.getEmbeddedParameterValueIfSelectedOrElse(
        RansacOutlierFilterParameters.RESIDUAL_THRESHOLD, null));

    final Properties props = new Properties();
    props.setProperty("Residual threshold", "12.5");
    props.setProperty("Intensity ROI", "0,0,4,4");
    params.loadValuesFromProperties(props, "");

    Assertions.assertEquals(12.5, params.getEmbeddedParameterValueIfSelectedOrElse(
        RansacOutlierFilterParameters.RESIDUAL_THRESHOLD, null));
    Assertions.assertEquals(new RoiRectangle(0, 0, 4, 4),
        params.getEmbeddedParameterValueIfSelectedOrElse(RansacOutlierFilterParameters.ROI,
            null));

    props.setProperty("Residual threshold", "false");
    params.loadValuesFromProperties(props, "");
    Assertions.assertEquals(-1d, params.getEmbeddedParameterValueIfSelectedOrElse(
        RansacOutlierFilterParameters.RESIDUAL_THRESHOLD, -1d));
  }

  @Test
  void testNestedSetsUseDottedKeys() {
    final ScanAggregationParameters params = new ScanAggregationParameters();
    final Properties props = new Properties();
    props.setProperty("Worker threads", "4");
    props.setProperty("Experiment.Pump rate", "0HZ");
    props.setProperty("RANSAC filter.Maximum trials", "250");
    params.loadValuesFromProperties(props, "");

    Assertions.assertEquals(4, params.getValue(ScanAggregationParameters.THREADS));
    Assertions.assertEquals(PumpRate.ZERO, params.getValue(ScanAggregationParameters.EXPERIMENT)
        .getValue(ExperimentParameters.PUMP_RATE));
    Assertions.assertEquals(250, params.getValue(ScanAggregationParameters.RANSAC)
        .getValue(RansacOutlierFilterParameters.MAX_TRIALS));
  }

  @Test
  void testUnparsableValue() {
    final RansacOutlierFilterParameters params = new RansacOutlierFilterParameters();
    final Properties props = new Properties();
    props.setProperty("Maximum trials", "many");
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> params.loadValuesFromProperties(props, ""));
  }

  @Test
  void testCheckCollectsAllErrors() {
    final SimpleParameterSet params = new SimpleParameterSet(
        new IntegerParameter("Count", "", 0, 1, null),
        new DoubleParameter("Ratio", "", new DecimalFormat("0.0"), 2d, 0d, 1d));
    final List<String> errors = new ArrayList<>();
    Assertions.assertFalse(params.checkParameterValues(errors));
    Assertions.assertEquals(2, errors.size());
  }

  @Test
  void testUnknownParameter() {
    final RansacOutlierFilterParameters params = new RansacOutlierFilterParameters();
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> params.getParameter(ExperimentParameters.BEAM_ENERGY));
  }

  @Test
  void testJsonExport() {
    final ScanAggregationParameters params = new ScanAggregationParameters();
    final JSONObject json = params.toJson();
    Assertions.assertEquals("standard", json.getString("Pipelines"));
    Assertions.assertEquals("15HZ", json.getJSONObject("Experiment").getString("Pump rate"));
    Assertions.assertFalse(json.getBoolean("ROI moments"));
    Assertions.assertTrue(json.isNull("Scan directory"));
  }
}
