// ******************************************************************************
//
// Title:       Correlation Function X.
// Description: Correlation Function X - Spherical Bessel Transforms for Clustering.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2024.
//
// This file is part of Correlation Function X.
//
// Correlation Function X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Correlation Function X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Correlation Function X; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package cfx.cosmology;

import static org.apache.commons.math3.util.FastMath.exp;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import cfx.utilities.CFXProperties;
import cfx.utilities.CFXTest;
import java.util.HashMap;
import java.util.Map;
import org.junit.Test;

/**
 * @author Michael J. Schnieders
 */
public class DistortionModelTest extends CFXTest {

  private static final double[] K = {1.0e-3, 0.05, 0.2, 1.0, 10.0};
  private static final double[] MU = {-1.0, -0.4, 0.0, 0.3, 0.77, 1.0};

  /**
   * A biased tracer without distortion.
   */
  @Test
  public void testBiasOnly() {
    DistortionModel model = DistortionModel.builder().bias(2.0).build();
    for (double k : K) {
      for (double mu : MU) {
        assertEquals(4.0, model.redshiftSpaceDistortion(k, mu), 1.0e-15);
        assertEquals(1.0, model.nonlinearDistortion(k, mu), 1.0e-15);
        assertEquals(4.0, model.distortion(k, mu), 1.0e-15);
      }
    }
  }

  @Test
  public void testDefaults() {
    DistortionModel model = DistortionModel.undistorted();
    assertEquals(1.0, model.getBias(), 0.0);
    assertEquals(0.0, model.getBeta(), 0.0);
    assertEquals(1.0, model.getBias2(), 0.0);
    assertEquals(0.0, model.getBeta2(), 0.0);
    assertTrue(model.isIsotropicScaling());
    assertEquals(1.0, model.distortion(0.3, 0.5), 0.0);
  }

  @Test
  public void testSecondaryTracerDefaults() {
    DistortionModel auto = DistortionModel.builder().bias(1.8).beta(0.6).build();
    assertEquals(1.8, auto.getBias2(), 0.0);
    assertEquals(0.6, auto.getBeta2(), 0.0);
    // Kaiser (1 + beta mu^2)^2 for the auto-correlation.
    assertEquals(1.8 * 1.8 * 1.6 * 1.6, auto.redshiftSpaceDistortion(0.1, 1.0), 1.0e-14);

    DistortionModel cross = DistortionModel.builder().bias(2.0).beta(0.5).bias2(1.5).beta2(0.25).build();
    assertEquals(2.0 * 1.5 * 1.18 * 1.09, cross.redshiftSpaceDistortion(0.1, 0.6), 1.0e-14);
  }

  @Test
  public void testNonlinearDistortion() {
    DistortionModel model = DistortionModel.builder().sigL(8.0).sigT(4.0).sigS(3.0).build();
    double expected = exp(-(0.25 * 64.0 + 0.75 * 16.0) * 0.01 / 2.0) / (1.0225 * 1.0225);
    assertEquals(expected, model.nonlinearDistortion(0.1, 0.5), 1.0e-14);
    // Transverse damping only across the line of sight.
    assertEquals(exp(-16.0 * 0.01 / 2.0), model.nonlinearDistortion(0.1, 0.0), 1.0e-14);
    assertEquals(1.0, model.nonlinearDistortion(0.0, 0.5), 0.0);
  }

  @Test
  public void testTransformedCoordinates() {
    DistortionModel identity = DistortionModel.undistorted();
    double[] kmu = identity.transformedCoordinates(0.2, 0.3);
    assertEquals(0.2, kmu[0], 1.0e-15);
    assertEquals(0.3, kmu[1], 1.0e-15);

    DistortionModel model = DistortionModel.builder().alphaParallel(1.1).alphaPerp(0.9).build();
    assertFalse(model.isIsotropicScaling());
    kmu = model.transformedCoordinates(0.2, 0.0);
    assertEquals(0.18, kmu[0], 1.0e-15);
    assertEquals(0.0, kmu[1], 0.0);
    kmu = model.transformedCoordinates(0.2, 1.0);
    assertEquals(0.22, kmu[0], 1.0e-15);
    assertEquals(1.0, kmu[1], 1.0e-15);
    kmu = model.transformedCoordinates(0.2, -0.6);
    double alpha = Math.sqrt(1.21 * 0.36 + 0.81 * 0.64);
    assertEquals(alpha * 0.2, kmu[0], 1.0e-15);
    assertEquals(-1.1 / alpha * 0.6, kmu[1], 1.0e-15);
  }

  @Test
  public void testFromProperties() {
    System.setProperty("distortion.bias", "2.5");
    System.setProperty("distortion.beta", "0.4");
    System.setProperty("distortion.beta2", "0.1");
    System.setProperty("distortion.sigS", "3.0");
    DistortionModel model = DistortionModel.fromProperties(CFXProperties.loadProperties());
    assertEquals(2.5, model.getBias(), 0.0);
    assertEquals(2.5, model.getBias2(), 0.0);
    assertEquals(0.4, model.getBeta(), 0.0);
    assertEquals(0.1, model.getBeta2(), 0.0);
    assertEquals(3.0, model.getSigS(), 0.0);
    assertEquals(0.0, model.getSigL(), 0.0);
  }

  @Test
  public void testFromParameters() {
    Map<String, Double> parameters = new HashMap<>();
    parameters.put("bias", 1.5);
    parameters.put("beta", 0.3);
    parameters.put("sigT", 2.0);
    DistortionModel model = DistortionModel.fromParameters(parameters);
    assertEquals(1.5, model.getBias2(), 0.0);
    assertEquals(0.3, model.getBeta2(), 0.0);
    assertEquals(2.0, model.getSigT(), 0.0);
    assertTrue(model.toString().contains("bias=1.5"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownParameter() {
    Map<String, Double> parameters = new HashMap<>();
    parameters.put("growth", 0.5);
    DistortionModel.fromParameters(parameters);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingParameterValue() {
    Map<String, Double> parameters = new HashMap<>();
    parameters.put("bias", 2.0);
    parameters.put("beta", null);
    DistortionModel.fromParameters(parameters);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidScale() {
    DistortionModel.builder().alphaPerp(0.0).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonFiniteBias() {
    DistortionModel.builder().bias(Double.NaN).build();
  }
}
