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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import cfx.numerics.spline.CubicSplineFunction;
import cfx.utilities.CFXTest;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.junit.Test;

/**
 * @author Michael J. Schnieders
 */
public class DistortionSamplerTest extends CFXTest {

  private static final UnivariateFunction INVERSE_SQUARE = k -> 1.0 / (k * k);

  private final DistortionSampler sampler = new DistortionSampler(new MultipoleProjector());

  @Test
  public void testSampleCount() {
    assertEquals(68, DistortionSampler.sampleCount(1.0e-3, 0.05, 40));
    assertEquals(17, DistortionSampler.sampleCount(1.0e-3, 0.05, 10));
    // Short ranges still get the minimum.
    assertEquals(10, DistortionSampler.sampleCount(1.0, 1.5, 40));
  }

  /**
   * One extra sample beyond each end of the range.
   */
  @Test
  public void testPadding() {
    CubicSplineFunction f = sampler.distortionMultipoleFunction(INVERSE_SQUARE, DistortionModel.undistorted(),
        1.0e-3, 0.5, 0, 40);
    assertEquals(110, f.getKnotCount());
    assertTrue(f.getLower() < 1.0e-3);
    assertTrue(f.getUpper() > 0.5);
    assertEquals(CubicSplineFunction.Scale.LOG, f.getAbscissaScale());
  }

  /**
   * Multipoles of a Kaiser distorted power law are scaled copies of the power law.
   */
  @Test
  public void testKaiserMultipoles() {
    double bias = 1.5;
    double beta = 0.4;
    DistortionModel model = DistortionModel.builder().bias(bias).beta(beta).build();
    double[] kaiser = {
        1.0 + 2.0 * beta / 3.0 + beta * beta / 5.0,
        4.0 * beta / 3.0 + 4.0 * beta * beta / 7.0,
        8.0 * beta * beta / 35.0};
    for (int i = 0; i < kaiser.length; i++) {
      int ell = 2 * i;
      CubicSplineFunction f = sampler.distortionMultipoleFunction(INVERSE_SQUARE, model, 1.0e-3, 1.0, ell, 40);
      for (double k : new double[]{3.0e-3, 0.01, 0.05, 0.2}) {
        double expected = bias * bias * kaiser[i] / (k * k);
        assertEquals(" Multipole " + ell + " at k = " + k, 1.0, f.value(k) / expected, 1.0e-5);
      }
    }
    CubicSplineFunction hexacontatetrapole = sampler.distortionMultipoleFunction(INVERSE_SQUARE, model,
        1.0e-3, 1.0, 6, 40);
    assertEquals(0.0, hexacontatetrapole.value(0.05), 1.0e-10);
  }

  @Test
  public void testFingersOfGodDamping() {
    DistortionModel model = DistortionModel.builder().sigS(4.0).build();
    CubicSplineFunction f = sampler.distortionMultipoleFunction(INVERSE_SQUARE, model, 1.0e-3, 1.0, 0, 40);
    assertEquals(1.0, f.value(5.0e-3) * 2.5e-5, 1.0e-3);
    assertTrue(f.value(0.5) * 0.25 < 0.5);
  }

  /**
   * Equal scale factors dilate the spectrum.
   */
  @Test
  public void testIsotropicDilation() {
    DistortionModel model = DistortionModel.builder().alphaParallel(1.2).alphaPerp(1.2).build();
    CubicSplineFunction f = sampler.distortionMultipoleFunction(INVERSE_SQUARE, model, 1.0e-3, 1.0, 0, 40);
    assertEquals(1.0, f.value(0.1) * (0.12 * 0.12), 1.0e-5);
    CubicSplineFunction quadrupole = sampler.distortionMultipoleFunction(INVERSE_SQUARE, model, 1.0e-3, 1.0, 2, 40);
    assertEquals(0.0, quadrupole.value(0.1), 1.0e-10);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidRange() {
    sampler.distortionMultipoleFunction(INVERSE_SQUARE, DistortionModel.undistorted(), 1.0, 1.0e-3, 0, 40);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidDensity() {
    sampler.distortionMultipoleFunction(INVERSE_SQUARE, DistortionModel.undistorted(), 1.0e-3, 1.0, 0, 0);
  }
}
