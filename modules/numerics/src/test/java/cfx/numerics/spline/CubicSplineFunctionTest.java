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
package cfx.numerics.spline;

import static org.apache.commons.math3.util.FastMath.pow;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import cfx.numerics.NumericalDivergenceException;
import cfx.utilities.CFXTest;
import org.junit.Test;

/**
 * @author Michael J. Schnieders
 */
public class CubicSplineFunctionTest extends CFXTest {

  @Test
  public void testKnots() {
    double[] x = {0.0, 1.0, 2.5, 4.0, 5.0};
    double[] y = {1.0, -2.0, 0.5, 3.0, 2.0};
    CubicSplineFunction spline = CubicSplineFunction.linear(x, y);
    for (int i = 0; i < x.length; i++) {
      assertEquals(y[i], spline.value(x[i]), 1.0e-14);
    }
    assertEquals(0.0, spline.getLower(), 0.0);
    assertEquals(5.0, spline.getUpper(), 0.0);
    assertEquals(5, spline.getKnotCount());
  }

  /**
   * A power law is a straight line in log-log and is reproduced exactly.
   */
  @Test
  public void testLogLogPowerLaw() {
    int n = 12;
    double[] k = new double[n];
    double[] p = new double[n];
    for (int i = 0; i < n; i++) {
      k[i] = pow(10.0, -3.0 + 0.3 * i);
      p[i] = 2.0 * pow(k[i], -1.5);
    }
    CubicSplineFunction spline = CubicSplineFunction.logLog(k, p);
    for (double q = 0.0011; q < k[n - 1]; q *= 1.37) {
      assertEquals(1.0, spline.value(q) / (2.0 * pow(q, -1.5)), 1.0e-12);
    }
  }

  @Test
  public void testLogAbscissa() {
    double[] r = {1.0, 10.0, 100.0, 1000.0};
    double[] y = {0.0, 1.0, 2.0, 3.0};
    CubicSplineFunction spline = CubicSplineFunction.logAbscissa(r, y);
    assertEquals(1.5, spline.value(Math.sqrt(1000.0)), 1.0e-12);
  }

  @Test
  public void testTwoPointsAreLinear() {
    CubicSplineFunction spline = CubicSplineFunction.linear(new double[]{1.0, 3.0}, new double[]{2.0, 6.0});
    assertEquals(4.0, spline.value(2.0), 1.0e-15);
  }

  @Test
  public void testDomain() {
    CubicSplineFunction spline = CubicSplineFunction.logAbscissa(new double[]{1.0, 2.0, 3.0}, new double[]{1.0, 2.0, 3.0});
    assertTrue(spline.isValidPoint(2.0));
    assertFalse(spline.isValidPoint(3.5));
    try {
      spline.value(3.5);
    } catch (NumericalDivergenceException e) {
      assertEquals(3.5, e.abscissa, 0.0);
      return;
    }
    throw new AssertionError(" Evaluation outside of the tabulated range should fail.");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonIncreasing() {
    CubicSplineFunction.linear(new double[]{1.0, 2.0, 2.0}, new double[]{1.0, 2.0, 3.0});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testLogOrdinateRequiresPositive() {
    CubicSplineFunction.logLog(new double[]{1.0, 2.0, 3.0}, new double[]{1.0, -2.0, 3.0});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSinglePoint() {
    CubicSplineFunction.linear(new double[]{1.0}, new double[]{1.0});
  }
}
