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
package cfx.cosmology.transform;

import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.log;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import cfx.utilities.CFXTest;
import java.util.Arrays;
import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Transform sizing over [10, 200] compared to reference values.
 *
 * @author Michael J. Schnieders
 */
@RunWith(Parameterized.class)
public class TransformSizerTest extends CFXTest {

  private static final double RMIN = 10.0;
  private static final double RMAX = 200.0;
  private static final double TOLERANCE = 1.0e-11;

  private final String info;
  private final int ell;
  private final double veps;
  private final double kr0;
  private final double ds1;
  private final double eps;
  private final int nsf;
  private final double dsf;
  private final int nsg;

  public TransformSizerTest(String info, int ell, double veps, double kr0, double ds1, double eps,
      int nsf, double dsf, int nsg) {
    this.info = info;
    this.ell = ell;
    this.veps = veps;
    this.kr0 = kr0;
    this.ds1 = ds1;
    this.eps = eps;
    this.nsf = nsf;
    this.dsf = dsf;
    this.nsg = nsg;
  }

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(
        new Object[][]{
            {"Monopole at 1e-2", 0, 1.0e-2, 1.0, PI, 0.11689399356734501, 101, 0.042799838774231144, 36},
            {"Monopole at 1e-3", 0, 1.0e-3, 1.0, PI, 0.044511035268019063, 1002, 0.0062198864481854133, 242},
            {"Monopole at 1e-4", 0, 1.0e-4, 1.0, PI, 0.016200753687684737, 10002, 0.00082447569060876264, 1818},
            {"Quadrupole at 1e-2", 2, 1.0e-2, 2.46621207433047, 1.2738534071295051,
                0.0046972178194039458, 101, 0.035388623719378225, 44},
            {"Quadrupole at 1e-3", 2, 1.0e-3, 2.46621207433047, 1.2738534071295051,
                0.00028012503035319434, 1001, 0.0054515307123786045, 276},
            {"Quadrupole at 1e-4", 2, 1.0e-4, 2.46621207433047, 1.2738534071295051,
                1.4129286408335043e-05, 10001, 0.00074447075358115105, 2013},
            {"Hexadecapole at 1e-2", 4, 1.0e-2, 3.9362834270353515, 0.7981113941167375,
                0.00032472136790592451, 101, 0.032081473298518591, 48},
            {"Hexadecapole at 1e-3", 4, 1.0e-3, 3.9362834270353515, 0.7981113941167375,
                3.2017519991231798e-06, 1001, 0.0050577022288163702, 298},
            {"Hexadecapole at 1e-4", 4, 1.0e-4, 3.9362834270353515, 0.7981113941167375,
                2.306129395968434e-08, 10001, 0.00070336091497988579, 2131},
        });
  }

  @Test
  public void testKernelConstants() {
    assertEquals(info, kr0, TransformSizer.kr0(ell), TOLERANCE * kr0);
    assertEquals(info, ds1, TransformSizer.ds(ell, 1.0), TOLERANCE * ds1);
    assertEquals(info, eps, TransformSizer.epsApprox(veps, ell), TOLERANCE * eps);
  }

  @Test
  public void testSize() {
    TransformSizing sizing = TransformSizer.size(ell, veps);
    assertEquals(info, ell, sizing.ell());
    assertEquals(info, nsf, sizing.nsf());
    assertEquals(info, dsf, sizing.dsf(), TOLERANCE * dsf);
    assertEquals(info, sizing.ndsf(), sizing.nsf() * sizing.dsf(), 1.0e-12);
    assertEquals(info, (1 - ell) / 2.0, sizing.biasExponent(), 0.0);
    assertEquals(info, 1.0 / dsf, sizing.samplesPerLogInterval(), TOLERANCE / dsf);
    // The step never exceeds the kernel resolution or 40 samples per decade.
    assertTrue(info, sizing.dsf() <= TransformSizer.ds(ell, sizing.eps()) * (1.0 + 1.0e-12));
    assertTrue(info, sizing.dsf() <= TransformSizer.MAX_STEP * (1.0 + 1.0e-12));
  }

  @Test
  public void testPlan() {
    TransformGrid grid = TransformSizer.plan(RMIN, RMAX, ell, veps);
    assertEquals(info, nsg, grid.nsg());
    assertEquals(info, nsf + nsg, grid.ntot());
    assertEquals(info, 2 * (nsf + nsg), grid.size());
    assertEquals(info, Math.sqrt(RMIN * RMAX), grid.r0(), 1.0e-12);
    assertEquals(info, kr0 / grid.r0(), grid.k0(), TOLERANCE * grid.k0());
    // The zoom window [nsf, 2 ntot - nsf) covers [rmin, rmax].
    assertTrue(info, grid.r(nsf) <= RMIN);
    assertTrue(info, grid.r(grid.size() - nsf - 1) >= RMAX);
    assertEquals(info, grid.k0(), grid.k(grid.ntot()), 1.0e-12 * grid.k0());
    assertEquals(info, grid.kmax(), grid.k(0), 1.0e-12 * grid.kmax());
    assertTrue(info, grid.kmin() < grid.k(grid.size() - 1));
  }

  @Test
  public void testUnalignedWidth() {
    double e = TransformSizer.epsApprox(veps, ell);
    double nds0 = TransformSizer.nds(ell, e, false);
    assertEquals(info, -2.0 / (ell + 1) * log(e), nds0, 1.0e-12);
    assertTrue(info, TransformSizer.nds(ell, e, true) >= nds0);
  }
}
