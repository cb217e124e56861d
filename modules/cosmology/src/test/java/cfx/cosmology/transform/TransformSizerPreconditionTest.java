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

import static org.junit.Assert.assertEquals;

import cfx.utilities.CFXTest;
import org.junit.Test;

/**
 * @author Michael J. Schnieders
 */
public class TransformSizerPreconditionTest extends CFXTest {

  @Test
  public void testAlignedWidth() {
    double eps = TransformSizer.epsApprox(1.0e-3, 0);
    assertEquals(6.2323262210817845, TransformSizer.nds(0, eps, true), 1.0e-11);
  }

  @Test
  public void testKr0IsCached() {
    assertEquals(TransformSizer.kr0(6), TransformSizer.kr0(6), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testOddMultipole() {
    TransformSizer.size(3, 1.0e-3);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeMultipole() {
    TransformSizer.kr0(-2);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testToleranceTooLarge() {
    TransformSizer.size(0, 0.35);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroTolerance() {
    TransformSizer.size(0, 0.0);
  }

  /**
   * 0.3 is below 0.35, but 0.3 / ds(4, 1) is not.
   */
  @Test(expected = IllegalArgumentException.class)
  public void testScaledToleranceTooLarge() {
    TransformSizer.epsApprox(0.3, 4);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyRange() {
    TransformSizer.plan(10.0, 10.0, 0, 1.0e-3);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveRange() {
    TransformSizer.plan(0.0, 10.0, 0, 1.0e-3);
  }
}
