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

import static org.apache.commons.math3.util.FastMath.pow;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import cfx.utilities.CFXProperties;
import cfx.utilities.CFXTest;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

/**
 * @author Michael J. Schnieders
 */
public class PowerSpectrumTest extends CFXTest {

  private static final double[] K = {0.001, 0.01, 0.1, 1.0};
  private static final double[] P = {1000.0, 500.0, 50.0, 1.0};

  private final Logger spectrumLogger = Logger.getLogger(PowerSpectrum.class.getName());
  private final List<LogRecord> records = new ArrayList<>();
  private final Handler handler = new Handler() {
    @Override
    public void publish(LogRecord record) {
      records.add(record);
    }

    @Override
    public void flush() {
    }

    @Override
    public void close() {
    }
  };
  private Level level;

  @Before
  public void addHandler() {
    level = spectrumLogger.getLevel();
    spectrumLogger.setLevel(Level.INFO);
    spectrumLogger.addHandler(handler);
  }

  @After
  public void removeHandler() {
    spectrumLogger.removeHandler(handler);
    spectrumLogger.setLevel(level);
  }

  @Test
  public void testTabulatedValues() {
    PowerSpectrum spectrum = new PowerSpectrum(K, P);
    for (int i = 0; i < K.length; i++) {
      assertEquals(P[i], spectrum.value(K[i]), 1.0e-12 * P[i]);
    }
    assertEquals(0.001, spectrum.getKMin(), 0.0);
    assertEquals(1.0, spectrum.getKMax(), 0.0);
    assertEquals(4, spectrum.size());
    // Interpolated values stay between their neighbors for this monotonic table.
    double p = spectrum.value(0.03);
    assertTrue(p < 500.0 && p > 50.0);
  }

  @Test
  public void testPowerLawIsExact() {
    int n = 8;
    double[] k = new double[n];
    double[] p = new double[n];
    for (int i = 0; i < n; i++) {
      k[i] = pow(10.0, -3.0 + 0.5 * i);
      p[i] = 3.0 * pow(k[i], -1.2);
    }
    PowerSpectrum spectrum = new PowerSpectrum(k, p);
    for (double q : new double[]{1.0e-5, 2.0e-3, 0.37, 4.0, 1.0e3}) {
      assertEquals(1.0, spectrum.value(q) / (3.0 * pow(q, -1.2)), 1.0e-12);
    }
  }

  /**
   * Tails follow the power laws through the first and last pairs of points.
   */
  @Test
  public void testExtrapolation() {
    PowerSpectrum spectrum = new PowerSpectrum(K, P);
    assertEquals(2000.0, spectrum.value(1.0e-4), 1.0e-8);
    assertEquals(0.02, spectrum.value(10.0), 1.0e-12);

    PowerSpectrum.PowerLaw tail = PowerSpectrum.powerLaw(0.1, 50.0, 1.0, 1.0);
    assertEquals(1.0, tail.getAmplitude(), 1.0e-12);
    assertEquals(-1.6989700043360187, tail.getIndex(), 1.0e-12);
  }

  @Test
  public void testWarnsOncePerSide() {
    PowerSpectrum spectrum = new PowerSpectrum(K, P);
    spectrum.value(1.0e-4);
    spectrum.value(2.0e-4);
    spectrum.value(5.0);
    spectrum.value(7.0);
    spectrum.value(0.5);
    assertEquals(2, countWarnings());
  }

  @Test
  public void testWarningsDisabled() {
    PowerSpectrum spectrum = new PowerSpectrum(K, P, true, true, false, false);
    spectrum.value(1.0e-4);
    spectrum.value(5.0);
    assertEquals(0, countWarnings());
  }

  @Test
  public void testVerboseSummary() {
    new PowerSpectrum(K, P, true, true, true, true);
    assertEquals(1, records.size());
    assertEquals(Level.INFO, records.get(0).getLevel());
    assertTrue(records.get(0).getMessage().contains("4 points"));
  }

  @Test
  public void testExtrapolationDisabled() {
    PowerSpectrum spectrum = new PowerSpectrum(K, P, false, false, true, false);
    // The table ends are still valid.
    assertEquals(1000.0, spectrum.value(0.001), 1.0e-9);
    assertEquals(1.0, spectrum.value(1.0), 1.0e-12);
    try {
      spectrum.value(1.0e-4);
      throw new AssertionError(" Extrapolation below kmin should fail.");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("<"));
    }
    try {
      spectrum.value(2.0);
      throw new AssertionError(" Extrapolation above kmax should fail.");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains(">"));
    }
    assertEquals(0, countWarnings());
  }

  @Test
  public void testFromProperties() {
    System.setProperty("spectrum.extrapolateAbove", "false");
    PowerSpectrum spectrum = PowerSpectrum.fromPoints(
        new double[][]{{0.001, 1000.0}, {0.01, 500.0}, {0.1, 50.0}, {1.0, 1.0}},
        CFXProperties.loadProperties());
    assertTrue(spectrum.isExtrapolateBelow());
    assertFalse(spectrum.isExtrapolateAbove());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSinglePoint() {
    new PowerSpectrum(new double[]{0.1}, new double[]{1.0});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateWavenumber() {
    new PowerSpectrum(new double[]{0.1, 0.2, 0.2}, new double[]{1.0, 2.0, 3.0});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveWavenumber() {
    new PowerSpectrum(new double[]{0.0, 0.2}, new double[]{1.0, 2.0});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositivePower() {
    new PowerSpectrum(new double[]{0.1, 0.2}, new double[]{1.0, -2.0});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveArgument() {
    new PowerSpectrum(K, P).value(-1.0);
  }

  private int countWarnings() {
    int count = 0;
    for (LogRecord record : records) {
      if (record.getLevel() == Level.WARNING) {
        count++;
      }
    }
    return count;
  }
}
