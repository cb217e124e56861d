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
package cfx.numerics.fft;

import static java.lang.String.format;

/**
 * Circular convolution of real sequences of equal length.
 * <p>
 * (a * b)[m] = sum_j a[j] b[(m - j) mod n]
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class CircularConvolution {

  private CircularConvolution() {
  }

  /**
   * Compute the circular convolution with a forward FFT of each sequence, a pointwise product and a
   * normalized inverse FFT, keeping the real part.
   *
   * @param a the first sequence.
   * @param b the second sequence.
   * @return the convolution, of length a.length.
   */
  public static double[] convolve(double[] a, double[] b) {
    int n = checkLengths(a, b);
    if (n == 1) {
      return new double[] {a[0] * b[0]};
    }
    double[] ca = new double[2 * n];
    double[] cb = new double[2 * n];
    for (int i = 0; i < n; i++) {
      ca[2 * i] = a[i];
      cb[2 * i] = b[i];
    }
    Complex complex = new Complex(n);
    complex.fft(ca, 0, 2);
    complex.fft(cb, 0, 2);
    for (int i = 0; i < n; i++) {
      double re = ca[2 * i] * cb[2 * i] - ca[2 * i + 1] * cb[2 * i + 1];
      double im = ca[2 * i] * cb[2 * i + 1] + ca[2 * i + 1] * cb[2 * i];
      ca[2 * i] = re;
      ca[2 * i + 1] = im;
    }
    complex.inverse(ca, 0, 2);
    double[] result = new double[n];
    for (int i = 0; i < n; i++) {
      result[i] = ca[2 * i];
    }
    return result;
  }

  /**
   * Brute force O(n^2) circular convolution.
   *
   * @param a the first sequence.
   * @param b the second sequence.
   * @return the convolution, of length a.length.
   */
  public static double[] convolveDirect(double[] a, double[] b) {
    int n = checkLengths(a, b);
    double[] result = new double[n];
    for (int m = 0; m < n; m++) {
      double sum = 0.0;
      for (int j = 0; j < n; j++) {
        int k = m - j;
        if (k < 0) {
          k += n;
        }
        sum += a[j] * b[k];
      }
      result[m] = sum;
    }
    return result;
  }

  private static int checkLengths(double[] a, double[] b) {
    if (a == null || b == null || a.length == 0) {
      throw new IllegalArgumentException(" Convolution requires two non-empty sequences.");
    }
    if (a.length != b.length) {
      throw new IllegalArgumentException(
          format(" Sequence lengths differ (%d vs. %d).", a.length, b.length));
    }
    return a.length;
  }
}
