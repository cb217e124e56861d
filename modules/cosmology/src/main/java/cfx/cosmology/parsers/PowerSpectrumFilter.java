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
package cfx.cosmology.parsers;

import static java.lang.String.format;

import cfx.cosmology.PowerSpectrum;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The PowerSpectrumFilter class parses a tabulated power spectrum: whitespace separated k and P(k)
 * columns, one point per line. Blank lines and lines starting with '#' are skipped, and columns
 * after the second are ignored.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PowerSpectrumFilter {

  private static final Logger logger = Logger.getLogger(PowerSpectrumFilter.class.getName());

  private final File file;
  private final CompositeConfiguration properties;
  private double[] k;
  private double[] p;

  /**
   * Constructor for PowerSpectrumFilter.
   *
   * @param file       the file to parse.
   * @param properties options passed to the spectrum.
   */
  public PowerSpectrumFilter(File file, CompositeConfiguration properties) {
    this.file = file;
    this.properties = properties;
  }

  /**
   * Parse the file.
   *
   * @return true if the file was read.
   */
  public boolean readFile() {
    List<double[]> points = new ArrayList<>();
    try (BufferedReader br = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      String line;
      int lineNumber = 0;
      while ((line = br.readLine()) != null) {
        lineNumber++;
        line = line.trim();
        if (line.isEmpty() || line.startsWith("#")) {
          continue;
        }
        String[] tokens = line.split("\\s+");
        if (tokens.length < 2) {
          logger.warning(format(" Line %d of %s has fewer than two columns: %s", lineNumber, file, line));
          return false;
        }
        try {
          points.add(new double[] {Double.parseDouble(tokens[0]), Double.parseDouble(tokens[1])});
        } catch (NumberFormatException e) {
          logger.warning(format(" Line %d of %s could not be parsed: %s", lineNumber, file, line));
          return false;
        }
      }
    } catch (IOException e) {
      logger.log(Level.WARNING, format(" Exception reading %s", file), e);
      return false;
    }
    int n = points.size();
    k = new double[n];
    p = new double[n];
    for (int i = 0; i < n; i++) {
      k[i] = points.get(i)[0];
      p[i] = points.get(i)[1];
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Read %d power spectrum points from %s.", n, file));
    }
    return true;
  }

  /**
   * Create the power spectrum from the parsed table.
   *
   * @return the power spectrum.
   * @throws IllegalStateException if the file has not been read.
   */
  public PowerSpectrum getPowerSpectrum() {
    if (k == null) {
      throw new IllegalStateException(format(" %s has not been read.", file));
    }
    return PowerSpectrum.fromProperties(k, p, properties);
  }

  /**
   * Read a power spectrum file.
   *
   * @param file       the file.
   * @param properties spectrum options.
   * @return the power spectrum.
   * @throws IllegalArgumentException if the file cannot be parsed.
   */
  public static PowerSpectrum read(File file, CompositeConfiguration properties) {
    PowerSpectrumFilter filter = new PowerSpectrumFilter(file, properties);
    if (!filter.readFile()) {
      throw new IllegalArgumentException(format(" Power spectrum file %s could not be parsed.", file));
    }
    return filter.getPowerSpectrum();
  }
}
