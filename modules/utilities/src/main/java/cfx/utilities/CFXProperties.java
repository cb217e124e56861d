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
package cfx.utilities;

import static java.lang.String.format;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Arrays;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.io.FileHandler;

/**
 * Assembles the layered CFX configuration.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class CFXProperties {

  private static final Logger logger = Logger.getLogger(CFXProperties.class.getName());

  /** Name of the built-in defaults resource. */
  public static final String DEFAULTS_RESOURCE = "cfx/cfx.properties";

  /** Environment variable naming a system wide property file. */
  public static final String ENVIRONMENT_VARIABLE = "CFX_PROPERTIES";

  private CFXProperties() {
  }

  /**
   * Load properties with no caller supplied property file.
   *
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties() {
    return loadProperties(null);
  }

  /**
   * This method sets up configuration properties in the following precedence order:
   * <p>
   * 1.) JVM system properties (i.e. -Dkey=value pairs on the command line).
   * <p>
   * 2.) The property file supplied by the caller.
   * <p>
   * 3.) User specific properties in ~/.cfx/cfx.properties.
   * <p>
   * 4.) System wide properties in the file named by the CFX_PROPERTIES environment variable.
   * <p>
   * 5.) Built-in defaults from the class path.
   *
   * @param file a property file, or null.
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties(File file) {

    // Command line options take precedence.
    CompositeConfiguration properties = new CompositeConfiguration();

    /*
      JVM system properties are read first.
      a.) -Dkey=value from the Java command line
      b.) System.setProperty("key","value") within Java code.
     */
    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    // Caller specified options are 2nd.
    if (file != null) {
      if (!file.canRead()) {
        throw new IllegalArgumentException(format(" Property file %s cannot be read.", file));
      }
      PropertiesConfiguration configuration = loadFile(file);
      if (configuration != null) {
        configuration.setHeader("Caller properties from (" + file + ").");
        properties.addConfiguration(configuration);
        try {
          properties.addProperty("propertyFile", file.getCanonicalPath());
        } catch (IOException e) {
          properties.addProperty("propertyFile", file.getAbsolutePath());
        }
      }
    }

    // User specific options are 3rd.
    String filename = System.getProperty("user.home") + File.separator + ".cfx" + File.separator + "cfx.properties";
    File userPropFile = new File(filename);
    if (userPropFile.exists() && userPropFile.canRead()) {
      PropertiesConfiguration configuration = loadFile(userPropFile);
      if (configuration != null) {
        configuration.setHeader("CFX user property file (" + filename + ").");
        properties.addConfiguration(configuration);
      }
    }

    // System wide options are 2nd to last.
    filename = System.getenv(ENVIRONMENT_VARIABLE);
    if (filename != null) {
      File systemPropFile = new File(filename);
      if (systemPropFile.exists() && systemPropFile.canRead()) {
        PropertiesConfiguration configuration = loadFile(systemPropFile);
        if (configuration != null) {
          configuration.setHeader("Environment variable CFX_PROPERTIES (" + filename + ").");
          properties.addConfiguration(configuration);
        }
      }
    }

    // Built-in defaults are last.
    URL defaults = CFXProperties.class.getClassLoader().getResource(DEFAULTS_RESOURCE);
    if (defaults != null) {
      PropertiesConfiguration configuration = new PropertiesConfiguration();
      try (InputStream inputStream = defaults.openStream()) {
        new FileHandler(configuration).load(inputStream);
        configuration.setHeader("Built-in defaults (" + DEFAULTS_RESOURCE + ").");
        properties.addConfiguration(configuration);
      } catch (ConfigurationException | IOException e) {
        logger.log(Level.WARNING, format(" Error loading %s.", DEFAULTS_RESOURCE), e);
      }
    }

    // Echo the interpolated configuration.
    if (logger.isLoggable(Level.FINE)) {
      Iterator<String> i = properties.getKeys();
      StringBuilder sb = new StringBuilder();
      sb.append(format("\n %-30s %s\n", "Property", "Value"));
      while (i.hasNext()) {
        String s = i.next();
        sb.append(format(" %-30s %s\n", s, Arrays.toString(properties.getList(s).toArray())));
      }
      logger.fine(sb.toString());
    }

    return properties;
  }

  /**
   * Load a single properties file.
   *
   * @param file the file to load.
   * @return the loaded configuration, or null if it could not be parsed.
   */
  private static PropertiesConfiguration loadFile(File file) {
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties()
                  .setFile(file)
                  .setThrowExceptionOnMissing(true)
                  .setIncludesAllowed(false));
      return builder.getConfiguration();
    } catch (ConfigurationException e) {
      logger.log(Level.WARNING, format(" Error loading %s.", file), e);
      return null;
    }
  }
}
