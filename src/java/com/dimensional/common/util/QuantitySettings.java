// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.dimensional.common.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;

import com.dimensional.common.base.MorePreconditions;
import com.dimensional.common.quantity.Culture;
import com.dimensional.common.quantity.algebra.ZeroDivisorPolicy;

/**
 * Handles loading of the quantity properties file, which configures the process-wide defaults of
 * the parser and the operator network.  Missing keys, and a missing file, leave the built-in
 * defaults in place.
 */
public class QuantitySettings {

  private static final Logger LOG = Logger.getLogger(QuantitySettings.class.getName());

  private static final String DEFAULT_PROPERTIES_PATH = "quantity.properties";

  private final Culture defaultCulture;
  private final Culture fallbackCulture;
  private final ZeroDivisorPolicy zeroDivisorPolicy;

  /**
   * Creates settings from the default properties file path.
   */
  public QuantitySettings() {
    this(DEFAULT_PROPERTIES_PATH);
  }

  /**
   * Creates settings, reading from the given resource path.
   *
   * @param resourcePath The resource path to read properties from.
   */
  public QuantitySettings(String resourcePath) {
    this(fetchProperties(MorePreconditions.checkNotBlank(resourcePath)));
  }

  @VisibleForTesting
  public QuantitySettings(Properties properties) {
    Preconditions.checkNotNull(properties);
    defaultCulture = culture(properties, Key.DEFAULT_CULTURE, Culture.EN_US);
    fallbackCulture = culture(properties, Key.FALLBACK_CULTURE, Culture.EN_US);
    String policy = properties.getProperty(Key.ZERO_DIVISOR_POLICY.value);
    zeroDivisorPolicy = policy == null
        ? ZeroDivisorPolicy.THROW
        : ZeroDivisorPolicy.valueOf(policy.trim().toUpperCase(Locale.ENGLISH));
  }

  private static Properties fetchProperties(String resourcePath) {
    Properties properties = new Properties();
    LOG.info("Fetching quantity properties from " + resourcePath);
    InputStream in = QuantitySettings.class.getClassLoader().getResourceAsStream(resourcePath);
    if (in == null) {
      LOG.warning("Failed to fetch quantity properties from " + resourcePath
          + ", using defaults");
      return properties;
    }

    try {
      properties.load(in);
    } catch (IOException e) {
      LOG.log(Level.WARNING, "Failed to load properties file " + resourcePath, e);
    } finally {
      try {
        in.close();
      } catch (IOException e) {
        LOG.log(Level.FINE, "Failed to close " + resourcePath, e);
      }
    }
    return properties;
  }

  private static Culture culture(Properties properties, Key key, Culture defaultValue) {
    String id = properties.getProperty(key.value);
    if (id == null) {
      return defaultValue;
    }
    Optional<Culture> culture = Culture.forId(id);
    Preconditions.checkArgument(culture.isPresent(), "Unknown culture '%s' for %s", id, key.value);
    return culture.get();
  }

  /**
   * Returns the culture used by parse and format calls that pass none.
   */
  public Culture getDefaultCulture() {
    return defaultCulture;
  }

  /**
   * Returns the culture whose abbreviations stand in for units missing from the requested one.
   */
  public Culture getFallbackCulture() {
    return fallbackCulture;
  }

  public ZeroDivisorPolicy getZeroDivisorPolicy() {
    return zeroDivisorPolicy;
  }

  @Override
  public String toString() {
    return String.format("default culture: %s, fallback culture: %s, zero divisor policy: %s",
        defaultCulture, fallbackCulture, zeroDivisorPolicy);
  }

  /**
   * Keys recognized in the properties file.
   */
  public enum Key {
    DEFAULT_CULTURE("quantity.default.culture"),
    FALLBACK_CULTURE("quantity.fallback.culture"),
    ZERO_DIVISOR_POLICY("quantity.zero.divisor.policy");

    public final String value;
    private Key(String value) {
      this.value = value;
    }
  }
}
