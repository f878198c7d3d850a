/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.sudokucsp.engine;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.logging.Level.WARNING;

import com.google.common.base.MoreObjects;
import com.google.common.io.Resources;

import java.io.IOException;
import java.io.Reader;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import java.util.Random;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Settings for a {@link SudokuEngine}.  Read from the classpath resource
 * {@value #RESOURCE_NAME} when present:
 *
 * <pre>
 *   sudokucsp.propagate = true              # commit forced values before each guess
 *   sudokucsp.requireUniqueSolution = false # generated puzzles must have one solution
 *   sudokucsp.seed = 1234                   # fixed seed for generation; absent means random
 * </pre>
 */
@Immutable
public final class EngineConfig {
  private static final Logger logger = Logger.getLogger(EngineConfig.class.getName());

  public static final String RESOURCE_NAME = "sudokucsp.properties";
  public static final String PROPAGATE = "sudokucsp.propagate";
  public static final String REQUIRE_UNIQUE_SOLUTION = "sudokucsp.requireUniqueSolution";
  public static final String SEED = "sudokucsp.seed";

  /** The settings used when nothing is configured. */
  public static final EngineConfig DEFAULTS = builder().build();

  private final boolean propagate;
  private final boolean requireUniqueSolution;
  @Nullable private final Long seed;

  private EngineConfig(Builder builder) {
    this.propagate = builder.propagate;
    this.requireUniqueSolution = builder.requireUniqueSolution;
    this.seed = builder.seed;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder().setPropagate(propagate)
        .setRequireUniqueSolution(requireUniqueSolution)
        .setSeed(seed);
  }

  /** Whether the solver commits forced values before each guess. */
  public boolean propagate() {
    return propagate;
  }

  /** Whether generated puzzles must have exactly one solution. */
  public boolean requireUniqueSolution() {
    return requireUniqueSolution;
  }

  /** The generation seed, or null for an unseeded random. */
  @Nullable public Long getSeed() {
    return seed;
  }

  /** Returns a new random source, seeded if a seed is configured. */
  public Random newRandom() {
    return seed == null ? new Random() : new Random(seed);
  }

  /**
   * Loads the configuration from the classpath resource, or returns the
   * defaults if there is no such resource.
   *
   * @throws IllegalArgumentException if a setting is malformed
   */
  public static EngineConfig load() {
    URL url;
    try {
      url = Resources.getResource(RESOURCE_NAME);
    } catch (IllegalArgumentException e) {
      logger.fine("No " + RESOURCE_NAME + " on the classpath, using defaults");
      return DEFAULTS;
    }
    Properties properties = new Properties();
    try (Reader reader = Resources.asCharSource(url, StandardCharsets.UTF_8).openStream()) {
      properties.load(reader);
    } catch (IOException e) {
      logger.log(WARNING, "Unable to read " + url + ", using defaults", e);
      return DEFAULTS;
    }
    return fromProperties(properties);
  }

  /**
   * Builds a configuration from the given properties; missing keys take their
   * default values.
   *
   * @throws IllegalArgumentException if a setting is malformed
   */
  public static EngineConfig fromProperties(Properties properties) {
    Builder builder = builder();
    builder.setPropagate(parseBoolean(properties, PROPAGATE, true));
    builder.setRequireUniqueSolution(parseBoolean(properties, REQUIRE_UNIQUE_SOLUTION, false));
    String seed = properties.getProperty(SEED);
    if (seed != null && !seed.trim().isEmpty()) {
      try {
        builder.setSeed(Long.parseLong(seed.trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Bad " + SEED + ": " + seed, e);
      }
    }
    return builder.build();
  }

  private static boolean parseBoolean(Properties properties, String key, boolean defaultValue) {
    String value = properties.getProperty(key);
    if (value == null) return defaultValue;
    value = value.trim();
    checkArgument(value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false"),
        "Bad %s: %s", key, value);
    return Boolean.parseBoolean(value);
  }

  @Override public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("propagate", propagate)
        .add("requireUniqueSolution", requireUniqueSolution)
        .add("seed", seed)
        .toString();
  }

  /** A mutable builder of configurations. */
  public static final class Builder {
    private boolean propagate = true;
    private boolean requireUniqueSolution;
    @Nullable private Long seed;

    private Builder() {}

    public Builder setPropagate(boolean propagate) {
      this.propagate = propagate;
      return this;
    }

    public Builder setRequireUniqueSolution(boolean requireUniqueSolution) {
      this.requireUniqueSolution = requireUniqueSolution;
      return this;
    }

    public Builder setSeed(@Nullable Long seed) {
      this.seed = seed;
      return this;
    }

    public EngineConfig build() {
      return new EngineConfig(this);
    }
  }
}
