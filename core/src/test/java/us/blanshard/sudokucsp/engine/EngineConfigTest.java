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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import java.util.Properties;

public class EngineConfigTest {

  @Test public void defaults() {
    EngineConfig config = EngineConfig.DEFAULTS;
    assertTrue(config.propagate());
    assertFalse(config.requireUniqueSolution());
    assertNull(config.getSeed());
  }

  @Test public void loadsFromClasspath() {
    EngineConfig config = EngineConfig.load();
    assertTrue(config.propagate());
    assertFalse(config.requireUniqueSolution());
    assertEquals(Long.valueOf(20131019), config.getSeed());
  }

  @Test public void fromProperties() {
    Properties properties = new Properties();
    properties.setProperty(EngineConfig.PROPAGATE, "false");
    properties.setProperty(EngineConfig.REQUIRE_UNIQUE_SOLUTION, " TRUE ");
    properties.setProperty(EngineConfig.SEED, "7");
    EngineConfig config = EngineConfig.fromProperties(properties);
    assertFalse(config.propagate());
    assertTrue(config.requireUniqueSolution());
    assertEquals(Long.valueOf(7), config.getSeed());
  }

  @Test public void missingKeysTakeDefaults() {
    EngineConfig config = EngineConfig.fromProperties(new Properties());
    assertEquals(EngineConfig.DEFAULTS.toString(), config.toString());
  }

  @Test(expected = IllegalArgumentException.class)
  public void badBoolean() {
    Properties properties = new Properties();
    properties.setProperty(EngineConfig.PROPAGATE, "yes");
    EngineConfig.fromProperties(properties);
  }

  @Test(expected = IllegalArgumentException.class)
  public void badSeed() {
    Properties properties = new Properties();
    properties.setProperty(EngineConfig.SEED, "twelve");
    EngineConfig.fromProperties(properties);
  }

  @Test public void builder() {
    EngineConfig config = EngineConfig.builder().setSeed(3L).setPropagate(false).build();
    EngineConfig copy = config.toBuilder().build();
    assertEquals(Long.valueOf(3), copy.getSeed());
    assertFalse(copy.propagate());
    assertEquals(config.newRandom().nextLong(), copy.newRandom().nextLong());
  }
}
