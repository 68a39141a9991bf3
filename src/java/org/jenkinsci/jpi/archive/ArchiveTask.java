/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.jenkinsci.jpi.archive;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.jar.Attributes;
import java.util.jar.Manifest;

/**
 * An archive about to be written: its manifest, which several collaborators
 * contribute attributes to, and the input properties that decide whether an
 * earlier output of it is still current.
 */
public class ArchiveTask {

  private final String name;
  private final Manifest manifest = new Manifest();
  private final Map<String, String> inputs = new TreeMap<>();

  public ArchiveTask(String name) {
    this.name = name;
    manifest.getMainAttributes().put(Attributes.Name.MANIFEST_VERSION, "1.0");
  }

  public String getName() {
    return name;
  }

  /** @return the live manifest of the archive */
  public Manifest getManifest() {
    return manifest;
  }

  /** Records a build input of this archive. */
  public synchronized void inputProperty(String key, String value) {
    inputs.put(key, value);
  }

  public synchronized Map<String, String> getInputs() {
    return Collections.unmodifiableMap(new TreeMap<>(inputs));
  }

  /**
   * @param previous inputs recorded when the archive was last written
   * @return true if nothing that feeds the archive changed since
   */
  public synchronized boolean isUpToDate(Map<String, String> previous) {
    return previous != null && inputs.equals(previous);
  }

  @Override
  public String toString() {
    return name;
  }
}
