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
package org.jenkinsci.jpi.manifest;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.jar.Attributes;

import org.apache.commons.codec.digest.DigestUtils;

/**
 * Ordered manifest attributes. Every value is a plain string so the map can
 * be written verbatim into a manifest and used as a build input fingerprint.
 */
public final class ManifestAttributes {

  private final Map<String, String> attributes = new LinkedHashMap<>();

  /**
   * Adds an attribute. A null value leaves the attribute out.
   *
   * @throws IllegalArgumentException if the name is not a valid manifest
   *           attribute name
   */
  public ManifestAttributes put(String name, String value) {
    // validates the name
    new Attributes.Name(name);
    if (value != null) {
      attributes.put(name, value);
    }
    return this;
  }

  public String get(String name) {
    return attributes.get(name);
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(attributes);
  }

  public int size() {
    return attributes.size();
  }

  /**
   * @return a SHA-256 digest over the attributes in order; equal maps give
   *         equal fingerprints
   */
  public String fingerprint() {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, String> e : attributes.entrySet()) {
      sb.append(e.getKey()).append(": ").append(e.getValue()).append('\n');
    }
    return DigestUtils.sha256Hex(sb.toString().getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ManifestAttributes
        && attributes.equals(((ManifestAttributes) o).attributes);
  }

  @Override
  public int hashCode() {
    return attributes.hashCode();
  }

  @Override
  public String toString() {
    return attributes.toString();
  }
}
