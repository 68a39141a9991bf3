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
package org.jenkinsci.jpi.artifact;

import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

/**
 * A declared dependency, written in notation
 * <code>group:name:version[@type]</code>.
 * <p>
 * Without a type the module's default artifact is requested together with its
 * transitive dependencies. With an explicit type only that single artifact is
 * requested, which is how a plugin's jar is put on a classpath without pulling
 * in its graph.
 */
public final class DependencyCoordinate {

  private final ModuleIdentifier module;
  private final String version;
  private final String type;
  private final boolean transitive;

  public DependencyCoordinate(String group, String name, String version) {
    this(group, name, version, null, true);
  }

  public DependencyCoordinate(String group, String name, String version,
      String type, boolean transitive) {
    this.module = new ModuleIdentifier(group, name);
    this.version = Objects.requireNonNull(version, "version");
    this.type = type;
    this.transitive = transitive;
  }

  /**
   * Parses <code>group:name:version</code> or
   * <code>group:name:version@type</code>.
   *
   * @param notation the dependency notation
   * @return the coordinate, non-transitive if a type was given
   * @throws IllegalArgumentException if the notation is malformed
   */
  public static DependencyCoordinate parse(String notation) {
    String text = StringUtils.trimToEmpty(notation);
    String type = null;
    int at = text.indexOf('@');
    if (at >= 0) {
      type = text.substring(at + 1);
      text = text.substring(0, at);
    }
    String[] parts = text.split(":");
    if (parts.length != 3 || StringUtils.isAnyBlank(parts)
        || (type != null && type.isEmpty())) {
      throw new IllegalArgumentException("Invalid dependency notation '"
          + notation + "', expected group:name:version[@type]");
    }
    return new DependencyCoordinate(parts[0], parts[1], parts[2], type,
        type == null);
  }

  public ModuleIdentifier getModule() {
    return module;
  }

  public String getGroup() {
    return module.getGroup();
  }

  public String getName() {
    return module.getName();
  }

  public String getVersion() {
    return version;
  }

  /** @return the requested artifact type, or null for the default artifact */
  public String getType() {
    return type;
  }

  public boolean isTransitive() {
    return transitive;
  }

  /** @return the same module and version without an artifact type */
  public DependencyCoordinate withoutType() {
    return new DependencyCoordinate(getGroup(), getName(), version);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DependencyCoordinate)) {
      return false;
    }
    DependencyCoordinate other = (DependencyCoordinate) o;
    return module.equals(other.module) && version.equals(other.version)
        && Objects.equals(type, other.type) && transitive == other.transitive;
  }

  @Override
  public int hashCode() {
    return Objects.hash(module, version, type, transitive);
  }

  @Override
  public String toString() {
    String s = module + ":" + version;
    return type == null ? s : s + "@" + type;
  }
}
