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

/**
 * Identity of a module regardless of its version: <code>group:name</code>.
 */
public final class ModuleIdentifier implements Comparable<ModuleIdentifier> {

  private final String group;
  private final String name;

  public ModuleIdentifier(String group, String name) {
    this.group = Objects.requireNonNull(group, "group");
    this.name = Objects.requireNonNull(name, "name");
  }

  public String getGroup() {
    return group;
  }

  public String getName() {
    return name;
  }

  @Override
  public int compareTo(ModuleIdentifier o) {
    int c = group.compareTo(o.group);
    return c != 0 ? c : name.compareTo(o.name);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ModuleIdentifier)) {
      return false;
    }
    ModuleIdentifier other = (ModuleIdentifier) o;
    return group.equals(other.group) && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(group, name);
  }

  @Override
  public String toString() {
    return group + ":" + name;
  }
}
