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
package org.jenkinsci.jpi.role;

import java.util.Objects;

import org.jenkinsci.jpi.artifact.ModuleIdentifier;

/**
 * Drops modules from a role's resolution. A null group or module matches
 * anything.
 */
public final class Exclusion {

  private final String group;
  private final String module;

  public Exclusion(String group, String module) {
    if (group == null && module == null) {
      throw new IllegalArgumentException("An exclusion needs a group or a module");
    }
    this.group = group;
    this.module = module;
  }

  public String getGroup() {
    return group;
  }

  public String getModule() {
    return module;
  }

  public boolean matches(ModuleIdentifier id) {
    return (group == null || group.equals(id.getGroup()))
        && (module == null || module.equals(id.getName()));
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Exclusion)) {
      return false;
    }
    Exclusion other = (Exclusion) o;
    return Objects.equals(group, other.group)
        && Objects.equals(module, other.module);
  }

  @Override
  public int hashCode() {
    return Objects.hash(group, module);
  }

  @Override
  public String toString() {
    return (group == null ? "*" : group) + ":" + (module == null ? "*" : module);
  }
}
