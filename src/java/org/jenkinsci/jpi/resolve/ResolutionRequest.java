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
package org.jenkinsci.jpi.resolve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.jenkinsci.jpi.artifact.DependencyCoordinate;
import org.jenkinsci.jpi.role.Exclusion;
import org.jenkinsci.jpi.role.Role;

/**
 * What a {@link DependencyResolver} is asked to resolve: the effective
 * dependencies of a role, including those of every role extending into it,
 * and the exclusions that apply.
 */
public final class ResolutionRequest {

  private final Role role;
  private final List<DependencyCoordinate> dependencies;
  private final Set<Exclusion> exclusions;

  public ResolutionRequest(Role role, List<DependencyCoordinate> dependencies,
      Set<Exclusion> exclusions) {
    this.role = role;
    this.dependencies = Collections.unmodifiableList(new ArrayList<>(dependencies));
    this.exclusions = Collections.unmodifiableSet(new LinkedHashSet<>(exclusions));
  }

  public Role getRole() {
    return role;
  }

  public List<DependencyCoordinate> getDependencies() {
    return dependencies;
  }

  public Set<Exclusion> getExclusions() {
    return exclusions;
  }

  @Override
  public String toString() {
    return role + " " + dependencies;
  }
}
