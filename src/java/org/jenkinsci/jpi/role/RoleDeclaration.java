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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jenkinsci.jpi.artifact.DependencyCoordinate;
import org.jenkinsci.jpi.artifact.ModuleIdentifier;
import org.jenkinsci.jpi.config.ConfigurationException;

/**
 * A role as declared in a {@link RoleGraph}: its visibility, the dependencies
 * the user declared on it, the exclusions it applies and the dependencies the
 * scope rewriter added to it.
 * <p>
 * User declarations are accepted until the graph is frozen. Rewritten
 * dependencies can only be added afterwards, while the graph resolves.
 */
public class RoleDeclaration {

  private final RoleGraph graph;
  private final Role role;
  private final Visibility visibility;
  private final String description;
  private final Set<DependencyCoordinate> dependencies = new LinkedHashSet<>();
  private final Set<Exclusion> exclusions = new LinkedHashSet<>();
  private final Map<ModuleIdentifier, RewrittenDependency> rewritten = new LinkedHashMap<>();

  RoleDeclaration(RoleGraph graph, Role role, Visibility visibility,
      String description) {
    this.graph = graph;
    this.role = role;
    this.visibility = visibility;
    this.description = description;
  }

  public Role getRole() {
    return role;
  }

  public String getName() {
    return role.getRoleName();
  }

  public Visibility getVisibility() {
    return visibility;
  }

  public boolean isVisible() {
    return visibility == Visibility.EXPOSED;
  }

  public String getDescription() {
    return description;
  }

  /**
   * Declares a dependency on this role.
   *
   * @param coordinate the dependency
   * @return this declaration
   * @throws ConfigurationException if the graph is already frozen
   */
  public synchronized RoleDeclaration addDependency(DependencyCoordinate coordinate)
      throws ConfigurationException {
    checkNotFrozen("declare " + coordinate + " on");
    dependencies.add(coordinate);
    return this;
  }

  /**
   * Declares a dependency given in <code>group:name:version[@type]</code>
   * notation.
   *
   * @throws ConfigurationException if the notation is invalid or the graph is
   *           already frozen
   */
  public RoleDeclaration addDependency(String notation)
      throws ConfigurationException {
    DependencyCoordinate coordinate;
    try {
      coordinate = DependencyCoordinate.parse(notation);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(e.getMessage() + " on role " + getName(), e);
    }
    return addDependency(coordinate);
  }

  /**
   * Excludes a module from every resolution this role takes part in.
   *
   * @throws ConfigurationException if the graph is already frozen
   */
  public synchronized RoleDeclaration exclude(String group, String module)
      throws ConfigurationException {
    checkNotFrozen("add exclusion " + group + ":" + module + " to");
    exclusions.add(new Exclusion(group, module));
    return this;
  }

  /** @return the dependencies declared by the user, in declaration order */
  public synchronized List<DependencyCoordinate> getDeclaredDependencies() {
    return new ArrayList<>(dependencies);
  }

  /**
   * @return declared dependencies followed by rewritten ones, in the order
   *         they were added
   */
  public synchronized List<DependencyCoordinate> getDependencies() {
    List<DependencyCoordinate> all = new ArrayList<>(dependencies);
    for (RewrittenDependency r : rewritten.values()) {
      all.add(r.getCoordinate());
    }
    return all;
  }

  public synchronized List<RewrittenDependency> getRewrittenDependencies() {
    return new ArrayList<>(rewritten.values());
  }

  public synchronized Set<Exclusion> getExclusions() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(exclusions));
  }

  /**
   * Adds a dependency on behalf of the scope rewriter. A module is added at
   * most once; later contributions of the same module are ignored.
   *
   * @param dependency the rewritten dependency, targeting this role
   * @return true if it was added, false if the module was already present
   * @throws IllegalStateException if the graph is not frozen yet or the
   *           dependency targets another role
   */
  public synchronized boolean addRewritten(RewrittenDependency dependency) {
    if (!graph.isFrozen()) {
      throw new IllegalStateException("Rewritten dependencies can only be added"
          + " once role declarations are frozen");
    }
    if (dependency.getTarget() != role) {
      throw new IllegalStateException(dependency + " does not target " + role);
    }
    ModuleIdentifier module = dependency.getCoordinate().getModule();
    if (rewritten.containsKey(module)) {
      return false;
    }
    rewritten.put(module, dependency);
    return true;
  }

  private void checkNotFrozen(String action) throws ConfigurationException {
    if (graph.isFrozen()) {
      throw new ConfigurationException("Cannot " + action + " role " + getName()
          + ": role declarations are frozen once resolution has started");
    }
  }

  @Override
  public String toString() {
    return getName();
  }
}
