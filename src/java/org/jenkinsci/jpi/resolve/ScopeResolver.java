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

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.jenkinsci.jpi.artifact.DependencyCoordinate;
import org.jenkinsci.jpi.artifact.ResolvedArtifact;
import org.jenkinsci.jpi.config.ConfigurationException;
import org.jenkinsci.jpi.role.Exclusion;
import org.jenkinsci.jpi.role.Role;
import org.jenkinsci.jpi.role.RoleDeclaration;
import org.jenkinsci.jpi.role.RoleGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves roles of a frozen {@link RoleGraph} through a
 * {@link DependencyResolver} and caches the result per role. When
 * dependencies are added to a role, only that role and the roles it extends
 * into are resolved again.
 */
public class ScopeResolver {

  private static final Logger LOG = LoggerFactory
      .getLogger(MethodHandles.lookup().lookupClass());

  private final RoleGraph graph;
  private final DependencyResolver resolver;
  private final Map<Role, List<ResolvedArtifact>> cache = new ConcurrentHashMap<>();

  public ScopeResolver(RoleGraph graph, DependencyResolver resolver) {
    this.graph = graph;
    this.resolver = resolver;
  }

  public RoleGraph getGraph() {
    return graph;
  }

  /**
   * Resolves a role, including the dependencies of every role extending into
   * it.
   *
   * @param role the role to resolve
   * @return the resolved artifacts, in resolver order
   * @throws ResolutionException if any dependency could not be resolved
   * @throws IllegalStateException if the graph is still being declared
   */
  public List<ResolvedArtifact> resolve(Role role) throws ResolutionException {
    if (!graph.isFrozen()) {
      throw new IllegalStateException("Role " + role
          + " cannot be resolved before role declarations are frozen");
    }
    List<ResolvedArtifact> cached = cache.get(role);
    if (cached != null) {
      return cached;
    }
    ResolutionRequest request = createRequest(role);
    LOG.debug("Resolving role {} with {} dependencies", role,
        request.getDependencies().size());
    ResolutionResult result = resolver.resolve(request);
    if (result.hasErrors()) {
      throw new ResolutionException(role, result.getErrors());
    }
    List<ResolvedArtifact> artifacts = Collections.unmodifiableList(
        new ArrayList<>(result.getArtifacts()));
    cache.put(role, artifacts);
    return artifacts;
  }

  /**
   * Drops the cached resolution of <code>role</code> and of every role it
   * extends into.
   */
  public void invalidate(Role role) {
    for (Role r : graph.getDownstreamRoles(role)) {
      if (cache.remove(r) != null) {
        LOG.debug("Invalidated resolution of role {}", r);
      }
    }
  }

  /** @return true if the role has a cached resolution */
  public boolean isResolved(Role role) {
    return cache.containsKey(role);
  }

  ResolutionRequest createRequest(Role role) {
    Set<DependencyCoordinate> dependencies = new LinkedHashSet<>();
    Set<Exclusion> exclusions = new LinkedHashSet<>();
    for (Role contributor : graph.getContributingRoles(role)) {
      RoleDeclaration declaration = declaration(contributor);
      dependencies.addAll(declaration.getDependencies());
      exclusions.addAll(declaration.getExclusions());
    }
    return new ResolutionRequest(role, new ArrayList<>(dependencies),
        exclusions);
  }

  private RoleDeclaration declaration(Role role) {
    try {
      return graph.getRole(role);
    } catch (ConfigurationException e) {
      // contributing roles always come from the graph itself
      throw new IllegalStateException(e);
    }
  }
}
