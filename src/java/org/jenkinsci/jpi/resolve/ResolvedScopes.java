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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jenkinsci.jpi.artifact.ArtifactClassifier;
import org.jenkinsci.jpi.artifact.ModuleIdentifier;
import org.jenkinsci.jpi.artifact.ResolvedArtifact;
import org.jenkinsci.jpi.role.Role;

/**
 * Classpath and bundle views of a resolved role graph.
 * <p>
 * A classpath holds the resolved artifacts of a role except plugin archives.
 * Everything resolved through <code>providedRuntime</code>, which carries
 * the Jenkins core and the plugin roles, is supplied by Jenkins and therefore
 * never bundled.
 */
public class ResolvedScopes {

  private final ScopeResolver scopes;

  public ResolvedScopes(ScopeResolver scopes) {
    this.scopes = scopes;
  }

  public List<ResolvedArtifact> getArtifacts(Role role)
      throws ResolutionException {
    return scopes.resolve(role);
  }

  /** @return the resolved artifacts of the role that are not plugin archives */
  public List<ResolvedArtifact> getClasspath(Role role)
      throws ResolutionException {
    Set<ResolvedArtifact> classpath = new LinkedHashSet<>();
    for (ResolvedArtifact artifact : scopes.resolve(role)) {
      if (!ArtifactClassifier.isHostExtension(artifact)) {
        classpath.add(artifact);
      }
    }
    return new ArrayList<>(classpath);
  }

  public List<ResolvedArtifact> getCompileClasspath() throws ResolutionException {
    return getClasspath(Role.COMPILE_CLASSPATH);
  }

  public List<ResolvedArtifact> getRuntimeClasspath() throws ResolutionException {
    return getClasspath(Role.RUNTIME_CLASSPATH);
  }

  public List<ResolvedArtifact> getTestCompileClasspath()
      throws ResolutionException {
    return getClasspath(Role.TEST_COMPILE_CLASSPATH);
  }

  /** @return the plugin archives resolved from a role */
  public List<ResolvedArtifact> getPlugins(Role role) throws ResolutionException {
    List<ResolvedArtifact> plugins = new ArrayList<>();
    for (ResolvedArtifact artifact : scopes.resolve(role)) {
      if (ArtifactClassifier.isHostExtension(artifact)) {
        plugins.add(artifact);
      }
    }
    return plugins;
  }

  /** @return every module Jenkins supplies at run time */
  public Set<ModuleIdentifier> getProvidedModules() throws ResolutionException {
    Set<ModuleIdentifier> provided = new LinkedHashSet<>();
    for (ResolvedArtifact artifact : scopes.resolve(Role.PROVIDED_RUNTIME)) {
      provided.add(artifact.getModule());
    }
    for (ResolvedArtifact artifact : scopes.resolve(Role.RUNTIME_CLASSPATH)) {
      if (ArtifactClassifier.isHostExtension(artifact)) {
        provided.add(artifact.getModule());
      }
    }
    return provided;
  }

  /**
   * @return the runtime classpath minus provided modules, one artifact per
   *         module, first resolved wins
   */
  public List<ResolvedArtifact> getBundledArtifacts() throws ResolutionException {
    Set<ModuleIdentifier> provided = getProvidedModules();
    Map<ModuleIdentifier, ResolvedArtifact> bundled = new LinkedHashMap<>();
    for (ResolvedArtifact artifact : getRuntimeClasspath()) {
      if (!provided.contains(artifact.getModule())) {
        bundled.putIfAbsent(artifact.getModule(), artifact);
      }
    }
    return new ArrayList<>(bundled.values());
  }
}
