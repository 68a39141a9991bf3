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

import java.io.File;
import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.jenkinsci.jpi.artifact.DependencyCoordinate;
import org.jenkinsci.jpi.artifact.ResolvedArtifact;
import org.jenkinsci.jpi.role.Exclusion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves dependencies against a single directory holding files named
 * <code>name-version.type</code>. There is no metadata in such a directory,
 * so resolution is never transitive.
 * <p>
 * A dependency without a type resolves to the first of
 * <code>name-version.hpi</code>, <code>.jpi</code> and <code>.jar</code> that
 * exists.
 */
public class FlatDirResolver implements DependencyResolver {

  private static final Logger LOG = LoggerFactory
      .getLogger(MethodHandles.lookup().lookupClass());

  private static final String[] DEFAULT_TYPES = { "hpi", "jpi", "jar" };

  private final File directory;

  public FlatDirResolver(File directory) {
    this.directory = directory;
  }

  @Override
  public ResolutionResult resolve(ResolutionRequest request) {
    Set<ResolvedArtifact> artifacts = new LinkedHashSet<>();
    List<ResolutionError> errors = new ArrayList<>();
    for (DependencyCoordinate dependency : request.getDependencies()) {
      if (isExcluded(dependency, request.getExclusions())) {
        LOG.debug("{}: excluding {}", request.getRole(), dependency);
        continue;
      }
      ResolvedArtifact artifact = find(dependency);
      if (artifact == null) {
        errors.add(new ResolutionError(dependency, request.getRole(),
            "Could not find " + dependency + " in " + directory));
      } else {
        artifacts.add(artifact);
      }
    }
    return new ResolutionResult(new ArrayList<>(artifacts), errors);
  }

  private ResolvedArtifact find(DependencyCoordinate dependency) {
    String[] types = dependency.getType() == null ? DEFAULT_TYPES
        : new String[] { dependency.getType() };
    for (String type : types) {
      File file = new File(directory, dependency.getName() + "-"
          + dependency.getVersion() + "." + type);
      if (file.isFile()) {
        return new ResolvedArtifact(dependency.getModule(),
            dependency.getVersion(), type, file);
      }
    }
    return null;
  }

  private static boolean isExcluded(DependencyCoordinate dependency,
      Set<Exclusion> exclusions) {
    for (Exclusion exclusion : exclusions) {
      if (exclusion.matches(dependency.getModule())) {
        return true;
      }
    }
    return false;
  }
}
