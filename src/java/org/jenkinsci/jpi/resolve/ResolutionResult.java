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
import java.util.List;

import org.jenkinsci.jpi.artifact.ResolvedArtifact;

/** Artifacts and errors of one resolution. */
public final class ResolutionResult {

  private final List<ResolvedArtifact> artifacts;
  private final List<ResolutionError> errors;

  public ResolutionResult(List<ResolvedArtifact> artifacts,
      List<ResolutionError> errors) {
    this.artifacts = Collections.unmodifiableList(new ArrayList<>(artifacts));
    this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
  }

  public List<ResolvedArtifact> getArtifacts() {
    return artifacts;
  }

  public List<ResolutionError> getErrors() {
    return errors;
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
