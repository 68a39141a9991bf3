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

import java.io.File;
import java.util.Objects;

/**
 * A file produced by resolving a dependency role. Immutable.
 */
public final class ResolvedArtifact {

  private final ModuleIdentifier module;
  private final String version;
  private final String type;
  private final String classifier;
  private final File file;

  public ResolvedArtifact(ModuleIdentifier module, String version, String type,
      String classifier, File file) {
    this.module = Objects.requireNonNull(module, "module");
    this.version = Objects.requireNonNull(version, "version");
    this.type = Objects.requireNonNull(type, "type");
    this.classifier = classifier;
    this.file = Objects.requireNonNull(file, "file");
  }

  public ResolvedArtifact(ModuleIdentifier module, String version, String type,
      File file) {
    this(module, version, type, null, file);
  }

  public ModuleIdentifier getModule() {
    return module;
  }

  public String getVersion() {
    return version;
  }

  /** @return the declared packaging type, e.g. <code>jar</code> or <code>hpi</code> */
  public String getType() {
    return type;
  }

  public String getClassifier() {
    return classifier;
  }

  public File getFile() {
    return file;
  }

  /**
   * File name used when the artifact is bundled:
   * <code>name-version[-classifier].type</code>.
   */
  public String getBundleName() {
    StringBuilder sb = new StringBuilder(module.getName()).append('-')
        .append(version);
    if (classifier != null) {
      sb.append('-').append(classifier);
    }
    return sb.append('.').append(type).toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ResolvedArtifact)) {
      return false;
    }
    ResolvedArtifact other = (ResolvedArtifact) o;
    return module.equals(other.module) && version.equals(other.version)
        && type.equals(other.type) && Objects.equals(classifier, other.classifier)
        && file.equals(other.file);
  }

  @Override
  public int hashCode() {
    return Objects.hash(module, version, type, classifier, file);
  }

  @Override
  public String toString() {
    return module + ":" + version + (classifier == null ? "" : ":" + classifier)
        + "@" + type;
  }
}
