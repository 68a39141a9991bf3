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
package org.jenkinsci.jpi.archive;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import org.apache.commons.lang3.StringUtils;
import org.jenkinsci.jpi.artifact.ModuleIdentifier;
import org.jenkinsci.jpi.config.ConfigurationException;
import org.jenkinsci.jpi.config.FileExtension;
import org.jenkinsci.jpi.config.JpiSettings;

/**
 * Name and extension of a plugin archive, and the modules left out of its
 * <code>WEB-INF/lib</code> because Jenkins supplies them.
 */
public final class PackageDescriptor {

  private final String baseName;
  private final FileExtension extension;
  private final Set<ModuleIdentifier> excluded;

  public PackageDescriptor(String baseName, FileExtension extension,
      Set<ModuleIdentifier> excluded) {
    if (StringUtils.isBlank(baseName)) {
      throw new IllegalArgumentException("An archive needs a base name");
    }
    this.baseName = baseName;
    this.extension = extension == null ? FileExtension.HPI : extension;
    this.excluded = Collections.unmodifiableSet(new TreeSet<>(excluded));
  }

  /**
   * @throws ConfigurationException if the settings yield no short name
   */
  public static PackageDescriptor of(JpiSettings settings,
      Set<ModuleIdentifier> excluded) throws ConfigurationException {
    String shortName = settings.getShortName();
    if (shortName == null) {
      throw new ConfigurationException("Cannot name the plugin archive: no"
          + " short name, set jpi.short.name or jpi.project.name");
    }
    return new PackageDescriptor(shortName, settings.getFileExtension(), excluded);
  }

  public String getBaseName() {
    return baseName;
  }

  public FileExtension getExtension() {
    return extension;
  }

  /** @return e.g. <code>widget.hpi</code> */
  public String getArchiveName() {
    return baseName + "." + extension.getExtension();
  }

  /** @return name of the nested jar holding the plugin's own classes */
  public String getLibraryJarName() {
    return baseName + ".jar";
  }

  public Set<ModuleIdentifier> getExcluded() {
    return excluded;
  }

  public boolean isExcluded(ModuleIdentifier module) {
    return excluded.contains(module);
  }

  @Override
  public String toString() {
    return getArchiveName();
  }
}
