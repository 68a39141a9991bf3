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
package org.jenkinsci.jpi.manifest;

import java.lang.invoke.MethodHandles;
import java.util.Arrays;
import java.util.Collection;
import java.util.jar.Attributes;

import org.apache.commons.lang3.StringUtils;
import org.jenkinsci.jpi.archive.ArchiveTask;
import org.jenkinsci.jpi.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the main attributes of a plugin manifest and merges them into the
 * archives that carry it, the library jar and the plugin archive.
 */
public class ManifestAssembler {

  private static final Logger LOG = LoggerFactory
      .getLogger(MethodHandles.lookup().lookupClass());

  /** Input property under which the attribute fingerprint is recorded. */
  public static final String MANIFEST_INPUT = "manifest";

  public static final String SHORT_NAME = "Short-Name";
  public static final String LONG_NAME = "Long-Name";
  public static final String GROUP_ID = "Group-Id";
  public static final String URL = "Url";
  public static final String PLUGIN_CLASS = "Plugin-Class";
  public static final String EXTENSION_NAME = "Extension-Name";
  public static final String PLUGIN_VERSION = "Plugin-Version";
  public static final String JENKINS_VERSION = "Jenkins-Version";
  public static final String PLUGIN_DEPENDENCIES = "Plugin-Dependencies";

  /**
   * @param metadata the project metadata
   * @return the attributes, in manifest order
   * @throws ConfigurationException if the short name or the version is
   *           missing
   */
  public ManifestAttributes assemble(ProjectMetadata metadata)
      throws ConfigurationException {
    if (StringUtils.isBlank(metadata.getShortName())) {
      throw new ConfigurationException("Cannot assemble manifest: no short name,"
          + " set jpi.short.name or jpi.project.name");
    }
    if (StringUtils.isBlank(metadata.getVersion())) {
      throw new ConfigurationException("Cannot assemble manifest of "
          + metadata.getShortName() + ": no version, set jpi.version");
    }
    ManifestAttributes attributes = new ManifestAttributes()
        .put(Attributes.Name.MANIFEST_VERSION.toString(), "1.0")
        .put(SHORT_NAME, metadata.getShortName())
        .put(LONG_NAME, StringUtils.defaultIfBlank(metadata.getLongName(),
            metadata.getShortName()))
        .put(GROUP_ID, metadata.getGroup())
        .put(URL, metadata.getUrl())
        .put(PLUGIN_CLASS, metadata.getPluginClass())
        .put(EXTENSION_NAME, metadata.getShortName())
        .put(PLUGIN_VERSION, metadata.getVersion())
        .put(JENKINS_VERSION, metadata.getCoreVersion());
    if (!metadata.getPluginDependencies().isEmpty()) {
      attributes.put(PLUGIN_DEPENDENCIES,
          String.join(",", metadata.getPluginDependencies()));
    }
    return attributes;
  }

  public void apply(ManifestAttributes attributes, ArchiveTask... archives) {
    apply(attributes, Arrays.asList(archives));
  }

  /**
   * Merges the attributes into each archive's manifest, keeping attributes
   * other collaborators set, and records their fingerprint as an input of
   * each archive.
   */
  public void apply(ManifestAttributes attributes,
      Collection<ArchiveTask> archives) {
    String fingerprint = attributes.fingerprint();
    for (ArchiveTask archive : archives) {
      Attributes main = archive.getManifest().getMainAttributes();
      attributes.asMap().forEach(main::putValue);
      archive.inputProperty(MANIFEST_INPUT, fingerprint);
      LOG.debug("Applied {} manifest attributes to {}", attributes.size(),
          archive);
    }
  }
}
