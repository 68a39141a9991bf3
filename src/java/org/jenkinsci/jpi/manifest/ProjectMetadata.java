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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jenkinsci.jpi.artifact.ModuleIdentifier;
import org.jenkinsci.jpi.artifact.ResolvedArtifact;
import org.jenkinsci.jpi.config.JpiSettings;

/**
 * The project facts a plugin manifest is generated from.
 */
public class ProjectMetadata {

  private String shortName;
  private String longName;
  private String version;
  private String group;
  private String coreVersion;
  private String url;
  private String pluginClass;
  private final List<String> pluginDependencies = new ArrayList<>();

  /**
   * Collects metadata from the settings and the plugins resolved from the
   * plugin roles.
   *
   * @param settings the plugin settings
   * @param required plugin archives resolved from <code>jenkinsPlugins</code>
   * @param optional plugin archives resolved from
   *          <code>optionalJenkinsPlugins</code>
   */
  public static ProjectMetadata from(JpiSettings settings,
      List<ResolvedArtifact> required, List<ResolvedArtifact> optional) {
    ProjectMetadata metadata = new ProjectMetadata()
        .setShortName(settings.getShortName())
        .setLongName(settings.getDisplayName())
        .setVersion(settings.getVersion())
        .setGroup(settings.getGroup())
        .setCoreVersion(settings.getCoreVersion())
        .setUrl(settings.getUrl())
        .setPluginClass(settings.getPluginClass());
    Map<ModuleIdentifier, String> dependencies = new LinkedHashMap<>();
    for (ResolvedArtifact plugin : required) {
      dependencies.putIfAbsent(plugin.getModule(),
          plugin.getModule().getName() + ":" + plugin.getVersion());
    }
    for (ResolvedArtifact plugin : optional) {
      dependencies.putIfAbsent(plugin.getModule(),
          plugin.getModule().getName() + ":" + plugin.getVersion()
              + ";resolution:=optional");
    }
    for (String dependency : dependencies.values()) {
      metadata.addPluginDependency(dependency);
    }
    return metadata;
  }

  public String getShortName() {
    return shortName;
  }

  public ProjectMetadata setShortName(String shortName) {
    this.shortName = shortName;
    return this;
  }

  public String getLongName() {
    return longName;
  }

  public ProjectMetadata setLongName(String longName) {
    this.longName = longName;
    return this;
  }

  public String getVersion() {
    return version;
  }

  public ProjectMetadata setVersion(String version) {
    this.version = version;
    return this;
  }

  public String getGroup() {
    return group;
  }

  public ProjectMetadata setGroup(String group) {
    this.group = group;
    return this;
  }

  public String getCoreVersion() {
    return coreVersion;
  }

  public ProjectMetadata setCoreVersion(String coreVersion) {
    this.coreVersion = coreVersion;
    return this;
  }

  public String getUrl() {
    return url;
  }

  public ProjectMetadata setUrl(String url) {
    this.url = url;
    return this;
  }

  public String getPluginClass() {
    return pluginClass;
  }

  public ProjectMetadata setPluginClass(String pluginClass) {
    this.pluginClass = pluginClass;
    return this;
  }

  /** @return entries such as <code>credentials:2.1</code> */
  public List<String> getPluginDependencies() {
    return Collections.unmodifiableList(pluginDependencies);
  }

  public ProjectMetadata addPluginDependency(String dependency) {
    pluginDependencies.add(dependency);
    return this;
  }
}
