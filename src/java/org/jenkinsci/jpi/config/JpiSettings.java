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
package org.jenkinsci.jpi.config;

import java.io.File;
import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.hadoop.conf.Configuration;
import org.jenkinsci.jpi.role.RoleDeclaration;
import org.jenkinsci.jpi.role.RoleGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Everything a plugin build is configured with: the role graph and the
 * plugin's naming, packaging and publishing settings.
 * <p>
 * A settings object is created once and passed to the resolution and
 * assembly stages. {@link #freeze()} ends the declaration phase for the
 * settings and the role graph together; any later mutation fails with a
 * {@link ConfigurationException}.
 */
public class JpiSettings {

  private static final Logger LOG = LoggerFactory
      .getLogger(MethodHandles.lookup().lookupClass());

  public static final String PROJECT_NAME = "jpi.project.name";
  public static final String SHORT_NAME = "jpi.short.name";
  public static final String DISPLAY_NAME = "jpi.display.name";
  public static final String GROUP = "jpi.group";
  public static final String VERSION = "jpi.version";
  public static final String CORE_VERSION = "jpi.core.version";
  public static final String URL = "jpi.url";
  public static final String PLUGIN_CLASS = "jpi.plugin.class";
  public static final String FILE_EXTENSION = "jpi.file.extension";
  public static final String CONFIGURE_REPOSITORIES = "jpi.configure.repositories";
  public static final String CONFIGURE_PUBLISHING = "jpi.configure.publishing";
  public static final String REPO_URL = "jpi.repo.url";
  public static final String SNAPSHOT_REPO_URL = "jpi.snapshot.repo.url";
  public static final String DISABLED_TEST_INJECTION = "jpi.disabled.test.injection";
  public static final String INJECTED_TEST_NAME = "jpi.injected.test.name";
  public static final String RESOLVER_THREADS = "jpi.resolver.threads";
  /** Prefix of the per role dependency lists, followed by the role name. */
  public static final String DEPENDENCIES_PREFIX = "jpi.dependencies.";

  public static final String MAVEN_CENTRAL_URL = "https://repo.maven.apache.org/maven2/";
  public static final String JENKINS_PUBLIC_URL = "https://repo.jenkins-ci.org/public/";
  public static final String DEFAULT_REPO_URL = "https://repo.jenkins-ci.org/releases";
  public static final String DEFAULT_SNAPSHOT_REPO_URL = "https://repo.jenkins-ci.org/snapshots";

  private static final String PLUGIN_SUFFIX = "-plugin";

  private final RoleGraph roles;
  private String projectName;
  private String shortName;
  private String displayName;
  private String group;
  private String version;
  private String coreVersion;
  private String url;
  private String pluginClass;
  private FileExtension fileExtension = FileExtension.HPI;
  private boolean configureRepositories = true;
  private boolean configurePublishing = true;
  private String repoUrl = DEFAULT_REPO_URL;
  private String snapshotRepoUrl = DEFAULT_SNAPSHOT_REPO_URL;
  private boolean disabledTestInjection;
  private String injectedTestName = "InjectedTest";
  private int resolverThreads = 2;
  private volatile boolean frozen;

  public JpiSettings(RoleGraph roles) {
    this.roles = roles;
  }

  /**
   * Reads settings and role dependency declarations from a configuration.
   * Declarations are read from <code>jpi.dependencies.&lt;roleName&gt;</code>,
   * a comma separated list of <code>group:name:version[@type]</code>.
   *
   * @param conf a populated {@link Configuration}
   * @return settings over the default role graph, not frozen
   * @throws ConfigurationException if a value is invalid
   */
  public static JpiSettings fromConfiguration(Configuration conf)
      throws ConfigurationException {
    JpiSettings settings = new JpiSettings(RoleGraph.createDefault());
    settings.setProjectName(conf.getTrimmed(PROJECT_NAME));
    settings.setShortName(conf.getTrimmed(SHORT_NAME));
    settings.setDisplayName(conf.getTrimmed(DISPLAY_NAME));
    settings.setGroup(conf.getTrimmed(GROUP));
    settings.setVersion(conf.getTrimmed(VERSION));
    settings.setCoreVersion(conf.getTrimmed(CORE_VERSION));
    settings.setUrl(conf.getTrimmed(URL));
    settings.setPluginClass(conf.getTrimmed(PLUGIN_CLASS));
    settings.setFileExtension(FileExtension.parse(conf.getTrimmed(FILE_EXTENSION)));
    settings.setConfigureRepositories(conf.getBoolean(CONFIGURE_REPOSITORIES, true));
    settings.setConfigurePublishing(conf.getBoolean(CONFIGURE_PUBLISHING, true));
    settings.setRepoUrl(conf.getTrimmed(REPO_URL, DEFAULT_REPO_URL));
    settings.setSnapshotRepoUrl(conf.getTrimmed(SNAPSHOT_REPO_URL,
        DEFAULT_SNAPSHOT_REPO_URL));
    settings.setDisabledTestInjection(conf.getBoolean(DISABLED_TEST_INJECTION, false));
    settings.setInjectedTestName(conf.getTrimmed(INJECTED_TEST_NAME, "InjectedTest"));
    settings.setResolverThreads(conf.getInt(RESOLVER_THREADS, 2));

    for (RoleDeclaration role : settings.roles.getRoles()) {
      for (String notation : conf.getTrimmedStrings(DEPENDENCIES_PREFIX + role.getName())) {
        role.addDependency(notation);
        LOG.debug("Declared {} on role {}", notation, role.getName());
      }
    }
    return settings;
  }

  public RoleGraph getRoles() {
    return roles;
  }

  /**
   * Ends the declaration phase for the settings and the role graph.
   *
   * @throws ConfigurationException if the role graph is cyclic
   */
  public void freeze() throws ConfigurationException {
    roles.freeze();
    frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }

  /**
   * @return the explicit short name, or else the project name without a
   *         trailing <code>-plugin</code>; null if neither is set
   */
  public String getShortName() {
    if (StringUtils.isNotBlank(shortName)) {
      return shortName;
    }
    if (StringUtils.isBlank(projectName)) {
      return null;
    }
    return StringUtils.removeEnd(projectName, PLUGIN_SUFFIX);
  }

  public void setShortName(String shortName) throws ConfigurationException {
    checkNotFrozen(SHORT_NAME);
    this.shortName = StringUtils.trimToNull(shortName);
  }

  public String getProjectName() {
    return projectName;
  }

  public void setProjectName(String projectName) throws ConfigurationException {
    checkNotFrozen(PROJECT_NAME);
    this.projectName = StringUtils.trimToNull(projectName);
  }

  /** @return the display name, defaulting to the short name */
  public String getDisplayName() {
    return displayName != null ? displayName : getShortName();
  }

  public void setDisplayName(String displayName) throws ConfigurationException {
    checkNotFrozen(DISPLAY_NAME);
    this.displayName = StringUtils.trimToNull(displayName);
  }

  public String getGroup() {
    return group;
  }

  public void setGroup(String group) throws ConfigurationException {
    checkNotFrozen(GROUP);
    this.group = StringUtils.trimToNull(group);
  }

  public String getVersion() {
    return version;
  }

  public void setVersion(String version) throws ConfigurationException {
    checkNotFrozen(VERSION);
    this.version = StringUtils.trimToNull(version);
  }

  public String getCoreVersion() {
    return coreVersion;
  }

  public void setCoreVersion(String coreVersion) throws ConfigurationException {
    checkNotFrozen(CORE_VERSION);
    this.coreVersion = StringUtils.trimToNull(coreVersion);
  }

  public String getUrl() {
    return url;
  }

  public void setUrl(String url) throws ConfigurationException {
    checkNotFrozen(URL);
    this.url = StringUtils.trimToNull(url);
  }

  public String getPluginClass() {
    return pluginClass;
  }

  public void setPluginClass(String pluginClass) throws ConfigurationException {
    checkNotFrozen(PLUGIN_CLASS);
    this.pluginClass = StringUtils.trimToNull(pluginClass);
  }

  public FileExtension getFileExtension() {
    return fileExtension;
  }

  public void setFileExtension(FileExtension fileExtension)
      throws ConfigurationException {
    checkNotFrozen(FILE_EXTENSION);
    this.fileExtension = fileExtension == null ? FileExtension.HPI : fileExtension;
  }

  public void setFileExtension(String fileExtension) throws ConfigurationException {
    setFileExtension(FileExtension.parse(fileExtension));
  }

  public boolean isConfigureRepositories() {
    return configureRepositories;
  }

  public void setConfigureRepositories(boolean configureRepositories)
      throws ConfigurationException {
    checkNotFrozen(CONFIGURE_REPOSITORIES);
    this.configureRepositories = configureRepositories;
  }

  public boolean isConfigurePublishing() {
    return configurePublishing;
  }

  public void setConfigurePublishing(boolean configurePublishing)
      throws ConfigurationException {
    checkNotFrozen(CONFIGURE_PUBLISHING);
    this.configurePublishing = configurePublishing;
  }

  public String getRepoUrl() {
    return repoUrl;
  }

  public void setRepoUrl(String repoUrl) throws ConfigurationException {
    checkNotFrozen(REPO_URL);
    this.repoUrl = repoUrl;
  }

  public String getSnapshotRepoUrl() {
    return snapshotRepoUrl;
  }

  public void setSnapshotRepoUrl(String snapshotRepoUrl)
      throws ConfigurationException {
    checkNotFrozen(SNAPSHOT_REPO_URL);
    this.snapshotRepoUrl = snapshotRepoUrl;
  }

  public boolean isDisabledTestInjection() {
    return disabledTestInjection;
  }

  public void setDisabledTestInjection(boolean disabledTestInjection)
      throws ConfigurationException {
    checkNotFrozen(DISABLED_TEST_INJECTION);
    this.disabledTestInjection = disabledTestInjection;
  }

  public String getInjectedTestName() {
    return injectedTestName;
  }

  public void setInjectedTestName(String injectedTestName)
      throws ConfigurationException {
    checkNotFrozen(INJECTED_TEST_NAME);
    this.injectedTestName = injectedTestName;
  }

  public int getResolverThreads() {
    return resolverThreads;
  }

  public void setResolverThreads(int resolverThreads)
      throws ConfigurationException {
    checkNotFrozen(RESOLVER_THREADS);
    if (resolverThreads < 1) {
      throw new ConfigurationException(RESOLVER_THREADS
          + " must be at least 1, was " + resolverThreads);
    }
    this.resolverThreads = resolverThreads;
  }

  /**
   * @return Maven Central, the local Maven repository and the Jenkins public
   *         repository, or nothing if repository configuration is disabled
   */
  public List<String> getRepositoryUrls() {
    if (!configureRepositories) {
      return Collections.emptyList();
    }
    List<String> urls = new ArrayList<>();
    urls.add(MAVEN_CENTRAL_URL);
    urls.add(new File(System.getProperty("user.home"), ".m2/repository").toURI()
        .toString());
    urls.add(JENKINS_PUBLIC_URL);
    return urls;
  }

  /**
   * @return the repository the plugin is published to, chosen by whether the
   *         version is a snapshot, or null if publishing is disabled
   */
  public String getPublicationRepositoryUrl() {
    if (!configurePublishing) {
      return null;
    }
    if (version != null && version.endsWith("-SNAPSHOT")) {
      return snapshotRepoUrl;
    }
    return repoUrl;
  }

  private void checkNotFrozen(String key) throws ConfigurationException {
    if (frozen) {
      throw new ConfigurationException("Cannot change " + key
          + ": settings are frozen once resolution has started");
    }
  }
}
