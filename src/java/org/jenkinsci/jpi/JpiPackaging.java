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
package org.jenkinsci.jpi;

import java.io.File;
import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.jenkinsci.jpi.archive.ArchiveTask;
import org.jenkinsci.jpi.archive.ArchiveWriterFactory;
import org.jenkinsci.jpi.archive.AssemblyException;
import org.jenkinsci.jpi.archive.LibraryJarAssembler;
import org.jenkinsci.jpi.archive.PackageAssembler;
import org.jenkinsci.jpi.archive.PackageDescriptor;
import org.jenkinsci.jpi.artifact.DependencyCoordinate;
import org.jenkinsci.jpi.artifact.ModuleIdentifier;
import org.jenkinsci.jpi.artifact.ResolvedArtifact;
import org.jenkinsci.jpi.config.ConfigurationException;
import org.jenkinsci.jpi.config.JpiSettings;
import org.jenkinsci.jpi.manifest.ManifestAssembler;
import org.jenkinsci.jpi.manifest.ManifestAttributes;
import org.jenkinsci.jpi.manifest.ProjectMetadata;
import org.jenkinsci.jpi.resolve.DependencyResolver;
import org.jenkinsci.jpi.resolve.ResolutionException;
import org.jenkinsci.jpi.resolve.ResolvedScopes;
import org.jenkinsci.jpi.resolve.ScopeResolver;
import org.jenkinsci.jpi.resolve.ScopeRewriter;
import org.jenkinsci.jpi.role.Role;
import org.jenkinsci.jpi.role.RoleDeclaration;
import org.jenkinsci.jpi.role.RoleGraph;
import org.jenkinsci.jpi.testdeps.TestDependenciesWriter;
import org.jenkinsci.jpi.testdeps.TestHplWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Packages one Jenkins plugin.</p>
 *
 * <p>Creating an instance registers the fixed plugin rewrites:
 * <code>jenkinsPlugins</code> and <code>optionalJenkinsPlugins</code> into
 * <code>providedCompile</code>, <code>jenkinsTest</code> into
 * <code>testImplementation</code>. Until {@link #freezeAndResolve()} is
 * called, dependencies may still be declared on the roles of the settings.
 * Whichever way the roles get frozen, the plugins declared by then are copied
 * into <code>pluginResources</code>.
 * {@link #packageInto(File, File, File)} then writes the library jar and the
 * plugin archive.</p>
 */
public class JpiPackaging {

  private static final Logger LOG = LoggerFactory
      .getLogger(MethodHandles.lookup().lookupClass());

  private static final Role[] PLUGIN_ROLES = { Role.JENKINS_PLUGINS,
      Role.OPTIONAL_JENKINS_PLUGINS, Role.JENKINS_SERVER, Role.JENKINS_TEST };

  private final JpiSettings settings;
  private final ScopeRewriter rewriter;
  private final ArchiveWriterFactory writers;
  private final ManifestAssembler manifests = new ManifestAssembler();
  private final ArchiveTask jarTask = new ArchiveTask("jar");
  private final ArchiveTask archiveTask = new ArchiveTask("jpi");
  private ResolvedScopes resolved;

  public JpiPackaging(JpiSettings settings, DependencyResolver resolver,
      ArchiveWriterFactory writers) throws ConfigurationException {
    this.settings = settings;
    this.writers = writers;
    ScopeResolver scopes = new ScopeResolver(settings.getRoles(), resolver);
    this.rewriter = new ScopeRewriter(scopes, settings.getResolverThreads());
    rewriter.rewrite(Role.JENKINS_PLUGINS, Role.PROVIDED_COMPILE);
    rewriter.rewrite(Role.OPTIONAL_JENKINS_PLUGINS, Role.PROVIDED_COMPILE);
    rewriter.rewrite(Role.JENKINS_TEST, Role.TEST_IMPLEMENTATION);
    settings.getRoles().beforeFreeze(graph -> collectPluginResources());
  }

  public JpiSettings getSettings() {
    return settings;
  }

  public RoleGraph getRoles() {
    return settings.getRoles();
  }

  public ScopeRewriter getRewriter() {
    return rewriter;
  }

  /** @return the library jar, as far as its manifest and inputs go */
  public ArchiveTask getJarTask() {
    return jarTask;
  }

  /** @return the plugin archive, as far as its manifest and inputs go */
  public ArchiveTask getArchiveTask() {
    return archiveTask;
  }

  /**
   * Ends the declaration phase and resolves the plugin rewrites. Only the
   * first call does any work.
   *
   * @throws ConfigurationException if the role graph is invalid
   * @throws ResolutionException if a plugin role cannot be resolved
   */
  public synchronized ResolvedScopes freezeAndResolve()
      throws ConfigurationException, ResolutionException {
    if (resolved == null) {
      long start = System.currentTimeMillis();
      if (!settings.isFrozen()) {
        settings.freeze();
      }
      resolved = rewriter.freezeAndResolve();
      LOG.info("Resolved plugin roles of {} in {} ms", settings.getShortName(),
          System.currentTimeMillis() - start);
    }
    return resolved;
  }

  /**
   * Writes <code>&lt;shortName&gt;.jar</code> from the compiled classes and
   * <code>&lt;shortName&gt;.hpi</code> (or <code>.jpi</code>) around it.
   *
   * @param classesDir compiled classes and resources of the plugin
   * @param licenseDir license report, may be null
   * @param outputDir directory receiving both archives
   * @return the plugin archive
   * @throws ConfigurationException if required metadata is missing; nothing
   *           has been written then
   * @throws ResolutionException if a role cannot be resolved
   * @throws AssemblyException if an archive cannot be written
   */
  public File packageInto(File classesDir, File licenseDir, File outputDir)
      throws JpiException {
    ResolvedScopes scopes = freezeAndResolve();
    ManifestAttributes attributes = assembleManifest(scopes);
    PackageDescriptor descriptor = PackageDescriptor.of(settings,
        scopes.getProvidedModules());
    List<ResolvedArtifact> bundled = scopes.getBundledArtifacts();

    manifests.apply(attributes, jarTask, archiveTask);
    File jar = new LibraryJarAssembler(writers).assemble(classesDir,
        jarTask.getManifest(), new File(outputDir, descriptor.getLibraryJarName()));
    return new PackageAssembler(writers).assemble(descriptor, jar,
        archiveTask.getManifest(), bundled, licenseDir, outputDir);
  }

  /**
   * Copies the plugins of <code>pluginResources</code> for the test harness.
   *
   * @return the plugin names written to the index
   */
  public List<String> writeTestDependencies(File outputDir) throws JpiException {
    ResolvedScopes scopes = freezeAndResolve();
    return new TestDependenciesWriter().write(
        scopes.getArtifacts(Role.PLUGIN_RESOURCES), outputDir);
  }

  /**
   * Writes <code>the.hpl</code>, the manifest the test harness loads the
   * plugin under test from.
   *
   * @param classesDir compiled classes and resources of the plugin
   * @param resourceDir web resources of the plugin, may be null
   * @param outputDir directory receiving the file
   * @return the written file
   */
  public File writeTestHpl(File classesDir, File resourceDir, File outputDir)
      throws JpiException {
    ResolvedScopes scopes = freezeAndResolve();
    ManifestAttributes attributes = assembleManifest(scopes);
    List<File> libraries = new ArrayList<>();
    libraries.add(classesDir);
    for (ResolvedArtifact artifact : scopes.getBundledArtifacts()) {
      libraries.add(artifact.getFile());
    }
    return new TestHplWriter().write(attributes, resourceDir, libraries,
        outputDir);
  }

  private ManifestAttributes assembleManifest(ResolvedScopes scopes)
      throws JpiException {
    ProjectMetadata metadata = ProjectMetadata.from(settings,
        directPlugins(scopes, Role.JENKINS_PLUGINS),
        directPlugins(scopes, Role.OPTIONAL_JENKINS_PLUGINS));
    return manifests.assemble(metadata);
  }

  // every plugin declared anywhere is made available to the test harness
  private void collectPluginResources() throws ConfigurationException {
    RoleGraph roles = settings.getRoles();
    RoleDeclaration resources = roles.getRole(Role.PLUGIN_RESOURCES);
    for (Role role : PLUGIN_ROLES) {
      for (DependencyCoordinate dependency : roles.getRole(role)
          .getDeclaredDependencies()) {
        resources.addDependency(dependency.withoutType());
      }
    }
  }

  private List<ResolvedArtifact> directPlugins(ResolvedScopes scopes, Role role)
      throws JpiException {
    Set<ModuleIdentifier> declared = new HashSet<>();
    for (DependencyCoordinate dependency : settings.getRoles().getRole(role)
        .getDeclaredDependencies()) {
      declared.add(dependency.getModule());
    }
    List<ResolvedArtifact> plugins = new ArrayList<>();
    for (ResolvedArtifact plugin : scopes.getPlugins(role)) {
      if (declared.contains(plugin.getModule())) {
        plugins.add(plugin);
      }
    }
    return plugins;
  }
}
