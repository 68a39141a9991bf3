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

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.jenkinsci.jpi.artifact.DependencyCoordinate;
import org.jenkinsci.jpi.artifact.ResolvedArtifact;
import org.jenkinsci.jpi.config.ConfigurationException;
import org.jenkinsci.jpi.role.RewrittenDependency;
import org.jenkinsci.jpi.role.Role;
import org.jenkinsci.jpi.role.RoleGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestScopeRewriter {

  private static final String CREDENTIALS = "org.jenkins-ci.plugins:credentials:1.9.4";

  @TempDir
  File repo;

  private RoleGraph graph;
  private ScriptedResolver resolver;
  private ScopeResolver scopes;
  private ScopeRewriter rewriter;

  @BeforeEach
  public void setUp() {
    graph = RoleGraph.createDefault();
    resolver = new ScriptedResolver(repo)
        .module(CREDENTIALS, "hpi", "org.example:secrets:1.0")
        .module("org.example:secrets:1.0", "jar")
        .module("org.jenkins-ci.plugins:ant:1.2", "jpi")
        .module("junit:junit:4.12", "jar", "org.hamcrest:hamcrest-core:1.3")
        .module("org.hamcrest:hamcrest-core:1.3", "jar");
    scopes = new ScopeResolver(graph, resolver);
    rewriter = new ScopeRewriter(scopes, 2);
  }

  @Test
  public void testPluginJarOnCompileClasspathWithoutArchive() throws Exception {
    graph.getRole(Role.JENKINS_PLUGINS).addDependency(CREDENTIALS);
    rewriter.rewrite(Role.JENKINS_PLUGINS, Role.PROVIDED_COMPILE);

    ResolvedScopes resolved = rewriter.freezeAndResolve();

    List<String> classpath = names(resolved.getCompileClasspath());
    assertTrue(classpath.contains("credentials-1.9.4.jar"), classpath.toString());
    assertTrue(classpath.contains("secrets-1.0.jar"), classpath.toString());
    assertFalse(classpath.contains("credentials-1.9.4.hpi"), classpath.toString());

    List<RewrittenDependency> rewritten = graph.getRole(Role.PROVIDED_COMPILE)
        .getRewrittenDependencies();
    assertEquals(1, rewritten.size());
    DependencyCoordinate jar = rewritten.get(0).getCoordinate();
    assertEquals(CREDENTIALS + "@jar", jar.toString());
    assertFalse(jar.isTransitive());
    assertTrue(rewritten.get(0).getReason().contains("present on jenkinsPlugins"),
        rewritten.get(0).getReason());
  }

  @Test
  public void testReasonNamesPluginCoordinate() throws Exception {
    graph.getRole(Role.JENKINS_PLUGINS).addDependency(CREDENTIALS);
    rewriter.rewrite(Role.JENKINS_PLUGINS, Role.PROVIDED_COMPILE);
    rewriter.freezeAndResolve();

    String reason = graph.getRole(Role.PROVIDED_COMPILE)
        .getRewrittenDependencies().get(0).getReason();
    assertEquals("added jar for compilation support (plugin "
        + "org.jenkins-ci.plugins:credentials:1.9.4 present on jenkinsPlugins)",
        reason);
  }

  @Test
  public void testHostExtensionsNotBundled() throws Exception {
    graph.getRole(Role.JENKINS_PLUGINS).addDependency(CREDENTIALS);
    graph.getRole(Role.IMPLEMENTATION).addDependency("junit:junit:4.12");
    rewriter.rewrite(Role.JENKINS_PLUGINS, Role.PROVIDED_COMPILE);

    ResolvedScopes resolved = rewriter.freezeAndResolve();

    assertEquals(Arrays.asList("junit-4.12.jar", "hamcrest-core-1.3.jar"),
        names(resolved.getBundledArtifacts()));
    assertEquals(1, resolved.getPlugins(Role.JENKINS_PLUGINS).size());
    assertTrue(resolved.getRuntimeClasspath().stream()
        .noneMatch(a -> a.getType().equals("hpi")));
  }

  @Test
  public void testApplyIsIdempotent() throws Exception {
    graph.getRole(Role.JENKINS_PLUGINS).addDependency(CREDENTIALS);
    rewriter.rewrite(Role.JENKINS_PLUGINS, Role.PROVIDED_COMPILE);
    rewriter.freezeAndResolve();
    int calls = resolver.totalCalls();

    assertTrue(rewriter.apply(new RewriteRule(Role.JENKINS_PLUGINS,
        Role.PROVIDED_COMPILE)).isEmpty());
    rewriter.freezeAndResolve();
    assertEquals(1, graph.getRole(Role.PROVIDED_COMPILE).getRewrittenDependencies().size());
    assertEquals(calls, resolver.totalCalls());
  }

  @Test
  public void testFirstDeclaredRuleWins() throws Exception {
    graph.getRole(Role.JENKINS_PLUGINS).addDependency(CREDENTIALS);
    graph.getRole(Role.OPTIONAL_JENKINS_PLUGINS).addDependency(CREDENTIALS);
    rewriter.rewrite(Role.OPTIONAL_JENKINS_PLUGINS, Role.PROVIDED_COMPILE);
    rewriter.rewrite(Role.JENKINS_PLUGINS, Role.PROVIDED_COMPILE);

    rewriter.freezeAndResolve();

    List<RewrittenDependency> rewritten = graph.getRole(Role.PROVIDED_COMPILE)
        .getRewrittenDependencies();
    assertEquals(1, rewritten.size());
    assertEquals(Role.OPTIONAL_JENKINS_PLUGINS, rewritten.get(0).getSource());
  }

  @Test
  public void testDeclarationsAfterRegistrationAreSeen() throws Exception {
    rewriter.rewrite(Role.JENKINS_PLUGINS, Role.PROVIDED_COMPILE);
    rewriter.rewrite(Role.JENKINS_TEST, Role.TEST_IMPLEMENTATION);
    graph.getRole(Role.JENKINS_PLUGINS).addDependency(CREDENTIALS);
    graph.getRole(Role.JENKINS_TEST).addDependency("org.jenkins-ci.plugins:ant:1.2");

    ResolvedScopes resolved = rewriter.freezeAndResolve();

    List<String> testClasspath = names(resolved.getTestCompileClasspath());
    assertTrue(testClasspath.contains("ant-1.2.jar"), testClasspath.toString());
    assertTrue(testClasspath.contains("credentials-1.9.4.jar"), testClasspath.toString());
    assertFalse(names(resolved.getRuntimeClasspath()).contains("ant-1.2.jar"));
  }

  @Test
  public void testDeclarationsAfterFreezeFail() throws Exception {
    rewriter.rewrite(Role.JENKINS_PLUGINS, Role.PROVIDED_COMPILE);
    rewriter.freezeAndResolve();
    assertThrows(ConfigurationException.class,
        () -> graph.getRole(Role.JENKINS_PLUGINS).addDependency(CREDENTIALS));
    assertThrows(ConfigurationException.class,
        () -> rewriter.rewrite(Role.JENKINS_TEST, Role.TEST_IMPLEMENTATION));
  }

  @Test
  public void testResolutionErrorNamesCoordinateAndRole() throws Exception {
    graph.getRole(Role.JENKINS_PLUGINS).addDependency("org.example:missing:1.0");
    rewriter.rewrite(Role.JENKINS_PLUGINS, Role.PROVIDED_COMPILE);

    ResolutionException e = assertThrows(ResolutionException.class,
        () -> rewriter.freezeAndResolve());
    assertEquals(Role.JENKINS_PLUGINS, e.getRole());
    assertEquals(1, e.getErrors().size());
    assertTrue(e.getMessage().contains("org.example:missing:1.0"), e.getMessage());
    assertTrue(e.getMessage().contains("jenkinsPlugins"), e.getMessage());
  }

  @Test
  public void testUnrelatedRolesAreNotResolved() throws Exception {
    graph.getRole(Role.JENKINS_PLUGINS).addDependency(CREDENTIALS);
    graph.getRole(Role.RUNTIME_ONLY).addDependency("junit:junit:4.12");
    rewriter.rewrite(Role.JENKINS_PLUGINS, Role.PROVIDED_COMPILE);

    ResolvedScopes resolved = rewriter.freezeAndResolve();

    assertEquals(1, resolver.calls(Role.JENKINS_PLUGINS));
    assertEquals(0, resolver.calls(Role.RUNTIME_ONLY));
    assertEquals(0, resolver.calls(Role.PROVIDED_COMPILE));
    resolved.getCompileClasspath();
    resolved.getCompileClasspath();
    assertEquals(1, resolver.calls(Role.COMPILE_CLASSPATH));
  }

  @Test
  public void testRuleRegistration() throws Exception {
    rewriter.rewrite(Role.JENKINS_PLUGINS, Role.PROVIDED_COMPILE);
    rewriter.rewrite(Role.JENKINS_PLUGINS, Role.PROVIDED_COMPILE);
    assertEquals(1, rewriter.getRules().size());

    assertThrows(ConfigurationException.class,
        () -> rewriter.rewrite(Role.PROVIDED_COMPILE, Role.JENKINS_PLUGINS));
    assertThrows(ConfigurationException.class,
        () -> rewriter.rewrite(Role.JENKINS_PLUGINS, Role.JENKINS_PLUGINS));
  }

  @Test
  public void testDependentRulesRunInLaterWave() throws Exception {
    RewriteRule fromClasspath = new RewriteRule(Role.COMPILE_CLASSPATH,
        Role.TEST_IMPLEMENTATION);
    RewriteRule fromPlugins = new RewriteRule(Role.JENKINS_PLUGINS,
        Role.PROVIDED_COMPILE);
    rewriter.rewrite(Role.COMPILE_CLASSPATH, Role.TEST_IMPLEMENTATION);
    rewriter.rewrite(Role.JENKINS_PLUGINS, Role.PROVIDED_COMPILE);

    List<List<RewriteRule>> waves = rewriter.orderRules();
    assertEquals(2, waves.size());
    assertEquals(Arrays.asList(fromPlugins), waves.get(0));
    assertEquals(Arrays.asList(fromClasspath), waves.get(1));
  }

  @Test
  public void testIndependentRulesShareAWave() throws Exception {
    rewriter.rewrite(Role.JENKINS_PLUGINS, Role.PROVIDED_COMPILE);
    rewriter.rewrite(Role.OPTIONAL_JENKINS_PLUGINS, Role.PROVIDED_COMPILE);
    rewriter.rewrite(Role.JENKINS_TEST, Role.TEST_IMPLEMENTATION);

    List<List<RewriteRule>> waves = rewriter.orderRules();
    assertEquals(1, waves.size());
    assertEquals(rewriter.getRules(), waves.get(0));
  }

  @Test
  public void testResolveBeforeFreezeFails() {
    assertThrows(IllegalStateException.class,
        () -> scopes.resolve(Role.COMPILE_CLASSPATH));
  }

  private static List<String> names(List<ResolvedArtifact> artifacts) {
    List<String> names = new ArrayList<>();
    for (ResolvedArtifact a : artifacts) {
      names.add(a.getBundleName());
    }
    return names;
  }
}
