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
package org.jenkinsci.jpi.role;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.jenkinsci.jpi.artifact.DependencyCoordinate;
import org.jenkinsci.jpi.artifact.ModuleIdentifier;
import org.jenkinsci.jpi.config.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TestRoleGraph {

  private RoleGraph graph;

  @BeforeEach
  public void setUp() {
    graph = RoleGraph.createDefault();
  }

  @Test
  public void testDefaultRolesAreDefined() throws Exception {
    for (Role role : Role.values()) {
      assertTrue(graph.isDefined(role), role + " should be defined");
    }
    assertEquals(Role.values().length, graph.getRoles().size());
    assertEquals(Visibility.HIDDEN, graph.getRole("jenkinsPlugins").getVisibility());
    assertTrue(graph.getRole(Role.IMPLEMENTATION).isVisible());
  }

  @Test
  public void testUndeclaredRoleLookupFails() {
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> graph.getRole("jenkinsPlugin"));
    assertEquals("Role 'jenkinsPlugin' not found", e.getMessage());
  }

  @Test
  public void testPluginRolesFlowIntoProvidedCompile() {
    assertEquals(set(Role.PROVIDED_COMPILE), graph.getExtendsInto(Role.JENKINS_PLUGINS));
    assertEquals(set(Role.PROVIDED_COMPILE),
        graph.getExtendsInto(Role.OPTIONAL_JENKINS_PLUGINS));
    assertEquals(set(Role.PROVIDED_COMPILE), graph.getExtendsInto(Role.JENKINS_CORE));
    assertEquals(set(Role.TEST_IMPLEMENTATION), graph.getExtendsInto(Role.JENKINS_TEST));

    assertTrue(graph.flowsInto(Role.JENKINS_PLUGINS, Role.COMPILE_CLASSPATH));
    assertTrue(graph.flowsInto(Role.JENKINS_PLUGINS, Role.RUNTIME_CLASSPATH));
    assertTrue(graph.flowsInto(Role.JENKINS_TEST, Role.TEST_COMPILE_CLASSPATH));
    assertFalse(graph.flowsInto(Role.JENKINS_TEST, Role.RUNTIME_CLASSPATH));
    assertFalse(graph.flowsInto(Role.JENKINS_SERVER, Role.COMPILE_CLASSPATH));
    assertFalse(graph.flowsInto(Role.PROVIDED_COMPILE, Role.JENKINS_PLUGINS));
  }

  @Test
  public void testContributingRoles() {
    List<Role> roles = graph.getContributingRoles(Role.PROVIDED_COMPILE);
    assertEquals(Role.PROVIDED_COMPILE, roles.get(0));
    assertTrue(roles.containsAll(Arrays.asList(Role.JENKINS_CORE,
        Role.JENKINS_PLUGINS, Role.OPTIONAL_JENKINS_PLUGINS)));
    assertFalse(roles.contains(Role.IMPLEMENTATION));

    List<Role> testRoles = graph.getContributingRoles(Role.TEST_COMPILE_CLASSPATH);
    assertTrue(testRoles.contains(Role.JENKINS_TEST));
    assertTrue(testRoles.contains(Role.JENKINS_PLUGINS));
    assertTrue(testRoles.contains(Role.IMPLEMENTATION));
  }

  @Test
  public void testDownstreamRoles() {
    Set<Role> downstream = graph.getDownstreamRoles(Role.PROVIDED_COMPILE);
    assertTrue(downstream.contains(Role.PROVIDED_COMPILE));
    assertTrue(downstream.contains(Role.COMPILE_CLASSPATH));
    assertTrue(downstream.contains(Role.TEST_COMPILE_CLASSPATH));
    assertTrue(downstream.contains(Role.RUNTIME_CLASSPATH));
    assertFalse(downstream.contains(Role.JENKINS_PLUGINS));
  }

  @Test
  public void testCycleRejectedAtDeclaration() throws Exception {
    RoleGraph g = new RoleGraph();
    g.defineRole(Role.JENKINS_CORE, Visibility.HIDDEN, "a");
    g.defineRole(Role.JENKINS_PLUGINS, Visibility.HIDDEN, "b");
    g.declareExtends(Role.JENKINS_CORE, Role.JENKINS_PLUGINS);

    CircularDependencyException e = assertThrows(CircularDependencyException.class,
        () -> g.declareExtends(Role.JENKINS_PLUGINS, Role.JENKINS_CORE));
    assertEquals("Circular extends detected: jenkinsPlugins -> jenkinsCore"
        + " -> jenkinsPlugins", e.getMessage());
    // the rejected edge was not recorded
    assertTrue(g.getExtendsInto(Role.JENKINS_PLUGINS).isEmpty());
    g.freeze();
  }

  @Test
  public void testLongerCycleRejected() {
    CircularDependencyException e = assertThrows(CircularDependencyException.class,
        () -> graph.declareExtends("testCompileClasspath", "jenkinsCore"));
    assertTrue(e.getMessage().startsWith(
        "Circular extends detected: testCompileClasspath -> jenkinsCore"),
        e.getMessage());
  }

  @Test
  public void testSelfExtendRejected() {
    assertThrows(CircularDependencyException.class,
        () -> graph.declareExtends(Role.IMPLEMENTATION, Role.IMPLEMENTATION));
  }

  @Test
  public void testExtendsOnUndefinedRoleFails() throws Exception {
    RoleGraph g = new RoleGraph();
    g.defineRole(Role.JENKINS_CORE, Visibility.HIDDEN, "a");
    assertThrows(ConfigurationException.class,
        () -> g.declareExtends(Role.JENKINS_CORE, Role.JENKINS_WAR));
    assertThrows(ConfigurationException.class,
        () -> g.defineRole(Role.JENKINS_CORE, Visibility.HIDDEN, "again"));
  }

  @Test
  public void testFrozenGraphRejectsDeclarations() throws Exception {
    graph.freeze();
    graph.freeze();
    assertTrue(graph.isFrozen());
    assertThrows(ConfigurationException.class,
        () -> graph.declareExtends(Role.JENKINS_SERVER, Role.TEST_IMPLEMENTATION));
    assertThrows(ConfigurationException.class,
        () -> graph.getRole(Role.JENKINS_PLUGINS).addDependency("org.example:a:1.0"));
    assertThrows(ConfigurationException.class,
        () -> graph.getRole(Role.JENKINS_TEST).exclude("org.example", null));
  }

  @Test
  public void testJenkinsTestExcludesSshModules() throws Exception {
    Set<Exclusion> exclusions = graph.getRole(Role.JENKINS_TEST).getExclusions();
    assertEquals(2, exclusions.size());
    assertTrue(exclusions.contains(new Exclusion("org.jenkins-ci.modules", "ssh-cli-auth")));
    assertTrue(exclusions.contains(new Exclusion("org.jenkins-ci.modules", "sshd")));
  }

  @Test
  public void testDependencyDeclaration() throws Exception {
    RoleDeclaration plugins = graph.getRole(Role.JENKINS_PLUGINS);
    plugins.addDependency("org.jenkins-ci.plugins:credentials:1.9.4")
        .addDependency("org.jenkins-ci.plugins:credentials:1.9.4");
    assertEquals(1, plugins.getDeclaredDependencies().size());

    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> plugins.addDependency("credentials"));
    assertTrue(e.getMessage().contains("jenkinsPlugins"), e.getMessage());
  }

  @Test
  public void testRewrittenDependenciesOnlyAfterFreeze() throws Exception {
    RoleDeclaration provided = graph.getRole(Role.PROVIDED_COMPILE);
    DependencyCoordinate jar = DependencyCoordinate
        .parse("org.jenkins-ci.plugins:credentials:1.9.4@jar");
    RewrittenDependency rewritten = new RewrittenDependency(jar,
        Role.JENKINS_PLUGINS, Role.PROVIDED_COMPILE);
    assertThrows(IllegalStateException.class, () -> provided.addRewritten(rewritten));

    graph.freeze();
    assertTrue(provided.addRewritten(rewritten));
    assertFalse(provided.addRewritten(new RewrittenDependency(jar,
        Role.OPTIONAL_JENKINS_PLUGINS, Role.PROVIDED_COMPILE)));
    assertEquals(1, provided.getRewrittenDependencies().size());
    assertEquals(Role.JENKINS_PLUGINS, provided.getRewrittenDependencies().get(0).getSource());
    assertEquals(Arrays.asList(jar), provided.getDependencies());
    assertThrows(IllegalStateException.class,
        () -> graph.getRole(Role.COMPILE_CLASSPATH).addRewritten(rewritten));
  }

  @Test
  public void testExclusionMatching() {
    ModuleIdentifier sshd = new ModuleIdentifier("org.jenkins-ci.modules", "sshd");
    assertTrue(new Exclusion("org.jenkins-ci.modules", null).matches(sshd));
    assertTrue(new Exclusion(null, "sshd").matches(sshd));
    assertFalse(new Exclusion("org.jenkins-ci.modules", "ssh-cli-auth").matches(sshd));
    assertThrows(IllegalArgumentException.class, () -> new Exclusion(null, null));
  }

  private static Set<Role> set(Role... roles) {
    return new LinkedHashSet<>(Arrays.asList(roles));
  }

  @Test
  public void testFreezeListenerRunsOnceBeforeFreeze() throws Exception {
    int[] calls = new int[1];
    graph.beforeFreeze(g -> {
      calls[0]++;
      assertFalse(g.isFrozen());
      g.getRole(Role.PLUGIN_RESOURCES)
          .addDependency("org.jenkins-ci.plugins:credentials:1.9.4");
    });

    graph.freeze();
    graph.freeze();

    assertEquals(1, calls[0]);
    assertTrue(graph.isFrozen());
    assertEquals(1, graph.getRole(Role.PLUGIN_RESOURCES)
        .getDeclaredDependencies().size());
    assertThrows(ConfigurationException.class, () -> graph.beforeFreeze(g -> { }));
  }

  @Test
  public void testFailingFreezeListenerLeavesGraphOpen() throws Exception {
    graph.beforeFreeze(g -> {
      throw new ConfigurationException("not ready");
    });
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> graph.freeze());
    assertEquals("not ready", e.getMessage());
    assertFalse(graph.isFrozen());
  }
}
