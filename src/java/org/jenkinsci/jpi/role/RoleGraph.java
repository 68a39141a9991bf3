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

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jenkinsci.jpi.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>The role graph holds every dependency role of a plugin build and the
 * "extends into" edges between them.</p>
 *
 * <p>An edge <code>role -&gt; target</code> means that the dependencies of
 * <code>role</code> are also dependencies of <code>target</code> whenever
 * <code>target</code> is resolved, the way <code>providedCompile</code> sees
 * everything declared on <code>jenkinsPlugins</code>. Edges must not form a
 * cycle; a cyclic declaration is rejected at once.</p>
 *
 * <p>The graph is built and mutated during the declaration phase only.
 * {@link #freeze()} ends that phase, after which every further declaration
 * fails with a {@link ConfigurationException}.</p>
 */
public class RoleGraph {

  private static final Logger LOG = LoggerFactory
      .getLogger(MethodHandles.lookup().lookupClass());

  private final Map<Role, RoleDeclaration> roles = new EnumMap<>(Role.class);

  private final Map<Role, Set<Role>> extendsInto = new EnumMap<>(Role.class);

  private final Map<Role, Set<Role>> inbound = new EnumMap<>(Role.class);

  private final List<FreezeListener> freezeListeners = new ArrayList<>();

  private volatile boolean frozen;

  /** Called once, right before the graph is frozen. */
  public interface FreezeListener {
    void beforeFreeze(RoleGraph graph) throws ConfigurationException;
  }

  /**
   * Creates the graph of a Jenkins plugin build: the Jenkins roles, the Java
   * and war scopes, and the edges between them.
   *
   * @return a graph in its declaration phase
   */
  public static RoleGraph createDefault() {
    RoleGraph graph = new RoleGraph();
    try {
      graph.defineRole(Role.JENKINS_CORE, Visibility.HIDDEN,
          "Jenkins core that your plugin is built against");
      graph.defineRole(Role.JENKINS_PLUGINS, Visibility.HIDDEN,
          "Jenkins plugins which your plugin is built against");
      graph.defineRole(Role.OPTIONAL_JENKINS_PLUGINS, Visibility.HIDDEN,
          "Optional Jenkins plugins dependencies which your plugin is built against");
      graph.defineRole(Role.JENKINS_SERVER, Visibility.HIDDEN,
          "Jenkins plugins which will be installed by the server task");
      graph.defineRole(Role.JENKINS_TEST, Visibility.HIDDEN,
          "Jenkins plugin test dependencies.")
          .exclude("org.jenkins-ci.modules", "ssh-cli-auth")
          .exclude("org.jenkins-ci.modules", "sshd");
      graph.defineRole(Role.JENKINS_WAR, Visibility.HIDDEN,
          "Jenkins war that corresponds to the Jenkins core");
      graph.defineRole(Role.PLUGIN_RESOURCES, Visibility.HIDDEN,
          "Jenkins plugins copied for the test harness");

      graph.defineRole(Role.IMPLEMENTATION, Visibility.EXPOSED,
          "Implementation only dependencies, bundled into the plugin");
      graph.defineRole(Role.RUNTIME_ONLY, Visibility.EXPOSED,
          "Runtime only dependencies, bundled into the plugin");
      graph.defineRole(Role.PROVIDED_COMPILE, Visibility.HIDDEN,
          "Compile dependencies supplied by Jenkins at run time");
      graph.defineRole(Role.PROVIDED_RUNTIME, Visibility.HIDDEN,
          "Runtime dependencies supplied by Jenkins at run time");
      graph.defineRole(Role.TEST_IMPLEMENTATION, Visibility.HIDDEN,
          "Test dependencies");
      graph.defineRole(Role.COMPILE_CLASSPATH, Visibility.HIDDEN,
          "Compile classpath of the plugin");
      graph.defineRole(Role.RUNTIME_CLASSPATH, Visibility.HIDDEN,
          "Runtime classpath of the plugin");
      graph.defineRole(Role.TEST_COMPILE_CLASSPATH, Visibility.HIDDEN,
          "Compile classpath of the plugin tests");

      graph.declareExtends(Role.IMPLEMENTATION, Role.COMPILE_CLASSPATH);
      graph.declareExtends(Role.PROVIDED_COMPILE, Role.COMPILE_CLASSPATH);
      graph.declareExtends(Role.IMPLEMENTATION, Role.RUNTIME_CLASSPATH);
      graph.declareExtends(Role.RUNTIME_ONLY, Role.RUNTIME_CLASSPATH);
      graph.declareExtends(Role.PROVIDED_COMPILE, Role.PROVIDED_RUNTIME);
      graph.declareExtends(Role.PROVIDED_RUNTIME, Role.RUNTIME_CLASSPATH);
      graph.declareExtends(Role.COMPILE_CLASSPATH, Role.TEST_COMPILE_CLASSPATH);
      graph.declareExtends(Role.TEST_IMPLEMENTATION, Role.TEST_COMPILE_CLASSPATH);

      graph.declareExtends(Role.JENKINS_CORE, Role.PROVIDED_COMPILE);
      graph.declareExtends(Role.JENKINS_PLUGINS, Role.PROVIDED_COMPILE);
      graph.declareExtends(Role.OPTIONAL_JENKINS_PLUGINS, Role.PROVIDED_COMPILE);
      graph.declareExtends(Role.JENKINS_TEST, Role.TEST_IMPLEMENTATION);
    } catch (ConfigurationException e) {
      // the default graph is fixed, failing here is a programming error
      throw new IllegalStateException(e);
    }
    return graph;
  }

  /**
   * Defines a role.
   *
   * @param role the role identifier
   * @param visibility whether consumers of the plugin see the role
   * @param description human readable purpose of the role
   * @return the declaration, used to add dependencies and exclusions
   * @throws ConfigurationException if the role is already defined or the graph
   *           is frozen
   */
  public synchronized RoleDeclaration defineRole(Role role, Visibility visibility,
      String description) throws ConfigurationException {
    checkNotFrozen("define role " + role);
    if (roles.containsKey(role)) {
      throw new ConfigurationException("Role " + role + " is already defined");
    }
    RoleDeclaration declaration = new RoleDeclaration(this, role, visibility,
        description);
    roles.put(role, declaration);
    extendsInto.put(role, new LinkedHashSet<>());
    inbound.put(role, new LinkedHashSet<>());
    return declaration;
  }

  /**
   * Looks up a role by name.
   *
   * @param name a role name such as <code>jenkinsPlugins</code>
   * @return the declaration
   * @throws ConfigurationException if no role of that name was defined
   */
  public RoleDeclaration getRole(String name) throws ConfigurationException {
    Role role = Role.forName(name);
    if (role == null) {
      throw new ConfigurationException("Role '" + name + "' not found");
    }
    return getRole(role);
  }

  /**
   * @throws ConfigurationException if the role was not defined in this graph
   */
  public synchronized RoleDeclaration getRole(Role role)
      throws ConfigurationException {
    RoleDeclaration declaration = roles.get(role);
    if (declaration == null) {
      throw new ConfigurationException("Role '" + role + "' not found");
    }
    return declaration;
  }

  public synchronized boolean isDefined(Role role) {
    return roles.containsKey(role);
  }

  /** @return every defined role, in declaration order of the enum */
  public synchronized List<RoleDeclaration> getRoles() {
    return new ArrayList<>(roles.values());
  }

  /**
   * Records that the dependencies of <code>role</code> are also seen through
   * <code>target</code>.
   *
   * @throws CircularDependencyException if the edge closes a cycle
   * @throws ConfigurationException if a role is undefined or the graph is
   *           frozen
   */
  public synchronized void declareExtends(Role role, Role target)
      throws ConfigurationException {
    checkNotFrozen("declare " + role + " extends into " + target + " in");
    getRole(role);
    getRole(target);
    if (role == target) {
      throw new CircularDependencyException("Circular extends detected: role "
          + role + " extends into itself");
    }
    List<Role> path = findPath(target, role);
    if (path != null) {
      StringBuilder sb = new StringBuilder();
      sb.append(role).append(" -> ").append(target);
      for (Role r : path) {
        sb.append(" -> ").append(r);
      }
      throw new CircularDependencyException("Circular extends detected: " + sb);
    }
    extendsInto.get(role).add(target);
    inbound.get(target).add(role);
    LOG.debug("Role {} extends into {}", role, target);
  }

  /**
   * @see #declareExtends(Role, Role)
   */
  public void declareExtends(String role, String target)
      throws ConfigurationException {
    declareExtends(getRole(role).getRole(), getRole(target).getRole());
  }

  /** @return the roles <code>role</code> directly extends into */
  public synchronized Set<Role> getExtendsInto(Role role) {
    Set<Role> targets = extendsInto.get(role);
    return targets == null ? Collections.emptySet()
        : Collections.unmodifiableSet(new LinkedHashSet<>(targets));
  }

  /**
   * Returns the roles whose dependencies take part when <code>role</code> is
   * resolved: the role itself followed by every role extending into it,
   * directly or not, depth first in edge declaration order.
   */
  public synchronized List<Role> getContributingRoles(Role role) {
    Set<Role> seen = new LinkedHashSet<>();
    collect(role, inbound, seen);
    return new ArrayList<>(seen);
  }

  /**
   * Returns the roles affected by a change of <code>role</code>: the role
   * itself and every role it extends into, directly or not.
   */
  public synchronized Set<Role> getDownstreamRoles(Role role) {
    Set<Role> seen = new LinkedHashSet<>();
    collect(role, extendsInto, seen);
    return seen;
  }

  /**
   * @return true if the dependencies of <code>from</code> flow into
   *         <code>to</code>, or both are the same role
   */
  public synchronized boolean flowsInto(Role from, Role to) {
    return from == to || findPath(from, to) != null;
  }

  /**
   * Registers a listener that may still declare dependencies when the
   * declaration phase ends, however {@link #freeze()} is reached.
   *
   * @throws ConfigurationException if the graph is already frozen
   */
  public synchronized void beforeFreeze(FreezeListener listener)
      throws ConfigurationException {
    checkNotFrozen("register a freeze listener on");
    freezeListeners.add(listener);
  }

  /**
   * Ends the declaration phase. Freeze listeners run first, in registration
   * order. Calling it again has no effect.
   *
   * @throws CircularDependencyException if the graph contains a cycle
   * @throws ConfigurationException if a freeze listener fails; the graph
   *           stays open then
   */
  public synchronized void freeze() throws ConfigurationException {
    if (frozen) {
      return;
    }
    for (FreezeListener listener : new ArrayList<>(freezeListeners)) {
      listener.beforeFreeze(this);
    }
    checkAcyclic();
    frozen = true;
    LOG.debug("Role declarations frozen");
  }

  public boolean isFrozen() {
    return frozen;
  }

  private void checkAcyclic() throws CircularDependencyException {
    Set<Role> done = new LinkedHashSet<>();
    for (Role role : roles.keySet()) {
      checkAcyclic(role, new LinkedHashMap<>(), done);
    }
  }

  private void checkAcyclic(Role role, Map<Role, Role> branch, Set<Role> done)
      throws CircularDependencyException {
    if (done.contains(role)) {
      return;
    }
    branch.put(role, role);
    for (Role target : extendsInto.get(role)) {
      if (branch.containsKey(target)) {
        throw new CircularDependencyException("Circular extends detected "
            + target + " for role " + role);
      }
      checkAcyclic(target, branch, done);
    }
    branch.remove(role);
    done.add(role);
  }

  // depth first search along extendsInto edges, returns the path after 'from'
  private List<Role> findPath(Role from, Role to) {
    for (Role next : extendsInto.get(from)) {
      if (next == to) {
        List<Role> path = new ArrayList<>();
        path.add(next);
        return path;
      }
      List<Role> rest = findPath(next, to);
      if (rest != null) {
        rest.add(0, next);
        return rest;
      }
    }
    return null;
  }

  private static void collect(Role role, Map<Role, Set<Role>> edges,
      Set<Role> seen) {
    if (!seen.add(role)) {
      return;
    }
    Set<Role> next = edges.get(role);
    if (next != null) {
      for (Role r : next) {
        collect(r, edges, seen);
      }
    }
  }

  private void checkNotFrozen(String action) throws ConfigurationException {
    if (frozen) {
      throw new ConfigurationException("Cannot " + action
          + " the role graph: it is frozen once resolution has started");
    }
  }
}
