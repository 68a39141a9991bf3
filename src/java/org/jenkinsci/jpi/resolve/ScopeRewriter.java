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

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.jenkinsci.jpi.artifact.ArtifactClassifier;
import org.jenkinsci.jpi.artifact.DependencyCoordinate;
import org.jenkinsci.jpi.artifact.ResolvedArtifact;
import org.jenkinsci.jpi.config.ConfigurationException;
import org.jenkinsci.jpi.role.Role;
import org.jenkinsci.jpi.role.RoleDeclaration;
import org.jenkinsci.jpi.role.RoleGraph;
import org.jenkinsci.jpi.role.RewrittenDependency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Rewrites plugin dependencies into classpath-only jars.</p>
 *
 * <p>A plugin declared on, say, <code>jenkinsPlugins</code> resolves to its
 * <code>hpi</code> archive, which is not usable on a classpath, and Jenkins
 * supplies the plugin at run time anyway. For each rule
 * <code>source -&gt; target</code> the source role is resolved, every plugin
 * archive found is turned into a non-transitive
 * <code>group:name:version@jar</code> dependency and added to the target role.
 * The target is chosen so the jar ends up on a classpath but never in the
 * bundle.</p>
 *
 * <p>Work happens in two explicit phases. {@link #rewrite(Role, Role)}
 * registers rules while roles are still being declared;
 * {@link #freezeAndResolve()} freezes the graph and runs every rule once, in
 * dependency order. Rules of the same wave resolve their sources in parallel,
 * their results are then written by a single thread in rule declaration
 * order, so when two rules contribute the same module to one target the
 * earlier declared rule wins.</p>
 */
public class ScopeRewriter {

  private static final Logger LOG = LoggerFactory
      .getLogger(MethodHandles.lookup().lookupClass());

  private final RoleGraph graph;
  private final ScopeResolver scopes;
  private final int threads;
  private final List<RewriteRule> rules = new ArrayList<>();
  private boolean resolved;

  public ScopeRewriter(ScopeResolver scopes, int threads) {
    this.graph = scopes.getGraph();
    this.scopes = scopes;
    this.threads = Math.max(1, threads);
  }

  /**
   * Registers a rewrite of the plugins resolved from <code>source</code> into
   * <code>target</code>. Registering the same rule twice has no effect.
   *
   * @throws ConfigurationException if a role is undefined, the graph is
   *           frozen, or <code>target</code> feeds back into
   *           <code>source</code>
   */
  public synchronized void rewrite(Role source, Role target)
      throws ConfigurationException {
    if (graph.isFrozen()) {
      throw new ConfigurationException("Cannot register rewrite " + source
          + " -> " + target + ": role declarations are frozen");
    }
    graph.getRole(source);
    graph.getRole(target);
    if (graph.flowsInto(target, source)) {
      throw new ConfigurationException("Cannot rewrite " + source + " into "
          + target + ": " + target + " extends into " + source);
    }
    RewriteRule rule = new RewriteRule(source, target);
    if (!rules.contains(rule)) {
      rules.add(rule);
    }
  }

  public synchronized List<RewriteRule> getRules() {
    return Collections.unmodifiableList(new ArrayList<>(rules));
  }

  /**
   * Freezes the role graph and runs every registered rule. Only the first
   * call does any work.
   *
   * @return the resolved scopes of the frozen graph
   * @throws ConfigurationException if the graph or the rules contain a cycle
   * @throws ResolutionException if a source role cannot be resolved
   */
  public synchronized ResolvedScopes freezeAndResolve()
      throws ConfigurationException, ResolutionException {
    if (!resolved) {
      graph.freeze();
      List<List<RewriteRule>> waves = orderRules();
      ExecutorService executor = Executors.newFixedThreadPool(threads);
      try {
        for (List<RewriteRule> wave : waves) {
          runWave(wave, executor);
        }
      } finally {
        executor.shutdownNow();
      }
      resolved = true;
    }
    return new ResolvedScopes(scopes);
  }

  /**
   * Resolves the source of a rule and adds its plugins to the target. Running
   * the same rule again adds nothing new.
   *
   * @return the dependencies added by this call
   * @throws ResolutionException if the source role cannot be resolved
   * @throws IllegalStateException if the graph is not frozen
   */
  public List<RewrittenDependency> apply(RewriteRule rule)
      throws ResolutionException {
    return apply(rule, scopes.resolve(rule.getSource()));
  }

  private void runWave(List<RewriteRule> wave, ExecutorService executor)
      throws ResolutionException {
    List<Future<List<ResolvedArtifact>>> futures = new ArrayList<>();
    for (RewriteRule rule : wave) {
      futures.add(executor.submit(() -> scopes.resolve(rule.getSource())));
    }
    for (int i = 0; i < wave.size(); i++) {
      RewriteRule rule = wave.get(i);
      apply(rule, await(futures.get(i), rule));
    }
  }

  private List<RewrittenDependency> apply(RewriteRule rule,
      List<ResolvedArtifact> artifacts) {
    RoleDeclaration target = declaration(rule.getTarget());
    List<RewrittenDependency> added = new ArrayList<>();
    for (ResolvedArtifact artifact : artifacts) {
      if (!ArtifactClassifier.isHostExtension(artifact)) {
        continue;
      }
      DependencyCoordinate jar = new DependencyCoordinate(
          artifact.getModule().getGroup(), artifact.getModule().getName(),
          artifact.getVersion(), "jar", false);
      RewrittenDependency dependency = new RewrittenDependency(jar,
          rule.getSource(), rule.getTarget());
      if (target.addRewritten(dependency)) {
        LOG.debug("Added {}", dependency);
        added.add(dependency);
      }
    }
    if (!added.isEmpty()) {
      scopes.invalidate(rule.getTarget());
    }
    LOG.info("Rewrite {}: {} plugin jar(s) added", rule, added.size());
    return added;
  }

  private static List<ResolvedArtifact> await(
      Future<List<ResolvedArtifact>> future, RewriteRule rule)
      throws ResolutionException {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ResolutionException(rule.getSource(), "interrupted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof ResolutionException) {
        throw (ResolutionException) cause;
      }
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new ResolutionException(rule.getSource(), cause.toString(), cause);
    }
  }

  /*
   * Splits the rules into waves. A rule has to wait for every rule whose
   * target flows into its source; rules inside a wave keep declaration order.
   */
  List<List<RewriteRule>> orderRules() throws ConfigurationException {
    List<RewriteRule> pending = new ArrayList<>(rules);
    List<List<RewriteRule>> waves = new ArrayList<>();
    while (!pending.isEmpty()) {
      List<RewriteRule> wave = new ArrayList<>();
      for (RewriteRule rule : pending) {
        boolean ready = true;
        for (RewriteRule other : pending) {
          if (other != rule && graph.flowsInto(other.getTarget(), rule.getSource())) {
            ready = false;
            break;
          }
        }
        if (ready) {
          wave.add(rule);
        }
      }
      if (wave.isEmpty()) {
        throw new ConfigurationException("Circular rewrite rules: " + pending);
      }
      pending.removeAll(wave);
      waves.add(wave);
    }
    return waves;
  }

  private RoleDeclaration declaration(Role role) {
    try {
      return graph.getRole(role);
    } catch (ConfigurationException e) {
      // rules only reference roles checked in rewrite()
      throw new IllegalStateException(e);
    }
  }
}
