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

import java.util.Objects;

import org.jenkinsci.jpi.artifact.DependencyCoordinate;

/**
 * A dependency added to a role by the scope rewriter rather than by the user.
 * It keeps a plugin's jar visible on a classpath without bundling it.
 */
public final class RewrittenDependency {

  private final DependencyCoordinate coordinate;
  private final Role source;
  private final Role target;
  private final String reason;

  public RewrittenDependency(DependencyCoordinate coordinate, Role source,
      Role target) {
    this.coordinate = Objects.requireNonNull(coordinate, "coordinate");
    this.source = Objects.requireNonNull(source, "source");
    this.target = Objects.requireNonNull(target, "target");
    this.reason = "added jar for compilation support (plugin "
        + coordinate.getModule() + ":" + coordinate.getVersion()
        + " present on " + source.getRoleName() + ")";
  }

  public DependencyCoordinate getCoordinate() {
    return coordinate;
  }

  /** @return the role the plugin was declared on */
  public Role getSource() {
    return source;
  }

  public Role getTarget() {
    return target;
  }

  /** @return why the dependency exists */
  public String getReason() {
    return reason;
  }

  @Override
  public String toString() {
    return coordinate + " on " + target + " (" + reason + ")";
  }
}
