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

import java.util.Objects;

import org.jenkinsci.jpi.role.Role;

/**
 * Plugins resolved from <code>source</code> are added to <code>target</code>
 * as classpath-only jars.
 */
public final class RewriteRule {

  private final Role source;
  private final Role target;

  public RewriteRule(Role source, Role target) {
    this.source = Objects.requireNonNull(source, "source");
    this.target = Objects.requireNonNull(target, "target");
  }

  public Role getSource() {
    return source;
  }

  public Role getTarget() {
    return target;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof RewriteRule)) {
      return false;
    }
    RewriteRule other = (RewriteRule) o;
    return source == other.source && target == other.target;
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, target);
  }

  @Override
  public String toString() {
    return source + " -> " + target;
  }
}
