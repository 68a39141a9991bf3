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

import org.jenkinsci.jpi.artifact.DependencyCoordinate;
import org.jenkinsci.jpi.role.Role;

/** A dependency of a role that could not be resolved. */
public final class ResolutionError {

  private final DependencyCoordinate coordinate;
  private final Role role;
  private final String message;

  public ResolutionError(DependencyCoordinate coordinate, Role role,
      String message) {
    this.coordinate = coordinate;
    this.role = role;
    this.message = message;
  }

  public DependencyCoordinate getCoordinate() {
    return coordinate;
  }

  public Role getRole() {
    return role;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return coordinate + " (role " + role + "): " + message;
  }
}
