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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jenkinsci.jpi.JpiException;
import org.jenkinsci.jpi.role.Role;

/**
 * A role could not be resolved. The message names every failed coordinate
 * and the role it was requested for.
 */
public class ResolutionException extends JpiException {

  private static final long serialVersionUID = 1L;

  private final Role role;
  private final transient List<ResolutionError> errors;

  public ResolutionException(Role role, List<ResolutionError> errors) {
    super(format(role, errors));
    this.role = role;
    this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
  }

  public ResolutionException(Role role, String message, Throwable cause) {
    super("Could not resolve role " + role + ": " + message, cause);
    this.role = role;
    this.errors = Collections.emptyList();
  }

  public Role getRole() {
    return role;
  }

  public List<ResolutionError> getErrors() {
    return errors;
  }

  private static String format(Role role, List<ResolutionError> errors) {
    StringBuilder sb = new StringBuilder("Could not resolve all dependencies"
        + " of role ").append(role).append(':');
    for (ResolutionError error : errors) {
      sb.append("\n  ").append(error);
    }
    return sb.toString();
  }
}
