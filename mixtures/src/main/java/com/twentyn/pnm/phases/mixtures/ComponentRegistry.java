/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.pnm.phases.mixtures;

import com.twentyn.pnm.phases.NotInProjectException;
import com.twentyn.pnm.phases.Phase;
import com.twentyn.pnm.project.PhaseNamespace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Tracks the names of the pure phases that make up a mixture.
 * Only names are kept; the live phase objects are looked up in the namespace each time they are needed, so a
 * component that has been replaced or purged from the project is never handed out.
 */
public class ComponentRegistry {

  /**
   * Qualifier reserved for aggregates over all components, e.g. "pore.mole_fraction.all"
   */
  public static final String RESERVED_NAME = "all";

  private final PhaseNamespace namespace;
  private final Set<String> names = new LinkedHashSet<>();

  public ComponentRegistry(PhaseNamespace namespace) {
    this.namespace = namespace;
  }

  /**
   * Register a phase as a component.
   * @param phase the phase to register
   * @return true if the phase was not registered before
   * @throws NotInProjectException if the phase does not belong to the namespace
   * @throws IllegalArgumentException if the phase uses the reserved name
   */
  public boolean register(Phase phase) {
    if (!namespace.contains(phase)) {
      throw new NotInProjectException(phase.getName());
    }
    if (RESERVED_NAME.equals(phase.getName())) {
      throw new IllegalArgumentException(
          String.format("'%s' is reserved and cannot be used as a component name", RESERVED_NAME));
    }
    return names.add(phase.getName());
  }

  /**
   * @throws NotInMixtureException if no component of that name is registered
   */
  public void deregister(String name) {
    if (!names.remove(name)) {
      throw new NotInMixtureException(name);
    }
  }

  public boolean isRegistered(String name) {
    return names.contains(name);
  }

  public Set<String> getNames() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(names));
  }

  public int size() {
    return names.size();
  }

  public boolean isEmpty() {
    return names.isEmpty();
  }

  /**
   * Resolve a registered component by name.
   * @throws NotInMixtureException if the name is not registered
   * @throws NotInProjectException if the component has disappeared from the namespace
   */
  public Phase resolve(String name) {
    if (!isRegistered(name)) {
      throw new NotInMixtureException(name);
    }
    return namespace.resolve(name);
  }

  /**
   * Resolve every registered component, in registration order.
   */
  public Map<String, Phase> resolveAll() {
    Map<String, Phase> components = new LinkedHashMap<>();
    for (String name : names) {
      components.put(name, namespace.resolve(name));
    }
    return components;
  }

  /**
   * Check that a phase object belongs to the namespace and is registered here.
   * @return the name of the component
   */
  public String requireMember(Phase phase) {
    if (!namespace.contains(phase)) {
      throw new NotInProjectException(phase.getName());
    }
    if (!isRegistered(phase.getName())) {
      throw new NotInMixtureException(phase.getName());
    }
    return phase.getName();
  }

  /**
   * Check that a component name is registered and still resolves in the namespace.
   * @return the name of the component
   */
  public String requireMember(String name) {
    return resolve(name).getName();
  }
}
