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

package com.twentyn.pnm.project;

import com.twentyn.pnm.network.PoreNetwork;
import com.twentyn.pnm.phases.NotInProjectException;
import com.twentyn.pnm.phases.Phase;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds a pore network and every phase attached to it, keyed by the phase's unique name.
 */
public class Project implements PhaseNamespace {

  private static final Logger LOGGER = LogManager.getFormatterLogger(Project.class);

  private final PoreNetwork network;
  private final Map<String, Phase> phases = new LinkedHashMap<>();

  public Project(PoreNetwork network) {
    this.network = network;
  }

  public PoreNetwork getNetwork() {
    return network;
  }

  /**
   * Attach a phase to this project.
   * @param phase the phase to attach
   * @throws IllegalArgumentException if another phase already uses the same name
   */
  public void register(Phase phase) {
    Phase existing = phases.get(phase.getName());
    if (existing != null && existing != phase) {
      throw new IllegalArgumentException(
          String.format("A phase named '%s' already exists in this project", phase.getName()));
    }
    phases.put(phase.getName(), phase);
    LOGGER.debug("Registered phase %s", phase.getName());
  }

  /**
   * Detach a phase from this project. Objects still referring to it by name will no longer resolve it.
   */
  public void purge(Phase phase) {
    if (!contains(phase)) {
      throw new NotInProjectException(phase.getName());
    }
    phases.remove(phase.getName());
    LOGGER.debug("Purged phase %s", phase.getName());
  }

  /**
   * Generate a name that no phase of this project uses yet, e.g. "mix_01".
   */
  public String generateName(String prefix) {
    int i = 1;
    String name;
    do {
      name = String.format("%s_%02d", prefix, i++);
    } while (phases.containsKey(name));
    return name;
  }

  @Override
  public Phase resolve(String name) {
    Phase phase = phases.get(name);
    if (phase == null) {
      throw new NotInProjectException(name);
    }
    return phase;
  }

  @Override
  public boolean contains(Phase phase) {
    return phase != null && phases.get(phase.getName()) == phase;
  }

  public List<Phase> getPhases() {
    return Collections.unmodifiableList(new ArrayList<>(phases.values()));
  }
}
