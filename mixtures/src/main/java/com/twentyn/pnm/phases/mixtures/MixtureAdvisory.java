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

import com.twentyn.pnm.phases.PropertyKey;

import java.util.Collections;
import java.util.List;

/**
 * A non-fatal finding raised while a mixture's composition is being set up.
 * Advisories are handed back to the caller instead of failing the operation.
 */
public class MixtureAdvisory {

  public enum Kind {
    // Some values of a mole fraction array lie outside [0, 1]
    MOLE_FRACTION_OUT_OF_RANGE,
    // A component was added that the mixture already contained
    DUPLICATE_COMPONENT,
  }

  private final Kind kind;
  private final String componentName;
  private final PropertyKey key;
  private final List<Integer> indices;
  private final String message;

  public MixtureAdvisory(Kind kind, String componentName, PropertyKey key, List<Integer> indices, String message) {
    this.kind = kind;
    this.componentName = componentName;
    this.key = key;
    this.indices = indices == null ? Collections.emptyList() : Collections.unmodifiableList(indices);
    this.message = message;
  }

  public static MixtureAdvisory moleFractionOutOfRange(String componentName, PropertyKey key, List<Integer> indices) {
    return new MixtureAdvisory(Kind.MOLE_FRACTION_OUT_OF_RANGE, componentName, key, indices,
        String.format("Received values for %s contain mole fractions outside the range of 0 -> 1 at %d %s(s)",
            key, indices.size(), key.getElement()));
  }

  public static MixtureAdvisory duplicateComponent(String componentName) {
    return new MixtureAdvisory(Kind.DUPLICATE_COMPONENT, componentName, null, null,
        String.format("%s is already a component of this mixture", componentName));
  }

  public Kind getKind() {
    return kind;
  }

  public String getComponentName() {
    return componentName;
  }

  /**
   * Get the key the finding is about, or null if it is not about a particular property
   */
  public PropertyKey getKey() {
    return key;
  }

  public List<Integer> getIndices() {
    return indices;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return String.format("%s: %s", kind, message);
  }
}
