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

import com.twentyn.pnm.network.ElementType;

import java.util.Collections;
import java.util.List;

/**
 * Where a mixture's mole fractions fail to add up to one, per element instance.
 */
public class MixtureHealth {

  private final ElementType element;
  private final List<Integer> tooLow;
  private final List<Integer> tooHigh;
  private final List<Integer> undefined;

  public MixtureHealth(ElementType element, List<Integer> tooLow, List<Integer> tooHigh, List<Integer> undefined) {
    this.element = element;
    this.tooLow = Collections.unmodifiableList(tooLow);
    this.tooHigh = Collections.unmodifiableList(tooHigh);
    this.undefined = Collections.unmodifiableList(undefined);
  }

  public ElementType getElement() {
    return element;
  }

  /**
   * Get the indices of the instances whose mole fractions add up to less than one
   */
  public List<Integer> getTooLow() {
    return tooLow;
  }

  /**
   * Get the indices of the instances whose mole fractions add up to more than one
   */
  public List<Integer> getTooHigh() {
    return tooHigh;
  }

  /**
   * Get the indices of the instances where at least one component has no mole fraction
   */
  public List<Integer> getUndefined() {
    return undefined;
  }

  public boolean isHealthy() {
    return tooLow.isEmpty() && tooHigh.isEmpty() && undefined.isEmpty();
  }

  @Override
  public String toString() {
    return String.format("%s mole_fraction_too_low: %s, mole_fraction_too_high: %s, mole_fraction_undefined: %s",
        element, tooLow, tooHigh, undefined);
  }
}
