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
import com.twentyn.pnm.phases.PhaseDataException;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when a mixture property is blended from its components while their mole fractions do not add up to one.
 */
public class CompositionNotNormalizedException extends PhaseDataException {
  private final ElementType element;
  private final List<Integer> indices;

  public CompositionNotNormalizedException(ElementType element, List<Integer> indices) {
    super(String.format("Mole fraction does not add to unity in all %ss (%d offending)", element, indices.size()));
    this.element = element;
    this.indices = Collections.unmodifiableList(indices);
  }

  public ElementType getElement() {
    return element;
  }

  /**
   * Get the indices of the element instances whose mole fractions do not add up to one
   */
  public List<Integer> getIndices() {
    return indices;
  }
}
