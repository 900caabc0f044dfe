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
import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when mole fractions are derived from concentrations but some components have no concentration.
 */
public class InsufficientConcentrationDataException extends PhaseDataException {
  private final ElementType element;
  private final List<String> missingComponents;

  public InsufficientConcentrationDataException(ElementType element, List<String> missingComponents) {
    super(String.format("No %s concentration set for component(s): %s",
        element, StringUtils.join(missingComponents, ", ")));
    this.element = element;
    this.missingComponents = Collections.unmodifiableList(missingComponents);
  }

  public ElementType getElement() {
    return element;
  }

  public List<String> getMissingComponents() {
    return missingComponents;
  }
}
