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

package com.twentyn.pnm.network;

/**
 * Sizing information for a pore network: how many pores and throats it has.
 * Phases attached to the network hold one value per pore or throat for each of their properties.
 */
public class PoreNetwork {

  private final Integer poreCount;
  private final Integer throatCount;

  public PoreNetwork(Integer poreCount, Integer throatCount) {
    if (poreCount == null || poreCount < 0 || throatCount == null || throatCount < 0) {
      throw new IllegalArgumentException(
          String.format("Pore and throat counts must be non-negative, got %s and %s", poreCount, throatCount));
    }
    this.poreCount = poreCount;
    this.throatCount = throatCount;
  }

  public Integer getPoreCount() {
    return poreCount;
  }

  public Integer getThroatCount() {
    return throatCount;
  }

  public int count(ElementType element) {
    switch (element) {
      case PORE:
        return poreCount;
      case THROAT:
        return throatCount;
      default:
        throw new IllegalArgumentException(String.format("Unsupported element kind %s", element));
    }
  }
}
