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
 * The kinds of network entities that carry per-instance property arrays.
 * Every property key starts with the prefix of one of these kinds, for example "pore.density".
 */
public enum ElementType {
  PORE("pore"),
  THROAT("throat"),
  ;

  private String prefix;

  ElementType(String prefix) {
    this.prefix = prefix;
  }

  public String getPrefix() {
    return this.prefix;
  }

  /**
   * Look up an element kind from the leading segment of a property key.
   * @param prefix the key prefix, e.g. "pore"
   * @return the matching element kind
   * @throws IllegalArgumentException if no element kind uses that prefix
   */
  public static ElementType fromPrefix(String prefix) {
    for (ElementType element : values()) {
      if (element.prefix.equals(prefix)) {
        return element;
      }
    }
    throw new IllegalArgumentException(String.format("Unknown element kind '%s'", prefix));
  }

  @Override
  public String toString() {
    return this.prefix;
  }
}
