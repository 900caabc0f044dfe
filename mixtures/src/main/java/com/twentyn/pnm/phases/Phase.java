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

package com.twentyn.pnm.phases;

import com.twentyn.pnm.project.Project;

import java.util.SortedSet;

/**
 * A named fluid phase attached to a project, exposing its properties through the property store protocol.
 */
public interface Phase extends PropertyStore {

  /**
   * Get the name of the phase, unique within its project
   */
  String getName();

  /**
   * Get the project the phase belongs to
   */
  Project getProject();

  /**
   * List the full keys of the properties held by this phase, e.g. "pore.viscosity"
   */
  SortedSet<String> props();

  default double[] get(String key) {
    return get(PropertyKey.parse(key));
  }

  default void set(String key, double[] values) {
    set(PropertyKey.parse(key), values);
  }

  default boolean contains(String key) {
    return contains(PropertyKey.parse(key));
  }
}
