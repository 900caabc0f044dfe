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

import com.twentyn.pnm.network.ElementType;

import java.util.SortedSet;

/**
 * Dict-like storage of per-element numeric arrays.
 * Each array stored under a key holds exactly one value per instance of the key's element kind.
 */
public interface PropertyStore {

  /**
   * Get the array stored under a key.
   * @throws KeyNotFoundException if nothing can be found for the key
   */
  double[] get(PropertyKey key);

  /**
   * Store an array under a key, replacing any existing value.
   */
  void set(PropertyKey key, double[] values);

  /**
   * Check whether an array is stored directly under a key.
   */
  boolean contains(PropertyKey key);

  /**
   * Remove the array stored under a key.
   * @return the removed array, or null if nothing was stored
   */
  double[] remove(PropertyKey key);

  /**
   * Get all keys stored directly, in key order.
   */
  SortedSet<PropertyKey> keys();

  /**
   * Get the number of instances of an element kind, i.e. the length of every array of that kind.
   */
  int count(ElementType element);
}
