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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Accumulates the advisories a mixture raises over its lifetime, until a caller drains them.
 */
public class MixtureDiagnostics {

  private final List<MixtureAdvisory> advisories = new ArrayList<>();

  public void record(MixtureAdvisory advisory) {
    advisories.add(advisory);
  }

  public List<MixtureAdvisory> getAdvisories() {
    return Collections.unmodifiableList(new ArrayList<>(advisories));
  }

  public List<MixtureAdvisory> getAdvisories(MixtureAdvisory.Kind kind) {
    return advisories.stream().filter(a -> a.getKind() == kind).collect(Collectors.toList());
  }

  /**
   * Return every advisory recorded so far and forget them.
   */
  public List<MixtureAdvisory> drain() {
    List<MixtureAdvisory> drained = getAdvisories();
    advisories.clear();
    return drained;
  }

  public boolean isEmpty() {
    return advisories.isEmpty();
  }
}
