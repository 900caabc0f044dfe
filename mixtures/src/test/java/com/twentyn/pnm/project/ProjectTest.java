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
import com.twentyn.pnm.phases.GenericPhase;
import com.twentyn.pnm.phases.NotInProjectException;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ProjectTest {

  private Project project;

  @Before
  public void setup() {
    project = new Project(new PoreNetwork(4, 3));
  }

  @Test
  public void testGeneratedNamesAreUnique() {
    GenericPhase first = new GenericPhase(project);
    GenericPhase second = new GenericPhase(project);
    assertEquals("phase_01", first.getName());
    assertEquals("phase_02", second.getName());
    assertEquals(Arrays.asList(first, second), project.getPhases());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateNamesAreRejected() {
    new GenericPhase(project, "water");
    new GenericPhase(project, "water");
  }

  @Test
  public void testContainsChecksIdentity() {
    GenericPhase water = new GenericPhase(project, "water");
    Project other = new Project(new PoreNetwork(4, 3));
    GenericPhase impostor = new GenericPhase(other, "water");

    assertTrue(project.contains(water));
    assertFalse(project.contains(impostor));
    assertFalse(project.contains(null));
  }

  @Test(expected = NotInProjectException.class)
  public void testResolveUnknownName() {
    project.resolve("air");
  }

  @Test
  public void testPurgedPhaseNoLongerResolves() {
    GenericPhase water = new GenericPhase(project, "water");
    project.purge(water);
    assertFalse(project.contains(water));
    try {
      project.resolve("water");
    } catch (NotInProjectException e) {
      assertEquals("water", e.getPhaseName());
      return;
    }
    throw new AssertionError("Expected purged phase not to resolve");
  }
}
