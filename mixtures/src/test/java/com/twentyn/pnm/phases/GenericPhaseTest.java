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
import com.twentyn.pnm.network.PoreNetwork;
import com.twentyn.pnm.project.Project;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.TreeSet;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class GenericPhaseTest {

  private static final double DELTA = 1e-12;

  private Project project;
  private GenericPhase water;

  @Before
  public void setup() {
    project = new Project(new PoreNetwork(3, 2));
    water = new GenericPhase(project, "water");
  }

  @Test
  public void testPhaseRegistersWithItsProject() {
    assertSame(water, project.resolve("water"));
    assertSame(project, water.getProject());
    assertEquals(3, water.count(ElementType.PORE));
    assertEquals(2, water.count(ElementType.THROAT));
  }

  @Test
  public void testGeneratedNameUsesPrefix() {
    GenericPhase unnamed = new GenericPhase(project);
    assertEquals("phase_01", unnamed.getName());
  }

  @Test
  public void testSetThenGet() {
    water.set("pore.density", new double[]{998.0, 997.0, 996.0});
    assertArrayEquals(new double[]{998.0, 997.0, 996.0}, water.get("pore.density"), DELTA);
    assertTrue(water.contains("pore.density"));
    assertFalse(water.contains("throat.density"));
  }

  @Test
  public void testStoredArraysCannotBeModifiedThroughReferences() {
    double[] values = new double[]{1.0, 2.0, 3.0};
    water.set("pore.temperature", values);
    values[0] = 100.0;
    double[] read = water.get("pore.temperature");
    read[1] = 200.0;
    assertArrayEquals(new double[]{1.0, 2.0, 3.0}, water.get("pore.temperature"), DELTA);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWrongLengthIsRejected() {
    water.set("throat.density", new double[]{1.0, 2.0, 3.0});
  }

  @Test(expected = KeyNotFoundException.class)
  public void testMissingKeyIsNotFound() {
    water.get("pore.viscosity");
  }

  @Test
  public void testPropsAndRemove() {
    water.set("pore.density", new double[]{1.0, 1.0, 1.0});
    water.set("throat.density", new double[]{1.0, 1.0});
    assertEquals(new TreeSet<>(Arrays.asList("pore.density", "throat.density")), water.props());

    assertArrayEquals(new double[]{1.0, 1.0}, water.remove(PropertyKey.parse("throat.density")), DELTA);
    assertNull(water.remove(PropertyKey.parse("throat.density")));
    assertEquals(new TreeSet<>(Arrays.asList("pore.density")), water.props());
  }
}
