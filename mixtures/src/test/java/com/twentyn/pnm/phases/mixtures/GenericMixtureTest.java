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
import com.twentyn.pnm.network.PoreNetwork;
import com.twentyn.pnm.phases.GenericPhase;
import com.twentyn.pnm.phases.KeyNotFoundException;
import com.twentyn.pnm.phases.NotInProjectException;
import com.twentyn.pnm.phases.Phase;
import com.twentyn.pnm.phases.PropertyKey;
import com.twentyn.pnm.project.Project;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Tests of property resolution and component bookkeeping on mixtures.
 */
public class GenericMixtureTest {

  private static final double DELTA = 1e-9;

  private Project project;
  private GenericPhase water;
  private GenericPhase ethanol;
  private GenericMixture mixture;

  @Before
  public void setup() {
    project = new Project(new PoreNetwork(3, 2));

    water = new GenericPhase(project, "water");
    water.set("pore.density", new double[]{1000.0, 1000.0, 1000.0});
    water.set("pore.viscosity", new double[]{1.0, 2.0, 3.0});
    water.set("throat.density", new double[]{1000.0, 1000.0});

    ethanol = new GenericPhase(project, "ethanol");
    ethanol.set("pore.density", new double[]{800.0, 800.0, 800.0});
    ethanol.set("throat.density", new double[]{800.0, 800.0});

    mixture = new GenericMixture(project, "solution", Arrays.asList(water, ethanol));
  }

  @Test
  public void testConstructionSeedsUnsetMoleFractions() {
    assertEquals(Arrays.asList("water", "ethanol"), Arrays.asList(mixture.listComponents().keySet().toArray()));
    for (String key : Arrays.asList("pore.mole_fraction.water", "pore.mole_fraction.ethanol",
        "pore.mole_fraction.all")) {
      for (double value : mixture.get(key)) {
        assertTrue(String.format("%s should be unset", key), Double.isNaN(value));
      }
    }
  }

  @Test
  public void testGeneratedNameUsesMixturePrefix() {
    GenericMixture unnamed = new GenericMixture(project);
    assertEquals("mix_01", unnamed.getName());
    assertTrue(unnamed.listComponents().isEmpty());
  }

  @Test
  public void testDirectLookupWins() {
    mixture.set("pore.temperature", new double[]{300.0, 310.0, 320.0});
    assertArrayEquals(new double[]{300.0, 310.0, 320.0}, mixture.get("pore.temperature"), DELTA);
  }

  @Test
  public void testQualifiedKeyIsDelegatedToComponent() {
    assertFalse(mixture.contains("pore.density.water"));
    assertArrayEquals(water.get("pore.density"), mixture.get("pore.density.water"), 0.0);
    assertArrayEquals(ethanol.get("throat.density"), mixture.get("throat.density.ethanol"), 0.0);
  }

  @Test
  public void testWritingComponentOwnedKeyIsRejected() {
    try {
      mixture.set("pore.density.water", new double[]{1.0, 1.0, 1.0});
      fail("Expected pore.density.water to be owned by the water component");
    } catch (AlreadyOwnedByComponentException e) {
      assertEquals(PropertyKey.parse("pore.density.water"), e.getKey());
    }
    assertFalse(mixture.contains("pore.density.water"));
  }

  @Test
  public void testComponentQualifiedKeyNotOwnedByComponentCanBeWritten() {
    mixture.set("pore.heat_capacity.water", new double[]{4.2, 4.2, 4.2});
    assertArrayEquals(new double[]{4.2, 4.2, 4.2}, mixture.get("pore.heat_capacity.water"), DELTA);
  }

  @Test
  public void testPropsShallowAndDeep() {
    SortedSet<String> shallow = mixture.props();
    assertEquals(new TreeSet<>(Arrays.asList(
        "pore.mole_fraction.all", "pore.mole_fraction.ethanol", "pore.mole_fraction.water")), shallow);

    SortedSet<String> deep = mixture.props(true);
    assertTrue(deep.containsAll(shallow));
    assertTrue(deep.contains("pore.density.water"));
    assertTrue(deep.contains("pore.viscosity.water"));
    assertTrue(deep.contains("throat.density.ethanol"));
    assertFalse(deep.contains("pore.viscosity.ethanol"));
  }

  @Test
  public void testInterleaveBlendsByMoleFraction() {
    mixture.setMoleFraction(water, 0.25);
    mixture.setMoleFraction(ethanol, 0.75);

    assertArrayEquals(new double[]{850.0, 850.0, 850.0}, mixture.get("pore.density"), DELTA);
  }

  @Test
  public void testInterleaveUsesPerInstanceMoleFractions() {
    mixture.setMoleFraction(water, 1.0, 0.5, 0.0);
    mixture.setMoleFraction(ethanol, 0.0, 0.5, 1.0);

    assertArrayEquals(new double[]{1000.0, 900.0, 800.0}, mixture.get("pore.density"), DELTA);
  }

  @Test
  public void testInterleaveOnThroats() {
    mixture.setMoleFraction(ElementType.THROAT, water, 0.5);
    mixture.setMoleFraction(ElementType.THROAT, ethanol, 0.5);

    assertArrayEquals(new double[]{900.0, 900.0}, mixture.get("throat.density"), DELTA);
  }

  @Test
  public void testInterleaveRefusesNonUnityComposition() {
    mixture.setMoleFraction(water, 0.5, 0.5, 0.6);
    mixture.setMoleFraction(ethanol, 0.4);

    try {
      mixture.get("pore.density");
      fail("Expected a non normalized composition to be rejected");
    } catch (CompositionNotNormalizedException e) {
      assertEquals(ElementType.PORE, e.getElement());
      assertEquals(Arrays.asList(0, 1), e.getIndices());
    }
  }

  @Test(expected = CompositionNotNormalizedException.class)
  public void testInterleaveRefusesUnsetComposition() {
    mixture.get("pore.density");
  }

  @Test(expected = KeyNotFoundException.class)
  public void testInterleaveDegradesToNotFoundWhenComponentLacksProperty() {
    mixture.setMoleFraction(water, 0.5);
    mixture.setMoleFraction(ethanol, 0.5);

    // ethanol has no viscosity
    mixture.get("pore.viscosity");
  }

  @Test
  public void testEmptyMixtureIsNotNormalized() {
    GenericMixture empty = new GenericMixture(project, "empty");
    try {
      empty.get("pore.density");
      fail("Mole fractions of a mixture without components cannot add up to one");
    } catch (CompositionNotNormalizedException e) {
      assertEquals(ElementType.PORE, e.getElement());
      assertEquals(Arrays.asList(0, 1, 2), e.getIndices());
    }
    assertArrayEquals(new double[]{0.0, 0.0, 0.0}, empty.get("pore.mole_fraction.all"), 0.0);
  }

  @Test
  public void testFailedConstructionReleasesTheName() {
    Project other = new Project(new PoreNetwork(3, 2));
    try {
      new GenericMixture(project, "blend", Arrays.asList(water, new GenericPhase(other, "air")));
      fail("Expected a component from another project to be rejected");
    } catch (NotInProjectException e) {
      assertEquals("air", e.getPhaseName());
    }
    assertFalse(phaseNames().contains("blend"));

    GenericMixture blend = new GenericMixture(project, "blend", Collections.singletonList(water));
    assertSame(blend, project.resolve("blend"));
  }

  @Test
  public void testReservedComponentNameReleasesTheName() {
    GenericPhase all = new GenericPhase(project, "all");
    try {
      new GenericMixture(project, "blend", Arrays.asList(water, all));
      fail("Expected a component named all to be rejected");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("reserved"));
    }
    assertEquals(Arrays.asList("water", "ethanol", "solution", "all"), phaseNames());
  }

  private List<String> phaseNames() {
    List<String> names = new ArrayList<>();
    for (Phase phase : project.getPhases()) {
      names.add(phase.getName());
    }
    return names;
  }

  @Test
  public void testAddComponentIsIdempotentAndLeavesDataAlone() {
    GenericPhase salt = new GenericPhase(project, "salt");
    SortedSet<String> before = mixture.props();

    mixture.addComponent(salt);
    mixture.addComponent(salt);

    assertEquals(before, mixture.props());
    assertEquals(Arrays.asList("water", "ethanol", "salt"),
        Arrays.asList(mixture.listComponents().keySet().toArray()));
    List<MixtureAdvisory> duplicates =
        mixture.getDiagnostics().getAdvisories(MixtureAdvisory.Kind.DUPLICATE_COMPONENT);
    assertEquals(1, duplicates.size());
    assertEquals("salt", duplicates.get(0).getComponentName());
  }

  @Test(expected = NotInProjectException.class)
  public void testAddComponentFromAnotherProject() {
    Project other = new Project(new PoreNetwork(3, 2));
    mixture.addComponent(new GenericPhase(other, "air"));
  }

  @Test
  public void testRemoveComponentCleansUp() {
    mixture.setConcentration(water, 2.0);
    mixture.setConcentration(ethanol, 3.0);
    mixture.recomputeFromConcentrations();
    mixture.set("pore.heat_capacity.water", new double[]{4.2, 4.2, 4.2});

    mixture.setComponent(water, GenericMixture.Mode.REMOVE);

    assertFalse(mixture.listComponents().containsKey("water"));
    for (PropertyKey key : mixture.keys()) {
      assertFalse(String.format("%s should have been removed", key), key.hasQualifier("water"));
    }
    for (double value : mixture.get("pore.mole_fraction.all")) {
      assertTrue(Double.isNaN(value));
    }
    assertTrue(mixture.contains("pore.concentration.ethanol"));
  }

  @Test(expected = NotInMixtureException.class)
  public void testRemoveUnknownComponent() {
    mixture.removeComponent("salt");
  }

  @Test
  public void testSetComponentsReplacesRegistry() {
    GenericPhase salt = new GenericPhase(project, "salt");
    mixture.setMoleFraction(water, 0.5);

    mixture.setComponents(Arrays.asList(ethanol, salt));

    assertEquals(Arrays.asList("ethanol", "salt"), Arrays.asList(mixture.listComponents().keySet().toArray()));
    assertFalse(mixture.contains("pore.mole_fraction.water"));
    assertTrue(mixture.getDiagnostics().isEmpty());
  }

  @Test
  public void testListComponentsResolvesLiveObjects() {
    Map<String, Phase> components = mixture.listComponents();
    assertSame(water, components.get("water"));
    assertSame(ethanol, mixture.getComponent("ethanol"));

    project.purge(ethanol);
    try {
      mixture.listComponents();
      fail("A purged component should not be handed out");
    } catch (NotInProjectException e) {
      assertEquals("ethanol", e.getPhaseName());
    }
  }

  @Test
  public void testMixtureNeverWritesToItsComponents() {
    Phase component = Mockito.mock(Phase.class);
    Mockito.when(component.getName()).thenReturn("brine");
    Mockito.when(component.get(PropertyKey.parse("pore.density"))).thenReturn(new double[]{1200.0, 1200.0, 1200.0});
    project.register(component);

    GenericMixture pure = new GenericMixture(project, "pure", Collections.singletonList(component));
    pure.setMoleFraction(component, 1.0);
    pure.recomputeAggregate();

    assertArrayEquals(new double[]{1200.0, 1200.0, 1200.0}, pure.get("pore.density"), DELTA);
    Mockito.verify(component, Mockito.never()).set(Mockito.any(PropertyKey.class), Mockito.any(double[].class));
    Mockito.verify(component, Mockito.never()).remove(Mockito.any(PropertyKey.class));
  }
}
