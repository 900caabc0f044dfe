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
import com.twentyn.pnm.phases.GenericPhase;
import com.twentyn.pnm.phases.KeyNotFoundException;
import com.twentyn.pnm.phases.NotInProjectException;
import com.twentyn.pnm.phases.Phase;
import com.twentyn.pnm.phases.PropertyKey;
import com.twentyn.pnm.project.Project;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.math3.util.MathArrays;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * A phase representing a multicomponent mixture, built from other phases of the same project acting as its
 * pure components.
 *
 * Properties are resolved in three steps:
 * 1) anything stored on the mixture itself is returned as is,
 * 2) a key qualified with a component name, e.g. "pore.density.water", is delegated to that component as
 * "pore.density",
 * 3) anything else is interleaved: the same property is read from every component and blended, weighted by each
 * component's mole fraction.
 *
 * The composition is kept as one "element.mole_fraction.component" array per component, optionally derived from
 * "element.concentration.component" arrays, and their sum is kept under "element.mole_fraction.all".
 *
 * Components are shared with the project and may be shared by other mixtures; a mixture never writes to them.
 * None of this is thread-safe.
 */
public class GenericMixture extends GenericPhase {

  private static final Logger LOGGER = LogManager.getFormatterLogger(GenericMixture.class);

  public static final String NAME_PREFIX = "mix";
  public static final String MOLE_FRACTION = "mole_fraction";
  public static final String CONCENTRATION = "concentration";
  public static final String AGGREGATE_QUALIFIER = ComponentRegistry.RESERVED_NAME;

  // Mole fractions adding up to within this distance of one are considered normalized.
  public static final double UNITY_TOLERANCE = 1e-9;

  public enum Mode {
    ADD,
    REMOVE,
  }

  private final ComponentRegistry registry;
  private final MixtureDiagnostics diagnostics;

  public GenericMixture(Project project) {
    this(project, null, Collections.emptyList());
  }

  public GenericMixture(Project project, String name) {
    this(project, name, Collections.emptyList());
  }

  /**
   * Creates a mixture of the given components. Every component starts with an unset pore mole fraction.
   * @param project the project holding the network and the component phases
   * @param name the name of the mixture, or null to generate one
   * @param components the phases that constitute the mixture
   */
  public GenericMixture(Project project, String name, Collection<? extends Phase> components) {
    super(project, name, NAME_PREFIX);
    this.registry = new ComponentRegistry(project);
    this.diagnostics = new MixtureDiagnostics();

    try {
      for (Phase component : components) {
        setComponent(component, Mode.ADD);
        setMoleFraction(component, Double.NaN);
      }
    } catch (RuntimeException e) {
      // Frees the name for another attempt.
      project.purge(this);
      throw e;
    }
    set(aggregateKey(ElementType.PORE), unset(ElementType.PORE));

    LOGGER.warn("Mixtures are a beta feature and functionality may change in future versions");
    LOGGER.info("Created mixture %s with components %s", getName(), registry.getNames());
  }

  public static PropertyKey moleFractionKey(ElementType element, String componentName) {
    return PropertyKey.of(element, MOLE_FRACTION, componentName);
  }

  public static PropertyKey concentrationKey(ElementType element, String componentName) {
    return PropertyKey.of(element, CONCENTRATION, componentName);
  }

  public static PropertyKey aggregateKey(ElementType element) {
    return PropertyKey.of(element, MOLE_FRACTION, AGGREGATE_QUALIFIER);
  }

  public MixtureDiagnostics getDiagnostics() {
    return diagnostics;
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Property resolution
   */

  @Override
  public double[] get(PropertyKey key) {
    if (super.contains(key)) {
      return super.get(key);
    }

    Optional<String> qualifier = key.getQualifier();
    if (qualifier.isPresent() && registry.isRegistered(qualifier.get())) {
      Phase component = registry.resolve(qualifier.get());
      try {
        return component.get(key.unqualified());
      } catch (KeyNotFoundException e) {
        LOGGER.debug("Component %s has no %s, trying to interleave %s", component.getName(), key.unqualified(), key);
      }
    }

    return interleaveData(key);
  }

  /**
   * Stores a value on the mixture.
   * @throws AlreadyOwnedByComponentException if the key is provided by a component through delegation and has not
   * been stored on the mixture itself
   */
  @Override
  public void set(PropertyKey key, double[] values) {
    if (isOwnedByComponent(key)) {
      throw new AlreadyOwnedByComponentException(key);
    }
    super.set(key, values);
  }

  // Equivalent to key being in props(true) but not in props(false).
  private boolean isOwnedByComponent(PropertyKey key) {
    if (!key.isQualified() || super.contains(key) || !registry.isRegistered(key.getQualifier().get())) {
      return false;
    }
    Phase component = registry.resolve(key.getQualifier().get());
    return component.props().contains(key.unqualified().toString());
  }

  @Override
  public SortedSet<String> props() {
    return props(false);
  }

  /**
   * List property keys visible on this mixture.
   * @param deep whether to include, for every component, each of its properties suffixed with ".component"
   * @return the sorted property keys
   */
  public SortedSet<String> props(boolean deep) {
    SortedSet<String> props = new TreeSet<>(super.props());
    if (deep) {
      for (Phase component : registry.resolveAll().values()) {
        for (String prop : component.props()) {
          props.add(prop + PropertyKey.SEPARATOR + component.getName());
        }
      }
    }
    return props;
  }

  /**
   * Gathers property values from the component phases and blends them into a single array, weighting each
   * component by its mole fraction.
   * @param key the property to build
   * @return the blended values
   * @throws CompositionNotNormalizedException if the mole fractions do not add up to one for the key's element,
   *         which is always the case for a mixture with no components
   * @throws KeyNotFoundException if any component lacks the property and nothing is stored under the key
   */
  public double[] interleaveData(PropertyKey key) {
    ElementType element = key.getElement();
    requireNormalized(element);

    try {
      return blend(key);
    } catch (MissingComponentPropertyException e) {
      LOGGER.debug("Unable to interleave %s: %s", key, e.getMessage());
      return super.get(key);
    }
  }

  private double[] blend(PropertyKey key) {
    ElementType element = key.getElement();
    double[] values = new double[count(element)];
    for (Map.Entry<String, Phase> entry : registry.resolveAll().entrySet()) {
      double[] componentValues;
      try {
        componentValues = entry.getValue().get(key);
      } catch (KeyNotFoundException e) {
        throw new MissingComponentPropertyException(entry.getKey(), key, e);
      }
      values = MathArrays.ebeAdd(values, MathArrays.ebeMultiply(componentValues, moleFraction(element, entry.getKey())));
    }
    return values;
  }

  private void requireNormalized(ElementType element) {
    if (nonUnityIndices(storedOrUnset(aggregateKey(element))).isEmpty()) {
      return;
    }
    List<Integer> offending = nonUnityIndices(recomputeAggregate(element));
    if (!offending.isEmpty()) {
      throw new CompositionNotNormalizedException(element, offending);
    }
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Components
   */

  /**
   * Add or remove a component.
   */
  public void setComponent(Phase component, Mode mode) {
    switch (mode) {
      case ADD:
        addComponent(component);
        break;
      case REMOVE:
        removeComponent(component);
        break;
      default:
        throw new IllegalArgumentException(String.format("Unsupported mode %s", mode));
    }
  }

  /**
   * Register a phase as a component of this mixture. No composition data is touched: until a mole fraction is
   * set for it, the component counts as unset.
   * @throws NotInProjectException if the phase does not belong to this mixture's project
   */
  public void addComponent(Phase component) {
    if (registry.register(component)) {
      LOGGER.debug("Added component %s to mixture %s", component.getName(), getName());
    } else {
      diagnostics.record(MixtureAdvisory.duplicateComponent(component.getName()));
    }
  }

  public void addComponents(Collection<? extends Phase> components) {
    for (Phase component : components) {
      addComponent(component);
    }
  }

  public void removeComponent(Phase component) {
    removeComponent(component.getName());
  }

  /**
   * Remove a component, deleting every value stored on the mixture for it and resetting the aggregate
   * mole fractions to unset.
   * @throws NotInMixtureException if no such component is registered
   */
  public void removeComponent(String name) {
    registry.deregister(name);
    for (PropertyKey key : keys()) {
      if (key.hasQualifier(name)) {
        remove(key);
      }
    }
    for (ElementType element : ElementType.values()) {
      if (element == ElementType.PORE || super.contains(aggregateKey(element))) {
        set(aggregateKey(element), unset(element));
      }
    }
    LOGGER.debug("Removed component %s from mixture %s", name, getName());
  }

  public void removeComponents(Collection<? extends Phase> components) {
    for (Phase component : components) {
      removeComponent(component);
    }
  }

  /**
   * Get the live component phases, resolved through the project, in the order they were added.
   */
  public Map<String, Phase> listComponents() {
    return registry.resolveAll();
  }

  /**
   * Make the given phases the exact set of components: new ones are added, and current components that are not
   * listed are removed along with their data.
   */
  public void setComponents(Collection<? extends Phase> components) {
    for (Phase component : components) {
      if (!getProject().contains(component)) {
        throw new NotInProjectException(component.getName());
      }
    }
    Set<String> wanted = components.stream().map(Phase::getName).collect(Collectors.toSet());
    for (String name : registry.getNames()) {
      if (!wanted.contains(name)) {
        removeComponent(name);
      }
    }
    for (Phase component : components) {
      if (!registry.isRegistered(component.getName())) {
        addComponent(component);
      }
    }
  }

  public Phase getComponent(String name) {
    return registry.resolve(name);
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Composition
   */

  public void setConcentration(Phase component, double... values) {
    setConcentration(ElementType.PORE, component, values);
  }

  public void setConcentration(String component, double... values) {
    setConcentration(ElementType.PORE, component, values);
  }

  public void setConcentration(ElementType element, Phase component, double... values) {
    storeConcentration(element, registry.requireMember(component), values);
  }

  public void setConcentration(ElementType element, String component, double... values) {
    storeConcentration(element, registry.requireMember(component), values);
  }

  /**
   * Once a concentration is given it is authoritative: every component's mole fraction for the element is reset
   * to unset, to be derived again with {@link #recomputeFromConcentrations(ElementType)} or
   * {@link #recomputeFromFreeComponent(ElementType)}.
   */
  private void storeConcentration(ElementType element, String name, double[] values) {
    if (ArrayUtils.isEmpty(values)) {
      return;
    }
    set(concentrationKey(element, name), broadcast(element, values));
    for (String componentName : registry.getNames()) {
      set(moleFractionKey(element, componentName), unset(element));
    }
    recomputeAggregate(element);
    LOGGER.debug("Set %s concentration of %s, mole fractions reset", element, name);
  }

  public List<MixtureAdvisory> setMoleFraction(Phase component, double... values) {
    return setMoleFraction(ElementType.PORE, component, values);
  }

  public List<MixtureAdvisory> setMoleFraction(String component, double... values) {
    return setMoleFraction(ElementType.PORE, component, values);
  }

  public List<MixtureAdvisory> setMoleFraction(ElementType element, Phase component, double... values) {
    return storeMoleFraction(element, registry.requireMember(component), values);
  }

  public List<MixtureAdvisory> setMoleFraction(ElementType element, String component, double... values) {
    return storeMoleFraction(element, registry.requireMember(component), values);
  }

  /**
   * Other components' mole fractions and all concentrations are left alone.
   * @return the advisories raised, e.g. for values outside [0, 1]
   */
  private List<MixtureAdvisory> storeMoleFraction(ElementType element, String name, double[] values) {
    List<MixtureAdvisory> advisories = new ArrayList<>();
    if (!ArrayUtils.isEmpty(values)) {
      PropertyKey key = moleFractionKey(element, name);
      double[] moleFractions = broadcast(element, values);
      List<Integer> outOfRange = new ArrayList<>();
      for (int i = 0; i < moleFractions.length; i++) {
        if (moleFractions[i] < 0.0 || moleFractions[i] > 1.0) {
          outOfRange.add(i);
        }
      }
      if (!outOfRange.isEmpty()) {
        MixtureAdvisory advisory = MixtureAdvisory.moleFractionOutOfRange(name, key, outOfRange);
        diagnostics.record(advisory);
        advisories.add(advisory);
      }
      set(key, moleFractions);
    }
    recomputeAggregate(element);
    return advisories;
  }

  public double[] recomputeFromFreeComponent() {
    return recomputeFromFreeComponent(ElementType.PORE, (String) null);
  }

  public double[] recomputeFromFreeComponent(Phase released) {
    return recomputeFromFreeComponent(ElementType.PORE, released);
  }

  public double[] recomputeFromFreeComponent(String released) {
    return recomputeFromFreeComponent(ElementType.PORE, released);
  }

  public double[] recomputeFromFreeComponent(ElementType element) {
    return recomputeFromFreeComponent(element, (String) null);
  }

  public double[] recomputeFromFreeComponent(ElementType element, Phase released) {
    return recomputeFromFreeComponent(element, registry.requireMember(released));
  }

  /**
   * Adjusts the mole fraction of a single free component so the total adds up to one.
   * If a component is released, its mole fraction is unset first. When exactly one component has an unset mole
   * fraction it becomes one minus the sum of the others; otherwise every mole fraction is derived from the
   * concentrations, as in {@link #recomputeFromConcentrations(ElementType)}.
   * @param element the element kind to reconcile
   * @param released the component whose mole fraction should be adjusted, or null
   * @return the recomputed aggregate mole fraction
   * @throws InsufficientConcentrationDataException if concentrations are needed but some are missing
   */
  public double[] recomputeFromFreeComponent(ElementType element, String released) {
    if (released != null) {
      set(moleFractionKey(element, registry.requireMember(released)), unset(element));
    }

    Set<String> names = registry.getNames();
    List<String> unsetComponents = names.stream()
        .filter(name -> isUnset(moleFraction(element, name)))
        .collect(Collectors.toList());

    if (unsetComponents.size() == 1) {
      String free = unsetComponents.get(0);
      double[] remainder = filled(element, 1.0);
      for (String name : names) {
        if (!name.equals(free)) {
          remainder = MathArrays.ebeSubtract(remainder, moleFraction(element, name));
        }
      }
      set(moleFractionKey(element, free), remainder);
      LOGGER.debug("Solved %s mole fraction of free component %s", element, free);
    } else {
      LOGGER.debug("%d components have unset %s mole fractions, normalizing concentrations instead",
          unsetComponents.size(), element);
      normalizeConcentrations(element);
    }
    return recomputeAggregate(element);
  }

  public double[] recomputeFromConcentrations() {
    return recomputeFromConcentrations(ElementType.PORE);
  }

  /**
   * Derives every component's mole fraction as its concentration divided by the total concentration.
   * @return the recomputed aggregate mole fraction
   * @throws InsufficientConcentrationDataException if any component has no concentration for the element
   */
  public double[] recomputeFromConcentrations(ElementType element) {
    normalizeConcentrations(element);
    return recomputeAggregate(element);
  }

  private void normalizeConcentrations(ElementType element) {
    Set<String> names = registry.getNames();
    List<String> missing = names.stream()
        .filter(name -> !super.contains(concentrationKey(element, name)))
        .collect(Collectors.toList());
    if (!missing.isEmpty()) {
      throw new InsufficientConcentrationDataException(element, missing);
    }

    double[] total = new double[count(element)];
    for (String name : names) {
      total = MathArrays.ebeAdd(total, super.get(concentrationKey(element, name)));
    }
    for (String name : names) {
      set(moleFractionKey(element, name), MathArrays.ebeDivide(super.get(concentrationKey(element, name)), total));
    }
  }

  public double[] recomputeAggregate() {
    return recomputeAggregate(ElementType.PORE);
  }

  /**
   * Sets "element.mole_fraction.all" to the sum of every component's mole fraction.
   * @return the new aggregate
   */
  public double[] recomputeAggregate(ElementType element) {
    double[] total = new double[count(element)];
    for (String name : registry.getNames()) {
      total = MathArrays.ebeAdd(total, moleFraction(element, name));
    }
    set(aggregateKey(element), total);
    return total;
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Health
   */

  public MixtureHealth checkHealth() {
    return checkHealth(ElementType.PORE);
  }

  /**
   * Calculates the total mole fraction in each element instance and reports where it is not one.
   */
  public MixtureHealth checkHealth(ElementType element) {
    double[] total = recomputeAggregate(element);
    List<Integer> tooLow = new ArrayList<>();
    List<Integer> tooHigh = new ArrayList<>();
    List<Integer> undefined = new ArrayList<>();
    for (int i = 0; i < total.length; i++) {
      if (Double.isNaN(total[i])) {
        undefined.add(i);
      } else if (total[i] < 1.0 - UNITY_TOLERANCE) {
        tooLow.add(i);
      } else if (total[i] > 1.0 + UNITY_TOLERANCE) {
        tooHigh.add(i);
      }
    }
    return new MixtureHealth(element, tooLow, tooHigh, undefined);
  }

  /* ----------------------------------------------------------------------------------------------------------------
   * Helpers
   */

  // Missing mole fractions count as unset.
  private double[] moleFraction(ElementType element, String name) {
    return storedOrUnset(moleFractionKey(element, name));
  }

  private double[] storedOrUnset(PropertyKey key) {
    return super.contains(key) ? super.get(key) : unset(key.getElement());
  }

  private double[] broadcast(ElementType element, double[] values) {
    if (values.length == 1) {
      return filled(element, values[0]);
    }
    return values;
  }

  private double[] filled(ElementType element, double value) {
    double[] values = new double[count(element)];
    Arrays.fill(values, value);
    return values;
  }

  private double[] unset(ElementType element) {
    return filled(element, Double.NaN);
  }

  private static boolean isUnset(double[] values) {
    return Arrays.stream(values).anyMatch(Double::isNaN);
  }

  private static List<Integer> nonUnityIndices(double[] values) {
    List<Integer> indices = new ArrayList<>();
    for (int i = 0; i < values.length; i++) {
      if (Double.isNaN(values[i]) || Math.abs(values[i] - 1.0) > UNITY_TOLERANCE) {
        indices.add(i);
      }
    }
    return indices;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder(super.toString()).append('\n');
    builder.append("Component Phases\n").append(HORIZONTAL_RULE).append('\n');
    for (String name : registry.getNames()) {
      builder.append(String.format("%s : %s%n", getProject().resolve(name).getClass().getSimpleName(), name));
    }
    builder.append(HORIZONTAL_RULE);
    return builder.toString();
  }
}
