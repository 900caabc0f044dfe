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

package com.twentyn.pnm.config;

import com.twentyn.pnm.network.ElementType;
import com.twentyn.pnm.network.PoreNetwork;
import com.twentyn.pnm.phases.GenericPhase;
import com.twentyn.pnm.phases.Phase;
import com.twentyn.pnm.phases.PropertyKey;
import com.twentyn.pnm.phases.mixtures.GenericMixture;
import com.twentyn.pnm.phases.mixtures.MixtureAdvisory;
import com.twentyn.pnm.project.Project;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Builds a project and its mixture from a {@link MixtureDefinition}.
 * Concentrations are applied before mole fractions, since setting a concentration unsets every mole fraction.
 */
public class MixtureDefinitionLoader {

  private static final Logger LOGGER = LogManager.getFormatterLogger(MixtureDefinitionLoader.class);

  public GenericMixture load(File file) throws IOException {
    LOGGER.info("Reading mixture definition from %s", file.getAbsolutePath());
    return load(MixtureDefinition.readFromJsonFile(file));
  }

  public GenericMixture load(MixtureDefinition definition) {
    if (definition.getNetwork() == null || definition.getNetwork().getPores() == null) {
      throw new IllegalArgumentException("Mixture definition has no network size");
    }
    if (definition.getMixture() == null) {
      throw new IllegalArgumentException("Mixture definition has no mixture");
    }

    Project project = new Project(
        new PoreNetwork(definition.getNetwork().getPores(), definition.getNetwork().getThroats()));

    for (MixtureDefinition.PhaseDefinition phaseDefinition :
        ObjectUtils.defaultIfNull(definition.getPhases(), Collections.<MixtureDefinition.PhaseDefinition>emptyList())) {
      GenericPhase phase = new GenericPhase(project, phaseDefinition.getName());
      for (Map.Entry<String, double[]> property : nullToEmpty(phaseDefinition.getProperties()).entrySet()) {
        PropertyKey key = PropertyKey.parse(property.getKey());
        phase.set(key, broadcast(phase.count(key.getElement()), property.getValue()));
      }
      LOGGER.debug("Loaded phase %s with %d properties", phase.getName(), phase.keys().size());
    }

    MixtureDefinition.CompositionDefinition composition = definition.getMixture();
    List<Phase> components = new ArrayList<>();
    for (String name : ObjectUtils.defaultIfNull(composition.getComponents(), Collections.<String>emptyList())) {
      components.add(project.resolve(name));
    }
    GenericMixture mixture = new GenericMixture(project, composition.getName(), components);

    for (Map.Entry<String, Map<String, double[]>> byElement : nullToEmpty(composition.getConcentrations()).entrySet()) {
      ElementType element = ElementType.fromPrefix(byElement.getKey());
      for (Map.Entry<String, double[]> entry : nullToEmpty(byElement.getValue()).entrySet()) {
        mixture.setConcentration(element, entry.getKey(), entry.getValue());
      }
    }
    for (Map.Entry<String, Map<String, double[]>> byElement : nullToEmpty(composition.getMoleFractions()).entrySet()) {
      ElementType element = ElementType.fromPrefix(byElement.getKey());
      for (Map.Entry<String, double[]> entry : nullToEmpty(byElement.getValue()).entrySet()) {
        for (MixtureAdvisory advisory : mixture.setMoleFraction(element, entry.getKey(), entry.getValue())) {
          LOGGER.warn("%s", advisory.getMessage());
        }
      }
    }

    return mixture;
  }

  // JSON nulls stand for absent sections.
  private static <K, V> Map<K, V> nullToEmpty(Map<K, V> map) {
    return ObjectUtils.defaultIfNull(map, Collections.<K, V>emptyMap());
  }

  private static double[] broadcast(int count, double[] values) {
    if (ArrayUtils.getLength(values) == 1) {
      double[] broadcast = new double[count];
      Arrays.fill(broadcast, values[0]);
      return broadcast;
    }
    return values;
  }
}
