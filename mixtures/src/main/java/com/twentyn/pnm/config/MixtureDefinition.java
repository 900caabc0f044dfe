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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON description of a simulation setup: the network size, the pure phases with their properties, and one
 * mixture made of some of those phases together with its initial composition.
 * Composition maps are keyed first by element kind ("pore" or "throat") and then by component name; arrays with a
 * single value are broadcast over every element instance.
 */
public class MixtureDefinition {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  @JsonProperty("network")
  private NetworkDefinition network;

  @JsonProperty("phases")
  private List<PhaseDefinition> phases = new ArrayList<>();

  @JsonProperty("mixture")
  private CompositionDefinition mixture;

  public MixtureDefinition() {}

  public MixtureDefinition(NetworkDefinition network, List<PhaseDefinition> phases, CompositionDefinition mixture) {
    this.network = network;
    this.phases = phases;
    this.mixture = mixture;
  }

  public static MixtureDefinition readFromJsonFile(File file) throws IOException {
    return OBJECT_MAPPER.readValue(file, MixtureDefinition.class);
  }

  public static MixtureDefinition readFromJsonStream(InputStream stream) throws IOException {
    return OBJECT_MAPPER.readValue(stream, MixtureDefinition.class);
  }

  public NetworkDefinition getNetwork() {
    return network;
  }

  public List<PhaseDefinition> getPhases() {
    return phases;
  }

  public CompositionDefinition getMixture() {
    return mixture;
  }

  public static class NetworkDefinition {
    @JsonProperty("pores")
    private Integer pores;

    @JsonProperty("throats")
    private Integer throats = 0;

    public NetworkDefinition() {}

    public NetworkDefinition(Integer pores, Integer throats) {
      this.pores = pores;
      this.throats = throats;
    }

    public Integer getPores() {
      return pores;
    }

    public Integer getThroats() {
      return throats;
    }
  }

  public static class PhaseDefinition {
    @JsonProperty("name")
    private String name;

    @JsonProperty("properties")
    private Map<String, double[]> properties = new LinkedHashMap<>();

    public PhaseDefinition() {}

    public PhaseDefinition(String name, Map<String, double[]> properties) {
      this.name = name;
      this.properties = properties;
    }

    public String getName() {
      return name;
    }

    public Map<String, double[]> getProperties() {
      return properties;
    }
  }

  public static class CompositionDefinition {
    @JsonProperty("name")
    private String name;

    @JsonProperty("components")
    private List<String> components = new ArrayList<>();

    @JsonProperty("mole_fractions")
    private Map<String, Map<String, double[]>> moleFractions = new LinkedHashMap<>();

    @JsonProperty("concentrations")
    private Map<String, Map<String, double[]>> concentrations = new LinkedHashMap<>();

    public CompositionDefinition() {}

    public CompositionDefinition(String name, List<String> components,
                                 Map<String, Map<String, double[]>> moleFractions,
                                 Map<String, Map<String, double[]>> concentrations) {
      this.name = name;
      this.components = components;
      this.moleFractions = moleFractions;
      this.concentrations = concentrations;
    }

    public String getName() {
      return name;
    }

    public List<String> getComponents() {
      return components;
    }

    public Map<String, Map<String, double[]>> getMoleFractions() {
      return moleFractions;
    }

    public Map<String, Map<String, double[]>> getConcentrations() {
      return concentrations;
    }
  }
}
