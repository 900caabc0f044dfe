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
import com.twentyn.pnm.project.Project;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A phase whose properties are stored directly as arrays, one value per pore or throat of the project's network.
 * Arrays are copied on the way in and on the way out, so callers can never alter the stored data in place.
 */
public class GenericPhase implements Phase {

  public static final String NAME_PREFIX = "phase";

  protected static final String HORIZONTAL_RULE = StringUtils.repeat('-', 78);

  private final String name;
  private final Project project;
  private final Map<PropertyKey, double[]> data = new TreeMap<>();

  public GenericPhase(Project project) {
    this(project, null);
  }

  public GenericPhase(Project project, String name) {
    this(project, name, NAME_PREFIX);
  }

  protected GenericPhase(Project project, String name, String prefix) {
    this.project = project;
    this.name = name != null ? name : project.generateName(prefix);
    project.register(this);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public Project getProject() {
    return project;
  }

  @Override
  public double[] get(PropertyKey key) {
    double[] values = data.get(key);
    if (values == null) {
      throw new KeyNotFoundException(key);
    }
    return ArrayUtils.clone(values);
  }

  @Override
  public void set(PropertyKey key, double[] values) {
    if (values == null) {
      throw new IllegalArgumentException(String.format("Cannot store null under '%s'", key));
    }
    int expected = count(key.getElement());
    if (values.length != expected) {
      throw new IllegalArgumentException(String.format(
          "'%s' needs %d values, one per %s, but %d were given", key, expected, key.getElement(), values.length));
    }
    data.put(key, ArrayUtils.clone(values));
  }

  @Override
  public boolean contains(PropertyKey key) {
    return data.containsKey(key);
  }

  @Override
  public double[] remove(PropertyKey key) {
    return data.remove(key);
  }

  @Override
  public SortedSet<PropertyKey> keys() {
    return new TreeSet<>(data.keySet());
  }

  @Override
  public SortedSet<String> props() {
    SortedSet<String> props = new TreeSet<>();
    for (PropertyKey key : data.keySet()) {
      props.add(key.toString());
    }
    return props;
  }

  @Override
  public int count(ElementType element) {
    return project.getNetwork().count(element);
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    builder.append(HORIZONTAL_RULE).append('\n');
    builder.append(String.format("%s : %s%n", getClass().getSimpleName(), name));
    builder.append(HORIZONTAL_RULE).append('\n');
    int i = 1;
    for (Map.Entry<PropertyKey, double[]> entry : data.entrySet()) {
      long defined = Arrays.stream(entry.getValue()).filter(v -> !Double.isNaN(v)).count();
      builder.append(String.format("%-4d%-50s%d / %d%n", i++, entry.getKey(), defined, entry.getValue().length));
    }
    builder.append(HORIZONTAL_RULE);
    return builder.toString();
  }
}
