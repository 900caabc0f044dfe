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

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A key into a phase's property storage, made of an element kind, a property name and an optional qualifier.
 * The textual form is "element.property[.qualifier]", for example "pore.density" or "pore.mole_fraction.water".
 * The qualifier names the component a value belongs to, or "all" for an aggregate over components.
 */
public final class PropertyKey implements Comparable<PropertyKey> {

  public static final String SEPARATOR = ".";

  // Matches "element.property" with an optional ".qualifier"; segments may not be empty or contain dots.
  private static final Pattern KEY_PATTERN = Pattern.compile("^([^.]+)\\.([^.]+)(?:\\.([^.]+))?$");

  private static final Comparator<PropertyKey> ORDERING = Comparator
      .comparing(PropertyKey::getElement)
      .thenComparing(PropertyKey::getProperty)
      .thenComparing(key -> key.qualifier, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

  private final ElementType element;
  private final String property;
  private final String qualifier;

  private PropertyKey(ElementType element, String property, String qualifier) {
    this.element = Objects.requireNonNull(element, "element");
    this.property = requireSegment(property, "property");
    this.qualifier = qualifier == null ? null : requireSegment(qualifier, "qualifier");
  }

  private static String requireSegment(String segment, String what) {
    if (segment == null || segment.isEmpty() || segment.contains(SEPARATOR)) {
      throw new IllegalArgumentException(String.format("Invalid %s segment '%s'", what, segment));
    }
    return segment;
  }

  public static PropertyKey of(ElementType element, String property) {
    return new PropertyKey(element, property, null);
  }

  public static PropertyKey of(ElementType element, String property, String qualifier) {
    return new PropertyKey(element, property, qualifier);
  }

  /**
   * Parses a key from its dotted string representation.
   * @param key a string such as "throat.concentration.water"
   * @return the parsed key
   * @throws IllegalArgumentException if the string is not a well formed key
   */
  public static PropertyKey parse(String key) {
    if (key == null) {
      throw new IllegalArgumentException("Property key may not be null");
    }
    Matcher matcher = KEY_PATTERN.matcher(key);
    if (!matcher.matches()) {
      throw new IllegalArgumentException(String.format("Malformed property key '%s'", key));
    }
    return new PropertyKey(ElementType.fromPrefix(matcher.group(1)), matcher.group(2), matcher.group(3));
  }

  public ElementType getElement() {
    return element;
  }

  public String getProperty() {
    return property;
  }

  public Optional<String> getQualifier() {
    return Optional.ofNullable(qualifier);
  }

  public boolean isQualified() {
    return qualifier != null;
  }

  public boolean hasQualifier(String name) {
    return qualifier != null && qualifier.equals(name);
  }

  public PropertyKey withQualifier(String newQualifier) {
    return new PropertyKey(element, property, newQualifier);
  }

  /**
   * @return this key with its qualifier stripped, e.g. "pore.density" for "pore.density.water"
   */
  public PropertyKey unqualified() {
    return qualifier == null ? this : new PropertyKey(element, property, null);
  }

  @Override
  public int compareTo(PropertyKey other) {
    return ORDERING.compare(this, other);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    PropertyKey that = (PropertyKey) o;

    if (element != that.element) return false;
    if (!property.equals(that.property)) return false;
    return Objects.equals(qualifier, that.qualifier);
  }

  @Override
  public int hashCode() {
    int result = element.hashCode();
    result = 31 * result + property.hashCode();
    result = 31 * result + (qualifier != null ? qualifier.hashCode() : 0);
    return result;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder(element.getPrefix()).append(SEPARATOR).append(property);
    if (qualifier != null) {
      builder.append(SEPARATOR).append(qualifier);
    }
    return builder.toString();
  }
}
