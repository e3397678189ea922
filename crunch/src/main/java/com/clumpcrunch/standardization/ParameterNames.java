/*************************************************************************
*                                                                        *
*  This file is part of the clumpcrunch project.                         *
*  clumpcrunch standardizes clumped-isotope measurements of CO2.         *
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

package com.clumpcrunch.standardization;

import com.clumpcrunch.ConfigurationException;
import com.clumpcrunch.data.ClumpedMass;
import com.clumpcrunch.data.Session;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Naming of the standardization parameters: {@code a_<session>}, {@code b_<session>}, ..., {@code c2_<session>} for
 * every session, then {@code D47_<sample>} (or {@code D48_<sample>}) for every unknown.  Session and sample names are
 * sanitized so that the parameter names are valid identifiers in constraint expressions.
 */
public final class ParameterNames {
  private ParameterNames() {
  }

  public static String sanitize(String name) {
    return name.replace('-', '_').replace('.', '_').replace(' ', '_');
  }

  public static String sessionParameter(String session, int parameterIndex) {
    return Session.PARAMETER_NAMES[parameterIndex] + "_" + sanitize(session);
  }

  public static String unknownParameter(ClumpedMass mass, String sample) {
    return mass.getAnomalyName() + "_" + sanitize(sample);
  }

  /**
   * Build the ordered parameter names of a fit.
   * @throws ConfigurationException If two sessions or two unknowns sanitize to the same name.
   */
  public static List<String> build(ClumpedMass mass, Collection<String> sessions, Collection<String> unknowns)
      throws ConfigurationException {
    List<String> names = new ArrayList<>(Session.N_PARAMETERS * sessions.size() + unknowns.size());
    Map<String, String> origin = new HashMap<>();
    for (String session : sessions) {
      for (int i = 0; i < Session.N_PARAMETERS; i++) {
        names.add(claim(origin, sessionParameter(session, i), session));
      }
    }
    for (String sample : unknowns) {
      names.add(claim(origin, unknownParameter(mass, sample), sample));
    }
    return names;
  }

  private static String claim(Map<String, String> origin, String parameter, String owner)
      throws ConfigurationException {
    String previous = origin.put(parameter, owner);
    if (previous != null) {
      throw new ConfigurationException(String.format(
          "Names '%s' and '%s' both map to parameter %s; rename one of them", previous, owner, parameter));
    }
    return parameter;
  }
}
