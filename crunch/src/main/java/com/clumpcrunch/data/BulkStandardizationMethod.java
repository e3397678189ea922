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

package com.clumpcrunch.data;

/**
 * How a session's d13C or d18O values are brought onto the nominal scale defined by the anchors' bulk composition.
 */
public enum BulkStandardizationMethod {
  NONE("none"),
  ONE_POINT("1pt"),   // Offset only.
  TWO_POINT("2pt"),   // Affine: slope and offset.
  ;

  private final String label;

  BulkStandardizationMethod(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  public static BulkStandardizationMethod fromLabel(String label) {
    for (BulkStandardizationMethod m : values()) {
      if (m.label.equalsIgnoreCase(label) || m.name().equalsIgnoreCase(label)) {
        return m;
      }
    }
    throw new IllegalArgumentException(String.format("Unrecognized bulk standardization method '%s'", label));
  }
}
