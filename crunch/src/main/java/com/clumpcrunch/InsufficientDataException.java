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

package com.clumpcrunch;

/**
 * A session does not hold enough anchor analyses to determine the quantities asked of it.
 */
public class InsufficientDataException extends ClumpedCrunchException {
  private final String session;

  public InsufficientDataException(String session, String message) {
    super(message);
    this.session = session;
  }

  public String getSession() {
    return session;
  }
}
