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

import com.clumpcrunch.ConstraintResolutionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An affine combination of named parameters, {@code constant + sum(coefficient_i * name_i)}, as written on the right
 * hand side of a parameter constraint.  Parsed expressions may use numbers, parameter names, + - * / and
 * parentheses, as long as the result stays linear in the names.
 */
public class LinearExpression {
  private final Map<String, Double> coefficients;
  private final double constant;

  private LinearExpression(Map<String, Double> coefficients, double constant) {
    this.coefficients = coefficients;
    this.constant = constant;
  }

  public static LinearExpression constant(double value) {
    return new LinearExpression(new LinkedHashMap<String, Double>(), value);
  }

  public static LinearExpression of(String name) {
    Map<String, Double> coefficients = new LinkedHashMap<>();
    coefficients.put(name, 1.0);
    return new LinearExpression(coefficients, 0.0);
  }

  public Map<String, Double> getCoefficients() {
    return Collections.unmodifiableMap(coefficients);
  }

  public double getConstant() {
    return constant;
  }

  public boolean isConstant() {
    return coefficients.isEmpty();
  }

  public LinearExpression plus(LinearExpression other) {
    Map<String, Double> sum = new LinkedHashMap<>(coefficients);
    for (Map.Entry<String, Double> entry : other.coefficients.entrySet()) {
      Double existing = sum.get(entry.getKey());
      sum.put(entry.getKey(), existing == null ? entry.getValue() : existing + entry.getValue());
    }
    return new LinearExpression(sum, constant + other.constant);
  }

  public LinearExpression times(double factor) {
    Map<String, Double> scaled = new LinkedHashMap<>();
    for (Map.Entry<String, Double> entry : coefficients.entrySet()) {
      scaled.put(entry.getKey(), entry.getValue() * factor);
    }
    return new LinearExpression(scaled, constant * factor);
  }

  public double evaluate(Map<String, Double> values) {
    double result = constant;
    for (Map.Entry<String, Double> entry : coefficients.entrySet()) {
      result += entry.getValue() * values.get(entry.getKey());
    }
    return result;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(constant);
    for (Map.Entry<String, Double> entry : coefficients.entrySet()) {
      sb.append(" + ").append(entry.getValue()).append('*').append(entry.getKey());
    }
    return sb.toString();
  }

  public static LinearExpression parse(String text) throws ConstraintResolutionException {
    Parser parser = new Parser(text);
    LinearExpression result = parser.expression();
    if (parser.peek() != null) {
      throw parser.error("unexpected '" + parser.peek() + "'");
    }
    return result;
  }

  /**
   * Recursive descent over: expression = term (('+' | '-') term)*, term = factor (('*' | '/') factor)*,
   * factor = ('+' | '-') factor | number | name | '(' expression ')'.
   */
  private static class Parser {
    private final String text;
    private final List<String> tokens;
    private int position = 0;

    Parser(String text) throws ConstraintResolutionException {
      this.text = text;
      this.tokens = tokenize(text);
    }

    private List<String> tokenize(String s) throws ConstraintResolutionException {
      List<String> result = new ArrayList<>();
      int i = 0;
      while (i < s.length()) {
        char ch = s.charAt(i);
        if (Character.isWhitespace(ch)) {
          i++;
        } else if ("+-*/()".indexOf(ch) >= 0) {
          result.add(String.valueOf(ch));
          i++;
        } else if (Character.isDigit(ch) || ch == '.') {
          int start = i;
          while (i < s.length() && (Character.isDigit(s.charAt(i)) || s.charAt(i) == '.')) {
            i++;
          }
          // Exponent, e.g. 1.5e-3.
          if (i < s.length() && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < s.length() && (s.charAt(j) == '+' || s.charAt(j) == '-')) {
              j++;
            }
            if (j < s.length() && Character.isDigit(s.charAt(j))) {
              i = j;
              while (i < s.length() && Character.isDigit(s.charAt(i))) {
                i++;
              }
            }
          }
          result.add(s.substring(start, i));
        } else if (Character.isLetter(ch) || ch == '_') {
          int start = i;
          while (i < s.length() && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_')) {
            i++;
          }
          result.add(s.substring(start, i));
        } else {
          throw new ConstraintResolutionException(
              String.format("Unexpected character '%c' in constraint expression '%s'", ch, s));
        }
      }
      return result;
    }

    String peek() {
      return position < tokens.size() ? tokens.get(position) : null;
    }

    String next() throws ConstraintResolutionException {
      if (position >= tokens.size()) {
        throw error("unexpected end of expression");
      }
      return tokens.get(position++);
    }

    ConstraintResolutionException error(String what) {
      return new ConstraintResolutionException(
          String.format("Cannot parse constraint expression '%s': %s", text, what));
    }

    LinearExpression expression() throws ConstraintResolutionException {
      LinearExpression result = term();
      while ("+".equals(peek()) || "-".equals(peek())) {
        String op = next();
        LinearExpression rhs = term();
        result = result.plus("+".equals(op) ? rhs : rhs.times(-1));
      }
      return result;
    }

    LinearExpression term() throws ConstraintResolutionException {
      LinearExpression result = factor();
      while ("*".equals(peek()) || "/".equals(peek())) {
        String op = next();
        LinearExpression rhs = factor();
        if ("*".equals(op)) {
          if (result.isConstant()) {
            result = rhs.times(result.constant);
          } else if (rhs.isConstant()) {
            result = result.times(rhs.constant);
          } else {
            throw error("product of two parameters is not linear");
          }
        } else {
          if (!rhs.isConstant()) {
            throw error("division by a parameter is not linear");
          }
          if (rhs.constant == 0) {
            throw error("division by zero");
          }
          result = result.times(1 / rhs.constant);
        }
      }
      return result;
    }

    LinearExpression factor() throws ConstraintResolutionException {
      String token = next();
      if ("-".equals(token)) {
        return factor().times(-1);
      }
      if ("+".equals(token)) {
        return factor();
      }
      if ("(".equals(token)) {
        LinearExpression inner = expression();
        if (!")".equals(next())) {
          throw error("missing ')'");
        }
        return inner;
      }
      char first = token.charAt(0);
      if (Character.isDigit(first) || first == '.') {
        try {
          return constant(Double.parseDouble(token));
        } catch (NumberFormatException e) {
          throw error("bad number '" + token + "'");
        }
      }
      if (Character.isLetter(first) || first == '_') {
        return of(token);
      }
      throw error("unexpected '" + token + "'");
    }
  }
}
