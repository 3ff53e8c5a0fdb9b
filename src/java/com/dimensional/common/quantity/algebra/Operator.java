// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.dimensional.common.quantity.algebra;

/**
 * The operators of the dimensional network.  Addition and subtraction only combine quantities of
 * one type and live on {@link com.dimensional.common.quantity.Quantity} instead.
 */
public enum Operator {
  MULTIPLY("×") {
    @Override double apply(double left, double right) {
      return left * right;
    }
  },
  DIVIDE("÷") {
    @Override double apply(double left, double right) {
      return left / right;
    }
  };

  private final String symbol;

  private Operator(String symbol) {
    this.symbol = symbol;
  }

  abstract double apply(double left, double right);

  public String symbol() {
    return symbol;
  }
}
