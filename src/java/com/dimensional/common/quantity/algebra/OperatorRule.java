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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

import com.dimensional.common.quantity.QuantityType;

/**
 * A rule of the dimensional network: {@code left operator right = result}.  The rule applies its
 * operator directly to base unit values and the result is in the base unit of the result type, eg:
 * meters divided by seconds gives meters per second.
 */
public final class OperatorRule {

  private final QuantityType<?> left;
  private final Operator operator;
  private final QuantityType<?> right;
  private final QuantityType<?> result;

  OperatorRule(QuantityType<?> left, Operator operator, QuantityType<?> right,
      QuantityType<?> result) {
    this.left = Preconditions.checkNotNull(left);
    this.operator = Preconditions.checkNotNull(operator);
    this.right = Preconditions.checkNotNull(right);
    this.result = Preconditions.checkNotNull(result);
  }

  public QuantityType<?> getLeft() {
    return left;
  }

  public Operator getOperator() {
    return operator;
  }

  public QuantityType<?> getRight() {
    return right;
  }

  public QuantityType<?> getResult() {
    return result;
  }

  /**
   * Applies this rule to operands in base units.
   *
   * @param leftBase the left operand in the base unit of {@link #getLeft()}
   * @param rightBase the right operand in the base unit of {@link #getRight()}
   * @return the result in the base unit of {@link #getResult()}
   */
  public double apply(double leftBase, double rightBase) {
    return operator.apply(leftBase, rightBase);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof OperatorRule)) {
      return false;
    }
    OperatorRule other = (OperatorRule) obj;
    return left == other.left && operator == other.operator && right == other.right
        && result == other.result;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(left, operator, right, result);
  }

  @Override
  public String toString() {
    return String.format("%s %s %s = %s", left, operator.symbol(), right, result);
  }
}
