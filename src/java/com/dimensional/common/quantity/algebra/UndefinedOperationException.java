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

import com.dimensional.common.quantity.QuantityType;

/**
 * Thrown when two quantity types are combined by an operator the network defines no rule for, or
 * when the rule's result type is not the one the caller asked for.
 */
public class UndefinedOperationException extends IllegalArgumentException {

  public UndefinedOperationException(QuantityType<?> left, Operator operator,
      QuantityType<?> right) {
    super(String.format("No rule for %s %s %s", left, operator.symbol(), right));
  }

  public UndefinedOperationException(OperatorRule rule, QuantityType<?> expectedResult) {
    super(String.format("%s does not produce %s", rule, expectedResult));
  }
}
