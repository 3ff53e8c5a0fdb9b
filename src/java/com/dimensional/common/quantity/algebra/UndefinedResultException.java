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
 * Thrown when a rule's result is not a number, eg: infinity times zero or infinity divided by
 * infinity.  A quantity can not hold such a value.
 */
public class UndefinedResultException extends ArithmeticException {

  private final OperatorRule rule;

  public UndefinedResultException(OperatorRule rule, double leftBase, double rightBase) {
    super(String.format("%s is undefined for %s and %s", rule, leftBase, rightBase));
    this.rule = rule;
  }

  public OperatorRule getRule() {
    return rule;
  }
}
