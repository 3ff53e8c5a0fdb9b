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
 * Thrown when a quantity is divided by a zero quantity under {@link ZeroDivisorPolicy#THROW}.
 */
public class DivisionByZeroException extends ArithmeticException {

  private final OperatorRule rule;

  public DivisionByZeroException(OperatorRule rule) {
    super("Division by zero " + rule.getRight() + " in " + rule);
    this.rule = rule;
  }

  public OperatorRule getRule() {
    return rule;
  }
}
