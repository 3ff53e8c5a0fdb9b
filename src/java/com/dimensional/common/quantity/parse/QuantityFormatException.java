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

package com.dimensional.common.quantity.parse;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import com.dimensional.common.quantity.QuantityType;

/**
 * Thrown by the parse methods that do not return a {@link ParseResult} when a text is not a
 * quantity of the requested type.
 */
public class QuantityFormatException extends IllegalArgumentException {

  private final ParseFailure failure;

  public QuantityFormatException(ParseFailure failure) {
    super(Preconditions.checkNotNull(failure).describe());
    this.failure = failure;
  }

  @Nullable
  public String getText() {
    return failure.getText();
  }

  public QuantityType<?> getQuantityType() {
    return failure.getQuantityType();
  }

  public ParseFailure getFailure() {
    return failure;
  }
}
