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

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;

import com.dimensional.common.quantity.Quantity;
import com.dimensional.common.quantity.Unit;

/**
 * The outcome of a parse attempt: either a quantity and the way it was recognized, or a
 * {@link ParseFailure} explaining what was tried.
 *
 * @param <U> the unit type of the parsed quantity
 */
public final class ParseResult<U extends Unit<U>> {

  /**
   * How a successfully parsed text was recognized.
   */
  public enum Path {
    /** A number and a single unit abbreviation. */
    SINGLE_UNIT,
    /** Several parts matched by a {@link CompositeGrammar}. */
    COMPOSITE
  }

  @Nullable private final Quantity<U> quantity;
  @Nullable private final Path path;
  @Nullable private final ParseFailure failure;

  private ParseResult(@Nullable Quantity<U> quantity, @Nullable Path path,
      @Nullable ParseFailure failure) {
    this.quantity = quantity;
    this.path = path;
    this.failure = failure;
  }

  static <U extends Unit<U>> ParseResult<U> success(Quantity<U> quantity, Path path) {
    return new ParseResult<U>(Preconditions.checkNotNull(quantity),
        Preconditions.checkNotNull(path), null);
  }

  static <U extends Unit<U>> ParseResult<U> failure(ParseFailure failure) {
    return new ParseResult<U>(null, null, Preconditions.checkNotNull(failure));
  }

  public boolean isSuccess() {
    return quantity != null;
  }

  /**
   * Returns the parsed quantity.
   *
   * @throws IllegalStateException if the parse failed
   */
  public Quantity<U> getQuantity() {
    Preconditions.checkState(quantity != null, "No quantity was parsed: %s", failure);
    return quantity;
  }

  public Optional<Quantity<U>> asOptional() {
    return Optional.fromNullable(quantity);
  }

  /**
   * Returns how the quantity was recognized.
   *
   * @throws IllegalStateException if the parse failed
   */
  public Path getPath() {
    Preconditions.checkState(path != null, "No quantity was parsed: %s", failure);
    return path;
  }

  /**
   * Returns the failure description.
   *
   * @throws IllegalStateException if the parse succeeded
   */
  public ParseFailure getFailure() {
    Preconditions.checkState(failure != null, "Parse succeeded with %s", quantity);
    return failure;
  }

  @Override
  public String toString() {
    return isSuccess() ? "Parsed " + quantity + " via " + path : failure.describe();
  }
}
