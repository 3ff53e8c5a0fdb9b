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

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Table;

import com.dimensional.common.quantity.Quantity;
import com.dimensional.common.quantity.QuantityType;
import com.dimensional.common.quantity.Unit;

import static com.dimensional.common.quantity.QuantityType.ACCELERATION;
import static com.dimensional.common.quantity.QuantityType.AREA;
import static com.dimensional.common.quantity.QuantityType.DURATION;
import static com.dimensional.common.quantity.QuantityType.FORCE;
import static com.dimensional.common.quantity.QuantityType.LENGTH;
import static com.dimensional.common.quantity.QuantityType.MASS;
import static com.dimensional.common.quantity.QuantityType.SPEED;
import static com.dimensional.common.quantity.QuantityType.TORQUE;
import static com.dimensional.common.quantity.QuantityType.VOLUME;

/**
 * The closed set of rules that multiply and divide quantities of different types into quantities
 * of a third type, eg: length ÷ duration = speed.
 *
 * <p>A network is declared as products only.  Declaring {@code A × B = C} defines {@code A × B},
 * {@code B × A}, {@code C ÷ A = B} and {@code C ÷ B = A}, so every product can be undone by a
 * division and no division exists without its product.  Declarations that would give one pair of
 * operand types two different results are rejected when the network is built.
 *
 * <p>Networks are immutable and thread-safe.
 */
public class OperatorNetwork {

  private static final Logger LOG = Logger.getLogger(OperatorNetwork.class.getName());

  private final ImmutableList<OperatorRule> products;
  private final ImmutableMap<Operator, ImmutableTable<QuantityType<?>, QuantityType<?>,
      OperatorRule>> rules;
  private final ZeroDivisorPolicy zeroDivisorPolicy;

  private OperatorNetwork(ImmutableList<OperatorRule> products,
      ImmutableMap<Operator, ImmutableTable<QuantityType<?>, QuantityType<?>, OperatorRule>> rules,
      ZeroDivisorPolicy zeroDivisorPolicy) {
    this.products = products;
    this.rules = rules;
    this.zeroDivisorPolicy = zeroDivisorPolicy;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the network of the quantity types shipped with this library.
   *
   * @param zeroDivisorPolicy what divisions by zero do
   */
  public static OperatorNetwork standard(ZeroDivisorPolicy zeroDivisorPolicy) {
    return builder()
        .product(LENGTH, LENGTH, AREA)
        .product(AREA, LENGTH, VOLUME)
        .product(SPEED, DURATION, LENGTH)
        .product(ACCELERATION, DURATION, SPEED)
        .product(MASS, ACCELERATION, FORCE)
        .product(FORCE, LENGTH, TORQUE)
        .zeroDivisorPolicy(zeroDivisorPolicy)
        .build();
  }

  public static OperatorNetwork standard() {
    return standard(ZeroDivisorPolicy.THROW);
  }

  /**
   * Returns the products the network was declared with, in declaration order.
   */
  public ImmutableList<OperatorRule> getProducts() {
    return products;
  }

  /**
   * Returns every rule of the network, declared and derived.
   */
  public ImmutableSet<OperatorRule> getRules() {
    ImmutableSet.Builder<OperatorRule> all = ImmutableSet.builder();
    for (ImmutableTable<QuantityType<?>, QuantityType<?>, OperatorRule> table : rules.values()) {
      all.addAll(table.values());
    }
    return all.build();
  }

  public ZeroDivisorPolicy getZeroDivisorPolicy() {
    return zeroDivisorPolicy;
  }

  public Optional<OperatorRule> getRule(QuantityType<?> left, Operator operator,
      QuantityType<?> right) {
    return Optional.fromNullable(rules.get(operator).get(left, right));
  }

  /**
   * Multiplies quantities of two types, selecting the rule by their runtime types.
   *
   * @throws UndefinedOperationException if the network has no rule for the operand types
   * @throws UndefinedResultException if the operands have no defined product, eg: infinity
   *     times zero
   */
  public Quantity<?> multiply(Quantity<?> left, Quantity<?> right) {
    return apply(rule(left, Operator.MULTIPLY, right), left, right);
  }

  /**
   * Divides a quantity by a quantity of another type, selecting the rule by their runtime types.
   *
   * @throws UndefinedOperationException if the network has no rule for the operand types
   * @throws DivisionByZeroException if {@code right} is zero and the policy demands it
   * @throws UndefinedResultException if the operands have no defined product or quotient
   */
  public Quantity<?> divide(Quantity<?> left, Quantity<?> right) {
    return apply(rule(left, Operator.DIVIDE, right), left, right);
  }

  /**
   * Multiplies quantities of two types into a quantity of {@code resultType}.
   *
   * @throws UndefinedOperationException if no rule combines the operand types into
   *     {@code resultType}
   * @throws UndefinedResultException if the operands have no defined product, eg: infinity
   *     times zero
   */
  public <C extends Unit<C>> Quantity<C> multiply(Quantity<?> left, Quantity<?> right,
      QuantityType<C> resultType) {
    return apply(rule(left, Operator.MULTIPLY, right), left, right, resultType);
  }

  /**
   * Divides a quantity by a quantity of another type into a quantity of {@code resultType}, eg:
   * {@code divide(distance, time, QuantityType.SPEED)}.
   *
   * @throws UndefinedOperationException if no rule combines the operand types into
   *     {@code resultType}
   * @throws DivisionByZeroException if {@code right} is zero and the policy demands it
   * @throws UndefinedResultException if the operands have no defined product or quotient
   */
  public <C extends Unit<C>> Quantity<C> divide(Quantity<?> left, Quantity<?> right,
      QuantityType<C> resultType) {
    return apply(rule(left, Operator.DIVIDE, right), left, right, resultType);
  }

  private OperatorRule rule(Quantity<?> left, Operator operator, Quantity<?> right) {
    Optional<OperatorRule> rule = getRule(left.getType(), operator, right.getType());
    if (!rule.isPresent()) {
      throw new UndefinedOperationException(left.getType(), operator, right.getType());
    }
    return rule.get();
  }

  private Quantity<?> apply(OperatorRule rule, Quantity<?> left, Quantity<?> right) {
    return Quantity.ofBase(evaluate(rule, left, right), rule.getResult());
  }

  private <C extends Unit<C>> Quantity<C> apply(OperatorRule rule, Quantity<?> left,
      Quantity<?> right, QuantityType<C> resultType) {
    if (rule.getResult() != resultType) {
      throw new UndefinedOperationException(rule, resultType);
    }
    return Quantity.ofBase(evaluate(rule, left, right), resultType);
  }

  private double evaluate(OperatorRule rule, Quantity<?> left, Quantity<?> right) {
    double rightBase = right.baseValue();
    if (rule.getOperator() == Operator.DIVIDE && rightBase == 0) {
      double leftBase = left.baseValue();
      if (zeroDivisorPolicy == ZeroDivisorPolicy.THROW || leftBase == 0) {
        throw new DivisionByZeroException(rule);
      }
    }
    double result = rule.apply(left.baseValue(), rightBase);
    if (Double.isNaN(result)) {
      throw new UndefinedResultException(rule, left.baseValue(), rightBase);
    }
    return result;
  }

  /**
   * Builds an {@link OperatorNetwork} from product declarations.
   */
  public static final class Builder {
    private final List<OperatorRule> products = Lists.newArrayList();
    private ZeroDivisorPolicy zeroDivisorPolicy = ZeroDivisorPolicy.THROW;

    private Builder() {
    }

    /**
     * Declares {@code left × right = result}.
     */
    public Builder product(QuantityType<?> left, QuantityType<?> right, QuantityType<?> result) {
      products.add(new OperatorRule(left, Operator.MULTIPLY, right, result));
      return this;
    }

    public Builder zeroDivisorPolicy(ZeroDivisorPolicy zeroDivisorPolicy) {
      this.zeroDivisorPolicy = Preconditions.checkNotNull(zeroDivisorPolicy);
      return this;
    }

    /**
     * Builds the network.
     *
     * @throws IllegalStateException if two declarations contradict each other
     */
    public OperatorNetwork build() {
      Map<Operator, Table<QuantityType<?>, QuantityType<?>, OperatorRule>> byOperator =
          Maps.newEnumMap(Operator.class);
      for (Operator operator : Operator.values()) {
        byOperator.put(operator, HashBasedTable.<QuantityType<?>, QuantityType<?>,
            OperatorRule>create());
      }

      for (OperatorRule product : products) {
        QuantityType<?> a = product.getLeft();
        QuantityType<?> b = product.getRight();
        QuantityType<?> c = product.getResult();
        add(byOperator, new OperatorRule(a, Operator.MULTIPLY, b, c));
        add(byOperator, new OperatorRule(b, Operator.MULTIPLY, a, c));
        add(byOperator, new OperatorRule(c, Operator.DIVIDE, a, b));
        add(byOperator, new OperatorRule(c, Operator.DIVIDE, b, a));
      }

      ImmutableMap.Builder<Operator, ImmutableTable<QuantityType<?>, QuantityType<?>,
          OperatorRule>> rules = ImmutableMap.builder();
      int count = 0;
      for (Map.Entry<Operator, Table<QuantityType<?>, QuantityType<?>, OperatorRule>> entry
          : byOperator.entrySet()) {
        rules.put(entry.getKey(), ImmutableTable.copyOf(entry.getValue()));
        count += entry.getValue().size();
      }
      LOG.fine("Built operator network with " + count + " rules from " + products.size()
          + " products");
      return new OperatorNetwork(ImmutableList.copyOf(products), rules.build(),
          zeroDivisorPolicy);
    }

    private static void add(Map<Operator, Table<QuantityType<?>, QuantityType<?>,
        OperatorRule>> byOperator, OperatorRule rule) {
      Table<QuantityType<?>, QuantityType<?>, OperatorRule> table =
          byOperator.get(rule.getOperator());
      OperatorRule existing = table.get(rule.getLeft(), rule.getRight());
      if (existing == null) {
        table.put(rule.getLeft(), rule.getRight(), rule);
      } else if (existing.getResult() != rule.getResult()) {
        throw new IllegalStateException(
            String.format("Contradictory rules: %s and %s", existing, rule));
      }
    }
  }
}
