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

package com.dimensional.common.application.modules;

import java.util.logging.Logger;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

import com.dimensional.common.quantity.algebra.OperatorNetwork;
import com.dimensional.common.quantity.parse.QuantityFormatter;
import com.dimensional.common.quantity.parse.QuantityParser;
import com.dimensional.common.quantity.table.StandardUnits;
import com.dimensional.common.quantity.table.UnitDefinitionTable;
import com.dimensional.common.util.QuantitySettings;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Binding module for the quantity parser, formatter and operator network.  All of them are
 * singletons built from one {@link UnitDefinitionTable} and one {@link QuantitySettings}.
 *
 * Bindings provided by this module:
 * <ul>
 *   <li>{@code QuantitySettings} - loaded from {@code quantity.properties} unless given.
 *   <li>{@code UnitDefinitionTable} - the {@link StandardUnits standard table} unless given.
 *   <li>{@code QuantityParser} - with the feet/inches composite grammar.
 *   <li>{@code QuantityFormatter}
 *   <li>{@code OperatorNetwork} - the standard network with the configured zero divisor policy.
 * </ul>
 */
public class QuantityModule extends AbstractModule {

  private static final Logger LOG = Logger.getLogger(QuantityModule.class.getName());

  private final QuantitySettings settings;
  private final UnitDefinitionTable table;

  public QuantityModule() {
    this(new QuantitySettings(), StandardUnits.table());
  }

  public QuantityModule(QuantitySettings settings, UnitDefinitionTable table) {
    this.settings = checkNotNull(settings);
    this.table = checkNotNull(table);
  }

  @Override
  protected void configure() {
    LOG.info("Quantity settings: " + settings);
    bind(QuantitySettings.class).toInstance(settings);
    bind(UnitDefinitionTable.class).toInstance(table);
  }

  @Provides
  @Singleton
  QuantityParser provideQuantityParser(UnitDefinitionTable table, QuantitySettings settings) {
    return QuantityParser.builder()
        .table(table)
        .defaultCulture(settings.getDefaultCulture())
        .fallbackCulture(settings.getFallbackCulture())
        .build();
  }

  @Provides
  @Singleton
  QuantityFormatter provideQuantityFormatter(QuantityParser parser, QuantitySettings settings) {
    return new QuantityFormatter(parser.getResolver(), settings.getDefaultCulture());
  }

  @Provides
  @Singleton
  OperatorNetwork provideOperatorNetwork(QuantitySettings settings) {
    return OperatorNetwork.standard(settings.getZeroDivisorPolicy());
  }
}
