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

package com.dimensional.common.testing.easymock;

import com.google.common.base.Preconditions;
import com.google.common.reflect.TypeToken;

import org.easymock.IMocksControl;
import org.junit.After;
import org.junit.Before;

import static org.easymock.EasyMock.createControl;

/**
 * A baseclass for tests that use EasyMock.  A new {@link IMocksControl control} is set up before
 * each test and the mocks created and replayed with it are verified after it.
 */
public abstract class EasyMockTest {
  protected IMocksControl control;

  @Before
  public final void setupEasyMock() {
    control = createControl();
  }

  @After
  public final void verifyEasyMock() {
    control.verify();
  }

  /**
   * Creates an EasyMock mock with this test's control.
   */
  public <T> T createMock(Class<T> type) {
    Preconditions.checkNotNull(type);
    return control.createMock(type);
  }

  /**
   * Creates a mock of a parameterized type without unchecked conversion warnings at the call
   * site.  To mock a {@code Supplier<String>} use:
   * {@code createMock(new TypeToken<Supplier<String>>() {})}
   */
  public <T> T createMock(TypeToken<T> type) {
    Preconditions.checkNotNull(type);
    @SuppressWarnings("unchecked")
    Class<T> rawType = (Class<T>) type.getRawType();
    return control.createMock(rawType);
  }
}
