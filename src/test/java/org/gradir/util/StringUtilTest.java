/*
 * Copyright 2025 The Gradir Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.gradir.util;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class StringUtilTest {

  @Test
  public void escape() {
    assertThat(StringUtil.escape("")).isEqualTo("\"\"");
    assertThat(StringUtil.escape("aten::neg")).isEqualTo("\"aten::neg\"");
    assertThat(StringUtil.escape("say \"hi\"")).isEqualTo("\"say \\\"hi\\\"\"");
    assertThat(StringUtil.escape("a\\b")).isEqualTo("\"a\\\\b\"");
    assertThat(StringUtil.escape("1\n2\t3\r")).isEqualTo("\"1\\n2\\t3\\r\"");
    assertThat(StringUtil.escape("\u0001\u007f")).isEqualTo("\"\\u0001\\u007f\"");
    assertThat(StringUtil.escape("é")).isEqualTo("\"é\"");
  }

  @Test
  public void joinTo() {
    StringBuilder sb = new StringBuilder("(");
    StringUtil.joinTo(sb, ImmutableList.of(1, 2, 3), i -> "%" + i).append(")");
    assertThat(sb.toString()).isEqualTo("(%1, %2, %3)");
    ImmutableList<String> empty = ImmutableList.of();
    assertThat(StringUtil.joinTo(new StringBuilder(), empty, s -> s).toString()).isEmpty();
  }
}
