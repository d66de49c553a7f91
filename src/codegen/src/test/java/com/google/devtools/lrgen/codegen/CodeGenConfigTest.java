/*
 * Copyright 2024 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.devtools.lrgen.codegen;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.logging.Level;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CodeGenConfigTest {
  @Rule public final LogRecorder log = new LogRecorder();

  @Test
  public void defaults() {
    CodeGenConfig config = CodeGenConfig.defaults();
    assertThat(config.getTemplateDirectory()).isNull();
    assertThat(config.getTemplateName()).isEqualTo("bison/yacc.c");
    assertThat(config.getHeaderTemplateName()).isEqualTo("bison/yacc.h");
  }

  @Test
  public void fromJson() throws Exception {
    CodeGenConfig config =
        CodeGenConfig.fromJson(
            "{ \"templateDirectory\": \"/opt/skeletons\", \"templateName\": \"my/parser.c\" }");

    assertThat(config.getTemplateDirectory()).isEqualTo("/opt/skeletons");
    assertThat(config.getTemplateName()).isEqualTo("my/parser.c");
    assertThat(config.getHeaderTemplateName())
        .isEqualTo(CodeGenConfig.DEFAULT_HEADER_TEMPLATE_NAME);
    assertThat(log.pullOnly().getMessage())
        .isEqualTo("Code generator configuration loaded, templates from /opt/skeletons");
  }

  @Test
  public void emptyObject() throws Exception {
    CodeGenConfig config = CodeGenConfig.fromJson("{}");

    assertThat(config.getTemplateDirectory()).isNull();
    assertThat(config.getTemplateName()).isEqualTo(CodeGenConfig.DEFAULT_TEMPLATE_NAME);
    assertThat(log.pullOnly().getMessage()).endsWith("templates from class path");
  }

  @Test
  public void emptyDocument() throws Exception {
    CodeGenConfig config = CodeGenConfig.fromJson("");

    assertThat(config.getTemplateName()).isEqualTo(CodeGenConfig.DEFAULT_TEMPLATE_NAME);
  }

  @Test
  public void malformedJson() {
    CodeGenConfigException e =
        assertThrows(
            CodeGenConfigException.class, () -> CodeGenConfig.fromJson("{ \"templateName\""));

    assertThat(e).hasMessageThat().startsWith("Malformed code generator configuration");
    assertThat(e).hasCauseThat().isNotNull();
    assertThat(log.pullOnly().getLevel()).isEqualTo(Level.WARNING);
  }

  @Test
  public void emptyTemplateName() {
    CodeGenConfigException e =
        assertThrows(
            CodeGenConfigException.class,
            () -> CodeGenConfig.fromJson("{ \"templateName\": \"\" }"));

    assertThat(e).hasMessageThat().isEqualTo("Template name must not be empty");
  }

  @Test
  public void nullHeaderTemplateName() {
    assertThrows(
        CodeGenConfigException.class,
        () -> CodeGenConfig.fromJson("{ \"headerTemplateName\": null }"));
  }

  @Test
  public void constructorRejectsEmptyNames() {
    assertThrows(IllegalArgumentException.class, () -> new CodeGenConfig(null, "", "a.h"));
    assertThrows(IllegalArgumentException.class, () -> new CodeGenConfig(null, "a.c", null));
  }
}
