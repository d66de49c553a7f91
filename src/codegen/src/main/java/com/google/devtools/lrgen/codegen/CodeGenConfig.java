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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.devtools.lrgen.codegen.CodeGenLogger.infofmt;
import static com.google.devtools.lrgen.codegen.CodeGenLogger.warnfmt;

import com.google.common.base.Strings;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * Code generator configuration.
 *
 * <p>An example of a JSON configuration would be:
 *
 * <pre>
 * {
 *   "templateDirectory": "/usr/share/lrgen/templates",
 *   "templateName": "bison/yacc.c",
 *   "headerTemplateName": "bison/yacc.h"
 * }
 * </pre>
 *
 * <p>All keys are optional. Without a template directory the skeletons bundled with the code
 * generator are used.
 */
public final class CodeGenConfig {
  static final String DEFAULT_TEMPLATE_NAME = "bison/yacc.c";
  static final String DEFAULT_HEADER_TEMPLATE_NAME = "bison/yacc.h";

  /**
   * Directory holding the skeletons or null to load them from the class path.
   */
  private String templateDirectory;

  /**
   * Skeleton of the parser implementation, relative to the template directory.
   */
  private String templateName = DEFAULT_TEMPLATE_NAME;

  /**
   * Skeleton of the parser header, relative to the template directory.
   */
  private String headerTemplateName = DEFAULT_HEADER_TEMPLATE_NAME;

  // Used by Gson.
  private CodeGenConfig() {}

  public CodeGenConfig(String templateDirectory, String templateName, String headerTemplateName) {
    checkArgument(!Strings.isNullOrEmpty(templateName), "Template name must not be empty");
    checkArgument(
        !Strings.isNullOrEmpty(headerTemplateName), "Header template name must not be empty");
    this.templateDirectory = templateDirectory;
    this.templateName = templateName;
    this.headerTemplateName = headerTemplateName;
  }

  /** Gets the configuration using the bundled skeletons. */
  public static CodeGenConfig defaults() {
    return new CodeGenConfig();
  }

  /**
   * Parses a JSON configuration.
   *
   * @throws CodeGenConfigException if the JSON can't be parsed or names an empty template
   */
  public static CodeGenConfig fromJson(String json) throws CodeGenConfigException {
    CodeGenConfig config;
    try {
      config = new Gson().fromJson(json, CodeGenConfig.class);
    } catch (JsonParseException e) {
      warnfmt(e, "Failed to parse code generator configuration");
      throw new CodeGenConfigException("Malformed code generator configuration: " + e, e);
    }

    if (config == null) {
      // Nothing was loaded
      config = defaults();
    }

    config.validate();

    infofmt(
        "Code generator configuration loaded, templates from %s",
        (config.templateDirectory != null) ? config.templateDirectory : "class path");
    return config;
  }

  private void validate() throws CodeGenConfigException {
    if (Strings.isNullOrEmpty(templateName)) {
      throw new CodeGenConfigException("Template name must not be empty");
    }

    if (Strings.isNullOrEmpty(headerTemplateName)) {
      throw new CodeGenConfigException("Header template name must not be empty");
    }
  }

  /** Gets the template directory or null if the bundled skeletons are used. */
  public String getTemplateDirectory() {
    return templateDirectory;
  }

  public String getTemplateName() {
    return templateName;
  }

  public String getHeaderTemplateName() {
    return headerTemplateName;
  }
}
