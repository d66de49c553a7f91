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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.devtools.lrgen.codegen.CodeGenLogger.infofmt;
import static com.google.devtools.lrgen.codegen.CodeGenLogger.warnfmt;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;
import com.google.devtools.lrgen.model.AnalysisContext;
import com.google.devtools.lrgen.model.Grammar;
import freemarker.template.Configuration;
import freemarker.template.DefaultObjectWrapper;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import freemarker.template.Version;
import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.util.Locale;
import java.util.Map;

/**
 * Generates the parser source (and optionally its header) from the analysis results.
 *
 * <p>Each document is produced in two steps. The skeleton is first executed with the context,
 * the grammar and a {@link ParserOutput} bound as {@code context}, {@code grammar} and {@code
 * output}. The executed text still holds {@link Placeholder} markers, which are then resolved by a
 * {@link PlaceholderResolver} against the path of that document.
 *
 * <p>Both documents are fully generated before anything is written, so a failure leaves the
 * sinks untouched.
 */
public final class SkeletonRenderer {
  /** Operation name passed to the {@link DurationReporter}. */
  static final String RENDER_OPERATION = "render";

  private static final Version FREEMARKER_VERSION = Configuration.VERSION_2_3_32;

  /**
   * Code generator configuration.
   */
  private final CodeGenConfig config;

  /**
   * Receives the time spent in each render.
   */
  private final DurationReporter durationReporter;

  /**
   * Template engine configuration. Parsed skeletons are cached here across renders.
   */
  private final Configuration templates;

  /**
   * Creates a renderer loading skeletons from the directory set in {@code config}, or from the
   * class path if it sets none.
   *
   * @throws IOException if the template directory can't be used
   */
  public SkeletonRenderer(CodeGenConfig config, DurationReporter durationReporter)
      throws IOException {
    this.config = checkNotNull(config);
    this.durationReporter = checkNotNull(durationReporter);

    templates = new Configuration(FREEMARKER_VERSION);
    if (config.getTemplateDirectory() != null) {
      templates.setDirectoryForTemplateLoading(new File(config.getTemplateDirectory()));
    } else {
      templates.setClassForTemplateLoading(getClass(), "");
    }

    templates.setObjectWrapper(new DefaultObjectWrapper(FREEMARKER_VERSION));
    templates.setDefaultEncoding(UTF_8.name());
    templates.setLocale(Locale.ROOT);
    templates.setLocalizedLookup(false);
    // Skeletons only use <#...> directives; [@oline@] markers must stay plain text.
    templates.setTagSyntax(Configuration.ANGLE_BRACKET_TAG_SYNTAX);
    templates.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
    templates.setLogTemplateExceptions(false);
    templates.setWrapUncheckedExceptions(true);
  }

  /**
   * Generates the parser.
   *
   * @param target where to write the generated files
   * @param grammarFilePath path of the grammar file used in {@code #line} directives
   * @param context result of the grammar analysis
   * @param grammar the analyzed grammar
   * @throws IOException if a skeleton can't be read or the output can't be written
   * @throws TemplateException if a skeleton fails to execute (including invalid inputs)
   */
  public void render(
      RenderTarget target, String grammarFilePath, AnalysisContext context, Grammar grammar)
      throws IOException, TemplateException {
    Stopwatch stopwatch = Stopwatch.createStarted();

    String headerFilePath = target.getHeaderFilePath();
    ParserOutput output =
        new ParserOutput(
            context, grammar, grammarFilePath, config.getTemplateName(), headerFilePath);

    Map<String, Object> data =
        ImmutableMap.<String, Object>of("context", context, "grammar", grammar, "output", output);

    String body = generate(config.getTemplateName(), data, target.getOutputFilePath());
    String header = null;
    if (headerFilePath != null) {
      header = generate(config.getHeaderTemplateName(), data, headerFilePath);
    }

    target.getOut().append(body);

    if (header != null) {
      if (target.getHeaderOut() != null) {
        target.getHeaderOut().append(header);
      } else {
        writeFile(header, headerFilePath);
      }
    }

    durationReporter.reportDuration(RENDER_OPERATION, stopwatch.elapsed());
  }

  /**
   * Executes one skeleton and resolves its markers against {@code outputFilePath}.
   */
  String generate(String templateName, Map<String, Object> data, String outputFilePath)
      throws IOException, TemplateException {
    Template template = templates.getTemplate(templateName);

    StringWriter writer = new StringWriter();
    template.process(data, writer);

    String text = new PlaceholderResolver(outputFilePath).resolve(writer.toString());
    infofmt("Generated %s from skeleton %s", outputFilePath, templateName);
    return text;
  }

  private static void writeFile(String text, String path) throws IOException {
    try {
      Files.asCharSink(new File(path), UTF_8).write(text);
    } catch (IOException e) {
      warnfmt(e, "Failed to write %s", path);
      throw e;
    }
  }
}
