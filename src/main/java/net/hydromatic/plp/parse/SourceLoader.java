/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.plp.parse;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.plp.ast.NodeKind;
import net.hydromatic.plp.ast.Syntax.Tree;
import net.hydromatic.plp.ast.SyntaxNode;
import net.hydromatic.plp.util.Prop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads probabilistic logic programs from files or strings and parses them
 * into a single syntax tree.
 *
 * <p>When several files are read, each is parsed on its own and the trees are
 * merged into the first: each statement of a later tree is appended unless a
 * structurally equal statement is already present.
 */
public class SourceLoader {
  private static final Logger LOG = LoggerFactory.getLogger(SourceLoader.class);

  private final Charset charset;
  private final boolean deduplicate;

  /** Creates a SourceLoader with default properties. */
  public SourceLoader() {
    this(ImmutableMap.of());
  }

  /** Creates a SourceLoader configured by a property map. */
  public SourceLoader(Map<Prop, Object> map) {
    this.charset = Prop.CHARSET.charsetValue(map);
    this.deduplicate = Prop.DEDUPLICATE.booleanValue(map);
  }

  /**
   * Parses a string.
   *
   * @param text Program text
   * @param file Name used in positions and error messages
   * @return Syntax tree whose root has kind {@link NodeKind#PLP}
   * @throws PlpParseException if the text is not a valid program
   */
  public static Tree parse(String text, String file) {
    requireNonNull(text, "text");
    try {
      return PlpParserImpl.parse(text, file);
    } catch (ParseException e) {
      throw PlpParseException.of(e, file);
    } catch (TokenMgrError e) {
      throw PlpParseException.of(e, file);
    }
  }

  /**
   * Reads and parses files, merging their trees into one.
   *
   * @throws NoInputException if the list is empty
   * @throws PlpParseException if a file is not a valid program
   * @throws UncheckedIOException if a file cannot be read
   */
  public Tree read(List<Path> files) {
    Tree tree = null;
    for (Path file : files) {
      final String text;
      try {
        text = Files.readString(file, charset);
      } catch (IOException e) {
        throw new UncheckedIOException("Error reading " + file, e);
      }
      final Tree u = parse(text, file.toString());
      LOG.debug("Parsed {}: {} statements", file, u.children.size());
      tree = tree == null ? u : merge(tree, u);
    }
    if (tree == null) {
      throw new NoInputException("No file read");
    }
    return tree;
  }

  /**
   * Parses blocks of program text as a single unit, joining them with line
   * breaks.
   *
   * @throws NoInputException if there are no blocks
   * @throws PlpParseException if the text is not a valid program
   */
  public Tree readString(List<String> blocks) {
    if (blocks.isEmpty()) {
      throw new NoInputException("No text block given");
    }
    return parse(String.join("\n", blocks), "");
  }

  /**
   * Merges the statements of {@code other} into {@code tree}, returning a new
   * tree with the position of {@code tree}.
   *
   * <p>If deduplication is enabled, a statement of {@code other} is skipped if
   * it is structurally equal to a statement already in the result.
   */
  public Tree merge(Tree tree, Tree other) {
    checkArgument(tree.kind == NodeKind.PLP, "not a program: %s", tree.kind);
    checkArgument(other.kind == NodeKind.PLP, "not a program: %s", other.kind);
    if (!deduplicate) {
      return tree.copy(
          ImmutableList.<SyntaxNode>builder()
              .addAll(tree.children)
              .addAll(other.children)
              .build());
    }
    final List<SyntaxNode> children = new ArrayList<>(tree.children);
    final Set<SyntaxNode> seen = new LinkedHashSet<>(tree.children);
    int skipped = 0;
    for (SyntaxNode child : other.children) {
      if (seen.add(child)) {
        children.add(child);
      } else {
        ++skipped;
      }
    }
    LOG.debug(
        "Merged {} statements, skipped {} duplicates",
        other.children.size() - skipped,
        skipped);
    return tree.copy(children);
  }
}

// End SourceLoader.java
