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
package net.hydromatic.plp.compile;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.plp.compile.TreePredicates.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.plp.ast.NodeKind;
import net.hydromatic.plp.ast.Sign;
import net.hydromatic.plp.ast.Syntax.Leaf;
import net.hydromatic.plp.ast.Syntax.Tree;
import net.hydromatic.plp.ast.SyntaxNode;
import net.hydromatic.plp.ast.TokenKind;
import net.hydromatic.plp.program.CredalFact;
import net.hydromatic.plp.program.ProbFact;
import net.hydromatic.plp.program.ProbRule;
import net.hydromatic.plp.program.Program;
import net.hydromatic.plp.program.Query;
import net.hydromatic.plp.util.Prop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transforms the syntax tree of a probabilistic logic program into a
 * {@link Program}.
 *
 * <p>Each production is folded bottom-up: terms and literals into text plus
 * a flag saying whether they are ground, heads and bodies additionally into
 * the list of their non-ground arguments, and statements into the entities of
 * the program. Statements are added to the program in the order they occur.
 *
 * <p>A transformer generates fresh names, so use a new one for each tree.
 */
public class ProgramTransformer {
  private static final Logger LOG =
      LoggerFactory.getLogger(ProgramTransformer.class);

  private final String unifyFunction;
  private final NameGenerator nameGenerator;

  /** Creates a ProgramTransformer with default properties. */
  public ProgramTransformer() {
    this(ImmutableMap.of());
  }

  /** Creates a ProgramTransformer configured by a property map. */
  public ProgramTransformer(Map<Prop, Object> map) {
    this.unifyFunction = Prop.UNIFY_FUNCTION.stringValue(map);
    this.nameGenerator =
        new NameGenerator(Prop.PROP_FACT_PREFIX.stringValue(map));
  }

  /**
   * Transforms a program tree.
   *
   * @param plp Tree of kind {@link NodeKind#PLP}
   * @return Program; never partial
   * @throws InvalidNodeException if the tree is malformed
   * @throws UnsafeRuleException if a probabilistic rule with variables has an
   *     empty body
   */
  public Program transform(SyntaxNode plp) {
    final Tree tree = expect(plp, NodeKind.PLP);
    final Program.Builder b = Program.builder();
    for (SyntaxNode statement : tree.children) {
      statement(b, statement);
    }
    final Program program = b.build();
    LOG.debug(
        "Transformed {} statements: {} probabilistic facts, "
            + "{} probabilistic rules, {} queries, {} credal facts",
        tree.children.size(),
        program.probFacts.size(),
        program.probRules.size(),
        program.queries.size(),
        program.credalFacts.size());
    return program;
  }

  private void statement(Program.Builder b, SyntaxNode x) {
    if (!(x instanceof Tree)) {
      throw new InvalidNodeException("Expected a statement", x);
    }
    final Tree tree = (Tree) x;
    switch (tree.kind) {
      case FACT:
        b.addClause(fact(tree));
        break;
      case PFACT:
        b.addProbFact(pfact(tree));
        break;
      case CFACT:
        b.addCredalFact(cfact(tree));
        break;
      case RULE:
        b.addClause(rule(tree));
        break;
      case PRULE:
        b.addProbRule(prule(tree));
        break;
      case CONSTRAINT:
        b.addClause(constraint(tree));
        break;
      case QUERY:
        b.addQuery(query(tree));
        break;
      default:
        throw new InvalidNodeException("Expected a statement", x);
    }
  }

  // Statements.

  /** Folds a fact into {@code a.}. */
  String fact(SyntaxNode x) {
    final Tree tree = expect(x, NodeKind.FACT, 1);
    return literal(tree.child(0)).text + ".";
  }

  /** Folds a probabilistic fact. */
  ProbFact pfact(SyntaxNode x) {
    final Tree tree = expect(x, NodeKind.PFACT, 2);
    final String p = prob(tree.child(0));
    return probFact(tree, literal(tree.child(1)).text, p);
  }

  /** Folds a credal fact. */
  CredalFact cfact(SyntaxNode x) {
    final Tree tree = expect(x, NodeKind.CFACT, 3);
    return new CredalFact(
        literal(tree.child(2)).text, prob(tree.child(0)), prob(tree.child(1)));
  }

  /** Folds a rule into {@code h :- b.}. */
  String rule(SyntaxNode x) {
    final Tree tree = expect(x, NodeKind.RULE, 2);
    return head(tree.child(0)).text + " :- " + body(tree.child(1)).text + ".";
  }

  /** Folds an integrity constraint into {@code :- b.}. */
  String constraint(SyntaxNode x) {
    final Tree tree = expect(x, NodeKind.CONSTRAINT, 1);
    return ":- " + body(tree.child(0)).text + ".";
  }

  /** Folds a query, separating positive and negative literals. */
  Query query(SyntaxNode x) {
    final Tree tree = expect(x, NodeKind.QUERY);
    final List<String> positive = new ArrayList<>();
    final List<String> negative = new ArrayList<>();
    for (SyntaxNode child : tree.children) {
      final Literal literal = literal(child);
      switch (literal.sign) {
        case POSITIVE:
          positive.add(literal.atom);
          break;
        case NEGATIVE:
          negative.add(literal.atom);
          break;
        case NOT_APPLICABLE:
        default:
          throw new InvalidNodeException(
              "Query literal must be an atom", child);
      }
    }
    return new Query(positive, negative);
  }

  /**
   * Folds a probabilistic rule.
   *
   * <p>If neither head nor body has variables, the rule is propositional and
   * becomes a fresh probabilistic fact {@code u} plus the rule
   * {@code h :- b, u.}. Otherwise it gets a {@link UnifyClause}.
   */
  ProbRule prule(SyntaxNode x) {
    final Tree tree = expect(x, NodeKind.PRULE, 3);
    final String id = prob(tree.child(0));
    final Head head = ohead(tree.child(1));
    final Body body = body(tree.child(2));
    final String rule = head.text + " :- " + body.text;
    if (head.ground && body.ground) {
      final String u = nameGenerator.get();
      return ProbRule.propositional(
          id, rule, rule + ", " + u + ".", probFact(tree, u, id));
    }
    if (body.size == 0) {
      throw new UnsafeRuleException(
          "Probabilistic rule with variables has an empty body: " + rule,
          tree.pos);
    }
    final UnifyClause unify =
        new UnifyClause(
            unifyFunction,
            id,
            head.name,
            head.nonGroundArgs,
            body.nonGroundArgs,
            body.text);
    return ProbRule.parameterized(id, rule, unify.toString());
  }

  // Parts of statements.

  /** Folds the head of a rule. */
  Literal head(SyntaxNode x) {
    final Tree tree = expect(x, NodeKind.HEAD, 1);
    return literal(tree.child(0));
  }

  /**
   * Folds the head of a probabilistic rule. The non-ground arguments are
   * those that contain a variable, in order.
   */
  Head ohead(SyntaxNode x) {
    final Tree tree = expect(x, NodeKind.OHEAD);
    final String name = name(tree, 0);
    if (tree.children.size() == 1) {
      return new Head(name, true, name, ImmutableList.of());
    }
    final Args args = args(tree.children.subList(1, tree.children.size()));
    return new Head(
        name + "(" + args.text + ")", args.ground, name, args.nonGround);
  }

  /**
   * Folds a body. The non-ground arguments are those of its atoms and
   * predicates; comparisons contribute none.
   */
  Body body(SyntaxNode x) {
    final Tree tree = expect(x, NodeKind.BODY);
    final List<String> texts = new ArrayList<>();
    final ImmutableList.Builder<String> nonGround = ImmutableList.builder();
    boolean ground = true;
    for (SyntaxNode child : tree.children) {
      final Literal literal = literal(child);
      texts.add(literal.text);
      ground &= literal.ground;
      nonGround.addAll(literal.nonGroundArgs);
    }
    return new Body(
        String.join(", ", texts),
        ground,
        tree.children.size(),
        nonGround.build());
  }

  // Literals and terms.

  /** Folds an atom or predicate, possibly negated, or a comparison. */
  Literal literal(SyntaxNode x) {
    switch (TreePredicates.sign(x)) {
      case POSITIVE:
        return literal((Tree) x, Sign.POSITIVE, 0);
      case NEGATIVE:
        return literal((Tree) x, Sign.NEGATIVE, 1);
      case NOT_APPLICABLE:
      default:
        if (is(x, NodeKind.BOP)) {
          final Fragment f = term(x);
          return new Literal(
              f.text,
              f.ground,
              Sign.NOT_APPLICABLE,
              f.text,
              ImmutableList.of());
        }
        throw new InvalidNodeException("Expected a literal", x);
    }
  }

  private Literal literal(Tree tree, Sign sign, int nameIndex) {
    final String name = name(tree, nameIndex);
    final List<SyntaxNode> argNodes =
        tree.children.subList(nameIndex + 1, tree.children.size());
    if (TreePredicates.isAtom(tree) && !argNodes.isEmpty()) {
      throw new InvalidNodeException("Atom must not have arguments", tree);
    }
    final String atom;
    final boolean ground;
    final List<String> nonGround;
    if (argNodes.isEmpty()) {
      atom = name;
      ground = true;
      nonGround = ImmutableList.of();
    } else {
      final Args args = args(argNodes);
      atom = name + "(" + args.text + ")";
      ground = args.ground;
      nonGround = args.nonGround;
    }
    final String text = sign == Sign.NEGATIVE ? "not " + atom : atom;
    return new Literal(text, ground, sign, atom, nonGround);
  }

  /** Folds a list of arguments. */
  private Args args(List<SyntaxNode> argNodes) {
    final List<String> texts = new ArrayList<>();
    final ImmutableList.Builder<String> nonGround = ImmutableList.builder();
    boolean ground = true;
    for (SyntaxNode arg : argNodes) {
      final Fragment f = term(arg);
      texts.add(f.text);
      ground &= f.ground;
      if (Groundedness.isNonGround(arg)) {
        nonGround.add(f.text);
      }
    }
    return new Args(String.join(", ", texts), ground, nonGround.build());
  }

  /** Folds a term: a constant, variable, interval or arithmetic expression. */
  Fragment term(SyntaxNode x) {
    if (x instanceof Leaf) {
      final Leaf leaf = (Leaf) x;
      switch (leaf.kind) {
        case CONST:
        case ID:
          return new Fragment(leaf.text, true);
        case VAR:
          return new Fragment(leaf.text, false);
        default:
          throw new InvalidNodeException("Expected a term", x);
      }
    }
    final Tree tree = (Tree) x;
    switch (tree.kind) {
      case INTERVAL:
        // Checks the shape; the bounds keep their text.
        TreePredicates.expandInterval(tree);
        return new Fragment(
            ((Leaf) tree.child(0)).text + ".." + ((Leaf) tree.child(1)).text,
            true);
      case BOP:
        final List<String> texts = new ArrayList<>();
        boolean ground = true;
        for (SyntaxNode child : tree.children) {
          if (is(child, TokenKind.OP)) {
            texts.add(((Leaf) child).text);
          } else {
            final Fragment f = term(child);
            texts.add(f.text);
            ground &= f.ground;
          }
        }
        return new Fragment(String.join(" ", texts), ground);
      default:
        throw new InvalidNodeException("Expected a term", x);
    }
  }

  // Utilities.

  /** Returns the text of a probability token. */
  private static String prob(SyntaxNode x) {
    if (!is(x, TokenKind.PROB)) {
      throw new InvalidNodeException("Expected a probability", x);
    }
    return ((Leaf) x).text;
  }

  private static ProbFact probFact(Tree tree, String atom, String p) {
    try {
      return ProbFact.of(atom, p);
    } catch (NumberFormatException e) {
      throw new InvalidNodeException("Probability is not a number", tree);
    }
  }

  /** Returns the text of the name token that is the {@code i}th child. */
  private static String name(Tree tree, int i) {
    if (tree.children.size() <= i || !is(tree.child(i), TokenKind.ID)) {
      throw new InvalidNodeException("Expected a name", tree);
    }
    return ((Leaf) tree.child(i)).text;
  }

  private static Tree expect(SyntaxNode x, NodeKind kind) {
    if (!is(x, kind)) {
      throw new InvalidNodeException("Expected " + kind.lowerName(), x);
    }
    return (Tree) x;
  }

  private static Tree expect(SyntaxNode x, NodeKind kind, int childCount) {
    final Tree tree = expect(x, kind);
    if (tree.children.size() != childCount) {
      throw new InvalidNodeException(
          "Expected " + kind.lowerName() + " with " + childCount + " children",
          x);
    }
    return tree;
  }

  /** Result of folding a term: its text and whether it is ground. */
  static class Fragment {
    final String text;
    final boolean ground;

    Fragment(String text, boolean ground) {
      this.text = requireNonNull(text);
      this.ground = ground;
    }
  }

  /** Result of folding a literal. */
  static class Literal extends Fragment {
    /** NOT_APPLICABLE for a comparison. */
    final Sign sign;
    /** The text without {@code not}. */
    final String atom;
    final List<String> nonGroundArgs;

    Literal(
        String text,
        boolean ground,
        Sign sign,
        String atom,
        List<String> nonGroundArgs) {
      super(text, ground);
      this.sign = requireNonNull(sign);
      this.atom = requireNonNull(atom);
      this.nonGroundArgs = ImmutableList.copyOf(nonGroundArgs);
    }
  }

  /** Result of folding the head of a probabilistic rule. */
  static class Head extends Fragment {
    final String name;
    final List<String> nonGroundArgs;

    Head(String text, boolean ground, String name, List<String> nonGroundArgs) {
      super(text, ground);
      this.name = requireNonNull(name);
      this.nonGroundArgs = ImmutableList.copyOf(nonGroundArgs);
    }
  }

  /** Result of folding a body. */
  static class Body extends Fragment {
    /** Number of literals. */
    final int size;
    final List<String> nonGroundArgs;

    Body(String text, boolean ground, int size, List<String> nonGroundArgs) {
      super(text, ground);
      this.size = size;
      this.nonGroundArgs = ImmutableList.copyOf(nonGroundArgs);
    }
  }

  /** Result of folding an argument list. */
  private static class Args extends Fragment {
    final List<String> nonGround;

    Args(String text, boolean ground, List<String> nonGround) {
      super(text, ground);
      this.nonGround = nonGround;
    }
  }
}

// End ProgramTransformer.java
