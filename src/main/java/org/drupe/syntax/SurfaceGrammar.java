/*
 * Copyright 2025 The Drupe Authors
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


package org.drupe.syntax;

import static org.drupe.grammar.Rules.keyword;
import static org.drupe.grammar.Rules.lookahead;
import static org.drupe.grammar.Rules.many;
import static org.drupe.grammar.Rules.many1;
import static org.drupe.grammar.Rules.nameExcept;
import static org.drupe.grammar.Rules.op;
import static org.drupe.grammar.Rules.optional;
import static org.drupe.grammar.Rules.ref;
import static org.drupe.grammar.Rules.sepBy1;
import static org.drupe.grammar.Rules.seq;
import static org.drupe.grammar.Rules.token;
import static org.drupe.grammar.Rules.tokenIf;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.drupe.grammar.ParseState;
import org.drupe.grammar.Rule;
import org.drupe.grammar.Rules;
import org.drupe.grammar.Rules.Ref;
import org.drupe.grammar.Separated;
import org.jspecify.annotations.Nullable;

/**
 * The grammar of the surface language, as a graph of {@link Rule}s whose semantic actions build
 * {@link Stmt}, {@link Expr} and {@link Pattern} trees.
 *
 * <p>The rule graph is built once and shared; each parse supplies its own {@link ParseState}.
 * Where two alternatives could both match, the one listed first wins; the comments on individual
 * rules note the orderings that users can observe.
 */
public final class SurfaceGrammar {

  /** Names that can never be identifiers. */
  public static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
          "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
          "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return",
          "try", "while", "with", "yield");

  private static final ImmutableSet<String> CONSTANTS = ImmutableSet.of("None", "True", "False");

  /** Operators that can be written in parentheses as a function, e.g. {@code (+)}. */
  private static final ImmutableSet<String> OPERATOR_SYMBOLS =
      ImmutableSet.of(
          "+", "-", "*", "/", "//", "%", "**", "@", "<<", ">>", "&", "|", "^", "~", "<", ">", "<=",
          ">=", "==", "!=", "|>", "|*>", "<|", "..", "..>", "::");

  private static final ImmutableSet<String> OPERATOR_WORDS =
      ImmutableSet.of("is", "in", "and", "or", "not");

  /** Operator functions that can't be used in a section. */
  private static final ImmutableSet<String> UNARY_ONLY = ImmutableSet.of("~", "not");

  private static final SurfaceGrammar INSTANCE = new SurfaceGrammar();

  private final Rule<ImmutableList<Stmt>> fileInput;
  private final Rule<Expr> expressionInput;

  /** Parses a complete file. */
  public static ImmutableList<Stmt> parseFile(ImmutableList<Token> tokens) {
    return parseFile(new ParseState(tokens));
  }

  /** Parses a complete file using the given state, so that the caller can inspect it afterwards. */
  public static ImmutableList<Stmt> parseFile(ParseState state) {
    return state.parseAll(INSTANCE.fileInput);
  }

  /**
   * Parses a single expression (possibly an unparenthesized tuple) followed by the end of the
   * input.
   */
  public static Expr parseExpression(ImmutableList<Token> tokens) {
    return ParseState.parseAll(INSTANCE.expressionInput, tokens);
  }

  /** Matches any one of the given operators. */
  private static Rule<Token> ops(String... texts) {
    ImmutableSet<String> set = ImmutableSet.copyOf(texts);
    String description = set.stream().map(s -> "'" + s + "'").collect(Collectors.joining(", "));
    return tokenIf(t -> t.kind == TokenKind.OP && set.contains(t.text), description);
  }

  /** Matches any one of the given keywords. */
  private static Rule<Token> keywords(String... texts) {
    ImmutableSet<String> set = ImmutableSet.copyOf(texts);
    String description = set.stream().map(s -> "'" + s + "'").collect(Collectors.joining(", "));
    return tokenIf(t -> t.kind == TokenKind.NAME && set.contains(t.text), description);
  }

  private SurfaceGrammar() {
    Rule<Token> name = nameExcept(KEYWORDS);
    Rule<Token> comma = op(",");
    Rule<Token> newline = token(TokenKind.NEWLINE, "end of line");
    Rule<Token> indent = token(TokenKind.INDENT, "indented block");
    Rule<Token> dedent = token(TokenKind.DEDENT, "dedent");
    Rule<Token> number = token(TokenKind.NUMBER, "number");
    Rule<ImmutableList<Token>> strings = token(TokenKind.STRING, "string").many1();
    Rule<Token> constant =
        tokenIf(t -> t.kind == TokenKind.NAME && CONSTANTS.contains(t.text), "name");

    Ref<Expr> test = ref("test");
    Ref<Expr> orTest = ref("orTest");
    Ref<Expr> bitOr = ref("bitOr");
    Ref<Expr> testlistStar = ref("testlistStar");

    // Comprehensions and argument lists

    Rule<Expr> starExpr = seq(op("*"), bitOr, Expr.Starred::new);
    Rule<Separated<Expr>> testOrStarList =
        sepBy1(Rules.<Expr>choice(test, starExpr), comma, true).memo("testOrStarList");
    testlistStar.set(testOrStarList.mapWithStart(SurfaceGrammar::tupleOrSingle));

    Rule<Expr> exprList =
        sepBy1(Rules.<Expr>choice(starExpr, bitOr), comma, true)
            .mapWithStart(SurfaceGrammar::tupleOrSingle);
    Rule<Expr.CompClause> compFor =
        seq(
            keyword("for"),
            exprList,
            keyword("in"),
            orTest,
            (f, t, in, it) -> new Expr.CompClause(t, it));
    Rule<Expr.CompClause> compIf =
        seq(keyword("if"), orTest, (i, c) -> new Expr.CompClause(null, c));
    Rule<ImmutableList<Expr.CompClause>> compClauses =
        seq(compFor, many(Rules.<Expr.CompClause>choice(compFor, compIf)), SurfaceGrammar::prepend);

    // Keyword arguments are tried before a plain expression, since "x" alone would match "x=1".
    Rule<Arg> argument =
        Rules.<Arg>choice(
            seq(
                test,
                compClauses,
                (e, cs) -> Arg.positional(Expr.Comprehension.bareGenerator(e, cs))),
            seq(name, op("="), test, (n, eq, v) -> new Arg(n, Arg.Kind.KEYWORD, n.text, v)),
            seq(op("**"), test, (s, v) -> new Arg(s, Arg.Kind.DOUBLE_STAR, null, v)),
            seq(op("*"), test, (s, v) -> new Arg(s, Arg.Kind.STAR, null, v)),
            test.map(Arg::positional));
    // "?" parses in any argument list; lowering rejects it outside a partial application.
    Rule<Arg> argumentOrHole =
        Rules.<Arg>choice(op("?").map(q -> new Arg(q, Arg.Kind.HOLE, null, null)), argument);
    Rule<ImmutableList<Arg>> args =
        optional(sepBy1(argumentOrHole, comma, true))
            .map(o -> o.map(s -> s.items).orElse(ImmutableList.of()));

    // Parameters

    Rule<Optional<Expr>> annotation = optional(seq(op(":"), test, (c, e) -> e));
    Rule<Optional<Expr>> defaultValue = optional(seq(op("="), test, (eq, e) -> e));
    Rule<Param> typedParam =
        Rules.<Param>choice(
            seq(
                op("**"),
                name,
                annotation,
                (s, n, a) -> starParam(s, Param.Kind.DOUBLE_STAR, n, a)),
            seq(op("*"), name, annotation, (s, n, a) -> starParam(s, Param.Kind.STAR, n, a)),
            op("*").map(s -> new Param(s, Param.Kind.BARE_STAR, null, null, null)),
            seq(name, annotation, defaultValue, SurfaceGrammar::plainParam));
    Rule<Optional<Expr>> noAnnotation = Rules.success(Optional.empty());
    Rule<Param> untypedParam =
        Rules.<Param>choice(
            seq(
                op("**"),
                name,
                (s, n) -> starParam(s, Param.Kind.DOUBLE_STAR, n, Optional.empty())),
            seq(op("*"), name, (s, n) -> starParam(s, Param.Kind.STAR, n, Optional.empty())),
            op("*").map(s -> new Param(s, Param.Kind.BARE_STAR, null, null, null)),
            seq(name, noAnnotation, defaultValue, SurfaceGrammar::plainParam));
    Rule<ImmutableList<Param>> typedParams = sepBy1(typedParam, comma, true).map(s -> s.items);
    Rule<ImmutableList<Param>> untypedParams = sepBy1(untypedParam, comma, true).map(s -> s.items);

    // Atoms

    Rule<Expr> yieldExpr =
        Rules.<Expr>choice(
            seq(keyword("yield"), keyword("from"), test, (y, f, e) -> new Expr.Yield(y, e, true)),
            seq(
                keyword("yield"),
                optional(testlistStar),
                (y, e) -> new Expr.Yield(y, e.orElse(null), false)));

    Rule<String> operatorSymbol =
        Rules.<String>choice(
            seq(keyword("is"), keyword("not"), (a, b) -> "is not"),
            seq(keyword("not"), keyword("in"), (a, b) -> "not in"),
            tokenIf(t -> t.kind == TokenKind.OP && OPERATOR_SYMBOLS.contains(t.text), "operator")
                .map(t -> t.text),
            tokenIf(t -> t.kind == TokenKind.NAME && OPERATOR_WORDS.contains(t.text), "operator")
                .map(t -> t.text));
    Rule<String> sectionOperator = operatorSymbol.filter(s -> !UNARY_ONLY.contains(s));

    // A parenthesized expression is tried before the operator forms, so "(- x)" is a negation
    // and "(+ 1)" is unary plus rather than a section. "(*x)" is not an expression, which lets
    // it fall through to be a section.
    Rule<Expr> parenAtom =
        Rules.<Expr>choice(
            seq(op("("), op(")"), (o, c) -> new Expr.TupleExpr(o, ImmutableList.of(), true)),
            seq(op("("), yieldExpr, op(")"), (o, y, c) -> new Expr.Paren(o, y)),
            seq(
                op("("),
                test,
                compClauses,
                op(")"),
                (o, e, cs, c) ->
                    new Expr.Comprehension(o, Expr.Comprehension.Kind.GENERATOR, e, null, cs)),
            seq(
                op("("),
                testOrStarList.filter(s -> s.isList() || !(s.items.get(0) instanceof Expr.Starred)),
                op(")"),
                (o, s, c) -> parenthesized(o, s)),
            seq(op("("), operatorSymbol, op(")"), (o, s, c) -> new Expr.OperatorFunction(o, s)),
            seq(
                op("("),
                sectionOperator,
                test,
                op(")"),
                (o, s, e, c) -> new Expr.Section(o, s, null, e)),
            seq(
                op("("),
                test,
                sectionOperator,
                op(")"),
                (o, e, s, c) -> new Expr.Section(o, s, e, null)));

    Rule<KeyValue> keyValue = seq(test, op(":"), test, (k, c, v) -> new KeyValue(k, v));
    Rule<Expr> braceAtom =
        Rules.<Expr>choice(
            seq(
                op("{"),
                op("}"),
                (o, c) -> new Expr.DictExpr(o, ImmutableList.of(), ImmutableList.of())),
            seq(
                op("{"),
                keyValue,
                compClauses,
                op("}"),
                (o, kv, cs, c) ->
                    new Expr.Comprehension(o, Expr.Comprehension.Kind.DICT, kv.key, kv.value, cs)),
            seq(
                op("{"),
                sepBy1(keyValue, comma, true),
                op("}"),
                (o, s, c) -> dictionary(o, s.items)),
            seq(
                op("{"),
                test,
                compClauses,
                op("}"),
                (o, e, cs, c) ->
                    new Expr.Comprehension(o, Expr.Comprehension.Kind.SET, e, null, cs)),
            seq(op("{"), testOrStarList, op("}"), (o, s, c) -> new Expr.SetExpr(o, s.items)));

    Rule<Expr> listAtom =
        Rules.<Expr>choice(
            seq(op("["), op("]"), (o, c) -> new Expr.ListExpr(o, ImmutableList.of())),
            seq(
                op("["),
                test,
                compClauses,
                op("]"),
                (o, e, cs, c) ->
                    new Expr.Comprehension(o, Expr.Comprehension.Kind.LIST, e, null, cs)),
            seq(op("["), testOrStarList, op("]"), (o, s, c) -> new Expr.ListExpr(o, s.items)));

    // "memo" is only special as the first word of a lazy comprehension: "(| memo |)" is a
    // one-element lazy list.
    Rule<Expr> lazyAtom =
        Rules.<Expr>choice(
            seq(
                op("(|"),
                op("|)"),
                (o, c) ->
                    new Expr.LazySequence(
                        o, Expr.LazySequence.Kind.FINITE, ImmutableList.of(), ImmutableList.of())),
            seq(
                op("(|"),
                keyword("memo"),
                test,
                compClauses,
                op("|)"),
                (o, m, e, cs, c) ->
                    new Expr.LazySequence(
                        o, Expr.LazySequence.Kind.MEMOIZING, ImmutableList.of(e), cs)),
            seq(
                op("(|"),
                test,
                compClauses,
                op("|)"),
                (o, e, cs, c) ->
                    new Expr.LazySequence(
                        o, Expr.LazySequence.Kind.SINGLE_PASS, ImmutableList.of(e), cs)),
            seq(
                op("(|"),
                sepBy1(test, comma, true),
                op("|)"),
                (o, s, c) ->
                    new Expr.LazySequence(
                        o, Expr.LazySequence.Kind.FINITE, s.items, ImmutableList.of())));

    Rule<Expr> implicitPartial =
        Rules.<Expr>choice(
            seq(
                op("."),
                name,
                op("("),
                args,
                op(")"),
                (d, n, o, as, c) ->
                    new Expr.ImplicitPartial(
                        d, Expr.ImplicitPartial.Kind.METHOD, n.text, as, null)),
            seq(
                op("."),
                name,
                (d, n) ->
                    new Expr.ImplicitPartial(
                        d, Expr.ImplicitPartial.Kind.ATTRIBUTE, n.text, ImmutableList.of(), null)),
            seq(
                op("."),
                op("["),
                test,
                op("]"),
                (d, o, i, c) ->
                    new Expr.ImplicitPartial(
                        d, Expr.ImplicitPartial.Kind.ITEM, null, ImmutableList.of(), i)));

    Rule<Expr> atom =
        Rules.<Expr>choice(
            lazyAtom,
            parenAtom,
            listAtom,
            braceAtom,
            implicitPartial,
            constant.map(Expr.Constant::new),
            op("...").map(Expr.Constant::new),
            name.map(Expr.Name::new),
            number.map(Expr.Number::new),
            strings.map(Expr.Str::new));

    // Trailers

    Rule<Expr> sliceItem =
        seq(
            optional(test),
            op(":"),
            optional(test),
            optional(seq(op(":"), optional(test), (c, e) -> e)),
            (lower, colon, upper, step) ->
                new Expr.Slice(
                    colon,
                    lower.orElse(null),
                    upper.orElse(null),
                    step.isPresent() ? step.get().orElse(null) : null,
                    step.isPresent()));
    Rule<Separated<Expr>> subscripts =
        sepBy1(Rules.<Expr>choice(sliceItem, test), comma, true);
    Rule<Function<Expr, Expr>> trailer =
        Rules.<Function<Expr, Expr>>choice(
            seq(op("("), args, op(")"), (o, as, c) -> call(as)),
            seq(op("$"), op("("), args, op(")"), (d, o, as, c) -> partial(as)),
            seq(op("["), subscripts, op("]"), (o, s, c) -> subscript(s)),
            seq(op("."), name, (d, n) -> attribute(n.text)));
    Rule<Expr> atomExpr =
        seq(atom, many(trailer), SurfaceGrammar::applyTrailers).memo("atomExpr");

    // Operators, tightest first

    Ref<Expr> factor = ref("factor");
    Rule<Expr> power =
        seq(
            atomExpr,
            optional(seq(op("**"), factor, (o, f) -> f)),
            (base, exp) -> exp.isPresent() ? new Expr.Binary(base, "**", exp.get()) : base);
    factor.set(
        Rules.<Expr>choice(seq(ops("-", "+", "~"), factor, Expr.Unary::new), power).memo("factor"));
    Rule<Expr> term = binary(factor, ops("*", "/", "//", "%", "@"));
    Rule<Expr> arith = binary(term, ops("+", "-"));
    Rule<Expr> shift = binary(arith, ops("<<", ">>"));
    Rule<Expr> bitAnd = binary(shift, op("&"));
    Rule<Expr> bitXor = binary(bitAnd, op("^"));
    bitOr.set(binary(bitXor, op("|")).memo("bitOr"));

    Rule<Expr> chainExpr =
        sepBy1(bitOr, op("::"), false)
            .map(s -> s.items.size() == 1 ? s.items.get(0) : new Expr.Chain(s.items));
    Rule<Expr> composeExpr =
        sepBy1(chainExpr, op(".."), false)
            .map(s -> s.items.size() == 1 ? s.items.get(0) : new Expr.Compose(s.items, false));
    Rule<Expr> forwardComposeExpr =
        sepBy1(composeExpr, op("..>"), false)
            .map(s -> s.items.size() == 1 ? s.items.get(0) : new Expr.Compose(s.items, true));
    Rule<Expr> pipeExpr =
        Rules.chainLeft(
            forwardComposeExpr,
            ops("|>", "|*>", "<|"),
            (l, o, r) -> new Expr.Pipe(l, o.text, r));

    Rule<String> comparisonOperator =
        Rules.<String>choice(
            seq(keyword("not"), keyword("in"), (a, b) -> "not in"),
            seq(keyword("is"), keyword("not"), (a, b) -> "is not"),
            keywords("in", "is").map(t -> t.text),
            ops("<", ">", "==", ">=", "<=", "!=").map(t -> t.text));
    Rule<Expr> comparison =
        seq(
            pipeExpr,
            many(seq(comparisonOperator, pipeExpr, OperatorAndOperand::new)),
            SurfaceGrammar::comparison);
    Ref<Expr> notTest = ref("notTest");
    notTest.set(
        Rules.<Expr>choice(seq(keyword("not"), notTest, Expr.Not::new), comparison));
    Rule<Expr> andTest =
        sepBy1(notTest, keyword("and"), false)
            .map(s -> s.items.size() == 1 ? s.items.get(0) : new Expr.BoolOp("and", s.items));
    orTest.set(
        sepBy1(andTest, keyword("or"), false)
            .map(s -> s.items.size() == 1 ? s.items.get(0) : new Expr.BoolOp("or", s.items))
            .memo("orTest"));

    Rule<Expr> ternary =
        seq(
            orTest,
            optional(
                seq(
                    keyword("if"),
                    orTest,
                    keyword("else"),
                    test,
                    (i, c, e, orElse) -> ternaryTail(c, orElse))),
            (body, tail) -> tail.isPresent() ? tail.get().apply(body) : body);
    Rule<Expr> lambda =
        seq(
            keyword("lambda"),
            optional(untypedParams),
            op(":"),
            test,
            (l, ps, c, body) -> new Expr.Lambda(l, ps.orElse(ImmutableList.of()), body, false));
    Rule<ImmutableList<Param>> arrowParams =
        seq(op("("), optional(untypedParams), op(")"), (o, ps, c) -> ps.orElse(ImmutableList.of()));
    // An arrow attempt that fails on its first token leaves no trace in error messages.
    Rule<Expr> arrowLambda =
        lookahead(
                Rules.<Object>choice(
                    seq(name, op("->"), (n, a) -> a), seq(arrowParams, op("->"), (p, a) -> a)))
            .then(
                Rules.<Expr>choice(
                    seq(
                        name,
                        op("->"),
                        test,
                        (n, a, body) ->
                            new Expr.Lambda(
                                n,
                                ImmutableList.of(plainParam(n, Optional.empty(), Optional.empty())),
                                body,
                                true)),
                    seq(
                        lookahead(op("(")),
                        arrowParams,
                        op("->"),
                        test,
                        (o, ps, a, body) -> new Expr.Lambda(o, ps, body, true))));
    test.set(Rules.<Expr>choice(lambda, arrowLambda, ternary).memo("test"));

    // Simple statements

    Rule<Expr> valueOrYield = Rules.<Expr>choice(yieldExpr, testlistStar);
    Rule<Stmt> expressionStatement =
        Rules.<Stmt>choice(
            seq(
                test,
                op(":"),
                test,
                optional(seq(op("="), valueOrYield, (eq, v) -> v)),
                (t, c, a, v) -> new Stmt.AnnAssign(t, a, v.orElse(null))),
            seq(
                testlistStar,
                ops(
                    "+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=", "<<=", "&=", "|=", "^=",
                    "@="),
                valueOrYield,
                (t, o, v) -> new Stmt.AugAssign(t, o.text, v)),
            seq(
                testlistStar,
                many1(seq(op("="), valueOrYield, (eq, v) -> v)),
                SurfaceGrammar::assignment),
            valueOrYield.map(Stmt.ExprStmt::new));

    Rule<String> dottedName =
        sepBy1(name, op("."), false)
            .map(s -> s.items.stream().map(t -> t.text).collect(Collectors.joining(".")));
    Rule<Optional<String>> asName = optional(seq(keyword("as"), name, (a, n) -> n.text));
    Rule<Stmt.Alias> dottedAsName =
        seq(dottedName, asName, (d, a) -> new Stmt.Alias(d, a.orElse(null)));
    Rule<Stmt.Alias> importAsName =
        seq(name, asName, (n, a) -> new Stmt.Alias(n.text, a.orElse(null)));
    Rule<String> dots = ops(".", "..", "...").map(t -> t.text);
    Rule<String> module =
        Rules.<String>choice(
            seq(
                many1(dots),
                optional(dottedName),
                (ds, n) -> String.join("", ds) + n.orElse("")),
            dottedName);
    Rule<ImmutableList<Stmt.Alias>> importTargets =
        Rules.<ImmutableList<Stmt.Alias>>choice(
            op("*").map(s -> ImmutableList.<Stmt.Alias>of()),
            seq(op("("), sepBy1(importAsName, comma, true), op(")"), (o, s, c) -> s.items),
            sepBy1(importAsName, comma, false).map(s -> s.items));

    Rule<Stmt> smallStatement =
        Rules.<Stmt>choice(
            keywords("pass", "break", "continue").map(Stmt.Keyword::new),
            seq(
                keyword("return"),
                optional(testlistStar),
                (r, v) -> new Stmt.Return(r, v.orElse(null))),
            seq(
                keyword("raise"),
                test,
                keyword("from"),
                test,
                (r, e, f, cause) -> new Stmt.Raise(r, e, cause)),
            seq(keyword("raise"), test, (r, e) -> new Stmt.Raise(r, e, null)),
            keyword("raise").map(r -> new Stmt.Raise(r, null, null)),
            seq(
                keywords("global", "nonlocal"),
                sepBy1(name, comma, false),
                (k, s) -> new Stmt.Scope(k, names(s.items))),
            seq(
                keyword("import"),
                sepBy1(dottedAsName, comma, false),
                (i, s) -> new Stmt.Import(i, s.items)),
            seq(
                keyword("from"),
                module,
                keyword("import"),
                importTargets,
                (f, m, i, names) -> new Stmt.FromImport(f, m, names)),
            seq(
                keyword("assert"),
                test,
                optional(seq(comma, test, (c, e) -> e)),
                (a, t, m) -> new Stmt.Assert(a, t, m.orElse(null))),
            seq(
                keyword("del"),
                sepBy1(bitOr, comma, true),
                (d, s) -> new Stmt.Del(d, s.items)),
            expressionStatement);
    Rule<ImmutableList<Stmt>> simpleStatements =
        seq(sepBy1(smallStatement, op(";"), true), newline, (s, n) -> s.items);

    // Compound statements

    Ref<ImmutableList<Stmt>> statement = ref("statement");
    Rule<ImmutableList<Stmt>> block =
        Rules.<ImmutableList<Stmt>>choice(
                seq(
                    newline,
                    indent,
                    many1(statement),
                    dedent,
                    (n, i, ss, d) -> flatten(ss)),
                simpleStatements)
            .memo("block");
    Rule<ImmutableList<Stmt>> suite = seq(op(":"), block, (c, b) -> b);
    Rule<Optional<ImmutableList<Stmt>>> elseSuite =
        optional(seq(keyword("else"), suite, (e, b) -> b));

    Rule<Stmt> ifStatement =
        seq(
            keyword("if"),
            test,
            suite,
            many(seq(keyword("elif"), test, suite, (e, c, b) -> new Branch(c, b))),
            elseSuite,
            (i, c, b, elifs, orElse) -> ifStatement(i, new Branch(c, b), elifs, orElse));
    Rule<Stmt> whileStatement =
        seq(
            keyword("while"),
            test,
            suite,
            elseSuite,
            (w, c, b, orElse) -> new Stmt.While(w, c, b, orElse.orElse(null)));
    Rule<ForHeader> forHeader =
        seq(
            keyword("for"),
            exprList,
            keyword("in"),
            testlistStar,
            (f, t, in, it) -> new ForHeader(f, t, it));
    Rule<Stmt> forStatement =
        seq(
            forHeader,
            suite,
            elseSuite,
            (h, b, orElse) -> new Stmt.For(h.start, h.target, h.iterable, b, orElse.orElse(null)));

    Rule<Stmt.Handler> handler =
        Rules.<Stmt.Handler>choice(
            seq(
                keyword("except"),
                test,
                keyword("as"),
                name,
                suite,
                (e, t, a, n, b) -> new Stmt.Handler(e, t, n.text, b)),
            seq(keyword("except"), test, suite, (e, t, b) -> new Stmt.Handler(e, t, null, b)),
            seq(keyword("except"), suite, (e, b) -> new Stmt.Handler(e, null, null, b)));
    Rule<ImmutableList<Stmt>> finallySuite = seq(keyword("finally"), suite, (f, b) -> b);
    Rule<Stmt> tryStatement =
        Rules.<Stmt>choice(
            seq(
                keyword("try"),
                suite,
                many1(handler),
                elseSuite,
                optional(finallySuite),
                (t, b, hs, orElse, fin) ->
                    new Stmt.Try(t, b, hs, orElse.orElse(null), fin.orElse(null))),
            seq(
                keyword("try"),
                suite,
                finallySuite,
                (t, b, fin) -> new Stmt.Try(t, b, ImmutableList.of(), null, fin)));

    Rule<Stmt.WithItem> withItem =
        seq(
            test,
            optional(seq(keyword("as"), bitOr, (a, t) -> t)),
            (c, t) -> new Stmt.WithItem(c, t.orElse(null)));
    Rule<Stmt> withStatement =
        seq(
            keyword("with"),
            sepBy1(withItem, comma, false),
            suite,
            (w, items, b) -> new Stmt.With(w, items.items, b));

    Rule<FunctionBody> functionBody =
        Rules.<FunctionBody>choice(
            suite.map(b -> new FunctionBody(b, false)),
            seq(
                op("="),
                test,
                newline,
                (eq, e, n) -> new FunctionBody(ImmutableList.of(new Stmt.Return(eq, e)), true)));
    Rule<ImmutableList<Param>> paramList =
        seq(op("("), optional(typedParams), op(")"), (o, ps, c) -> ps.orElse(ImmutableList.of()));
    Rule<Stmt> functionDef =
        seq(
            keyword("def"),
            name,
            paramList,
            optional(seq(op("->"), test, (a, t) -> t)),
            functionBody,
            (d, n, ps, returns, body) ->
                new Stmt.FunctionDef(
                    d,
                    ImmutableList.of(),
                    n.text,
                    ps,
                    returns.orElse(null),
                    body.statements,
                    body.assignmentForm));

    Rule<Stmt> classDef =
        seq(
            keyword("class"),
            name,
            optional(seq(op("("), args, op(")"), (o, as, c) -> as)),
            suite,
            (k, n, bases, body) ->
                new Stmt.ClassDef(k, ImmutableList.of(), n.text, bases.orElse(null), body));

    Rule<ImmutableList<Param>> dataFields =
        seq(
            op("("),
            optional(
                sepBy1(
                    seq(name, noAnnotation, defaultValue, SurfaceGrammar::plainParam),
                    comma,
                    true)),
            op(")"),
            (o, fs, c) -> fs.map(s -> s.items).orElse(ImmutableList.of()));
    Rule<Stmt> dataDef =
        seq(
            keyword("data"),
            name,
            dataFields,
            Rules.<ImmutableList<Stmt>>choice(suite, newline.map(n -> ImmutableList.<Stmt>of())),
            (d, n, fs, body) -> new Stmt.DataDef(d, ImmutableList.of(), n.text, fs, body));

    // Patterns

    Ref<Pattern> asPattern = ref("asPattern");
    Rule<Expr> dottedNameExpr =
        seq(name, many(seq(op("."), name, (d, n) -> n)), SurfaceGrammar::dotted);
    Rule<Expr> literal =
        Rules.<Expr>choice(
            seq(op("-"), number, (m, n) -> new Expr.Unary(m, new Expr.Number(n))),
            number.map(Expr.Number::new),
            strings.map(Expr.Str::new),
            constant.map(Expr.Constant::new));
    Rule<Pattern> starPattern =
        seq(op("*"), name, (s, n) -> new Pattern.Star(s, n.text.equals("_") ? null : n.text));
    Rule<Pattern> sequenceItem = Rules.<Pattern>choice(starPattern, asPattern);
    Rule<ClassArgument> classArgument =
        Rules.<ClassArgument>choice(
            seq(name, op("="), asPattern, (n, eq, p) -> new ClassArgument(n.text, p)),
            asPattern.map(p -> new ClassArgument(null, p)));
    Rule<MappingItem> mappingItem =
        Rules.<MappingItem>choice(
            seq(op("**"), name, (s, n) -> new MappingItem(null, null, n.text)),
            seq(
                Rules.<Expr>choice(
                    literal, dottedNameExpr.filter(e -> e instanceof Expr.Attribute)),
                op(":"),
                asPattern,
                (k, c, p) -> new MappingItem(k, p, null)));

    // A type test and a class pattern both start with a name, and must be tried before the
    // capture pattern that would match that name alone.
    Rule<Pattern> closedPattern =
        Rules.<Pattern>choice(
            literal.map(Pattern.Literal::new),
            seq(
                name,
                keyword("is"),
                dottedNameExpr,
                (n, is, t) -> new Pattern.TypeTest(n, n.text.equals("_") ? null : n.text, t)),
            seq(
                dottedNameExpr,
                op("("),
                optional(sepBy1(classArgument, comma, true)),
                op(")"),
                (c, o, as, cl) -> classPattern(c, as.map(s -> s.items).orElse(ImmutableList.of()))),
            dottedNameExpr.filter(e -> e instanceof Expr.Attribute).map(Pattern.Value::new),
            name.map(SurfaceGrammar::capture),
            seq(op("("), op(")"), (o, c) -> new Pattern.Sequence(o, ImmutableList.of())),
            seq(
                op("("),
                sepBy1(sequenceItem, comma, true),
                op(")"),
                (o, s, c) -> s.isList() ? new Pattern.Sequence(o, s.items) : s.items.get(0)),
            seq(
                op("["),
                optional(sepBy1(sequenceItem, comma, true)),
                op("]"),
                (o, s, c) ->
                    new Pattern.Sequence(o, s.map(x -> x.items).orElse(ImmutableList.of()))),
            seq(
                op("{"),
                optional(sepBy1(mappingItem, comma, true)),
                op("}"),
                (o, s, c) -> mappingPattern(o, s.map(x -> x.items).orElse(ImmutableList.of()))));
    Rule<Pattern> orPattern =
        sepBy1(closedPattern, op("|"), false)
            .map(s -> s.items.size() == 1 ? s.items.get(0) : new Pattern.Or(s.items));
    asPattern.set(
        seq(
            orPattern,
            asName,
            (p, n) -> n.isPresent() ? new Pattern.As(p, n.get()) : p));
    Rule<Pattern> openPattern =
        sepBy1(sequenceItem, comma, true)
            .mapWithStart(
                (s, start) -> s.isList() ? new Pattern.Sequence(start, s.items) : s.items.get(0));

    Rule<ImmutableList<Pattern>> patternParams =
        seq(
            op("("),
            optional(sepBy1(asPattern, comma, true)),
            op(")"),
            (o, s, c) -> s.map(x -> x.items).orElse(ImmutableList.of()));
    Rule<Stmt> matchFunctionDef =
        seq(
            keywords("match", "addpattern"),
            keyword("def"),
            name,
            patternParams,
            functionBody,
            (m, d, n, ps, body) ->
                new Stmt.MatchFunctionDef(
                    m,
                    ImmutableList.of(),
                    n.text,
                    ps,
                    body.statements,
                    m.text.equals("addpattern")));

    Rule<Stmt.Case> caseClause =
        seq(
            keyword("case"),
            openPattern,
            optional(seq(keyword("if"), test, (i, g) -> g)),
            suite,
            (c, p, g, b) -> new Stmt.Case(c, p, g.orElse(null), b));
    Rule<CaseBlock> caseBlock =
        seq(
            newline,
            indent,
            many1(caseClause),
            elseSuite,
            dedent,
            (n, i, cs, orElse, d) -> new CaseBlock(cs, orElse.orElse(null)));
    Rule<Stmt> matchStatement =
        seq(
            keyword("match"),
            testlistStar,
            op(":"),
            caseBlock,
            (m, s, c, cb) -> new Stmt.Match(m, s, cb.cases, cb.orElse));

    Rule<Expr> decorator = seq(op("@"), test, newline, (a, e, n) -> e);
    Rule<Stmt> decorated =
        seq(
            lookahead(op("@")),
            many1(decorator),
            Rules.<Stmt>choice(functionDef, matchFunctionDef, classDef, dataDef),
            SurfaceGrammar::decorate);

    // "match", "data" and "addpattern" are only keywords where their statement forms match, so
    // "match = 3" falls through to an assignment.
    Rule<Stmt> compoundStatement =
        Rules.<Stmt>choice(
            ifStatement,
            whileStatement,
            forStatement,
            tryStatement,
            withStatement,
            functionDef,
            classDef,
            decorated,
            matchStatement,
            matchFunctionDef,
            dataDef);
    statement.set(
        Rules.<ImmutableList<Stmt>>choice(
                compoundStatement.map(s -> ImmutableList.of(s)), simpleStatements)
            .memo("statement"));

    fileInput =
        seq(many(statement), token(TokenKind.EOF, "end of input"), (ss, e) -> flatten(ss));
    expressionInput =
        seq(testlistStar, newline, token(TokenKind.EOF, "end of input"), (e, n, eof) -> e);
  }

  // Helpers for the semantic actions.

  private static final class KeyValue {
    final Expr key;
    final Expr value;

    KeyValue(Expr key, Expr value) {
      this.key = key;
      this.value = value;
    }
  }

  private static final class OperatorAndOperand {
    final String op;
    final Expr operand;

    OperatorAndOperand(String op, Expr operand) {
      this.op = op;
      this.operand = operand;
    }
  }

  private static final class Branch {
    final Expr condition;
    final ImmutableList<Stmt> body;

    Branch(Expr condition, ImmutableList<Stmt> body) {
      this.condition = condition;
      this.body = body;
    }
  }

  private static final class ForHeader {
    final Token start;
    final Expr target;
    final Expr iterable;

    ForHeader(Token start, Expr target, Expr iterable) {
      this.start = start;
      this.target = target;
      this.iterable = iterable;
    }
  }

  private static final class FunctionBody {
    final ImmutableList<Stmt> statements;
    final boolean assignmentForm;

    FunctionBody(ImmutableList<Stmt> statements, boolean assignmentForm) {
      this.statements = statements;
      this.assignmentForm = assignmentForm;
    }
  }

  private static final class ClassArgument {
    final @Nullable String keyword;
    final Pattern pattern;

    ClassArgument(@Nullable String keyword, Pattern pattern) {
      this.keyword = keyword;
      this.pattern = pattern;
    }
  }

  /** Either a {@code key: pattern} item (rest is null) or a {@code **rest} item. */
  private static final class MappingItem {
    final @Nullable Expr key;
    final @Nullable Pattern pattern;
    final @Nullable String rest;

    MappingItem(@Nullable Expr key, @Nullable Pattern pattern, @Nullable String rest) {
      this.key = key;
      this.pattern = pattern;
      this.rest = rest;
    }
  }

  private static final class CaseBlock {
    final ImmutableList<Stmt.Case> cases;
    final @Nullable ImmutableList<Stmt> orElse;

    CaseBlock(ImmutableList<Stmt.Case> cases, @Nullable ImmutableList<Stmt> orElse) {
      this.cases = cases;
      this.orElse = orElse;
    }
  }

  private static Expr tupleOrSingle(Separated<Expr> items, Token start) {
    return items.isList() ? new Expr.TupleExpr(start, items.items, false) : items.items.get(0);
  }

  private static Expr parenthesized(Token open, Separated<Expr> items) {
    return items.isList()
        ? new Expr.TupleExpr(open, items.items, true)
        : new Expr.Paren(open, items.items.get(0));
  }

  private static <T> ImmutableList<T> prepend(T first, List<T> rest) {
    return ImmutableList.<T>builder().add(first).addAll(rest).build();
  }

  private static <T> ImmutableList<T> flatten(List<ImmutableList<T>> lists) {
    ImmutableList.Builder<T> result = ImmutableList.builder();
    lists.forEach(result::addAll);
    return result.build();
  }

  private static ImmutableList<String> names(List<Token> tokens) {
    return tokens.stream().map(t -> t.text).collect(ImmutableList.toImmutableList());
  }

  private static Param starParam(
      Token star, Param.Kind kind, Token name, Optional<Expr> annotation) {
    return new Param(star, kind, name.text, annotation.orElse(null), null);
  }

  private static Param plainParam(
      Token name, Optional<Expr> annotation, Optional<Expr> defaultValue) {
    return new Param(
        name, Param.Kind.PLAIN, name.text, annotation.orElse(null), defaultValue.orElse(null));
  }

  private static Rule<Expr> binary(Rule<Expr> operand, Rule<Token> operator) {
    return Rules.chainLeft(operand, operator, (l, o, r) -> new Expr.Binary(l, o.text, r));
  }

  private static Function<Expr, Expr> call(ImmutableList<Arg> args) {
    return f -> new Expr.Call(f, args);
  }

  private static Function<Expr, Expr> partial(ImmutableList<Arg> args) {
    return f -> new Expr.Partial(f, args);
  }

  private static Function<Expr, Expr> subscript(Separated<Expr> indices) {
    return v -> new Expr.Subscript(v, indices.items, indices.isList());
  }

  private static Function<Expr, Expr> attribute(String name) {
    return v -> new Expr.Attribute(v, name);
  }

  private static Function<Expr, Expr> ternaryTail(Expr condition, Expr orElse) {
    return body -> new Expr.Ternary(body, condition, orElse);
  }

  private static Expr applyTrailers(Expr atom, List<Function<Expr, Expr>> trailers) {
    Expr result = atom;
    for (Function<Expr, Expr> trailer : trailers) {
      result = trailer.apply(result);
    }
    return result;
  }

  private static Expr comparison(Expr first, List<OperatorAndOperand> rest) {
    if (rest.isEmpty()) {
      return first;
    }
    ImmutableList.Builder<Expr> operands = ImmutableList.builder();
    ImmutableList.Builder<String> operators = ImmutableList.builder();
    operands.add(first);
    for (OperatorAndOperand r : rest) {
      operators.add(r.op);
      operands.add(r.operand);
    }
    return new Expr.Compare(operands.build(), operators.build());
  }

  private static Expr dictionary(Token open, List<KeyValue> items) {
    return new Expr.DictExpr(
        open,
        items.stream().map(kv -> kv.key).collect(ImmutableList.toImmutableList()),
        items.stream().map(kv -> kv.value).collect(ImmutableList.toImmutableList()));
  }

  private static Stmt assignment(Expr first, List<Expr> rest) {
    ImmutableList<Expr> targets = prepend(first, rest.subList(0, rest.size() - 1));
    return new Stmt.Assign(targets, rest.get(rest.size() - 1));
  }

  private static Stmt ifStatement(
      Token start, Branch first, List<Branch> elifs, Optional<ImmutableList<Stmt>> orElse) {
    ImmutableList.Builder<Expr> conditions = ImmutableList.builder();
    ImmutableList.Builder<ImmutableList<Stmt>> bodies = ImmutableList.builder();
    for (Branch b : prepend(first, elifs)) {
      conditions.add(b.condition);
      bodies.add(b.body);
    }
    return new Stmt.If(start, conditions.build(), bodies.build(), orElse.orElse(null));
  }

  private static Expr dotted(Token first, List<Token> rest) {
    Expr result = new Expr.Name(first);
    for (Token t : rest) {
      result = new Expr.Attribute(result, t.text);
    }
    return result;
  }

  private static Pattern capture(Token name) {
    return name.text.equals("_") ? new Pattern.Wildcard(name) : new Pattern.Capture(name);
  }

  private static Pattern classPattern(Expr cls, List<ClassArgument> arguments) {
    ImmutableList.Builder<Pattern> positional = ImmutableList.builder();
    ImmutableList.Builder<Pattern.KeywordPattern> keywords = ImmutableList.builder();
    for (ClassArgument a : arguments) {
      if (a.keyword == null) {
        positional.add(a.pattern);
      } else {
        keywords.add(new Pattern.KeywordPattern(a.keyword, a.pattern));
      }
    }
    return new Pattern.ClassPattern(cls, positional.build(), keywords.build());
  }

  private static Pattern mappingPattern(Token open, List<MappingItem> items) {
    ImmutableList.Builder<Expr> keys = ImmutableList.builder();
    ImmutableList.Builder<Pattern> values = ImmutableList.builder();
    String rest = null;
    for (MappingItem item : items) {
      if (item.rest != null) {
        rest = item.rest;
      } else {
        keys.add(item.key);
        values.add(item.pattern);
      }
    }
    return new Pattern.Mapping(open, keys.build(), values.build(), rest);
  }

  private static Stmt decorate(Token at, ImmutableList<Expr> decorators, Stmt stmt) {
    if (stmt instanceof Stmt.FunctionDef) {
      return ((Stmt.FunctionDef) stmt).withDecorators(decorators, at);
    } else if (stmt instanceof Stmt.MatchFunctionDef) {
      return ((Stmt.MatchFunctionDef) stmt).withDecorators(decorators, at);
    } else if (stmt instanceof Stmt.ClassDef) {
      return ((Stmt.ClassDef) stmt).withDecorators(decorators, at);
    } else {
      return ((Stmt.DataDef) stmt).withDecorators(decorators, at);
    }
  }
}
