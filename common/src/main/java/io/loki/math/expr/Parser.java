/*
 * Licensed to SK Telecom Co., LTD. (SK Telecom) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  SK Telecom licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.loki.math.expr;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.metamx.common.IAE;
import com.metamx.common.logger.Logger;
import io.loki.common.CompileException;
import io.loki.data.TypeResolver;
import io.loki.math.expr.antlr.ExprLexer;
import io.loki.math.expr.antlr.ExprParser;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.ParseTreeWalker;

import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class Parser
{
  private static final Logger log = new Logger(Parser.class);

  private static final Map<String, Object> registered = Maps.newConcurrentMap();
  private static final Map<String, Function.Factory> functions = Maps.newConcurrentMap();

  static {
    register(BuiltinFunctions.class);
  }

  public static void register(Class<?> parent)
  {
    if (registered.putIfAbsent(parent.getName(), new Object()) != null) {
      return;
    }
    final boolean builtInLibrary = parent == BuiltinFunctions.class;

    log.info("registering functions in %s library [%s]", builtInLibrary ? "built-in" : "user", parent.getName());

    for (Function.Factory factory : getFunctions(parent)) {
      register(factory, builtInLibrary);
    }
  }

  public static void register(Function.Factory factory)
  {
    register(factory, false);
  }

  private static void register(Function.Factory factory, boolean builtInLibrary)
  {
    final String name = Preconditions.checkNotNull(factory.name(), "name for [%s] is null", factory).toLowerCase();
    if (functions.putIfAbsent(name, factory) != null) {
      throw new IAE("function '%s' cannot not be overridden", name);
    }
    if (!builtInLibrary) {
      log.info("> '%s' is registered with class %s", name, factory.getClass().getSimpleName());
    }
  }

  private static Iterable<Function.Factory> getFunctions(Class<?> parent)
  {
    final List<Function.Factory> factories = Lists.newArrayList();
    for (Class<?> clazz : parent.getClasses()) {
      if (Modifier.isAbstract(clazz.getModifiers()) || !Function.Factory.class.isAssignableFrom(clazz)) {
        continue;
      }
      try {
        factories.add((Function.Factory) clazz.getDeclaredConstructor().newInstance());
      }
      catch (Exception e) {
        log.warn(e, "failed to instantiate %s .. ignoring", clazz.getName());
      }
    }
    return factories;
  }

  public static List<String> getFunctionNames()
  {
    return ImmutableList.copyOf(Sets.newTreeSet(functions.keySet()));
  }

  /**
   * Parses with every identifier taken as a scalar field.
   */
  public static Expr parse(String in)
  {
    return parse(in, TypeResolver.SCALAR);
  }

  public static Expr parse(String in, TypeResolver resolver)
  {
    return parse(in, resolver, true);
  }

  public static Expr parse(String in, TypeResolver resolver, boolean flatten)
  {
    Preconditions.checkNotNull(in, "expression should not be null");
    try {
      final ParseTree parseTree = parseTree(in);
      final ParseTreeWalker walker = new ParseTreeWalker();
      final ExprListenerImpl listener = new ExprListenerImpl(parseTree, functions, resolver, flatten);
      walker.walk(listener, parseTree);
      return listener.getAST();
    }
    catch (CompileException e) {
      throw e;
    }
    catch (RuntimeException e) {
      throw new CompileException(e, in);
    }
  }

  public static ParseTree parseTree(final String in)
  {
    final BaseErrorListener errorListener = new BaseErrorListener()
    {
      @Override
      public void syntaxError(
          Recognizer<?, ?> recognizer,
          Object offendingSymbol,
          int line,
          int charPositionInLine,
          String msg,
          RecognitionException e
      )
      {
        throw new CompileException(in, "syntax error at position %d, %s", charPositionInLine, msg);
      }
    };
    final ExprLexer lexer = new ExprLexer(CharStreams.fromString(in));
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);

    final ExprParser parser = new ExprParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    parser.setBuildParseTree(true);
    return parser.start();
  }

  public static List<String> findRequiredBindings(String in)
  {
    return findRequiredBindings(parse(in));
  }

  /**
   * Returns every field the expression reads.
   */
  public static List<String> findRequiredBindings(Expr parsed)
  {
    return Lists.newArrayList(findBindingsRecursive(parsed, Sets.<String>newLinkedHashSet(), false));
  }

  /**
   * Returns the jagged fields read at the current slot, which decide how many values the expression
   * yields per record. Fields inside reductions and indexed accesses are excluded.
   */
  public static List<String> findSlotBindings(Expr parsed)
  {
    return Lists.newArrayList(findBindingsRecursive(parsed, Sets.<String>newLinkedHashSet(), true));
  }

  public static boolean isScalar(Expr parsed)
  {
    return findSlotBindings(parsed).isEmpty();
  }

  private static Set<String> findBindingsRecursive(Expr expr, Set<String> found, boolean slotOnly)
  {
    if (expr instanceof IdentifierExpr) {
      final IdentifierExpr identifier = (IdentifierExpr) expr;
      if (!slotOnly || identifier.isJagged()) {
        found.add(identifier.identifier());
      }
    } else if (expr instanceof IndexedIdentifierExpr) {
      if (!slotOnly) {
        found.add(((IndexedIdentifierExpr) expr).identifier());
      }
    } else if (expr instanceof FunctionExpr && slotOnly && ((FunctionExpr) expr).isReduction()) {
      return found;
    } else {
      for (Expr child : expr.getChildren()) {
        findBindingsRecursive(child, found, slotOnly);
      }
    }
    return found;
  }
}
