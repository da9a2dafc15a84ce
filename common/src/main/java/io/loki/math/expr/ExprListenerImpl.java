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

import com.metamx.common.IAE;
import io.loki.data.FieldType;
import io.loki.data.TypeResolver;
import io.loki.math.expr.antlr.ExprBaseListener;
import io.loki.math.expr.antlr.ExprParser;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 */
public class ExprListenerImpl extends ExprBaseListener
{
  private final Map<ParseTree, Object> nodes;
  private final ParseTree rootNodeKey;
  private final Map<String, Function.Factory> functions;
  private final TypeResolver resolver;
  private final boolean flatten;

  ExprListenerImpl(
      ParseTree rootNodeKey,
      Map<String, Function.Factory> functions,
      TypeResolver resolver,
      boolean flatten
  )
  {
    this.rootNodeKey = rootNodeKey;
    this.functions = functions;
    this.nodes = new HashMap<>();
    this.resolver = resolver;
    this.flatten = flatten;
  }

  Expr getAST()
  {
    return (Expr) nodes.get(rootNodeKey);
  }

  private void registerWithFlatten(ParseTree ctx, Expr expr, Expr... params)
  {
    registerWithFlatten(ctx, expr, Arrays.asList(params));
  }

  private void registerWithFlatten(ParseTree ctx, Expr expr, List<Expr> params)
  {
    if (flatten && !Evals.isConstant(expr) && Evals.isAllConstants(params)) {
      expr = Evals.toConstant(expr.eval(Expr.NULL_BINDING));
    }
    nodes.put(ctx, expr);
  }

  @Override
  public void exitStart(ExprParser.StartContext ctx)
  {
    nodes.put(ctx, nodes.get(ctx.expr()));
  }

  @Override
  public void exitUnaryOpExpr(ExprParser.UnaryOpExprContext ctx)
  {
    final int opCode = ((TerminalNode) ctx.getChild(0)).getSymbol().getType();
    final Expr param = (Expr) nodes.get(ctx.getChild(1));

    final Expr expr;
    switch (opCode) {
      case ExprParser.MINUS:
        expr = new UnaryMinusExpr(param);
        break;
      case ExprParser.NOT:
        expr = new UnaryNotExpr(param);
        break;
      default:
        throw new IAE("Unrecognized unary operator %s", ctx.getChild(0).getText());
    }
    registerWithFlatten(ctx, expr, param);
  }

  @Override
  public void exitLongExpr(ExprParser.LongExprContext ctx)
  {
    nodes.put(ctx, new LongConst(Long.parseLong(ctx.getText())));
  }

  @Override
  public void exitDoubleExpr(ExprParser.DoubleExprContext ctx)
  {
    nodes.put(ctx, new DoubleConst(Double.parseDouble(ctx.getText())));
  }

  @Override
  public void exitAddSubExpr(ExprParser.AddSubExprContext ctx)
  {
    final String op = ctx.getChild(1).getText();
    final Expr left = (Expr) nodes.get(ctx.getChild(0));
    final Expr right = (Expr) nodes.get(ctx.getChild(2));

    final int opCode = ((TerminalNode) ctx.getChild(1)).getSymbol().getType();

    final Expr expr;
    switch (opCode) {
      case ExprParser.PLUS:
        expr = new BinPlusExpr(op, left, right);
        break;
      case ExprParser.MINUS:
        expr = new BinMinusExpr(op, left, right);
        break;
      default:
        throw new IAE("Unrecognized binary operator %s", op);
    }
    registerWithFlatten(ctx, expr, left, right);
  }

  @Override
  public void exitLogicalAndOrExpr(ExprParser.LogicalAndOrExprContext ctx)
  {
    final String op = ctx.getChild(1).getText();
    final Expr left = (Expr) nodes.get(ctx.getChild(0));
    final Expr right = (Expr) nodes.get(ctx.getChild(2));

    final int opCode = ((TerminalNode) ctx.getChild(1)).getSymbol().getType();

    final Expr expr;
    switch (opCode) {
      case ExprParser.AND:
        expr = new BinAndExpr(op, left, right);
        break;
      case ExprParser.OR:
        expr = new BinOrExpr(op, left, right);
        break;
      default:
        throw new IAE("Unrecognized binary operator %s", op);
    }
    registerWithFlatten(ctx, expr, left, right);
  }

  @Override
  public void exitNestedExpr(ExprParser.NestedExprContext ctx)
  {
    nodes.put(ctx, nodes.get(ctx.getChild(1)));
  }

  @Override
  public void exitLogicalOpExpr(ExprParser.LogicalOpExprContext ctx)
  {
    final String op = ctx.getChild(1).getText();
    final Expr left = (Expr) nodes.get(ctx.getChild(0));
    final Expr right = (Expr) nodes.get(ctx.getChild(2));

    final int opCode = ((TerminalNode) ctx.getChild(1)).getSymbol().getType();

    final Expr expr;
    switch (opCode) {
      case ExprParser.LT:
        expr = new BinLtExpr(op, left, right);
        break;
      case ExprParser.LEQ:
        expr = new BinLeqExpr(op, left, right);
        break;
      case ExprParser.GT:
        expr = new BinGtExpr(op, left, right);
        break;
      case ExprParser.GEQ:
        expr = new BinGeqExpr(op, left, right);
        break;
      case ExprParser.EQ:
        expr = new BinEqExpr(op, left, right);
        break;
      case ExprParser.NEQ:
        expr = new BinNeqExpr(op, left, right);
        break;
      default:
        throw new IAE("Unrecognized binary operator %s", op);
    }
    registerWithFlatten(ctx, expr, left, right);
  }

  @Override
  public void exitMulDivModuloExpr(ExprParser.MulDivModuloExprContext ctx)
  {
    final String op = ctx.getChild(1).getText();
    final Expr left = (Expr) nodes.get(ctx.getChild(0));
    final Expr right = (Expr) nodes.get(ctx.getChild(2));

    final int opCode = ((TerminalNode) ctx.getChild(1)).getSymbol().getType();
    final Expr expr;
    switch (opCode) {
      case ExprParser.MUL:
        expr = new BinMulExpr(op, left, right);
        break;
      case ExprParser.DIV:
        expr = new BinDivExpr(op, left, right);
        break;
      case ExprParser.MODULO:
        expr = new BinModuloExpr(op, left, right);
        break;
      default:
        throw new IAE("Unrecognized binary operator %s", op);
    }
    registerWithFlatten(ctx, expr, left, right);
  }

  @Override
  public void exitPowOpExpr(ExprParser.PowOpExprContext ctx)
  {
    final Expr left = (Expr) nodes.get(ctx.getChild(0));
    final Expr right = (Expr) nodes.get(ctx.getChild(2));
    final BinPowExpr expr = new BinPowExpr(ctx.getChild(1).getText(), left, right);

    registerWithFlatten(ctx, expr, left, right);
  }

  @Override
  @SuppressWarnings("unchecked")
  public void exitFunctionExpr(ExprParser.FunctionExprContext ctx)
  {
    final String fnName = ctx.getChild(0).getText();
    final Function.Factory factory = functions.get(fnName.toLowerCase());
    if (factory == null) {
      throw new IAE("function '%s' is not defined.", fnName);
    }

    final List<Expr> args = ctx.getChildCount() > 3
                            ? (List<Expr>) nodes.get(ctx.getChild(2))
                            : Collections.<Expr>emptyList();

    final FunctionExpr expr = new FunctionExpr(fnName, args, factory.create(args, resolver));
    registerWithFlatten(ctx, expr, args);
  }

  @Override
  public void exitIndexedIdentifierExpr(ExprParser.IndexedIdentifierExprContext ctx)
  {
    final String text = normalize(ctx.IDENTIFIER().getText());
    final FieldType type = resolve(text);
    if (type != FieldType.JAGGED) {
      throw new IAE("'%s' is a scalar field and cannot be indexed", text);
    }
    nodes.put(ctx, new IndexedIdentifierExpr(text, Integer.parseInt(ctx.LONG().getText())));
  }

  @Override
  public void exitIdentifierExpr(ExprParser.IdentifierExprContext ctx)
  {
    final String text = normalize(ctx.IDENTIFIER().getText());
    nodes.put(ctx, new IdentifierExpr(text, resolve(text)));
  }

  private FieldType resolve(String identifier)
  {
    final FieldType type = resolver.resolve(identifier);
    if (type == null) {
      throw new IAE("field '%s' is not declared in schema", identifier);
    }
    return type;
  }

  protected String normalize(String identifier)
  {
    if (identifier.length() > 1 && identifier.charAt(0) == '"' && identifier.charAt(identifier.length() - 1) == '"') {
      return identifier.substring(1, identifier.length() - 1);
    }
    return identifier;
  }

  @Override
  public void exitFunctionArgs(ExprParser.FunctionArgsContext ctx)
  {
    final List<Expr> args = new ArrayList<>();
    for (ExprParser.ExprContext child : ctx.expr()) {
      args.add((Expr) nodes.get(child));
    }
    nodes.put(ctx, args);
  }
}
