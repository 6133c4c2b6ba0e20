package eqlib.engine;

import eqlib.engine.expr.Expr;
import eqlib.engine.expr.FunctionExpr;
import eqlib.engine.expr.NumberExpr;
import eqlib.engine.expr.Rule;

import java.util.Set;

public abstract class TestHelper {
  public static final TestContext CTX = new TestContext();

  private TestHelper() {}

  public static int id(String name) {
    return CTX.resolve(name);
  }

  public static Expr num(double value) {
    return NumberExpr.mk(value);
  }

  public static Expr sym(String name) {
    return FunctionExpr.mkSymbol(id(name));
  }

  /** Generic symbol `?name`. */
  public static Expr gen(String name) {
    return FunctionExpr.mkGeneric(id(name));
  }

  public static Expr fn(String name, Expr... args) {
    return FunctionExpr.mk(id(name), args);
  }

  /** Generic function `?name(args)`. */
  public static Expr genFn(String name, Expr... args) {
    return FunctionExpr.mkGeneric(id(name), args);
  }

  public static Expr add(Expr a, Expr b) {
    return fn("add", a, b);
  }

  public static Expr sub(Expr a, Expr b) {
    return fn("sub", a, b);
  }

  public static Expr mul(Expr a, Expr b) {
    return fn("mul", a, b);
  }

  public static Expr div(Expr a, Expr b) {
    return fn("div", a, b);
  }

  public static Expr pow(Expr a, Expr b) {
    return fn("pow", a, b);
  }

  public static Expr sin(Expr a) {
    return fn("sin", a);
  }

  public static Expr cos(Expr a) {
    return fn("cos", a);
  }

  public static Rule eq(Expr left, Expr right) {
    return new Rule(left, right);
  }

  /** Addition and multiplication. */
  public static Set<Integer> rearrangeable() {
    return Set.of(id("add"), id("mul"));
  }
}
