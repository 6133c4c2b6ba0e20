package eqlib.engine.expr;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

final class FunctionExprImpl implements FunctionExpr {
  private final int id;
  private final boolean generic;
  private final ImmutableList<Expr> args;
  private final int size;
  private final int hash;

  FunctionExprImpl(int id, boolean generic, ImmutableList<Expr> args) {
    this.id = id;
    this.generic = generic;
    this.args = args;

    int size = 1;
    for (Expr arg : args) size += arg.size();
    this.size = size;
    this.hash = Objects.hash(id, generic, args);
  }

  @Override
  public int id() {
    return id;
  }

  @Override
  public boolean isGeneric() {
    return generic;
  }

  @Override
  public List<Expr> args() {
    return args;
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof FunctionExpr that)) return false;
    if (that instanceof FunctionExprImpl impl && impl.hash != hash) return false;
    return id == that.id() && generic == that.isGeneric() && args.equals(that.args());
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString(ExprContext ctx) {
    final String name = (generic ? "?" : "") + ctx.resolveName(id);
    if (args.isEmpty()) return name;
    return args.stream().map(it -> it.toString(ctx)).collect(Collectors.joining(", ", name + "(", ")"));
  }

  @Override
  public String toString() {
    final String name = (generic ? "?#" : "#") + id;
    if (args.isEmpty()) return name;
    return args.stream().map(Object::toString).collect(Collectors.joining(", ", name + "(", ")"));
  }
}
