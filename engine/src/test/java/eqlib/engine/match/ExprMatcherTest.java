package eqlib.engine.match;

import eqlib.engine.expr.Expr;
import eqlib.engine.expr.ExprException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static eqlib.engine.TestHelper.*;
import static org.junit.jupiter.api.Assertions.*;

@Tag("match")
@Tag("fast")
public class ExprMatcherTest {

  @Test
  public void testGenericFreePatterns() {
    final List<Expr> exprs =
        List.of(num(1), sym("a"), add(sym("a"), num(2)), fn("f", sym("a"), sin(sym("b"))));
    for (Expr c : exprs) {
      for (Expr p : exprs) {
        final ExprMatchResult result = ExprMatcher.matchSuperset(c, p, Set.of());
        if (result.matched()) {
          assertTrue(result.bindings().isEmpty());
          assertEquals(p, c);
        } else {
          assertNotEquals(p, c);
        }
      }
    }
  }

  @Test
  public void testBindingConsistency() {
    final Expr pattern = fn("f", gen("x"), gen("x"));
    assertTrue(ExprMatcher.matchSuperset(fn("f", sym("a"), sym("b")), pattern).failed());

    final ExprMatchResult result = ExprMatcher.matchSuperset(fn("f", sym("a"), sym("a")), pattern);
    assertTrue(result.matched());
    assertEquals(Map.of(id("x"), sym("a")), result.bindings());
  }

  @Test
  public void testGenericSymbolBindsAnything() {
    assertEquals(Map.of(id("x"), num(5)), ExprMatcher.matchSuperset(num(5), gen("x")).bindings());
    final Expr e = add(sym("a"), sin(num(1)));
    assertEquals(Map.of(id("x"), e), ExprMatcher.matchSuperset(e, gen("x")).bindings());
  }

  @Test
  public void testNumbers() {
    assertTrue(ExprMatcher.matchSuperset(num(5), num(5)).matched());
    assertTrue(ExprMatcher.matchSuperset(num(5), num(5)).bindings().isEmpty());
    assertTrue(ExprMatcher.matchSuperset(num(5), num(6)).failed());
    assertTrue(ExprMatcher.matchSuperset(sym("a"), num(5)).failed());
    assertTrue(ExprMatcher.matchSuperset(num(5), sym("a")).failed());
    assertTrue(ExprMatcher.matchSuperset(num(5), sin(gen("x"))).failed());
  }

  @Test
  public void testShapeMismatch() {
    assertTrue(ExprMatcher.matchSuperset(add(sym("a"), sym("b")), mul(gen("x"), gen("y"))).failed());
    assertTrue(ExprMatcher.matchSuperset(fn("f", sym("a")), fn("f", gen("x"), gen("y"))).failed());
    assertTrue(ExprMatcher.matchSuperset(add(sym("a"), num(1)), add(gen("x"), num(2))).failed());
  }

  @Test
  public void testGenericFunction() {
    final Expr x = sym("x");
    final Expr concrete = fn("diff", sin(pow(x, num(3))), x);
    final Expr pattern = fn("diff", genFn("fn", gen("a")), gen("b"));

    final ExprMatchResult result = ExprMatcher.matchSuperset(concrete, pattern);
    assertTrue(result.matched());
    assertEquals(
        Map.of(id("fn"), sin(pow(x, num(3))), id("a"), pow(x, num(3)), id("b"), x),
        result.bindings());
    assertEquals(Map.of(id("fn"), List.of(gen("a"))), result.dependentVars());
  }

  @Test
  public void testGenericFunctionShape() {
    final Expr pattern = genFn("fn", gen("a"));
    assertTrue(ExprMatcher.matchSuperset(sym("x"), pattern).failed());
    assertTrue(ExprMatcher.matchSuperset(num(1), pattern).failed());
    assertTrue(ExprMatcher.matchSuperset(add(sym("x"), sym("y")), pattern).failed());
    assertTrue(ExprMatcher.matchSuperset(cos(sym("y")), pattern).matched());
  }

  @Test
  public void testGenericFunctionConflict() {
    // ?fn(?a) twice, bound to different applications
    final Expr pattern = add(genFn("fn", gen("a")), genFn("fn", gen("a")));
    assertTrue(ExprMatcher.matchSuperset(add(sin(sym("x")), cos(sym("x"))), pattern).failed());
    assertTrue(ExprMatcher.matchSuperset(add(sin(sym("x")), sin(sym("x"))), pattern).matched());

    final Expr inconsistent = add(genFn("fn", gen("a")), genFn("fn", gen("b")));
    final ExprException ex =
        assertThrows(
            ExprException.class,
            () -> ExprMatcher.matchSuperset(add(sin(sym("x")), sin(sym("x"))), inconsistent));
    assertEquals(ExprException.Kind.BINDING_CONFLICT, ex.kind());

    // the inconsistency is reported no matter what the pattern is matched against
    for (Expr e : List.of(add(sin(sym("x")), cos(sym("y"))), sym("x"), num(1), mul(sym("x"), sym("y")))) {
      final ExprException conflict =
          assertThrows(ExprException.class, () -> ExprMatcher.matchSuperset(e, inconsistent));
      assertEquals(ExprException.Kind.BINDING_CONFLICT, conflict.kind());
    }
  }

  @Test
  public void testCallerSuppliedGenericIds() {
    final Expr pattern = fn("f", sym("u"), sym("v"));
    final ExprMatchResult result =
        ExprMatcher.matchSuperset(fn("f", num(1), sym("v")), pattern, Set.of(id("u")));
    assertEquals(Map.of(id("u"), num(1)), result.bindings());
    assertTrue(ExprMatcher.matchSuperset(fn("f", num(1), sym("v")), pattern).failed());
  }

  @Test
  public void testMerge() {
    final ExprMatchResult left = ExprMatchResult.bind(1, num(1));
    assertEquals(left, left.merge(ExprMatchResult.empty()));
    assertEquals(left, left.merge(ExprMatchResult.bind(1, num(1))));
    assertTrue(left.merge(ExprMatchResult.bind(1, num(2))).failed());
    assertTrue(left.merge(ExprMatchResult.noMatch()).failed());
    assertEquals(Map.of(1, num(1), 2, num(2)), left.merge(ExprMatchResult.bind(2, num(2))).bindings());
  }
}
