package eqlib.engine.diff;

import eqlib.engine.expr.Expr;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static eqlib.engine.TestHelper.*;
import static org.junit.jupiter.api.Assertions.*;

@Tag("diff")
@Tag("fast")
public class RearrangementSolverTest {
  private final Expr x = sym("x"), y = sym("y"), z = sym("z"), w = sym("w"), r = sym("r");
  private RearrangementSolver solver;

  @BeforeEach
  public void setUp() {
    solver = new RearrangementSolver(rearrangeable());
  }

  @Test
  public void testCanonicalHashFlat() {
    final Expr sum = fn("add", x, y, z);
    final int hash = solver.canonicalHash(sum);
    assertEquals(hash, solver.canonicalHash(fn("add", x, z, y)));
    assertEquals(hash, solver.canonicalHash(fn("add", y, x, z)));
    assertEquals(hash, solver.canonicalHash(fn("add", y, z, x)));
    assertEquals(hash, solver.canonicalHash(fn("add", z, x, y)));
    assertEquals(hash, solver.canonicalHash(fn("add", z, y, x)));
  }

  @Test
  public void testCanonicalHashNested() {
    final Expr e = add(mul(x, add(y, num(2))), add(z, w));
    final Expr permuted = add(add(w, z), mul(add(num(2), y), x));
    assertEquals(solver.canonicalHash(e), solver.canonicalHash(permuted));
    // associativity: (x + y) + z and x + (y + z)
    assertEquals(solver.canonicalHash(add(add(x, y), z)), solver.canonicalHash(add(x, add(y, z))));
  }

  @Test
  public void testCanonicalHashOfOtherFunctions() {
    assertEquals(sub(x, y).hashCode(), solver.canonicalHash(sub(x, y)));
    assertNotEquals(solver.canonicalHash(sub(x, y)), solver.canonicalHash(sub(y, x)));
    assertEquals(num(3).hashCode(), solver.canonicalHash(num(3)));
  }

  @Test
  public void testSwap() {
    final Expr a = add(x, y), b = add(y, x);
    final List<Rearrangement> steps = solver.computeRearrangement(0, a, b);
    assertEquals(List.of(new Rearrangement(0, List.of(1, 0))), steps);
    assertEquals(b, Rearrangement.applyAll(a, steps, rearrangeable()));
  }

  @Test
  public void testAssociativity() {
    final Expr a = mul(mul(x, y), z), b = mul(x, mul(y, z));
    final List<Rearrangement> steps = solver.computeRearrangement(0, a, b);
    assertEquals(List.of(new Rearrangement(0, List.of(0, 1, 2, -1))), steps);
    assertTrue(steps.get(0).hasGaps());
    assertEquals(b, Rearrangement.applyAll(a, steps, rearrangeable()));
  }

  @Test
  public void testSingleDifferentArgument() {
    final Expr a = mul(w, add(x, y)), b = mul(w, add(y, x));
    final List<Rearrangement> steps = solver.computeRearrangement(0, a, b);
    assertEquals(List.of(new Rearrangement(2, List.of(1, 0))), steps);
    assertEquals(b, Rearrangement.applyAll(a, steps, rearrangeable()));
  }

  @Test
  public void testNestedPreArrangement() {
    final Expr a = add(mul(x, y), z), b = add(z, mul(y, x));
    final List<Rearrangement> steps = solver.computeRearrangement(0, a, b);
    assertEquals(
        List.of(new Rearrangement(1, List.of(1, 0)), new Rearrangement(0, List.of(1, 0))), steps);
    assertEquals(b, Rearrangement.applyAll(a, steps, rearrangeable()));
  }

  @Test
  public void testNestedStepsChangingSize() {
    // the first child grows from binary nesting to a ternary node, shifting its right sibling
    final Expr a = mul(add(add(x, y), z), add(w, r));
    final Expr b = mul(fn("add", z, x, y), add(r, w));
    final List<Rearrangement> steps = solver.computeRearrangement(0, a, b);
    assertEquals(
        List.of(
            new Rearrangement(6, List.of(1, 0)),
            new Rearrangement(1, List.of(2, 0, 1)),
            new Rearrangement(0, List.of(0, 1))),
        steps);
    assertEquals(b, Rearrangement.applyAll(a, steps, rearrangeable()));
  }

  @Test
  public void testRoundTrip() {
    final List<Expr[]> cases =
        List.of(
            new Expr[] {add(add(x, y), add(z, w)), add(w, add(z, add(y, x)))},
            new Expr[] {mul(add(x, num(1)), mul(y, z)), mul(z, mul(add(num(1), x), y))},
            new Expr[] {add(mul(x, y), mul(y, x)), add(mul(y, x), mul(y, x))},
            new Expr[] {fn("add", x, y, z), add(z, add(x, y))},
            new Expr[] {add(sin(add(x, y)), z), add(z, sin(add(x, y)))},
            new Expr[] {mul(add(add(x, y), z), add(w, r)), mul(fn("add", z, x, y), add(r, w))},
            new Expr[] {mul(fn("add", z, x, y), add(r, w)), mul(add(add(x, y), z), add(w, r))});
    for (Expr[] pair : cases) {
      final List<Rearrangement> steps = solver.computeRearrangement(0, pair[0], pair[1]);
      assertFalse(steps.isEmpty(), pair[0] + " -> " + pair[1]);
      assertEquals(pair[1], Rearrangement.applyAll(pair[0], steps, rearrangeable()));
    }
  }

  @Test
  public void testRoundTripAtOffset() {
    // only the sub-tree at position 2 is rearranged
    final Expr whole = fn("f", sym("k"), add(add(x, y), z));
    final Expr a = whole.at(2), b = add(z, add(y, x));
    final List<Rearrangement> steps = solver.computeRearrangement(2, a, b);
    assertFalse(steps.isEmpty());
    assertEquals(fn("f", sym("k"), b), Rearrangement.applyAll(whole, steps, rearrangeable()));
  }

  @Test
  public void testImpossible() {
    assertTrue(solver.computeRearrangement(0, add(x, y), add(x, z)).isEmpty());
    assertTrue(solver.computeRearrangement(0, add(x, y), mul(y, x)).isEmpty());
    assertTrue(solver.computeRearrangement(0, sub(x, y), sub(y, x)).isEmpty());
    assertTrue(solver.computeRearrangement(0, add(x, y), add(x, y)).isEmpty());
    assertTrue(solver.computeRearrangement(0, add(add(x, y), z), add(x, y)).isEmpty());
    assertTrue(solver.computeRearrangement(0, x, y).isEmpty());
    // the reordering is hidden below a function that does not commute
    assertTrue(solver.computeRearrangement(0, add(sin(add(x, y)), z), add(sin(add(y, x)), z)).isEmpty());
  }
}
