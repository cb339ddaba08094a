package exm.sdfg.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sdfg.common.exceptions.SDFGRuntimeError;

public class SubsetTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testParseRanges() {
    Range r = Range.parse("0:10");
    assertEquals(SymExpr.of(0), r.start);
    assertEquals("End is stored inclusive", SymExpr.of(9), r.end);
    assertEquals(SymExpr.of(10), r.size());

    assertTrue("Unit range is an index", Range.parse("0:1").isIndex());
    assertEquals(Range.index(SymExpr.ZERO), Range.parse("0:1"));
    assertEquals(SymExpr.of(5), Range.parse("0:10:2").size());
    assertEquals(SymExpr.parse("N"), Range.whole(SymExpr.parse("N")).size());
  }

  @Test
  public void testSubsetSize() {
    Subset s = Subset.parse("0:N, i, 2:2*M:2");
    assertEquals(3, s.dims());
    assertEquals(Arrays.asList(SymExpr.parse("N"), SymExpr.ONE,
                               SymExpr.parse("M - 1")),
                 s.size());
    assertEquals(Arrays.asList(SymExpr.ZERO, SymExpr.parse("i"),
                               SymExpr.of(2)),
                 s.minElement());
    assertEquals(SymExpr.parse("N*M"),
        Subset.parse("0:N, 0:M").numElements());
  }

  @Test
  public void testToStringParsesBack() {
    for (String text: Arrays.asList("0:N, i", "1:N - 1:2", "0", "i + 1:i + 3")) {
      Subset s = Subset.parse(text);
      assertEquals(text, s, Subset.parse(s.toString()));
    }
    assertEquals(0, Subset.parse("").dims());
  }

  @Test
  public void testFromShape() {
    List<SymExpr> shape = Arrays.asList(SymExpr.parse("N"), SymExpr.of(4));
    assertEquals(Subset.parse("0:N, 0:4"), Subset.fromShape(shape));
  }

  @Test
  public void testOffset() {
    Subset s = Subset.parse("0:10, i");
    assertEquals(Subset.parse("5:15, i + 2"),
        s.offset(SymExpr.ofAll(5, 2), false));
    assertEquals(Subset.parse("-5:5, i - 2"),
        s.offset(SymExpr.ofAll(5, 2), true));
    assertEquals("Offset by the starts of another subset",
        Subset.parse("3:13, i + j"), s.offset(Subset.parse("3:4, j"), false));
  }

  @Test
  public void testOffsetAdditive() {
    Subset s = Subset.parse("0:N, i:i + 4");
    List<SymExpr> a = Arrays.asList(SymExpr.parse("k"), SymExpr.of(3));
    List<SymExpr> b = Arrays.asList(SymExpr.of(2), SymExpr.parse("-j"));
    List<SymExpr> sum = Arrays.asList(a.get(0).plus(b.get(0)),
                                      a.get(1).plus(b.get(1)));
    assertEquals(s.offset(sum, false),
                 s.offset(a, false).offset(b, false));
    assertEquals("Offset and negative offset cancel", s,
                 s.offset(a, false).offset(a, true));
  }

  @Test
  public void testOffsetRankMismatch() {
    exception.expect(SDFGRuntimeError.class);
    Subset.parse("0:10, 0:5").offset(SymExpr.ofAll(1), false);
  }

  @Test
  public void testUnsqueeze() {
    Subset s = Subset.parse("0:N, i");
    assertEquals(Subset.parse("0, 0:N, i"), s.unsqueeze(Arrays.asList(0)));
    assertEquals(Subset.parse("0:N, i, 0"), s.unsqueeze(Arrays.asList(2)));
    assertEquals("Positions are sorted first",
        Subset.parse("0, 0:N, 0, i"), s.unsqueeze(Arrays.asList(2, 0)));
  }

  @Test
  public void testUnsqueezeComposition() {
    Subset s = Subset.parse("0:N, i");
    // Later positions expressed in terms of the intermediate result
    assertEquals(s.unsqueeze(Arrays.asList(0, 2)),
        s.unsqueeze(Arrays.asList(0)).unsqueeze(Arrays.asList(2)));
    assertEquals(s.unsqueeze(Arrays.asList(0, 2)),
        s.unsqueeze(Arrays.asList(1)).unsqueeze(Arrays.asList(0)));
    assertEquals(s.unsqueeze(Arrays.asList(1, 2, 4)),
        s.unsqueeze(Arrays.asList(1, 2)).unsqueeze(Arrays.asList(4)));
  }

  @Test
  public void testUnsqueezeOutOfRange() {
    exception.expect(SDFGRuntimeError.class);
    Subset.parse("0:N").unsqueeze(Arrays.asList(2));
  }

  @Test
  public void testUnion() {
    Subset u = Subset.parse("0:5, N").union(Subset.parse("3:10, N"));
    assertEquals(Subset.parse("0:10, N"), u);
    assertNull("Incomparable bounds",
        Subset.parse("0:N").union(Subset.parse("0:M")));
    assertFalse(Subset.parse("0:5").equals(Subset.parse("0:6")));
  }
}
