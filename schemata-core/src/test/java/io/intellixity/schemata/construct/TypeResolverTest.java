package io.intellixity.schemata.construct;

import io.intellixity.schemata.exceptions.ConstructionException;
import io.intellixity.schemata.types.TypeDescriptor;
import io.intellixity.schemata.types.Types;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class TypeResolverTest {

  private static final TypeResolver RESOLVER = new TypeResolver((schemaId, mapping, depth) -> {
    throw new AssertionError("unexpected nested schema " + schemaId);
  }, ResolverSettings.DEFAULTS);

  private static ConstructionException rejected(String field, Object value, TypeDescriptor type) {
    return assertThrows(ConstructionException.class, () -> RESOLVER.resolve(field, value, type));
  }

  @Test
  void nestedContainers_resolveToEqualValues() {
    Object a = RESOLVER.resolve("a", List.of(List.of(1, 2, 3)), Types.listOf(Types.listOf(Types.INT)));
    Object b = RESOLVER.resolve("b", List.of(Map.of(1, 1), Map.of(2, 2)),
        Types.listOf(Types.mapOf(Types.INT, Types.INT)));

    assertEquals(List.of(List.of(1, 2, 3)), a);
    assertEquals(List.of(Map.of(1, 1), Map.of(2, 2)), b);
  }

  @Test
  void null_passesForEveryType() {
    assertNull(RESOLVER.resolve("a", null, Types.INT));
    assertNull(RESOLVER.resolve("a", null, Types.nested("Server")));
    assertNull(RESOLVER.resolve("a", null, Types.NONE));
  }

  @Test
  void any_returnsTheSameObject() {
    Object v = new ArrayList<>(List.of(1, "x"));
    assertSame(v, RESOLVER.resolve("a", v, Types.ANY));
  }

  @Test
  void primitives_acceptOnlyTheirOwnKind() {
    assertEquals(BigInteger.TEN, RESOLVER.resolve("n", BigInteger.TEN, Types.INT));
    assertEquals(1.5d, RESOLVER.resolve("x", 1.5d, Types.FLOAT));

    ConstructionException e = rejected("x", 1, Types.FLOAT);
    assertEquals(ConstructionException.Kind.WRONG_TYPE, e.kind());
    assertEquals("Wrong type 'Integer' with value '1' for key 'x'. Expected 'float'.", e.getMessage());
    assertEquals(ConstructionException.Kind.WRONG_TYPE, rejected("n", 1.0d, Types.INT).kind());
    assertEquals(ConstructionException.Kind.WRONG_TYPE, rejected("b", "true", Types.BOOL).kind());
    assertEquals(ConstructionException.Kind.WRONG_TYPE, rejected("s", true, Types.STRING).kind());
  }

  @Test
  void containerErrors_carryTheElementPath() {
    ConstructionException e = rejected("a", List.of(List.of(1), List.of(2, "x")), Types.listOf(Types.listOf(Types.INT)));
    assertEquals(List.of("a", "[1]", "[1]"), e.path());
    assertEquals("Wrong type 'String' with value 'x' for key 'a[1][1]'. Expected 'int'.", e.getMessage());

    ConstructionException v = rejected("m", Map.of("k", "v"), Types.mapOf(Types.STRING, Types.INT));
    assertEquals("m[k]", v.pathString());
  }

  @Test
  void mapKeys_areCheckedButKeptAsGiven() {
    ConstructionException stringKey = rejected("m", Map.of("1", 1), Types.mapOf(Types.INT, Types.INT));
    assertEquals(ConstructionException.Kind.WRONG_TYPE, stringKey.kind());
    assertEquals("int", stringKey.expected());

    ConstructionException boolKey = rejected("m", Map.of(true, 1), Types.mapOf(Types.ANY, Types.INT));
    assertEquals("m[true]", boolKey.pathString());

    Map<Object, Object> in = new LinkedHashMap<>();
    in.put(2L, "b");
    in.put(1, "a");
    @SuppressWarnings("unchecked")
    Map<Object, Object> out = (Map<Object, Object>) RESOLVER.resolve("m", in, Types.mapOf(Types.INT, Types.STRING));
    assertEquals(List.of(2L, 1), new ArrayList<>(out.keySet()));
  }

  @Test
  void results_areFreshAndUnmodifiable() {
    List<Object> in = new ArrayList<>(List.of(1, 2));
    @SuppressWarnings("unchecked")
    List<Object> out = (List<Object>) RESOLVER.resolve("a", in, Types.listOf(Types.INT));
    in.add(3);

    assertEquals(List.of(1, 2), out);
    assertThrows(UnsupportedOperationException.class, () -> out.add(4));
  }

  @Test
  void wrongShapes_areRejected() {
    assertEquals("list<int>", rejected("a", Map.of(), Types.listOf(Types.INT)).expected());
    assertEquals("map<string,int>", rejected("a", List.of(), Types.mapOf(Types.STRING, Types.INT)).expected());
    assertEquals("ref(Server)", rejected("a", "db", Types.nested("Server")).expected());
    assertEquals("none", rejected("a", 1, Types.NONE).expected());
    assertEquals(ConstructionException.Kind.WRONG_TYPE, rejected("a", List.of(1), Types.untypedList()).kind());
  }

  @Test
  void deepDocuments_areCutOff() {
    TypeResolver shallow = new TypeResolver((id, m, d) -> {
      throw new AssertionError();
    }, new ResolverSettings(2));
    TypeDescriptor t = Types.listOf(Types.listOf(Types.listOf(Types.listOf(Types.INT))));

    assertEquals(List.of(List.of(List.of())), shallow.resolve("a", List.of(List.of(List.of())), t));
    ConstructionException e = assertThrows(ConstructionException.class,
        () -> shallow.resolve("a", List.of(List.of(List.of(List.of(1)))), t));
    assertEquals(ConstructionException.Kind.NESTING_TOO_DEEP, e.kind());
    assertEquals("a[0][0][0]", e.pathString());
  }
}
