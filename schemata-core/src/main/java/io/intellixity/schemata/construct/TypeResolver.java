package io.intellixity.schemata.construct;

import io.intellixity.schemata.exceptions.ConstructionException;
import io.intellixity.schemata.types.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validates a raw document value against a {@link TypeDescriptor} and rebuilds it.
 * <p>
 * Rules, first match wins:
 * <ol>
 *   <li>null passes through for every type (callers decide whether absence is acceptable)</li>
 *   <li>{@code any} returns the value unchanged</li>
 *   <li>primitives require exactly the matching native kind, no widening</li>
 *   <li>nested schemas require a mapping and build an {@link Instance} from it</li>
 *   <li>lists require a sequence and resolve every element</li>
 *   <li>maps require a mapping with int/float/string keys; keys are checked against the key type but kept as given</li>
 *   <li>anything else is a wrong type</li>
 * </ol>
 * Containers in the result are always freshly built and unmodifiable; the input is never aliased
 * except below {@code any}.
 */
public final class TypeResolver {

  /** Builds a nested schema instance; its errors carry paths relative to that schema. */
  @FunctionalInterface
  public interface NestedConstructor {
    Instance construct(String schemaId, Map<?, ?> mapping, int depth);
  }

  private final NestedConstructor nested;
  private final int maxDepth;

  public TypeResolver(NestedConstructor nested, ResolverSettings settings) {
    this.nested = Objects.requireNonNull(nested, "nested");
    this.maxDepth = Objects.requireNonNull(settings, "settings").maxDepth();
  }

  public Object resolve(String field, Object value, TypeDescriptor type) {
    return resolve(field, value, type, 0);
  }

  public Object resolve(String field, Object value, TypeDescriptor type, int depth) {
    Objects.requireNonNull(type, "type");
    if (depth > maxDepth) throw ConstructionException.nestingTooDeep(field, maxDepth);
    if (value == null) return null;
    return type.accept(new Resolution(field, value, depth));
  }

  private Object resolveChild(String field, String segment, Object value, TypeDescriptor type, int depth) {
    try {
      return resolve(segment, value, type, depth + 1);
    } catch (ConstructionException e) {
      throw e.withParent(field);
    }
  }

  private final class Resolution implements TypeDescriptorVisitor<Object> {
    private final String field;
    private final Object value;
    private final int depth;

    Resolution(String field, Object value, int depth) {
      this.field = field;
      this.value = value;
      this.depth = depth;
    }

    @Override
    public Object visit(AnyType any) {
      return value;
    }

    @Override
    public Object visit(PrimitiveType primitive) {
      if (NativeKind.of(value) != primitive.kind().nativeKind()) throw wrongType(primitive);
      return value;
    }

    @Override
    public Object visit(NoneType none) {
      throw wrongType(none);
    }

    @Override
    public Object visit(NestedType ref) {
      if (!(value instanceof Map<?, ?> m)) throw wrongType(ref);
      try {
        return nested.construct(ref.schemaId(), m, depth + 1);
      } catch (ConstructionException e) {
        throw e.withParent(field);
      }
    }

    @Override
    public Object visit(ListType list) {
      if (!(value instanceof List<?> in) || !list.isParameterized()) throw wrongType(list);
      List<Object> out = new ArrayList<>(in.size());
      int i = 0;
      for (Object el : in) {
        out.add(resolveChild(field, "[" + i + "]", el, list.element(), depth));
        i++;
      }
      return Collections.unmodifiableList(out);
    }

    @Override
    public Object visit(MapType map) {
      if (!(value instanceof Map<?, ?> in) || !map.isParameterized()) throw wrongType(map);
      Map<Object, Object> out = new LinkedHashMap<>();
      for (var e : in.entrySet()) {
        Object key = e.getKey();
        String segment = "[" + key + "]";
        NativeKind keyKind = NativeKind.of(key);
        if (keyKind != NativeKind.INTEGER && keyKind != NativeKind.FLOAT && keyKind != NativeKind.STRING) {
          throw ConstructionException.wrongType(segment, key, TypeIds.id(map.key())).withParent(field);
        }
        resolveChild(field, segment, key, map.key(), depth);
        out.put(key, resolveChild(field, segment, e.getValue(), map.value(), depth));
      }
      return Collections.unmodifiableMap(out);
    }

    @Override
    public Object visit(OpaqueType opaque) {
      throw wrongType(opaque);
    }

    private ConstructionException wrongType(TypeDescriptor expected) {
      return ConstructionException.wrongType(field, value, TypeIds.id(expected));
    }
  }
}
