package com.obsidiandynamics.rulecheck;

import com.obsidiandynamics.rulecheck.util.*;

import java.util.*;

/**
 *  The state-encoding contract of a model: an ordered list of fields packed back to back. The
 *  total width is fixed once the layout is built.
 */
public final class Layout {
  public static final class Builder {
    private final List<Field> fields = new ArrayList<>();

    private final Set<String> names = new HashSet<>();

    private int width;

    private Builder() {}

    public Field range(String name, long min, long max) {
      return add(Field.range(name, width, min, max));
    }

    public Field bool(String name) {
      return add(Field.bool(name, width));
    }

    public Field enumeration(String name, String... members) {
      return add(Field.enumeration(name, width, Arrays.asList(members)));
    }

    private Field add(Field field) {
      Assert.that(names.add(field.getName()), IllegalArgumentException::new, () -> "Duplicate field " + field.getName());
      fields.add(field);
      width += field.getLength();
      return field;
    }

    public Layout build() {
      return new Layout(fields, width);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  private final List<Field> fields;

  private final int width;

  private Layout(List<Field> fields, int width) {
    this.fields = List.copyOf(fields);
    this.width = width;
  }

  public int width() {
    return width;
  }

  public List<Field> getFields() {
    return fields;
  }

  public Field field(String name) {
    for (var field : fields) {
      if (field.getName().equals(name)) {
        return field;
      }
    }
    throw new NoSuchElementException("No field " + name);
  }

  public String render(StateView state) {
    final var sb = new StringBuilder();
    for (var field : fields) {
      sb.append(field.getName()).append(':').append(field.render(state)).append('\n');
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return Layout.class.getSimpleName() + "[fields=" + fields.size() + ", width=" + width + ']';
  }
}
