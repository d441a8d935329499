/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.page;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.sqlexec.planner.physical.page.Block.BlockType;

/**
 * Ordered, immutable list of named and typed fields. A single instance is shared by every page it
 * describes.
 */
@EqualsAndHashCode
public class Schema {

  @Getter private final List<Field> fields;

  public Schema(List<Field> fields) {
    this.fields = ImmutableList.copyOf(fields);
  }

  public static Schema of(Field... fields) {
    return new Schema(List.of(fields));
  }

  public int size() {
    return fields.size();
  }

  public Field getField(int index) {
    return fields.get(index);
  }

  public BlockType getType(int index) {
    return fields.get(index).getType();
  }

  /** Returns the index of the first field with the given name, or -1. */
  public int indexOf(String name) {
    for (int i = 0; i < fields.size(); i++) {
      if (fields.get(i).getName().equals(name)) {
        return i;
      }
    }
    return -1;
  }

  public List<String> getFieldNames() {
    return fields.stream().map(Field::getName).collect(Collectors.toList());
  }

  /** Returns a schema holding this schema's fields followed by the other schema's fields. */
  public Schema concat(Schema other) {
    return new Schema(
        ImmutableList.<Field>builder().addAll(fields).addAll(other.fields).build());
  }

  /** Returns true if both schemas have the same field types in the same order. */
  public boolean isTypeCompatible(Schema other) {
    if (other.size() != size()) {
      return false;
    }
    for (int i = 0; i < size(); i++) {
      if (getType(i) != other.getType(i)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return fields.stream().map(Field::toString).collect(Collectors.joining(", ", "[", "]"));
  }

  /** A named, typed column. */
  @Getter
  @EqualsAndHashCode
  public static class Field {
    private final String name;
    private final BlockType type;

    public Field(String name, BlockType type) {
      this.name = name;
      this.type = type;
    }

    public static Field of(String name, BlockType type) {
      return new Field(name, type);
    }

    @Override
    public String toString() {
      return name + ":" + type;
    }
  }
}
