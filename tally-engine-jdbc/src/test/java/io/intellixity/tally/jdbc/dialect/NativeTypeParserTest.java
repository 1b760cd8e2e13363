package io.intellixity.tally.jdbc.dialect;

import io.intellixity.tally.error.TypeMappingException;
import io.intellixity.tally.model.DataType;
import io.intellixity.tally.model.Field;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class NativeTypeParserTest {
  private final AnsiDialect dialect = new AnsiDialect();

  @Test
  void parsesScalars() {
    assertEquals(DataType.STRING, dialect.parseField("a", "character varying(255)").type());
    assertEquals(DataType.NUMBER, dialect.parseField("a", "double precision").type());
    assertEquals(DataType.NUMBER, dialect.parseField("a", "DECIMAL(10,2)").type());
    assertEquals(DataType.BOOL, dialect.parseField("a", "boolean").type());
    assertEquals(DataType.DATETIME, dialect.parseField("a", "timestamp(3) with time zone").type());
  }

  @Test
  void parsesNestedStructsInBothNotations() {
    Field f = dialect.parseField("ctx", "row(os varchar, device row(\"model\" varchar, ram bigint))");
    assertEquals(DataType.STRUCT, f.type());
    assertEquals(List.of("ctx.os", "ctx.device.model", "ctx.device.ram"),
        f.leaves().stream().map(Field::path).toList());
    assertEquals(DataType.STRUCT, f.subFields().get(1).parentType());

    Field g = dialect.parseField("ctx", "STRUCT<os:STRING,version:INT>");
    assertEquals(List.of("ctx.os", "ctx.version"), g.leaves().stream().map(Field::path).toList());
    assertEquals(DataType.NUMBER, g.subFields().get(1).type());
  }

  @Test
  void parsesMapsAndArrays() {
    Field m = dialect.parseField("props", "map(varchar, map(varchar, bigint))");
    assertEquals(DataType.MAP, m.type());
    assertEquals(DataType.MAP, m.valueType());
    assertTrue(m.leaves().isEmpty());

    Field n = dialect.parseField("props", "MAP<STRING,INT>");
    assertEquals(DataType.NUMBER, n.valueType());

    Field a = dialect.parseField("tags", "array<string>");
    assertEquals(DataType.ARRAY, a.type());
    assertEquals(DataType.STRING, a.valueType());
  }

  @Test
  void unknownTypeFailsOnStrictDialects() {
    assertThrows(TypeMappingException.class, () -> dialect.parseField("g", "geometry"));
  }

  @Test
  void malformedMapIsRejected() {
    assertThrows(TypeMappingException.class, () -> dialect.parseField("m", "map<string>"));
  }
}
