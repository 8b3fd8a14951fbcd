package io.intellixity.tessera.persistence.schema;

import io.intellixity.tessera.persistence.testing.Schemas;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class RecordTypeTest {

  @Test
  void keepsDeclarationOrder() {
    assertEquals(List.of("id", "name", "email", "salary", "department_id"),
        List.copyOf(Schemas.EMPLOYEE.attributes().keySet()));
  }

  @Test
  void fieldWithersReturnFlaggedCopies() {
    FieldDef base = FieldDef.text();
    FieldDef key = base.asPrimaryKey().asUnique().notNull();
    assertTrue(key.primaryKey());
    assertTrue(key.unique());
    assertFalse(key.nullable());
    assertEquals(BaseType.TEXT, key.type());
    assertFalse(base.primaryKey());
    assertFalse(base.unique());
    assertTrue(base.nullable());
  }

  @Test
  void primaryKeyDefaultsToId() {
    RecordType t = RecordType.builder("Note").table("notes").field("body", FieldDef.text()).build();
    assertEquals("id", t.primaryKey());
    assertTrue(t.isImplicitKey("id"));
    assertFalse(t.isImplicitKey("body"));
    assertEquals(List.of(), t.primaryKeyColumns());
  }

  @Test
  void markedPrimaryKeyWins() {
    RecordType t = RecordType.builder("Country").table("countries")
        .field("code", FieldDef.text().asPrimaryKey())
        .build();
    assertEquals("code", t.primaryKey());
    assertFalse(t.isImplicitKey("id"));
  }

  @Test
  void severalMarkedKeysAreAmbiguous() {
    RecordType t = RecordType.builder("Membership").table("memberships")
        .field("group_id", FieldDef.integer().asPrimaryKey())
        .field("user_id", FieldDef.integer().asPrimaryKey())
        .build();
    SchemaException ex = assertThrows(SchemaException.class, t::primaryKey);
    assertTrue(ex.getMessage().contains("Ambiguous primary key"));
  }

  @Test
  void rejectsDuplicateReservedAndInvalidNames() {
    RecordType.Builder b = RecordType.builder("T").table("t").field("a", FieldDef.text());
    assertThrows(SchemaException.class, () -> b.field("a", FieldDef.integer()));
    assertThrows(SchemaException.class, () -> b.field("_data", FieldDef.text()));
    assertThrows(SchemaException.class, () -> b.field("a b", FieldDef.text()));
    assertThrows(SchemaException.class, () -> b.field("x;DROP", FieldDef.text()));
    assertThrows(SchemaException.class, () -> RecordType.builder("T").table("bad table"));
    assertThrows(SchemaException.class, () -> RecordType.builder(" "));
  }

  @Test
  void relationsAreIntegerColumnsWithPolicyFromNullability() {
    RelationDef strict = RelationDef.to(Schemas.DEPARTMENT);
    RelationDef loose = RelationDef.nullableTo(Schemas.DEPARTMENT);
    assertEquals(BaseType.INTEGER, strict.type());
    assertEquals(RelationDef.OnDelete.CASCADE, strict.onDelete());
    assertEquals(RelationDef.OnDelete.SET_NULL, loose.onDelete());
  }

  @Test
  void normalizesNumbersToDeclaredBaseType() {
    assertEquals(5L, BaseType.INTEGER.normalize(5));
    assertEquals(5L, BaseType.INTEGER.normalize(5.0d));
    assertEquals(5.5d, BaseType.INTEGER.normalize(5.5d));
    assertEquals(1L, BaseType.INTEGER.normalize(true));
    assertEquals(100000.0d, BaseType.REAL.normalize(100000));
    assertEquals("x", BaseType.TEXT.normalize(new StringBuilder("x")));
    assertNull(BaseType.BLOB.normalize(null));
  }
}
