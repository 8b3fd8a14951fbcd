package io.intellixity.tessera.persistence.jdbc.sqlite;

import io.intellixity.tessera.persistence.exec.ConstraintViolationException;
import io.intellixity.tessera.persistence.jdbc.JdbcSession;
import io.intellixity.tessera.persistence.query.Direction;
import io.intellixity.tessera.persistence.record.Entity;
import io.intellixity.tessera.persistence.schema.FieldDef;
import io.intellixity.tessera.persistence.schema.RecordType;
import io.intellixity.tessera.persistence.schema.RelationDef;
import io.intellixity.tessera.persistence.sql.SqlStatement;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class SqliteSessionEndToEndTest {
  static final RecordType DEPARTMENT = RecordType.builder("Department").table("departments")
      .field("id", FieldDef.integer().asPrimaryKey())
      .field("name", FieldDef.text().notNull().asUnique())
      .field("budget", FieldDef.real())
      .build();

  static final RecordType EMPLOYEE = RecordType.builder("Employee").table("employees")
      .field("id", FieldDef.integer().asPrimaryKey())
      .field("name", FieldDef.text().notNull())
      .field("salary", FieldDef.real())
      .relation("department_id", RelationDef.to(DEPARTMENT))
      .build();

  static final RecordType PROJECT = RecordType.builder("Project").table("projects")
      .field("id", FieldDef.integer().asPrimaryKey())
      .field("title", FieldDef.text().notNull())
      .relation("department_id", RelationDef.nullableTo(DEPARTMENT))
      .build();

  @TempDir Path dir;
  private JdbcSession session;

  @BeforeEach
  void open() {
    session = SqliteSessions.open("jdbc:sqlite:" + dir.resolve("company.db"));
    session.createTable(DEPARTMENT);
    session.createTable(EMPLOYEE);
    session.createTable(PROJECT);
  }

  @AfterEach
  void close() {
    session.close();
  }

  @Test
  void queriesEmployeesOfOneDepartment() {
    Entity it = department("IT", 100000.0);
    Entity hr = department("HR", 80000.0);
    assertNotEquals(it.get("id"), hr.get("id"));

    employee("Ana", 75000.0, it);
    employee("Bea", 62000.0, hr);
    employee("Carlos", 70000.0, it);

    List<Entity> staff = session.query(EMPLOYEE).where("department_id = ?", it.get("id")).all();
    assertEquals(List.of("Ana", "Carlos"), names(staff));
    for (Entity e : staff) assertEquals(it.get("id"), e.get("department_id"));
  }

  @Test
  void roundTripsEveryBaseType() {
    RecordType sample = RecordType.builder("Sample").table("samples")
        .field("id", FieldDef.integer().asPrimaryKey())
        .field("i", FieldDef.integer())
        .field("big", FieldDef.integer())
        .field("r", FieldDef.real())
        .field("t", FieldDef.text())
        .field("b", FieldDef.blob())
        .field("missing", FieldDef.text())
        .build();
    session.createTable(sample);

    byte[] payload = {0, 1, 2, (byte) 0xff};
    Entity s = session.newRecord(sample)
        .set("i", 42)
        .set("big", Long.MAX_VALUE)
        .set("r", 2.5)
        .set("t", "héllo wörld")
        .set("b", payload)
        .set("missing", null);
    s.save();

    Entity loaded = session.find(sample, s.get("id")).orElseThrow();
    assertEquals(42L, loaded.get("i"));
    assertEquals(Long.MAX_VALUE, loaded.get("big"));
    assertEquals(2.5d, loaded.get("r"));
    assertEquals("héllo wörld", loaded.get("t"));
    assertArrayEquals(payload, loaded.get("b", byte[].class));
    assertNull(loaded.get("missing"));
    assertFalse(loaded.isDirty());
  }

  @Test
  void repeatedSaveDoesNotTouchStoredData() {
    Entity it = department("IT", 100000.0);
    session.update(new SqlStatement("UPDATE departments SET budget = ? WHERE id = ?",
        List.of(1.0, it.get("id")), SqlStatement.ExecKind.UPDATE));

    it.save();
    it.save();
    assertEquals(1.0d, session.find(DEPARTMENT, it.get("id")).orElseThrow().get("budget"));
  }

  @Test
  void updateWritesOnlyDirtyColumns() {
    Entity it = department("IT", 100000.0);
    Entity stale = session.find(DEPARTMENT, it.get("id")).orElseThrow();

    it.set("name", "Engineering").save();
    stale.set("budget", 5.0).save();

    Entity fresh = session.find(DEPARTMENT, it.get("id")).orElseThrow();
    assertEquals("Engineering", fresh.get("name"));
    assertEquals(5.0d, fresh.get("budget"));
  }

  @Test
  void savingAfterRewritingTheKeyKeepsTheRow() {
    Entity it = department("IT", 100000.0);
    Entity loaded = session.find(DEPARTMENT, it.get("id")).orElseThrow();
    loaded.set("id", loaded.get("id"));

    assertDoesNotThrow(loaded::save);
    assertFalse(loaded.isDirty());
    assertEquals("IT", session.find(DEPARTMENT, it.get("id")).orElseThrow().get("name"));
  }

  @Test
  void uniqueViolationLeavesInstanceUnsaved() {
    department("IT", 1.0);
    Entity dup = session.newRecord(DEPARTMENT, Map.of("name", "IT"));

    assertThrows(ConstraintViolationException.class, dup::save);
    assertNull(dup.get("id"));
    assertEquals(Set.of("name"), dup.dirtyAttributes());
    assertEquals(1L, session.query(DEPARTMENT).count());
  }

  @Test
  void foreignKeysAreEnforced() {
    Entity orphan = session.newRecord(EMPLOYEE, Map.of("name", "Ghost", "department_id", 999L));
    assertThrows(ConstraintViolationException.class, orphan::save);

    Entity noDept = session.newRecord(EMPLOYEE, Map.of("name", "Nobody"));
    assertThrows(ConstraintViolationException.class, noDept::save);
  }

  @Test
  void deletePolicyFollowsEachRelation() {
    Entity it = department("IT", 1.0);
    employee("Ana", 1.0, it);
    Entity project = session.newRecord(PROJECT, Map.of("title", "Migration", "department_id", it.get("id")));
    project.save();

    it.delete();

    assertEquals(0L, session.query(EMPLOYEE).count());
    Entity orphaned = session.find(PROJECT, project.get("id")).orElseThrow();
    assertNull(orphaned.get("department_id"));
  }

  @Test
  void countIgnoresPagingAndOrdering() {
    Entity it = department("IT", 1.0);
    Entity hr = department("HR", 1.0);
    employee("Ana", 1.0, it);
    employee("Bea", 1.0, hr);
    employee("Carlos", 1.0, it);

    long n = session.query(EMPLOYEE)
        .where("department_id = ?", it.get("id"))
        .orderBy("name", Direction.DESC)
        .limit(1)
        .count();
    assertEquals(2L, n);
    assertTrue(session.query(EMPLOYEE).where("name = ?", "Bea").exists());
    assertFalse(session.query(EMPLOYEE).where("name = ?", "Zoe").exists());
  }

  @Test
  void firstOnEmptyResultIsEmpty() {
    assertEquals(Optional.empty(), session.query(EMPLOYEE).where("name = ?", "nobody").first());
    assertEquals(Optional.empty(), session.find(DEPARTMENT, 12345L));
  }

  @Test
  void pagesWithOffsetOnly() {
    Entity it = department("IT", 1.0);
    employee("Ana", 1.0, it);
    employee("Bea", 1.0, it);
    employee("Carlos", 1.0, it);

    assertEquals(List.of("Bea", "Carlos"), names(session.query(EMPLOYEE).orderBy("id").offset(1).all()));
    assertEquals(List.of("Bea"), names(session.query(EMPLOYEE).orderBy("id").limit(1).offset(1).all()));
  }

  @Test
  void joinsExposeProjectedColumns() {
    Entity it = department("IT", 1.0);
    Entity hr = department("HR", 1.0);
    employee("Ana", 1.0, it);
    employee("Bea", 1.0, hr);

    List<Entity> rows = session.query(EMPLOYEE)
        .select("employees.name", "departments.name AS department")
        .join("departments", "departments.id = employees.department_id")
        .where("departments.name = ?", "HR")
        .all();
    assertEquals(1, rows.size());
    assertEquals("Bea", rows.get(0).get("name"));
    assertEquals("HR", rows.get(0).get("department"));
  }

  @Test
  void groupsWithHaving() {
    Entity it = department("IT", 1.0);
    Entity hr = department("HR", 1.0);
    employee("Ana", 1.0, it);
    employee("Carlos", 1.0, it);
    employee("Bea", 1.0, hr);

    List<Entity> rows = session.query(EMPLOYEE)
        .select("department_id", "COUNT(*) AS headcount")
        .where("salary > ?", 0.5)
        .groupBy("department_id")
        .having("COUNT(*) > ?", 1)
        .all();
    assertEquals(1, rows.size());
    assertEquals(it.get("id"), rows.get(0).get("department_id"));
    assertEquals(2, ((Number) rows.get(0).get("headcount")).intValue());
  }

  @Test
  void resolvesRelationsBothWays() {
    Entity it = department("IT", 1.0);
    Entity ana = employee("Ana", 1.0, it);
    employee("Carlos", 1.0, it);

    assertEquals("IT", ana.belongsTo(DEPARTMENT).orElseThrow().get("name"));
    assertEquals(List.of("Ana", "Carlos"), names(it.hasMany(EMPLOYEE)));
    assertEquals(List.of(), department("HR", 1.0).hasMany(EMPLOYEE));
  }

  @Test
  void closedSessionCannotBeReused() {
    session.close();
    assertThrows(IllegalStateException.class, () -> session.query(DEPARTMENT).all());
  }

  private Entity department(String name, double budget) {
    Entity d = session.newRecord(DEPARTMENT).set("name", name).set("budget", budget);
    d.save();
    return d;
  }

  private Entity employee(String name, double salary, Entity department) {
    Entity e = session.newRecord(EMPLOYEE)
        .set("name", name)
        .set("salary", salary)
        .set("department_id", department.get("id"));
    e.save();
    return e;
  }

  private static List<String> names(List<Entity> rows) {
    return rows.stream().map(e -> (String) e.get("name")).toList();
  }
}
