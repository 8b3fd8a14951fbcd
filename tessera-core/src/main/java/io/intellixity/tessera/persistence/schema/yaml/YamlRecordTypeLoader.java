package io.intellixity.tessera.persistence.schema.yaml;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.intellixity.tessera.persistence.schema.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads record type declarations from YAML.\n
 *
 * <pre>
 * types:
 *   - name: Department
 *     table: departments
 *     fields:
 *       id: { type: INTEGER, primaryKey: true }
 *       name: { type: TEXT, nullable: false, unique: true }
 *       budget: REAL
 *   - name: Employee
 *     table: employees
 *     fields:
 *       id: { type: INTEGER, primaryKey: true }
 *       department_id: ref(Department)
 * </pre>
 *
 * A field is either a scalar shorthand ({@code REAL}, {@code ref(Department)}) or a mapping with
 * {@code type} or {@code ref} plus optional {@code primaryKey}, {@code nullable} and {@code unique} flags.
 * Relations resolve against types declared earlier in the same document or passed in as {@code known}.\n
 */
public final class YamlRecordTypeLoader {
  private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

  public List<RecordType> load(Path file) {
    try (InputStream in = Files.newInputStream(file)) {
      return load(in, List.of());
    } catch (IOException e) {
      throw new SchemaException("Failed to read record types from " + file, e);
    }
  }

  public List<RecordType> load(InputStream in) {
    return load(in, List.of());
  }

  public List<RecordType> load(InputStream in, Collection<RecordType> known) {
    Objects.requireNonNull(in, "in");
    JsonNode root;
    try {
      root = YAML.readTree(in);
    } catch (IOException e) {
      throw new SchemaException("Invalid record type YAML", e);
    }
    if (root == null || !root.path("types").isArray()) {
      throw new SchemaException("Record type YAML requires a top-level 'types' list");
    }

    Map<String, RecordType> byName = new LinkedHashMap<>();
    if (known != null) {
      for (RecordType t : known) byName.put(t.name(), t);
    }

    List<RecordType> out = new ArrayList<>();
    Set<String> declared = new HashSet<>();
    for (JsonNode tn : root.get("types")) {
      RecordType t = parseType(tn, byName);
      if (!declared.add(t.name())) throw new SchemaException("Duplicate record type in YAML: " + t.name());
      byName.put(t.name(), t);
      out.add(t);
    }
    return out;
  }

  private static RecordType parseType(JsonNode tn, Map<String, RecordType> byName) {
    String name = text(tn, "name");
    if (name == null) throw new SchemaException("Record type entry without 'name': " + tn);
    RecordType.Builder b = RecordType.builder(name).table(text(tn, "table"));

    JsonNode fields = tn.path("fields");
    if (!fields.isMissingNode() && !fields.isObject()) {
      throw new SchemaException("'fields' of record type " + name + " must be a mapping");
    }
    Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
    while (it.hasNext()) {
      var e = it.next();
      b.attribute(e.getKey(), parseAttribute(name, e.getKey(), e.getValue(), byName));
    }
    return b.build();
  }

  private static AttributeDef parseAttribute(String typeName, String attr, JsonNode fn,
                                             Map<String, RecordType> byName) {
    if (fn.isTextual()) {
      String s = fn.asText().trim();
      if (s.startsWith("ref(") && s.endsWith(")")) {
        return new RelationDef(resolve(typeName, attr, s.substring(4, s.length() - 1).trim(), byName), false);
      }
      return FieldDef.of(baseType(typeName, attr, s));
    }
    if (!fn.isObject()) {
      throw new SchemaException("Invalid definition for " + typeName + "." + attr + ": " + fn);
    }

    String ref = text(fn, "ref");
    if (ref != null) {
      return new RelationDef(resolve(typeName, attr, ref, byName), fn.path("nullable").asBoolean(false));
    }
    String type = text(fn, "type");
    if (type == null) throw new SchemaException("Field " + typeName + "." + attr + " needs 'type' or 'ref'");
    return new FieldDef(
        baseType(typeName, attr, type),
        fn.path("primaryKey").asBoolean(false),
        fn.path("nullable").asBoolean(true),
        fn.path("unique").asBoolean(false));
  }

  private static RecordType resolve(String typeName, String attr, String ref, Map<String, RecordType> byName) {
    RecordType t = byName.get(ref);
    if (t == null) {
      throw new SchemaException("Relation " + typeName + "." + attr + " references unknown record type: " + ref);
    }
    return t;
  }

  private static BaseType baseType(String typeName, String attr, String s) {
    try {
      return BaseType.valueOf(s.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new SchemaException("Unknown base type for " + typeName + "." + attr + ": " + s, e);
    }
  }

  private static String text(JsonNode n, String field) {
    JsonNode v = n.get(field);
    if (v == null || v.isNull()) return null;
    String s = v.asText();
    return s.isBlank() ? null : s.trim();
  }
}
