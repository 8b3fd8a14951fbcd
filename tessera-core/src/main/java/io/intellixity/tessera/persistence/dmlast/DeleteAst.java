package io.intellixity.tessera.persistence.dmlast;

public record DeleteAst(String table, String keyColumn, Object keyValue) implements DmlAst {
}
