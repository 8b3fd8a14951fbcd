package io.intellixity.tessera.persistence.exec;

@FunctionalInterface
public interface RowReader<T> {
  T read(RowAdapter row);
}
