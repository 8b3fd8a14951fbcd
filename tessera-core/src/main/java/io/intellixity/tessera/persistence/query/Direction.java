package io.intellixity.tessera.persistence.query;

public enum Direction { ASC, DESC }
